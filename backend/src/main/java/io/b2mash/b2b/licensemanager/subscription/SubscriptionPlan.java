package io.b2mash.b2b.licensemanager.subscription;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** A time-bounded pool of licenses granted to an enterprise customer under an agreement. */
@Entity
@Table(name = "subscription_plans")
public class SubscriptionPlan {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "title", nullable = false, length = 128)
  private String title;

  @Column(name = "customer_agreement_id", nullable = false)
  private UUID customerAgreementId;

  @Column(name = "product_id", nullable = false)
  private UUID productId;

  @Column(name = "enterprise_catalog_uuid")
  private UUID enterpriseCatalogUuid;

  @Column(name = "start_date", nullable = false)
  private Instant startDate;

  @Column(name = "expiration_date", nullable = false)
  private Instant expirationDate;

  @Column(name = "expiration_processed", nullable = false)
  private boolean expirationProcessed;

  @Column(name = "is_active", nullable = false)
  private boolean active;

  @Column(name = "for_internal_use_only", nullable = false)
  private boolean forInternalUseOnly;

  @Column(name = "should_auto_apply_licenses", nullable = false)
  private boolean shouldAutoApplyLicenses;

  @Column(name = "is_revocation_cap_enabled", nullable = false)
  private boolean revocationCapEnabled;

  @Column(name = "revoke_max_percentage", nullable = false)
  private int revokeMaxPercentage;

  @Column(name = "num_revocations_applied", nullable = false)
  private int numRevocationsApplied;

  @Column(name = "num_licenses", nullable = false)
  private int numLicenses;

  @Column(name = "salesforce_opportunity_id", length = 18)
  private String salesforceOpportunityId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected SubscriptionPlan() {}

  public SubscriptionPlan(
      String title,
      UUID customerAgreementId,
      UUID productId,
      UUID enterpriseCatalogUuid,
      Instant startDate,
      Instant expirationDate,
      boolean active,
      int numLicenses,
      boolean forInternalUseOnly,
      boolean revocationCapEnabled,
      int revokeMaxPercentage,
      String salesforceOpportunityId) {
    this.title = title;
    this.customerAgreementId = customerAgreementId;
    this.productId = productId;
    this.enterpriseCatalogUuid = enterpriseCatalogUuid;
    this.startDate = startDate;
    this.expirationDate = expirationDate;
    this.active = active;
    this.numLicenses = numLicenses;
    this.forInternalUseOnly = forInternalUseOnly;
    this.revocationCapEnabled = revocationCapEnabled;
    this.revokeMaxPercentage = revokeMaxPercentage;
    this.salesforceOpportunityId = salesforceOpportunityId;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void updateTerms(
      String title,
      UUID customerAgreementId,
      UUID productId,
      UUID enterpriseCatalogUuid,
      Instant startDate,
      Instant expirationDate,
      boolean active,
      int numLicenses,
      boolean forInternalUseOnly,
      boolean revocationCapEnabled,
      int revokeMaxPercentage,
      String salesforceOpportunityId) {
    this.title = title;
    this.customerAgreementId = customerAgreementId;
    this.productId = productId;
    this.enterpriseCatalogUuid = enterpriseCatalogUuid;
    this.startDate = startDate;
    this.expirationDate = expirationDate;
    this.active = active;
    this.numLicenses = numLicenses;
    this.forInternalUseOnly = forInternalUseOnly;
    this.revocationCapEnabled = revocationCapEnabled;
    this.revokeMaxPercentage = revokeMaxPercentage;
    this.salesforceOpportunityId = salesforceOpportunityId;
    this.updatedAt = Instant.now();
  }

  public void enableAutoApply() {
    this.shouldAutoApplyLicenses = true;
    this.updatedAt = Instant.now();
  }

  public void disableAutoApply() {
    this.shouldAutoApplyLicenses = false;
    this.updatedAt = Instant.now();
  }

  /** True when the plan is active and {@code now} lies within its start and expiration dates. */
  public boolean isRunningAt(Instant now) {
    return active && !startDate.isAfter(now) && !expirationDate.isBefore(now);
  }

  /**
   * Revocations still allowed under the revocation cap: the capped share of licenses, rounded up,
   * minus revocations already applied. Null when the cap is disabled.
   */
  public Integer getNumRevocationsRemaining() {
    if (!revocationCapEnabled) {
      return null;
    }
    long allowed = ((long) numLicenses * revokeMaxPercentage + 99) / 100;
    return (int) Math.max(0, allowed - numRevocationsApplied);
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public String getTitle() {
    return title;
  }

  public UUID getCustomerAgreementId() {
    return customerAgreementId;
  }

  public UUID getProductId() {
    return productId;
  }

  public UUID getEnterpriseCatalogUuid() {
    return enterpriseCatalogUuid;
  }

  public Instant getStartDate() {
    return startDate;
  }

  public Instant getExpirationDate() {
    return expirationDate;
  }

  public boolean isExpirationProcessed() {
    return expirationProcessed;
  }

  public boolean isActive() {
    return active;
  }

  public boolean isForInternalUseOnly() {
    return forInternalUseOnly;
  }

  public boolean isShouldAutoApplyLicenses() {
    return shouldAutoApplyLicenses;
  }

  public boolean isRevocationCapEnabled() {
    return revocationCapEnabled;
  }

  public int getRevokeMaxPercentage() {
    return revokeMaxPercentage;
  }

  public int getNumRevocationsApplied() {
    return numRevocationsApplied;
  }

  public int getNumLicenses() {
    return numLicenses;
  }

  public String getSalesforceOpportunityId() {
    return salesforceOpportunityId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
