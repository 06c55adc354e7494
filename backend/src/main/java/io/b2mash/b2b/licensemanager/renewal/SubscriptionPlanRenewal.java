package io.b2mash.b2b.licensemanager.renewal;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * A scheduled future plan that replaces {@code priorSubscriptionPlanId} once it expires. The
 * renewed plan is only known after the renewal has been processed.
 */
@Entity
@Table(name = "subscription_plan_renewals")
public class SubscriptionPlanRenewal {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "prior_subscription_plan_id", nullable = false, unique = true)
  private UUID priorSubscriptionPlanId;

  @Column(name = "renewed_subscription_plan_id")
  private UUID renewedSubscriptionPlanId;

  @Column(name = "renewed_plan_title", length = 128)
  private String renewedPlanTitle;

  @Column(name = "salesforce_opportunity_id", length = 18)
  private String salesforceOpportunityId;

  @Column(name = "number_of_licenses", nullable = false)
  private int numberOfLicenses;

  @Column(name = "effective_date", nullable = false)
  private Instant effectiveDate;

  @Column(name = "renewed_expiration_date", nullable = false)
  private Instant renewedExpirationDate;

  @Column(name = "processed", nullable = false)
  private boolean processed;

  @Column(name = "processed_datetime")
  private Instant processedDatetime;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected SubscriptionPlanRenewal() {}

  public SubscriptionPlanRenewal(
      UUID priorSubscriptionPlanId,
      String renewedPlanTitle,
      String salesforceOpportunityId,
      int numberOfLicenses,
      Instant effectiveDate,
      Instant renewedExpirationDate) {
    this.priorSubscriptionPlanId = priorSubscriptionPlanId;
    this.renewedPlanTitle = renewedPlanTitle;
    this.salesforceOpportunityId = salesforceOpportunityId;
    this.numberOfLicenses = numberOfLicenses;
    this.effectiveDate = effectiveDate;
    this.renewedExpirationDate = renewedExpirationDate;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void reschedule(
      String renewedPlanTitle,
      String salesforceOpportunityId,
      int numberOfLicenses,
      Instant effectiveDate,
      Instant renewedExpirationDate) {
    if (processed) {
      throw new IllegalStateException("Processed renewals can not be changed");
    }
    this.renewedPlanTitle = renewedPlanTitle;
    this.salesforceOpportunityId = salesforceOpportunityId;
    this.numberOfLicenses = numberOfLicenses;
    this.effectiveDate = effectiveDate;
    this.renewedExpirationDate = renewedExpirationDate;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getPriorSubscriptionPlanId() {
    return priorSubscriptionPlanId;
  }

  public UUID getRenewedSubscriptionPlanId() {
    return renewedSubscriptionPlanId;
  }

  public String getRenewedPlanTitle() {
    return renewedPlanTitle;
  }

  public String getSalesforceOpportunityId() {
    return salesforceOpportunityId;
  }

  public int getNumberOfLicenses() {
    return numberOfLicenses;
  }

  public Instant getEffectiveDate() {
    return effectiveDate;
  }

  public Instant getRenewedExpirationDate() {
    return renewedExpirationDate;
  }

  public boolean isProcessed() {
    return processed;
  }

  public Instant getProcessedDatetime() {
    return processedDatetime;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
