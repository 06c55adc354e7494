package io.b2mash.b2b.licensemanager.customeragreement;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Contractual parent of one or more subscription plans for a single enterprise customer.
 *
 * <p>The purge duration is kept in whole days; the admin surface never deals in smaller units.
 */
@Entity
@Table(name = "customer_agreements")
public class CustomerAgreement {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "enterprise_customer_uuid", nullable = false, unique = true)
  private UUID enterpriseCustomerUuid;

  @Column(name = "enterprise_customer_slug", unique = true, length = 128)
  private String enterpriseCustomerSlug;

  @Column(name = "enterprise_customer_name", length = 255)
  private String enterpriseCustomerName;

  @Column(name = "default_enterprise_catalog_uuid")
  private UUID defaultEnterpriseCatalogUuid;

  @Column(name = "disable_expiration_notifications", nullable = false)
  private boolean disableExpirationNotifications;

  @Column(name = "license_duration_before_purge_days", nullable = false)
  private long licenseDurationBeforePurgeDays;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected CustomerAgreement() {}

  public CustomerAgreement(
      UUID enterpriseCustomerUuid,
      String enterpriseCustomerSlug,
      String enterpriseCustomerName,
      UUID defaultEnterpriseCatalogUuid,
      boolean disableExpirationNotifications,
      Duration licenseDurationBeforePurge) {
    this.enterpriseCustomerUuid = enterpriseCustomerUuid;
    this.enterpriseCustomerSlug = enterpriseCustomerSlug;
    this.enterpriseCustomerName = enterpriseCustomerName;
    this.defaultEnterpriseCatalogUuid = defaultEnterpriseCatalogUuid;
    this.disableExpirationNotifications = disableExpirationNotifications;
    this.licenseDurationBeforePurgeDays = licenseDurationBeforePurge.toDays();
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void updateTerms(
      String enterpriseCustomerSlug,
      String enterpriseCustomerName,
      UUID defaultEnterpriseCatalogUuid,
      boolean disableExpirationNotifications,
      Duration licenseDurationBeforePurge) {
    this.enterpriseCustomerSlug = enterpriseCustomerSlug;
    this.enterpriseCustomerName = enterpriseCustomerName;
    this.defaultEnterpriseCatalogUuid = defaultEnterpriseCatalogUuid;
    this.disableExpirationNotifications = disableExpirationNotifications;
    this.licenseDurationBeforePurgeDays = licenseDurationBeforePurge.toDays();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getEnterpriseCustomerUuid() {
    return enterpriseCustomerUuid;
  }

  public String getEnterpriseCustomerSlug() {
    return enterpriseCustomerSlug;
  }

  public String getEnterpriseCustomerName() {
    return enterpriseCustomerName;
  }

  public UUID getDefaultEnterpriseCatalogUuid() {
    return defaultEnterpriseCatalogUuid;
  }

  public boolean isDisableExpirationNotifications() {
    return disableExpirationNotifications;
  }

  public Duration getLicenseDurationBeforePurge() {
    return Duration.ofDays(licenseDurationBeforePurgeDays);
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
