package io.b2mash.b2b.licensemanager.product;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Category of a product (e.g. "Standard Paid", "Trial", "Test"). Its flags decide which external
 * identifiers dependent records must carry.
 */
@Entity
@Table(name = "plan_types")
public class PlanType {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "label", nullable = false, unique = true, length = 128)
  private String label;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "is_paid_subscription", nullable = false)
  private boolean paidSubscription;

  @Column(name = "sf_id_required", nullable = false)
  private boolean sfIdRequired;

  @Column(name = "ns_id_required", nullable = false)
  private boolean nsIdRequired;

  @Column(name = "internal_use_only", nullable = false)
  private boolean internalUseOnly;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected PlanType() {}

  public PlanType(
      String label,
      String description,
      boolean paidSubscription,
      boolean sfIdRequired,
      boolean nsIdRequired,
      boolean internalUseOnly) {
    this.label = label;
    this.description = description;
    this.paidSubscription = paidSubscription;
    this.sfIdRequired = sfIdRequired;
    this.nsIdRequired = nsIdRequired;
    this.internalUseOnly = internalUseOnly;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getLabel() {
    return label;
  }

  public String getDescription() {
    return description;
  }

  public boolean isPaidSubscription() {
    return paidSubscription;
  }

  public boolean isSfIdRequired() {
    return sfIdRequired;
  }

  public boolean isNsIdRequired() {
    return nsIdRequired;
  }

  public boolean isInternalUseOnly() {
    return internalUseOnly;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
