package io.b2mash.b2b.licensemanager.product;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "products")
public class Product {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, unique = true, length = 255)
  private String name;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "plan_type_id", nullable = false)
  private UUID planTypeId;

  @Column(name = "netsuite_id")
  private Integer netsuiteId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Product() {}

  public Product(String name, String description, UUID planTypeId, Integer netsuiteId) {
    this.name = name;
    this.description = description;
    this.planTypeId = planTypeId;
    this.netsuiteId = netsuiteId;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void update(String name, String description, UUID planTypeId, Integer netsuiteId) {
    this.name = name;
    this.description = description;
    this.planTypeId = planTypeId;
    this.netsuiteId = netsuiteId;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public UUID getPlanTypeId() {
    return planTypeId;
  }

  public Integer getNetsuiteId() {
    return netsuiteId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
