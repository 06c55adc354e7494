package io.b2mash.b2b.licensemanager.validation;

import io.b2mash.b2b.licensemanager.customeragreement.CustomerAgreement;
import io.b2mash.b2b.licensemanager.product.PlanType;
import io.b2mash.b2b.licensemanager.product.Product;
import java.util.UUID;

/**
 * Snapshot of a submitted subscription plan together with the related records the plan rules
 * read. Related records are null when the submission does not reference them.
 *
 * @param numLicenses submitted license count, null treated as zero
 * @param forInternalUseOnly whether the plan is for internal (test) use only
 * @param revocationCapEnabled whether the revocation cap is enabled
 * @param revokeMaxPercentage submitted revocation cap percentage, may be null
 * @param enterpriseCatalogUuid the plan's own catalog, may be null
 * @param customerAgreement the linked agreement, may be null
 * @param product the selected product, may be null
 * @param productPlanType the plan type of {@code product}, null when there is no product
 * @param salesforceOpportunityId submitted Salesforce opportunity id, may be null or blank
 */
public record SubscriptionPlanCandidate(
    Integer numLicenses,
    boolean forInternalUseOnly,
    boolean revocationCapEnabled,
    Integer revokeMaxPercentage,
    UUID enterpriseCatalogUuid,
    CustomerAgreement customerAgreement,
    Product product,
    PlanType productPlanType,
    String salesforceOpportunityId) {

  int licenseCount() {
    return numLicenses != null ? numLicenses : 0;
  }

  boolean hasCatalogFromItselfOrAgreement() {
    if (enterpriseCatalogUuid != null) {
      return true;
    }
    return customerAgreement != null && customerAgreement.getDefaultEnterpriseCatalogUuid() != null;
  }

  boolean hasSalesforceOpportunityId() {
    return salesforceOpportunityId != null && !salesforceOpportunityId.isBlank();
  }
}
