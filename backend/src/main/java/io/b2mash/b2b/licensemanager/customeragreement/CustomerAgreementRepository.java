package io.b2mash.b2b.licensemanager.customeragreement;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CustomerAgreementRepository extends JpaRepository<CustomerAgreement, UUID> {

  boolean existsByEnterpriseCustomerUuid(UUID enterpriseCustomerUuid);

  boolean existsByEnterpriseCustomerSlug(String enterpriseCustomerSlug);

  boolean existsByEnterpriseCustomerSlugAndIdNot(String enterpriseCustomerSlug, UUID id);

  List<CustomerAgreement> findAllByOrderByEnterpriseCustomerNameAsc();
}
