package io.b2mash.b2b.licensemanager.subscription;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SubscriptionPlanRepository extends JpaRepository<SubscriptionPlan, UUID> {

  /**
   * Plans of the given agreement that are active and running at {@code now}, i.e. {@code
   * start_date <= now <= expiration_date}. Both bounds are inclusive.
   */
  @Query(
      "SELECT sp FROM SubscriptionPlan sp WHERE sp.customerAgreementId = :agreementId"
          + " AND sp.active = true AND sp.startDate <= :now AND sp.expirationDate >= :now"
          + " ORDER BY sp.startDate, sp.title")
  List<SubscriptionPlan> findActiveForAgreement(
      @Param("agreementId") UUID agreementId, @Param("now") Instant now);

  List<SubscriptionPlan> findByCustomerAgreementIdOrderByStartDateAsc(UUID customerAgreementId);

  List<SubscriptionPlan> findByCustomerAgreementIdAndShouldAutoApplyLicensesTrue(
      UUID customerAgreementId);

  List<SubscriptionPlan> findAllByOrderByStartDateDesc();
}
