package io.b2mash.b2b.licensemanager.renewal;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SubscriptionPlanRenewalRepository
    extends JpaRepository<SubscriptionPlanRenewal, UUID> {

  Optional<SubscriptionPlanRenewal> findByPriorSubscriptionPlanId(UUID priorSubscriptionPlanId);

  boolean existsByPriorSubscriptionPlanId(UUID priorSubscriptionPlanId);

  List<SubscriptionPlanRenewal> findAllByOrderByEffectiveDateAsc();
}
