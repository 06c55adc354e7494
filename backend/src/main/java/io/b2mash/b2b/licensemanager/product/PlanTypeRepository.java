package io.b2mash.b2b.licensemanager.product;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PlanTypeRepository extends JpaRepository<PlanType, UUID> {

  boolean existsByLabel(String label);

  List<PlanType> findAllByOrderByLabelAsc();
}
