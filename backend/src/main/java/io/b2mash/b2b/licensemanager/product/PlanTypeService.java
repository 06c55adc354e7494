package io.b2mash.b2b.licensemanager.product;

import io.b2mash.b2b.licensemanager.audit.AuditEventBuilder;
import io.b2mash.b2b.licensemanager.audit.AuditService;
import io.b2mash.b2b.licensemanager.exception.ResourceConflictException;
import io.b2mash.b2b.licensemanager.exception.ResourceNotFoundException;
import io.b2mash.b2b.licensemanager.product.dto.CreatePlanTypeRequest;
import io.b2mash.b2b.licensemanager.product.dto.PlanTypeResponse;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PlanTypeService {

  private static final Logger log = LoggerFactory.getLogger(PlanTypeService.class);

  private final PlanTypeRepository planTypeRepository;
  private final AuditService auditService;

  public PlanTypeService(PlanTypeRepository planTypeRepository, AuditService auditService) {
    this.planTypeRepository = planTypeRepository;
    this.auditService = auditService;
  }

  @Transactional(readOnly = true)
  public List<PlanTypeResponse> listPlanTypes() {
    return planTypeRepository.findAllByOrderByLabelAsc().stream()
        .map(PlanTypeResponse::from)
        .toList();
  }

  @Transactional(readOnly = true)
  public PlanType requirePlanType(UUID id) {
    return planTypeRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("PlanType", id));
  }

  @Transactional
  public PlanTypeResponse createPlanType(CreatePlanTypeRequest request) {
    if (planTypeRepository.existsByLabel(request.label())) {
      throw new ResourceConflictException(
          "Duplicate plan type", "A plan type labelled '" + request.label() + "' already exists");
    }

    var planType =
        planTypeRepository.save(
            new PlanType(
                request.label(),
                request.description(),
                request.paidSubscription(),
                request.sfIdRequired(),
                request.nsIdRequired(),
                request.internalUseOnly()));

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("plan_type.created")
            .entityType("PLAN_TYPE")
            .entityId(planType.getId())
            .details(
                Map.of(
                    "label", planType.getLabel(),
                    "sf_id_required", planType.isSfIdRequired(),
                    "ns_id_required", planType.isNsIdRequired()))
            .build());

    log.info("Created plan type: id={}, label={}", planType.getId(), planType.getLabel());
    return PlanTypeResponse.from(planType);
  }
}
