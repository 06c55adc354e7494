package io.b2mash.b2b.licensemanager.product;

import io.b2mash.b2b.licensemanager.product.dto.CreatePlanTypeRequest;
import io.b2mash.b2b.licensemanager.product.dto.PlanTypeResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/plan-types")
public class PlanTypeController {

  private final PlanTypeService planTypeService;

  public PlanTypeController(PlanTypeService planTypeService) {
    this.planTypeService = planTypeService;
  }

  @GetMapping
  @PreAuthorize("hasAnyRole('LICENSE_ADMIN', 'LICENSE_VIEWER')")
  public ResponseEntity<List<PlanTypeResponse>> listPlanTypes() {
    return ResponseEntity.ok(planTypeService.listPlanTypes());
  }

  @PostMapping
  @PreAuthorize("hasRole('LICENSE_ADMIN')")
  public ResponseEntity<PlanTypeResponse> createPlanType(
      @Valid @RequestBody CreatePlanTypeRequest request) {
    var response = planTypeService.createPlanType(request);
    return ResponseEntity.created(URI.create("/api/admin/plan-types/" + response.id()))
        .body(response);
  }
}
