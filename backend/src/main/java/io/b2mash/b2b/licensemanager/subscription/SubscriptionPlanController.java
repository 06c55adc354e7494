package io.b2mash.b2b.licensemanager.subscription;

import io.b2mash.b2b.licensemanager.subscription.dto.SubscriptionPlanRequest;
import io.b2mash.b2b.licensemanager.subscription.dto.SubscriptionPlanResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/subscription-plans")
public class SubscriptionPlanController {

  private final SubscriptionPlanService subscriptionPlanService;

  public SubscriptionPlanController(SubscriptionPlanService subscriptionPlanService) {
    this.subscriptionPlanService = subscriptionPlanService;
  }

  @GetMapping
  @PreAuthorize("hasAnyRole('LICENSE_ADMIN', 'LICENSE_VIEWER')")
  public ResponseEntity<List<SubscriptionPlanResponse>> listPlans(
      @RequestParam(required = false) UUID customerAgreement) {
    return ResponseEntity.ok(subscriptionPlanService.listPlans(customerAgreement));
  }

  @GetMapping("/{id}")
  @PreAuthorize("hasAnyRole('LICENSE_ADMIN', 'LICENSE_VIEWER')")
  public ResponseEntity<SubscriptionPlanResponse> getPlan(@PathVariable UUID id) {
    return ResponseEntity.ok(subscriptionPlanService.getPlan(id));
  }

  @PostMapping
  @PreAuthorize("hasRole('LICENSE_ADMIN')")
  public ResponseEntity<SubscriptionPlanResponse> createPlan(
      @Valid @RequestBody SubscriptionPlanRequest request) {
    var response = subscriptionPlanService.createPlan(request);
    return ResponseEntity.created(URI.create("/api/admin/subscription-plans/" + response.id()))
        .body(response);
  }

  @PutMapping("/{id}")
  @PreAuthorize("hasRole('LICENSE_ADMIN')")
  public ResponseEntity<SubscriptionPlanResponse> updatePlan(
      @PathVariable UUID id, @Valid @RequestBody SubscriptionPlanRequest request) {
    return ResponseEntity.ok(subscriptionPlanService.updatePlan(id, request));
  }
}
