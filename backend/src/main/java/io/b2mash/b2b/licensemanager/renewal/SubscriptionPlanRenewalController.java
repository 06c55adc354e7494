package io.b2mash.b2b.licensemanager.renewal;

import io.b2mash.b2b.licensemanager.renewal.dto.CreateRenewalRequest;
import io.b2mash.b2b.licensemanager.renewal.dto.RenewalResponse;
import io.b2mash.b2b.licensemanager.renewal.dto.UpdateRenewalRequest;
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
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/renewals")
public class SubscriptionPlanRenewalController {

  private final SubscriptionPlanRenewalService renewalService;

  public SubscriptionPlanRenewalController(SubscriptionPlanRenewalService renewalService) {
    this.renewalService = renewalService;
  }

  @GetMapping
  @PreAuthorize("hasAnyRole('LICENSE_ADMIN', 'LICENSE_VIEWER')")
  public ResponseEntity<List<RenewalResponse>> listRenewals() {
    return ResponseEntity.ok(renewalService.listRenewals());
  }

  @GetMapping("/{id}")
  @PreAuthorize("hasAnyRole('LICENSE_ADMIN', 'LICENSE_VIEWER')")
  public ResponseEntity<RenewalResponse> getRenewal(@PathVariable UUID id) {
    return ResponseEntity.ok(renewalService.getRenewal(id));
  }

  @PostMapping
  @PreAuthorize("hasRole('LICENSE_ADMIN')")
  public ResponseEntity<RenewalResponse> createRenewal(
      @Valid @RequestBody CreateRenewalRequest request) {
    var response = renewalService.createRenewal(request);
    return ResponseEntity.created(URI.create("/api/admin/renewals/" + response.id()))
        .body(response);
  }

  @PutMapping("/{id}")
  @PreAuthorize("hasRole('LICENSE_ADMIN')")
  public ResponseEntity<RenewalResponse> updateRenewal(
      @PathVariable UUID id, @Valid @RequestBody UpdateRenewalRequest request) {
    return ResponseEntity.ok(renewalService.updateRenewal(id, request));
  }
}
