package io.b2mash.b2b.licensemanager.customeragreement;

import io.b2mash.b2b.licensemanager.customeragreement.dto.AutoApplyChoicesResponse;
import io.b2mash.b2b.licensemanager.customeragreement.dto.CreateCustomerAgreementRequest;
import io.b2mash.b2b.licensemanager.customeragreement.dto.CustomerAgreementResponse;
import io.b2mash.b2b.licensemanager.customeragreement.dto.UpdateCustomerAgreementRequest;
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
@RequestMapping("/api/admin/customer-agreements")
public class CustomerAgreementController {

  private final CustomerAgreementService customerAgreementService;

  public CustomerAgreementController(CustomerAgreementService customerAgreementService) {
    this.customerAgreementService = customerAgreementService;
  }

  @GetMapping
  @PreAuthorize("hasAnyRole('LICENSE_ADMIN', 'LICENSE_VIEWER')")
  public ResponseEntity<List<CustomerAgreementResponse>> listAgreements() {
    return ResponseEntity.ok(customerAgreementService.listAgreements());
  }

  @GetMapping("/{id}")
  @PreAuthorize("hasAnyRole('LICENSE_ADMIN', 'LICENSE_VIEWER')")
  public ResponseEntity<CustomerAgreementResponse> getAgreement(@PathVariable UUID id) {
    return ResponseEntity.ok(customerAgreementService.getAgreement(id));
  }

  @GetMapping("/{id}/auto-apply-choices")
  @PreAuthorize("hasAnyRole('LICENSE_ADMIN', 'LICENSE_VIEWER')")
  public ResponseEntity<AutoApplyChoicesResponse> getAutoApplyChoices(@PathVariable UUID id) {
    return ResponseEntity.ok(customerAgreementService.getAutoApplyChoices(id));
  }

  @PostMapping
  @PreAuthorize("hasRole('LICENSE_ADMIN')")
  public ResponseEntity<CustomerAgreementResponse> createAgreement(
      @Valid @RequestBody CreateCustomerAgreementRequest request) {
    var response = customerAgreementService.createAgreement(request);
    return ResponseEntity.created(URI.create("/api/admin/customer-agreements/" + response.id()))
        .body(response);
  }

  @PutMapping("/{id}")
  @PreAuthorize("hasRole('LICENSE_ADMIN')")
  public ResponseEntity<CustomerAgreementResponse> updateAgreement(
      @PathVariable UUID id, @Valid @RequestBody UpdateCustomerAgreementRequest request) {
    return ResponseEntity.ok(customerAgreementService.updateAgreement(id, request));
  }
}
