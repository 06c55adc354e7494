package io.b2mash.b2b.licensemanager.product;

import io.b2mash.b2b.licensemanager.product.dto.ProductRequest;
import io.b2mash.b2b.licensemanager.product.dto.ProductResponse;
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
@RequestMapping("/api/admin/products")
public class ProductController {

  private final ProductService productService;

  public ProductController(ProductService productService) {
    this.productService = productService;
  }

  @GetMapping
  @PreAuthorize("hasAnyRole('LICENSE_ADMIN', 'LICENSE_VIEWER')")
  public ResponseEntity<List<ProductResponse>> listProducts() {
    return ResponseEntity.ok(productService.listProducts());
  }

  @GetMapping("/{id}")
  @PreAuthorize("hasAnyRole('LICENSE_ADMIN', 'LICENSE_VIEWER')")
  public ResponseEntity<ProductResponse> getProduct(@PathVariable UUID id) {
    return ResponseEntity.ok(productService.getProduct(id));
  }

  @PostMapping
  @PreAuthorize("hasRole('LICENSE_ADMIN')")
  public ResponseEntity<ProductResponse> createProduct(
      @Valid @RequestBody ProductRequest request) {
    var response = productService.createProduct(request);
    return ResponseEntity.created(URI.create("/api/admin/products/" + response.id()))
        .body(response);
  }

  @PutMapping("/{id}")
  @PreAuthorize("hasRole('LICENSE_ADMIN')")
  public ResponseEntity<ProductResponse> updateProduct(
      @PathVariable UUID id, @Valid @RequestBody ProductRequest request) {
    return ResponseEntity.ok(productService.updateProduct(id, request));
  }
}
