package io.b2mash.b2b.licensemanager.product;

import io.b2mash.b2b.licensemanager.audit.AuditEventBuilder;
import io.b2mash.b2b.licensemanager.audit.AuditService;
import io.b2mash.b2b.licensemanager.exception.ResourceConflictException;
import io.b2mash.b2b.licensemanager.exception.ResourceNotFoundException;
import io.b2mash.b2b.licensemanager.exception.SubmissionRejectedException;
import io.b2mash.b2b.licensemanager.product.dto.ProductRequest;
import io.b2mash.b2b.licensemanager.product.dto.ProductResponse;
import io.b2mash.b2b.licensemanager.validation.PlanValidator;
import io.b2mash.b2b.licensemanager.validation.ProductCandidate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProductService {

  private static final Logger log = LoggerFactory.getLogger(ProductService.class);

  private final ProductRepository productRepository;
  private final PlanTypeService planTypeService;
  private final PlanTypeRepository planTypeRepository;
  private final PlanValidator planValidator;
  private final AuditService auditService;

  public ProductService(
      ProductRepository productRepository,
      PlanTypeService planTypeService,
      PlanTypeRepository planTypeRepository,
      PlanValidator planValidator,
      AuditService auditService) {
    this.productRepository = productRepository;
    this.planTypeService = planTypeService;
    this.planTypeRepository = planTypeRepository;
    this.planValidator = planValidator;
    this.auditService = auditService;
  }

  @Transactional(readOnly = true)
  public List<ProductResponse> listProducts() {
    Map<UUID, PlanType> planTypes =
        planTypeRepository.findAll().stream()
            .collect(Collectors.toMap(PlanType::getId, Function.identity()));
    return productRepository.findAllByOrderByNameAsc().stream()
        .map(p -> ProductResponse.from(p, planTypes.get(p.getPlanTypeId())))
        .toList();
  }

  @Transactional(readOnly = true)
  public ProductResponse getProduct(UUID id) {
    var product = requireProduct(id);
    return ProductResponse.from(product, planTypeService.requirePlanType(product.getPlanTypeId()));
  }

  @Transactional(readOnly = true)
  public Product requireProduct(UUID id) {
    return productRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Product", id));
  }

  @Transactional
  public ProductResponse createProduct(ProductRequest request) {
    if (productRepository.existsByName(request.name())) {
      throw duplicateName(request.name());
    }
    var planType = planTypeService.requirePlanType(request.planType());

    var outcome =
        planValidator.validateProduct(new ProductCandidate(planType, request.netsuiteId()));
    if (!outcome.accepted()) {
      throw new SubmissionRejectedException("product", outcome);
    }

    var product =
        productRepository.save(
            new Product(
                request.name(), request.description(), planType.getId(), request.netsuiteId()));

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("product.created")
            .entityType("PRODUCT")
            .entityId(product.getId())
            .details(snapshot(product, planType))
            .build());

    log.info("Created product: id={}, planType={}", product.getId(), planType.getLabel());
    return ProductResponse.from(product, planType);
  }

  @Transactional
  public ProductResponse updateProduct(UUID id, ProductRequest request) {
    var product = requireProduct(id);
    if (productRepository.existsByNameAndIdNot(request.name(), id)) {
      throw duplicateName(request.name());
    }
    var planType = planTypeService.requirePlanType(request.planType());

    var outcome =
        planValidator.validateProduct(new ProductCandidate(planType, request.netsuiteId()));
    if (!outcome.accepted()) {
      throw new SubmissionRejectedException("product", outcome);
    }

    product.update(request.name(), request.description(), planType.getId(), request.netsuiteId());
    productRepository.save(product);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("product.updated")
            .entityType("PRODUCT")
            .entityId(product.getId())
            .details(snapshot(product, planType))
            .build());

    log.info("Updated product: id={}, planType={}", product.getId(), planType.getLabel());
    return ProductResponse.from(product, planType);
  }

  private static ResourceConflictException duplicateName(String name) {
    return new ResourceConflictException(
        "Duplicate product", "A product named '" + name + "' already exists");
  }

  private static Map<String, Object> snapshot(Product product, PlanType planType) {
    var details = new HashMap<String, Object>();
    details.put("name", product.getName());
    details.put("plan_type", planType.getLabel());
    if (product.getNetsuiteId() != null) {
      details.put("netsuite_id", product.getNetsuiteId());
    }
    return details;
  }
}
