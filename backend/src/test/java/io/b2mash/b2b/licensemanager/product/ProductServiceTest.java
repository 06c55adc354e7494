package io.b2mash.b2b.licensemanager.product;

import static io.b2mash.b2b.licensemanager.testutil.TestEntities.planType;
import static io.b2mash.b2b.licensemanager.testutil.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.licensemanager.audit.AuditEventRecord;
import io.b2mash.b2b.licensemanager.audit.AuditService;
import io.b2mash.b2b.licensemanager.exception.ResourceConflictException;
import io.b2mash.b2b.licensemanager.exception.ResourceNotFoundException;
import io.b2mash.b2b.licensemanager.exception.SubmissionRejectedException;
import io.b2mash.b2b.licensemanager.product.dto.ProductRequest;
import io.b2mash.b2b.licensemanager.subscription.SubscriptionLimits;
import io.b2mash.b2b.licensemanager.subscription.SubscriptionPlanRepository;
import io.b2mash.b2b.licensemanager.validation.FieldRejection;
import io.b2mash.b2b.licensemanager.validation.PlanValidator;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProductServiceTest {

  @Mock private ProductRepository productRepository;
  @Mock private PlanTypeService planTypeService;
  @Mock private PlanTypeRepository planTypeRepository;
  @Mock private SubscriptionPlanRepository subscriptionPlanRepository;
  @Mock private AuditService auditService;

  private ProductService service;

  @BeforeEach
  void setUp() {
    var validator =
        new PlanValidator(
            new SubscriptionLimits(0, 10_000, 5, Duration.ofDays(90)), subscriptionPlanRepository);
    service =
        new ProductService(
            productRepository, planTypeService, planTypeRepository, validator, auditService);
  }

  @Test
  void createProduct_netsuiteIdRequiredButMissing_rejectsWithoutSaving() {
    var planType = planType(false, true);
    when(planTypeService.requirePlanType(planType.getId())).thenReturn(planType);

    assertThatThrownBy(
            () ->
                service.createProduct(
                    new ProductRequest("Enterprise", null, planType.getId(), null)))
        .isInstanceOfSatisfying(
            SubmissionRejectedException.class,
            ex ->
                assertThat(ex.getRejections())
                    .containsExactly(
                        new FieldRejection(
                            "netsuite_id",
                            "You must specify Netsuite ID for selected plan type.")));

    verify(productRepository, never()).save(any());
    verifyNoInteractions(auditService);
  }

  @Test
  void createProduct_accepted_savesAndAuditsOnce() {
    var planType = planType(false, true);
    when(planTypeService.requirePlanType(planType.getId())).thenReturn(planType);
    when(productRepository.save(any(Product.class))).thenAnswer(inv -> withId(inv.getArgument(0)));

    var response =
        service.createProduct(new ProductRequest("Enterprise", "desc", planType.getId(), 106));

    assertThat(response.name()).isEqualTo("Enterprise");
    assertThat(response.planType()).isEqualTo(planType.getId());
    assertThat(response.netsuiteId()).isEqualTo(106);

    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(captor.capture());
    assertThat(captor.getValue().eventType()).isEqualTo("product.created");
    assertThat(captor.getValue().entityId()).isEqualTo(response.id());
    assertThat(captor.getValue().actorType()).isEqualTo("SYSTEM");
  }

  @Test
  void updateProduct_switchToPlanTypeNeedingNetsuiteId_rejects() {
    var original = planType(false, false);
    var product = withId(new Product("B2B Subscription", null, original.getId(), null));
    var strict = planType(false, true);
    when(productRepository.findById(product.getId())).thenReturn(Optional.of(product));
    when(planTypeService.requirePlanType(strict.getId())).thenReturn(strict);

    assertThatThrownBy(
            () ->
                service.updateProduct(
                    product.getId(), new ProductRequest("Renamed", null, strict.getId(), 0)))
        .isInstanceOf(SubmissionRejectedException.class);

    assertThat(product.getName()).isEqualTo("B2B Subscription");
    verify(productRepository, never()).save(any());
    verifyNoInteractions(auditService);
  }

  @Test
  void createProduct_duplicateName_throwsConflict() {
    when(productRepository.existsByName("Enterprise")).thenReturn(true);

    assertThatThrownBy(
            () ->
                service.createProduct(
                    new ProductRequest("Enterprise", null, UUID.randomUUID(), 106)))
        .isInstanceOf(ResourceConflictException.class);

    verify(productRepository, never()).save(any());
    verifyNoInteractions(planTypeService, auditService);
  }

  @Test
  void updateProduct_nameTakenByAnotherProduct_throwsConflict() {
    var planType = planType(false, false);
    var product = withId(new Product("B2B Subscription", null, planType.getId(), null));
    when(productRepository.findById(product.getId())).thenReturn(Optional.of(product));
    when(productRepository.existsByNameAndIdNot("Enterprise", product.getId())).thenReturn(true);

    assertThatThrownBy(
            () ->
                service.updateProduct(
                    product.getId(), new ProductRequest("Enterprise", null, planType.getId(), 0)))
        .isInstanceOf(ResourceConflictException.class);

    assertThat(product.getName()).isEqualTo("B2B Subscription");
    verify(productRepository, never()).save(any());
    verifyNoInteractions(auditService);
  }

  @Test
  void updateProduct_keepingOwnName_isAccepted() {
    var planType = planType(false, false);
    var product = withId(new Product("B2B Subscription", null, planType.getId(), null));
    when(productRepository.findById(product.getId())).thenReturn(Optional.of(product));
    when(productRepository.existsByNameAndIdNot("B2B Subscription", product.getId()))
        .thenReturn(false);
    when(planTypeService.requirePlanType(planType.getId())).thenReturn(planType);

    var response =
        service.updateProduct(
            product.getId(), new ProductRequest("B2B Subscription", "desc", planType.getId(), 7));

    assertThat(response.netsuiteId()).isEqualTo(7);
    verify(productRepository).save(product);
  }

  @Test
  void updateProduct_unknownProduct_throwsNotFound() {
    var id = UUID.randomUUID();
    when(productRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(
            () -> service.updateProduct(id, new ProductRequest("X", null, UUID.randomUUID(), 1)))
        .isInstanceOf(ResourceNotFoundException.class);
  }
}
