package io.b2mash.b2b.licensemanager;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class AdminApiIntegrationTest {

  @Autowired private MockMvc mockMvc;

  @Test
  void planCreation_requiresSalesforceIdForProductThatNeedsIt() throws Exception {
    var planTypeId = createPlanType(true, false);
    var productId = createProduct(planTypeId, null);
    var agreementId = createAgreement(UUID.randomUUID());

    mockMvc
        .perform(
            post("/api/admin/subscription-plans")
                .with(adminJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(planJson(agreementId, productId, 50, "")))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.title").value("Submission rejected"))
        .andExpect(jsonPath("$.errors", hasSize(1)))
        .andExpect(jsonPath("$.errors[0].field").value("salesforce_opportunity_id"))
        .andExpect(
            jsonPath("$.errors[0].message")
                .value("You must specify Salesforce ID for selected product."));

    mockMvc
        .perform(
            get("/api/admin/subscription-plans")
                .param("customerAgreement", agreementId)
                .with(viewerJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(0)));
  }

  @Test
  void planCreation_overLicenseLimit_isRejected() throws Exception {
    var productId = createProduct(createPlanType(false, false), null);
    var agreementId = createAgreement(UUID.randomUUID());

    mockMvc
        .perform(
            post("/api/admin/subscription-plans")
                .with(adminJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(planJson(agreementId, productId, 10_001, null)))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.errors[0].field").value("num_licenses"))
        .andExpect(
            jsonPath("$.errors[0].message")
                .value("Non-test subscriptions may not have more than 10000 licenses"));
  }

  @Test
  void productCreation_withoutRequiredNetsuiteId_isRejected() throws Exception {
    var planTypeId = createPlanType(false, true);

    mockMvc
        .perform(
            post("/api/admin/products")
                .with(adminJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "%s", "plan_type": "%s"}
                    """
                        .formatted("Product " + UUID.randomUUID(), planTypeId)))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.errors[0].field").value("netsuite_id"));
  }

  @Test
  void autoApplySelection_flowsThroughChoicesAndAgreement() throws Exception {
    var productId = createProduct(createPlanType(false, false), null);
    var agreementId = createAgreement(UUID.randomUUID());
    var planId = createPlan(agreementId, productId);

    mockMvc
        .perform(
            get("/api/admin/customer-agreements/{id}/auto-apply-choices", agreementId)
                .with(viewerJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.choices", hasSize(2)))
        .andExpect(jsonPath("$.choices[0].value").value(""))
        .andExpect(jsonPath("$.choices[1].value").value(planId))
        .andExpect(jsonPath("$.initial").value(""));

    mockMvc
        .perform(
            put("/api/admin/customer-agreements/{id}", agreementId)
                .with(adminJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(agreementUpdateJson(UUID.randomUUID().toString())))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.errors[0].field").value("subscription_for_auto_applied_licenses"));

    mockMvc
        .perform(
            put("/api/admin/customer-agreements/{id}", agreementId)
                .with(adminJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(agreementUpdateJson(planId)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.auto_applicable_subscription").value(planId));

    mockMvc
        .perform(get("/api/admin/subscription-plans/{id}", planId).with(viewerJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.should_auto_apply_licenses").value(true));

    mockMvc
        .perform(
            get("/api/admin/audit-events")
                .param("entityType", "CUSTOMER_AGREEMENT")
                .param("entityId", agreementId)
                .with(viewerJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(3)))
        .andExpect(jsonPath("$[0].actor").value("admin-user"));
  }

  @Test
  void renewal_effectiveInPast_isRejectedAndValidOneIsSaved() throws Exception {
    var productId = createProduct(createPlanType(false, false), null);
    var planId = createPlan(createAgreement(UUID.randomUUID()), productId);
    var yesterday = Instant.now().minus(1, ChronoUnit.DAYS);

    mockMvc
        .perform(
            post("/api/admin/renewals")
                .with(adminJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(renewalJson(planId, yesterday, yesterday.plus(365, ChronoUnit.DAYS))))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.errors[0].field").value("effective_date"))
        .andExpect(
            jsonPath("$.errors[0].message")
                .value(
                    "A subscription renewal can not be scheduled to become effective in the"
                        + " past."));

    var effective = Instant.now().plus(400, ChronoUnit.DAYS);
    mockMvc
        .perform(
            post("/api/admin/renewals")
                .with(adminJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(renewalJson(planId, effective, effective.plus(365, ChronoUnit.DAYS))))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.prior_subscription_plan").value(planId))
        .andExpect(jsonPath("$.processed").value(false));

    mockMvc
        .perform(
            post("/api/admin/renewals")
                .with(adminJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(renewalJson(planId, effective, effective.plus(365, ChronoUnit.DAYS))))
        .andExpect(status().isConflict());
  }

  @Test
  void missingRequiredFields_returnSnakeCaseFieldErrors() throws Exception {
    mockMvc
        .perform(
            post("/api/admin/customer-agreements")
                .with(adminJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"enterprise_customer_slug\": \"no-uuid\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errors[0].field").value("enterprise_customer_uuid"));
  }

  @Test
  void negativeRevocationPercentage_isBadRequestEvenWithCapDisabled() throws Exception {
    var productId = createProduct(createPlanType(false, false), null);
    var agreementId = createAgreement(UUID.randomUUID());
    var body =
        planJson(agreementId, productId, 25, null)
            .replace("\"change_reason\"", "\"revoke_max_percentage\": -5, \"change_reason\"");

    mockMvc
        .perform(
            post("/api/admin/subscription-plans")
                .with(adminJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errors[0].field").value("revoke_max_percentage"));
  }

  @Test
  void productCreation_duplicateName_isConflict() throws Exception {
    var planTypeId = createPlanType(false, false);
    var body =
        """
        {"name": "%s", "plan_type": "%s"}
        """
            .formatted("Product " + UUID.randomUUID(), planTypeId);

    mockMvc
        .perform(
            post("/api/admin/products")
                .with(adminJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
        .andExpect(status().isCreated());

    mockMvc
        .perform(
            post("/api/admin/products")
                .with(adminJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.title").value("Duplicate product"));
  }

  @Test
  void viewer_cannotWrite() throws Exception {
    mockMvc
        .perform(
            post("/api/admin/plan-types")
                .with(viewerJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"label\": \"Viewer attempt\"}"))
        .andExpect(status().isForbidden());
  }

  @Test
  void anonymous_isUnauthorized() throws Exception {
    mockMvc.perform(get("/api/admin/products")).andExpect(status().isUnauthorized());
  }

  @Test
  void unknownAgreement_returnsNotFound() throws Exception {
    mockMvc
        .perform(get("/api/admin/customer-agreements/{id}", UUID.randomUUID()).with(viewerJwt()))
        .andExpect(status().isNotFound());
  }

  // --- Helpers ---

  private String createPlanType(boolean sfIdRequired, boolean nsIdRequired) throws Exception {
    return idOf(
        mockMvc.perform(
            post("/api/admin/plan-types")
                .with(adminJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"label": "%s", "paid_subscription": true,
                     "sf_id_required": %s, "ns_id_required": %s}
                    """
                        .formatted("Type " + UUID.randomUUID(), sfIdRequired, nsIdRequired))));
  }

  private String createProduct(String planTypeId, Integer netsuiteId) throws Exception {
    return idOf(
        mockMvc.perform(
            post("/api/admin/products")
                .with(adminJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "%s", "plan_type": "%s", "netsuite_id": %s}
                    """
                        .formatted("Product " + UUID.randomUUID(), planTypeId, netsuiteId))));
  }

  private String createAgreement(UUID defaultCatalog) throws Exception {
    return idOf(
        mockMvc.perform(
            post("/api/admin/customer-agreements")
                .with(adminJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"enterprise_customer_uuid": "%s", "enterprise_customer_name": "Acme",
                     "default_enterprise_catalog_uuid": "%s"}
                    """
                        .formatted(UUID.randomUUID(), defaultCatalog))));
  }

  private String createPlan(String agreementId, String productId) throws Exception {
    return idOf(
        mockMvc.perform(
            post("/api/admin/subscription-plans")
                .with(adminJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(planJson(agreementId, productId, 25, null))));
  }

  private static String idOf(ResultActions result) throws Exception {
    var body = result.andExpect(status().isCreated()).andReturn().getResponse();
    return JsonPath.read(body.getContentAsString(), "$.id");
  }

  private static String planJson(
      String agreementId, String productId, int numLicenses, String salesforceId) {
    var now = Instant.now();
    return """
        {"title": "Plan %s", "customer_agreement": "%s", "product": "%s",
         "start_date": "%s", "expiration_date": "%s", "num_licenses": %d,
         "salesforce_opportunity_id": %s, "change_reason": "NEW"}
        """
        .formatted(
            UUID.randomUUID(),
            agreementId,
            productId,
            now.minus(1, ChronoUnit.DAYS),
            now.plus(365, ChronoUnit.DAYS),
            numLicenses,
            salesforceId == null ? "null" : "\"" + salesforceId + "\"");
  }

  private static String agreementUpdateJson(String autoApplyPlan) {
    return """
        {"enterprise_customer_name": "Acme", "license_duration_before_purge_days": 90,
         "subscription_for_auto_applied_licenses": "%s"}
        """
        .formatted(autoApplyPlan);
  }

  private static String renewalJson(String priorPlanId, Instant effective, Instant expiration) {
    return """
        {"prior_subscription_plan": "%s", "number_of_licenses": 25,
         "effective_date": "%s", "renewed_expiration_date": "%s"}
        """
        .formatted(priorPlanId, effective, expiration);
  }

  private JwtRequestPostProcessor adminJwt() {
    return jwt()
        .jwt(j -> j.subject("admin-user").claim("roles", List.of("license_admin")))
        .authorities(new SimpleGrantedAuthority("ROLE_LICENSE_ADMIN"));
  }

  private JwtRequestPostProcessor viewerJwt() {
    return jwt()
        .jwt(j -> j.subject("viewer-user").claim("roles", List.of("license_viewer")))
        .authorities(new SimpleGrantedAuthority("ROLE_LICENSE_VIEWER"));
  }
}
