package com.flagship.payout_settlement.admin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end payout flow over HTTP.
 *
 * These tests verify:
 * - Record, approve and settle through the role-scoped endpoints
 * - Settlement failures surface as 422 after the failure is persisted
 * - Identity headers are required and ownership is enforced
 * - Validation errors come back as ApiError bodies
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class PayoutApiIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("payout_settlement_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("spring.kafka.producer.properties.max.block.ms", () -> "500");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("settlement.rail.sandbox", () -> "true");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private UUID adminId;
    private UUID creatorId;
    private UUID companyId;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        adminId = UUID.randomUUID();
        creatorId = UUID.randomUUID();
        companyId = UUID.randomUUID();
    }

    private String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    private UUID recordPayment(String grossAmount) throws Exception {
        String response = mockMvc.perform(post("/api/admin/payments")
                .header(AdminPayoutController.ADMIN_ID_HEADER, adminId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(Map.of(
                    "creator_id", creatorId,
                    "company_id", companyId,
                    "gross_amount", grossAmount,
                    "description", "Signup conversion"))))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("PENDING"))
            .andReturn().getResponse().getContentAsString();
        JsonNode node = objectMapper.readTree(response);
        return UUID.fromString(node.get("id").asText());
    }

    private void registerPaypal() throws Exception {
        mockMvc.perform(post("/api/creator/payment-methods")
                .header("X-Creator-Id", creatorId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(Map.of("type", "PAYPAL", "paypal_email", "creator@example.com"))))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.is_default").value(true));
    }

    @Test
    @DisplayName("Record, approve and settle a payout end to end")
    void recordApproveSettle() throws Exception {
        printTestHeader("Record, Approve, Settle");

        UUID paymentId = recordPayment("100.00");
        registerPaypal();

        mockMvc.perform(post("/api/company/payments/{id}/approve", paymentId)
                .header("X-Company-Id", companyId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("PROCESSING"));

        String settled = mockMvc.perform(post("/api/admin/payments/{id}/settle", paymentId)
                .header(AdminPayoutController.ADMIN_ID_HEADER, adminId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result").value("COMPLETED"))
            .andExpect(jsonPath("$.payment.status").value("COMPLETED"))
            .andExpect(jsonPath("$.payment.payout_method").value("PAYPAL"))
            .andReturn().getResponse().getContentAsString();
        printOutput("Settle response", settled);

        mockMvc.perform(post("/api/admin/payments/{id}/settle", paymentId)
                .header(AdminPayoutController.ADMIN_ID_HEADER, adminId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result").value("ALREADY_COMPLETED"));

        mockMvc.perform(get("/api/creator/earnings").header("X-Creator-Id", creatorId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.completed_earnings").value(93.0))
            .andExpect(jsonPath("$.pending_earnings").value(0));

        printSuccess("Payment settled once and counted in creator earnings");
    }

    @Test
    @DisplayName("Settling below the method minimum returns 422 and persists the failure")
    void belowMinimum() throws Exception {
        printTestHeader("Below Minimum Settlement");

        UUID paymentId = recordPayment("0.50");
        registerPaypal();

        mockMvc.perform(post("/api/admin/payments/{id}/settle", paymentId)
                .header(AdminPayoutController.ADMIN_ID_HEADER, adminId))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("Settlement Failed"))
            .andExpect(jsonPath("$.details.failure_kind").value("BELOW_MINIMUM_AMOUNT"));

        mockMvc.perform(get("/api/admin/payments/{id}", paymentId)
                .header(AdminPayoutController.ADMIN_ID_HEADER, adminId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("FAILED"))
            .andExpect(jsonPath("$.failure_kind").value("BELOW_MINIMUM_AMOUNT"));

        printSuccess("Failure persisted before the error response");
    }

    @Test
    @DisplayName("Dispute, then release back to processing")
    void disputeAndRelease() throws Exception {
        UUID paymentId = recordPayment("40.00");

        mockMvc.perform(post("/api/company/payments/{id}/dispute", paymentId)
                .header("X-Company-Id", companyId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(Map.of("reason", "Conversion was refunded"))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("FAILED"))
            .andExpect(jsonPath("$.disputed").value(true));

        mockMvc.perform(get("/api/admin/payments/disputed")
                .header(AdminPayoutController.ADMIN_ID_HEADER, adminId))
            .andExpect(status().isOk());

        mockMvc.perform(post("/api/admin/payments/{id}/resolve-dispute", paymentId)
                .header(AdminPayoutController.ADMIN_ID_HEADER, adminId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(Map.of("resolution", "RELEASE", "notes", "Verified with company"))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("PROCESSING"));
    }

    @Test
    @DisplayName("A company cannot act on another company's payment")
    void ownershipEnforced() throws Exception {
        UUID paymentId = recordPayment("25.00");

        mockMvc.perform(post("/api/company/payments/{id}/approve", paymentId)
                .header("X-Company-Id", UUID.randomUUID()))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("Forbidden"));
    }

    @Test
    @DisplayName("Approving twice is a state conflict")
    void approveTwice() throws Exception {
        UUID paymentId = recordPayment("25.00");

        mockMvc.perform(post("/api/admin/payments/{id}/approve", paymentId)
                .header(AdminPayoutController.ADMIN_ID_HEADER, adminId))
            .andExpect(status().isOk());

        mockMvc.perform(post("/api/admin/payments/{id}/approve", paymentId)
                .header(AdminPayoutController.ADMIN_ID_HEADER, adminId))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.details.current_status").value("PROCESSING"));
    }

    @Test
    @DisplayName("Missing identity header is rejected")
    void missingHeader() throws Exception {
        mockMvc.perform(get("/api/admin/payments"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Missing Required Header"));
    }

    @Test
    @DisplayName("Invalid request bodies report the offending fields")
    void invalidBody() throws Exception {
        mockMvc.perform(post("/api/admin/payments")
                .header(AdminPayoutController.ADMIN_ID_HEADER, adminId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(Map.of("company_id", companyId, "gross_amount", "10.00"))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"))
            .andExpect(jsonPath("$.details.creatorId").value("Creator ID is required"));
    }

    @Test
    @DisplayName("Unknown payments are 404")
    void unknownPayment() throws Exception {
        mockMvc.perform(get("/api/admin/payments/{id}", UUID.randomUUID())
                .header(AdminPayoutController.ADMIN_ID_HEADER, adminId))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Platform settings are seeded and validated on update")
    void settings() throws Exception {
        mockMvc.perform(get("/api/admin/settings").header(AdminPayoutController.ADMIN_ID_HEADER, adminId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(7));

        mockMvc.perform(put("/api/admin/settings/{key}", "platform_fee_percentage")
                .header(AdminPayoutController.ADMIN_ID_HEADER, adminId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(Map.of("value", "60"))))
            .andExpect(status().isBadRequest());

        String response = mockMvc.perform(put("/api/admin/settings/{key}", "payment_settlement_schedule")
                .header(AdminPayoutController.ADMIN_ID_HEADER, adminId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(Map.of("value", "Daily"))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.value").value("daily"))
            .andReturn().getResponse().getContentAsString();
        assertTrue(response.contains(adminId.toString()));
    }
}
