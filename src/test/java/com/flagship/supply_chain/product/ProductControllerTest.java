package com.flagship.supply_chain.product;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.supply_chain.access.Principal;
import com.flagship.supply_chain.ledger.InMemoryTokenLedger;
import com.flagship.supply_chain.product.dto.CreateProductRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.math.BigDecimal;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP surface tests: status codes, the reason field and the principal header.
 */
@SpringBootTest
@AutoConfigureMockMvc
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class ProductControllerTest {

    private static final String PRINCIPAL_HEADER = "X-Principal";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private InMemoryTokenLedger ledger;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() throws Exception {
        for (String principal : new String[]{"0xproducer", "0xshipper", "0xbuyer"}) {
            mockMvc.perform(post("/api/access/verifications/{principal}", principal)
                    .header(PRINCIPAL_HEADER, "admin"))
                .andExpect(status().isOk());
        }
        grant("0xproducer", "PRODUCER");
        grant("0xshipper", "SHIPPER");
        grant("0xbuyer", "BUYER");
    }

    private void grant(String principal, String role) throws Exception {
        mockMvc.perform(post("/api/access/roles/{principal}/{role}", principal, role)
                .header(PRINCIPAL_HEADER, "admin"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.verified").value(true));
    }

    private ResultActions createWidget(String caller) throws Exception {
        CreateProductRequest request = new CreateProductRequest("Widget", "Factory-A", new BigDecimal("100"));
        return mockMvc.perform(post("/api/products")
            .header(PRINCIPAL_HEADER, caller)
            .contentType(MediaType.APPLICATION_JSON)
            .content(objectMapper.writeValueAsString(request)));
    }

    @Test
    @DisplayName("Create returns 201 with the new record")
    void testCreateProduct() throws Exception {
        printTestHeader("POST /api/products");

        createWidget("0xproducer")
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value(1))
            .andExpect(jsonPath("$.producer").value("0xproducer"))
            .andExpect(jsonPath("$.location").value("Factory-A"))
            .andExpect(jsonPath("$.is_paid").value(false))
            .andExpect(jsonPath("$.stage").value("CREATED"));

        mockMvc.perform(get("/api/products/1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.name").value("Widget"));
        printSuccess("Product created and readable");
    }

    @Test
    @DisplayName("Full lifecycle over HTTP")
    void testLifecycleOverHttp() throws Exception {
        ledger.mint(Principal.of("0xpayer"), new BigDecimal("100"));
        createWidget("0xproducer").andExpect(status().isCreated());

        mockMvc.perform(post("/api/products/1/payment").header(PRINCIPAL_HEADER, "0xpayer"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.is_paid").value(true));

        mockMvc.perform(post("/api/products/1/shipment")
                .header(PRINCIPAL_HEADER, "0xshipper")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"location\":\"Port-X\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.location").value("Port-X"))
            .andExpect(jsonPath("$.shipper").value("0xshipper"));

        mockMvc.perform(post("/api/products/1/dispute").header(PRINCIPAL_HEADER, "0xproducer"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.is_disputed").value(true));

        mockMvc.perform(delete("/api/products/1/dispute").header(PRINCIPAL_HEADER, "admin"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.is_disputed").value(false));

        mockMvc.perform(post("/api/products/1/receipt").header(PRINCIPAL_HEADER, "0xbuyer"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.is_received").value(true))
            .andExpect(jsonPath("$.buyer").value("0xbuyer"))
            .andExpect(jsonPath("$.stage").value("RECEIVED"));

        mockMvc.perform(get("/api/products/1/events"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(6))
            .andExpect(jsonPath("$[0].eventType").value("ProductCreated"))
            .andExpect(jsonPath("$[5].eventType").value("ProductReceived"));

        mockMvc.perform(get("/api/ledger/balances/0xproducer"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.balance").value(100));
    }

    @Test
    @DisplayName("Rejections map to their own status codes")
    void testRejectionStatusCodes() throws Exception {
        // No role
        createWidget("0xstranger")
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.reason").value("UNAUTHORIZED"));

        // Role but not verified
        mockMvc.perform(post("/api/access/roles/{principal}/PRODUCER", "0xfresh")
                .header(PRINCIPAL_HEADER, "admin"))
            .andExpect(status().isOk());
        createWidget("0xfresh")
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.reason").value("NOT_VERIFIED"));

        // Missing product
        mockMvc.perform(post("/api/products/42/payment").header(PRINCIPAL_HEADER, "0xpayer"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.reason").value("NOT_FOUND"))
            .andExpect(jsonPath("$.details.productId").value("42"));

        createWidget("0xproducer").andExpect(status().isCreated());

        // Nothing paid yet
        mockMvc.perform(post("/api/products/1/receipt").header(PRINCIPAL_HEADER, "0xbuyer"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.reason").value("INVALID_STATE"));

        // Empty balance
        mockMvc.perform(post("/api/products/1/payment").header(PRINCIPAL_HEADER, "0xpayer"))
            .andExpect(status().isPaymentRequired())
            .andExpect(jsonPath("$.reason").value("INSUFFICIENT_FUNDS"));

        // Frozen account
        ledger.mint(Principal.of("0xpayer"), new BigDecimal("100"));
        ledger.freeze(Principal.of("0xpayer"));
        mockMvc.perform(post("/api/products/1/payment").header(PRINCIPAL_HEADER, "0xpayer"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.reason").value("TRANSFER_FAILED"));
    }

    @Test
    @DisplayName("Transitions without a principal header are bad requests")
    void testMissingPrincipalHeader() throws Exception {
        mockMvc.perform(post("/api/products/1/payment"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Required header 'X-Principal' is missing"))
            .andExpect(jsonPath("$.correlationId").exists());
    }

    @Test
    @DisplayName("Invalid create payload is rejected before the lifecycle service")
    void testValidation() throws Exception {
        mockMvc.perform(post("/api/products")
                .header(PRINCIPAL_HEADER, "0xproducer")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"\",\"origin\":\"Factory-A\",\"price\":-1}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"))
            .andExpect(jsonPath("$.details.price").exists())
            .andExpect(jsonPath("$.details.name").exists());

        mockMvc.perform(get("/api/products"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    @DisplayName("Correlation id is echoed, or generated when absent")
    void testCorrelationId() throws Exception {
        mockMvc.perform(get("/api/products").header("X-Correlation-ID", "trace-123"))
            .andExpect(status().isOk())
            .andExpect(header().string("X-Correlation-ID", "trace-123"));

        mockMvc.perform(get("/api/products"))
            .andExpect(header().exists("X-Correlation-ID"));
    }

    @Test
    @DisplayName("Non-numeric product id is a bad request")
    void testMalformedId() throws Exception {
        mockMvc.perform(get("/api/products/abc"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Event feed pages by sequence number")
    void testEventFeed() throws Exception {
        createWidget("0xproducer").andExpect(status().isCreated());
        createWidget("0xproducer").andExpect(status().isCreated());

        mockMvc.perform(get("/api/events").param("after", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].sequenceNumber").value(2))
            .andExpect(jsonPath("$[0].productId").value(2));

        mockMvc.perform(get("/api/events").param("limit", "0"))
            .andExpect(status().isBadRequest());
    }
}
