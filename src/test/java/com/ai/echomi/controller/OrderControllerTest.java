package com.ai.echomi.controller;

import com.ai.echomi.auth.SharedSecretVerifier;
import com.ai.echomi.client.LedgerOtpBackendClient;
import com.ai.echomi.entity.OrderStatus;
import com.ai.echomi.service.OrderLedger;
import com.ai.echomi.service.OtpReleaseService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class OrderControllerTest {

    private static final String SECRET = "s3cret";

    private OrderLedger ledger;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ledger = new OrderLedger();
        OrderController controller = new OrderController(ledger,
                new OtpReleaseService(ledger, new LedgerOtpBackendClient(ledger)),
                new SharedSecretVerifier(SECRET, false));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void shouldAddOrderWithValidSecret() throws Exception {
        String body = "{\"secret_key\": \"s3cret\", \"company\": \"zomato\", \"otp\": \"4821\", \"tracking_id\": \"zm 123\"}";

        mockMvc.perform(post("/add-order").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.order_id").exists());

        assertEquals(1, ledger.list().size());
        assertEquals("ZM123", ledger.list().get(0).getTrackingId());
    }

    @Test
    void shouldRejectWrongSecret() throws Exception {
        String body = "{\"secret_key\": \"guess\", \"company\": \"Zomato\", \"otp\": \"4821\"}";

        mockMvc.perform(post("/add-order").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.type").value("UNAUTHORIZED"));
    }

    @Test
    void shouldRequireCompanyAndOtp() throws Exception {
        String body = "{\"secret_key\": \"s3cret\", \"company\": \"Zomato\"}";

        mockMvc.perform(post("/add-order").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldListOrdersWithoutOtp() throws Exception {
        ledger.add("Swiggy", "9911", null);

        mockMvc.perform(get("/list-orders"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.orders[0].company").value("Swiggy"))
                .andExpect(jsonPath("$.orders[0].status").value("pending"))
                .andExpect(content().string(not(containsString("9911"))));
    }

    @Test
    void shouldReturnNotFoundForUnknownOrder() throws Exception {
        mockMvc.perform(get("/api/orders/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.type").value("ORDER_NOT_FOUND"))
                .andExpect(jsonPath("$.orderId").value("missing"));
    }

    @Test
    void shouldApproveThenRejectReopening() throws Exception {
        String id = ledger.add("Amazon", "1234", null);

        mockMvc.perform(post("/api/orders/" + id + "/status").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"secret_key\": \"s3cret\", \"status\": \"denied\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("denied"));

        mockMvc.perform(post("/api/orders/" + id + "/status").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"secret_key\": \"s3cret\", \"status\": \"approved\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.from").value("denied"))
                .andExpect(jsonPath("$.to").value("approved"));
    }

    @Test
    void shouldRejectUnknownStatusLabel() throws Exception {
        String id = ledger.add("Amazon", "1234", null);

        mockMvc.perform(post("/api/orders/" + id + "/status").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"secret_key\": \"s3cret\", \"status\": \"shipped\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldReleaseOtpOnlyForApprovedOrder() throws Exception {
        String id = ledger.add("Amazon", "1234", null);
        String request = "{\"firebaseUid\": \"uid\", \"company\": \"Amazon\", \"orderId\": \"" + id + "\"}";

        mockMvc.perform(post("/api/get-otp").contentType(MediaType.APPLICATION_JSON).content(request))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("The delivery hasn't been approved yet."));

        ledger.setStatus(id, OrderStatus.APPROVED);

        mockMvc.perform(post("/api/get-otp").contentType(MediaType.APPLICATION_JSON).content(request))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.otp").value("1234"))
                .andExpect(jsonPath("$.fallback").value(false));
        assertEquals(OrderStatus.COMPLETED, ledger.get(id).orElseThrow().getStatus());
    }
}
