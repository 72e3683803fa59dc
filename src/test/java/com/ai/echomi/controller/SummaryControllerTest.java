package com.ai.echomi.controller;

import com.ai.echomi.client.OfflineLanguageModelService;
import com.ai.echomi.service.CallSummaryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class SummaryControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        SummaryController controller =
                new SummaryController(new CallSummaryService(new OfflineLanguageModelService(), "Ruchit"), true);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void shouldSummarizeDeliveryCall() throws Exception {
        String body = """
                {"history": [{"role": "user", "content": "Swiggy delivery here"}],
                 "collected_info": {"company": "Swiggy"}}
                """;

        mockMvc.perform(post("/api/conversation-summary").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.summary").value("Delivery person from Swiggy called for assistance. "
                        + "Provided directions and OTP as needed. Call completed successfully."));
    }

    @Test
    void shouldReportHealthAndMockMode() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.mock_mode").value(true));
    }
}
