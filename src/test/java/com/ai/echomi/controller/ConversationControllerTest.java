package com.ai.echomi.controller;

import com.ai.echomi.ConversationStackFixture;
import com.ai.echomi.service.OwnerNotifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.mock;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ConversationControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ConversationController controller =
                new ConversationController(new ConversationStackFixture().orchestrator(mock(OwnerNotifier.class)));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void shouldAnswerDeliveryOpeningTurn() throws Exception {
        String body = """
                {"new_message": "I have a delivery from Amazon",
                 "caller_role": "delivery",
                 "conversation_stage": "start",
                 "collected_info": {},
                 "history": [],
                 "call_sid": "CA42"}
                """;

        mockMvc.perform(post("/generate").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conversation_stage").value("asking_location_help"))
                .andExpect(jsonPath("$.collected_info.company").value("Amazon"))
                .andExpect(jsonPath("$.action.type").value("NONE"))
                .andExpect(jsonPath("$.end_call").value(false))
                .andExpect(jsonPath("$.call_sid").value("CA42"))
                .andExpect(jsonPath("$.updated_history.length()").value(2));
    }

    @Test
    void shouldReturnOtpFromSmsReprocessing() throws Exception {
        String body = """
                {"requires_reprocessing": true,
                 "company": "Zomato",
                 "caller_role": "delivery",
                 "conversation_stage": "checking_sms",
                 "collected_info": {"company": "Zomato"},
                 "sms_data": [{"sender": "VM-ZOMATO", "message": "Your Zomato OTP is 4821", "timestamp": "1714557600"}]}
                """;

        mockMvc.perform(post("/generate").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conversation_stage").value("call_ending"))
                .andExpect(jsonPath("$.action.type").value("PROVIDE_OTP"))
                .andExpect(jsonPath("$.action.otp").value("4821"))
                .andExpect(jsonPath("$.end_call").value(true))
                .andExpect(jsonPath("$.conversation_summary").exists());
    }

    @Test
    void shouldRejectStageFromOtherGraph() throws Exception {
        String body = """
                {"new_message": "hello", "caller_role": "delivery", "conversation_stage": "asking_purpose"}
                """;

        mockMvc.perform(post("/generate").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error").value("Stage asking_purpose is not a delivery stage"));
    }

    @Test
    void shouldRejectMissingMessage() throws Exception {
        mockMvc.perform(post("/generate").contentType(MediaType.APPLICATION_JSON).content("{\"caller_role\": \"unknown\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("new_message is required"));
    }

    @Test
    void shouldRejectMalformedBody() throws Exception {
        mockMvc.perform(post("/generate").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("VALIDATION_ERROR"));
    }
}
