package com.ai.echomi.controller;

import com.ai.echomi.dto.SummaryRequest;
import com.ai.echomi.service.CallSummaryService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class SummaryController {

    private final CallSummaryService callSummary;
    private final boolean mockMode;

    public SummaryController(CallSummaryService callSummary, @Value("${echomi.mock-mode:false}") boolean mockMode) {
        this.callSummary = callSummary;
        this.mockMode = mockMode;
    }

    @PostMapping("/api/conversation-summary")
    public Map<String, Object> summarize(@RequestBody SummaryRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("summary", callSummary.summarize(request.getHistory(), request.getCollectedInfo()));
        return body;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("mock_mode", mockMode);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
