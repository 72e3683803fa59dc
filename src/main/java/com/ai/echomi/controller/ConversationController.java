package com.ai.echomi.controller;

import com.ai.echomi.dto.TurnRequest;
import com.ai.echomi.dto.TurnResponse;
import com.ai.echomi.service.ConversationOrchestrator;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ConversationController {

    private final ConversationOrchestrator orchestrator;

    public ConversationController(ConversationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * One conversation turn, or the SMS reprocessing step when
     * {@code requires_reprocessing} is set.
     */
    @PostMapping(value = "/generate", produces = MediaType.APPLICATION_JSON_VALUE)
    public TurnResponse generate(@RequestBody TurnRequest request) {
        return orchestrator.process(request);
    }
}
