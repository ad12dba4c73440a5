package com.bistroAssist.queryDemo.gateway.controller;

import com.bistroAssist.queryDemo.intent.IntentClassifier;
import com.bistroAssist.queryDemo.intent.model.IntentPatternStats;
import com.bistroAssist.queryDemo.intent.model.QueryIntent;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Diagnostics for the intent classifier.
 */
@RestController
@RequestMapping("/api/v1/intents")
@RequiredArgsConstructor
public class IntentController {

    private final IntentClassifier intentClassifier;

    @GetMapping("/stats")
    public Map<QueryIntent, IntentPatternStats> stats() {
        return intentClassifier.intentStats();
    }
}
