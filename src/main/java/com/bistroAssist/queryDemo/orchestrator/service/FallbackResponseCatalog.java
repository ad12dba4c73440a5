package com.bistroAssist.queryDemo.orchestrator.service;

import com.bistroAssist.queryDemo.intent.model.QueryIntent;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Canned answers used when generation fails, and follow-up suggestions per intent.
 */
@Component
public class FallbackResponseCatalog {

    public static final double FALLBACK_CONFIDENCE = 0.3;

    private static final String DEFAULT_BUSINESS_NAME = "our business";

    private static final Map<QueryIntent, String> FALLBACKS = new EnumMap<>(QueryIntent.class);
    private static final Map<QueryIntent, List<String>> SUGGESTIONS = new EnumMap<>(QueryIntent.class);

    static {
        FALLBACKS.put(QueryIntent.MENU_INQUIRY, "I'd be happy to help you with our menu at %s. However, I'm currently experiencing technical difficulties. Please contact us directly for the most up-to-date information.");
        FALLBACKS.put(QueryIntent.HOURS_POLICY, "I can help you with our hours and policies at %s. Due to a technical issue, please call us directly for current information.");
        FALLBACKS.put(QueryIntent.PRICING_QUESTION, "I'd love to help you with pricing information for %s. Please contact us directly for the most accurate and current pricing.");
        FALLBACKS.put(QueryIntent.DIETARY_RESTRICTIONS, "I can help you with dietary options at %s. Please contact us directly to discuss your specific dietary needs.");
        FALLBACKS.put(QueryIntent.LOCATION_INFO, "I can help you with location information for %s. Please contact us directly for directions and location details.");
        FALLBACKS.put(QueryIntent.GENERAL_CHAT, "Thank you for contacting %s! I'm currently experiencing technical difficulties. Please feel free to reach out to us directly.");
        FALLBACKS.put(QueryIntent.COMPLAINT_FEEDBACK, "I appreciate you reaching out to %s. Please contact us directly so we can address your concerns properly.");
        FALLBACKS.put(QueryIntent.UNKNOWN, "Thank you for contacting %s. I'm currently experiencing technical difficulties. Please contact us directly for assistance.");

        SUGGESTIONS.put(QueryIntent.MENU_INQUIRY, List.of(
                "What are your most popular items?",
                "Do you have any specials today?",
                "What ingredients do you use?"));
        SUGGESTIONS.put(QueryIntent.HOURS_POLICY, List.of(
                "What are your delivery hours?",
                "Do you offer pickup?",
                "What's your cancellation policy?"));
        SUGGESTIONS.put(QueryIntent.PRICING_QUESTION, List.of(
                "Are there any deals available?",
                "What's included in the price?",
                "Do you offer group discounts?"));
        SUGGESTIONS.put(QueryIntent.DIETARY_RESTRICTIONS, List.of(
                "What vegan options do you have?",
                "Are your items gluten-free?",
                "Do you accommodate allergies?"));
        SUGGESTIONS.put(QueryIntent.LOCATION_INFO, List.of(
                "What's your delivery radius?",
                "How long does delivery take?",
                "Do you have multiple locations?"));
    }

    private static final List<String> DEFAULT_SUGGESTIONS = List.of(
            "Tell me more about your menu",
            "What are your hours?",
            "How can I place an order?");

    public String fallbackAnswer(QueryIntent intent, String businessName) {
        String template = FALLBACKS.getOrDefault(intent != null ? intent : QueryIntent.UNKNOWN, FALLBACKS.get(QueryIntent.UNKNOWN));
        String name = businessName == null || businessName.isBlank() ? DEFAULT_BUSINESS_NAME : businessName;
        return String.format(template, name);
    }

    public List<String> suggestions(QueryIntent intent) {
        return intent != null ? SUGGESTIONS.getOrDefault(intent, DEFAULT_SUGGESTIONS) : DEFAULT_SUGGESTIONS;
    }
}
