package com.bistroAssist.queryDemo.context.model;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Everything retrieved for one query. Built fresh per request and owned by the pipeline.
 */
@Value
@Builder
public class ContextBundle {

    public static final String SOURCE_MENU = "menu";
    public static final String SOURCE_POLICIES = "policies";
    public static final String SOURCE_FAQS = "faqs";
    public static final String SOURCE_BUSINESS_DATA = "business_data";
    public static final String SOURCE_CONVERSATION = "conversation";

    @Builder.Default
    List<MenuMatch> menuMatches = List.of();

    @Builder.Default
    List<PolicyMatch> policyMatches = List.of();

    @Builder.Default
    List<FaqMatch> faqMatches = List.of();

    /**
     * Null when the business profile could not be loaded.
     */
    BusinessFacts businessFacts;

    @Builder.Default
    List<ConversationTurn> conversationHistory = List.of();

    public static ContextBundle empty() {
        return ContextBundle.builder().build();
    }

    public List<ContextMatch> allMatches() {
        return Stream.of(menuMatches, policyMatches, faqMatches)
                .flatMap(List::stream)
                .map(ContextMatch.class::cast)
                .toList();
    }

    /**
     * Content ids of every matched item, menu first.
     */
    public List<String> sourceIds() {
        return allMatches().stream().map(ContextMatch::contentId).toList();
    }

    /**
     * Names of the sources that contributed anything, in a fixed order.
     */
    public List<String> contributingSources() {
        List<String> sources = new ArrayList<>();
        if (!menuMatches.isEmpty()) {
            sources.add(SOURCE_MENU);
        }
        if (!policyMatches.isEmpty()) {
            sources.add(SOURCE_POLICIES);
        }
        if (!faqMatches.isEmpty()) {
            sources.add(SOURCE_FAQS);
        }
        if (businessFacts != null) {
            sources.add(SOURCE_BUSINESS_DATA);
        }
        if (!conversationHistory.isEmpty()) {
            sources.add(SOURCE_CONVERSATION);
        }
        return sources;
    }

    public int totalMatches() {
        return menuMatches.size() + policyMatches.size() + faqMatches.size();
    }

    /**
     * Mean match confidence, or 0 when nothing matched.
     */
    public double averageConfidence() {
        return allMatches().stream().mapToDouble(ContextMatch::confidence).average().orElse(0.0);
    }
}
