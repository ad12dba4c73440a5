package com.bistroAssist.queryDemo.intent;

import com.bistroAssist.queryDemo.intent.model.IntentPattern;
import com.bistroAssist.queryDemo.intent.model.QueryIntent;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keyword and regex patterns used by rule-based classification, one entry per intent.
 * Order matters: on equal scores the earlier intent wins.
 */
public class IntentPatternCatalog {

    private IntentPatternCatalog() {}

    public static final List<IntentPattern> PATTERNS = List.of(
            pattern(QueryIntent.MENU_INQUIRY,
                    List.of("menu", "food", "dish", "pizza", "burger", "pasta", "salad", "appetizer", "entree",
                            "dessert", "drink", "beverage", "special", "recommendation", "ingredients", "recipe"),
                    "what.*on.*menu", "do you have.*food", "what.*recommend", "best.*dish", "what.*ingredients",
                    "is.*available"),
            pattern(QueryIntent.HOURS_POLICY,
                    List.of("hours", "open", "close", "closed", "time", "when", "policy", "rules", "delivery",
                            "pickup", "reservation", "booking"),
                    "what.*hours", "when.*open", "when.*close", "are you.*open", "delivery.*policy",
                    "reservation.*policy"),
            pattern(QueryIntent.PRICING_QUESTION,
                    List.of("price", "cost", "how much", "expensive", "cheap", "deal", "discount", "special",
                            "promotion", "offer", "dollar", "$"),
                    "how much.*cost", "what.*price", "how much.*dollar", "any.*deal", "discount.*available",
                    "\\$\\d+"),
            pattern(QueryIntent.DIETARY_RESTRICTIONS,
                    List.of("vegan", "vegetarian", "gluten", "allergy", "allergic", "dairy", "nuts", "peanut", "soy",
                            "kosher", "halal", "keto", "paleo", "diet"),
                    "do you have.*vegan", "is.*gluten.*free", "allergic.*to", "dietary.*restriction",
                    "special.*diet"),
            pattern(QueryIntent.LOCATION_INFO,
                    List.of("where", "location", "address", "directions", "near", "close", "delivery", "area", "zip",
                            "city", "street"),
                    "where.*located", "what.*address", "how.*get.*there", "deliver.*to", "near.*me"),
            pattern(QueryIntent.GENERAL_CHAT,
                    List.of("hello", "hi", "hey", "good morning", "good afternoon", "good evening", "how are you",
                            "thank you", "thanks", "bye", "goodbye"),
                    "^(hello|hi|hey)$", "good.*morning", "how.*are.*you", "thank.*you"),
            pattern(QueryIntent.COMPLAINT_FEEDBACK,
                    List.of("complaint", "problem", "issue", "wrong", "bad", "terrible", "awful", "disappointed",
                            "angry", "upset", "refund", "money back"),
                    "my.*order.*wrong", "terrible.*service", "want.*refund", "very.*disappointed", "worst.*ever")
    );

    private static IntentPattern pattern(QueryIntent intent, List<String> keywords, String... regexes) {
        List<Pattern> compiled = Arrays.stream(regexes)
                .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE))
                .collect(Collectors.toList());
        return new IntentPattern(intent, keywords, compiled);
    }
}
