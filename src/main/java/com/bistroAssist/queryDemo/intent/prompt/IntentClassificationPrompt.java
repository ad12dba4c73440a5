package com.bistroAssist.queryDemo.intent.prompt;

/**
 * Prompts for language-model intent classification.
 */
public class IntentClassificationPrompt {

    private IntentClassificationPrompt() {}

    public static final String SYSTEM_PROMPT = """
            You are an expert at classifying restaurant customer queries. \
            Analyze the query and determine the most likely intent.
            """;

    private static final String USER_PROMPT_TEMPLATE = """
            Analyze this restaurant customer query and classify it into one of these intents:

            QUERY: "%s"

            INTENT CATEGORIES:
            - MENU_INQUIRY: Questions about food items, dishes, ingredients, recommendations
            - HOURS_POLICY: Questions about operating hours, policies, procedures
            - PRICING_QUESTION: Questions about prices, costs, deals, discounts
            - DIETARY_RESTRICTIONS: Questions about allergies, dietary needs, special diets
            - LOCATION_INFO: Questions about address, directions, delivery areas
            - GENERAL_CHAT: Greetings, small talk, general conversation
            - COMPLAINT_FEEDBACK: Complaints, issues, feedback, problems
            - UNKNOWN: Unclear or ambiguous queries

            Respond with a single JSON object and nothing else, in exactly this format:
            {
              "intent": "INTENT_NAME",
              "confidence": 0.95,
              "reasoning": "Brief explanation of why this intent was chosen"
            }
            """;

    public static String buildUserPrompt(String query) {
        return String.format(USER_PROMPT_TEMPLATE, query.replace("\"", "'"));
    }
}
