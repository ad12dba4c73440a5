package com.bistroAssist.queryDemo.intent.model;

/**
 * Intent taxonomy for customer queries.
 */
public enum QueryIntent {
    MENU_INQUIRY,
    HOURS_POLICY,
    PRICING_QUESTION,
    DIETARY_RESTRICTIONS,
    LOCATION_INFO,
    GENERAL_CHAT,
    COMPLAINT_FEEDBACK,
    UNKNOWN;

    /**
     * Parses a label case-insensitively; anything unrecognised maps to {@link #UNKNOWN}.
     */
    public static QueryIntent fromLabel(String label) {
        if (label == null) {
            return UNKNOWN;
        }
        for (QueryIntent intent : values()) {
            if (intent.name().equalsIgnoreCase(label.trim())) {
                return intent;
            }
        }
        return UNKNOWN;
    }
}
