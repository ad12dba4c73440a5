package com.bistroAssist.queryDemo.context.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Static profile of a business used to ground generated answers.
 */
@Value
@Builder
public class BusinessFacts {

    String businessId;
    String name;
    String description;
    String cuisine;
    String industry;
    String phone;
    String website;
    String timezone;
    Location location;

    /**
     * Day name (lower case) to opening hours text, e.g. "monday" -> "11:00-22:00".
     */
    @Singular("operatingHour")
    Map<String, String> operatingHours;

    @Singular
    List<String> specials;

    String customInstructions;

    @Value
    @Builder
    public static class Location {
        String address;
        String city;
        String state;
        String zipCode;
        @Singular
        List<String> deliveryAreas;

        public String formatted() {
            StringBuilder sb = new StringBuilder();
            append(sb, address);
            append(sb, city);
            append(sb, state);
            append(sb, zipCode);
            return sb.toString();
        }

        private static void append(StringBuilder sb, String part) {
            if (part == null || part.isBlank()) {
                return;
            }
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(part);
        }
    }
}
