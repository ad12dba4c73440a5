package com.bistroAssist.queryDemo.orchestrator.admission;

import com.bistroAssist.queryDemo.config.AssistantProperties;
import com.bistroAssist.queryDemo.orchestrator.dto.QueryRequest;
import com.bistroAssist.queryDemo.orchestrator.exception.QueryValidationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Input checks every query passes before any other work is done.
 */
@Component
public class QueryValidator {

    private static final Pattern SESSION_ID = Pattern.compile("^[a-zA-Z0-9\\-]{8,64}$");
    private static final Pattern CUSTOMER_ID = Pattern.compile("^[a-zA-Z0-9]{3,50}$");

    /**
     * Adjacent keyword pairs only.
     */
    private static final List<Pattern> SQL_INJECTION = List.of(
            "union\\s+select",
            "drop\\s+table",
            "delete\\s+from",
            "insert\\s+into",
            "update\\s+set",
            "alter\\s+table",
            "create\\s+table",
            "exec\\s*\\(",
            "execute\\s*\\(",
            "sp_executesql",
            "xp_cmdshell",
            "waitfor\\s+delay",
            "benchmark\\s*\\(",
            "sleep\\s*\\(").stream()
            .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE))
            .toList();

    private static final int SPAM_MIN_WORDS = 4;

    private final AssistantProperties properties;

    public QueryValidator(AssistantProperties properties) {
        this.properties = properties;
    }

    /**
     * @throws QueryValidationException listing every problem found
     */
    public void validate(String businessId, QueryRequest request) {
        List<String> errors = new ArrayList<>();
        if (businessId == null || businessId.isBlank()) {
            errors.add("Business ID is required");
        }
        String query = request != null ? request.getQuery() : null;
        if (query == null || query.isBlank()) {
            errors.add("Query text is required");
        } else {
            int maxLength = properties.getPipeline().getMaxQueryLength();
            if (query.length() > maxLength) {
                errors.add("Query exceeds maximum length of " + maxLength + " characters");
            }
            if (looksLikeSqlInjection(query)) {
                errors.add("Query contains potentially harmful content");
            }
            if (looksLikeSpam(query)) {
                errors.add("Query appears to be spam");
            }
        }
        if (request != null && request.getSessionId() != null && !SESSION_ID.matcher(request.getSessionId()).matches()) {
            errors.add("Session ID must be 8-64 letters, digits or dashes");
        }
        if (request != null && request.getCustomerId() != null && !CUSTOMER_ID.matcher(request.getCustomerId()).matches()) {
            errors.add("Customer ID must be 3-50 letters or digits");
        }
        if (!errors.isEmpty()) {
            throw new QueryValidationException(errors);
        }
    }

    boolean looksLikeSqlInjection(String query) {
        return SQL_INJECTION.stream().anyMatch(pattern -> pattern.matcher(query).find());
    }

    /**
     * A single word making up more than half of a query of at least four words.
     */
    boolean looksLikeSpam(String query) {
        String[] words = query.toLowerCase(Locale.ROOT).trim().split("\\s+");
        if (words.length < SPAM_MIN_WORDS) {
            return false;
        }
        Map<String, Integer> counts = new HashMap<>();
        int max = 0;
        for (String word : words) {
            max = Math.max(max, counts.merge(word, 1, Integer::sum));
        }
        return max > words.length / 2.0;
    }
}
