package com.bistroAssist.queryDemo.vectorizer;

import com.bistroAssist.queryDemo.config.AssistantProperties;
import com.bistroAssist.queryDemo.vectorizer.exception.InvalidContentException;
import com.bistroAssist.queryDemo.vectorizer.model.ContentType;
import com.bistroAssist.queryDemo.vectorizer.model.ProcessedContent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Content vectorizer - turns raw business content into normalized text for embedding.
 * 
 * Responsibilities:
 * - Validate the fields each content type requires
 * - Assemble a single descriptive line per item
 * - Clean control characters and whitespace
 * - Keep the text within the token budget
 */
@Slf4j
@Component
public class ContentVectorizer {

    private static final String SEPARATOR = " - ";
    private static final int CHARS_PER_TOKEN = 4;
    private static final double TRUNCATION_RATIO = 0.9;
    private static final String ELLIPSIS = "...";

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cntrl}&&[^\\s]]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int maxTokens;

    public ContentVectorizer(AssistantProperties properties) {
        this.maxTokens = Math.max(1, properties.getVectorizer().getMaxTokens());
    }

    /**
     * Builds normalized text for one content item.
     *
     * @param contentType Type of the content
     * @param data        Raw fields as submitted
     * @return Processed content whose token estimate never exceeds the budget
     * @throws InvalidContentException if a required field is missing
     */
    public ProcessedContent process(ContentType contentType, Map<String, Object> data) {
        if (contentType == null) {
            throw new InvalidContentException("Content type is required");
        }
        Map<String, Object> fields = data != null ? data : Map.of();
        validate(contentType, fields);

        String assembled = switch (contentType) {
            case MENU -> assembleMenu(fields);
            case POLICY -> assemblePolicy(fields);
            case FAQ -> assembleFaq(fields);
            case BUSINESS -> assembleBusiness(fields);
        };

        String cleaned = clean(assembled);
        String text = truncate(cleaned);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("contentType", contentType.name());
        metadata.putAll(salientFields(contentType, fields));
        metadata.put("originalLength", cleaned.length());
        metadata.put("processedLength", text.length());
        if (text.length() < cleaned.length()) {
            metadata.put("truncated", true);
        }

        return new ProcessedContent(text, estimateTokens(text), metadata);
    }

    /**
     * Builds a short keyword line for an item, used for snippets and previews.
     */
    public String extractSearchableContent(ContentType contentType, Map<String, Object> data) {
        Map<String, Object> fields = data != null ? data : Map.of();
        List<String> parts = new ArrayList<>();
        switch (contentType) {
            case MENU -> {
                addIfPresent(parts, fields.get("name"));
                addIfPresent(parts, fields.get("category"));
                addIfPresent(parts, joinList(fields.get("ingredients")));
            }
            case POLICY -> {
                addIfPresent(parts, fields.get("title"));
                addIfPresent(parts, fields.get("type"));
            }
            case FAQ -> {
                addIfPresent(parts, fields.get("question"));
                addIfPresent(parts, joinList(fields.get("tags")));
            }
            case BUSINESS -> {
                addIfPresent(parts, fields.get("name"));
                addIfPresent(parts, fields.get("cuisine"));
            }
        }
        return clean(String.join(" ", parts)).toLowerCase(Locale.ROOT);
    }

    /**
     * Cleans free text the same way indexed content is cleaned.
     */
    public String clean(String text) {
        if (text == null) {
            return "";
        }
        String withoutControls = CONTROL_CHARS.matcher(text).replaceAll("");
        return WHITESPACE.matcher(withoutControls).replaceAll(" ").trim();
    }

    public int estimateTokens(String text) {
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    String truncate(String text) {
        if (estimateTokens(text) <= maxTokens) {
            return text;
        }
        int cut = (int) (maxTokens * CHARS_PER_TOKEN * TRUNCATION_RATIO);
        String head = text.substring(0, Math.min(cut, text.length()));
        int lastSpace = head.lastIndexOf(' ');
        if (lastSpace > 0) {
            head = head.substring(0, lastSpace);
        }
        int hardLimit = maxTokens * CHARS_PER_TOKEN - ELLIPSIS.length();
        if (head.length() > hardLimit) {
            head = head.substring(0, Math.max(0, hardLimit));
        }
        log.debug("Truncated content - originalChars: {}, keptChars: {}, budget: {}", text.length(), head.length(), maxTokens);
        return head + ELLIPSIS;
    }

    private void validate(ContentType contentType, Map<String, Object> fields) {
        List<String> required = switch (contentType) {
            case MENU, BUSINESS -> List.of("name");
            case POLICY -> List.of("title", "content");
            case FAQ -> List.of("question", "answer");
        };
        List<String> missing = required.stream()
                .filter(field -> isBlank(fields.get(field)))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new InvalidContentException(contentType + " content is missing required field(s): " + String.join(", ", missing));
        }
    }

    private String assembleMenu(Map<String, Object> fields) {
        List<String> parts = new ArrayList<>();
        addIfPresent(parts, fields.get("name"));
        addIfPresent(parts, fields.get("description"));
        addLabelled(parts, "Category", fields.get("category"));
        Object price = fields.get("price");
        if (price instanceof Number) {
            parts.add(String.format(Locale.ROOT, "Price: $%.2f", ((Number) price).doubleValue()));
        } else if (!isBlank(price)) {
            parts.add("Price: " + price);
        }
        addLabelled(parts, "Allergens", joinList(fields.get("allergens")));
        addLabelled(parts, "Calories", fields.get("calories"));
        Object prepTime = fields.get("preparationTime");
        if (!isBlank(prepTime)) {
            parts.add("Prep time: " + prepTime + " minutes");
        }
        return String.join(SEPARATOR, parts);
    }

    private String assemblePolicy(Map<String, Object> fields) {
        List<String> parts = new ArrayList<>();
        addIfPresent(parts, fields.get("title"));
        addIfPresent(parts, fields.get("content"));
        addLabelled(parts, "Type", fields.get("type"));
        addLabelled(parts, "Effective", formatDate(fields.get("effectiveDate")));
        return String.join(SEPARATOR, parts);
    }

    private String assembleFaq(Map<String, Object> fields) {
        List<String> parts = new ArrayList<>();
        addLabelled(parts, "Question", fields.get("question"));
        addLabelled(parts, "Answer", fields.get("answer"));
        addLabelled(parts, "Category", fields.get("category"));
        addLabelled(parts, "Tags", joinList(fields.get("tags")));
        return String.join(SEPARATOR, parts);
    }

    private String assembleBusiness(Map<String, Object> fields) {
        List<String> parts = new ArrayList<>();
        addIfPresent(parts, fields.get("name"));
        addIfPresent(parts, fields.get("description"));
        addLabelled(parts, "Cuisine", fields.get("cuisine"));
        addLabelled(parts, "Location", fields.get("location"));
        addLabelled(parts, "Industry", fields.get("industry"));
        return String.join(SEPARATOR, parts);
    }

    private Map<String, Object> salientFields(ContentType contentType, Map<String, Object> fields) {
        List<String> keys = switch (contentType) {
            case MENU -> List.of("name", "category", "price", "allergens", "dietaryInfo");
            case POLICY -> List.of("title", "type", "effectiveDate");
            case FAQ -> List.of("question", "category", "tags");
            case BUSINESS -> List.of("name", "cuisine", "industry");
        };
        Map<String, Object> salient = new LinkedHashMap<>();
        for (String key : keys) {
            Object value = fields.get(key);
            if (!isBlank(value)) {
                salient.put(key, value);
            }
        }
        return salient;
    }

    private static String formatDate(Object value) {
        if (isBlank(value)) {
            return null;
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).format(DateTimeFormatter.ISO_LOCAL_DATE);
        }
        String raw = value.toString();
        try {
            return OffsetDateTime.parse(raw).toLocalDate().format(DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeParseException e) {
            return raw;
        }
    }

    private static String joinList(Object value) {
        if (value instanceof Collection) {
            Collection<?> collection = (Collection<?>) value;
            if (collection.isEmpty()) {
                return null;
            }
            return collection.stream().map(String::valueOf).collect(Collectors.joining(", "));
        }
        return value != null ? value.toString() : null;
    }

    private static void addLabelled(List<String> parts, String label, Object value) {
        if (!isBlank(value)) {
            parts.add(label + ": " + value);
        }
    }

    private static void addIfPresent(List<String> parts, Object value) {
        if (!isBlank(value)) {
            parts.add(value.toString());
        }
    }

    private static boolean isBlank(Object value) {
        return value == null || value.toString().isBlank();
    }
}
