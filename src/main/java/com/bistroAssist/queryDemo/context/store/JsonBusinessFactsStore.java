package com.bistroAssist.queryDemo.context.store;

import com.bistroAssist.queryDemo.context.model.BusinessFacts;
import com.bistroAssist.queryDemo.util.JsonFileLoader;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Business profiles loaded from a classpath JSON array.
 * Each element is an object keyed by {@code _id}, parsed into a BSON {@link Document}
 * and mapped to {@link BusinessFacts}.
 */
@Slf4j
@Repository
public class JsonBusinessFactsStore implements BusinessFactsStore {

    private final Map<String, BusinessFacts> businesses;

    public JsonBusinessFactsStore(@Value("${assistant.data.businesses-file:data/businesses.json}") String resourcePath) {
        this.businesses = load(resourcePath);
    }

    @Override
    public Optional<BusinessFacts> findBusiness(String businessId) {
        if (businessId == null) {
            return Optional.empty();
        }
        BusinessFacts facts = businesses.get(businessId);
        if (facts == null) {
            log.debug("No business found with _id: {}", businessId);
        }
        return Optional.ofNullable(facts);
    }

    private static Map<String, BusinessFacts> load(String resourcePath) {
        Map<String, BusinessFacts> loaded = new LinkedHashMap<>();
        try {
            JsonNode jsonArray = JsonFileLoader.loadAsJsonNode(resourcePath);
            if (!jsonArray.isArray()) {
                log.error("JSON file {} does not contain an array", resourcePath);
                return Collections.emptyMap();
            }
            for (JsonNode jsonObject : jsonArray) {
                Document document = Document.parse(jsonObject.toString());
                String id = document.getString("_id");
                if (id == null || id.isBlank()) {
                    log.warn("Skipping business without _id in {}", resourcePath);
                    continue;
                }
                loaded.put(id, toBusinessFacts(id, document));
            }
            log.info("Loaded business profiles - file: {}, count: {}", resourcePath, loaded.size());
        } catch (IOException e) {
            log.error("Failed to load JSON file: {}", resourcePath, e);
        }
        return Collections.unmodifiableMap(loaded);
    }

    static BusinessFacts toBusinessFacts(String id, Document document) {
        BusinessFacts.BusinessFactsBuilder builder = BusinessFacts.builder()
                .businessId(id)
                .name(document.getString("name"))
                .description(document.getString("description"))
                .cuisine(document.getString("cuisine"))
                .industry(document.getString("industry"))
                .phone(document.getString("phone"))
                .website(document.getString("website"))
                .timezone(document.getString("timezone"))
                .customInstructions(document.getString("customInstructions"));

        Document location = document.get("location", Document.class);
        if (location != null) {
            builder.location(BusinessFacts.Location.builder()
                    .address(location.getString("address"))
                    .city(location.getString("city"))
                    .state(location.getString("state"))
                    .zipCode(location.getString("zipCode"))
                    .deliveryAreas(stringList(location, "deliveryAreas"))
                    .build());
        }

        Document hours = document.get("operatingHours", Document.class);
        if (hours != null) {
            hours.forEach((day, value) -> {
                if (value != null) {
                    builder.operatingHour(day.toLowerCase(), value.toString());
                }
            });
        }

        builder.specials(stringList(document, "specials"));
        return builder.build();
    }

    private static List<String> stringList(Document document, String key) {
        Object value = document.get(key);
        if (!(value instanceof List)) {
            return List.of();
        }
        return ((List<?>) value).stream()
                .filter(item -> item != null)
                .map(Object::toString)
                .toList();
    }
}
