package com.bistroAssist.queryDemo.context.store;

import com.bistroAssist.queryDemo.context.model.BusinessFacts;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsonBusinessFactsStoreTest {

    @Test
    void seedFileIsLoadedById() {
        JsonBusinessFactsStore store = new JsonBusinessFactsStore("data/businesses.json");

        BusinessFacts facts = store.findBusiness("bella-vista").orElseThrow();

        assertEquals("Bella Vista Trattoria", facts.getName());
        assertEquals("closed", facts.getOperatingHours().get("monday"));
        assertEquals("214 Harbor Street, Portland, ME, 04101", facts.getLocation().formatted());
        assertTrue(store.exists("green-bowl"));
        assertFalse(store.exists("unknown"));
        assertTrue(store.findBusiness(null).isEmpty());
    }

    @Test
    void missingFileYieldsEmptyStore() {
        JsonBusinessFactsStore store = new JsonBusinessFactsStore("data/does-not-exist.json");

        assertTrue(store.findBusiness("bella-vista").isEmpty());
    }

    @Test
    void documentWithoutOptionalSectionsMapsToBareFacts() {
        BusinessFacts facts = JsonBusinessFactsStore.toBusinessFacts("solo",
                Document.parse("{\"name\": \"Solo\", \"specials\": [\"Soup\", null]}"));

        assertEquals("solo", facts.getBusinessId());
        assertNull(facts.getLocation());
        assertTrue(facts.getOperatingHours().isEmpty());
        assertEquals(1, facts.getSpecials().size());
    }
}
