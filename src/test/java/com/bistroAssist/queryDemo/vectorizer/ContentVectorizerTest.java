package com.bistroAssist.queryDemo.vectorizer;

import com.bistroAssist.queryDemo.config.AssistantProperties;
import com.bistroAssist.queryDemo.vectorizer.exception.InvalidContentException;
import com.bistroAssist.queryDemo.vectorizer.model.ContentType;
import com.bistroAssist.queryDemo.vectorizer.model.ProcessedContent;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContentVectorizerTest {

    private static ContentVectorizer vectorizer(int maxTokens) {
        AssistantProperties properties = new AssistantProperties();
        properties.getVectorizer().setMaxTokens(maxTokens);
        return new ContentVectorizer(properties);
    }

    @Test
    void menuItemIsAssembledWithLabelledFields() {
        ProcessedContent processed = vectorizer(8000).process(ContentType.MENU, Map.of(
                "name", "Margherita",
                "description", "Tomato, mozzarella and basil",
                "category", "Pizza",
                "price", 12.5,
                "allergens", List.of("gluten", "dairy")));

        assertEquals("Margherita - Tomato, mozzarella and basil - Category: Pizza - Price: $12.50 - Allergens: gluten, dairy",
                processed.text());
        assertEquals("MENU", processed.metadata().get("contentType"));
        assertEquals("Pizza", processed.metadata().get("category"));
        assertFalse(processed.metadata().containsKey("truncated"));
    }

    @Test
    void faqRequiresQuestionAndAnswer() {
        InvalidContentException ex = assertThrows(InvalidContentException.class,
                () -> vectorizer(8000).process(ContentType.FAQ, Map.of("question", "Do you deliver?")));

        assertTrue(ex.getMessage().contains("answer"));
    }

    @Test
    void controlCharactersAndRepeatedWhitespaceAreCleaned() {
        assertEquals("Closed on public holidays", vectorizer(8000).clean("  Closed\u0000 on\t\tpublic \n holidays  "));
    }

    @Test
    void longContentIsCutAtWordBoundaryWithinBudget() {
        // Given
        ContentVectorizer vectorizer = vectorizer(20);
        String content = "word ".repeat(60).trim();

        // When
        ProcessedContent processed = vectorizer.process(ContentType.POLICY, Map.of("title", "Refunds", "content", content));

        // Then
        assertTrue(processed.tokenEstimate() <= 20, "token estimate " + processed.tokenEstimate());
        assertTrue(processed.text().endsWith("..."));
        String kept = processed.text().substring(0, processed.text().length() - 3);
        assertFalse(kept.endsWith(" "));
        assertTrue(kept.endsWith("word") || kept.endsWith("Refunds"), kept);
        assertEquals(true, processed.metadata().get("truncated"));
    }

    @Test
    void budgetHoldsForEveryBudgetSize() {
        String content = "The quick brown fox jumps over the lazy dog ".repeat(40);
        for (int budget = 1; budget <= 120; budget++) {
            ProcessedContent processed = vectorizer(budget)
                    .process(ContentType.FAQ, Map.of("question", "Why?", "answer", content));
            assertTrue(processed.tokenEstimate() <= budget, "budget " + budget + " gave " + processed.tokenEstimate());
        }
    }

    @Test
    void searchableContentIsLowerCasedKeywords() {
        String searchable = vectorizer(8000).extractSearchableContent(ContentType.MENU,
                Map.of("name", "Tiramisu", "category", "Dessert", "ingredients", List.of("Mascarpone", "Espresso")));

        assertEquals("tiramisu dessert mascarpone, espresso", searchable);
    }
}
