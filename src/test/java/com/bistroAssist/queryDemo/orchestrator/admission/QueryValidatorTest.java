package com.bistroAssist.queryDemo.orchestrator.admission;

import com.bistroAssist.queryDemo.config.AssistantProperties;
import com.bistroAssist.queryDemo.orchestrator.dto.QueryRequest;
import com.bistroAssist.queryDemo.orchestrator.exception.QueryValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryValidatorTest {

    private final QueryValidator validator = new QueryValidator(new AssistantProperties());

    @Test
    void wellFormedQueryPasses() {
        QueryRequest request = QueryRequest.builder()
                .query("Do you have vegan pizza?")
                .sessionId("session-1234")
                .customerId("cust123")
                .build();

        assertDoesNotThrow(() -> validator.validate("bella-vista", request));
    }

    @Test
    void everyProblemIsReportedAtOnce() {
        QueryRequest request = QueryRequest.builder()
                .query(" ")
                .sessionId("short")
                .customerId("no spaces allowed")
                .build();

        QueryValidationException ex = assertThrows(QueryValidationException.class, () -> validator.validate("", request));

        assertEquals(4, ex.getErrors().size());
        assertTrue(ex.getErrors().contains("Business ID is required"));
        assertTrue(ex.getErrors().contains("Query text is required"));
    }

    @Test
    void overlongQueryIsRejected() {
        QueryRequest request = QueryRequest.builder().query("a".repeat(2001)).build();

        QueryValidationException ex = assertThrows(QueryValidationException.class,
                () -> validator.validate("bella-vista", request));

        assertEquals("Query exceeds maximum length of 2000 characters", ex.getErrors().get(0));
    }

    @Test
    void sqlInjectionShapesAreFlagged() {
        assertTrue(validator.looksLikeSqlInjection("1 UNION SELECT password FROM users"));
        assertTrue(validator.looksLikeSqlInjection("pizza'; drop table menu"));
        assertTrue(validator.looksLikeSqlInjection("x'; exec(xp_cmdshell 'dir')"));
        assertTrue(validator.looksLikeSqlInjection("1 and sleep(5)"));
        assertFalse(validator.looksLikeSqlInjection("Can I book a table for four?"));
    }

    @Test
    void everydayQuestionsWithSqlWordsPass() {
        for (String query : List.of(
                "Can I select a table by the window for Friday?",
                "Is the soup vegan; and is the bread gluten free?",
                "How do I update my booking for the table where we sat last week?",
                "Kids menu -- do you have one?")) {
            QueryRequest request = QueryRequest.builder().query(query).build();

            assertDoesNotThrow(() -> validator.validate("bella-vista", request), query);
        }
    }

    @Test
    void repeatedWordIsSpam() {
        assertTrue(validator.looksLikeSpam("buy buy buy now"));
        assertFalse(validator.looksLikeSpam("pizza pizza pizza"));
        assertFalse(validator.looksLikeSpam("what is the soup of the day"));
    }
}
