package me.golemcore.conductor.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TurnBudgetTest {

    @Test
    void shouldRefuseToolCallsPastCeilingWithoutCounting() {
        TurnBudget budget = new TurnBudget(10, 2);

        assertTrue(budget.tryReserveToolCall("search"));
        assertTrue(budget.tryReserveToolCall("ocr"));
        assertFalse(budget.isToolCallRefused());
        assertFalse(budget.tryReserveToolCall("search"));

        assertEquals(2, budget.getToolCalls());
        assertTrue(budget.isToolCallRefused());
    }

    @Test
    void shouldListDistinctToolsSorted() {
        TurnBudget budget = new TurnBudget(10, 10);
        budget.tryReserveToolCall("web_search");
        budget.tryReserveToolCall("calendar");
        budget.tryReserveToolCall("web_search");

        assertEquals(List.of("calendar", "web_search"), budget.getToolsUsed());
    }

    @Test
    void shouldExhaustAfterLastIteration() {
        TurnBudget budget = new TurnBudget(2, 10);

        assertEquals(1, budget.startIteration());
        assertTrue(budget.hasIterationsLeft());
        assertEquals(2, budget.startIteration());
        assertFalse(budget.hasIterationsLeft());
    }

    @Test
    void shouldAccumulateTokenUsage() {
        TurnBudget budget = new TurnBudget(5, 5);
        budget.recordUsage(LlmUsage.of(100, 20));
        budget.recordUsage(null);
        budget.recordUsage(LlmUsage.of(50, 5));

        assertEquals(150, budget.getInputTokens());
        assertEquals(25, budget.getOutputTokens());
    }
}
