package me.golemcore.conductor.domain.service;

import me.golemcore.conductor.domain.model.ModelTier;
import me.golemcore.conductor.domain.model.TurnRequest;
import me.golemcore.conductor.infrastructure.config.ConductorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ModelTierRouterTest {

    private ConductorProperties properties;
    private ModelTierRouter router;

    @BeforeEach
    void setUp() {
        properties = new ConductorProperties();
        router = new ModelTierRouter(properties);
    }

    private ModelTierRouter.TierDecision route(String query) {
        return router.route(TurnRequest.builder().userQuery(query).build());
    }

    @Test
    void shouldHonorExplicitPreferenceFirst() {
        ModelTierRouter.TierDecision decision = router.route(TurnRequest.builder()
                .userQuery("please analyze this in depth")
                .preferredModel("Haiku")
                .costPercentUsed(10.0)
                .build());

        assertEquals(ModelTier.FAST, decision.tier());
        assertEquals(properties.getRouter().getFastModel(), decision.model());
        assertEquals("Using faster model (user preference)", decision.reason());
    }

    @Test
    void shouldIgnoreUnknownPreference() {
        ModelTierRouter.TierDecision decision = router.route(TurnRequest.builder()
                .userQuery("tell me a story about a lighthouse keeper")
                .preferredModel("gpt")
                .build());

        assertEquals(ModelTier.ADVANCED, decision.tier());
        assertEquals("Using advanced model", decision.reason());
    }

    @Test
    void shouldDowngradeWhenBudgetIsNearlySpent() {
        ModelTierRouter.TierDecision decision = router.route(TurnRequest.builder()
                .userQuery("analyze the attached contract")
                .costPercentUsed(85.0)
                .build());

        assertEquals(ModelTier.FAST, decision.tier());
        assertEquals("Using faster model (budget at 85.0%)", decision.reason());
    }

    @Test
    void shouldPreferComplexOverSimpleKeywords() {
        ModelTierRouter.TierDecision decision = route("Analyze and count the words in this essay");

        assertEquals(ModelTier.ADVANCED, decision.tier());
        assertEquals("Using advanced model for complex task", decision.reason());
    }

    @Test
    void shouldRouteSimpleKeywordsToFastTier() {
        assertEquals("Using faster model for simple task", route("Convert 5 miles to km").reason());
    }

    @Test
    void shouldRouteShortQuestionsToFastTier() {
        ModelTierRouter.TierDecision decision = route("Who wrote Hamlet?");

        assertEquals(ModelTier.FAST, decision.tier());
        assertEquals("Using faster model for quick question", decision.reason());
    }

    @Test
    void shouldUseAdvancedTierForAttachments() {
        ModelTierRouter.TierDecision decision = router.route(TurnRequest.builder()
                .userQuery("Here is my receipt from yesterday's dinner")
                .files(List.of("/tmp/receipt.jpg"))
                .build());

        assertEquals(ModelTier.ADVANCED, decision.tier());
        assertEquals("Using advanced model for file analysis", decision.reason());
    }

    @Test
    void shouldUseConfiguredModelNames() {
        properties.getRouter().setBalancedModel("custom-balanced");

        assertEquals("custom-balanced", router.route(TurnRequest.builder()
                .userQuery("x")
                .preferredModel("sonnet")
                .build()).model());
    }
}
