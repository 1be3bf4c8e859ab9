package com.scoutiq.ai.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.scoutiq.ai.config.RetrievalConfig;
import com.scoutiq.ai.model.ConversationState;
import com.scoutiq.common.enums.SearchStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PlannerServiceTest {

    private RetrievalConfig config;
    private PlannerService planner;

    @BeforeEach
    void setUp() {
        config = new RetrievalConfig();
        planner = new PlannerService(config);
    }

    @Test
    void plansHybridSearchWithBudgetAndCategory() {
        ConversationState state = new ConversationState("eco stainless steel cleaner under $15");

        planner.plan(state);

        assertThat(state.getConstraints().getMaxPrice()).isEqualTo(15.0);
        assertThat(state.getConstraints().getCategory()).isEqualTo("Cleaning Supplies");
        assertThat(state.getConstraints().getKeywords()).containsExactly("eco", "stainless", "steel", "cleaner");
        assertThat(state.getStrategy()).isEqualTo(SearchStrategy.HYBRID);
        assertThat(state.getSteps()).extracting("node").containsExactly("planner");
    }

    @Test
    void recognizesBudgetPhrasings() {
        assertThat(PlannerService.extractBudget("headphones below 20 dollars")).isEqualTo(20.0);
        assertThat(PlannerService.extractBudget("a mug less than 30")).isEqualTo(30.0);
        assertThat(PlannerService.extractBudget("cheaper than $40.50 please")).isEqualTo(40.50);
        assertThat(PlannerService.extractBudget("max $25 toy")).isEqualTo(25.0);
        assertThat(PlannerService.extractBudget("at most 10 usd")).isEqualTo(10.0);
        assertThat(PlannerService.extractBudget("budget of $1,200 laptop")).isEqualTo(1200.0);
        assertThat(PlannerService.extractBudget("soap $15 or less")).isEqualTo(15.0);
    }

    @Test
    void ignoresMissingOrImplausibleBudgets() {
        assertThat(PlannerService.extractBudget("usb-c cable 6ft")).isNull();
        assertThat(PlannerService.extractBudget("under $0")).isNull();
        assertThat(PlannerService.extractBudget("under $20000 tv")).isNull();
        assertThat(PlannerService.extractBudget("lightweight tent under 5 pounds")).isNull();
        assertThat(PlannerService.extractBudget("laptop with at most 16 GB ram")).isNull();
        assertThat(PlannerService.extractBudget("coffee maker shipping within 2 days")).isNull();
        assertThat(PlannerService.extractBudget("tent for up to 3 people")).isNull();
        assertThat(PlannerService.extractBudget("backpack under 2.5 lbs")).isNull();
        assertThat(PlannerService.extractBudget("monitor below 27\" wide")).isNull();
        assertThat(PlannerService.extractBudget("under $12.999")).isNull();
    }

    @Test
    void unitWordsDoNotHideARealBudget() {
        assertThat(PlannerService.extractBudget("tent for up to 3 people under $150")).isEqualTo(150.0);
        assertThat(PlannerService.extractBudget("headphones under 30 in black")).isEqualTo(30.0);
        assertThat(PlannerService.extractBudget("blender under 60 for smoothies")).isEqualTo(60.0);
    }

    @Test
    void keywordsDropStopwordsAndNumbers() {
        assertThat(PlannerService.extractKeywords("I want the best 2 pack of dog toys under 20 bucks"))
            .containsExactly("pack", "dog", "toys");
        assertThat(PlannerService.categoryFor(PlannerService.extractKeywords("dog toys"))).isEqualTo("Pet Supplies");
        assertThat(PlannerService.categoryFor(PlannerService.extractKeywords("wireless earbuds")))
            .isEqualTo("Electronics");
    }

    @Test
    void noKeywordsMeansCatalogOnly() {
        ConversationState state = new ConversationState("something under $10");

        planner.plan(state);

        assertThat(state.getConstraints().getKeywords()).isEmpty();
        assertThat(state.getStrategy()).isEqualTo(SearchStrategy.CATALOG_ONLY);
    }

    @Test
    void namedRetailerMeansWebOnly() {
        ConversationState state = new ConversationState("wireless earbuds on amazon");

        planner.plan(state);

        assertThat(state.getStrategy()).isEqualTo(SearchStrategy.WEB_ONLY);
    }

    @Test
    void disabledSourceNarrowsStrategy() {
        config.setWebEnabled(false);
        ConversationState catalogOnly = new ConversationState("wireless earbuds on amazon");
        planner.plan(catalogOnly);

        config.setWebEnabled(true);
        config.setCatalogEnabled(false);
        ConversationState webOnly = new ConversationState("steel cleaner");
        planner.plan(webOnly);

        assertThat(catalogOnly.getStrategy()).isEqualTo(SearchStrategy.CATALOG_ONLY);
        assertThat(webOnly.getStrategy()).isEqualTo(SearchStrategy.WEB_ONLY);
    }
}
