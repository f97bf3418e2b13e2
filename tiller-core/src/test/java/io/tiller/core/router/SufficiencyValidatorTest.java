package io.tiller.core.router;

import static org.assertj.core.api.Assertions.assertThat;

import io.tiller.core.router.ValidationDecision.Verdict;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SufficiencyValidatorTest {

    private SufficiencyValidator validator;

    @BeforeEach
    void setUp() {
        validator =
                new SufficiencyValidator(
                        SufficiencyThreshold.defaults(), 2, 4, ConsentMode.EITHER);
    }

    private static List<ResultItem> items(String... names) {
        return Arrays.stream(names)
                .map(n -> ResultItem.of(n, BigDecimal.TEN))
                .toList();
    }

    private ValidationDecision validate(
            String intent, int tier, List<ResultItem> items, ConsentFlags consent) {
        return validator.validate(intent, tier, items, List.of(), items.size(), List.of(), consent);
    }

    @Nested
    class Escalation {

        @Test
        void shouldBeSufficientWhenThresholdMet() {
            assertThat(validate("product", 1, items("a", "b", "c"), ConsentFlags.none()).verdict())
                    .isEqualTo(Verdict.SUFFICIENT);
        }

        @Test
        void shouldEscalateAutomaticallyToTierTwo() {
            ValidationDecision decision = validate("product", 1, items("a"), ConsentFlags.none());

            assertThat(decision.verdict()).isEqualTo(Verdict.ESCALATE);
            assertThat(decision.nextTier()).isEqualTo(2);
        }

        @Test
        void shouldRequireConsentForTierThree() {
            ValidationDecision decision = validate("product", 2, items("a"), ConsentFlags.none());

            assertThat(decision.verdict()).isEqualTo(Verdict.CONSENT_REQUIRED);
            assertThat(decision.nextTier()).isEqualTo(3);
            assertThat(decision.consentType()).isEqualTo(ConsentType.PER_QUERY);
            assertThat(decision.message()).isEqualTo("Search deeper?");
        }

        @Test
        void shouldEscalateToGatedTierWithStandingOptIn() {
            ValidationDecision decision =
                    validate("product", 2, items("a"), new ConsentFlags(true, false));

            assertThat(decision.verdict()).isEqualTo(Verdict.ESCALATE);
            assertThat(decision.nextTier()).isEqualTo(3);
        }

        @Test
        void shouldStopAfterMaxTier() {
            ValidationDecision decision =
                    validate("product", 4, items("a"), new ConsentFlags(true, true));

            assertThat(decision.verdict()).isEqualTo(Verdict.MAX_TIER_REACHED);
            assertThat(decision.message()).isEqualTo("Showing results from available sources");
        }

        @Test
        void shouldAskForAccountToggleFirstWhenBothAreRequired() {
            SufficiencyValidator strict =
                    new SufficiencyValidator(SufficiencyThreshold.defaults(), 2, 4, ConsentMode.BOTH);

            ValidationDecision decision =
                    strict.validate(
                            "product",
                            2,
                            items("a"),
                            List.of(),
                            1,
                            List.of(),
                            new ConsentFlags(false, true));

            assertThat(decision.verdict()).isEqualTo(Verdict.CONSENT_REQUIRED);
            assertThat(decision.consentType()).isEqualTo(ConsentType.ACCOUNT_TOGGLE);
        }
    }

    @Nested
    class Thresholds {

        @Test
        void shouldRequireEveryRequestedItemForComparison() {
            List<ResultItem> found = items("Sony WH-1000XM5 Headphones", "Bose QC45");

            assertThat(
                            validator.isSufficient(
                                    "comparison", found, List.of(), 2, List.of("sony", "bose")))
                    .isTrue();
            assertThat(
                            validator.isSufficient(
                                    "comparison", found, List.of(), 2, List.of("sony", "apple")))
                    .isFalse();
        }

        @Test
        void shouldNeedTwoItemsForComparisonWithoutRequestedItems() {
            assertThat(validator.isSufficient("comparison", items("a"), List.of(), 1, List.of()))
                    .isFalse();
            assertThat(validator.isSufficient("comparison", items("a", "b"), List.of(), 1, List.of()))
                    .isTrue();
        }

        @Test
        void shouldCountSnippetsAndSourcesForReviews() {
            List<String> snippets = List.of("s1", "s2", "s3", "s4", "s5");

            assertThat(validator.isSufficient("review_deep_dive", List.of(), snippets, 1, List.of()))
                    .isFalse();
            assertThat(validator.isSufficient("review_deep_dive", List.of(), snippets, 2, List.of()))
                    .isTrue();
        }

        @Test
        void shouldNeedOneItemForUnknownIntent() {
            assertThat(validator.isSufficient("misc", items("a"), List.of(), 1, List.of())).isTrue();
            assertThat(validator.isSufficient("misc", List.of(), List.of(), 0, List.of())).isFalse();
        }
    }
}
