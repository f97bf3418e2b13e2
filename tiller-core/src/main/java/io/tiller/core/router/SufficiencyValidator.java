package io.tiller.core.router;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/// Decides whether the cumulative results of a request are good enough.
///
/// ### Rules
/// 1. Results meeting the intent's {@link SufficiencyThreshold} are `SUFFICIENT`.
/// 2. Otherwise the next tier is `ESCALATE` when it is at most `maxAutoTier`.
/// 3. A gated next tier (up to `maxTier`) is `ESCALATE` when consent is present,
///    `CONSENT_REQUIRED` otherwise.
/// 4. Beyond `maxTier` the result is `MAX_TIER_REACHED`.
///
/// Intents without a threshold need at least one item.
///
/// @implNote Thread-safe. Immutable.
public class SufficiencyValidator {

    private static final SufficiencyThreshold FALLBACK = SufficiencyThreshold.items(1);

    private final Map<String, SufficiencyThreshold> thresholds;
    private final int maxAutoTier;
    private final int maxTier;
    private final ConsentMode consentMode;

    /// Creates a validator.
    ///
    /// @param thresholds intent to threshold, not null
    /// @param maxAutoTier highest tier entered without consent, >= 1
    /// @param maxTier highest tier the router may enter, >= `maxAutoTier`
    /// @param consentMode how consent flags combine, not null
    public SufficiencyValidator(
            Map<String, SufficiencyThreshold> thresholds,
            int maxAutoTier,
            int maxTier,
            ConsentMode consentMode) {
        this.thresholds = Map.copyOf(Objects.requireNonNull(thresholds, "thresholds must not be null"));
        if (maxAutoTier < 1 || maxTier < maxAutoTier) {
            throw new IllegalArgumentException("require 1 <= maxAutoTier <= maxTier");
        }
        this.maxAutoTier = maxAutoTier;
        this.maxTier = maxTier;
        this.consentMode = Objects.requireNonNull(consentMode, "consentMode must not be null");
    }

    /// Validates cumulative results after a tier has been fetched.
    ///
    /// @param intent classified intent, not null
    /// @param currentTier tier just fetched, >= 1
    /// @param items deduplicated items so far, not null
    /// @param snippets snippets so far, not null
    /// @param sourceCount distinct successful sources so far
    /// @param requestedItems items the user asked to compare, not null (may be empty)
    /// @param consent consent flags of the request, not null
    /// @return the decision, never null
    public ValidationDecision validate(
            String intent,
            int currentTier,
            List<ResultItem> items,
            List<String> snippets,
            int sourceCount,
            List<String> requestedItems,
            ConsentFlags consent) {
        if (isSufficient(intent, items, snippets, sourceCount, requestedItems)) {
            return ValidationDecision.sufficient();
        }
        int nextTier = currentTier + 1;
        if (nextTier <= maxAutoTier) {
            return ValidationDecision.escalate(nextTier);
        }
        if (nextTier <= maxTier) {
            return consent.satisfies(consentMode)
                    ? ValidationDecision.escalate(nextTier)
                    : ValidationDecision.consentRequired(nextTier, consent.missing(consentMode));
        }
        return ValidationDecision.maxTierReached();
    }

    /// Returns whether results satisfy an intent's threshold.
    ///
    /// @param intent classified intent, not null
    /// @param items deduplicated items, not null
    /// @param snippets snippets, not null
    /// @param sourceCount distinct successful sources
    /// @param requestedItems items the user asked about, not null
    /// @return true if sufficient
    public boolean isSufficient(
            String intent,
            List<ResultItem> items,
            List<String> snippets,
            int sourceCount,
            List<String> requestedItems) {
        SufficiencyThreshold threshold = thresholds.getOrDefault(intent, FALLBACK);
        if (threshold.requireAllItems() && !coversRequested(items, requestedItems)) {
            return false;
        }
        return items.size() >= threshold.minItems()
                && snippets.size() >= threshold.minSnippets()
                && sourceCount >= threshold.minSources();
    }

    public boolean isGated(int tier) {
        return tier > maxAutoTier;
    }

    public int maxTier() {
        return maxTier;
    }

    public ConsentMode consentMode() {
        return consentMode;
    }

    /// Without named items a comparison needs two results; otherwise every requested
    /// name must occur in some result name, case-insensitively.
    private static boolean coversRequested(List<ResultItem> items, List<String> requestedItems) {
        if (requestedItems.isEmpty()) {
            return items.size() >= 2;
        }
        for (String requested : requestedItems) {
            String needle = requested.toLowerCase(Locale.ROOT);
            boolean found =
                    items.stream()
                            .anyMatch(i -> i.name().toLowerCase(Locale.ROOT).contains(needle));
            if (!found) {
                return false;
            }
        }
        return true;
    }
}
