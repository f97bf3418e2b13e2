package io.tiller.core.execution;

import io.tiller.core.router.ConsentPrompt;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/// Outcomes of one plan execution, in plan order.
///
/// @param outcomes outcomes of every capability that ran, never null
/// @param consentHalt where execution stopped for consent, null if it ran to the end
public record ExecutionReport(List<CapabilityOutcome> outcomes, ConsentHalt consentHalt) {

    public ExecutionReport {
        outcomes = outcomes != null ? List.copyOf(outcomes) : List.of();
    }

    public static ExecutionReport completed(List<CapabilityOutcome> outcomes) {
        return new ExecutionReport(outcomes, null);
    }

    /// Returns whether execution stopped early for consent.
    public boolean halted() {
        return consentHalt != null;
    }

    public Optional<CapabilityOutcome> outcome(String capability) {
        return outcomes.stream().filter(o -> o.capability().equals(capability)).findFirst();
    }

    /// Returns the first consent prompt raised by any capability.
    ///
    /// @return prompt, empty if no capability asked for consent
    public Optional<ConsentPrompt> consentPrompt() {
        return outcomes.stream()
                .filter(o -> o.status() == OutcomeStatus.CONSENT_REQUIRED)
                .map(CapabilityOutcome::consentPrompt)
                .filter(Objects::nonNull)
                .findFirst();
    }

    public List<String> failedCapabilities() {
        return outcomes.stream()
                .filter(CapabilityOutcome::isFailure)
                .map(CapabilityOutcome::capability)
                .toList();
    }

    public Map<String, Map<String, Object>> outputs() {
        return outcomes.stream()
                .collect(
                        Collectors.toMap(
                                CapabilityOutcome::capability,
                                CapabilityOutcome::output,
                                (a, b) -> a,
                                LinkedHashMap::new));
    }
}
