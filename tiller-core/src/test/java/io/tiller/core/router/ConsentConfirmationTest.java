package io.tiller.core.router;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ConsentConfirmationTest {

    @Test
    void shouldAcceptConfirmAction() {
        assertThat(ConsentConfirmation.isConfirmation("consent_confirm", null)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"yes", " Search deeper ", "OK", "yes please", "go ahead"})
    void shouldAcceptAffirmativeReplies(String reply) {
        assertThat(ConsentConfirmation.isConfirmation(null, reply)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"no", "cheaper ones?", ""})
    void shouldRejectOtherReplies(String reply) {
        assertThat(ConsentConfirmation.isConfirmation("other_action", reply)).isFalse();
    }

    @Test
    void shouldRejectMissingInput() {
        assertThat(ConsentConfirmation.isConfirmation(null, null)).isFalse();
    }
}
