package io.tiller.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.tiller.core.router.ConsentFlags;
import io.tiller.core.router.ConsentPrompt;
import io.tiller.core.router.ConsentType;
import io.tiller.core.router.ResultItem;
import io.tiller.core.router.RouterCheckpoint;
import io.tiller.core.router.RouterRequest;
import io.tiller.core.router.RouterResult;
import io.tiller.core.router.RouterStatus;
import io.tiller.core.router.TieredRouter;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TieredCapabilityHandlerTest {

    @Mock private TieredRouter router;

    private static CapabilityInvocation invocation(Map<String, Object> fields) {
        return new CapabilityInvocation(
                "search",
                "s1",
                "u1",
                "comparison",
                "compare sony xm5 and bose qc45",
                fields,
                Map.of(),
                new ConsentFlags(true, false));
    }

    @Test
    void shouldRouteWithFieldsAndConsent() throws Exception {
        when(router.route(any(), any()))
                .thenReturn(
                        new RouterResult(
                                RouterStatus.SUCCESS,
                                List.of(ResultItem.of("Sony XM5", BigDecimal.TEN)),
                                List.of("crisp"),
                                List.of("amazon_affiliate"),
                                List.of(),
                                null,
                                1,
                                null));

        CapabilityOutcome outcome =
                new TieredCapabilityHandler(router)
                        .handle(invocation(Map.of("items", "sony xm5, bose qc45 ,")));

        ArgumentCaptor<RouterRequest> captor = ArgumentCaptor.forClass(RouterRequest.class);
        verify(router).route(captor.capture(), isNull());
        RouterRequest request = captor.getValue();
        assertThat(request.query()).isEqualTo("compare sony xm5 and bose qc45");
        assertThat(request.requestedItems()).containsExactly("sony xm5", "bose qc45");
        assertThat(request.consent().standingOptIn()).isTrue();

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.SUCCESS);
        assertThat(outcome.output())
                .containsEntry("tier_reached", 1)
                .containsEntry("sources_used", List.of("amazon_affiliate"))
                .doesNotContainKey("message");
    }

    @Test
    void shouldCarryConsentPrompt() throws Exception {
        ConsentPrompt prompt = ConsentPrompt.of(3, ConsentType.PER_QUERY);
        when(router.route(any(), any()))
                .thenReturn(
                        new RouterResult(
                                RouterStatus.CONSENT_REQUIRED,
                                List.of(),
                                List.of(),
                                List.of(),
                                List.of(),
                                prompt,
                                2,
                                prompt.message()));

        CapabilityOutcome outcome =
                new TieredCapabilityHandler(router).handle(invocation(Map.of("query", "xm5")));

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.CONSENT_REQUIRED);
        assertThat(outcome.prompt()).contains(prompt);
        assertThat(outcome.output()).containsEntry("message", "Search deeper?");
        assertThat(outcome.checkpoint().resumeTier()).isEqualTo(3);
        assertThat(outcome.checkpoint().tierReached()).isEqualTo(2);
    }

    @Test
    void shouldRouteFromCheckpointWhenResuming() throws Exception {
        RouterCheckpoint checkpoint =
                new RouterCheckpoint(
                        3,
                        2,
                        List.of(ResultItem.of("Sony XM5", BigDecimal.TEN)),
                        List.of(),
                        List.of("amazon_affiliate"),
                        List.of());
        when(router.route(any(), eq(checkpoint)))
                .thenReturn(
                        new RouterResult(
                                RouterStatus.SUCCESS,
                                checkpoint.items(),
                                List.of(),
                                List.of("amazon_affiliate", "reddit"),
                                List.of(),
                                null,
                                3,
                                null));

        CapabilityOutcome outcome =
                new TieredCapabilityHandler(router)
                        .handle(invocation(Map.of("query", "xm5")).resuming(checkpoint));

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.SUCCESS);
        assertThat(outcome.checkpoint()).isNull();
        assertThat(outcome.output()).containsEntry("tier_reached", 3);
    }

    @Test
    void shouldParseRequestedItemsFromList() {
        assertThat(TieredCapabilityHandler.requestedItems(Arrays.asList(" a ", null, "b")))
                .containsExactly("a", "b");
        assertThat(TieredCapabilityHandler.requestedItems(null)).isEmpty();
    }
}
