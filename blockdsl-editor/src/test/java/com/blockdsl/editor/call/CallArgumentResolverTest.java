package com.blockdsl.editor.call;

import com.blockdsl.api.MethodSchemaProvider;
import com.blockdsl.api.model.CallArgument;
import com.blockdsl.api.model.MethodInputField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CallArgumentResolverTest {

    private static final List<MethodInputField> CHARGE = List.of(new MethodInputField("amount", "Decimal"));
    private static final List<MethodInputField> REFUND = List.of(new MethodInputField("reason", "String"));

    @Mock
    private MethodSchemaProvider provider;

    private CallArgumentResolver resolver;
    private List<CallEditorState.Status> transitions;

    @BeforeEach
    void setUp() {
        resolver = new CallArgumentResolver(provider, Duration.ofSeconds(5));
        transitions = new ArrayList<>();
        resolver.setListener((blockId, state) -> transitions.add(state.status()));
    }

    @Test
    @DisplayName("Should go from LOADING to READY with the declared fields")
    void shouldResolveFields() {
        when(provider.getMethodInputFields("Billing", "charge")).thenReturn(CompletableFuture.completedFuture(CHARGE));

        resolver.select("b1", "Billing", "charge");

        assertThat(resolver.state("b1").fields()).isEqualTo(CHARGE);
        assertThat(transitions).containsExactly(CallEditorState.Status.LOADING, CallEditorState.Status.READY);
        assertThat(resolver.state("other")).isEqualTo(CallEditorState.idle());
    }

    @Test
    @DisplayName("Should discard a response for an older selection")
    void shouldDiscardStaleResponses() {
        CompletableFuture<List<MethodInputField>> slow = new CompletableFuture<>();
        CompletableFuture<List<MethodInputField>> fast = new CompletableFuture<>();
        when(provider.getMethodInputFields("Billing", "charge")).thenReturn(slow);
        when(provider.getMethodInputFields("Billing", "refund")).thenReturn(fast);

        resolver.select("b1", "Billing", "charge");
        resolver.select("b1", "Billing", "refund");
        fast.complete(REFUND);
        slow.complete(CHARGE);

        assertThat(resolver.state("b1").status()).isEqualTo(CallEditorState.Status.READY);
        assertThat(resolver.state("b1").fields()).isEqualTo(REFUND);
    }

    @Test
    @DisplayName("Should discard responses for forgotten blocks and after clear")
    void shouldDiscardAfterForgetAndClear() {
        CompletableFuture<List<MethodInputField>> first = new CompletableFuture<>();
        CompletableFuture<List<MethodInputField>> second = new CompletableFuture<>();
        when(provider.getMethodInputFields("Billing", "charge")).thenReturn(first, second);

        resolver.select("b1", "Billing", "charge");
        resolver.forget("b1");
        first.complete(CHARGE);
        assertThat(resolver.state("b1")).isEqualTo(CallEditorState.idle());

        resolver.select("b2", "Billing", "charge");
        resolver.clear();
        second.complete(CHARGE);
        assertThat(resolver.state("b2")).isEqualTo(CallEditorState.idle());
    }

    @Test
    @DisplayName("Should fail only the affected block")
    void shouldScopeFailuresToBlock() {
        when(provider.getMethodInputFields("Billing", "charge")).thenReturn(CompletableFuture.completedFuture(CHARGE));
        when(provider.getMethodInputFields("Billing", "broken")).thenThrow(new IllegalStateException("connection refused"));

        resolver.select("b1", "Billing", "charge");
        resolver.select("b2", "Billing", "broken");

        assertThat(resolver.state("b1").status()).isEqualTo(CallEditorState.Status.READY);
        assertThat(resolver.state("b2").status()).isEqualTo(CallEditorState.Status.FAILED);
        assertThat(resolver.state("b2").error()).isEqualTo("connection refused");
        assertThat(resolver.state("b2").editMode(List.of())).isInstanceOf(ArgumentEditMode.FreeText.class);
    }

    @Test
    @DisplayName("Should time out and deliver the failure through the callback executor")
    void shouldTimeOut() throws InterruptedException {
        BlockingQueue<Runnable> eventLoop = new LinkedBlockingQueue<>();
        CallArgumentResolver bounded = new CallArgumentResolver(provider, Duration.ofMillis(50), eventLoop::add);
        when(provider.getMethodInputFields("Billing", "charge")).thenReturn(new CompletableFuture<>());

        bounded.select("b1", "Billing", "charge");
        assertThat(bounded.state("b1").status()).isEqualTo(CallEditorState.Status.LOADING);

        Runnable callback = eventLoop.poll(5, TimeUnit.SECONDS);
        assertThat(callback).isNotNull();
        callback.run();

        assertThat(bounded.state("b1").status()).isEqualTo(CallEditorState.Status.FAILED);
        assertThat(bounded.state("b1").error()).contains("timed out");
    }

    @Test
    @DisplayName("A result delivered after a re-selection should leave the new selection loading")
    void shouldNotOverwriteNewerSelection() {
        BlockingQueue<Runnable> eventLoop = new LinkedBlockingQueue<>();
        CallArgumentResolver queued = new CallArgumentResolver(provider, Duration.ofSeconds(5), eventLoop::add);
        when(provider.getMethodInputFields("Billing", "charge")).thenReturn(CompletableFuture.completedFuture(CHARGE));
        when(provider.getMethodInputFields("Billing", "refund")).thenReturn(new CompletableFuture<>());

        queued.select("b1", "Billing", "charge");
        queued.toggleManual("b1");
        queued.select("b1", "Billing", "refund");
        eventLoop.forEach(Runnable::run);

        CallEditorState state = queued.state("b1");
        assertThat(state.status()).isEqualTo(CallEditorState.Status.LOADING);
        assertThat(state.fields()).isEmpty();
        assertThat(state.manual()).isTrue();
    }

    @Test
    @DisplayName("A result delivered after a manual toggle should keep manual mode")
    void shouldKeepToggleMadeWhileLoading() {
        BlockingQueue<Runnable> eventLoop = new LinkedBlockingQueue<>();
        CallArgumentResolver queued = new CallArgumentResolver(provider, Duration.ofSeconds(5), eventLoop::add);
        when(provider.getMethodInputFields("Billing", "charge")).thenReturn(CompletableFuture.completedFuture(CHARGE));

        queued.select("b1", "Billing", "charge");
        assertThat(queued.toggleManual("b1").status()).isEqualTo(CallEditorState.Status.LOADING);
        eventLoop.forEach(Runnable::run);

        CallEditorState state = queued.state("b1");
        assertThat(state.status()).isEqualTo(CallEditorState.Status.READY);
        assertThat(state.fields()).isEqualTo(CHARGE);
        assertThat(state.manual()).isTrue();
    }

    @Test
    @DisplayName("A toggle racing a result completed on another thread should never be lost")
    void shouldNotLoseConcurrentToggles() throws InterruptedException {
        for (int round = 0; round < 200; round++) {
            CompletableFuture<List<MethodInputField>> lookup = new CompletableFuture<>();
            CallArgumentResolver racing = new CallArgumentResolver((product, method) -> lookup, Duration.ofSeconds(5));
            racing.select("b1", "Billing", "charge");

            CountDownLatch start = new CountDownLatch(1);
            Thread completer = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                lookup.complete(CHARGE);
            });
            completer.start();
            start.countDown();
            racing.toggleManual("b1");
            completer.join(5_000);

            CallEditorState state = racing.state("b1");
            assertThat(state.status()).as("round %d", round).isEqualTo(CallEditorState.Status.READY);
            assertThat(state.manual()).as("round %d", round).isTrue();
        }
    }

    @Test
    @DisplayName("Completed lookups should not leave their timeout task queued")
    void shouldRemoveCancelledTimeouts() {
        CallArgumentResolver patient = new CallArgumentResolver(provider, Duration.ofHours(1));
        CompletableFuture<List<MethodInputField>> lookup = new CompletableFuture<>();
        when(provider.getMethodInputFields("Billing", "charge")).thenReturn(lookup);
        int before = CallArgumentResolver.pendingTimeouts();

        patient.select("b1", "Billing", "charge");
        lookup.complete(CHARGE);

        assertThat(patient.state("b1").status()).isEqualTo(CallEditorState.Status.READY);
        assertThat(CallArgumentResolver.pendingTimeouts()).isLessThanOrEqualTo(before);
    }

    @Test
    @DisplayName("Blank selections should reset the block without a lookup")
    void shouldResetOnBlankSelection() {
        resolver.select("b1", "Billing", " ");

        assertThat(resolver.state("b1")).isEqualTo(CallEditorState.idle());
        verifyNoInteractions(provider);
    }

    @Test
    @DisplayName("Manual mode should survive a new selection")
    void shouldKeepManualMode() {
        when(provider.getMethodInputFields("Billing", "charge")).thenReturn(CompletableFuture.completedFuture(CHARGE));
        List<CallArgument> args = List.of(new CallArgument("amount", "10"));

        assertThat(resolver.toggleManual("b1").manual()).isTrue();
        resolver.select("b1", "Billing", "charge");

        CallEditorState state = resolver.state("b1");
        assertThat(state.status()).isEqualTo(CallEditorState.Status.READY);
        assertThat(state.manual()).isTrue();
        assertThat(state.editMode(args)).isEqualTo(new ArgumentEditMode.FreeText("amount: 10"));

        assertThat(resolver.toggleManual("b1").editMode(args))
            .isEqualTo(new ArgumentEditMode.Structured(CHARGE, args));
    }

    @Test
    @DisplayName("Field edits should update in place or append")
    void shouldBindFieldEditsByName() {
        List<CallArgument> args = List.of(new CallArgument("a", "1"), new CallArgument("b", "2"));

        assertThat(CallArgumentResolver.applyFieldEdit(args, "a", "9"))
            .containsExactly(new CallArgument("a", "9"), new CallArgument("b", "2"));
        assertThat(CallArgumentResolver.applyFieldEdit(args, "c", "3"))
            .containsExactly(new CallArgument("a", "1"), new CallArgument("b", "2"), new CallArgument("c", "3"));
        assertThat(CallArgumentResolver.applyFieldEdit(null, "a", "1")).containsExactly(new CallArgument("a", "1"));
        assertThat(args).hasSize(2);
    }

    @Test
    @DisplayName("Free text should replace the whole list without validation")
    void shouldParseFreeText() {
        assertThat(CallArgumentResolver.applyFreeText("nonsense, x: 1, y: \"a:b\", z: max(1, 2)"))
            .containsExactly(new CallArgument("x", "1"), new CallArgument("y", "\"a:b\""),
                new CallArgument("z", "max(1, 2)"));
        assertThat(new ArgumentEditMode.FreeText("x: 1").args()).containsExactly(new CallArgument("x", "1"));
    }
}
