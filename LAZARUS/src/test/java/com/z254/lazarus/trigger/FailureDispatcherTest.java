package com.z254.lazarus.trigger;

import com.z254.lazarus.domain.model.Failure;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FailureDispatcherTest {

    private TriggerEngine triggerEngine;
    private FailureHandler failureHandler;
    private FailureDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        triggerEngine = mock(TriggerEngine.class);
        failureHandler = mock(FailureHandler.class);
        dispatcher = new FailureDispatcher(triggerEngine, failureHandler);
    }

    @AfterEach
    void tearDown() {
        dispatcher.shutdown();
    }

    @Test
    void decisionIsReturnedAndHandedToHandler() {
        TriggerDecision decision = TriggerDecision.unhandled("no playbook");
        when(triggerEngine.evaluate(any())).thenReturn(decision);

        StepVerifier.create(dispatcher.dispatch(failure("db", "f-1")))
                .expectNext(decision)
                .verifyComplete();

        verify(failureHandler).onDecision(decision);
    }

    @Test
    void failuresOfOneResourceAreEvaluatedInOrderAndNeverOverlap() {
        Map<String, List<String>> seen = new ConcurrentHashMap<>();
        Map<String, AtomicInteger> inFlight = new ConcurrentHashMap<>();
        AtomicInteger overlaps = new AtomicInteger();
        when(triggerEngine.evaluate(any())).thenAnswer(invocation -> {
            Failure failure = invocation.getArgument(0);
            AtomicInteger running = inFlight.computeIfAbsent(failure.getResourceKey(), k -> new AtomicInteger());
            if (running.incrementAndGet() > 1) {
                overlaps.incrementAndGet();
            }
            Thread.sleep(2);
            seen.computeIfAbsent(failure.getResourceKey(), k -> new CopyOnWriteArrayList<>()).add(failure.getId());
            running.decrementAndGet();
            return TriggerDecision.unhandled("test");
        });

        Flux.range(0, 20)
                .flatMap(i -> dispatcher.dispatch(failure(i % 2 == 0 ? "db" : "cache", "f-" + i)))
                .collectList()
                .block(Duration.ofSeconds(10));

        assertThat(overlaps.get()).isZero();
        assertThat(seen.get("db")).containsExactly("f-0", "f-2", "f-4", "f-6", "f-8", "f-10", "f-12", "f-14",
                "f-16", "f-18");
        assertThat(seen.get("cache")).hasSize(10);
    }

    @Test
    void evaluationErrorFailsOnlyItsOwnSubmission() {
        TriggerDecision decision = TriggerDecision.unhandled("ok");
        when(triggerEngine.evaluate(any()))
                .thenThrow(new IllegalStateException("boom"))
                .thenReturn(decision);

        StepVerifier.create(dispatcher.dispatch(failure("db", "f-1")))
                .expectErrorMessage("boom")
                .verify(Duration.ofSeconds(5));
        StepVerifier.create(dispatcher.dispatch(failure("db", "f-2")))
                .expectNext(decision)
                .verifyComplete();

        verify(failureHandler, times(1)).onDecision(decision);
    }

    @Test
    void failureIsEvaluatedWithoutSubscriber() {
        when(triggerEngine.evaluate(any())).thenReturn(TriggerDecision.unhandled("test"));

        dispatcher.dispatch(failure("db", "f-1"));

        verify(triggerEngine, timeout(5000)).evaluate(any());
        verify(failureHandler, timeout(5000)).onDecision(any());
    }

    @Test
    void idleResourceGroupsAreClosedAndReopenedOnDemand() {
        FailureDispatcher shortLived = new FailureDispatcher(triggerEngine, failureHandler, Duration.ofMillis(50));
        try {
            TriggerDecision decision = TriggerDecision.unhandled("test");
            when(triggerEngine.evaluate(any())).thenReturn(decision);

            Flux.range(0, 50)
                    .flatMap(i -> shortLived.dispatch(failure("res-" + i, "f-" + i)))
                    .collectList()
                    .block(Duration.ofSeconds(10));
            await().atMost(Duration.ofSeconds(5)).until(() -> shortLived.openGroups() == 0);

            StepVerifier.create(shortLived.dispatch(failure("res-7", "f-again")))
                    .expectNext(decision)
                    .verifyComplete();
            verify(triggerEngine, times(51)).evaluate(any());
            await().atMost(Duration.ofSeconds(5)).until(() -> shortLived.openGroups() == 0);
        } finally {
            shortLived.shutdown();
        }
    }

    private static Failure failure(String resourceKey, String id) {
        return Failure.builder()
                .id(id)
                .detectorId("test")
                .resourceKey(resourceKey)
                .kind("heartbeat_timeout")
                .build();
    }
}
