package com.chicu.breachml.ml.training;

import com.chicu.breachml.common.enums.PredictionType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class TrainingRuntimeTest {

    private static final String ORG = "org-1";
    private static final PredictionType TYPE = PredictionType.BREACH_PROBABILITY;

    private ExecutorService executor;
    private TrainingOrchestrator orchestrator;
    private TrainingRuntime runtime;

    private final CountDownLatch started = new CountDownLatch(1);
    private final CountDownLatch release = new CountDownLatch(1);
    private final AtomicReference<BooleanSupplier> cancelSignal = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        orchestrator = mock(TrainingOrchestrator.class);
        // "обучение" висит, пока тест не отпустит
        when(orchestrator.train(eq(ORG), eq(TYPE), any(), any())).thenAnswer(inv -> {
            cancelSignal.set(inv.getArgument(3));
            started.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return TrainingOutcome.builder().success(true).modelId(1L).trainingRunId(2L).build();
        });
        runtime = new TrainingRuntime(orchestrator, executor);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdownNow();
    }

    @Test
    void secondSubmitWhileRunning_isRejectedImmediately() throws Exception {
        CompletableFuture<TrainingOutcome> first = runtime.submit(ORG, TrainingOverrides.none());
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(runtime.isRunning(ORG, TYPE));

        TrainingOutcome second = runtime.submit(ORG, TYPE, TrainingOverrides.none()).get(1, TimeUnit.SECONDS);
        assertFalse(second.success());
        assertEquals(TrainingRuntime.ALREADY_RUNNING, second.error());

        release.countDown();
        assertTrue(first.get(5, TimeUnit.SECONDS).success());
        verify(orchestrator, times(1)).train(any(), any(), any(), any());
    }

    @Test
    void slotIsReleasedAfterCompletion() throws Exception {
        release.countDown();
        runtime.submit(ORG, TrainingOverrides.none()).get(5, TimeUnit.SECONDS);

        assertFalse(runtime.isRunning(ORG, TYPE));
        assertTrue(runtime.submit(ORG, TrainingOverrides.none()).get(5, TimeUnit.SECONDS).success());
        verify(orchestrator, times(2)).train(any(), any(), any(), any());
    }

    @Test
    void cancel_raisesFlagSeenByOrchestrator() throws Exception {
        assertFalse(runtime.cancel(ORG, TYPE));

        CompletableFuture<TrainingOutcome> future = runtime.submit(ORG, TrainingOverrides.none());
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertFalse(cancelSignal.get().getAsBoolean());

        assertTrue(runtime.cancel(ORG, null));
        assertTrue(cancelSignal.get().getAsBoolean());

        release.countDown();
        future.get(5, TimeUnit.SECONDS);
        assertFalse(runtime.cancel(ORG, TYPE));
    }

    @Test
    void orchestratorException_releasesSlot() throws Exception {
        reset(orchestrator);
        when(orchestrator.train(any(), any(), any(), any())).thenThrow(new IllegalArgumentException("bad override"));

        CompletableFuture<TrainingOutcome> future = runtime.submit(ORG, TrainingOverrides.none());

        Exception e = assertThrows(Exception.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
        assertFalse(runtime.isRunning(ORG, TYPE));
    }

    @Test
    void blankOrganisation_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> runtime.submit(" ", TrainingOverrides.none()));
        verifyNoInteractions(orchestrator);
    }
}
