package com.chicu.breachml.ml.training;

import com.chicu.breachml.common.enums.PredictionType;
import com.chicu.breachml.ml.registry.ModelRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Фоновый запуск обучения. Не больше одного прогона на (организация, тип прогноза):
 * повторный запрос сразу завершается с success=false.
 */
@Slf4j
@Service
public class TrainingRuntime {

    static final String ALREADY_RUNNING = "training already running";

    private final TrainingOrchestrator orchestrator;
    private final ExecutorService executor;

    private final Set<String> running = ConcurrentHashMap.newKeySet();
    private final Map<String, AtomicBoolean> cancelFlags = new ConcurrentHashMap<>();

    public TrainingRuntime(TrainingOrchestrator orchestrator,
                           @Qualifier("mlTrainingExecutor") ExecutorService executor) {
        this.orchestrator = orchestrator;
        this.executor = executor;
    }

    public CompletableFuture<TrainingOutcome> submit(String organisationId, TrainingOverrides overrides) {
        return submit(organisationId, ModelRegistry.DEFAULT_TYPE, overrides);
    }

    public CompletableFuture<TrainingOutcome> submit(String organisationId, PredictionType type, TrainingOverrides overrides) {
        if (organisationId == null || organisationId.isBlank()) {
            throw new IllegalArgumentException("organisationId is required");
        }
        PredictionType t = type != null ? type : ModelRegistry.DEFAULT_TYPE;
        String key = key(organisationId, t);

        // защита от параллельных запусков
        if (!running.add(key)) {
            log.info("🏋 training skipped org={} type={}: already running", organisationId, t);
            return CompletableFuture.completedFuture(TrainingOutcome.rejected(null, ALREADY_RUNNING));
        }

        AtomicBoolean cancelFlag = new AtomicBoolean(false);
        cancelFlags.put(key, cancelFlag);

        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    TrainingOutcome outcome = orchestrator.train(organisationId, t, overrides, cancelFlag::get);
                    log.info("🏋 training done org={} type={} success={} acc={} error={}",
                            organisationId, t, outcome.success(), outcome.accuracy(), outcome.error());
                    return outcome;
                } finally {
                    release(key, cancelFlag);
                }
            }, executor);
        } catch (RejectedExecutionException e) {
            release(key, cancelFlag);
            log.warn("⚠️ training pool rejected org={} type={}", organisationId, t);
            return CompletableFuture.completedFuture(TrainingOutcome.rejected(null, "training pool is busy"));
        }
    }

    /**
     * Выставляет флаг отмены; обучение остановится перед следующей эпохой.
     *
     * @return false, если для пары сейчас нет прогона
     */
    public boolean cancel(String organisationId, PredictionType type) {
        PredictionType t = type != null ? type : ModelRegistry.DEFAULT_TYPE;
        AtomicBoolean flag = cancelFlags.get(key(organisationId, t));
        if (flag == null) return false;
        flag.set(true);
        log.info("🏋 training cancel requested org={} type={}", organisationId, t);
        return true;
    }

    public boolean isRunning(String organisationId, PredictionType type) {
        return running.contains(key(organisationId, type != null ? type : ModelRegistry.DEFAULT_TYPE));
    }

    private void release(String key, AtomicBoolean cancelFlag) {
        cancelFlags.remove(key, cancelFlag);
        running.remove(key);
    }

    private static String key(String organisationId, PredictionType type) {
        return organisationId + ":" + type;
    }
}
