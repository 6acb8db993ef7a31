package com.chicu.breachml.ml.backend;

import com.chicu.breachml.ml.MlProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Упорядоченная цепочка бэкендов (порядок бинов фабрик по @Order).
 *
 * <p>Первый успешный predict выигрывает. Отказ загрузки весов, исключение и таймаут
 * одинаково означают "следующий бэкенд". Если не справился никто - пустой результат,
 * исключение наружу не уходит.</p>
 */
@Slf4j
@Component
public class BackendChain {

    private final List<ModelBackendFactory> factories;
    private final ModelCache cache;
    private final ExecutorService executor;
    private final MlProperties props;

    public BackendChain(List<ModelBackendFactory> factories,
                        ModelCache cache,
                        @Qualifier("mlInferenceExecutor") ExecutorService executor,
                        MlProperties props) {
        this.factories = List.copyOf(factories);
        this.cache = cache;
        this.executor = executor;
        this.props = props;
        log.info("🧠 backend chain: {}", factories.stream().map(ModelBackendFactory::name).toList());
    }

    public List<ModelBackendFactory> factories() {
        return factories;
    }

    public Optional<MlScore> predict(ModelSnapshot snapshot, double[] features, String entityId) {
        if (snapshot == null || !snapshot.hasUsableWeights()) {
            log.debug("🧠 no usable weights modelId={} entityId={}",
                    snapshot != null ? snapshot.modelId() : null, entityId);
            return Optional.empty();
        }

        for (ModelBackendFactory factory : factories) {
            Optional<ModelBackend> loaded = cache.getOrLoad(snapshot, factory);
            if (loaded.isEmpty()) {
                continue;
            }

            ModelBackend backend = loaded.get();
            Future<Double> future;
            try {
                future = executor.submit(() -> backend.predict(features));
            } catch (RejectedExecutionException e) {
                log.warn("⚠️ inference pool rejected modelId={} entityId={} backend={}",
                        snapshot.modelId(), entityId, factory.name());
                continue;
            }
            try {
                double raw = future.get(props.getInference().getTimeoutMs(), TimeUnit.MILLISECONDS);
                if (!Double.isFinite(raw)) {
                    throw new ExecutionException(new IllegalStateException("non-finite score " + raw));
                }
                int score = (int) Math.max(0, Math.min(100, Math.round(raw)));
                int confidence = MlScore.confidence(factory.confidenceBase(), snapshot.trainingAccuracy(), snapshot.feedbackCount());
                log.debug("🧠 ml score modelId={} entityId={} backend={} score={} conf={}",
                        snapshot.modelId(), entityId, factory.name(), score, confidence);
                return Optional.of(new MlScore(score, confidence, factory.name()));

            } catch (TimeoutException e) {
                future.cancel(true);
                cache.evict(snapshot.modelId(), factory.name());
                log.warn("⚠️ backend timeout modelId={} entityId={} backend={} timeoutMs={}",
                        snapshot.modelId(), entityId, factory.name(), props.getInference().getTimeoutMs());
            } catch (ExecutionException e) {
                cache.evict(snapshot.modelId(), factory.name());
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("⚠️ backend failed modelId={} entityId={} backend={}: {}",
                        snapshot.modelId(), entityId, factory.name(), cause.toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                log.warn("⚠️ inference interrupted modelId={} entityId={} backend={}",
                        snapshot.modelId(), entityId, factory.name());
                return Optional.empty();
            }
        }

        log.warn("⚠️ no ML result, statistical only modelId={} entityId={} org={}",
                snapshot.modelId(), entityId, snapshot.organisationId());
        return Optional.empty();
    }
}
