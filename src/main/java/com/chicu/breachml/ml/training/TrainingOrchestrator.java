package com.chicu.breachml.ml.training;

import com.chicu.breachml.common.enums.PredictionType;
import com.chicu.breachml.ml.MlProperties;
import com.chicu.breachml.ml.backend.BackendChain;
import com.chicu.breachml.ml.backend.EpochStats;
import com.chicu.breachml.ml.backend.ModelArchitecture;
import com.chicu.breachml.ml.backend.ModelBackend;
import com.chicu.breachml.ml.backend.ModelBackendFactory;
import com.chicu.breachml.ml.backend.ModelCache;
import com.chicu.breachml.ml.backend.ModelSnapshot;
import com.chicu.breachml.ml.backend.ModelWeights;
import com.chicu.breachml.ml.backend.TrainingCancelledException;
import com.chicu.breachml.ml.backend.TrainingConfig;
import com.chicu.breachml.ml.backend.TrainingMonitor;
import com.chicu.breachml.ml.backend.TrainingResult;
import com.chicu.breachml.ml.persistence.MlModelEntity;
import com.chicu.breachml.ml.persistence.MlTrainingRunEntity;
import com.chicu.breachml.ml.registry.ModelRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Переобучение модели организации.
 *
 * <ol>
 *   <li>модель (get-or-create) и новый TrainingRun в TRAINING;</li>
 *   <li>набор из фидбека, при нехватке - bootstrap;</li>
 *   <li>обучение на первом бэкенде цепочки (стартуя с текущих весов, если подходят),
 *       при его падении - с нуля на следующем;</li>
 *   <li>успех: атомарная замена весов + инвалидация кеша;
 *       провал: прогон FAILED, веса модели не меняются.</li>
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrainingOrchestrator {

    static final String CANCELLED = "cancelled";

    private final ModelRegistry registry;
    private final TrainingDatasetBuilder datasetBuilder;
    private final TrainingRunRecorder recorder;
    private final BackendChain backendChain;
    private final ModelCache modelCache;
    private final MlProperties props;

    public TrainingOutcome train(String organisationId,
                                 PredictionType type,
                                 TrainingOverrides overrides,
                                 BooleanSupplier cancelled) {
        MlModelEntity model = registry.getOrCreate(organisationId, type);
        TrainingConfig config = resolveConfig(model, overrides);
        BooleanSupplier isCancelled = cancelled != null ? cancelled : () -> false;

        MlTrainingRunEntity run = recorder.open(model, config);
        Long runId = run.getId();

        TrainingDataset dataset = null;
        try {
            dataset = datasetBuilder.build(model);
            recorder.recordDataset(runId, dataset);
            if (dataset.size() == 0) {
                throw new IllegalStateException("no training examples (no usable feedback, bootstrap produced nothing)");
            }

            ModelSnapshot snapshot = registry.snapshotOf(model);
            Attempt attempt = trainOnChain(snapshot, dataset, config, runId, isCancelled);

            ModelWeights weights = attempt.backend().exportWeights();
            recorder.completeAtomic(runId, model.getId(), attempt.backend().name(),
                    attempt.architecture().hiddenLayers(), weights, attempt.result(), dataset.feedbackIds());
            modelCache.invalidate(model.getId());

            return TrainingOutcome.builder()
                    .success(true)
                    .modelId(model.getId())
                    .trainingRunId(runId)
                    .backend(attempt.backend().name())
                    .accuracy(attempt.result().finalAccuracy())
                    .loss(attempt.result().finalLoss())
                    .validationAccuracy(lastValidationAccuracy(attempt.result()))
                    .epochHistory(attempt.result().epochHistory())
                    .trainingSamples(attempt.result().trainingSamples())
                    .feedbackSamples(dataset.feedbackSamples())
                    .bootstrapSamples(dataset.bootstrapSamples())
                    .build();

        } catch (TrainingCancelledException e) {
            log.warn("⚠️ training cancelled runId={} modelId={} org={}: {}", runId, model.getId(), organisationId, e.getMessage());
            recorder.fail(runId, CANCELLED);
            return failed(model, runId, dataset, CANCELLED);

        } catch (Exception e) {
            log.error("❌ training failed runId={} modelId={} org={}: {}", runId, model.getId(), organisationId, e.getMessage(), e);
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            recorder.fail(runId, error);
            return failed(model, runId, dataset, error);
        }
    }

    /**
     * Дефолты конфигурации <- настройки модели <- переопределения запроса.
     */
    TrainingConfig resolveConfig(MlModelEntity model, TrainingOverrides overrides) {
        TrainingOverrides o = overrides != null ? overrides : TrainingOverrides.none();
        return TrainingConfig.builder()
                .learningRate(o.learningRate() != null ? o.learningRate() : model.getLearningRate())
                .epochs(o.epochs() != null ? o.epochs() : model.getEpochs())
                .batchSize(o.batchSize() != null ? o.batchSize() : model.getBatchSize())
                .validationSplit(o.validationSplit() != null
                        ? o.validationSplit()
                        : props.getTraining().getDefaults().getValidationSplit())
                .build();
    }

    // =========================================================
    // chain
    // =========================================================

    private record Attempt(ModelBackend backend, ModelArchitecture architecture, TrainingResult result) {
    }

    private Attempt trainOnChain(ModelSnapshot snapshot,
                                 TrainingDataset dataset,
                                 TrainingConfig config,
                                 Long runId,
                                 BooleanSupplier cancelled) {
        List<ModelBackendFactory> factories = backendChain.factories();
        Throwable lastError = null;

        for (int i = 0; i < factories.size(); i++) {
            ModelBackendFactory factory = factories.get(i);
            boolean primary = i == 0;
            RunMonitor monitor = new RunMonitor(runId, cancelled);
            try {
                // обучение всегда на новом экземпляре: закешированные для инференса бэкенды не меняются
                ModelArchitecture architecture = snapshot.architectureFor(factory);
                ModelBackend backend = factory.create(architecture);
                ModelWeights current = primary && snapshot.hasUsableWeights() ? snapshot.weights() : null;
                boolean warmStart = current != null && backend.loadWeights(current);
                if (!warmStart) {
                    backend.initialize();
                }

                log.info("🏋 training modelId={} runId={} backend={} hidden={} warmStart={} samples={}",
                        snapshot.modelId(), runId, factory.name(), architecture.hiddenLayers(), warmStart, dataset.size());

                TrainingResult result = backend.train(dataset.examples(), config, monitor);
                return new Attempt(backend, architecture, result);

            } catch (TrainingCancelledException e) {
                throw e;
            } catch (RuntimeException | LinkageError e) {
                // LinkageError: нет нативных библиотек nd4j
                lastError = e;
                log.warn("⚠️ training backend failed modelId={} runId={} backend={}: {}",
                        snapshot.modelId(), runId, factory.name(), e.toString());
            }
        }

        throw new IllegalStateException("all training backends failed"
                + (lastError != null ? ": " + lastError.getMessage() : ""), lastError);
    }

    private static Double lastValidationAccuracy(TrainingResult result) {
        EpochStats last = result.lastEpoch();
        return last != null ? last.validationAccuracy() : null;
    }

    private static TrainingOutcome failed(MlModelEntity model, Long runId, TrainingDataset dataset, String error) {
        return TrainingOutcome.builder()
                .success(false)
                .modelId(model.getId())
                .trainingRunId(runId)
                .feedbackSamples(dataset != null ? dataset.feedbackSamples() : 0)
                .bootstrapSamples(dataset != null ? dataset.bootstrapSamples() : 0)
                .error(error)
                .build();
    }

    /**
     * Копит историю эпох и раз в N эпох (и на последней) пишет прогресс в прогон.
     */
    private class RunMonitor implements TrainingMonitor {

        private final Long runId;
        private final BooleanSupplier cancelled;
        private final List<EpochStats> history = new ArrayList<>();

        RunMonitor(Long runId, BooleanSupplier cancelled) {
            this.runId = runId;
            this.cancelled = cancelled;
        }

        @Override
        public void onEpoch(EpochStats stats, int totalEpochs) {
            history.add(stats);
            int epoch = stats.epoch() + 1;
            int every = Math.max(1, props.getTraining().getProgressEveryEpochs());
            if (epoch % every != 0 && epoch != totalEpochs) {
                return;
            }
            try {
                recorder.progress(runId, epoch, totalEpochs, history);
            } catch (RuntimeException e) {
                log.warn("⚠️ progress write failed runId={} epoch={}: {}", runId, epoch, e.toString());
            }
        }

        @Override
        public boolean isCancelled() {
            return cancelled.getAsBoolean();
        }
    }
}
