package com.chicu.breachml.ml.training;

import com.chicu.breachml.common.enums.ModelStatus;
import com.chicu.breachml.ml.backend.EpochStats;
import com.chicu.breachml.ml.backend.ModelWeights;
import com.chicu.breachml.ml.backend.TrainingConfig;
import com.chicu.breachml.ml.backend.TrainingResult;
import com.chicu.breachml.ml.persistence.MlFeedbackRepository;
import com.chicu.breachml.ml.persistence.MlJsonMapper;
import com.chicu.breachml.ml.persistence.MlModelEntity;
import com.chicu.breachml.ml.persistence.MlModelRepository;
import com.chicu.breachml.ml.persistence.MlTrainingRunEntity;
import com.chicu.breachml.ml.persistence.MlTrainingRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Запись состояния TrainingRun. Каждый метод - отдельная транзакция,
 * чтобы прогресс был виден опрашивающему клиенту во время обучения.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrainingRunRecorder {

    static final int MAX_ERROR_LENGTH = 2000;

    private final MlTrainingRunRepository runRepo;
    private final MlModelRepository modelRepo;
    private final MlFeedbackRepository feedbackRepo;
    private final MlJsonMapper json;
    private final Clock clock;

    @Transactional
    public MlTrainingRunEntity open(MlModelEntity model, TrainingConfig config) {
        MlTrainingRunEntity run = runRepo.save(MlTrainingRunEntity.builder()
                .modelId(model.getId())
                .organisationId(model.getOrganisationId())
                .predictionType(model.getPredictionType())
                .status(ModelStatus.TRAINING)
                .learningRate(config.learningRate())
                .epochs(config.epochs())
                .batchSize(config.batchSize())
                .validationSplit(config.validationSplit())
                .epochHistoryJson(json.writeEpochs(List.of()))
                .startedAt(clock.instant())
                .build());
        log.info("🏋 training run opened id={} modelId={} org={} lr={} epochs={} batch={}",
                run.getId(), model.getId(), model.getOrganisationId(),
                config.learningRate(), config.epochs(), config.batchSize());
        return run;
    }

    @Transactional
    public void recordDataset(Long runId, TrainingDataset dataset) {
        MlTrainingRunEntity run = requireRun(runId);
        run.setFeedbackSamples(dataset.feedbackSamples());
        run.setBootstrapSamples(dataset.bootstrapSamples());
        runRepo.save(run);
    }

    /**
     * @param epoch номер эпохи с 1
     */
    public void progress(Long runId, int epoch, int totalEpochs, List<EpochStats> history) {
        int percent = totalEpochs > 0 ? (int) Math.round(epoch * 100.0 / totalEpochs) : 0;
        int updated = runRepo.updateProgress(runId, epoch, percent, json.writeEpochs(history));
        if (updated == 0) {
            log.warn("⚠️ progress not written, run id={} is no longer TRAINING", runId);
        }
    }

    /**
     * Успех: одной транзакцией меняем веса модели вместе с их архитектурой, помечаем фидбек и закрываем прогон.
     */
    @Transactional
    public MlModelEntity completeAtomic(Long runId,
                                        Long modelId,
                                        String backend,
                                        List<Integer> hiddenLayers,
                                        ModelWeights weights,
                                        TrainingResult result,
                                        List<Long> feedbackIds) {
        MlTrainingRunEntity run = requireRun(runId);
        if (run.getStatus() != ModelStatus.TRAINING) {
            throw new IllegalStateException("training run " + runId + " is already " + run.getStatus());
        }

        MlModelEntity model = modelRepo.findById(modelId)
                .orElseThrow(() -> new IllegalStateException("model not found: " + modelId));

        EpochStats last = result.lastEpoch();
        Double validationAccuracy = last != null ? last.validationAccuracy() : null;
        Double validationLoss = last != null ? last.validationLoss() : null;

        model.setWeightsJson(json.writeWeights(weights));
        model.setWeightsFormat(weights.format());
        // слои, с которыми реально обучены веса
        model.setHiddenLayersJson(json.writeInts(hiddenLayers));
        model.setWeightsRevision(model.getWeightsRevision() + 1);
        model.setStatus(ModelStatus.ACTIVE);
        model.setTrainingAccuracy(result.finalAccuracy());
        model.setTrainingLoss(result.finalLoss());
        model.setValidationAccuracy(validationAccuracy);
        model.setValidationLoss(validationLoss);
        model.setLastTrainedAt(clock.instant());
        MlModelEntity saved = modelRepo.save(model);

        if (!feedbackIds.isEmpty()) {
            feedbackRepo.markUsedForTraining(feedbackIds, runId);
        }

        run.setStatus(ModelStatus.ACTIVE);
        run.setBackend(backend);
        run.setCurrentEpoch(result.epochHistory().size());
        run.setProgressPercent(100);
        run.setTrainingSamples(result.trainingSamples());
        run.setValidationSamples(result.validationSamples());
        run.setFinalAccuracy(result.finalAccuracy());
        run.setFinalLoss(result.finalLoss());
        run.setValidationAccuracy(validationAccuracy);
        run.setValidationLoss(validationLoss);
        run.setEpochHistoryJson(json.writeEpochs(result.epochHistory()));
        run.setCompletedAt(clock.instant());
        runRepo.save(run);

        log.info("🏋 training run completed id={} modelId={} backend={} revision={} acc={} loss={} feedbackUsed={}",
                runId, modelId, backend, saved.getWeightsRevision(),
                result.finalAccuracy(), result.finalLoss(), feedbackIds.size());
        return saved;
    }

    /**
     * Провал: только прогон -> FAILED. Модель не трогаем.
     */
    @Transactional
    public void fail(Long runId, String error) {
        MlTrainingRunEntity run = runRepo.findById(runId).orElse(null);
        if (run == null) {
            log.warn("⚠️ cannot mark missing training run id={} as failed", runId);
            return;
        }
        if (run.getStatus() != ModelStatus.TRAINING) {
            log.warn("⚠️ training run id={} already {}, failure not recorded: {}", runId, run.getStatus(), error);
            return;
        }
        String msg = error != null ? error : "unknown error";
        run.setStatus(ModelStatus.FAILED);
        run.setErrorMessage(msg.length() > MAX_ERROR_LENGTH ? msg.substring(0, MAX_ERROR_LENGTH) : msg);
        run.setCompletedAt(clock.instant());
        runRepo.save(run);
    }

    private MlTrainingRunEntity requireRun(Long runId) {
        return runRepo.findById(runId)
                .orElseThrow(() -> new IllegalStateException("training run not found: " + runId));
    }
}
