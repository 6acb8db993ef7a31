package com.chicu.breachml.ml.training;

import com.chicu.breachml.common.enums.FeedbackType;
import com.chicu.breachml.ml.MlProperties;
import com.chicu.breachml.ml.ModelConfigurationException;
import com.chicu.breachml.ml.backend.TrainingExample;
import com.chicu.breachml.ml.features.FeatureExtractor;
import com.chicu.breachml.ml.features.FeatureSchema;
import com.chicu.breachml.ml.persistence.MlFeedbackEntity;
import com.chicu.breachml.ml.persistence.MlFeedbackRepository;
import com.chicu.breachml.ml.persistence.MlJsonMapper;
import com.chicu.breachml.ml.persistence.MlModelEntity;
import com.chicu.breachml.ml.persistence.MlPredictionEntity;
import com.chicu.breachml.ml.persistence.MlPredictionRepository;
import com.chicu.breachml.risk.PortfolioDirectory;
import com.chicu.breachml.risk.RiskAssessment;
import com.chicu.breachml.risk.StatisticalRiskScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Собирает обучающий набор модели:
 * - метки из неиспользованного фидбека (CORRECT -> статистический скор прогноза, иначе поправленный скор);
 * - если примеров меньше порога, добирает bootstrap-пары "фичи -> свежий статистический скор" по портфелю.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrainingDatasetBuilder {

    private final MlFeedbackRepository feedbackRepo;
    private final MlPredictionRepository predictionRepo;
    private final PortfolioDirectory portfolio;
    private final StatisticalRiskScorer scorer;
    private final FeatureExtractor featureExtractor;
    private final MlJsonMapper json;
    private final MlProperties props;

    public TrainingDataset build(MlModelEntity model) {
        FeatureSchema schema = featureExtractor.schema();
        List<TrainingExample> examples = new ArrayList<>();
        List<Long> feedbackIds = new ArrayList<>();

        List<MlFeedbackEntity> rows = feedbackRepo.findTrainable(
                model.getId(), PageRequest.of(0, props.getTraining().getMaxFeedbackRows()));

        List<Long> skippedIds = new ArrayList<>();
        for (MlFeedbackEntity f : rows) {
            Optional<TrainingExample> ex = fromFeedback(f, schema);
            if (ex.isPresent()) {
                examples.add(ex.get());
                feedbackIds.add(f.getId());
            } else {
                skippedIds.add(f.getId());
            }
        }
        int feedbackSamples = examples.size();
        if (!skippedIds.isEmpty()) {
            // иначе эти строки занимают окно выборки в каждом следующем прогоне
            feedbackRepo.markSkippedForTraining(skippedIds);
        }

        int bootstrapSamples = 0;
        if (examples.size() < props.getTraining().getMinExamples()) {
            bootstrapSamples = bootstrap(model.getOrganisationId(), schema, examples);
        }

        String datasetId = UUID.randomUUID().toString();
        log.info("📦 dataset built id={} modelId={} org={} feedback={} skipped={} bootstrap={} total={}",
                datasetId, model.getId(), model.getOrganisationId(), feedbackSamples, skippedIds.size(), bootstrapSamples, examples.size());

        return new TrainingDataset(datasetId, examples, feedbackIds, feedbackSamples, bootstrapSamples);
    }

    private Optional<TrainingExample> fromFeedback(MlFeedbackEntity f, FeatureSchema schema) {
        MlPredictionEntity prediction = predictionRepo.findById(f.getPredictionId()).orElse(null);
        if (prediction == null) {
            log.warn("⚠️ feedback id={} references missing prediction id={}, skipped", f.getId(), f.getPredictionId());
            return Optional.empty();
        }

        double target;
        if (f.getFeedbackType() == FeedbackType.CORRECT) {
            target = prediction.getStatisticalScore();
        } else if (f.getCorrectedScore() != null) {
            target = f.getCorrectedScore();
        } else {
            return Optional.empty();
        }

        try {
            Map<String, Double> features = json.readDoubleMap(prediction.getInputFeaturesJson());
            return Optional.of(new TrainingExample(schema.toVector(features), target));
        } catch (ModelConfigurationException | IllegalArgumentException | IllegalStateException e) {
            log.warn("⚠️ feedback id={} prediction id={} has unusable feature snapshot: {}",
                    f.getId(), prediction.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    private int bootstrap(String organisationId, FeatureSchema schema, List<TrainingExample> into) {
        List<String> entityIds = portfolio.listEntityIds(organisationId, props.getTraining().getBootstrapEntityLimit());
        int added = 0;
        for (String entityId : entityIds) {
            try {
                RiskAssessment risk = scorer.computeStatisticalScore(entityId, organisationId);
                Map<String, Double> features = featureExtractor.extract(entityId, organisationId, risk);
                double target = Math.max(0, Math.min(100, risk.overallScore()));
                into.add(new TrainingExample(schema.toVector(features), target));
                added++;
            } catch (RuntimeException e) {
                log.warn("⚠️ bootstrap sample skipped entityId={} org={}: {}", entityId, organisationId, e.toString());
            }
        }
        log.info("📦 bootstrap org={} entities={} samples={}", organisationId, entityIds.size(), added);
        return added;
    }
}
