package com.chicu.breachml.ml.prediction;

import com.chicu.breachml.common.enums.OutcomeType;
import com.chicu.breachml.common.enums.RiskCategory;
import com.chicu.breachml.ml.MlProperties;
import com.chicu.breachml.ml.ModelConfigurationException;
import com.chicu.breachml.ml.backend.BackendChain;
import com.chicu.breachml.ml.backend.MlScore;
import com.chicu.breachml.ml.backend.ModelSnapshot;
import com.chicu.breachml.ml.blend.BlendResult;
import com.chicu.breachml.ml.blend.BlendingEngine;
import com.chicu.breachml.ml.features.FeatureExtractor;
import com.chicu.breachml.ml.persistence.MlJsonMapper;
import com.chicu.breachml.ml.persistence.MlModelEntity;
import com.chicu.breachml.ml.persistence.MlModelRepository;
import com.chicu.breachml.ml.persistence.MlPredictionEntity;
import com.chicu.breachml.ml.persistence.MlPredictionRepository;
import com.chicu.breachml.ml.registry.ModelRegistry;
import com.chicu.breachml.risk.PortfolioDirectory;
import com.chicu.breachml.risk.RiskAssessment;
import com.chicu.breachml.risk.StatisticalRiskScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Один инференс: модель -> статистическая база -> фичи -> цепочка бэкендов -> смешивание -> запись Prediction.
 *
 * <p>Проблемы ML-ветки сюда не долетают: цепочка возвращает пустой результат,
 * и прогноз получается чисто статистическим.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PredictionService {

    public static final int MAX_BULK = 50;
    public static final int MAX_TEST_PREDICTIONS = 50;
    public static final int DEFAULT_TEST_PREDICTIONS = 30;
    public static final int MAX_LIST_LIMIT = 100;
    public static final int DEFAULT_LIST_LIMIT = 50;

    private final ModelRegistry registry;
    private final StatisticalRiskScorer scorer;
    private final FeatureExtractor featureExtractor;
    private final BackendChain backendChain;
    private final BlendingEngine blendingEngine;
    private final MlPredictionRepository predictionRepo;
    private final MlModelRepository modelRepo;
    private final PortfolioDirectory portfolio;
    private final MlJsonMapper json;
    private final MlProperties props;
    private final Clock clock;

    // =====================================================================
    // PREDICT
    // =====================================================================

    public PredictionResult predictBreach(String entityId, String organisationId) {
        return predictBreach(entityId, organisationId, false);
    }

    public PredictionResult predictBreach(String entityId, String organisationId, boolean isTest) {
        if (entityId == null || entityId.isBlank()) throw new IllegalArgumentException("entityId is required");
        if (organisationId == null || organisationId.isBlank()) throw new IllegalArgumentException("organisationId is required");

        MlModelEntity model = registry.getOrCreate(organisationId, ModelRegistry.DEFAULT_TYPE);
        ModelSnapshot snapshot = registry.snapshotOf(model);

        RiskAssessment assessment = scorer.computeStatisticalScore(entityId, organisationId);
        StatisticalPrediction stat = StatisticalPrediction.of(assessment);

        Map<String, Double> features = featureExtractor.extract(entityId, organisationId, assessment);
        double[] x = featureExtractor.schema().toVector(features);

        MlScore ml = backendChain.predict(snapshot, x, entityId).orElse(null);
        BlendResult blend = blendingEngine.blend(stat.score(), stat.confidence(), ml);

        Instant expiresAt = clock.instant().plus(Duration.ofHours(props.getInference().getPredictionTtlHours()));

        MlPredictionEntity saved = predictionRepo.save(MlPredictionEntity.builder()
                .modelId(model.getId())
                .organisationId(organisationId)
                .entityId(entityId)
                .statisticalScore(stat.score())
                .statisticalConfidence(stat.confidence())
                .mlScore(ml != null ? ml.score() : null)
                .mlConfidence(ml != null ? ml.confidence() : null)
                .mlBackend(ml != null ? ml.backend() : null)
                .combinedScore(blend.combinedScore())
                .combinedConfidence(blend.combinedConfidence())
                .riskCategory(blend.category())
                .sourceLabel(blend.sourceLabel())
                .daysToBreach(blend.daysToBreach())
                .predictedBreachDate(blend.predictedBreachDate())
                .inputFeaturesJson(json.writeDoubleMap(features))
                .test(isTest)
                .expiresAt(expiresAt)
                .build());

        modelRepo.incrementTotalPredictions(model.getId());

        log.debug("🧠 prediction id={} entityId={} org={} modelId={} stat={} ml={} combined={} {} source={}",
                saved.getId(), entityId, organisationId, model.getId(),
                stat.score(), ml != null ? ml.score() : null, blend.combinedScore(), blend.category(), blend.sourceLabel());

        return PredictionResult.from(saved, features);
    }

    /**
     * Пакетный прогноз (до 50 объектов). Ошибка по одному объекту не роняет остальные,
     * кроме ошибки конфигурации модели.
     */
    public BulkPredictionResult predictBulk(List<String> entityIds, String organisationId) {
        if (entityIds == null || entityIds.isEmpty()) {
            throw new IllegalArgumentException("entityIds must not be empty");
        }
        if (entityIds.size() > MAX_BULK) {
            throw new IllegalArgumentException("at most " + MAX_BULK + " entities per bulk request, got " + entityIds.size());
        }

        List<PredictionResult> results = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (String entityId : entityIds) {
            try {
                results.add(predictBreach(entityId, organisationId, false));
            } catch (ModelConfigurationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("⚠️ bulk prediction failed entityId={} org={}: {}", entityId, organisationId, e.toString());
                failures.put(String.valueOf(entityId), String.valueOf(e.getMessage()));
            }
        }
        log.info("🧠 bulk prediction org={} ok={} failed={}", organisationId, results.size(), failures.size());
        return new BulkPredictionResult(results, failures);
    }

    /**
     * Тестовые прогнозы (isTest=true) по выборке объектов портфеля.
     */
    public List<PredictionResult> generateTestPredictions(String organisationId, Integer limit) {
        int n = Math.min(limit != null ? limit : DEFAULT_TEST_PREDICTIONS, MAX_TEST_PREDICTIONS);
        if (n <= 0) throw new IllegalArgumentException("limit must be > 0, got " + limit);

        List<String> entityIds = portfolio.listEntityIds(organisationId, n);
        List<PredictionResult> results = new ArrayList<>();
        for (String entityId : entityIds) {
            if (results.size() >= n) break;
            try {
                results.add(predictBreach(entityId, organisationId, true));
            } catch (ModelConfigurationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("⚠️ test prediction skipped entityId={} org={}: {}", entityId, organisationId, e.toString());
            }
        }
        log.info("🧠 test predictions org={} requested={} generated={}", organisationId, n, results.size());
        return results;
    }

    // =====================================================================
    // READ / OUTCOME
    // =====================================================================

    public List<PredictionResult> listPredictions(String organisationId, String entityId, RiskCategory category, Integer limit) {
        int n = limit == null ? DEFAULT_LIST_LIMIT : Math.max(1, Math.min(limit, MAX_LIST_LIMIT));
        return predictionRepo.search(organisationId, entityId, category, PageRequest.of(0, n)).stream()
                .map(p -> PredictionResult.from(p, json.readDoubleMap(p.getInputFeaturesJson())))
                .toList();
    }

    /**
     * Фактический исход. wasAccurate = (прогноз HIGH/CRITICAL) == (нарушение случилось).
     */
    @Transactional
    public PredictionResult recordOutcome(Long predictionId, String organisationId, boolean breached, LocalDate actualBreachDate) {
        MlPredictionEntity p = predictionRepo.findByIdAndOrganisationId(predictionId, organisationId)
                .orElseThrow(() -> new IllegalArgumentException(
                        "prediction " + predictionId + " not found for organisation " + organisationId));

        p.setActualOutcome(breached ? OutcomeType.BREACHED : OutcomeType.NOT_BREACHED);
        p.setActualBreachDate(breached ? actualBreachDate : null);
        p.setWasAccurate(p.getRiskCategory().predictsBreach() == breached);

        MlPredictionEntity saved = predictionRepo.save(p);
        log.info("🧠 outcome recorded predictionId={} org={} outcome={} accurate={}",
                predictionId, organisationId, saved.getActualOutcome(), saved.getWasAccurate());
        return PredictionResult.from(saved, json.readDoubleMap(saved.getInputFeaturesJson()));
    }
}
