package com.chicu.breachml.ml.registry;

import com.chicu.breachml.common.enums.ModelStatus;
import com.chicu.breachml.common.enums.PredictionType;
import com.chicu.breachml.ml.MlProperties;
import com.chicu.breachml.ml.backend.ModelSnapshot;
import com.chicu.breachml.ml.backend.ModelWeights;
import com.chicu.breachml.ml.backend.WeightFormat;
import com.chicu.breachml.ml.features.BreachFeatures;
import com.chicu.breachml.ml.features.FeatureExtractor;
import com.chicu.breachml.ml.persistence.MalformedWeightsException;
import com.chicu.breachml.ml.persistence.MlJsonMapper;
import com.chicu.breachml.ml.persistence.MlModelEntity;
import com.chicu.breachml.ml.persistence.MlModelRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Одна активная модель на (организация, тип прогноза).
 * Создаётся лениво при первом запросе: статус TRAINING, без весов.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelRegistry {

    public static final PredictionType DEFAULT_TYPE = PredictionType.BREACH_PROBABILITY;
    static final String OUTPUT_ACTIVATION = "sigmoid";

    private final MlModelRepository repo;
    private final MlJsonMapper json;
    private final FeatureExtractor featureExtractor;
    private final MlProperties props;

    private final Map<String, Object> createLocks = new ConcurrentHashMap<>();

    // =====================================================================
    // GET / CREATE
    // =====================================================================

    public Optional<MlModelEntity> findActive(String organisationId, PredictionType type) {
        return repo.findFirstByOrganisationIdAndPredictionTypeAndActiveTrueOrderByVersionDesc(organisationId, type);
    }

    public MlModelEntity getOrCreate(String organisationId, PredictionType type) {
        requireOrg(organisationId);
        PredictionType t = type != null ? type : DEFAULT_TYPE;

        Optional<MlModelEntity> existing = findActive(organisationId, t);
        if (existing.isPresent()) return existing.get();

        synchronized (createLocks.computeIfAbsent(organisationId + ":" + t, k -> new Object())) {
            existing = findActive(organisationId, t);
            if (existing.isPresent()) return existing.get();

            int version = repo.findFirstByOrganisationIdAndPredictionTypeOrderByVersionDesc(organisationId, t)
                    .map(m -> m.getVersion() + 1)
                    .orElse(1);

            MlModelEntity created = MlModelEntity.builder()
                    .organisationId(organisationId)
                    .predictionType(t)
                    .version(version)
                    .status(ModelStatus.TRAINING)
                    .active(true)
                    .inputFeaturesJson(json.writeStrings(featureExtractor.schema().featureList()))
                    .hiddenLayersJson(json.writeInts(props.getModel().getHiddenLayers()))
                    .outputActivation(OUTPUT_ACTIVATION)
                    .weightsRevision(0)
                    .learningRate(props.getTraining().getDefaults().getLearningRate())
                    .epochs(props.getTraining().getDefaults().getEpochs())
                    .batchSize(props.getTraining().getDefaults().getBatchSize())
                    .featureWeightsJson(json.writeDoubleMap(BreachFeatures.defaultFeatureWeights()))
                    .build();

            try {
                MlModelEntity saved = repo.save(created);
                log.info("🧠 model created id={} org={} type={} version={}", saved.getId(), organisationId, t, version);
                return saved;
            } catch (DataIntegrityViolationException e) {
                // другой узел успел создать ту же версию
                log.warn("⚠️ model create race org={} type={}: {}", organisationId, t, e.getMessage());
                return findActive(organisationId, t)
                        .orElseThrow(() -> new IllegalStateException("model for org=" + organisationId + " not found after race", e));
            }
        }
    }

    public MlModelEntity require(Long modelId) {
        return repo.findById(modelId)
                .orElseThrow(() -> new IllegalArgumentException("model not found: " + modelId));
    }

    // =====================================================================
    // SNAPSHOT
    // =====================================================================

    /**
     * Снимок для инференса/обучения.
     *
     * @throws com.chicu.breachml.ml.ModelConfigurationException если список фич модели не совпадает со схемой экстрактора
     */
    public ModelSnapshot snapshotOf(MlModelEntity model) {
        List<String> features = inputFeatures(model);
        featureExtractor.schema().requireSameAs(features);

        WeightFormat format = model.hasWeights() ? model.getWeightsFormat() : null;
        if (model.hasWeights() && format == null) {
            log.warn("⚠️ legacy weights without format tag ignored modelId={} org={}",
                    model.getId(), model.getOrganisationId());
        }
        Long modelId = model.getId();
        String weightsJson = model.getWeightsJson();
        Supplier<ModelWeights> weights = null;
        if (format != null) {
            weights = () -> decodeWeights(modelId, format, weightsJson);
        }

        return new ModelSnapshot(
                modelId,
                model.getWeightsRevision(),
                model.getOrganisationId(),
                features,
                hiddenLayers(model),
                format,
                weights,
                model.getTrainingAccuracy(),
                model.getFeedbackCount()
        );
    }

    public List<String> inputFeatures(MlModelEntity model) {
        return json.readStrings(model.getInputFeaturesJson());
    }

    /** Пустой список, если колонка не читается: тогда бэкенд берёт слои холодного старта. */
    public List<Integer> hiddenLayers(MlModelEntity model) {
        try {
            return json.readInts(model.getHiddenLayersJson());
        } catch (IllegalStateException e) {
            log.warn("⚠️ unreadable hidden layers modelId={}: {}", model.getId(), e.getMessage());
            return List.of();
        }
    }

    public Map<String, Double> featureWeights(MlModelEntity model) {
        return json.readDoubleMap(model.getFeatureWeightsJson());
    }

    /**
     * Битые веса = "пригодной ML-модели нет".
     */
    private ModelWeights decodeWeights(Long modelId, WeightFormat format, String weightsJson) {
        try {
            return json.readWeights(format, weightsJson);
        } catch (MalformedWeightsException e) {
            log.warn("⚠️ malformed weights ignored modelId={} format={}: {}", modelId, format, e.getMessage());
            return null;
        }
    }

    // =====================================================================
    // SETTINGS
    // =====================================================================

    @Transactional
    public MlModelEntity updateModelSettings(String organisationId, ModelSettingsUpdate update) {
        if (update == null) throw new IllegalArgumentException("settings update is null");
        MlModelEntity model = getOrCreate(organisationId, DEFAULT_TYPE);

        if (update.learningRate() != null) {
            double lr = update.learningRate();
            if (!(lr > 0) || !Double.isFinite(lr)) {
                throw new IllegalArgumentException("learningRate must be > 0, got " + lr);
            }
            model.setLearningRate(lr);
        }
        if (update.epochs() != null) {
            if (update.epochs() <= 0) throw new IllegalArgumentException("epochs must be > 0, got " + update.epochs());
            model.setEpochs(update.epochs());
        }
        if (update.batchSize() != null) {
            if (update.batchSize() <= 0) throw new IllegalArgumentException("batchSize must be > 0, got " + update.batchSize());
            model.setBatchSize(update.batchSize());
        }
        if (update.featureWeights() != null && !update.featureWeights().isEmpty()) {
            List<String> known = inputFeatures(model);
            Map<String, Double> merged = featureWeights(model);
            update.featureWeights().forEach((name, w) -> {
                if (!known.contains(name)) {
                    throw new IllegalArgumentException("unknown feature: " + name);
                }
                if (w == null || !Double.isFinite(w)) {
                    throw new IllegalArgumentException("feature weight for " + name + " must be a finite number");
                }
                merged.put(name, w);
            });
            model.setFeatureWeightsJson(json.writeDoubleMap(merged));
        }

        MlModelEntity saved = repo.save(model);
        log.info("🧠 model settings updated id={} org={} lr={} epochs={} batch={}",
                saved.getId(), organisationId, saved.getLearningRate(), saved.getEpochs(), saved.getBatchSize());
        return saved;
    }

    private static void requireOrg(String organisationId) {
        if (organisationId == null || organisationId.isBlank()) {
            throw new IllegalArgumentException("organisationId is required");
        }
    }
}
