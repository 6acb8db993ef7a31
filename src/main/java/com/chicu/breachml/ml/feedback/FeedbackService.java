package com.chicu.breachml.ml.feedback;

import com.chicu.breachml.common.enums.FeedbackType;
import com.chicu.breachml.common.enums.RiskCategory;
import com.chicu.breachml.ml.persistence.MlFeedbackEntity;
import com.chicu.breachml.ml.persistence.MlFeedbackRepository;
import com.chicu.breachml.ml.persistence.MlModelRepository;
import com.chicu.breachml.ml.persistence.MlPredictionEntity;
import com.chicu.breachml.ml.persistence.MlPredictionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Objects;
import java.util.Optional;

/**
 * Приём человеческих поправок к прогнозам.
 *
 * <p>Повторная отправка тех же аргументов по тому же прогнозу возвращает
 * уже сохранённую запись и не двигает счётчики модели.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeedbackService {

    private final MlPredictionRepository predictionRepo;
    private final MlFeedbackRepository feedbackRepo;
    private final MlModelRepository modelRepo;

    @Transactional
    public MlFeedbackEntity submitFeedback(Long predictionId,
                                           String organisationId,
                                           FeedbackType feedbackType,
                                           Integer correctedScore,
                                           RiskCategory correctedCategory,
                                           String notes) {
        if (predictionId == null) throw new IllegalArgumentException("predictionId is required");
        if (feedbackType == null) throw new IllegalArgumentException("feedbackType is required");
        if (correctedScore != null && (correctedScore < 0 || correctedScore > 100)) {
            throw new IllegalArgumentException("correctedScore must be within 0..100, got " + correctedScore);
        }

        MlPredictionEntity prediction = predictionRepo.findByIdAndOrganisationId(predictionId, organisationId)
                .orElseThrow(() -> new IllegalArgumentException(
                        "prediction " + predictionId + " not found for organisation " + organisationId));

        Optional<MlFeedbackEntity> duplicate = feedbackRepo.findByPredictionIdOrderByIdAsc(predictionId).stream()
                .filter(f -> f.getFeedbackType() == feedbackType
                        && Objects.equals(f.getCorrectedScore(), correctedScore)
                        && f.getCorrectedCategory() == correctedCategory
                        && Objects.equals(f.getNotes(), notes))
                .findFirst();
        if (duplicate.isPresent()) {
            log.info("🧠 duplicate feedback ignored predictionId={} feedbackId={} type={}",
                    predictionId, duplicate.get().getId(), feedbackType);
            return duplicate.get();
        }

        MlFeedbackEntity saved = feedbackRepo.save(MlFeedbackEntity.builder()
                .predictionId(predictionId)
                .modelId(prediction.getModelId())
                .organisationId(organisationId)
                .feedbackType(feedbackType)
                .correctedScore(correctedScore)
                .correctedCategory(correctedCategory)
                .notes(notes)
                .usedForTraining(false)
                .build());

        modelRepo.incrementFeedback(prediction.getModelId(), feedbackType == FeedbackType.CORRECT ? 1 : 0);

        if (feedbackType != FeedbackType.CORRECT && correctedScore == null) {
            log.info("🧠 feedback id={} has no corrected score and will not be used for training", saved.getId());
        }
        log.info("🧠 feedback stored id={} predictionId={} modelId={} type={} corrected={}",
                saved.getId(), predictionId, prediction.getModelId(), feedbackType, correctedScore);
        return saved;
    }
}
