package com.chicu.breachml.ml.persistence;

import com.chicu.breachml.common.enums.FeedbackType;
import com.chicu.breachml.common.enums.RiskCategory;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "ml_feedback",
        indexes = {
                @Index(name = "idx_ml_feedback_model_unused", columnList = "model_id, used_for_training"),
                @Index(name = "idx_ml_feedback_prediction", columnList = "prediction_id")
        }
)
public class MlFeedbackEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "prediction_id", nullable = false)
    private Long predictionId;

    @Column(name = "model_id", nullable = false)
    private Long modelId;

    @Column(name = "organisation_id", nullable = false, length = 64)
    private String organisationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "feedback_type", nullable = false, length = 32)
    private FeedbackType feedbackType;

    @Column(name = "corrected_score")
    private Integer correctedScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "corrected_category", length = 16)
    private RiskCategory correctedCategory;

    @Column(name = "notes", length = 2000)
    private String notes;

    @Column(name = "used_for_training", nullable = false)
    private boolean usedForTraining;

    /** Метку не извлечь (прогноз удалён / снимок фич не читается): в обучение больше не берём. */
    @Column(name = "training_skipped", nullable = false)
    private boolean trainingSkipped;

    /** id TrainingRun, который поглотил этот фидбек. */
    @Column(name = "training_run_id")
    private Long trainingRunId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
