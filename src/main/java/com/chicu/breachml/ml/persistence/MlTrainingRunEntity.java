package com.chicu.breachml.ml.persistence;

import com.chicu.breachml.common.enums.ModelStatus;
import com.chicu.breachml.common.enums.PredictionType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Одна попытка переобучения. TRAINING -> ACTIVE | FAILED, без возврата.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "ml_training_run",
        indexes = {
                @Index(name = "idx_ml_training_run_model_started", columnList = "model_id, started_at DESC"),
                @Index(name = "idx_ml_training_run_org_started", columnList = "organisation_id, started_at DESC")
        }
)
public class MlTrainingRunEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "model_id", nullable = false)
    private Long modelId;

    @Column(name = "organisation_id", nullable = false, length = 64)
    private String organisationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "prediction_type", nullable = false, length = 32)
    private PredictionType predictionType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ModelStatus status;

    // ===== снимок гиперпараметров =====

    @Column(name = "learning_rate", nullable = false)
    private double learningRate;

    @Column(name = "epochs", nullable = false)
    private int epochs;

    @Column(name = "batch_size", nullable = false)
    private int batchSize;

    @Column(name = "validation_split", nullable = false)
    private double validationSplit;

    /** Бэкенд, на котором прошло обучение (известен после завершения). */
    @Column(name = "backend", length = 32)
    private String backend;

    // ===== прогресс =====

    @Column(name = "current_epoch", nullable = false)
    private int currentEpoch;

    @Column(name = "progress_percent", nullable = false)
    private int progressPercent;

    @Column(name = "feedback_samples", nullable = false)
    private int feedbackSamples;

    @Column(name = "bootstrap_samples", nullable = false)
    private int bootstrapSamples;

    @Column(name = "training_samples", nullable = false)
    private int trainingSamples;

    @Column(name = "validation_samples", nullable = false)
    private int validationSamples;

    // ===== итог =====

    @Column(name = "final_accuracy")
    private Double finalAccuracy;

    @Column(name = "final_loss")
    private Double finalLoss;

    @Column(name = "validation_accuracy")
    private Double validationAccuracy;

    @Column(name = "validation_loss")
    private Double validationLoss;

    /** JSON: [{epoch, loss, accuracy, validationLoss, validationAccuracy}, ...] */
    @Lob
    @Column(name = "epoch_history_json")
    private String epochHistoryJson;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;
}
