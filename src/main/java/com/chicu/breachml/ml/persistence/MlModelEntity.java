package com.chicu.breachml.ml.persistence;

import com.chicu.breachml.common.enums.ModelStatus;
import com.chicu.breachml.common.enums.PredictionType;
import com.chicu.breachml.ml.backend.WeightFormat;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.DynamicUpdate;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Модель организации для одного типа прогноза.
 * Переобучение меняет строку на месте (та же identity), счётчики двигаются только атомарными апдейтами репозитория.
 *
 * <p>{@code @DynamicUpdate}: при сохранении пишутся только изменённые колонки,
 * поэтому замена весов не затирает параллельно увеличенные счётчики.</p>
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@DynamicUpdate
@Table(
        name = "ml_model",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_ml_model_org_type_version", columnNames = {"organisation_id", "prediction_type", "version"})
        },
        indexes = {
                @Index(name = "idx_ml_model_org_type_active", columnList = "organisation_id, prediction_type, is_active")
        }
)
public class MlModelEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organisation_id", nullable = false, length = 64)
    private String organisationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "prediction_type", nullable = false, length = 32)
    private PredictionType predictionType;

    @Column(name = "version", nullable = false)
    private int version;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ModelStatus status;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    /** JSON: упорядоченный список имён входных фич. */
    @Lob
    @Column(name = "input_features_json", nullable = false)
    private String inputFeaturesJson;

    /** JSON: размеры скрытых слоёв. */
    @Column(name = "hidden_layers_json", nullable = false, length = 128)
    private String hiddenLayersJson;

    @Column(name = "output_activation", nullable = false, length = 32)
    private String outputActivation;

    @Lob
    @Column(name = "weights_json")
    private String weightsJson;

    /** null при заполненных весах = legacy payload без тега, не используется. */
    @Enumerated(EnumType.STRING)
    @Column(name = "weights_format", length = 32)
    private WeightFormat weightsFormat;

    /** Растёт при каждой замене весов; ключ инвалидации кеша бэкендов. */
    @Column(name = "weights_revision", nullable = false)
    private long weightsRevision;

    @Column(name = "learning_rate", nullable = false)
    private double learningRate;

    @Column(name = "epochs", nullable = false)
    private int epochs;

    @Column(name = "batch_size", nullable = false)
    private int batchSize;

    /** JSON: статические веса фич (prior). */
    @Lob
    @Column(name = "feature_weights_json")
    private String featureWeightsJson;

    @Column(name = "total_predictions", nullable = false)
    private long totalPredictions;

    @Column(name = "correct_predictions", nullable = false)
    private long correctPredictions;

    @Column(name = "feedback_count", nullable = false)
    private long feedbackCount;

    @Column(name = "last_trained_at")
    private Instant lastTrainedAt;

    /** Проценты 0..100. */
    @Column(name = "training_accuracy")
    private Double trainingAccuracy;

    @Column(name = "validation_accuracy")
    private Double validationAccuracy;

    @Column(name = "training_loss")
    private Double trainingLoss;

    @Column(name = "validation_loss")
    private Double validationLoss;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean hasWeights() {
        return weightsJson != null && !weightsJson.isBlank();
    }
}
