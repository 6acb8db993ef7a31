package com.chicu.breachml.ml.persistence;

import com.chicu.breachml.common.enums.OutcomeType;
import com.chicu.breachml.common.enums.RiskCategory;
import com.chicu.breachml.common.enums.SourceLabel;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Аудит одного инференса. После создания меняется только блок фактического исхода.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "ml_prediction",
        indexes = {
                @Index(name = "idx_ml_prediction_org_created", columnList = "organisation_id, created_at DESC"),
                @Index(name = "idx_ml_prediction_entity", columnList = "entity_id")
        }
)
public class MlPredictionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "model_id", nullable = false)
    private Long modelId;

    @Column(name = "organisation_id", nullable = false, length = 64)
    private String organisationId;

    @Column(name = "entity_id", nullable = false, length = 64)
    private String entityId;

    @Column(name = "statistical_score", nullable = false)
    private int statisticalScore;

    @Column(name = "statistical_confidence", nullable = false)
    private int statisticalConfidence;

    @Column(name = "ml_score")
    private Integer mlScore;

    @Column(name = "ml_confidence")
    private Integer mlConfidence;

    @Column(name = "ml_backend", length = 32)
    private String mlBackend;

    @Column(name = "combined_score", nullable = false)
    private int combinedScore;

    @Column(name = "combined_confidence", nullable = false)
    private int combinedConfidence;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_category", nullable = false, length = 16)
    private RiskCategory riskCategory;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_label", nullable = false, length = 16)
    private SourceLabel sourceLabel;

    @Column(name = "days_to_breach")
    private Integer daysToBreach;

    @Column(name = "predicted_breach_date")
    private LocalDate predictedBreachDate;

    /** JSON: точный снимок входных фич. */
    @Lob
    @Column(name = "input_features_json", nullable = false)
    private String inputFeaturesJson;

    @Column(name = "is_test", nullable = false)
    private boolean test;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "actual_outcome", length = 16)
    private OutcomeType actualOutcome;

    @Column(name = "actual_breach_date")
    private LocalDate actualBreachDate;

    @Column(name = "was_accurate")
    private Boolean wasAccurate;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
