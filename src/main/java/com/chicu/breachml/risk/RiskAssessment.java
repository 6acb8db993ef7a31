package com.chicu.breachml.risk;

import lombok.Builder;

import java.util.List;

/**
 * Результат внешнего статистического скоринга (rule engine).
 * Все под-скоры в диапазоне 0..100.
 */
@Builder
public record RiskAssessment(
        String entityId,
        String organisationId,
        int overallScore,
        double expiryRiskScore,
        double defectRiskScore,
        double assetProfileRiskScore,
        double coverageGapRiskScore,
        double externalFactorRiskScore,
        FactorBreakdown factorBreakdown
) {

    public RiskAssessment {
        if (factorBreakdown == null) factorBreakdown = FactorBreakdown.empty();
    }

    @Builder
    public record FactorBreakdown(
            int expiringCertificates,
            int overdueCertificates,
            int openDefects,
            int criticalDefects,
            List<String> missingStreams,
            Integer assetAge,          // null = неизвестно
            boolean highRiskBuilding,
            boolean vulnerableOccupants
    ) {
        public FactorBreakdown {
            missingStreams = missingStreams == null ? List.of() : List.copyOf(missingStreams);
        }

        public static FactorBreakdown empty() {
            return new FactorBreakdown(0, 0, 0, 0, List.of(), null, false, false);
        }
    }
}
