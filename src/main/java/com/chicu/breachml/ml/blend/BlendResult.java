package com.chicu.breachml.ml.blend;

import com.chicu.breachml.common.enums.RiskCategory;
import com.chicu.breachml.common.enums.SourceLabel;

import java.time.LocalDate;

/**
 * @param daysToBreach        null при combinedScore < 40
 * @param predictedBreachDate null вместе с daysToBreach
 */
public record BlendResult(
        int combinedScore,
        int combinedConfidence,
        RiskCategory category,
        Integer daysToBreach,
        LocalDate predictedBreachDate,
        SourceLabel sourceLabel
) {
}
