package com.chicu.breachml.ml.blend;

import com.chicu.breachml.common.enums.RiskCategory;
import com.chicu.breachml.common.enums.SourceLabel;
import com.chicu.breachml.ml.backend.MlScore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Смешивание статистического и ML-скора весами уверенности.
 *
 * <pre>
 * w_stat = statConf / (statConf + mlConf)
 * w_ml   = mlConf   / (statConf + mlConf)
 * score  = round(stat * w_stat + ml * w_ml)
 * conf   = round((statConf + mlConf) / 2)
 * </pre>
 *
 * Прогноз даты: score >= 70 -> max(1, round((100 - s) * 3)) дней,
 * 40..69 -> round(30 + (100 - s) * 2), ниже 40 даты нет.
 */
@Component
@RequiredArgsConstructor
public class BlendingEngine {

    static final int IMMINENT_THRESHOLD = 70;
    static final int WATCH_THRESHOLD = 40;

    private final Clock clock;

    public BlendResult blend(int statScore, int statConfidence, MlScore ml) {
        int combinedScore;
        int combinedConfidence;
        SourceLabel label;

        double confSum = ml != null ? (double) statConfidence + ml.confidence() : 0;
        if (ml == null || confSum <= 0) {
            combinedScore = statScore;
            combinedConfidence = statConfidence;
            label = SourceLabel.STATISTICAL;
        } else {
            double wStat = statConfidence / confSum;
            double wMl = ml.confidence() / confSum;
            combinedScore = (int) Math.round(statScore * wStat + ml.score() * wMl);
            combinedConfidence = (int) Math.round(confSum / 2.0);
            label = SourceLabel.ML_ENHANCED;
        }

        Integer days = daysToBreach(combinedScore);
        LocalDate breachDate = days != null ? LocalDate.now(clock).plusDays(days) : null;

        return new BlendResult(
                combinedScore,
                combinedConfidence,
                RiskCategory.fromScore(combinedScore),
                days,
                breachDate,
                label
        );
    }

    static Integer daysToBreach(int score) {
        if (score >= IMMINENT_THRESHOLD) {
            return (int) Math.max(1, Math.round((100 - score) * 3.0));
        }
        if (score >= WATCH_THRESHOLD) {
            return (int) Math.round(30 + (100 - score) * 2.0);
        }
        return null;
    }
}
