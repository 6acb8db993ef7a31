package com.chicu.breachml.ml.persistence;

import com.chicu.breachml.common.enums.FeedbackType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

public interface MlFeedbackRepository extends JpaRepository<MlFeedbackEntity, Long> {

    List<MlFeedbackEntity> findByPredictionIdOrderByIdAsc(Long predictionId);

    /**
     * Неиспользованный фидбек, из которого можно получить метку:
     * CORRECT или с поправленным скором. Остальные строки и строки, уже признанные
     * непригодными, в обучение не попадают.
     */
    @Query("""
            select f from MlFeedbackEntity f
             where f.modelId = :modelId
               and f.usedForTraining = false
               and f.trainingSkipped = false
               and (f.feedbackType = com.chicu.breachml.common.enums.FeedbackType.CORRECT
                    or f.correctedScore is not null)
             order by f.id asc
            """)
    List<MlFeedbackEntity> findTrainable(@Param("modelId") Long modelId, Pageable pageable);

    long countByModelIdAndUsedForTrainingFalse(Long modelId);

    long countByModelId(Long modelId);

    long countByModelIdAndFeedbackType(Long modelId, FeedbackType feedbackType);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update MlFeedbackEntity f
               set f.usedForTraining = true,
                   f.trainingRunId = :runId
             where f.id in :ids
               and f.usedForTraining = false
            """)
    int markUsedForTraining(@Param("ids") Collection<Long> ids, @Param("runId") Long runId);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update MlFeedbackEntity f
               set f.trainingSkipped = true
             where f.id in :ids
               and f.usedForTraining = false
            """)
    int markSkippedForTraining(@Param("ids") Collection<Long> ids);
}
