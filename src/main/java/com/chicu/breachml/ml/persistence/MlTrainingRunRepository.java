package com.chicu.breachml.ml.persistence;

import com.chicu.breachml.common.enums.ModelStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

public interface MlTrainingRunRepository extends JpaRepository<MlTrainingRunEntity, Long> {

    List<MlTrainingRunEntity> findTop10ByModelIdOrderByStartedAtDescIdDesc(Long modelId);

    List<MlTrainingRunEntity> findTop20ByOrganisationIdOrderByStartedAtDescIdDesc(String organisationId);

    boolean existsByModelIdAndStatus(Long modelId, ModelStatus status);

    /**
     * Прогресс пишем только пока прогон в TRAINING: завершённый прогон не "оживает".
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update MlTrainingRunEntity r
               set r.currentEpoch = :epoch,
                   r.progressPercent = :percent,
                   r.epochHistoryJson = :history
             where r.id = :id
               and r.status = com.chicu.breachml.common.enums.ModelStatus.TRAINING
            """)
    int updateProgress(
            @Param("id") Long id,
            @Param("epoch") int epoch,
            @Param("percent") int percent,
            @Param("history") String epochHistoryJson
    );
}
