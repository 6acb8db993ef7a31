package com.chicu.breachml.ml.persistence;

import com.chicu.breachml.common.enums.PredictionType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

public interface MlModelRepository extends JpaRepository<MlModelEntity, Long> {

    Optional<MlModelEntity> findFirstByOrganisationIdAndPredictionTypeAndActiveTrueOrderByVersionDesc(
            String organisationId,
            PredictionType predictionType
    );

    Optional<MlModelEntity> findFirstByOrganisationIdAndPredictionTypeOrderByVersionDesc(
            String organisationId,
            PredictionType predictionType
    );

    List<MlModelEntity> findByOrganisationId(String organisationId);

    // ===== атомарные счётчики (не читаем-пишем сущность целиком) =====

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update MlModelEntity m set m.totalPredictions = m.totalPredictions + 1 where m.id = :id")
    int incrementTotalPredictions(@Param("id") Long id);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update MlModelEntity m
               set m.feedbackCount = m.feedbackCount + 1,
                   m.correctPredictions = m.correctPredictions + :correctDelta
             where m.id = :id
            """)
    int incrementFeedback(@Param("id") Long id, @Param("correctDelta") long correctDelta);
}
