package com.chicu.breachml.ml.persistence;

import com.chicu.breachml.common.enums.RiskCategory;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface MlPredictionRepository extends JpaRepository<MlPredictionEntity, Long> {

    Optional<MlPredictionEntity> findByIdAndOrganisationId(Long id, String organisationId);

    List<MlPredictionEntity> findByOrganisationIdOrderByCreatedAtDescIdDesc(String organisationId, Pageable pageable);

    List<MlPredictionEntity> findByOrganisationIdAndEntityIdOrderByCreatedAtDescIdDesc(
            String organisationId, String entityId, Pageable pageable);

    List<MlPredictionEntity> findByOrganisationIdAndRiskCategoryOrderByCreatedAtDescIdDesc(
            String organisationId, RiskCategory riskCategory, Pageable pageable);

    List<MlPredictionEntity> findByOrganisationIdAndEntityIdAndRiskCategoryOrderByCreatedAtDescIdDesc(
            String organisationId, String entityId, RiskCategory riskCategory, Pageable pageable);

    /**
     * Прогнозы организации, новые первыми. null-фильтр = без фильтра.
     */
    default List<MlPredictionEntity> search(String organisationId, String entityId, RiskCategory category, Pageable pageable) {
        if (entityId != null && category != null) {
            return findByOrganisationIdAndEntityIdAndRiskCategoryOrderByCreatedAtDescIdDesc(organisationId, entityId, category, pageable);
        }
        if (entityId != null) {
            return findByOrganisationIdAndEntityIdOrderByCreatedAtDescIdDesc(organisationId, entityId, pageable);
        }
        if (category != null) {
            return findByOrganisationIdAndRiskCategoryOrderByCreatedAtDescIdDesc(organisationId, category, pageable);
        }
        return findByOrganisationIdOrderByCreatedAtDescIdDesc(organisationId, pageable);
    }

    long countByModelId(Long modelId);
}
