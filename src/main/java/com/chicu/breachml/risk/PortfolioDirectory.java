package com.chicu.breachml.risk;

import java.util.List;

/**
 * Список объектов портфеля организации (для bootstrap-обучения и тестовых прогнозов).
 */
public interface PortfolioDirectory {

    List<String> listEntityIds(String organisationId, int limit);
}
