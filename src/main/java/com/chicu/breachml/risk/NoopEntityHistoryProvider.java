package com.chicu.breachml.risk;

/**
 * Заглушка: истории нет, фичи берут дефолты.
 */
public class NoopEntityHistoryProvider implements EntityHistoryProvider {

    @Override
    public EntityHistory historyOf(String entityId) {
        return EntityHistory.empty();
    }
}
