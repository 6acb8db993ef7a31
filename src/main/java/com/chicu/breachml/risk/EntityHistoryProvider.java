package com.chicu.breachml.risk;

public interface EntityHistoryProvider {

    EntityHistory historyOf(String entityId);
}
