package com.chicu.breachml.risk;

import java.time.Instant;

/**
 * Недавняя история объекта, нужная для фич.
 *
 * @param lastCertificateIssuedAt дата выдачи последнего сертификата, null если сертификатов нет
 */
public record EntityHistory(
        Instant lastCertificateIssuedAt,
        int openActions,
        int historicalBreaches
) {

    public static EntityHistory empty() {
        return new EntityHistory(null, 0, 0);
    }
}
