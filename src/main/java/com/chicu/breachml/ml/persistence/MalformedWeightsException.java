package com.chicu.breachml.ml.persistence;

/**
 * Сохранённые веса не читаются (нет тега формата, битый JSON, не та структура).
 * Для инференса это "нет пригодной ML-модели", а не падение.
 */
public class MalformedWeightsException extends RuntimeException {

    public MalformedWeightsException(String message) {
        super(message);
    }

    public MalformedWeightsException(String message, Throwable cause) {
        super(message, cause);
    }
}
