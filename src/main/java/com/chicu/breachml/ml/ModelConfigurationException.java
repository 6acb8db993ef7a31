package com.chicu.breachml.ml;

/**
 * Ошибка конфигурации модели (несовпадение схемы фич, размеров весов и т.п.).
 * Не деградируется молча - пробрасывается вызывающему.
 */
public class ModelConfigurationException extends RuntimeException {

    public ModelConfigurationException(String message) {
        super(message);
    }
}
