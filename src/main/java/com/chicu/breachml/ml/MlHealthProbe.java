package com.chicu.breachml.ml;

import com.chicu.breachml.ml.backend.ModelArchitecture;
import com.chicu.breachml.ml.backend.TensorNetworkBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Проверка нативного тензорного движка на старте.
 * Если он не поднимается, работаем на fallback-бэкенде; приложение не валим.
 */
@Slf4j
@Component
public class MlHealthProbe implements ApplicationRunner {

    @Override
    public void run(ApplicationArguments args) {
        try {
            TensorNetworkBackend probe = new TensorNetworkBackend(new ModelArchitecture(2, List.of(2)), 42L);
            probe.initialize();
            double score = probe.predict(new double[]{0.5, 0.5});
            log.info("✅ tensor backend OK: probe score={}", score);
        } catch (Throwable e) {
            // UnsatisfiedLinkError и т.п. тоже сюда: нативных библиотек может не быть
            log.warn("⚠️ tensor backend NOT available, fallback backend will serve: {}", e.toString());
        }
    }
}
