package com.chicu.breachml.ml.backend;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Загруженные бэкенды по (modelId, backend).
 *
 * <p>Запись помнит ревизию весов, из которой она собрана: снимок с другой ревизией
 * пересобирает бэкенд. Уже выданный экземпляр никто не меняет, поэтому идущие
 * прогнозы на старых весах не затрагиваются. Отказ загрузки тоже кешируется
 * (пустая запись), чтобы не десериализовать битые веса на каждый запрос.</p>
 */
@Slf4j
@Component
public class ModelCache {

    private record Key(Long modelId, String backend) {
    }

    private record Entry(long revision, ModelBackend backend) {
    }

    private final Map<Key, Entry> entries = new ConcurrentHashMap<>();

    public Optional<ModelBackend> getOrLoad(ModelSnapshot snapshot, ModelBackendFactory factory) {
        Key key = new Key(snapshot.modelId(), factory.name());
        Entry entry = entries.compute(key, (k, current) -> {
            if (current != null && current.revision() == snapshot.revision()) {
                return current;
            }
            return new Entry(snapshot.revision(), load(snapshot, factory));
        });
        return Optional.ofNullable(entry.backend());
    }

    /** После замены весов модели. */
    public void invalidate(Long modelId) {
        int before = entries.size();
        entries.keySet().removeIf(k -> k.modelId().equals(modelId));
        log.debug("🧠 model cache invalidated modelId={} removed={}", modelId, before - entries.size());
    }

    /** Выбросить один бэкенд (упал / завис на predict). */
    public void evict(Long modelId, String backend) {
        entries.remove(new Key(modelId, backend));
    }

    public int size() {
        return entries.size();
    }

    private static ModelBackend load(ModelSnapshot snapshot, ModelBackendFactory factory) {
        ModelBackend backend;
        boolean loaded;
        try {
            backend = factory.create(snapshot.architectureFor(factory));
            // веса декодируются только здесь, на промахе кеша
            ModelWeights weights = snapshot.weights();
            loaded = weights != null && backend.loadWeights(weights);
        } catch (RuntimeException | LinkageError e) {
            // LinkageError: нативная часть бэкенда не загрузилась
            log.warn("⚠️ backend create failed modelId={} backend={}: {}", snapshot.modelId(), factory.name(), e.toString());
            return null;
        }
        if (!loaded) {
            log.warn("⚠️ weights not loadable modelId={} revision={} backend={} format={}",
                    snapshot.modelId(), snapshot.revision(), factory.name(), snapshot.weightsFormat());
            return null;
        }
        return backend;
    }
}
