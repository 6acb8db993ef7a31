package com.chicu.breachml.ml.backend;

import java.util.List;
import java.util.function.Supplier;

/**
 * Неизменяемый снимок модели на один вызов инференса.
 *
 * <p>Веса декодируются лениво и не более одного раза: при попадании в {@link ModelCache}
 * JSON весов вообще не разбирается.</p>
 *
 * @param revision      ревизия весов; вместе с modelId образует ключ кеша бэкендов
 * @param hiddenLayers  скрытые слои, с которыми обучены сохранённые веса
 * @param weightsFormat тег формата весов; null, если весов нет или они legacy (без тега)
 * @param weightsSource декодер весов; отдаёт null для битого JSON
 */
public record ModelSnapshot(
        Long modelId,
        long revision,
        String organisationId,
        List<String> inputFeatures,
        List<Integer> hiddenLayers,
        WeightFormat weightsFormat,
        Supplier<ModelWeights> weightsSource,
        Double trainingAccuracy,
        long feedbackCount
) {

    public ModelSnapshot {
        inputFeatures = inputFeatures == null ? List.of() : List.copyOf(inputFeatures);
        hiddenLayers = hiddenLayers == null ? List.of() : List.copyOf(hiddenLayers);
        if (weightsSource != null) {
            weightsSource = new Memoized(weightsSource);
        } else {
            weightsSource = () -> null;
        }
    }

    /** Снимок с уже декодированными весами. */
    public static ModelSnapshot of(Long modelId,
                                   long revision,
                                   String organisationId,
                                   List<String> inputFeatures,
                                   List<Integer> hiddenLayers,
                                   ModelWeights weights,
                                   Double trainingAccuracy,
                                   long feedbackCount) {
        boolean usable = weights != null && !weights.isEmpty();
        return new ModelSnapshot(modelId, revision, organisationId, inputFeatures, hiddenLayers,
                usable ? weights.format() : null, () -> weights, trainingAccuracy, feedbackCount);
    }

    /** Есть ли тегированные веса. Сам JSON не разбирает. */
    public boolean hasUsableWeights() {
        return weightsFormat != null;
    }

    public ModelWeights weights() {
        return weightsSource.get();
    }

    /**
     * Архитектура для бэкенда: объявленные слои модели, если её веса в формате этого бэкенда,
     * иначе слои холодного старта бэкенда.
     */
    public ModelArchitecture architectureFor(ModelBackendFactory factory) {
        boolean own = weightsFormat != null && weightsFormat == factory.weightFormat() && !hiddenLayers.isEmpty();
        return new ModelArchitecture(inputFeatures.size(), own ? hiddenLayers : factory.defaultHiddenLayers());
    }

    private static final class Memoized implements Supplier<ModelWeights> {

        private Supplier<ModelWeights> delegate;
        private ModelWeights value;

        Memoized(Supplier<ModelWeights> delegate) {
            this.delegate = delegate;
        }

        @Override
        public synchronized ModelWeights get() {
            if (delegate != null) {
                value = delegate.get();
                delegate = null;
            }
            return value;
        }
    }
}
