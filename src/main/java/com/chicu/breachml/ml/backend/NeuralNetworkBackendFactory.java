package com.chicu.breachml.ml.backend;

import com.chicu.breachml.ml.MlProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Random;

@Order(2)
@Component
@RequiredArgsConstructor
public class NeuralNetworkBackendFactory implements ModelBackendFactory {

    private final MlProperties props;

    @Override
    public String name() {
        return NeuralNetworkBackend.NAME;
    }

    @Override
    public WeightFormat weightFormat() {
        return WeightFormat.DENSE_LAYERS;
    }

    @Override
    public int confidenceBase() {
        return 30;
    }

    @Override
    public List<Integer> defaultHiddenLayers() {
        return props.getModel().getHiddenLayers();
    }

    @Override
    public ModelBackend create(ModelArchitecture architecture) {
        Long seed = props.getModel().getSeed();
        return new NeuralNetworkBackend(
                architecture,
                seed != null ? new Random(seed) : new Random()
        );
    }
}
