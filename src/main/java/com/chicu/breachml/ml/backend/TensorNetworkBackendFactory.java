package com.chicu.breachml.ml.backend;

import com.chicu.breachml.ml.MlProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

@Order(1)
@Component
@RequiredArgsConstructor
public class TensorNetworkBackendFactory implements ModelBackendFactory {

    private final MlProperties props;

    @Override
    public String name() {
        return TensorNetworkBackend.NAME;
    }

    @Override
    public WeightFormat weightFormat() {
        return WeightFormat.TENSOR_LIST;
    }

    @Override
    public int confidenceBase() {
        return 40;
    }

    @Override
    public List<Integer> defaultHiddenLayers() {
        return props.getModel().getTensorHiddenLayers();
    }

    @Override
    public ModelBackend create(ModelArchitecture architecture) {
        Long seed = props.getModel().getSeed();
        return new TensorNetworkBackend(
                architecture,
                seed != null ? seed : ThreadLocalRandom.current().nextLong()
        );
    }
}
