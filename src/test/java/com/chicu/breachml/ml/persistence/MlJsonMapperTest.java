package com.chicu.breachml.ml.persistence;

import com.chicu.breachml.ml.backend.EpochStats;
import com.chicu.breachml.ml.backend.ModelWeights;
import com.chicu.breachml.ml.backend.WeightFormat;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MlJsonMapperTest {

    private final MlJsonMapper json = new MlJsonMapper(new ObjectMapper());

    @Test
    void tensorList_readsDataAndShape() {
        ModelWeights w = json.readWeights(WeightFormat.TENSOR_LIST,
                "[{\"data\":[0.1,0.2,0.3,0.4],\"shape\":[2,2]},{\"data\":[0.0,0.0],\"shape\":[1,2]}]");

        assertEquals(WeightFormat.TENSOR_LIST, w.format());
        assertEquals(2, w.tensors().size());
        assertArrayEquals(new long[]{2, 2}, w.tensors().get(0).shape());
        assertTrue(w.layers().isEmpty());
    }

    @Test
    void tensorList_entryWithoutShape_isMalformed() {
        assertThrows(MalformedWeightsException.class,
                () -> json.readWeights(WeightFormat.TENSOR_LIST, "[{\"data\":[0.1]}]"));
        assertThrows(MalformedWeightsException.class,
                () -> json.readWeights(WeightFormat.TENSOR_LIST, "{\"layers\":[]}"));
    }

    @Test
    void denseLayers_acceptsBareArrayWithoutBiases() {
        ModelWeights w = json.readWeights(WeightFormat.DENSE_LAYERS, "[[0.1,0.2],[0.3]]");

        assertEquals(2, w.layers().size());
        assertNull(w.biases());
    }

    @Test
    void denseLayers_writtenWithBiases_areReadBack() {
        ModelWeights original = ModelWeights.denseLayers(List.of(new double[]{0.5, -0.5}, new double[]{1.0}), new double[]{0.1, 0.2});

        ModelWeights read = json.readWeights(WeightFormat.DENSE_LAYERS, json.writeWeights(original));

        assertArrayEquals(new double[]{0.5, -0.5}, read.layers().get(0));
        assertArrayEquals(new double[]{0.1, 0.2}, read.biases());
    }

    @Test
    void missingTagEmptyPayloadOrGarbage_areMalformed() {
        assertThrows(MalformedWeightsException.class, () -> json.readWeights(null, "[[0.1]]"));
        assertThrows(MalformedWeightsException.class, () -> json.readWeights(WeightFormat.DENSE_LAYERS, " "));
        assertThrows(MalformedWeightsException.class, () -> json.readWeights(WeightFormat.DENSE_LAYERS, "{not json"));
        assertThrows(MalformedWeightsException.class, () -> json.readWeights(WeightFormat.DENSE_LAYERS, "[1, 2]"));
        assertThrows(MalformedWeightsException.class, () -> json.readWeights(WeightFormat.DENSE_LAYERS, "[[\"a\"]]"));
    }

    @Test
    void epochHistory_keepsNullValidationFields() {
        String s = json.writeEpochs(List.of(EpochStats.of(0, 0.25, 60.0), new EpochStats(1, 0.2, 70.0, 0.3, 55.0)));

        List<EpochStats> read = json.readEpochs(s);

        assertEquals(2, read.size());
        assertNull(read.get(0).validationAccuracy());
        assertEquals(55.0, read.get(1).validationAccuracy());
    }

    @Test
    void featureWeights_keepInsertionOrder() {
        Map<String, Double> read = json.readDoubleMap("{\"b\":0.2,\"a\":0.1}");

        assertEquals(List.of("b", "a"), List.copyOf(read.keySet()));
        assertTrue(json.readDoubleMap(null).isEmpty());
    }
}
