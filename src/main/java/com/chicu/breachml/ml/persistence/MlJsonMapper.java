package com.chicu.breachml.ml.persistence;

import com.chicu.breachml.ml.backend.EpochStats;
import com.chicu.breachml.ml.backend.ModelWeights;
import com.chicu.breachml.ml.backend.TensorRecord;
import com.chicu.breachml.ml.backend.WeightFormat;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Единая точка (де)сериализации JSON-колонок ML-слоя.
 *
 * <p>Форматы весов:
 * TENSOR_LIST: {@code [{"data":[...],"shape":[...]}, ...]};
 * DENSE_LAYERS: {@code {"layers":[[...],...],"biases":[...]}} (старый вариант - просто {@code [[...],...]}).</p>
 */
@Component
@RequiredArgsConstructor
public class MlJsonMapper {

    private static final TypeReference<List<TensorRecord>> TENSORS = new TypeReference<>() {
    };
    private static final TypeReference<List<double[]>> LAYERS = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {
    };
    private static final TypeReference<List<Integer>> INTS = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, Double>> DOUBLE_MAP = new TypeReference<>() {
    };
    private static final TypeReference<List<EpochStats>> EPOCHS = new TypeReference<>() {
    };

    private final ObjectMapper om;

    // =========================================================
    // weights
    // =========================================================

    public String writeWeights(ModelWeights weights) {
        if (weights == null) return null;
        if (weights.format() == WeightFormat.TENSOR_LIST) {
            return write(weights.tensors());
        }
        ObjectNode node = om.createObjectNode();
        node.set("layers", om.valueToTree(weights.layers()));
        if (weights.biases() != null) {
            node.set("biases", om.valueToTree(weights.biases()));
        }
        return write(node);
    }

    /**
     * @throws MalformedWeightsException если JSON не соответствует заявленному формату
     */
    public ModelWeights readWeights(WeightFormat format, String json) {
        if (format == null) {
            throw new MalformedWeightsException("weights have no format tag (legacy payload)");
        }
        if (json == null || json.isBlank()) {
            throw new MalformedWeightsException("weights payload is empty");
        }
        try {
            JsonNode root = om.readTree(json);
            return switch (format) {
                case TENSOR_LIST -> readTensorList(root);
                case DENSE_LAYERS -> readDenseLayers(root);
            };
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedWeightsException("bad " + format + " payload: " + e.getMessage(), e);
        }
    }

    private ModelWeights readTensorList(JsonNode root) throws JsonProcessingException {
        if (!root.isArray()) {
            throw new MalformedWeightsException("TENSOR_LIST payload must be an array");
        }
        for (JsonNode t : root) {
            if (!t.isObject() || !t.has("data") || !t.has("shape")) {
                throw new MalformedWeightsException("TENSOR_LIST entry must have data and shape");
            }
        }
        List<TensorRecord> tensors = om.treeToValue(root, om.getTypeFactory().constructType(TENSORS));
        return ModelWeights.tensors(tensors);
    }

    private ModelWeights readDenseLayers(JsonNode root) throws JsonProcessingException {
        JsonNode layersNode;
        double[] biases = null;
        if (root.isArray()) {
            layersNode = root;
        } else if (root.isObject() && root.has("layers")) {
            layersNode = root.get("layers");
            JsonNode b = root.get("biases");
            if (b != null && !b.isNull()) {
                biases = om.treeToValue(b, double[].class);
            }
        } else {
            throw new MalformedWeightsException("DENSE_LAYERS payload must be an array or {layers, biases}");
        }
        if (!(layersNode instanceof ArrayNode arr)) {
            throw new MalformedWeightsException("DENSE_LAYERS layers must be an array");
        }
        for (JsonNode layer : arr) {
            if (!layer.isArray()) {
                throw new MalformedWeightsException("DENSE_LAYERS layer must be a flat number array");
            }
        }
        List<double[]> layers = om.treeToValue(arr, om.getTypeFactory().constructType(LAYERS));
        return ModelWeights.denseLayers(layers, biases);
    }

    // =========================================================
    // прочие колонки
    // =========================================================

    public String writeStrings(List<String> values) {
        return write(values);
    }

    public List<String> readStrings(String json) {
        return json == null ? List.of() : read(json, STRINGS);
    }

    public String writeInts(List<Integer> values) {
        return write(values);
    }

    public List<Integer> readInts(String json) {
        return json == null ? List.of() : read(json, INTS);
    }

    public String writeDoubleMap(Map<String, Double> values) {
        return values == null ? null : write(values);
    }

    public Map<String, Double> readDoubleMap(String json) {
        return json == null ? new LinkedHashMap<>() : read(json, DOUBLE_MAP);
    }

    public String writeEpochs(List<EpochStats> epochs) {
        return write(epochs != null ? epochs : new ArrayList<>());
    }

    public List<EpochStats> readEpochs(String json) {
        return json == null ? List.of() : read(json, EPOCHS);
    }

    private String write(Object value) {
        try {
            return om.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("json write failed: " + e.getMessage(), e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        try {
            return om.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("json read failed: " + e.getMessage(), e);
        }
    }
}
