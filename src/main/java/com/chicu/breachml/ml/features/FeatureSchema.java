package com.chicu.breachml.ml.features;

import com.chicu.breachml.ml.ModelConfigurationException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Упорядоченный список имён фич.
 * Порядок = порядок входов сети, поэтому любое расхождение - ошибка конфигурации.
 */
public class FeatureSchema {

    private final String[] names;
    private final String schemaHash;

    public FeatureSchema(String[] names) {
        if (names == null || names.length == 0) {
            throw new IllegalArgumentException("feature schema is empty");
        }
        if (new LinkedHashSet<>(Arrays.asList(names)).size() != names.length) {
            throw new IllegalArgumentException("duplicate feature names: " + Arrays.toString(names));
        }
        this.names = names.clone();
        this.schemaHash = sha256(String.join("|", this.names));
    }

    public FeatureSchema(List<String> names) {
        this(names != null ? names.toArray(new String[0]) : null);
    }

    public String[] featureNames() {
        return names.clone();
    }

    public List<String> featureList() {
        return List.of(names);
    }

    public int size() {
        return names.length;
    }

    public String schemaHash() {
        return schemaHash;
    }

    /**
     * Проверяет, что объявленный моделью список фич совпадает со схемой (и по составу, и по порядку).
     */
    public void requireSameAs(List<String> declared) {
        if (declared == null || !featureList().equals(declared)) {
            throw new ModelConfigurationException(
                    "model feature list " + declared + " does not match extractor schema " + featureList());
        }
    }

    /**
     * Строгая сборка вектора: набор ключей должен совпадать со схемой,
     * значения должны быть конечными.
     */
    public double[] toVector(Map<String, Double> features) {
        if (features == null) {
            throw new ModelConfigurationException("features map is null");
        }
        Set<String> expected = Set.of(names);
        if (!expected.equals(features.keySet())) {
            throw new ModelConfigurationException(
                    "feature keys " + features.keySet() + " do not match schema " + featureList());
        }

        double[] x = new double[names.length];
        for (int i = 0; i < names.length; i++) {
            Double v = features.get(names[i]);
            if (v == null || !Double.isFinite(v)) {
                throw new ModelConfigurationException("feature '" + names[i] + "' is not a finite number: " + v);
            }
            x[i] = v;
        }
        return x;
    }

    private static String sha256(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(s.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(dig);
        } catch (Exception e) {
            throw new IllegalStateException("sha256 error: " + e.getMessage(), e);
        }
    }
}
