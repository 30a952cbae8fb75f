package de.anton.pv.solver.iv_solver.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import de.anton.pv.solver.iv_solver.model.DerivedMetrics;
import de.anton.pv.solver.iv_solver.model.FitResult;
import de.anton.pv.solver.iv_solver.model.FittedParameters;
import de.anton.pv.solver.iv_solver.model.HashUtils;
import de.anton.pv.solver.iv_solver.model.ParameterBounds;
import de.anton.pv.solver.iv_solver.model.ParameterName;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical JSON of (fingerprint, configuration, parameters, metrics) and its
 * SHA-256. Keys are sorted at every level; doubles are written in their
 * shortest round-trip form. The time budget and the parallel flag are not
 * part of the configuration digest since they do not change a Reference
 * result.
 */
public class ResultHasher {

    static final int CANONICAL_VERSION = 1;

    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    public String hash(FitResult result, ModelConfiguration config) {
        return HashUtils.sha256Hex(canonicalJson(result, config));
    }

    public String canonicalJson(FitResult result, ModelConfiguration config) {
        Map<String, Object> root = new TreeMap<>();
        root.put("version", CANONICAL_VERSION);
        root.put("fingerprint", result.getFingerprint());
        root.put("status", result.getStatus().name());
        root.put("errorKind", result.getErrorKind() != null ? result.getErrorKind().name() : null);
        root.put("measurementKind", result.getMeasurementKind() != null ? result.getMeasurementKind().name() : null);
        root.put("configuration", configuration(config));
        root.put("parameters", parameters(result.getParameters()));
        root.put("metrics", metrics(result.getMetrics()));
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Canonical serialization failed", e);
        }
    }

    public static Map<String, Object> configuration(ModelConfiguration config) {
        SolverSettings s = config.settings();
        Map<String, Object> map = new TreeMap<>();
        map.put("modelKind", config.modelKind().name());
        map.put("mode", config.mode().name());
        map.put("seed", config.seed());
        Map<String, Object> bounds = new TreeMap<>();
        ParameterBounds parameterBounds = config.bounds();
        for (Map.Entry<ParameterName, ParameterBounds.Bound> entry : parameterBounds.asMap().entrySet()) {
            bounds.put(entry.getKey().symbol(), List.of(entry.getValue().lower(), entry.getValue().upper()));
        }
        map.put("bounds", bounds);
        map.put("populationMultiplier", s.populationMultiplier());
        map.put("maxGenerations", s.maxGenerations());
        map.put("globalTolerance", s.globalTolerance());
        map.put("mutationMin", s.mutationMin());
        map.put("mutationMax", s.mutationMax());
        map.put("recombination", s.recombination());
        map.put("costTolerance", s.costTolerance());
        map.put("stepTolerance", s.stepTolerance());
        map.put("gradientTolerance", s.gradientTolerance());
        map.put("maxEvaluations", s.maxEvaluations());
        map.put("maxIterations", s.maxIterations());
        map.put("noiseTrials", s.noiseTrials());
        map.put("noiseLevel", s.noiseLevel());
        map.put("noiseTrialGenerations", s.noiseTrialGenerations());
        map.put("boundaryMargin", s.boundaryMargin());
        map.put("incidentPowerDensity", s.incidentPowerDensity());
        map.put("kneeWeighting", s.kneeWeighting());
        return map;
    }

    public static Map<String, Object> parameters(FittedParameters parameters) {
        if (parameters == null) {
            return null;
        }
        Map<String, Object> map = new TreeMap<>();
        map.put("model", parameters.kind().name());
        for (Map.Entry<ParameterName, Double> entry : parameters.asMap().entrySet()) {
            map.put(entry.getKey().symbol(), entry.getValue());
        }
        return map;
    }

    public static Map<String, Object> metrics(DerivedMetrics metrics) {
        if (metrics == null) {
            return null;
        }
        Map<String, Object> map = new TreeMap<>();
        map.put("Jsc", metrics.shortCircuitCurrentDensity());
        map.put("Voc", metrics.openCircuitVoltage());
        map.put("FF", metrics.fillFactor());
        map.put("PCE", metrics.efficiencyPercent());
        map.put("Pmax", metrics.maxPowerWatts());
        map.put("Vmpp", metrics.mppVoltage());
        map.put("Impp", metrics.mppCurrent());
        map.put("Isc", metrics.shortCircuitCurrent());
        map.put("RsArea", metrics.seriesResistanceOhmCm2());
        map.put("RshArea", metrics.shuntResistanceOhmCm2());
        map.put("Pin", metrics.incidentPowerDensity());
        return map;
    }
}
