package com.aegis.engine.gate;

import com.aegis.core.domain.Gate;
import com.aegis.core.json.CanonicalJson;
import com.aegis.engine.config.ConfigurationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative gate definitions, keyed by id.
 * <p>
 * The JSON form is {@code {"gates": [ ... ]}}. Validator names are not
 * checked here; an unknown one surfaces as an {@code error} check when the
 * gate is evaluated.
 */
public class GateCatalog {

    public static final String DEFAULT_RESOURCE = "gates/default-gates.json";

    private final Map<String, Gate> gates;

    public GateCatalog(Collection<Gate> gates) {
        Map<String, Gate> byId = new LinkedHashMap<>();
        for (Gate gate : gates) {
            if (byId.putIfAbsent(gate.id(), gate) != null) {
                throw new ConfigurationException("Duplicate gate id: " + gate.id());
            }
        }
        this.gates = Collections.unmodifiableMap(byId);
    }

    public static GateCatalog fromClasspath(String resource) {
        try (InputStream in = GateCatalog.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Gate resource not found: " + resource);
            }
            return parse(CanonicalJson.mapper().readTree(in), resource);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read gate resource " + resource, e);
        }
    }

    public static GateCatalog fromFile(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(CanonicalJson.mapper().readTree(in), file.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read gate file " + file, e);
        }
    }

    public static GateCatalog defaults() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    private static GateCatalog parse(JsonNode root, String origin) {
        JsonNode array = root != null ? root.get("gates") : null;
        if (array == null || !array.isArray()) {
            throw new ConfigurationException(origin + " must contain a \"gates\" array");
        }
        ObjectMapper mapper = CanonicalJson.mapper();
        List<Gate> gates = new ArrayList<>();
        for (JsonNode node : array) {
            try {
                gates.add(mapper.treeToValue(node, Gate.class));
            } catch (IOException | IllegalArgumentException e) {
                throw new ConfigurationException("Invalid gate in " + origin + ": " + node, e);
            }
        }
        return new GateCatalog(gates);
    }

    /**
     * @throws UnknownGateException if no gate has this id
     */
    public Gate require(String gateId) {
        Gate gate = gateId != null ? gates.get(gateId) : null;
        if (gate == null) {
            throw new UnknownGateException(gateId);
        }
        return gate;
    }

    public boolean contains(String gateId) {
        return gateId != null && gates.containsKey(gateId);
    }

    public Collection<Gate> all() {
        return gates.values();
    }

    public List<Gate> forPhase(String phase) {
        Objects.requireNonNull(phase, "Phase cannot be null");
        return gates.values().stream().filter(gate -> phase.equals(gate.phase())).toList();
    }
}
