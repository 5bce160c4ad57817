package com.aegis.engine.workflow;

import com.aegis.core.json.CanonicalJson;
import com.aegis.engine.config.ConfigurationException;
import com.aegis.engine.gate.GateCatalog;
import com.aegis.engine.gate.UnknownGateException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads workflow definitions from JSON.
 */
public final class WorkflowDefinitions {

    public static final String DEFAULT_RESOURCE = "workflow/foundry-workflow.json";

    private WorkflowDefinitions() {
    }

    public static WorkflowDefinition defaults() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static WorkflowDefinition fromClasspath(String resource) {
        try (InputStream in = WorkflowDefinitions.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Workflow resource not found: " + resource);
            }
            return read(in, resource);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read workflow resource " + resource, e);
        }
    }

    public static WorkflowDefinition fromFile(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in, file.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read workflow file " + file, e);
        }
    }

    /**
     * Resolves every gate the workflow requires against a catalog.
     *
     * @throws UnknownGateException for the first gate the catalog lacks
     */
    public static void checkGates(WorkflowDefinition definition, GateCatalog catalog) {
        definition.requiredGateIds().forEach(catalog::require);
    }

    private static WorkflowDefinition read(InputStream in, String origin) throws IOException {
        try {
            return CanonicalJson.mapper().readValue(in, WorkflowDefinition.class);
        } catch (ValueInstantiationException e) {
            if (e.getCause() instanceof ConfigurationException configurationException) {
                throw configurationException;
            }
            throw new ConfigurationException("Invalid workflow in " + origin + ": " + e.getOriginalMessage(), e);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid workflow in " + origin + ": " + e.getOriginalMessage(), e);
        }
    }
}
