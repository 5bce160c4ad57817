package com.aegis.engine.kernel;

import com.aegis.engine.config.ConfigurationException;
import com.aegis.engine.gate.GateCatalog;
import com.aegis.engine.ledger.ProvenanceLedger;
import com.aegis.engine.workflow.WorkflowDefinitions;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

/**
 * Kernel configuration.
 * <p>
 * {@link #load()} starts from {@link #defaults()}, applies a classpath
 * {@code aegis.properties} if present, then any {@code aegis.*} system
 * properties.
 *
 * @param storeType       where ledger records live
 * @param ledgerDirectory directory of the file store; required for {@link StoreType#FILE}
 * @param signerId        recorded as {@code signedBy} on every record
 * @param gatesResource   classpath resource with gate definitions
 * @param workflowResource classpath resource with the workflow definition
 */
public record KernelSettings(
        StoreType storeType,
        Path ledgerDirectory,
        String signerId,
        String gatesResource,
        String workflowResource
) {
    public static final String PROPERTIES_RESOURCE = "aegis.properties";

    public static final String STORE_KEY = "aegis.ledger.store";
    public static final String DIRECTORY_KEY = "aegis.ledger.directory";
    public static final String SIGNER_KEY = "aegis.signer.id";
    public static final String GATES_KEY = "aegis.gates.resource";
    public static final String WORKFLOW_KEY = "aegis.workflow.resource";

    public KernelSettings {
        storeType = storeType != null ? storeType : StoreType.MEMORY;
        signerId = signerId != null && !signerId.isBlank() ? signerId : ProvenanceLedger.DEFAULT_SIGNER_ID;
        gatesResource = gatesResource != null ? gatesResource : GateCatalog.DEFAULT_RESOURCE;
        workflowResource = workflowResource != null ? workflowResource : WorkflowDefinitions.DEFAULT_RESOURCE;
        if (storeType == StoreType.FILE && ledgerDirectory == null) {
            throw new ConfigurationException("A file ledger store needs " + DIRECTORY_KEY);
        }
    }

    public static KernelSettings defaults() {
        return new KernelSettings(StoreType.MEMORY, null, null, null, null);
    }

    public static KernelSettings load() {
        Properties properties = new Properties();
        try (InputStream in = KernelSettings.class.getClassLoader().getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + PROPERTIES_RESOURCE, e);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith("aegis.")) {
                properties.setProperty(name, System.getProperty(name));
            }
        }
        return fromProperties(properties);
    }

    public static KernelSettings fromProperties(Properties properties) {
        KernelSettings defaults = defaults();
        String store = properties.getProperty(STORE_KEY);
        String directory = properties.getProperty(DIRECTORY_KEY);
        return new KernelSettings(
                store != null && !store.isBlank() ? StoreType.parse(store) : defaults.storeType(),
                directory != null && !directory.isBlank() ? Path.of(directory) : null,
                properties.getProperty(SIGNER_KEY, defaults.signerId()),
                properties.getProperty(GATES_KEY, defaults.gatesResource()),
                properties.getProperty(WORKFLOW_KEY, defaults.workflowResource()));
    }

    public KernelSettings withFileStore(Path directory) {
        return new KernelSettings(StoreType.FILE, directory, signerId, gatesResource, workflowResource);
    }

    public enum StoreType {
        MEMORY,
        FILE;

        static StoreType parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown ledger store type: " + value, e);
            }
        }
    }
}
