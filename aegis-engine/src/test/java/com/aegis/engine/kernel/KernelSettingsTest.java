package com.aegis.engine.kernel;

import com.aegis.engine.config.ConfigurationException;
import com.aegis.engine.gate.GateCatalog;
import com.aegis.engine.ledger.ProvenanceLedger;
import com.aegis.engine.workflow.WorkflowDefinitions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KernelSettingsTest {

    @Test
    void defaults() {
        KernelSettings settings = KernelSettings.defaults();

        assertThat(settings.storeType()).isEqualTo(KernelSettings.StoreType.MEMORY);
        assertThat(settings.ledgerDirectory()).isNull();
        assertThat(settings.signerId()).isEqualTo(ProvenanceLedger.DEFAULT_SIGNER_ID);
        assertThat(settings.gatesResource()).isEqualTo(GateCatalog.DEFAULT_RESOURCE);
        assertThat(settings.workflowResource()).isEqualTo(WorkflowDefinitions.DEFAULT_RESOURCE);
    }

    @Test
    void load_readsBundledProperties() {
        assertThat(KernelSettings.load()).isEqualTo(KernelSettings.defaults());
    }

    @Test
    void fromProperties_selectsFileStore() {
        Properties properties = new Properties();
        properties.setProperty(KernelSettings.STORE_KEY, " File ");
        properties.setProperty(KernelSettings.DIRECTORY_KEY, "/var/lib/aegis");
        properties.setProperty(KernelSettings.SIGNER_KEY, "ci-ledger");

        KernelSettings settings = KernelSettings.fromProperties(properties);

        assertThat(settings.storeType()).isEqualTo(KernelSettings.StoreType.FILE);
        assertThat(settings.ledgerDirectory()).isEqualTo(Path.of("/var/lib/aegis"));
        assertThat(settings.signerId()).isEqualTo("ci-ledger");
        assertThat(settings.gatesResource()).isEqualTo(GateCatalog.DEFAULT_RESOURCE);
    }

    @Test
    void fromProperties_rejectsBadStores() {
        Properties fileWithoutDirectory = new Properties();
        fileWithoutDirectory.setProperty(KernelSettings.STORE_KEY, "file");
        Properties unknownStore = new Properties();
        unknownStore.setProperty(KernelSettings.STORE_KEY, "postgres");

        assertThatThrownBy(() -> KernelSettings.fromProperties(fileWithoutDirectory))
                .isInstanceOf(ConfigurationException.class).hasMessageContaining(KernelSettings.DIRECTORY_KEY);
        assertThatThrownBy(() -> KernelSettings.fromProperties(unknownStore))
                .isInstanceOf(ConfigurationException.class).hasMessageContaining("postgres");
    }
}
