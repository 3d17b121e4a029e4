package com.platform.replication.discovery;

import com.platform.replication.error.DiscoveryException;
import com.platform.replication.error.ErrorCode;
import com.platform.replication.model.Backend;
import com.platform.replication.model.BackendDescriptor;
import com.platform.replication.observability.StructuredLogger;
import com.platform.replication.support.Intents;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackendSelectorTest {

    private final BackendSelector selector = new BackendSelector(new StructuredLogger("test"), false);
    private final BackendSelector strictSelector = new BackendSelector(new StructuredLogger("test"), true);

    @Test
    void hintWinsOverStorageClass() {
        var intent = Intents.intent("orders", Intents.spec("ceph-rbd", "trident"));

        BackendSelector.Selection selection = selector.select(intent, discovered(Backend.CEPH, Backend.TRIDENT));

        assertThat(selection.backend()).isEqualTo(Backend.TRIDENT);
        assertThat(selection.rule()).isEqualTo(BackendSelector.RULE_HINT);
    }

    @Test
    void hintNamingAnUnavailableBackendFails() {
        var intent = Intents.intent("orders", Intents.spec("ceph-rbd", "powerstore"));

        assertThatThrownBy(() -> selector.select(intent, discovered(Backend.CEPH)))
            .isInstanceOf(DiscoveryException.class)
            .hasMessageContaining("powerstore");
    }

    @Test
    void storageClassKeywordsSelectTheBackend() {
        var intent = Intents.intent("orders", Intents.spec("Netapp-Gold", null));

        BackendSelector.Selection selection = selector.select(intent,
            discovered(Backend.CEPH, Backend.TRIDENT, Backend.POWERSTORE));

        assertThat(selection.backend()).isEqualTo(Backend.TRIDENT);
        assertThat(selection.rule()).isEqualTo(BackendSelector.RULE_STORAGE_CLASS);
    }

    @Test
    void ontapStorageClassSelectsTrident() {
        var intent = Intents.intent("orders", Intents.spec("ontap-san-economy", null));

        BackendSelector.Selection selection = selector.select(intent,
            discovered(Backend.POWERSTORE, Backend.CEPH, Backend.TRIDENT));

        assertThat(selection.backend()).isEqualTo(Backend.TRIDENT);
        assertThat(selection.rule()).isEqualTo(BackendSelector.RULE_STORAGE_CLASS);
    }

    @Test
    void keywordOfUnavailableBackendFallsThroughToFirstAvailable() {
        var intent = Intents.intent("orders", Intents.spec("dell-powerstore", null));

        BackendSelector.Selection selection = selector.select(intent, discovered(Backend.TRIDENT, Backend.CEPH));

        assertThat(selection.backend()).isEqualTo(Backend.TRIDENT);
        assertThat(selection.rule()).isEqualTo(BackendSelector.RULE_FALLBACK);
    }

    @Test
    void strictSelectionRefusesTheFallback() {
        var intent = Intents.intent("orders", Intents.spec("standard", null));

        assertThatThrownBy(() -> strictSelector.select(intent, discovered(Backend.CEPH)))
            .isInstanceOf(DiscoveryException.class)
            .satisfies(e -> assertThat(((DiscoveryException) e).getErrorCode()).isEqualTo(ErrorCode.NO_BACKEND_AVAILABLE));
    }

    @Test
    void nothingAvailableMeansNoBackend() {
        var intent = Intents.intent("orders", Intents.spec("standard", null));

        assertThatThrownBy(() -> selector.select(intent, discovered()))
            .isInstanceOf(DiscoveryException.class);
    }

    private static DiscoveryResult discovered(Backend... available) {
        List<BackendDescriptor> descriptors = new ArrayList<>();
        for (Backend backend : Backend.values()) {
            boolean up = List.of(available).contains(backend);
            descriptors.add(up
                ? BackendDescriptor.available(backend, Set.of(), Intents.T0)
                : BackendDescriptor.unavailable(backend, "not installed", Intents.T0));
        }
        return DiscoveryResult.of(descriptors, Intents.T0, Map.of());
    }
}
