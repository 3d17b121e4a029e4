package com.platform.replication.connectors.ceph;

import com.platform.replication.connectors.AbstractReplicationAdapter;
import com.platform.replication.connectors.resource.BackendKinds;
import com.platform.replication.connectors.resource.BackendResource;
import com.platform.replication.connectors.resource.BackendResourceClient;
import com.platform.replication.error.AdapterException;
import com.platform.replication.model.Backend;
import com.platform.replication.model.ReplicationIntent;
import com.platform.replication.model.ReplicationMode;
import com.platform.replication.observability.MetricsRegistry;
import com.platform.replication.state.ReplicationState;
import com.platform.replication.translation.TranslationEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Ceph RBD mirroring through one VolumeReplication per volume.
 */
@Slf4j
@Component
public class CephAdapter extends AbstractReplicationAdapter {

    public static final String DEFAULT_REPLICATION_CLASS = "rbd-volumereplicationclass";
    public static final String PARAM_REPLICATION_CLASS = "volumeReplicationClass";
    public static final String PARAM_AUTO_RESYNC = "autoResync";

    public CephAdapter(BackendResourceClient client, TranslationEngine translation,
                       MetricsRegistry metricsRegistry, Clock clock) {
        super(Backend.CEPH, client, translation, metricsRegistry, clock);
    }

    @Override
    public void ensureReplication(ReplicationIntent intent) {
        execute("ensure", intent, () -> {
            createOrUpdate(buildVolumeReplication(intent));
        });
    }

    @Override
    public void deleteReplication(ReplicationIntent intent) {
        execute("delete", intent, () -> {
            if (!client.delete(BackendKinds.VOLUME_REPLICATION, intent.namespace(), recordName(intent))) {
                log.debug("VolumeReplication {} already gone", recordName(intent));
            }
        });
    }

    @Override
    public void promote(ReplicationIntent intent) {
        execute("promote", intent, () -> {
            writeReplicationState(intent, "promote", backendState(ReplicationState.PROMOTING), false);
        });
    }

    @Override
    public void demote(ReplicationIntent intent) {
        execute("demote", intent, () -> {
            writeReplicationState(intent, "demote", backendState(ReplicationState.DEMOTING), false);
        });
    }

    @Override
    public void resync(ReplicationIntent intent) {
        execute("resync", intent, () -> {
            writeReplicationState(intent, "resync", backendState(ReplicationState.SYNCING), true);
        });
    }

    @Override
    public void validateConfiguration(ReplicationIntent intent) {
        String storageClass = intent.spec().sourceEndpoint() == null
            ? null : intent.spec().sourceEndpoint().storageClass();
        if (storageClass == null) {
            throw validationFailure(intent, "source storage class is required");
        }
        String normalized = storageClass.toLowerCase(Locale.ROOT);
        if (!normalized.contains("rbd") && !normalized.contains("ceph")) {
            throw validationFailure(intent,
                "storage class '" + storageClass + "' is not a Ceph RBD storage class");
        }
        if (intent.spec().parameters().containsKey(PARAM_REPLICATION_CLASS)
                && intent.spec().parameters().get(PARAM_REPLICATION_CLASS).isBlank()) {
            throw validationFailure(intent, PARAM_REPLICATION_CLASS + " must not be blank");
        }
        backendState(intent.spec().desiredState());
        backendMode(intent.spec().desiredMode());
    }

    @Override
    protected Optional<BackendResource> findRecord(ReplicationIntent intent) {
        return client.get(BackendKinds.VOLUME_REPLICATION, intent.namespace(), recordName(intent));
    }

    /**
     * VolumeReplication carries no mode field; the replication class decides it, so the desired
     * mode is reported.
     */
    @Override
    protected ReplicationMode observedMode(BackendResource record, ReplicationIntent intent) {
        return intent.spec().desiredMode();
    }

    static String recordName(ReplicationIntent intent) {
        return intent.name() + "-vr";
    }

    private BackendResource buildVolumeReplication(ReplicationIntent intent) {
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("volumeReplicationClass", intent.spec().parameter(PARAM_REPLICATION_CLASS, DEFAULT_REPLICATION_CLASS));
        spec.put("replicationState", backendState(intent.spec().desiredState()));
        spec.put("pvcName", intent.spec().volumeMapping().source().pvcName());
        spec.put("autoResync", Boolean.parseBoolean(intent.spec().parameter(PARAM_AUTO_RESYNC, "false")));
        return BackendResource.of(BackendKinds.CEPH_API_VERSION, BackendKinds.VOLUME_REPLICATION,
            intent.namespace(), recordName(intent), managedLabels(intent), spec);
    }

    private void writeReplicationState(ReplicationIntent intent, String operation, String cephState, boolean autoResync) {
        BackendResource existing = findRecord(intent)
            .orElseThrow(() -> new AdapterException(AdapterException.Type.RESOURCE, backend().id(), operation,
                intent.key().toString(), "VolumeReplication " + recordName(intent) + " does not exist"));
        BackendResource updated = existing.withSpecField("replicationState", cephState);
        if (autoResync) {
            updated = updated.withSpecField("autoResync", true);
        }
        client.update(updated);
        log.info("Set VolumeReplication {} to {}", recordName(intent), cephState);
    }
}
