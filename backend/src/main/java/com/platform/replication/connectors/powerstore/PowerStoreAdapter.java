package com.platform.replication.connectors.powerstore;

import com.platform.replication.connectors.AbstractReplicationAdapter;
import com.platform.replication.connectors.resource.BackendKinds;
import com.platform.replication.connectors.resource.BackendResource;
import com.platform.replication.connectors.resource.BackendResourceClient;
import com.platform.replication.error.AdapterException;
import com.platform.replication.model.Backend;
import com.platform.replication.model.ReplicationIntent;
import com.platform.replication.observability.MetricsRegistry;
import com.platform.replication.state.ReplicationState;
import com.platform.replication.translation.TranslationEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dell PowerStore replication through DellCSIReplicationGroup records.
 * Volumes join the group by PVC label.
 */
@Slf4j
@Component
public class PowerStoreAdapter extends AbstractReplicationAdapter {

    public static final String DRIVER_NAME = "csi-powerstore.dellemc.com";
    public static final String GROUP_LABEL = "replication.storage.dell.com/group";
    public static final String RESYNC_ANNOTATION = "replication.dell.com/resync-requested";
    public static final String PARAM_PROTECTION_POLICY = "protectionPolicy";
    public static final String PARAM_REMOTE_SYSTEM = "remoteSystem";
    public static final String DEFAULT_REMOTE_RPO = "15m";

    public PowerStoreAdapter(BackendResourceClient client, TranslationEngine translation,
                             MetricsRegistry metricsRegistry, Clock clock) {
        super(Backend.POWERSTORE, client, translation, metricsRegistry, clock);
    }

    @Override
    public void ensureReplication(ReplicationIntent intent) {
        execute("ensure", intent, () -> {
            createOrUpdate(buildReplicationGroup(intent));
        });
    }

    @Override
    public void deleteReplication(ReplicationIntent intent) {
        execute("delete", intent, () -> {
            if (!client.delete(BackendKinds.DELL_REPLICATION_GROUP, intent.namespace(), intent.name())) {
                log.debug("DellCSIReplicationGroup {} already gone", intent.name());
            }
        });
    }

    @Override
    public void promote(ReplicationIntent intent) {
        execute("promote", intent, () -> {
            createOrUpdate(buildReplicationGroup(intent.withSpec(intent.spec().withDesiredState(ReplicationState.SOURCE))));
        });
    }

    @Override
    public void demote(ReplicationIntent intent) {
        execute("demote", intent, () -> {
            createOrUpdate(buildReplicationGroup(intent.withSpec(intent.spec().withDesiredState(ReplicationState.REPLICA))));
        });
    }

    @Override
    public void resync(ReplicationIntent intent) {
        execute("resync", intent, () -> {
            BackendResource group = findRecord(intent)
                .orElseThrow(() -> new AdapterException(AdapterException.Type.RESOURCE, backend().id(), "resync",
                    intent.key().toString(), "DellCSIReplicationGroup " + intent.name() + " does not exist"));
            String requestedAt = DateTimeFormatter.ISO_INSTANT.format(clock.instant().truncatedTo(ChronoUnit.SECONDS));
            client.update(group.withAnnotation(RESYNC_ANNOTATION, requestedAt));
            log.info("Requested resync of replication group {} at {}", intent.name(), requestedAt);
        });
    }

    @Override
    public void validateConfiguration(ReplicationIntent intent) {
        String handle = intent.spec().volumeMapping().destination().volumeHandle();
        if (handle == null || handle.isBlank()) {
            throw validationFailure(intent, "destination volume handle is required for a replication group");
        }
        if (intent.spec().parameters().containsKey(PARAM_PROTECTION_POLICY)
                && intent.spec().parameters().get(PARAM_PROTECTION_POLICY).isBlank()) {
            throw validationFailure(intent, PARAM_PROTECTION_POLICY + " must not be blank");
        }
        backendState(intent.spec().desiredState());
        backendMode(intent.spec().desiredMode());
    }

    @Override
    protected Optional<BackendResource> findRecord(ReplicationIntent intent) {
        return client.get(BackendKinds.DELL_REPLICATION_GROUP, intent.namespace(), intent.name());
    }

    private BackendResource buildReplicationGroup(ReplicationIntent intent) {
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("driverName", DRIVER_NAME);
        spec.put("state", backendState(intent.spec().desiredState()));
        spec.put("replicationPolicy", backendMode(intent.spec().desiredMode()));
        String protectionPolicy = intent.spec().parameter(PARAM_PROTECTION_POLICY, null);
        if (protectionPolicy != null) {
            spec.put("protectionPolicy", protectionPolicy);
        }
        String remoteSystem = intent.spec().parameter(PARAM_REMOTE_SYSTEM,
            intent.spec().destinationEndpoint() == null ? null : intent.spec().destinationEndpoint().cluster());
        if (remoteSystem != null) {
            spec.put("remoteSystem", remoteSystem);
        }
        String rpo = intent.spec().schedule().rpo();
        spec.put("remoteRPO", rpo == null || rpo.isBlank() ? DEFAULT_REMOTE_RPO : rpo);
        spec.put("pvcSelector", Map.of("matchLabels", Map.of(GROUP_LABEL, intent.name())));
        spec.put("sourceVolumes", List.of(Map.of("pvcName", intent.spec().volumeMapping().source().pvcName())));
        spec.put("remoteVolumes", List.of(Map.of("volumeHandle", intent.spec().volumeMapping().destination().volumeHandle())));
        return BackendResource.of(BackendKinds.DELL_API_VERSION, BackendKinds.DELL_REPLICATION_GROUP,
            intent.namespace(), intent.name(), managedLabels(intent), spec);
    }
}
