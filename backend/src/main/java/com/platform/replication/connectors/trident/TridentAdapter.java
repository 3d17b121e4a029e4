package com.platform.replication.connectors.trident;

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * NetApp Trident SnapMirror through TridentMirrorRelationship records.
 * Resync is requested with a one-shot TridentActionMirrorUpdate.
 */
@Slf4j
@Component
public class TridentAdapter extends AbstractReplicationAdapter {

    public static final String PARAM_REPLICATION_SCHEDULE = "replicationSchedule";

    private static final String ESTABLISHED = "established";

    public TridentAdapter(BackendResourceClient client, TranslationEngine translation,
                          MetricsRegistry metricsRegistry, Clock clock) {
        super(Backend.TRIDENT, client, translation, metricsRegistry, clock);
    }

    @Override
    public void ensureReplication(ReplicationIntent intent) {
        execute("ensure", intent, () -> {
            createOrUpdate(buildMirrorRelationship(intent));
        });
    }

    @Override
    public void deleteReplication(ReplicationIntent intent) {
        execute("delete", intent, () -> {
            client.list(BackendKinds.TRIDENT_ACTION_MIRROR_UPDATE, intent.namespace(), managedLabels(intent))
                .forEach(action -> client.delete(action.kind(), action.namespace(), action.name()));
            if (!client.delete(BackendKinds.TRIDENT_MIRROR_RELATIONSHIP, intent.namespace(), intent.name())) {
                log.debug("TridentMirrorRelationship {} already gone", intent.name());
            }
        });
    }

    @Override
    public void promote(ReplicationIntent intent) {
        execute("promote", intent, () -> {
            createOrUpdate(buildMirrorRelationship(intent.withSpec(intent.spec().withDesiredState(ReplicationState.SOURCE))));
        });
    }

    @Override
    public void demote(ReplicationIntent intent) {
        execute("demote", intent, () -> {
            createOrUpdate(buildMirrorRelationship(intent.withSpec(intent.spec().withDesiredState(ReplicationState.REPLICA))));
        });
    }

    @Override
    public void resync(ReplicationIntent intent) {
        execute("resync", intent, () -> {
            if (findRecord(intent).isEmpty()) {
                throw new AdapterException(AdapterException.Type.RESOURCE, backend().id(), "resync",
                    intent.key().toString(), "TridentMirrorRelationship " + intent.name() + " does not exist");
            }
            String actionName = intent.name() + "-resync-" + clock.instant().getEpochSecond();
            Map<String, Object> spec = new LinkedHashMap<>();
            spec.put("mirrorRelationshipName", intent.name());
            spec.put("snapshotHandle", "");
            client.create(BackendResource.of(BackendKinds.TRIDENT_API_VERSION,
                BackendKinds.TRIDENT_ACTION_MIRROR_UPDATE, intent.namespace(), actionName,
                managedLabels(intent), spec));
            log.info("Requested mirror update {} for {}", actionName, intent.key());
        });
    }

    @Override
    public void validateConfiguration(ReplicationIntent intent) {
        if (isBlank(intent.spec().volumeMapping().destination().volumeHandle())) {
            throw validationFailure(intent, "destination volume handle is required for a mirror relationship");
        }
        if (isBlank(intent.spec().volumeMapping().source().pvcName())) {
            throw validationFailure(intent, "source PVC name is required for a mirror relationship");
        }
        backendState(intent.spec().desiredState());
        backendMode(intent.spec().desiredMode());
    }

    @Override
    protected Optional<BackendResource> findRecord(ReplicationIntent intent) {
        return client.get(BackendKinds.TRIDENT_MIRROR_RELATIONSHIP, intent.namespace(), intent.name());
    }

    /**
     * Trident only accepts the base relationship states; sub-states of "established" are
     * reported by Trident itself.
     */
    static String relationshipState(String tridentState) {
        return tridentState.startsWith(ESTABLISHED + "-") ? ESTABLISHED : tridentState;
    }

    private BackendResource buildMirrorRelationship(ReplicationIntent intent) {
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("state", relationshipState(backendState(intent.spec().desiredState())));
        spec.put("replicationPolicy", backendMode(intent.spec().desiredMode()));
        String schedule = intent.spec().parameter(PARAM_REPLICATION_SCHEDULE, intent.spec().schedule().rpo());
        if (schedule != null) {
            spec.put("replicationSchedule", schedule);
        }
        spec.put("volumeGroupName", intent.name() + "-vg");
        spec.put("volumeMappings", List.of(Map.of(
            "localPVCName", intent.spec().volumeMapping().source().pvcName(),
            "remoteVolumeHandle", intent.spec().volumeMapping().destination().volumeHandle())));
        return BackendResource.of(BackendKinds.TRIDENT_API_VERSION, BackendKinds.TRIDENT_MIRROR_RELATIONSHIP,
            intent.namespace(), intent.name(), managedLabels(intent), spec);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
