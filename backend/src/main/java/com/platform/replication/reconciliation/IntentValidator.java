package com.platform.replication.reconciliation;

import com.platform.replication.connectors.ReplicationAdapter;
import com.platform.replication.error.ValidationException;
import com.platform.replication.model.Endpoint;
import com.platform.replication.model.ReplicationIntent;
import com.platform.replication.model.ReplicationSpec;
import com.platform.replication.model.Schedule;
import com.platform.replication.model.ScheduleMode;
import com.platform.replication.model.VolumeMapping;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Semantic checks run before any backend call. Structural admission happens at the API.
 */
@Component
public class IntentValidator {

    public static final Pattern DURATION = Pattern.compile("^[0-9]+(s|m|h|d)$");

    /**
     * Checks that need no backend, then the adapter's own configuration checks.
     *
     * @throws ValidationException on the first violation
     * @throws com.platform.replication.error.AdapterException if the adapter rejects the configuration
     */
    public void validate(ReplicationIntent intent, ReplicationAdapter adapter) {
        validate(intent.spec());
        adapter.validateConfiguration(intent);
    }

    public void validate(ReplicationSpec spec) {
        if (spec.desiredState() == null) {
            throw ValidationException.missing("desiredState");
        }
        if (spec.desiredMode() == null) {
            throw ValidationException.missing("desiredMode");
        }
        validateVolumeMapping(spec.volumeMapping());
        validateEndpoints(spec.sourceEndpoint(), spec.destinationEndpoint());
        validateSchedule(spec.schedule());
    }

    private void validateVolumeMapping(VolumeMapping mapping) {
        if (mapping == null) {
            throw ValidationException.missing("volumeMapping");
        }
        if (mapping.source() == null || isBlank(mapping.source().pvcName())) {
            throw ValidationException.missing("volumeMapping.source.pvcName");
        }
        if (mapping.destination() == null || isBlank(mapping.destination().volumeHandle())) {
            throw ValidationException.missing("volumeMapping.destination.volumeHandle");
        }
    }

    private void validateEndpoints(Endpoint source, Endpoint destination) {
        if (source == null) {
            throw ValidationException.missing("sourceEndpoint");
        }
        if (destination == null) {
            throw ValidationException.missing("destinationEndpoint");
        }
        if (source.sameLocationAs(destination)) {
            throw new ValidationException("destinationEndpoint", destination.cluster() + "/" + destination.region(),
                "source and destination endpoints must differ");
        }
    }

    private void validateSchedule(Schedule schedule) {
        if (schedule.rpo() != null && !DURATION.matcher(schedule.rpo()).matches()) {
            throw new ValidationException("schedule.rpo", schedule.rpo(), "expected a duration such as 15m");
        }
        if (schedule.rto() != null && !DURATION.matcher(schedule.rto()).matches()) {
            throw new ValidationException("schedule.rto", schedule.rto(), "expected a duration such as 1h");
        }
        if (schedule.mode() == ScheduleMode.INTERVAL && schedule.rpo() == null) {
            throw new ValidationException("schedule.rpo", null, "required for interval schedules");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
