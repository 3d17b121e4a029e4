package com.platform.replication.api;

import com.platform.replication.model.Endpoint;
import com.platform.replication.model.ReplicationMode;
import com.platform.replication.model.ReplicationSpec;
import com.platform.replication.model.Schedule;
import com.platform.replication.model.ScheduleMode;
import com.platform.replication.model.VolumeMapping;
import com.platform.replication.state.ReplicationState;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Validated request bodies for the intent API. These checks are structural only; semantic
 * checks run in the controller's pre-flight.
 */
public class IntentRequests {

    static final String NAME_PATTERN = "^[a-z0-9]([-a-z0-9]*[a-z0-9])?$";
    static final String DURATION_PATTERN = "^[0-9]+(s|m|h|d)$";

    @Data
    public static class CreateIntentRequest {

        @NotBlank(message = "Namespace is required")
        @Size(max = 63, message = "Namespace cannot exceed 63 characters")
        @Pattern(regexp = NAME_PATTERN, message = "Namespace must be a DNS label")
        private String namespace;

        @NotBlank(message = "Name is required")
        @Size(max = 63, message = "Name cannot exceed 63 characters")
        @Pattern(regexp = NAME_PATTERN, message = "Name must be a DNS label")
        private String name;

        @NotNull(message = "Spec is required")
        @Valid
        private SpecRequest spec;
    }

    @Data
    public static class SpecRequest {

        @NotNull(message = "Desired state is required")
        private ReplicationState desiredState;

        @NotNull(message = "Desired mode is required")
        private ReplicationMode desiredMode;

        @NotNull(message = "Volume mapping is required")
        @Valid
        private VolumeMappingRequest volumeMapping;

        @NotNull(message = "Source endpoint is required")
        @Valid
        private EndpointRequest sourceEndpoint;

        @NotNull(message = "Destination endpoint is required")
        @Valid
        private EndpointRequest destinationEndpoint;

        @Valid
        private ScheduleRequest schedule;

        @Pattern(regexp = "^(ceph|trident|powerstore)$", message = "Unknown backend")
        private String backendHint;

        private Map<String, String> parameters = new HashMap<>();

        public ReplicationSpec toSpec() {
            return new ReplicationSpec(
                desiredState,
                desiredMode,
                new VolumeMapping(
                    new VolumeMapping.SourceVolume(volumeMapping.getSourcePvcName(), volumeMapping.getSourceNamespace()),
                    new VolumeMapping.DestinationVolume(volumeMapping.getDestinationVolumeHandle(),
                        volumeMapping.getDestinationNamespace())),
                sourceEndpoint.toEndpoint(),
                destinationEndpoint.toEndpoint(),
                schedule == null ? null : schedule.toSchedule(),
                backendHint,
                parameters);
        }
    }

    @Data
    public static class VolumeMappingRequest {

        @NotBlank(message = "Source PVC name is required")
        private String sourcePvcName;

        @NotBlank(message = "Source namespace is required")
        private String sourceNamespace;

        @NotBlank(message = "Destination volume handle is required")
        private String destinationVolumeHandle;

        @NotBlank(message = "Destination namespace is required")
        private String destinationNamespace;
    }

    @Data
    public static class EndpointRequest {

        @NotBlank(message = "Cluster is required")
        private String cluster;

        @NotBlank(message = "Region is required")
        private String region;

        @NotBlank(message = "Storage class is required")
        private String storageClass;

        Endpoint toEndpoint() {
            return new Endpoint(cluster, region, storageClass);
        }
    }

    @Data
    public static class ScheduleRequest {

        @NotNull(message = "Schedule mode is required")
        private ScheduleMode mode;

        @Pattern(regexp = DURATION_PATTERN, message = "RPO must look like 15m")
        private String rpo;

        @Pattern(regexp = DURATION_PATTERN, message = "RTO must look like 1h")
        private String rto;

        Schedule toSchedule() {
            return new Schedule(mode, rpo, rto);
        }
    }
}
