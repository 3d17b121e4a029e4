package com.platform.replication.model;

/**
 * Unified volume mapping. Adapters reshape it into their backend's convention.
 */
public record VolumeMapping(SourceVolume source, DestinationVolume destination) {

    public record SourceVolume(String pvcName, String namespace) {}

    public record DestinationVolume(String volumeHandle, String namespace) {}
}
