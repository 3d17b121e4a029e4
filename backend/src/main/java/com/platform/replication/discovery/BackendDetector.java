package com.platform.replication.discovery;

import com.platform.replication.model.Backend;
import com.platform.replication.model.BackendDescriptor;

/**
 * Probes whether one backend is installed and usable.
 */
public interface BackendDetector {

    Backend backend();

    /**
     * Run the probe. May block on the backend API and may throw; the caller bounds it with a
     * timeout and turns failures into a soft result.
     */
    BackendDescriptor detect();
}
