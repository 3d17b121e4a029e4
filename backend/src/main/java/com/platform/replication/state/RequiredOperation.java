package com.platform.replication.state;

/**
 * Adapter verb a transition needs in order to be carried out on the backend.
 */
public enum RequiredOperation {
    ENSURE,
    PROMOTE,
    DEMOTE,
    RESYNC
}
