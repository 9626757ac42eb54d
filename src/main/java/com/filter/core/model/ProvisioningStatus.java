package com.filter.core.model;

/**
 * Lifecycle of a story workspace.
 */
public enum ProvisioningStatus {
    UNPROVISIONED,
    CLONING,        // clone or branch setup in progress, or interrupted
    READY,
    FAILED          // last attempt failed; the next attempt re-clones from scratch
}
