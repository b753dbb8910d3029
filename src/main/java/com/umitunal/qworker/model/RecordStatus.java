package com.umitunal.qworker.model;

/**
 * Lifecycle states of a stored record. Completed records are deleted.
 */
public enum RecordStatus {
    QUEUED,      // Waiting, possibly delayed
    PROCESSING,  // Claimed by a worker
    FAILED       // Terminal, awaiting manual remediation
}
