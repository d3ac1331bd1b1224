package com.tfve.sync.core.model;

/**
 * =====================================================================
 * FailurePolicy
 * =====================================================================
 *
 * What a sync run does after one variable fails to be created or updated.
 *
 *   STOP      record the failure, attempt nothing else in this run
 *   CONTINUE  record the failure, carry on with the next variable
 *
 * Either way the failure is reported and nothing already applied is
 * rolled back. Re-running is safe: a failed create leaves the name absent,
 * so the next run picks it up again.
 */
public enum FailurePolicy {
    STOP,
    CONTINUE
}
