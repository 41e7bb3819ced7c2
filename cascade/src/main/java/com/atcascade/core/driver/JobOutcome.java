package com.atcascade.core.driver;

/**
 * Why a job ended in the state it did.
 */
public enum JobOutcome {
    /** Ran and succeeded. */
    DONE,
    /** On-disk state already showed a completed fit; not run again. */
    ALREADY_DONE,
    ENGINE_FAILURE,
    /** The job's input database does not exist. */
    MISSING_INPUT,
    /** I/O or database error while preparing or recording the job. */
    EXECUTION_ERROR,
    SKIPPED_DUE_TO_ANCESTOR_FAILURE;

    public boolean isSuccess() {
        return this == DONE || this == ALREADY_DONE;
    }
}
