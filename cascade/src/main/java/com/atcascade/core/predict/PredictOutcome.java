package com.atcascade.core.predict;

public enum PredictOutcome {
    PREDICTED,
    /** No ancestor-or-self job has a successful fit. */
    NO_FIT,
    /** The job's log has more than one error. */
    ERROR,
    ENGINE_FAILURE,
    EXECUTION_ERROR
}
