package com.atcascade.core.log;

/**
 * State of a job as recorded on disk.
 */
public enum JobLogStatus {
    /** No fit database. */
    MISSING,
    /** Database present, no fit attempted since it was created. */
    NOT_RUN,
    /** Fit attempted and errors recorded, no successful fit. */
    ERROR,
    /** Fit succeeded, children not derived yet. */
    FIT,
    /** Fit succeeded and child databases were derived. */
    DONE;

    public boolean hasFit() {
        return this == FIT || this == DONE;
    }
}
