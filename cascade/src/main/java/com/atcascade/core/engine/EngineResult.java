package com.atcascade.core.engine;

public class EngineResult {
    private final int exitStatus;
    private final boolean timedOut;
    private final String message;

    public EngineResult(int exitStatus, boolean timedOut, String message) {
        this.exitStatus = exitStatus;
        this.timedOut = timedOut;
        this.message = message;
    }

    public static EngineResult ok() {
        return new EngineResult(0, false, "OK");
    }

    public static EngineResult exitStatus(int exitStatus) {
        return new EngineResult(exitStatus, false, "exit status " + exitStatus);
    }

    public static EngineResult timeout(long seconds) {
        return new EngineResult(-1, true, "timed out after " + seconds + " seconds");
    }

    public boolean isSuccess() {
        return exitStatus == 0 && !timedOut;
    }

    public int getExitStatus() {
        return exitStatus;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "EngineResult{" +
                "exitStatus=" + exitStatus +
                ", timedOut=" + timedOut +
                ", message='" + message + '\'' +
                '}';
    }
}
