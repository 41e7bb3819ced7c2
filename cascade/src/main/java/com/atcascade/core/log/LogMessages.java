package com.atcascade.core.log;

/**
 * Messages the cascade writes to the log table of a job's fit database.
 */
public final class LogMessages {

    public static final String FIT_OK = "fit: OK";
    public static final String CHILDREN_OK = "children: OK";
    public static final String PARENT_PREFIX = "parent: ";

    private LogMessages() {
    }

    public static String fitError(String mode, String detail) {
        return "fit " + mode + ": error: " + detail;
    }

    public static String parent(String parentJobName) {
        return PARENT_PREFIX + parentJobName;
    }
}
