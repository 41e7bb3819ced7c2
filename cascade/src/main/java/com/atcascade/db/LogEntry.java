package com.atcascade.db;

public class LogEntry {
    public static final String TYPE_CASCADE = "at_cascade";
    public static final String TYPE_ERROR = "error";
    public static final String TYPE_WARNING = "warning";

    private final long logId;
    private final String messageType;
    private final long unixTime;
    private final String message;

    public LogEntry(long logId, String messageType, long unixTime, String message) {
        this.logId = logId;
        this.messageType = messageType;
        this.unixTime = unixTime;
        this.message = message;
    }

    public long getLogId() {
        return logId;
    }

    public String getMessageType() {
        return messageType;
    }

    public long getUnixTime() {
        return unixTime;
    }

    public String getMessage() {
        return message;
    }

    public boolean isError() {
        return TYPE_ERROR.equals(messageType);
    }

    public boolean isWarning() {
        return TYPE_WARNING.equals(messageType);
    }

    @Override
    public String toString() {
        return "LogEntry{id=" + logId + ", type='" + messageType + "', message='" + message + "'}";
    }
}
