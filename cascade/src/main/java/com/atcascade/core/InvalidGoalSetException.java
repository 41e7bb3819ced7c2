package com.atcascade.core;

public class InvalidGoalSetException extends ConfigurationException {

    public InvalidGoalSetException(String message) {
        super(message);
    }
}
