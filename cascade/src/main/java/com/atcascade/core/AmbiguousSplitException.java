package com.atcascade.core;

public class AmbiguousSplitException extends ConfigurationException {

    public AmbiguousSplitException(String message) {
        super(message);
    }
}
