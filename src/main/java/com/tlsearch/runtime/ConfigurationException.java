package com.tlsearch.runtime;

public class ConfigurationException extends IllegalStateException {
    public ConfigurationException(String message) {
        super(message);
    }
}
