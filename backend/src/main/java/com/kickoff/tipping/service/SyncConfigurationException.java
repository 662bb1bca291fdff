package com.kickoff.tipping.service;

/** Raised before any network call when the sync cannot run at all, e.g. no API key is configured. */
public class SyncConfigurationException extends RuntimeException {
    public SyncConfigurationException(String message) {
        super(message);
    }
}
