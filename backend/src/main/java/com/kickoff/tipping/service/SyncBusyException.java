package com.kickoff.tipping.service;

/** Another full sync or catch-up pass holds the sync gate. */
public class SyncBusyException extends IllegalStateException {
    public SyncBusyException(String runName) {
        super("Another sync is already running" + (runName == null ? "" : " (" + runName + ")"));
    }
}
