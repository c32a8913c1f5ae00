package com.ordoAetheris.handoff;

/**
 * Workers were still running when the join timeout expired. This points at a
 * capacity or sentinel-count misconfiguration (deadlock), not a transient condition.
 */
public class TransferTimeoutException extends TransferException {

    public TransferTimeoutException(String message) {
        super(message);
    }
}
