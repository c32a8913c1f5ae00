package com.ordoAetheris.handoff;

/**
 * A transfer did not complete: a producer or consumer failed.
 */
public class TransferException extends Exception {

    public TransferException(String message) {
        super(message);
    }

    public TransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
