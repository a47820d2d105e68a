package com.screening.exception;

/**
 * A rescreen batch was requested while another one is still running.
 */
public class BatchAlreadyRunningException extends RuntimeException {

    public BatchAlreadyRunningException() {
        super("A rescreen batch is already running");
    }
}
