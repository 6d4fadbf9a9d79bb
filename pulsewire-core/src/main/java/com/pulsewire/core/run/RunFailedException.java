package com.pulsewire.core.run;

/**
 * The run as a whole cannot proceed: nothing registered, nothing available, or nothing selected.
 */
public class RunFailedException extends Exception {

    public RunFailedException(String message) {
        super(message);
    }

    public RunFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
