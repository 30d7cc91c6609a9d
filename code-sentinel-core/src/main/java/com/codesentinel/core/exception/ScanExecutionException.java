package com.codesentinel.core.exception;

/**
 * Thrown when a category scan task fails outside of rule evaluation, for example when
 * the worker running it dies or the calling thread is interrupted while joining.
 *
 * <p>Individual rule failures never produce this exception; they are recorded as
 * {@link com.codesentinel.core.model.RuleFault}s.
 */
public class ScanExecutionException extends RuntimeException {

    public ScanExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
