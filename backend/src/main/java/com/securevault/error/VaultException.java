package com.securevault.error;

/**
 * Root of the vault error taxonomy. All vault failures are unchecked and travel
 * through Reactor as error signals.
 */
public abstract class VaultException extends RuntimeException {

    protected VaultException(String message) {
        super(message);
    }

    protected VaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
