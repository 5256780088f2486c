package com.securevault.error;

/**
 * The operation is not valid for the vault's current lifecycle state, e.g.
 * initializing twice or resuming an expired session.
 */
public class VaultStateException extends VaultException {

    public VaultStateException(String message) {
        super(message);
    }
}
