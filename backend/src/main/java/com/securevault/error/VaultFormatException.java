package com.securevault.error;

/**
 * A blob or record collection could not be decoded: bad base64, a blob shorter
 * than salt + iv, or an import snapshot with the wrong shape.
 */
public class VaultFormatException extends VaultException {

    public VaultFormatException(String message) {
        super(message);
    }

    public VaultFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
