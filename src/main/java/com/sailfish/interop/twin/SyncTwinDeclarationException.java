package com.sailfish.interop.twin;

/**
 * Thrown when the twins registered for a type are invalid or conflict.
 */
public class SyncTwinDeclarationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public SyncTwinDeclarationException(String message) {
        super(message);
    }
}
