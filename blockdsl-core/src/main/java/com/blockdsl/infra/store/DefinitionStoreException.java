package com.blockdsl.infra.store;

/**
 * Thrown when a definition store cannot read or write its backing storage.
 */
public class DefinitionStoreException extends RuntimeException {

    public DefinitionStoreException(String message) {
        super(message);
    }

    public DefinitionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
