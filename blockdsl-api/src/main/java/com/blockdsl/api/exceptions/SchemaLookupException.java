package com.blockdsl.api.exceptions;

/**
 * Thrown when the input fields of a data product method cannot be resolved.
 */
public class SchemaLookupException extends Exception {

    private final String product;
    private final String method;

    public SchemaLookupException(String product, String method, String message) {
        super(message);
        this.product = product;
        this.method = method;
    }

    public SchemaLookupException(String product, String method, String message, Throwable cause) {
        super(message, cause);
        this.product = product;
        this.method = method;
    }

    public String getProduct() {
        return product;
    }

    public String getMethod() {
        return method;
    }
}
