package com.podscope.filter;

/**
 * A filter request that cannot be compiled: unknown family, value outside the family vocabulary or
 * malformed expression.
 */
public class InvalidFilterException extends RuntimeException {

    public InvalidFilterException(String message) {
        super(message);
    }

    public InvalidFilterException(String message, Throwable cause) {
        super(message, cause);
    }
}
