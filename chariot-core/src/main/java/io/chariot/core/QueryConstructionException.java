package io.chariot.core;

/**
 * Raised by the query builder call that introduced a malformed join, filter or fetch directive.
 */
public class QueryConstructionException extends ChariotException {

    public QueryConstructionException(String message) {
        super(message);
    }
}
