package io.chariot.core;

/**
 * Raised when code navigates a relationship that the query never fetched.
 */
public class RelationshipAbsentException extends ChariotException {

    private final String relationship;

    public RelationshipAbsentException(String relationship, String message) {
        super(message);
        this.relationship = relationship;
    }

    public String relationship() {
        return relationship;
    }
}
