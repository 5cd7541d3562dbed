package io.chariot.core;

/**
 * Raised at commit time when a pending insert breaks a table constraint.
 * <p>
 * The whole unit of work is rejected; no row of the failing batch is stored.
 */
public class ConstraintViolationException extends ChariotException {

    /**
     * Kinds of constraint the store enforces.
     */
    public enum Constraint {
        PRIMARY_KEY,
        UNIQUE,
        NOT_NULL,
        FOREIGN_KEY
    }

    private final String table;
    private final String column;
    private final Constraint constraint;

    public ConstraintViolationException(String table, String column, Constraint constraint, String detail) {
        super(constraint + " constraint failed: " + table + "." + column + " (" + detail + ")");
        this.table = table;
        this.column = column;
        this.constraint = constraint;
    }

    public String table() {
        return table;
    }

    public String column() {
        return column;
    }

    public Constraint constraint() {
        return constraint;
    }
}
