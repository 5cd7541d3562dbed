package io.chariot.schema;

/**
 * The owning side of a relationship, as declared on an entity property.
 * <p>
 * {@code MANY_TO_ONE} stores the target id in {@link #column()} of {@link #table()}.
 * {@code MANY_TO_MANY} stores (owner id, target id) pairs as rows of the junction
 * {@link #joinTable()}; there {@link #table()} is the owner's table and {@link #column()} is null.
 * In both cases {@link #targetTable()}.{@link #targetColumn()} is the referenced key.
 * Inverse sides are not declared; they are derived at query time from the owning side.
 */
public record RelationshipMapping(String name,
                                  String property,
                                  Kind kind,
                                  Class<?> declaringType,
                                  Class<?> targetType,
                                  String table,
                                  String column,
                                  String targetTable,
                                  String targetColumn,
                                  JoinTableMapping joinTable) {

    public enum Kind {
        MANY_TO_ONE,
        MANY_TO_MANY
    }

    public RelationshipMapping {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name required");
        }
        if (property == null || property.isBlank()) {
            throw new IllegalArgumentException("property required");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind required");
        }
        if (declaringType == null || targetType == null) {
            throw new IllegalArgumentException("declaringType and targetType required");
        }
        if (table == null || targetTable == null || targetColumn == null) {
            throw new IllegalArgumentException("table, targetTable and targetColumn required");
        }
        if (kind == Kind.MANY_TO_ONE && column == null) {
            throw new IllegalArgumentException("column required for " + kind);
        }
        if (kind == Kind.MANY_TO_MANY && joinTable == null) {
            throw new IllegalArgumentException("joinTable required for " + kind);
        }
    }

    public boolean isCollection() {
        return kind == Kind.MANY_TO_MANY;
    }

    /**
     * Junction table of a many-to-many relationship.
     *
     * @param name              the junction table name
     * @param joinColumn        the column referencing the owning entity
     * @param inverseJoinColumn the column referencing the target entity
     */
    public record JoinTableMapping(String name, String joinColumn, String inverseJoinColumn) {
        public JoinTableMapping {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name required");
            }
            if (joinColumn == null || joinColumn.isBlank()) {
                throw new IllegalArgumentException("joinColumn required");
            }
            if (inverseJoinColumn == null || inverseJoinColumn.isBlank()) {
                throw new IllegalArgumentException("inverseJoinColumn required");
            }
        }
    }
}
