package com.infomedia.abacox.nation.db.entity;

/**
 * Classification tag carried by every entity variant.
 * Equality between entities compares these tags by identity, so each tag must be a
 * singleton (an enum constant).
 */
public interface EntityKind {

    /**
     * Value stored in the {@code type} column of the family table.
     */
    String getDiscriminator();

    /**
     * Human readable name, e.g. "Province".
     */
    String getLabel();
}
