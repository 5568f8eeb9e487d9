package com.infomedia.abacox.nation.db.entity.superclass;

import com.infomedia.abacox.nation.db.entity.EntityKind;
import jakarta.persistence.MappedSuperclass;

/**
 * Identity shared by every entity: a typed identifier plus the variant tag of the
 * concrete entity. Two entities are the same entity only when both carry the same tag
 * and the same assigned identifier.
 *
 * @param <T> identifier type
 */
@MappedSuperclass
public abstract class IdentifiedEntity<T extends Comparable<T>> {

    public abstract T getId();

    public abstract EntityKind getKind();

    /**
     * An entity is transient until an identifier has been assigned, either by the caller
     * or by the database sequence on insert. A {@code null} or zero id means unassigned.
     */
    public boolean isTransient() {
        T id = getId();
        return id == null || (id instanceof Number number && number.longValue() == 0L);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IdentifiedEntity<?> other)) {
            return false;
        }
        // unassigned ids carry no identity
        if (isTransient() || other.isTransient()) {
            return false;
        }
        return getKind() == other.getKind() && getId().equals(other.getId());
    }

    @Override
    public int hashCode() {
        if (isTransient()) {
            return System.identityHashCode(this);
        }
        return 31 * getKind().getDiscriminator().hashCode() + getId().hashCode();
    }

    @Override
    public String toString() {
        EntityKind kind = getKind();
        String label = kind == null ? getClass().getSimpleName() : kind.getLabel();
        return label + "#" + (isTransient() ? "transient" : getId());
    }
}
