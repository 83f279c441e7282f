package com.cardvault.common.domain;

import java.io.Serializable;
import java.util.Objects;

/**
 * Base type for persistent entities with identity-based equality.
 * Transient instances (no id yet) are only equal to themselves.
 */
public abstract class BaseEntity<ID extends Serializable> {
    
    public abstract ID getId();
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BaseEntity<?> that = (BaseEntity<?>) o;
        return getId() != null && Objects.equals(getId(), that.getId());
    }
    
    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
