package com.cardvault.features.tags.domain;

import com.cardvault.common.domain.BaseEntity;
import jakarta.persistence.*;

/**
 * Entry of the shared tag vocabulary.
 * Names are unique across the store and matched exactly (case-sensitive).
 * Tags outlive the cards they were linked to.
 */
@Entity
@Table(name = "tags", uniqueConstraints = {
    @UniqueConstraint(name = "tags_name_unique", columnNames = {"name"})
})
public class Tag extends BaseEntity<Long> {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(nullable = false)
    private String name;
    
    protected Tag() {
        // JPA constructor
    }
    
    public Tag(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tag name cannot be blank");
        }
        this.name = normalizeName(name);
    }
    
    /**
     * Normalize tag name: trim surrounding whitespace. Case is preserved.
     */
    public static String normalizeName(String name) {
        return name.trim();
    }
    
    @Override
    public Long getId() {
        return id;
    }
    
    public String getName() { return name; }
}
