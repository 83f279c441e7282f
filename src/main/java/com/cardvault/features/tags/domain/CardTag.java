package com.cardvault.features.tags.domain;

import jakarta.persistence.*;

/**
 * Junction entity for the many-to-many relationship between cards and tags.
 */
@Entity
@Table(name = "card_tags")
@IdClass(CardTagId.class)
public class CardTag {
    
    @Id
    @Column(name = "card_id", nullable = false)
    private Long cardId;
    
    @Id
    @Column(name = "tag_id", nullable = false)
    private Long tagId;
    
    protected CardTag() {
        // JPA constructor
    }
    
    public CardTag(Long cardId, Long tagId) {
        if (cardId == null) {
            throw new IllegalArgumentException("Card ID cannot be null");
        }
        if (tagId == null) {
            throw new IllegalArgumentException("Tag ID cannot be null");
        }
        
        this.cardId = cardId;
        this.tagId = tagId;
    }
    
    // Getters
    public Long getCardId() { return cardId; }
    public Long getTagId() { return tagId; }
}
