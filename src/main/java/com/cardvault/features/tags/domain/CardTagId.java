package com.cardvault.features.tags.domain;

import java.io.Serializable;
import java.util.Objects;

/**
 * Composite key for CardTag entity.
 */
public class CardTagId implements Serializable {
    
    private Long cardId;
    private Long tagId;
    
    public CardTagId() {
        // JPA constructor
    }
    
    public CardTagId(Long cardId, Long tagId) {
        this.cardId = cardId;
        this.tagId = tagId;
    }
    
    public Long getCardId() { return cardId; }
    public void setCardId(Long cardId) { this.cardId = cardId; }
    
    public Long getTagId() { return tagId; }
    public void setTagId(Long tagId) { this.tagId = tagId; }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CardTagId that = (CardTagId) o;
        return Objects.equals(cardId, that.cardId) && Objects.equals(tagId, that.tagId);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(cardId, tagId);
    }
}
