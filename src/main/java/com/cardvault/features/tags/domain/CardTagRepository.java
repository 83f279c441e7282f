package com.cardvault.features.tags.domain;

import java.util.Collection;
import java.util.List;

/**
 * Repository interface for CardTag junction entity.
 */
public interface CardTagRepository {
    CardTag save(CardTag cardTag);
    boolean existsByCardIdAndTagId(Long cardId, Long tagId);
    void deleteByCardId(Long cardId);
    List<CardTagName> findTagNamesByCardIds(Collection<Long> cardIds);
}
