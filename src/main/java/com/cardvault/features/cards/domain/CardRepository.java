package com.cardvault.features.cards.domain;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the Card aggregate root.
 */
public interface CardRepository {
    Card save(Card card);
    Optional<Card> findById(Long id);
    List<Card> findAllById(Iterable<Long> ids);
    boolean existsById(Long id);
    long count();
    void delete(Card card);
}
