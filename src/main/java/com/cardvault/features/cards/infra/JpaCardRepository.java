package com.cardvault.features.cards.infra;

import com.cardvault.features.cards.domain.Card;
import com.cardvault.features.cards.domain.CardRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository implementation for Card entity.
 * Spring Data JPA provides implementations for every method declared in CardRepository.
 */
@Repository
public interface JpaCardRepository extends JpaRepository<Card, Long>, CardRepository {
}
