package com.cardvault.features.cards.app;

import com.cardvault.features.cards.api.dto.CardResponse;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Handler for loading one fully hydrated card.
 */
@Service
public class GetCardHandler {
    
    private final CardHydrator cardHydrator;
    
    public GetCardHandler(CardHydrator cardHydrator) {
        this.cardHydrator = cardHydrator;
    }
    
    @Transactional(readOnly = true)
    public Optional<CardResponse> handle(Long cardId) {
        return cardHydrator.hydrate(cardId);
    }
}
