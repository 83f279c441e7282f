package com.cardvault.features.listcards.app;

import com.cardvault.features.cards.api.dto.CardResponse;
import com.cardvault.features.cards.app.CardHydrator;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Handler for listing cards with optional text search and tag filter.
 * Cards are returned fully hydrated, most recently updated first.
 */
@Service
public class ListCardsHandler {
    
    private final CardSearchHandler cardSearchHandler;
    private final CardHydrator cardHydrator;
    
    public ListCardsHandler(CardSearchHandler cardSearchHandler, CardHydrator cardHydrator) {
        this.cardSearchHandler = cardSearchHandler;
        this.cardHydrator = cardHydrator;
    }
    
    @Transactional(readOnly = true)
    public List<CardResponse> handle(String query, String tag) {
        List<Long> cardIds = cardSearchHandler.resolve(query, tag);
        return cardHydrator.hydrate(cardIds);
    }
}
