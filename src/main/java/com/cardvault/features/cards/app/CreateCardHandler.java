package com.cardvault.features.cards.app;

import com.cardvault.features.cards.api.dto.CardRequest;
import com.cardvault.features.cards.domain.Card;
import com.cardvault.features.cards.domain.CardRepository;
import com.cardvault.features.tags.app.SyncCardTagsHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Handler for creating a card with its phones, emails, addresses and tags.
 * The whole aggregate is validated in memory before the first insert and written
 * in a single transaction.
 */
@Service
public class CreateCardHandler {
    
    private static final Logger log = LoggerFactory.getLogger(CreateCardHandler.class);
    
    private final CardRepository cardRepository;
    private final SyncCardTagsHandler syncCardTagsHandler;
    
    public CreateCardHandler(CardRepository cardRepository, SyncCardTagsHandler syncCardTagsHandler) {
        this.cardRepository = cardRepository;
        this.syncCardTagsHandler = syncCardTagsHandler;
    }
    
    @Transactional
    public Long handle(CardRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Name is required");
        }
        Card card = CardAssembler.newCard(request);
        
        Card saved = cardRepository.save(card);
        syncCardTagsHandler.handle(saved.getId(), request.tags());
        
        log.info("Created card: cardId={}, phones={}, emails={}, addresses={}",
            saved.getId(), request.phones().size(), request.emails().size(), request.addresses().size());
        return saved.getId();
    }
}
