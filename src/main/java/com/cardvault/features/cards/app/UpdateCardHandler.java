package com.cardvault.features.cards.app;

import com.cardvault.common.exception.NotFoundException;
import com.cardvault.features.cards.api.dto.CardRequest;
import com.cardvault.features.cards.domain.Card;
import com.cardvault.features.cards.domain.CardRepository;
import com.cardvault.features.tags.app.SyncCardTagsHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Handler for replacing a card.
 * Scalars are overwritten and every child collection and tag link is deleted and
 * re-inserted; previous child ids are discarded. The photo reference is left alone.
 */
@Service
public class UpdateCardHandler {
    
    private static final Logger log = LoggerFactory.getLogger(UpdateCardHandler.class);
    
    private final CardRepository cardRepository;
    private final SyncCardTagsHandler syncCardTagsHandler;
    
    public UpdateCardHandler(CardRepository cardRepository, SyncCardTagsHandler syncCardTagsHandler) {
        this.cardRepository = cardRepository;
        this.syncCardTagsHandler = syncCardTagsHandler;
    }
    
    @Transactional
    public void handle(Long cardId, CardRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Name is required");
        }
        Card card = cardRepository.findById(cardId)
                .orElseThrow(() -> new NotFoundException("Card not found: " + cardId));
        
        card.updateDetails(
            request.name(),
            request.title(),
            request.company(),
            request.website(),
            request.notes()
        );
        card.clearChildren();
        CardAssembler.addChildren(card, request);
        
        syncCardTagsHandler.handle(cardId, request.tags());
        log.info("Updated card: cardId={}", cardId);
    }
}
