package com.cardvault.features.cards.app;

import com.cardvault.features.cards.domain.Card;
import com.cardvault.features.cards.domain.CardRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Handler for deleting a card.
 * Children and tag links go with the row through the foreign-key cascade.
 * The referenced photo file is not touched; the caller reclaims it.
 */
@Service
public class DeleteCardHandler {
    
    private static final Logger log = LoggerFactory.getLogger(DeleteCardHandler.class);
    
    private final CardRepository cardRepository;
    
    public DeleteCardHandler(CardRepository cardRepository) {
        this.cardRepository = cardRepository;
    }
    
    /**
     * @return the card's photo path (empty if it had none), or empty Optional if the card does not exist
     */
    @Transactional
    public Optional<String> handle(Long cardId) {
        Optional<Card> card = cardRepository.findById(cardId);
        if (card.isEmpty()) {
            log.debug("Delete skipped, card not found: cardId={}", cardId);
            return Optional.empty();
        }
        
        String photoPath = card.get().getPhotoPath();
        cardRepository.delete(card.get());
        log.info("Deleted card: cardId={}", cardId);
        return Optional.of(photoPath);
    }
}
