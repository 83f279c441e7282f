package com.cardvault.features.cards.app;

import com.cardvault.common.exception.NotFoundException;
import com.cardvault.features.cards.domain.Card;
import com.cardvault.features.cards.domain.CardRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Handler for the photo reference stored on a card.
 * Only records paths; writing and deleting files belongs to the photo handlers.
 */
@Service
public class CardPhotoReferenceHandler {
    
    private final CardRepository cardRepository;
    
    public CardPhotoReferenceHandler(CardRepository cardRepository) {
        this.cardRepository = cardRepository;
    }
    
    @Transactional(readOnly = true)
    public boolean exists(Long cardId) {
        return cardRepository.existsById(cardId);
    }
    
    /**
     * Point the card at an already written photo.
     * @return the replaced photo path, empty if there was none
     */
    @Transactional
    public String attach(Long cardId, String photoPath) {
        return findCard(cardId).attachPhoto(photoPath);
    }
    
    /**
     * Clear the card's photo reference.
     * @return the cleared photo path, empty if there was none
     */
    @Transactional
    public String detach(Long cardId) {
        return findCard(cardId).detachPhoto();
    }
    
    private Card findCard(Long cardId) {
        return cardRepository.findById(cardId)
                .orElseThrow(() -> new NotFoundException("Card not found: " + cardId));
    }
}
