package com.cardvault.features.cards.api;

import com.cardvault.common.exception.NotFoundException;
import com.cardvault.features.cards.api.dto.CardRequest;
import com.cardvault.features.cards.api.dto.CardResponse;
import com.cardvault.features.cards.app.CreateCardHandler;
import com.cardvault.features.cards.app.DeleteCardHandler;
import com.cardvault.features.cards.app.GetCardHandler;
import com.cardvault.features.cards.app.UpdateCardHandler;
import com.cardvault.features.photos.app.DeletePhotoHandler;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for single-card operations.
 */
@RestController
@RequestMapping("/api/cards")
public class CardController {
    
    private final CreateCardHandler createCardHandler;
    private final GetCardHandler getCardHandler;
    private final UpdateCardHandler updateCardHandler;
    private final DeleteCardHandler deleteCardHandler;
    private final DeletePhotoHandler deletePhotoHandler;
    
    public CardController(
            CreateCardHandler createCardHandler,
            GetCardHandler getCardHandler,
            UpdateCardHandler updateCardHandler,
            DeleteCardHandler deleteCardHandler,
            DeletePhotoHandler deletePhotoHandler) {
        this.createCardHandler = createCardHandler;
        this.getCardHandler = getCardHandler;
        this.updateCardHandler = updateCardHandler;
        this.deleteCardHandler = deleteCardHandler;
        this.deletePhotoHandler = deletePhotoHandler;
    }
    
    /**
     * Create a card.
     * POST /api/cards
     */
    @PostMapping
    public ResponseEntity<CardResponse> createCard(@Valid @RequestBody CardRequest request) {
        Long cardId = createCardHandler.handle(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(loadCard(cardId));
    }
    
    /**
     * GET /api/cards/{cardId}
     */
    @GetMapping("/{cardId}")
    public ResponseEntity<CardResponse> getCard(@PathVariable Long cardId) {
        return ResponseEntity.ok(loadCard(cardId));
    }
    
    /**
     * Replace a card, including all of its phones, emails, addresses and tags.
     * PUT /api/cards/{cardId}
     */
    @PutMapping("/{cardId}")
    public ResponseEntity<CardResponse> updateCard(
            @PathVariable Long cardId,
            @Valid @RequestBody CardRequest request) {
        
        updateCardHandler.handle(cardId, request);
        return ResponseEntity.ok(loadCard(cardId));
    }
    
    /**
     * Delete a card and then its photo file, if any.
     * DELETE /api/cards/{cardId}
     */
    @DeleteMapping("/{cardId}")
    public ResponseEntity<Void> deleteCard(@PathVariable Long cardId) {
        String photoPath = deleteCardHandler.handle(cardId)
                .orElseThrow(() -> new NotFoundException("Card not found: " + cardId));
        deletePhotoHandler.discard(photoPath);
        return ResponseEntity.status(HttpStatus.NO_CONTENT).build();
    }
    
    private CardResponse loadCard(Long cardId) {
        return getCardHandler.handle(cardId)
                .orElseThrow(() -> new NotFoundException("Card not found: " + cardId));
    }
}
