package com.cardvault.features.listcards.api;

import com.cardvault.features.cards.api.dto.CardResponse;
import com.cardvault.features.listcards.app.ListCardsHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Controller for listing cards.
 * Supports searching by text and filtering by tag.
 */
@RestController
@RequestMapping("/api/cards")
public class CardListController {
    
    private final ListCardsHandler listCardsHandler;
    
    public CardListController(ListCardsHandler listCardsHandler) {
        this.listCardsHandler = listCardsHandler;
    }
    
    @GetMapping
    public ResponseEntity<List<CardResponse>> listCards(
            @RequestParam(required = false) String q,
            @RequestParam(required = false) String tag) {
        
        return ResponseEntity.ok(listCardsHandler.handle(q, tag));
    }
}
