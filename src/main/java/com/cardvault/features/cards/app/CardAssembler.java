package com.cardvault.features.cards.app;

import com.cardvault.features.cards.api.dto.AddressInput;
import com.cardvault.features.cards.api.dto.CardRequest;
import com.cardvault.features.cards.api.dto.EmailInput;
import com.cardvault.features.cards.api.dto.PhoneInput;
import com.cardvault.features.cards.domain.Card;

/**
 * Copies a card request's child collections onto an aggregate.
 */
final class CardAssembler {
    
    private CardAssembler() {
    }
    
    static Card newCard(CardRequest request) {
        Card card = new Card(
            request.name(),
            request.title(),
            request.company(),
            request.website(),
            request.notes()
        );
        addChildren(card, request);
        return card;
    }
    
    static void addChildren(Card card, CardRequest request) {
        for (PhoneInput phone : request.phones()) {
            requireEntry(phone, "phones");
            card.addPhone(phone.label(), phone.number());
        }
        for (EmailInput email : request.emails()) {
            requireEntry(email, "emails");
            card.addEmail(email.label(), email.address());
        }
        for (AddressInput address : request.addresses()) {
            requireEntry(address, "addresses");
            card.addAddress(
                address.label(),
                address.street(),
                address.city(),
                address.country(),
                address.postal()
            );
        }
    }
    
    private static void requireEntry(Object entry, String collection) {
        if (entry == null) {
            throw new IllegalArgumentException("Entries of " + collection + " cannot be null");
        }
    }
}
