package com.cardvault.features.cards.app;

import com.cardvault.features.cards.api.dto.AddressItem;
import com.cardvault.features.cards.api.dto.CardResponse;
import com.cardvault.features.cards.api.dto.EmailItem;
import com.cardvault.features.cards.api.dto.PhoneItem;
import com.cardvault.features.cards.domain.Card;
import com.cardvault.features.cards.domain.CardRepository;
import com.cardvault.features.tags.domain.CardTagName;
import com.cardvault.features.tags.domain.CardTagRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds complete card views: root fields, the three child collections ordered by
 * child id, and tag names in alphabetical order.
 */
@Component
public class CardHydrator {
    
    private final CardRepository cardRepository;
    private final CardTagRepository cardTagRepository;
    
    public CardHydrator(CardRepository cardRepository, CardTagRepository cardTagRepository) {
        this.cardRepository = cardRepository;
        this.cardTagRepository = cardTagRepository;
    }
    
    @Transactional(readOnly = true)
    public Optional<CardResponse> hydrate(Long cardId) {
        return hydrate(List.of(cardId)).stream().findFirst();
    }
    
    /**
     * Hydrate cards in the order of the given ids. Duplicate and unknown ids are skipped.
     */
    @Transactional(readOnly = true)
    public List<CardResponse> hydrate(List<Long> cardIds) {
        Set<Long> uniqueIds = new LinkedHashSet<>(cardIds);
        if (uniqueIds.isEmpty()) {
            return List.of();
        }
        
        Map<Long, Card> cardsById = cardRepository.findAllById(uniqueIds).stream()
                .collect(Collectors.toMap(Card::getId, Function.identity()));
        Map<Long, List<String>> tagsByCardId = loadTags(uniqueIds);
        
        List<CardResponse> cards = new ArrayList<>(cardsById.size());
        for (Long cardId : uniqueIds) {
            Card card = cardsById.get(cardId);
            if (card != null) {
                cards.add(toResponse(card, tagsByCardId.getOrDefault(cardId, List.of())));
            }
        }
        return cards;
    }
    
    /**
     * Load tag names for several cards at once.
     * Returns a map of cardId -> tag names, already sorted by the query.
     */
    private Map<Long, List<String>> loadTags(Set<Long> cardIds) {
        return cardTagRepository.findTagNamesByCardIds(cardIds).stream()
                .collect(Collectors.groupingBy(
                    CardTagName::cardId,
                    Collectors.mapping(CardTagName::name, Collectors.toList())
                ));
    }
    
    private CardResponse toResponse(Card card, List<String> tags) {
        List<PhoneItem> phones = card.getPhones().stream()
                .map(phone -> new PhoneItem(phone.getId(), phone.getLabel(), phone.getNumber()))
                .toList();
        List<EmailItem> emails = card.getEmails().stream()
                .map(email -> new EmailItem(email.getId(), email.getLabel(), email.getAddress()))
                .toList();
        List<AddressItem> addresses = card.getAddresses().stream()
                .map(address -> new AddressItem(
                    address.getId(),
                    address.getLabel(),
                    address.getStreet(),
                    address.getCity(),
                    address.getCountry(),
                    address.getPostal()))
                .toList();
        
        return new CardResponse(
            card.getId(),
            card.getName(),
            card.getTitle(),
            card.getCompany(),
            card.getWebsite(),
            card.getNotes(),
            card.hasPhoto() ? "/" + card.getPhotoPath() : "",
            phones,
            emails,
            addresses,
            tags,
            card.getCreatedAt(),
            card.getUpdatedAt()
        );
    }
}
