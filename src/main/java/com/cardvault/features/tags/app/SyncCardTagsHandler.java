package com.cardvault.features.tags.app;

import com.cardvault.features.tags.domain.CardTag;
import com.cardvault.features.tags.domain.CardTagRepository;
import com.cardvault.features.tags.domain.Tag;
import com.cardvault.features.tags.domain.TagRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Handler for replacing the tag links of a card.
 * Drops every existing link, then finds or creates each named tag and links it.
 * Tags left without cards are kept.
 */
@Service
public class SyncCardTagsHandler {
    
    private static final Logger log = LoggerFactory.getLogger(SyncCardTagsHandler.class);
    
    private final TagRepository tagRepository;
    private final CardTagRepository cardTagRepository;
    
    public SyncCardTagsHandler(TagRepository tagRepository, CardTagRepository cardTagRepository) {
        this.tagRepository = tagRepository;
        this.cardTagRepository = cardTagRepository;
    }
    
    @Transactional(propagation = Propagation.MANDATORY)
    public void handle(Long cardId, List<String> tagNames) {
        cardTagRepository.deleteByCardId(cardId);
        
        for (String name : normalizeNames(tagNames)) {
            // Find or create tag
            Tag tag = tagRepository.findByName(name)
                    .orElseGet(() -> {
                        log.debug("Creating tag '{}'", name);
                        return tagRepository.save(new Tag(name));
                    });
            
            // Create card-tag association if it doesn't exist
            if (!cardTagRepository.existsByCardIdAndTagId(cardId, tag.getId())) {
                cardTagRepository.save(new CardTag(cardId, tag.getId()));
            }
        }
    }
    
    /**
     * Trim names, skip blank entries and collapse duplicates, keeping first-seen order.
     */
    private Set<String> normalizeNames(List<String> tagNames) {
        Set<String> names = new LinkedHashSet<>();
        if (tagNames == null) {
            return names;
        }
        for (String name : tagNames) {
            if (name != null && !name.isBlank()) {
                names.add(Tag.normalizeName(name));
            }
        }
        return names;
    }
}
