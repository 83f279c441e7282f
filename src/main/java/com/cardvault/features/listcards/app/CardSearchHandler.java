package com.cardvault.features.listcards.app;

import com.cardvault.features.listcards.infra.CardQueryRepository;
import com.cardvault.features.tags.domain.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Resolves a free-text query and/or tag filter into card ids.
 * The text matches name, company or any linked email as a substring, ignoring ASCII case;
 * the tag must match exactly. Blank parameters are ignored.
 */
@Service
public class CardSearchHandler {
    
    private static final Logger log = LoggerFactory.getLogger(CardSearchHandler.class);
    private static final char LIKE_ESCAPE = '!';
    
    private final CardQueryRepository cardQueryRepository;
    
    public CardSearchHandler(CardQueryRepository cardQueryRepository) {
        this.cardQueryRepository = cardQueryRepository;
    }
    
    @Transactional(readOnly = true)
    public List<Long> resolve(String query, String tag) {
        String tagName = (tag != null && !tag.isBlank()) ? Tag.normalizeName(tag) : null;
        String pattern = (query != null && !query.isBlank()) ? containsPattern(query.trim()) : null;
        
        List<Long> cardIds;
        if (tagName != null && pattern != null) {
            cardIds = cardQueryRepository.findIdsByTagMatching(tagName, pattern);
        } else if (pattern != null) {
            cardIds = cardQueryRepository.findIdsMatching(pattern);
        } else if (tagName != null) {
            cardIds = cardQueryRepository.findIdsByTag(tagName);
        } else {
            cardIds = cardQueryRepository.findAllIds();
        }
        
        log.debug("Card search q={} tag={} matched {} cards", query, tagName, cardIds.size());
        return cardIds;
    }
    
    /**
     * Build a LIKE pattern matching the text anywhere, with wildcards in the
     * text itself taken literally.
     */
    static String containsPattern(String text) {
        StringBuilder pattern = new StringBuilder(text.length() + 2).append('%');
        for (char ch : text.toCharArray()) {
            if (ch == '%' || ch == '_' || ch == LIKE_ESCAPE) {
                pattern.append(LIKE_ESCAPE);
            }
            pattern.append(ch);
        }
        return pattern.append('%').toString();
    }
}
