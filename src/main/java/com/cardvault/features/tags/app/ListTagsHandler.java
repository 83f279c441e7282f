package com.cardvault.features.tags.app;

import com.cardvault.features.tags.domain.TagRepository;
import com.cardvault.features.tags.domain.TagUsage;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Handler for listing the tag vocabulary with usage counts.
 * Returns tags sorted alphabetically, including those with no cards.
 */
@Service
public class ListTagsHandler {
    
    private final TagRepository tagRepository;
    
    public ListTagsHandler(TagRepository tagRepository) {
        this.tagRepository = tagRepository;
    }
    
    @Transactional(readOnly = true)
    public List<TagUsage> handle() {
        return tagRepository.findUsageCounts();
    }
}
