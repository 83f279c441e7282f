package com.cardvault.features.tags.api;

import com.cardvault.features.tags.app.ListTagsHandler;
import com.cardvault.features.tags.domain.TagUsage;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Controller for querying tags.
 * Provides read-only access to the tag vocabulary.
 */
@RestController
@RequestMapping("/api/tags")
public class TagsQueryController {
    
    private final ListTagsHandler listTagsHandler;
    
    public TagsQueryController(ListTagsHandler listTagsHandler) {
        this.listTagsHandler = listTagsHandler;
    }
    
    /**
     * Get all tags with the number of cards using each.
     * GET /api/tags
     */
    @GetMapping
    public ResponseEntity<List<TagUsage>> listTags() {
        return ResponseEntity.ok(listTagsHandler.handle());
    }
}
