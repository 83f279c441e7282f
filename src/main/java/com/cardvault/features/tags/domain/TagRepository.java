package com.cardvault.features.tags.domain;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Tag domain entity.
 */
public interface TagRepository {
    Tag save(Tag tag);
    Optional<Tag> findByName(String name);
    List<TagUsage> findUsageCounts();
}
