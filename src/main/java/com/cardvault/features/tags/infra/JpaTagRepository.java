package com.cardvault.features.tags.infra;

import com.cardvault.features.tags.domain.Tag;
import com.cardvault.features.tags.domain.TagRepository;
import com.cardvault.features.tags.domain.TagUsage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * JPA repository implementation for Tag entity.
 * Spring Data JPA automatically provides implementations for methods declared in TagRepository
 * that match JpaRepository methods (save).
 */
@Repository
public interface JpaTagRepository extends JpaRepository<Tag, Long>, TagRepository {
    
    @Override
    Optional<Tag> findByName(String name);
    
    /**
     * Every tag with the number of linked cards, zero included, sorted by name.
     */
    @Override
    @Query("SELECT new com.cardvault.features.tags.domain.TagUsage(t.name, COUNT(ct.cardId)) " +
           "FROM Tag t LEFT JOIN CardTag ct ON ct.tagId = t.id " +
           "GROUP BY t.id, t.name ORDER BY t.name ASC")
    List<TagUsage> findUsageCounts();
}
