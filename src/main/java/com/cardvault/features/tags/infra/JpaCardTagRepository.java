package com.cardvault.features.tags.infra;

import com.cardvault.features.tags.domain.CardTag;
import com.cardvault.features.tags.domain.CardTagId;
import com.cardvault.features.tags.domain.CardTagName;
import com.cardvault.features.tags.domain.CardTagRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * JPA repository implementation for CardTag junction entity.
 * Spring Data JPA automatically provides implementations for methods declared in CardTagRepository
 * that match JpaRepository methods (save).
 */
@Repository
public interface JpaCardTagRepository extends JpaRepository<CardTag, CardTagId>, CardTagRepository {
    
    @Override
    boolean existsByCardIdAndTagId(Long cardId, Long tagId);
    
    @Override
    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM CardTag ct WHERE ct.cardId = :cardId")
    void deleteByCardId(@Param("cardId") Long cardId);
    
    @Override
    @Query("SELECT new com.cardvault.features.tags.domain.CardTagName(ct.cardId, t.name) " +
           "FROM CardTag ct, Tag t WHERE ct.tagId = t.id AND ct.cardId IN :cardIds " +
           "ORDER BY t.name ASC")
    List<CardTagName> findTagNamesByCardIds(@Param("cardIds") Collection<Long> cardIds);
}
