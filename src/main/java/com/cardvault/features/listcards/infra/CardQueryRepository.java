package com.cardvault.features.listcards.infra;

import com.cardvault.features.cards.domain.Card;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Read-optimized repository resolving card searches to ids.
 * Every query returns each matching card once, newest update first, ties broken by id.
 * Text patterns are LIKE patterns escaped with '!'; the store's LIKE folds ASCII case only.
 */
@Repository
public interface CardQueryRepository extends JpaRepository<Card, Long> {
    
    @Query("SELECT c.id FROM Card c ORDER BY c.updatedAt DESC, c.id DESC")
    List<Long> findAllIds();
    
    /**
     * Cards whose name, company or any linked email matches the pattern.
     * Emails are tested with EXISTS so several matching emails do not repeat the card.
     */
    @Query("SELECT c.id FROM Card c WHERE " +
           "c.name LIKE :pattern ESCAPE '!' " +
           "OR c.company LIKE :pattern ESCAPE '!' " +
           "OR EXISTS (SELECT e.id FROM CardEmail e WHERE e.card = c " +
           "AND e.address LIKE :pattern ESCAPE '!') " +
           "ORDER BY c.updatedAt DESC, c.id DESC")
    List<Long> findIdsMatching(@Param("pattern") String pattern);
    
    /**
     * Cards linked to the tag with exactly this name.
     */
    @Query("SELECT c.id FROM Card c WHERE c.id IN (SELECT ct.cardId FROM CardTag ct, Tag t " +
           "WHERE ct.tagId = t.id AND t.name = :tagName) " +
           "ORDER BY c.updatedAt DESC, c.id DESC")
    List<Long> findIdsByTag(@Param("tagName") String tagName);
    
    /**
     * Cards linked to the tag that also match the text pattern.
     */
    @Query("SELECT c.id FROM Card c WHERE c.id IN (SELECT ct.cardId FROM CardTag ct, Tag t " +
           "WHERE ct.tagId = t.id AND t.name = :tagName) " +
           "AND (c.name LIKE :pattern ESCAPE '!' " +
           "OR c.company LIKE :pattern ESCAPE '!' " +
           "OR EXISTS (SELECT e.id FROM CardEmail e WHERE e.card = c " +
           "AND e.address LIKE :pattern ESCAPE '!')) " +
           "ORDER BY c.updatedAt DESC, c.id DESC")
    List<Long> findIdsByTagMatching(
        @Param("tagName") String tagName,
        @Param("pattern") String pattern);
}
