package com.cardvault.integration;

import com.cardvault.features.cards.api.dto.CardRequest;
import com.cardvault.features.cards.api.dto.CardResponse;
import com.cardvault.features.cards.api.dto.EmailInput;
import com.cardvault.features.cards.app.CreateCardHandler;
import com.cardvault.features.cards.app.UpdateCardHandler;
import com.cardvault.features.listcards.app.CardSearchHandler;
import com.cardvault.features.listcards.app.ListCardsHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for free-text search and tag filtering.
 */
public class CardSearchIntegrationTest extends BaseIntegrationTest {
    
    @Autowired
    private CreateCardHandler createCardHandler;
    
    @Autowired
    private UpdateCardHandler updateCardHandler;
    
    @Autowired
    private CardSearchHandler cardSearchHandler;
    
    @Autowired
    private ListCardsHandler listCardsHandler;
    
    private Long dbs;
    private Long grab;
    private Long sea;
    
    @BeforeEach
    void createCards() throws InterruptedException {
        dbs = createCardHandler.handle(
            sampleCard("Tan Wei Ming", "DBS Group Holdings", "weiming.tan@dbs.com", "fintech", "client"));
        Thread.sleep(5);
        grab = createCardHandler.handle(
            sampleCard("Priya Krishnamurthy", "Grab Holdings", "priya.k@grab.com", "fintech", "partner"));
        Thread.sleep(5);
        sea = createCardHandler.handle(
            sampleCard("Li Mei Chen", "Sea Limited", "meichen@grab-alumni.org", "colleague"));
    }
    
    @Test
    void shouldListAllCardsMostRecentlyUpdatedFirst() throws InterruptedException {
        assertThat(cardSearchHandler.resolve(null, null)).containsExactly(sea, grab, dbs);
        
        Thread.sleep(5);
        updateCardHandler.handle(dbs, sampleCard("Tan Wei Ming", "DBS Bank", "weiming.tan@dbs.com"));
        
        assertThat(cardSearchHandler.resolve("", "  ")).containsExactly(dbs, sea, grab);
    }
    
    @Test
    void shouldMatchNameCompanyAndEmailCaseInsensitively() {
        assertThat(cardSearchHandler.resolve("PRIYA", null)).containsExactly(grab);
        assertThat(cardSearchHandler.resolve("holdings", null)).containsExactly(grab, dbs);
        assertThat(cardSearchHandler.resolve("grab", null)).containsExactly(sea, grab);
    }
    
    @Test
    void shouldReturnEachCardOnceWhenSeveralEmailsMatch() throws InterruptedException {
        Thread.sleep(5);
        updateCardHandler.handle(grab, new CardRequest(
            "Priya Krishnamurthy", null, "Grab Holdings", null, null, null,
            List.of(
                new EmailInput("work", "priya.k@grab.com"),
                new EmailInput("personal", "priya@grab.io")),
            null, List.of("fintech")));
        
        assertThat(cardSearchHandler.resolve("grab", null)).containsExactly(grab, sea);
    }
    
    @Test
    void shouldFilterByExactTag() {
        assertThat(cardSearchHandler.resolve(null, "fintech")).containsExactly(grab, dbs);
        assertThat(cardSearchHandler.resolve(null, "Fintech")).isEmpty();
        assertThat(cardSearchHandler.resolve(null, "fin")).isEmpty();
        assertThat(cardSearchHandler.resolve(null, "unknown")).isEmpty();
    }
    
    @Test
    void shouldCombineQueryAndTag() {
        assertThat(cardSearchHandler.resolve("grab", "fintech")).containsExactly(grab);
        assertThat(cardSearchHandler.resolve("grab", "colleague")).containsExactly(sea);
        assertThat(cardSearchHandler.resolve("dbs", "partner")).isEmpty();
    }
    
    @Test
    void shouldTreatWildcardsLiterally() {
        createCardHandler.handle(minimalCard("100% Legit_Co"));
        
        assertThat(cardSearchHandler.resolve("%", null)).hasSize(1);
        assertThat(cardSearchHandler.resolve("_", null)).hasSize(1);
        assertThat(cardSearchHandler.resolve("t_c", null)).hasSize(1);
        assertThat(cardSearchHandler.resolve("x%", null)).isEmpty();
    }
    
    @Test
    void shouldMatchNonAsciiTextByItsOwnSpelling() {
        Long emile = createCardHandler.handle(minimalCard("Émile Zola"));
        Long societe = createCardHandler.handle(
            sampleCard("Claire Dubois", "Société Générale", "claire@socgen.fr"));
        
        assertThat(cardSearchHandler.resolve("Émile", null)).containsExactly(emile);
        assertThat(cardSearchHandler.resolve("zola", null)).containsExactly(emile);
        assertThat(cardSearchHandler.resolve("Société", null)).containsExactly(societe);
    }
    
    @Test
    void shouldHydrateSearchResults() {
        List<CardResponse> cards = listCardsHandler.handle("holdings", "fintech");
        
        assertThat(cards).extracting(CardResponse::id).containsExactly(grab, dbs);
        assertThat(cards.get(0).tags()).containsExactly("fintech", "partner");
        assertThat(cards.get(0).emails()).hasSize(1);
    }
}
