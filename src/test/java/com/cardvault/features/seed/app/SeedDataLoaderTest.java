package com.cardvault.features.seed.app;

import com.cardvault.common.config.StoreProperties;
import com.cardvault.features.cards.api.dto.CardRequest;
import com.cardvault.features.cards.app.CreateCardHandler;
import com.cardvault.features.cards.domain.CardRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SeedDataLoaderTest {
    
    @Mock
    private CardRepository cardRepository;
    
    @Mock
    private CreateCardHandler createCardHandler;
    
    private StoreProperties storeProperties;
    private SeedDataLoader loader;
    
    @BeforeEach
    void setUp() {
        storeProperties = new StoreProperties();
        loader = new SeedDataLoader(storeProperties, cardRepository, createCardHandler, new ObjectMapper());
    }
    
    @Test
    void shouldDoNothingWhenSeedingDisabled() {
        loader.run(new DefaultApplicationArguments());
        
        verifyNoInteractions(cardRepository, createCardHandler);
    }
    
    @Test
    void shouldSkipNonEmptyStore() {
        storeProperties.setSeed(true);
        when(cardRepository.count()).thenReturn(3L);
        
        loader.run(new DefaultApplicationArguments());
        
        verify(createCardHandler, never()).handle(any());
    }
    
    @Test
    void shouldInsertSampleContactsIntoEmptyStore() {
        storeProperties.setSeed(true);
        when(cardRepository.count()).thenReturn(0L);
        
        loader.run(new DefaultApplicationArguments());
        
        ArgumentCaptor<CardRequest> captor = ArgumentCaptor.forClass(CardRequest.class);
        verify(createCardHandler, times(10)).handle(captor.capture());
        List<CardRequest> seeds = captor.getAllValues();
        assertThat(seeds.get(0).name()).isEqualTo("Tan Wei Ming");
        assertThat(seeds.get(0).tags()).containsExactly("fintech", "client", "investor");
        assertThat(seeds.get(3).addresses()).isEmpty();
        assertThat(seeds).allSatisfy(seed -> assertThat(seed.emails()).isNotEmpty());
    }
}
