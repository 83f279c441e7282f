package com.cardvault.features.seed.app;

import com.cardvault.common.config.StoreProperties;
import com.cardvault.common.exception.StorageException;
import com.cardvault.features.cards.api.dto.CardRequest;
import com.cardvault.features.cards.app.CreateCardHandler;
import com.cardvault.features.cards.domain.CardRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Inserts the sample contacts from seed/cards.json on startup.
 * Runs only when app.store.seed is enabled and the store holds no cards yet.
 */
@Component
public class SeedDataLoader implements ApplicationRunner {
    
    private static final Logger log = LoggerFactory.getLogger(SeedDataLoader.class);
    
    static final String SEED_RESOURCE = "seed/cards.json";
    
    private final StoreProperties storeProperties;
    private final CardRepository cardRepository;
    private final CreateCardHandler createCardHandler;
    private final ObjectMapper objectMapper;
    
    public SeedDataLoader(
            StoreProperties storeProperties,
            CardRepository cardRepository,
            CreateCardHandler createCardHandler,
            ObjectMapper objectMapper) {
        this.storeProperties = storeProperties;
        this.cardRepository = cardRepository;
        this.createCardHandler = createCardHandler;
        this.objectMapper = objectMapper;
    }
    
    @Override
    public void run(ApplicationArguments args) {
        if (!storeProperties.isSeed()) {
            return;
        }
        if (cardRepository.count() > 0) {
            log.info("Store already has cards, skipping seed data");
            return;
        }
        
        List<CardRequest> seeds = readSeeds();
        for (CardRequest seed : seeds) {
            createCardHandler.handle(seed);
        }
        log.info("Seeded {} sample cards", seeds.size());
    }
    
    private List<CardRequest> readSeeds() {
        Resource resource = new ClassPathResource(SEED_RESOURCE);
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<List<CardRequest>>() {});
        } catch (IOException e) {
            throw new StorageException("Failed to read seed data from " + SEED_RESOURCE, e);
        }
    }
}
