package com.cardvault.integration;

import com.cardvault.features.cards.api.dto.AddressInput;
import com.cardvault.features.cards.api.dto.CardRequest;
import com.cardvault.features.cards.api.dto.EmailInput;
import com.cardvault.features.cards.api.dto.PhoneInput;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Base class for integration tests.
 * Runs the application against a SQLite file and an uploads directory in a fresh
 * temporary directory, and empties the store before each test.
 */
@ActiveProfiles("test")
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
public abstract class BaseIntegrationTest {
    
    protected static final Path WORK_DIR = createWorkDir();
    
    @Autowired
    protected JdbcTemplate jdbcTemplate;
    
    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("app.store.path", () -> WORK_DIR.resolve("cardvault-test.db").toString());
        registry.add("app.photos.uploads-dir", () -> WORK_DIR.resolve("uploads").toString());
        registry.add("app.store.seed", () -> "false");
    }
    
    @BeforeEach
    void cleanStore() {
        // card rows take phones, emails, addresses and tag links with them
        jdbcTemplate.update("DELETE FROM cards");
        jdbcTemplate.update("DELETE FROM tags");
    }
    
    private static Path createWorkDir() {
        try {
            return Files.createTempDirectory("cardvault-it");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
    
    /**
     * Card with one phone, one email and one address.
     */
    protected static CardRequest sampleCard(String name, String company, String email, String... tags) {
        return new CardRequest(
            name,
            "Engineer",
            company,
            "https://example.com",
            "",
            List.of(new PhoneInput("mobile", "+65 9123 4567")),
            List.of(new EmailInput("work", email)),
            List.of(new AddressInput("office", "1 Raffles Place", "Singapore", "Singapore", "048616")),
            List.of(tags)
        );
    }
    
    protected static CardRequest minimalCard(String name, String... tags) {
        return new CardRequest(name, null, null, null, null, null, null, null, List.of(tags));
    }
}
