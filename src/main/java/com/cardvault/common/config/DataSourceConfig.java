package com.cardvault.common.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteConfig;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * SQLite store wiring.
 * <p>
 * The pool holds exactly one connection, so every read and write in the process is
 * serialized on it. Foreign keys and WAL journaling are applied when the connection opens.
 */
@Configuration
public class DataSourceConfig {
    
    private static final Logger log = LoggerFactory.getLogger(DataSourceConfig.class);
    
    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource(StoreProperties storeProperties) {
        Path dbFile = Path.of(storeProperties.getPath()).toAbsolutePath().normalize();
        createParentDirectory(dbFile);
        
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.enforceForeignKeys(true);
        sqlite.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sqlite.setBusyTimeout((int) storeProperties.getLockTimeout().toMillis());
        
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("cardvault-store");
        hikari.setJdbcUrl("jdbc:sqlite:" + dbFile);
        hikari.setDataSourceProperties(sqlite.toProperties());
        hikari.setMaximumPoolSize(1);
        hikari.setMinimumIdle(1);
        hikari.setConnectionTimeout(storeProperties.getLockTimeout().toMillis());
        
        log.info("Opening card store at {}", dbFile);
        return new HikariDataSource(hikari);
    }
    
    private void createParentDirectory(Path dbFile) {
        Path parent = dbFile.getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create store directory " + parent, e);
        }
    }
}
