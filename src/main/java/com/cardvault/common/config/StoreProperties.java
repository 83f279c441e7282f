package com.cardvault.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the card store.
 * Binds to app.store.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.store")
public class StoreProperties {
    
    private String path = "cardvault.db";
    private boolean seed;
    private Duration lockTimeout = Duration.ofSeconds(30);
    
    public String getPath() {
        return path;
    }
    
    public void setPath(String path) {
        this.path = path;
    }
    
    public boolean isSeed() {
        return seed;
    }
    
    public void setSeed(boolean seed) {
        this.seed = seed;
    }
    
    /**
     * Longest time a caller waits for the single store connection.
     */
    public Duration getLockTimeout() {
        return lockTimeout;
    }
    
    public void setLockTimeout(Duration lockTimeout) {
        this.lockTimeout = lockTimeout;
    }
}
