package com.cardvault.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Locale;

/**
 * Configuration properties for card photos.
 * Binds to app.photos.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.photos")
public class PhotoProperties {
    
    private String uploadsDir = "uploads";
    private long maxBytes = 5L * 1024 * 1024;
    private List<String> allowedExtensions = List.of("jpg", "jpeg", "png", "webp");
    
    public String getUploadsDir() {
        return uploadsDir;
    }
    
    public void setUploadsDir(String uploadsDir) {
        this.uploadsDir = uploadsDir;
    }
    
    public long getMaxBytes() {
        return maxBytes;
    }
    
    public void setMaxBytes(long maxBytes) {
        this.maxBytes = maxBytes;
    }
    
    public List<String> getAllowedExtensions() {
        return allowedExtensions;
    }
    
    public void setAllowedExtensions(List<String> allowedExtensions) {
        this.allowedExtensions = allowedExtensions;
    }
    
    /**
     * Check if a file extension is allowed for photos.
     * Performs case-insensitive comparison.
     * @param extension The extension without the leading dot
     * @return true if the extension is in the allowed list
     */
    public boolean isAllowedExtension(String extension) {
        if (extension == null || allowedExtensions == null || allowedExtensions.isEmpty()) {
            return false;
        }
        String normalized = extension.toLowerCase(Locale.ROOT).trim();
        return allowedExtensions.stream()
                .map(allowed -> allowed.toLowerCase(Locale.ROOT).trim())
                .anyMatch(allowed -> allowed.equals(normalized));
    }
}
