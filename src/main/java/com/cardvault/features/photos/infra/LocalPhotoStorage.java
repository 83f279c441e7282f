package com.cardvault.features.photos.infra;

import com.cardvault.common.config.PhotoProperties;
import com.cardvault.common.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Stores card photos as flat files under the uploads root.
 * <p>
 * Photo paths handed to the database have the form {@code uploads/<filename>}, which is
 * also the public URL without its leading slash. Deletion is best-effort: failures are
 * logged and reported through the return value, never thrown.
 */
@Service
public class LocalPhotoStorage {
    
    private static final Logger log = LoggerFactory.getLogger(LocalPhotoStorage.class);
    
    public static final String PATH_PREFIX = "uploads/";
    
    private final Path root;
    private final AtomicLong lastStamp = new AtomicLong();
    
    public LocalPhotoStorage(PhotoProperties photoProperties) {
        this.root = Path.of(photoProperties.getUploadsDir()).toAbsolutePath().normalize();
    }
    
    /**
     * Write photo bytes to a new file named {@code card_<id>_<millis>.<ext>}.
     * The millisecond stamp is strictly increasing within the process, so no two
     * uploads share a name and an existing file is never overwritten.
     *
     * @return the photo path to record on the card
     */
    public String store(Long cardId, String extension, byte[] bytes) {
        String filename = String.format("card_%d_%d.%s", cardId, nextStamp(), extension);
        Path target = root.resolve(filename);
        try {
            Files.createDirectories(root);
            Files.write(target, bytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new StorageException("Failed to write photo " + filename, e);
        }
        log.info("Stored photo: cardId={}, file={}, bytes={}", cardId, filename, bytes.length);
        return PATH_PREFIX + filename;
    }
    
    /**
     * Delete the file behind a recorded photo path.
     *
     * @param photoPath The path stored on the card
     * @return true if the file was deleted or did not exist, false on error
     */
    public boolean delete(String photoPath) {
        if (photoPath == null || photoPath.isBlank()) {
            return true;
        }
        
        String filename = filenameOf(photoPath);
        if (!isFlatName(filename)) {
            log.warn("Refusing to delete photo outside uploads root: {}", photoPath);
            return false;
        }
        
        try {
            if (Files.deleteIfExists(root.resolve(filename))) {
                log.info("Deleted photo file: {}", filename);
            } else {
                log.debug("Photo file does not exist (already deleted?): {}", filename);
            }
            return true;
        } catch (IOException e) {
            log.error("Failed to delete photo file: {}", filename, e);
            return false;
        }
    }
    
    /**
     * Locate a stored photo by its public filename.
     *
     * @throws IllegalArgumentException if the name is not a flat file name
     */
    public Optional<Path> resolve(String filename) {
        if (!isFlatName(filename)) {
            throw new IllegalArgumentException("Invalid photo filename");
        }
        Path file = root.resolve(filename);
        return Files.isRegularFile(file) ? Optional.of(file) : Optional.empty();
    }
    
    public Path getRoot() {
        return root;
    }
    
    private long nextStamp() {
        long now = System.currentTimeMillis();
        return lastStamp.updateAndGet(previous -> Math.max(previous + 1, now));
    }
    
    private static String filenameOf(String photoPath) {
        return photoPath.startsWith(PATH_PREFIX)
                ? photoPath.substring(PATH_PREFIX.length())
                : photoPath;
    }
    
    static boolean isFlatName(String filename) {
        return filename != null
                && !filename.isBlank()
                && !filename.contains("/")
                && !filename.contains("\\")
                && !filename.contains("..");
    }
}
