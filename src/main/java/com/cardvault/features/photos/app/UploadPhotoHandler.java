package com.cardvault.features.photos.app;

import com.cardvault.common.config.PhotoProperties;
import com.cardvault.common.exception.BusinessException;
import com.cardvault.common.exception.NotFoundException;
import com.cardvault.features.cards.app.CardPhotoReferenceHandler;
import com.cardvault.features.photos.infra.LocalPhotoStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Handler for uploading a card photo.
 * <p>
 * Validation happens before anything is written. The file is written first and linked
 * to the card afterwards; if linking fails the file stays on disk as an orphan and is
 * reported in the log. A photo replaced by the upload is deleted best-effort.
 */
@Service
public class UploadPhotoHandler {
    
    private static final Logger log = LoggerFactory.getLogger(UploadPhotoHandler.class);
    
    private final CardPhotoReferenceHandler cardPhotoReferenceHandler;
    private final LocalPhotoStorage photoStorage;
    private final PhotoProperties photoProperties;
    
    public UploadPhotoHandler(
            CardPhotoReferenceHandler cardPhotoReferenceHandler,
            LocalPhotoStorage photoStorage,
            PhotoProperties photoProperties) {
        this.cardPhotoReferenceHandler = cardPhotoReferenceHandler;
        this.photoStorage = photoStorage;
        this.photoProperties = photoProperties;
    }
    
    /**
     * @return the public URL of the stored photo
     */
    public String handle(Long cardId, String originalFilename, byte[] bytes) {
        String extension = extensionOf(originalFilename);
        validate(extension, bytes);
        
        if (!cardPhotoReferenceHandler.exists(cardId)) {
            throw new NotFoundException("Card not found: " + cardId);
        }
        
        String photoPath = photoStorage.store(cardId, extension, bytes);
        
        String previousPath;
        try {
            previousPath = cardPhotoReferenceHandler.attach(cardId, photoPath);
        } catch (RuntimeException e) {
            log.warn("Photo written but not linked, file is orphaned: cardId={}, path={}", cardId, photoPath);
            throw e;
        }
        
        if (!previousPath.isEmpty() && !previousPath.equals(photoPath)) {
            boolean deleted = photoStorage.delete(previousPath);
            if (!deleted) {
                log.warn("Replaced photo could not be deleted, file is orphaned: cardId={}, path={}",
                    cardId, previousPath);
            }
        }
        return "/" + photoPath;
    }
    
    private void validate(String extension, byte[] bytes) {
        if (!photoProperties.isAllowedExtension(extension)) {
            throw new BusinessException(
                "UNSUPPORTED_PHOTO_TYPE",
                String.format("Unsupported photo type. Allowed extensions: %s",
                    String.join(", ", photoProperties.getAllowedExtensions()))
            );
        }
        if (bytes == null || bytes.length == 0) {
            throw new BusinessException("EMPTY_PHOTO", "Photo is empty");
        }
        if (bytes.length > photoProperties.getMaxBytes()) {
            throw new BusinessException(
                "PHOTO_TOO_LARGE",
                String.format("Photo exceeds the maximum size of %d bytes", photoProperties.getMaxBytes())
            );
        }
    }
    
    /**
     * Lower-case extension after the last dot, empty if there is none.
     */
    static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int lastDot = filename.lastIndexOf('.');
        return lastDot >= 0 ? filename.substring(lastDot + 1).toLowerCase(Locale.ROOT) : "";
    }
}
