package com.cardvault.features.photos.app;

import com.cardvault.features.cards.app.CardPhotoReferenceHandler;
import com.cardvault.features.photos.infra.LocalPhotoStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Handler for removing a card photo.
 * The reference is cleared in the database first; the file is deleted afterwards on a
 * best-effort basis, since the database is authoritative.
 */
@Service
public class DeletePhotoHandler {
    
    private static final Logger log = LoggerFactory.getLogger(DeletePhotoHandler.class);
    
    private final CardPhotoReferenceHandler cardPhotoReferenceHandler;
    private final LocalPhotoStorage photoStorage;
    
    public DeletePhotoHandler(CardPhotoReferenceHandler cardPhotoReferenceHandler, LocalPhotoStorage photoStorage) {
        this.cardPhotoReferenceHandler = cardPhotoReferenceHandler;
        this.photoStorage = photoStorage;
    }
    
    /**
     * @return the cleared photo path, empty if the card had no photo
     */
    public String handle(Long cardId) {
        String previousPath = cardPhotoReferenceHandler.detach(cardId);
        discard(previousPath);
        return previousPath;
    }
    
    /**
     * Delete a photo file that is no longer referenced by any card.
     */
    public void discard(String photoPath) {
        if (photoPath == null || photoPath.isEmpty()) {
            return;
        }
        if (!photoStorage.delete(photoPath)) {
            log.warn("Photo file could not be deleted, file is orphaned: {}", photoPath);
        }
    }
}
