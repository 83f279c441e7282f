package com.cardvault.features.photos.api;

import com.cardvault.common.exception.StorageException;
import com.cardvault.features.photos.api.dto.PhotoUploadResponse;
import com.cardvault.features.photos.app.DeletePhotoHandler;
import com.cardvault.features.photos.app.UploadPhotoHandler;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * Controller for card photo uploads and removal.
 */
@RestController
@RequestMapping("/api/cards")
public class PhotoController {
    
    private final UploadPhotoHandler uploadPhotoHandler;
    private final DeletePhotoHandler deletePhotoHandler;
    
    public PhotoController(UploadPhotoHandler uploadPhotoHandler, DeletePhotoHandler deletePhotoHandler) {
        this.uploadPhotoHandler = uploadPhotoHandler;
        this.deletePhotoHandler = deletePhotoHandler;
    }
    
    /**
     * Upload or replace a card's photo.
     * POST /api/cards/{cardId}/photo (multipart part "photo")
     */
    @PostMapping(value = "/{cardId}/photo", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<PhotoUploadResponse> uploadPhoto(
            @PathVariable Long cardId,
            @RequestPart("photo") MultipartFile photo) {
        
        byte[] bytes;
        try {
            bytes = photo.getBytes();
        } catch (IOException e) {
            throw new StorageException("Failed to read uploaded photo", e);
        }
        
        String photoUrl = uploadPhotoHandler.handle(cardId, photo.getOriginalFilename(), bytes);
        return ResponseEntity.ok(new PhotoUploadResponse(photoUrl));
    }
    
    /**
     * Remove a card's photo.
     * DELETE /api/cards/{cardId}/photo
     */
    @DeleteMapping("/{cardId}/photo")
    public ResponseEntity<Void> deletePhoto(@PathVariable Long cardId) {
        deletePhotoHandler.handle(cardId);
        return ResponseEntity.status(HttpStatus.NO_CONTENT).build();
    }
}
