package com.cardvault.features.photos.api;

import com.cardvault.common.exception.NotFoundException;
import com.cardvault.features.photos.infra.LocalPhotoStorage;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;

/**
 * Serves stored photos. Only flat file names directly under the uploads root are served.
 * GET /uploads/{filename}
 */
@RestController
@RequestMapping("/uploads")
public class UploadsController {
    
    private final LocalPhotoStorage photoStorage;
    
    public UploadsController(LocalPhotoStorage photoStorage) {
        this.photoStorage = photoStorage;
    }
    
    @GetMapping("/{filename:.+}")
    public ResponseEntity<Resource> getPhoto(@PathVariable String filename) {
        Path file = photoStorage.resolve(filename)
                .orElseThrow(() -> new NotFoundException("Photo not found: " + filename));
        
        Resource resource = new FileSystemResource(file);
        MediaType mediaType = MediaTypeFactory.getMediaType(resource)
                .orElse(MediaType.APPLICATION_OCTET_STREAM);
        return ResponseEntity.ok()
                .contentType(mediaType)
                .body(resource);
    }
}
