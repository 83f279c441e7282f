package com.cardvault.features.photos.app;

import com.cardvault.common.config.PhotoProperties;
import com.cardvault.common.exception.BusinessException;
import com.cardvault.common.exception.NotFoundException;
import com.cardvault.features.cards.app.CardPhotoReferenceHandler;
import com.cardvault.features.photos.infra.LocalPhotoStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UploadPhotoHandlerTest {
    
    private static final byte[] BYTES = {1, 2, 3};
    
    @Mock
    private CardPhotoReferenceHandler cardPhotoReferenceHandler;
    
    @Mock
    private LocalPhotoStorage photoStorage;
    
    private UploadPhotoHandler handler;
    
    @BeforeEach
    void setUp() {
        handler = new UploadPhotoHandler(cardPhotoReferenceHandler, photoStorage, new PhotoProperties());
    }
    
    @Test
    void shouldExtractLowerCaseExtension() {
        assertThat(UploadPhotoHandler.extensionOf("Photo.JPG")).isEqualTo("jpg");
        assertThat(UploadPhotoHandler.extensionOf("archive.tar.png")).isEqualTo("png");
        assertThat(UploadPhotoHandler.extensionOf("noext")).isEmpty();
        assertThat(UploadPhotoHandler.extensionOf(null)).isEmpty();
    }
    
    @Test
    void shouldCheckExtensionBeforeCardExists() {
        assertThatThrownBy(() -> handler.handle(1L, "x.gif", BYTES))
                .isInstanceOf(BusinessException.class);
        
        verify(cardPhotoReferenceHandler, never()).exists(anyLong());
        verify(photoStorage, never()).store(any(), any(), any());
    }
    
    @Test
    void shouldNotWriteForUnknownCard() {
        when(cardPhotoReferenceHandler.exists(5L)).thenReturn(false);
        
        assertThatThrownBy(() -> handler.handle(5L, "x.png", BYTES))
                .isInstanceOf(NotFoundException.class);
        
        verify(photoStorage, never()).store(any(), any(), any());
    }
    
    @Test
    void shouldKeepFileAndRethrowWhenLinkingFails() {
        when(cardPhotoReferenceHandler.exists(5L)).thenReturn(true);
        when(photoStorage.store(5L, "png", BYTES)).thenReturn("uploads/card_5_1.png");
        when(cardPhotoReferenceHandler.attach(5L, "uploads/card_5_1.png"))
                .thenThrow(new NotFoundException("Card not found: 5"));
        
        assertThatThrownBy(() -> handler.handle(5L, "x.png", BYTES))
                .isInstanceOf(NotFoundException.class);
        
        verify(photoStorage, never()).delete(any());
    }
    
    @Test
    void shouldDeletePreviousPhotoAfterLinking() {
        when(cardPhotoReferenceHandler.exists(5L)).thenReturn(true);
        when(photoStorage.store(5L, "jpeg", BYTES)).thenReturn("uploads/card_5_2.jpeg");
        when(cardPhotoReferenceHandler.attach(5L, "uploads/card_5_2.jpeg")).thenReturn("uploads/card_5_1.png");
        when(photoStorage.delete("uploads/card_5_1.png")).thenReturn(false);
        
        String photoUrl = handler.handle(5L, "me.JPEG", BYTES);
        
        assertThat(photoUrl).isEqualTo("/uploads/card_5_2.jpeg");
        verify(photoStorage).delete("uploads/card_5_1.png");
    }
}
