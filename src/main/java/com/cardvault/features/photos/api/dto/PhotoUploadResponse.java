package com.cardvault.features.photos.api.dto;

public record PhotoUploadResponse(
    String photoUrl
) {}
