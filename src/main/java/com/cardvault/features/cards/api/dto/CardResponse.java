package com.cardvault.features.cards.api.dto;

import java.time.Instant;
import java.util.List;

/**
 * Fully hydrated card. photoUrl is empty when the card has no photo.
 */
public record CardResponse(
    Long id,
    String name,
    String title,
    String company,
    String website,
    String notes,
    String photoUrl,
    List<PhoneItem> phones,
    List<EmailItem> emails,
    List<AddressItem> addresses,
    List<String> tags,
    Instant createdAt,
    Instant updatedAt
) {}
