package com.cardvault.features.cards.api.dto;

public record PhoneItem(
    Long id,
    String label,
    String number
) {}
