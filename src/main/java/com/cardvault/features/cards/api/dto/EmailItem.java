package com.cardvault.features.cards.api.dto;

public record EmailItem(
    Long id,
    String label,
    String address
) {}
