package com.cardvault.features.cards.api.dto;

public record AddressInput(
    String label,
    String street,
    String city,
    String country,
    String postal
) {}
