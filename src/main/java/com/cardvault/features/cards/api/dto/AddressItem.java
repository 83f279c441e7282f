package com.cardvault.features.cards.api.dto;

public record AddressItem(
    Long id,
    String label,
    String street,
    String city,
    String country,
    String postal
) {}
