package com.cardvault.features.cards.api.dto;

import jakarta.validation.constraints.NotNull;

public record PhoneInput(
    String label,
    @NotNull(message = "Phone number is required")
    String number
) {}
