package com.cardvault.features.cards.api.dto;

import jakarta.validation.constraints.NotNull;

public record EmailInput(
    String label,
    @NotNull(message = "Email address is required")
    String address
) {}
