package com.cardvault.features.cards.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Full description of a card used for both create and replace.
 * Absent collections are treated as empty.
 */
public record CardRequest(
    @NotBlank(message = "Name is required")
    String name,
    String title,
    String company,
    String website,
    String notes,
    List<@NotNull @Valid PhoneInput> phones,
    List<@NotNull @Valid EmailInput> emails,
    List<@NotNull @Valid AddressInput> addresses,
    List<String> tags
) {
    public CardRequest {
        phones = phones == null ? List.of() : phones;
        emails = emails == null ? List.of() : emails;
        addresses = addresses == null ? List.of() : addresses;
        tags = tags == null ? List.of() : tags;
    }
}
