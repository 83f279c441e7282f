package com.cardvault.features.tags.domain;

/**
 * A tag name with the number of cards currently linked to it.
 */
public record TagUsage(
    String name,
    Long count
) {}
