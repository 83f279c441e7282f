package com.cardvault.features.tags.domain;

/**
 * Projection of one card-to-tag link, resolved to the tag's name.
 */
public record CardTagName(
    Long cardId,
    String name
) {}
