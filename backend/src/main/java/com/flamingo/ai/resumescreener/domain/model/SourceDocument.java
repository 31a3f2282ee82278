package com.flamingo.ai.resumescreener.domain.model;

/**
 * A candidate document after format decoding: its original name and its plain text.
 *
 * @param filename original document name
 * @param text decoded, not yet normalized, text
 */
public record SourceDocument(String filename, String text) {}
