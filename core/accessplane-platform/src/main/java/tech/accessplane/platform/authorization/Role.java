package tech.accessplane.platform.authorization;

/**
 * Role metadata, stored as {@code ROLE#<id>} / {@code METADATA}.
 */
public record Role(String id, String name) {}
