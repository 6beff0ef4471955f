package io.mycelic.core.graph;

/**
 * {@code type} is matched case-insensitively; a null {@code strength} defaults to 0.5.
 */
public record RelationshipDraft(
    String sourceId,
    String targetId,
    String type,
    Double strength,
    String context
) {
}
