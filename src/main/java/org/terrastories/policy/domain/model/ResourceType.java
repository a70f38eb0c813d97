package org.terrastories.policy.domain.model;

/**
 * Kinds of community-owned content governed by cultural protocol.
 */
public enum ResourceType {
    STORY("story"),
    PLACE("place"),
    SPEAKER("speaker"),
    THEME("theme");

    private final String value;

    ResourceType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
