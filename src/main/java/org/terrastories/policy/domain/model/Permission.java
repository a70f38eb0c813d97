package org.terrastories.policy.domain.model;

/**
 * Coarse-grained capabilities granted per role.
 *
 * <p>These gate whole features (e.g. the cultural validation queue). Access to a specific resource is
 * always decided by the policy engine.
 *
 * <p>This matrix is not an eligibility check. Elders hold no {@code *:write} permission yet the
 * engine lets them write and delete any content of their community; decide whether to offer
 * an edit or delete action from {@code CulturalAccessService.check}, not from these grants.
 */
public enum Permission {
    STORIES_READ("stories:read"),
    STORIES_WRITE("stories:write"),
    PLACES_READ("places:read"),
    PLACES_WRITE("places:write"),
    SPEAKERS_READ("speakers:read"),
    SPEAKERS_WRITE("speakers:write"),
    CULTURAL_READ("cultural:read"),
    CULTURAL_VALIDATE("cultural:validate"),
    SYSTEM_ADMIN("system:admin");

    private final String value;

    Permission(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isCommunityPermission() {
        return this != SYSTEM_ADMIN;
    }
}
