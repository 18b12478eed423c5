package com.anomalyplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Identity of the entity a detection run is about.
 */
public record EntityRef(
    @JsonProperty("type") EntityType type,
    @JsonProperty("id") String id,
    @JsonProperty("name") String name
) {
    public EntityRef {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
    }

    public static EntityRef of(EntityType type, String id) {
        return new EntityRef(type, id, null);
    }

    /** Same type and id; the display name is ignored. */
    public boolean sameAs(EntityRef other) {
        return other != null && type == other.type && id.equals(other.id);
    }

    /** Display name, falling back to "Player 42" style labels. */
    public String displayName() {
        if (name != null && !name.isBlank()) return name;
        String label = type.key();
        return Character.toUpperCase(label.charAt(0)) + label.substring(1) + " " + id;
    }

    @Override
    public String toString() {
        return type.key() + ":" + id;
    }
}
