package com.example.rpgcampaign.model;

import java.util.Objects;

/**
 * A campaign: the top-level container for NPCs, the bestiary and combat state.
 */
public class Campaign {

    private final String id;
    private final String name;
    private final String slug;
    private final String playerName;
    private final String playerSlug;
    private final long createdAt;

    public Campaign(String id, String name, String slug, String playerName, String playerSlug, long createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        this.slug = slug;
        this.playerName = playerName;
        this.playerSlug = playerSlug;
        this.createdAt = createdAt;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getSlug() { return slug; }
    public String getPlayerName() { return playerName; }
    public String getPlayerSlug() { return playerSlug; }
    public long getCreatedAt() { return createdAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Campaign other)) return false;
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Campaign[" + name + " (" + id + "), player=" + playerName + "]";
    }
}
