package com.example.rpgcampaign.model;

/**
 * What the combat engine needs to know about a participant's backing record.
 * Either value may be null; an explicit hit chance takes precedence over the threat level.
 */
public record ParticipantSource(
    String name,
    ThreatLevel threatLevel,
    Double hitChance
) {
    public static ParticipantSource of(NpcRecord npc) {
        return new ParticipantSource(npc.getName(), npc.getThreatLevel(), npc.getHitChance());
    }

    public static ParticipantSource of(BestiaryEntry entry) {
        return new ParticipantSource(entry.getName(), entry.getThreatLevel(), null);
    }
}
