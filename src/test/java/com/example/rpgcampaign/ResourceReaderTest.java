package com.example.rpgcampaign;

import com.example.rpgcampaign.combat.CombatException;
import com.example.rpgcampaign.combat.CombatSessionManager;
import com.example.rpgcampaign.combat.ParticipantSpec;
import com.example.rpgcampaign.model.SourceKind;
import com.example.rpgcampaign.persistence.InMemoryRepository;
import com.example.rpgcampaign.tools.ResourceReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.yaml.snakeyaml.Yaml;

import java.util.List;
import java.util.Map;

import static com.example.rpgcampaign.CampaignFixtures.CAMPAIGN_ID;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResourceReader Tests")
class ResourceReaderTest {

    private CombatSessionManager sessions;
    private ResourceReader reader;

    @BeforeEach
    void setUp() {
        InMemoryRepository repository = new InMemoryRepository();
        CampaignFixtures.populate(repository);
        sessions = new CombatSessionManager(repository);
        reader = new ResourceReader(repository, sessions);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> readYaml(String uri) {
        return (Map<String, Object>) new Yaml().load(reader.read(uri));
    }

    @Test
    @DisplayName("campaign://list lists every campaign")
    void listResource() {
        List<Map<String, Object>> campaigns = (List<Map<String, Object>>) readYaml("campaign://list").get("campaigns");
        assertEquals(1, campaigns.size());
        assertEquals(CAMPAIGN_ID, campaigns.get(0).get("id"));
        assertEquals("Shadows", campaigns.get(0).get("name"));
    }

    @Test
    @DisplayName("campaign://{id} renders the campaign record")
    void campaignResource() {
        Map<String, Object> campaign = readYaml("campaign://" + CAMPAIGN_ID);
        assertEquals("Shadows", campaign.get("name"));
        assertEquals("hero", campaign.get("player_slug"));
    }

    @Test
    @DisplayName("NPC and bestiary resources render their records")
    void npcAndBestiaryResources() {
        List<?> npcs = (List<?>) readYaml("campaign://" + CAMPAIGN_ID + "/npcs").get("npcs");
        assertEquals(4, npcs.size());
        List<?> creatures = (List<?>) readYaml("campaign://" + CAMPAIGN_ID + "/bestiary").get("creatures");
        assertEquals(2, creatures.size());
        assertTrue(reader.read("campaign://" + CAMPAIGN_ID + "/bestiary").contains("threat_level: negligible"));
    }

    @Test
    @DisplayName("The combat resource exists only once a fight has started")
    void combatResource() {
        String combatUri = "campaign://" + CAMPAIGN_ID + "/combat";
        assertFalse(reader.listResources().contains(combatUri));
        CombatException e = assertThrows(CombatException.class, () -> reader.read(combatUri));
        assertEquals(CombatException.Kind.NO_ACTIVE_COMBAT, e.getKind());

        sessions.begin(CAMPAIGN_ID, List.of(
            ParticipantSpec.of(SourceKind.PLAYER, "Hero", "players"),
            ParticipantSpec.of(SourceKind.BESTIARY, "Goblin", "monsters")));

        assertTrue(reader.listResources().contains(combatUri));
        Map<String, Object> combat = readYaml(combatUri);
        assertEquals("active", combat.get("state"));
        List<Map<String, Object>> combatants = (List<Map<String, Object>>) combat.get("combatants");
        assertEquals(2, combatants.size());
        assertEquals("goblin", combatants.get(1).get("id"));
        assertEquals(0.25, (Double) combatants.get(1).get("hit_chance"), 1e-9);
    }

    @Test
    @DisplayName("listResources names the per-campaign URIs")
    void listResources() {
        List<String> uris = reader.listResources();
        assertTrue(uris.contains("campaign://list"));
        assertTrue(uris.contains("campaign://" + CAMPAIGN_ID));
        assertTrue(uris.contains("campaign://" + CAMPAIGN_ID + "/npcs"));
        assertTrue(uris.contains("campaign://" + CAMPAIGN_ID + "/bestiary"));
    }

    @ParameterizedTest
    @DisplayName("Malformed URIs fail with INVALID_ARGUMENT")
    @ValueSource(strings = {"http://example.com", "campaign://", "campaign://camp-1/weather", "campaign://a/b/c"})
    void malformedUris(String uri) {
        CombatException e = assertThrows(CombatException.class, () -> reader.read(uri));
        assertEquals(CombatException.Kind.INVALID_ARGUMENT, e.getKind());
    }

    @Test
    @DisplayName("Unknown campaigns fail with CAMPAIGN_NOT_FOUND")
    void unknownCampaign() {
        CombatException e = assertThrows(CombatException.class, () -> reader.read("campaign://nope/npcs"));
        assertEquals(CombatException.Kind.CAMPAIGN_NOT_FOUND, e.getKind());
    }
}
