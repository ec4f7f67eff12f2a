package com.example.rpgcampaign;

import com.example.rpgcampaign.combat.AttackResult;
import com.example.rpgcampaign.combat.CombatException;
import com.example.rpgcampaign.combat.CombatSession;
import com.example.rpgcampaign.combat.CombatSessionManager;
import com.example.rpgcampaign.combat.CombatState;
import com.example.rpgcampaign.combat.Combatant;
import com.example.rpgcampaign.combat.ParticipantSpec;
import com.example.rpgcampaign.combat.RemovalReason;
import com.example.rpgcampaign.combat.CombatResolver;
import com.example.rpgcampaign.model.BestiaryEntry;
import com.example.rpgcampaign.model.NpcRecord;
import com.example.rpgcampaign.model.SourceKind;
import com.example.rpgcampaign.model.ThreatLevel;
import com.example.rpgcampaign.persistence.InMemoryRepository;
import com.example.rpgcampaign.util.HitRoller;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static com.example.rpgcampaign.CampaignFixtures.CAMPAIGN_ID;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CombatSessionManager Tests")
class CombatSessionManagerTest {

    private InMemoryRepository repository;
    private CombatSessionManager manager;

    @BeforeEach
    void setUp() {
        repository = new InMemoryRepository();
        CampaignFixtures.populate(repository);
        manager = new CombatSessionManager(repository);
    }

    private static List<ParticipantSpec> heroVsGoblin() {
        return List.of(
            ParticipantSpec.of(SourceKind.PLAYER, "Hero", "players"),
            ParticipantSpec.of(SourceKind.BESTIARY, "Goblin", "monsters"));
    }

    @Test
    @DisplayName("begin creates an active session with resolved combatants")
    void beginCreatesSession() {
        CombatSession session = manager.begin(CAMPAIGN_ID, heroVsGoblin());

        assertEquals(CombatState.ACTIVE, session.getState());
        assertEquals(2, session.getCombatants().size());
        assertEquals(List.of("players", "monsters"), session.getTeams());

        Combatant hero = session.find("hero").orElseThrow();
        Combatant goblin = session.find("goblin").orElseThrow();
        assertEquals(0.50, hero.getHitChance(), 1e-9);
        assertEquals(0.25, goblin.getHitChance(), 1e-9);
        assertTrue(hero.isActive());
        assertTrue(goblin.isActive());
    }

    @Test
    @DisplayName("begin persists the session")
    void beginPersists() {
        CombatSession session = manager.begin(CAMPAIGN_ID, heroVsGoblin());
        CombatSession stored = repository.loadSession(CAMPAIGN_ID).orElseThrow();
        assertEquals(session.getSessionId(), stored.getSessionId());
        assertEquals(2, stored.getCombatants().size());
    }

    @Test
    @DisplayName("All participants on one team fail with INVALID_COMBAT_SETUP")
    void oneTeamRejected() {
        List<ParticipantSpec> specs = List.of(
            ParticipantSpec.of(SourceKind.PLAYER, "Hero", "players"),
            ParticipantSpec.of(SourceKind.NPC, "Captain Mara", "players"));
        CombatException e = assertThrows(CombatException.class, () -> manager.begin(CAMPAIGN_ID, specs));
        assertEquals(CombatException.Kind.INVALID_COMBAT_SETUP, e.getKind());
        assertTrue(repository.loadSession(CAMPAIGN_ID).isEmpty());
    }

    @Test
    @DisplayName("No participants fail with INVALID_COMBAT_SETUP")
    void emptySetupRejected() {
        CombatException e = assertThrows(CombatException.class, () -> manager.begin(CAMPAIGN_ID, List.of()));
        assertEquals(CombatException.Kind.INVALID_COMBAT_SETUP, e.getKind());
    }

    @Test
    @DisplayName("A blank team fails with INVALID_COMBAT_SETUP")
    void blankTeamRejected() {
        List<ParticipantSpec> specs = List.of(
            ParticipantSpec.of(SourceKind.PLAYER, "Hero", "players"),
            ParticipantSpec.of(SourceKind.BESTIARY, "Goblin", " "));
        CombatException e = assertThrows(CombatException.class, () -> manager.begin(CAMPAIGN_ID, specs));
        assertEquals(CombatException.Kind.INVALID_COMBAT_SETUP, e.getKind());
    }

    @ParameterizedTest
    @DisplayName("Overrides outside [0,1] or NaN fail with INVALID_COMBAT_SETUP")
    @ValueSource(doubles = {-0.01, 1.01, 5.0, Double.NaN})
    void overrideOutOfRangeRejected(double override) {
        List<ParticipantSpec> specs = List.of(
            ParticipantSpec.of(SourceKind.PLAYER, "Hero", "players").withHitChance(override),
            ParticipantSpec.of(SourceKind.BESTIARY, "Goblin", "monsters"));
        CombatException e = assertThrows(CombatException.class, () -> manager.begin(CAMPAIGN_ID, specs));
        assertEquals(CombatException.Kind.INVALID_COMBAT_SETUP, e.getKind());
    }

    @Test
    @DisplayName("An override wins over the threat level table")
    void overrideWinsOverTable() {
        List<ParticipantSpec> specs = List.of(
            ParticipantSpec.of(SourceKind.PLAYER, "Hero", "players"),
            ParticipantSpec.of(SourceKind.BESTIARY, "Goblin", "monsters").withHitChance(0.9));
        CombatSession session = manager.begin(CAMPAIGN_ID, specs);
        assertEquals(0.9, session.find("goblin").orElseThrow().getHitChance(), 1e-9);
    }

    @ParameterizedTest
    @DisplayName("Hit chance falls back from explicit chance to threat level to the default")
    @CsvSource({
        "npc, Captain Mara, captain-mara, 0.65",
        "npc, pete, old-pete, 0.40",
        "npc, Stranger, stranger, 0.50",
        "bestiary, dragon, dragon, 0.80"
    })
    void hitChanceResolution(String kind, String key, String expectedId, double expected) {
        List<ParticipantSpec> specs = List.of(
            ParticipantSpec.of(SourceKind.PLAYER, "Hero", "players"),
            ParticipantSpec.of(SourceKind.fromString(kind), key, "others"));
        CombatSession session = manager.begin(CAMPAIGN_ID, specs);
        assertEquals(expected, session.find(expectedId).orElseThrow().getHitChance(), 1e-9);
    }

    @Test
    @DisplayName("An unknown campaign fails with CAMPAIGN_NOT_FOUND")
    void unknownCampaign() {
        CombatException e = assertThrows(CombatException.class, () -> manager.begin("nope", heroVsGoblin()));
        assertEquals(CombatException.Kind.CAMPAIGN_NOT_FOUND, e.getKind());
    }

    @Test
    @DisplayName("An unknown source record fails with PARTICIPANT_NOT_FOUND")
    void unknownSource() {
        List<ParticipantSpec> specs = List.of(
            ParticipantSpec.of(SourceKind.PLAYER, "Hero", "players"),
            ParticipantSpec.of(SourceKind.BESTIARY, "Beholder", "monsters"));
        CombatException e = assertThrows(CombatException.class, () -> manager.begin(CAMPAIGN_ID, specs));
        assertEquals(CombatException.Kind.PARTICIPANT_NOT_FOUND, e.getKind());
        assertTrue(repository.loadSession(CAMPAIGN_ID).isEmpty());
    }

    @Test
    @DisplayName("Starting while a fight is active fails with DUPLICATE_COMBAT")
    void duplicateCombatRejected() {
        CombatSession first = manager.begin(CAMPAIGN_ID, heroVsGoblin());
        CombatException e = assertThrows(CombatException.class, () -> manager.begin(CAMPAIGN_ID, heroVsGoblin()));
        assertEquals(CombatException.Kind.DUPLICATE_COMBAT, e.getKind());
        assertEquals(CombatException.Category.STATE_CONFLICT, e.getCategory());
        assertEquals(first.getSessionId(), manager.getStatus(CAMPAIGN_ID).getSessionId());
    }

    @Test
    @DisplayName("An ended fight is replaced by a new one")
    void endedCombatReplaced() {
        CombatSession first = manager.begin(CAMPAIGN_ID, heroVsGoblin());
        new CombatResolver(manager, new HitRoller(1L)).removeFromCombat(CAMPAIGN_ID, "goblin", RemovalReason.FLEE);

        CombatSession second = manager.begin(CAMPAIGN_ID, heroVsGoblin());
        assertNotEquals(first.getSessionId(), second.getSessionId());
        assertTrue(second.isActive());
    }

    @Test
    @DisplayName("Same-named participants get distinct ids")
    void duplicateNamesGetSuffixes() {
        List<ParticipantSpec> specs = List.of(
            ParticipantSpec.of(SourceKind.PLAYER, "Hero", "players"),
            ParticipantSpec.of(SourceKind.BESTIARY, "Goblin", "monsters"),
            ParticipantSpec.of(SourceKind.BESTIARY, "Goblin", "monsters"));
        CombatSession session = manager.begin(CAMPAIGN_ID, specs);
        assertTrue(session.find("goblin").isPresent());
        Combatant second = session.find("goblin-2").orElseThrow();
        assertEquals("Goblin 2", second.getName());
    }

    @Test
    @DisplayName("getStatus without a fight fails with NO_ACTIVE_COMBAT")
    void statusWithoutCombat() {
        CombatException e = assertThrows(CombatException.class, () -> manager.getStatus(CAMPAIGN_ID));
        assertEquals(CombatException.Kind.NO_ACTIVE_COMBAT, e.getKind());
    }

    @Test
    @DisplayName("getStatus returns a snapshot the caller cannot use to change stored state")
    void statusIsSnapshot() {
        manager.begin(CAMPAIGN_ID, heroVsGoblin());
        CombatSession snapshot = manager.getStatus(CAMPAIGN_ID);
        snapshot.remove(snapshot.find("goblin").orElseThrow(), RemovalReason.DEATH);

        CombatSession stored = manager.getStatus(CAMPAIGN_ID);
        assertTrue(stored.isActive());
        assertTrue(stored.find("goblin").orElseThrow().isActive());
    }

    @Test
    @DisplayName("join with an ally takes the ally's team")
    void joinWithAlly() {
        manager.begin(CAMPAIGN_ID, heroVsGoblin());
        Combatant mara = manager.join(CAMPAIGN_ID, ParticipantSpec.of(SourceKind.NPC, "mara", null), "Hero");

        assertEquals("players", mara.getTeam());
        assertEquals(0.65, mara.getHitChance(), 1e-9);
        assertEquals(3, manager.getStatus(CAMPAIGN_ID).getCombatants().size());
    }

    @Test
    @DisplayName("join with an explicit team")
    void joinWithTeam() {
        manager.begin(CAMPAIGN_ID, heroVsGoblin());
        Combatant dragon = manager.join(CAMPAIGN_ID, ParticipantSpec.of(SourceKind.BESTIARY, "Dragon", "monsters"), null);
        assertEquals("monsters", dragon.getTeam());
        assertEquals(0.80, dragon.getHitChance(), 1e-9);
    }

    @Test
    @DisplayName("join without a team or ally fails with INVALID_COMBAT_SETUP")
    void joinWithoutTeam() {
        manager.begin(CAMPAIGN_ID, heroVsGoblin());
        CombatException e = assertThrows(CombatException.class,
            () -> manager.join(CAMPAIGN_ID, ParticipantSpec.of(SourceKind.BESTIARY, "Dragon", null), null));
        assertEquals(CombatException.Kind.INVALID_COMBAT_SETUP, e.getKind());
    }

    @Test
    @DisplayName("join with an unknown ally fails with PARTICIPANT_NOT_FOUND")
    void joinUnknownAlly() {
        manager.begin(CAMPAIGN_ID, heroVsGoblin());
        CombatException e = assertThrows(CombatException.class,
            () -> manager.join(CAMPAIGN_ID, ParticipantSpec.of(SourceKind.BESTIARY, "Dragon", null), "Gandalf"));
        assertEquals(CombatException.Kind.PARTICIPANT_NOT_FOUND, e.getKind());
    }

    @Test
    @DisplayName("join without a fight fails with NO_ACTIVE_COMBAT")
    void joinWithoutCombat() {
        CombatException e = assertThrows(CombatException.class,
            () -> manager.join(CAMPAIGN_ID, ParticipantSpec.of(SourceKind.BESTIARY, "Dragon", "monsters"), null));
        assertEquals(CombatException.Kind.NO_ACTIVE_COMBAT, e.getKind());
    }

    @Test
    @DisplayName("A blank player key resolves to the campaign's player character")
    void blankPlayerKey() {
        List<ParticipantSpec> specs = List.of(
            ParticipantSpec.parse("player:@players"),
            ParticipantSpec.parse("bestiary:Goblin@monsters"));
        CombatSession session = manager.begin(CAMPAIGN_ID, specs);
        assertEquals("Hero", session.find("hero").orElseThrow().getName());
    }

    @Test
    @DisplayName("Hit chances are fixed when combatants join; later record edits do not change them")
    void hitChanceFixedAtJoin() {
        manager.begin(CAMPAIGN_ID, heroVsGoblin());

        repository.saveNpc(CAMPAIGN_ID, new NpcRecord("hero", "Hero", List.of("hero", "player"),
            "", ThreatLevel.CERTAIN_DEATH, 0.99, true));
        repository.saveBestiaryEntry(CAMPAIGN_ID, new BestiaryEntry("Goblin", ThreatLevel.DEADLY, "2d6",
            Map.of(), "Suddenly terrifying"));

        // 0.6 would hit at the edited chances but misses at the ones fixed on join
        CombatResolver resolver = new CombatResolver(manager, new HitRoller(CampaignFixtures.fixed(0.6)));
        AttackResult heroSwing = resolver.attack(CAMPAIGN_ID, "hero", "goblin");
        AttackResult goblinSwing = resolver.attack(CAMPAIGN_ID, "goblin", "hero");

        assertEquals(0.50, heroSwing.getHitChance(), 1e-9);
        assertFalse(heroSwing.isHit());
        assertEquals(0.25, goblinSwing.getHitChance(), 1e-9);
        assertFalse(goblinSwing.isHit());

        CombatSession session = manager.getStatus(CAMPAIGN_ID);
        assertEquals(0.50, session.find("hero").orElseThrow().getHitChance(), 1e-9);
        assertEquals(0.25, session.find("goblin").orElseThrow().getHitChance(), 1e-9);

        // Newcomers do see the edited record
        Combatant second = manager.join(CAMPAIGN_ID, ParticipantSpec.of(SourceKind.BESTIARY, "Goblin", "monsters"), null);
        assertEquals(0.80, second.getHitChance(), 1e-9);
        assertEquals(0.25, manager.getStatus(CAMPAIGN_ID).find("goblin").orElseThrow().getHitChance(), 1e-9);
    }

    @Test
    @DisplayName("deleteCampaign removes the campaign under its lock and drops the lock")
    void deleteCampaignDropsLock() {
        manager.begin(CAMPAIGN_ID, heroVsGoblin());
        assertEquals(1, manager.lockCount());

        assertTrue(manager.deleteCampaign(CAMPAIGN_ID, () -> repository.deleteCampaign(CAMPAIGN_ID)));

        assertEquals(0, manager.lockCount());
        assertTrue(manager.findLatest(CAMPAIGN_ID).isEmpty());
        CombatException e = assertThrows(CombatException.class, () -> manager.begin(CAMPAIGN_ID, heroVsGoblin()));
        assertEquals(CombatException.Kind.CAMPAIGN_NOT_FOUND, e.getKind());
        assertEquals(0, manager.lockCount());
    }
}
