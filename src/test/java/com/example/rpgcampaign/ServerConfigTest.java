package com.example.rpgcampaign;

import com.example.rpgcampaign.config.ServerConfig;
import com.example.rpgcampaign.config.ServerConfig.StorageBackend;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ServerConfig Tests")
class ServerConfigTest {

    private static final Function<String, String> NONE = key -> null;

    @Test
    @DisplayName("Values are read from the YAML resource")
    void readsYaml() {
        ServerConfig config = ServerConfig.load("/test-config.yaml", NONE, NONE);
        assertEquals(StorageBackend.MEMORY, config.getStorageBackend());
        assertEquals("jdbc:h2:mem:configured", config.getDbUrl());
        assertEquals("tester", config.getDbUser());
        assertEquals("secret", config.getDbPassword());
        assertEquals(42L, config.getCombatSeed());
        assertEquals("/data/test-bestiary.yaml", config.getBestiarySeed());
    }

    @Test
    @DisplayName("The shipped configuration uses H2 with unseeded rolls")
    void shippedDefaults() {
        ServerConfig config = ServerConfig.load(ServerConfig.DEFAULT_RESOURCE, NONE, NONE);
        assertEquals(StorageBackend.H2, config.getStorageBackend());
        assertTrue(config.getDbUrl().startsWith("jdbc:h2:file:"));
        assertNull(config.getCombatSeed());
        assertEquals("/data/bestiary.yaml", config.getBestiarySeed());
    }

    @Test
    @DisplayName("A missing resource falls back to built-in defaults")
    void missingResource() {
        ServerConfig config = ServerConfig.load("/no-such-config.yaml", NONE, NONE);
        assertEquals(StorageBackend.H2, config.getStorageBackend());
        assertEquals("sa", config.getDbUser());
        assertNull(config.getCombatSeed());
        assertNull(config.getBestiarySeed());
    }

    @Test
    @DisplayName("Environment variables win over system properties, which win over the file")
    void overridePrecedence() {
        Map<String, String> env = Map.of(
            "RPG_DB_URL", "jdbc:h2:mem:from-env",
            "RPG_COMBAT_SEED", "7");
        Map<String, String> props = Map.of(
            "rpg.db.url", "jdbc:h2:mem:from-props",
            "rpg.db.user", "prop-user",
            "rpg.storage.backend", "h2");

        ServerConfig config = ServerConfig.load("/test-config.yaml", env::get, props::get);
        assertEquals("jdbc:h2:mem:from-env", config.getDbUrl());
        assertEquals("prop-user", config.getDbUser());
        assertEquals(StorageBackend.H2, config.getStorageBackend());
        assertEquals(7L, config.getCombatSeed());
        assertEquals("secret", config.getDbPassword());
    }

    @Test
    @DisplayName("Malformed values keep the defaults")
    void malformedValues() {
        ServerConfig config = ServerConfig.load("/bad-config.yaml", NONE, NONE);
        assertEquals(StorageBackend.H2, config.getStorageBackend());
        assertNull(config.getCombatSeed());

        ServerConfig overridden = ServerConfig.load("/test-config.yaml",
            Map.of("RPG_COMBAT_SEED", "soon", "RPG_STORAGE_BACKEND", "postgres")::get, NONE);
        assertEquals(42L, overridden.getCombatSeed());
        assertEquals(StorageBackend.MEMORY, overridden.getStorageBackend());
    }

    @Test
    @DisplayName("inMemory builds a memory-backed configuration")
    void inMemoryFactory() {
        ServerConfig config = ServerConfig.inMemory(5L);
        assertEquals(StorageBackend.MEMORY, config.getStorageBackend());
        assertEquals(5L, config.getCombatSeed());
        assertNull(config.getBestiarySeed());
    }
}
