package com.example.rpgcampaign.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.Map;
import java.util.function.Function;

/**
 * Server settings read from {@code /config.yaml} on the classpath.
 *
 * Each setting can be overridden by an environment variable or, when that is unset,
 * a system property (e.g. {@code RPG_DB_URL} / {@code rpg.db.url}).
 */
public class ServerConfig {

    private static final Logger logger = LoggerFactory.getLogger(ServerConfig.class);

    public static final String DEFAULT_RESOURCE = "/config.yaml";

    public enum StorageBackend { H2, MEMORY }

    private StorageBackend storageBackend = StorageBackend.H2;
    private String dbUrl = "jdbc:h2:file:./data/rpgcampaign;AUTO_SERVER=TRUE;DB_CLOSE_DELAY=-1";
    private String dbUser = "sa";
    private String dbPassword = "";
    private Long combatSeed;
    private String bestiarySeed;

    public static ServerConfig load() {
        return load(DEFAULT_RESOURCE, System::getenv, System::getProperty);
    }

    /**
     * Load a YAML resource and apply overrides.
     *
     * @param env        environment lookup (name -> value or null)
     * @param properties system property lookup (name -> value or null)
     */
    public static ServerConfig load(String resourcePath, Function<String, String> env, Function<String, String> properties) {
        ServerConfig config = new ServerConfig();
        config.apply(readResource(resourcePath));
        config.applyOverrides(env, properties);
        logger.info("Configuration loaded: storage={}, url={}, seed={}, bestiarySeed={}",
            config.storageBackend, config.storageBackend == StorageBackend.H2 ? config.dbUrl : "-",
            config.combatSeed, config.bestiarySeed);
        return config;
    }

    /**
     * Settings for a throwaway process-local setup (tests, demos).
     */
    public static ServerConfig inMemory(Long seed) {
        ServerConfig config = new ServerConfig();
        config.storageBackend = StorageBackend.MEMORY;
        config.combatSeed = seed;
        return config;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> readResource(String resourcePath) {
        try (InputStream in = ServerConfig.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                logger.info("No configuration resource at {}, using defaults", resourcePath);
                return Collections.emptyMap();
            }
            Object loaded = new Yaml().load(in);
            if (loaded instanceof Map) {
                return (Map<String, Object>) loaded;
            }
            logger.warn("Configuration resource {} is not a mapping, using defaults", resourcePath);
            return Collections.emptyMap();
        } catch (IOException e) {
            logger.warn("Failed to read configuration {}: {}", resourcePath, e.getMessage());
            return Collections.emptyMap();
        }
    }

    void apply(Map<String, Object> root) {
        Map<String, Object> storage = section(root, "storage");
        setStorageBackend(str(storage.get("backend")));
        if (storage.get("url") != null) dbUrl = str(storage.get("url"));
        if (storage.get("user") != null) dbUser = str(storage.get("user"));
        if (storage.get("password") != null) dbPassword = str(storage.get("password"));

        Map<String, Object> combat = section(root, "combat");
        setCombatSeed(str(combat.get("seed")));

        Map<String, Object> campaign = section(root, "campaign");
        String seedResource = str(campaign.get("bestiary_seed"));
        bestiarySeed = seedResource.isEmpty() ? null : seedResource;
    }

    void applyOverrides(Function<String, String> env, Function<String, String> properties) {
        String backend = override(env, properties, "RPG_STORAGE_BACKEND", "rpg.storage.backend");
        if (backend != null) setStorageBackend(backend);
        String url = override(env, properties, "RPG_DB_URL", "rpg.db.url");
        if (url != null) dbUrl = url;
        String user = override(env, properties, "RPG_DB_USER", "rpg.db.user");
        if (user != null) dbUser = user;
        String password = override(env, properties, "RPG_DB_PASSWORD", "rpg.db.password");
        if (password != null) dbPassword = password;
        String seed = override(env, properties, "RPG_COMBAT_SEED", "rpg.combat.seed");
        if (seed != null) setCombatSeed(seed);
    }

    private static String override(Function<String, String> env, Function<String, String> properties,
                                   String envName, String propertyName) {
        String value = env.apply(envName);
        if (value != null && !value.isEmpty()) return value;
        value = properties.apply(propertyName);
        if (value != null && !value.isEmpty()) return value;
        return null;
    }

    private void setStorageBackend(String value) {
        if (value == null || value.isEmpty()) return;
        try {
            storageBackend = StorageBackend.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            logger.warn("Unknown storage backend '{}', keeping {}", value, storageBackend);
        }
    }

    private void setCombatSeed(String value) {
        if (value == null || value.isEmpty() || value.equalsIgnoreCase("null")) return;
        try {
            combatSeed = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Combat seed '{}' is not a number, using unseeded randomness", value);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> root, String name) {
        Object value = root.get(name);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return Collections.emptyMap();
    }

    private static String str(Object o) {
        return o == null ? "" : String.valueOf(o).trim();
    }

    public StorageBackend getStorageBackend() { return storageBackend; }
    public String getDbUrl() { return dbUrl; }
    public String getDbUser() { return dbUser; }
    public String getDbPassword() { return dbPassword; }

    /** Seed for hit rolls, or null for unseeded randomness. */
    public Long getCombatSeed() { return combatSeed; }

    /** Classpath resource copied into every new campaign's bestiary, or null. */
    public String getBestiarySeed() { return bestiarySeed; }
}
