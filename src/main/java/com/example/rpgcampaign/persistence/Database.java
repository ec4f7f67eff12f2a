package com.example.rpgcampaign.persistence;

import com.example.rpgcampaign.config.ServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * JDBC connection settings shared by the DAOs, plus the record of which table groups
 * have already been created through this instance.
 */
public class Database {

    private static final Logger logger = LoggerFactory.getLogger(Database.class);

    public static final String DEFAULT_URL = "jdbc:h2:file:./data/rpgcampaign;AUTO_SERVER=TRUE;DB_CLOSE_DELAY=-1";

    /**
     * DDL for one group of tables. Statements must be idempotent (CREATE ... IF NOT EXISTS).
     */
    @FunctionalInterface
    public interface SchemaSetup {
        void create(Statement statement) throws SQLException;
    }

    private final String url;
    private final String user;
    private final String password;

    /** Table groups whose DDL has run against this database */
    private final Set<String> readySchemas = ConcurrentHashMap.newKeySet();

    public Database(String url, String user, String password) {
        this.url = url == null || url.isBlank() ? DEFAULT_URL : url;
        this.user = user == null ? "sa" : user;
        this.password = password == null ? "" : password;
    }

    public static Database fromConfig(ServerConfig config) {
        return new Database(config.getDbUrl(), config.getDbUser(), config.getDbPassword());
    }

    public Connection getConnection() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    public String getUrl() {
        return url;
    }

    /**
     * Create the named table group unless this instance already did.
     * A setup that fails is not recorded, so the next DAO built on this database retries it.
     *
     * @throws PersistenceException when the DDL fails
     */
    public void ensureSchema(String schema, SchemaSetup setup) {
        if (readySchemas.contains(schema)) return;
        synchronized (readySchemas) {
            if (readySchemas.contains(schema)) return;
            try (Connection c = getConnection();
                 Statement s = c.createStatement()) {
                setup.create(s);
            } catch (SQLException e) {
                throw new PersistenceException("Failed to create " + schema + " tables on " + url, e);
            }
            readySchemas.add(schema);
            logger.info("Database: {} tables ready on {}", schema, url);
        }
    }

    public boolean isSchemaReady(String schema) {
        return readySchemas.contains(schema);
    }
}
