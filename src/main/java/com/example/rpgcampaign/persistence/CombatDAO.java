package com.example.rpgcampaign.persistence;

import com.example.rpgcampaign.combat.AttackResult;
import com.example.rpgcampaign.combat.CombatSession;
import com.example.rpgcampaign.combat.CombatState;
import com.example.rpgcampaign.combat.Combatant;
import com.example.rpgcampaign.combat.CombatantStatus;
import com.example.rpgcampaign.model.ParticipantSource;
import com.example.rpgcampaign.model.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.List;
import java.util.Optional;

/**
 * Data Access Object for combat sessions.
 * A session is spread over three tables and always written in a single transaction,
 * so a concurrent reader sees either the previous session or the new one.
 */
public class CombatDAO implements CombatRepository {
    private static final Logger logger = LoggerFactory.getLogger(CombatDAO.class);

    public static final String SCHEMA = "combat";

    private final Database database;
    private final CampaignRepository records;

    public CombatDAO(Database database, CampaignRepository records) {
        this.database = database;
        this.records = records;
        ensureSchema(database);
    }

    static void ensureSchema(Database database) {
        database.ensureSchema(SCHEMA, CombatDAO::createTables);
    }

    private static void createTables(Statement s) throws SQLException {
        // One row per campaign: the latest session
        s.execute("""
            CREATE TABLE IF NOT EXISTS combat_session (
                campaign_id VARCHAR(64) PRIMARY KEY,
                session_id VARCHAR(64) NOT NULL,
                state VARCHAR(16) NOT NULL,
                started_at BIGINT,
                ended_at BIGINT DEFAULT 0
            )
        """);

        s.execute("""
            CREATE TABLE IF NOT EXISTS combatant (
                campaign_id VARCHAR(64) NOT NULL,
                combatant_id VARCHAR(200) NOT NULL,
                seq INT NOT NULL,
                name VARCHAR(200) NOT NULL,
                team VARCHAR(100) NOT NULL,
                source_kind VARCHAR(16) NOT NULL,
                source_key VARCHAR(200),
                hit_chance DOUBLE NOT NULL,
                status VARCHAR(16) NOT NULL,
                PRIMARY KEY (campaign_id, combatant_id)
            )
        """);

        s.execute("""
            CREATE TABLE IF NOT EXISTS attack_log (
                campaign_id VARCHAR(64) NOT NULL,
                seq INT NOT NULL,
                attacker_id VARCHAR(200),
                attacker_name VARCHAR(200),
                target_id VARCHAR(200),
                target_name VARCHAR(200),
                hit_chance DOUBLE,
                roll DOUBLE,
                hit BOOLEAN,
                target_status VARCHAR(16),
                ts BIGINT,
                PRIMARY KEY (campaign_id, seq)
            )
        """);
    }

    @Override
    public boolean campaignExists(String campaignId) {
        return records.getCampaign(campaignId).isPresent();
    }

    @Override
    public Optional<ParticipantSource> loadParticipantSource(String campaignId, SourceKind kind, String key) {
        return ParticipantSourceResolver.resolve(records, campaignId, kind, key);
    }

    @Override
    public Optional<CombatSession> loadSession(String campaignId) {
        try (Connection c = database.getConnection()) {
            // Read all three tables from one snapshot
            c.setTransactionIsolation(Connection.TRANSACTION_REPEATABLE_READ);
            c.setAutoCommit(false);
            try {
                Optional<CombatSession> session = readSession(c, campaignId);
                c.commit();
                return session;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load combat for campaign " + campaignId, e);
        }
    }

    private Optional<CombatSession> readSession(Connection c, String campaignId) throws SQLException {
        CombatSession session;
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT session_id, state, started_at, ended_at FROM combat_session WHERE campaign_id = ?")) {
            ps.setString(1, campaignId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                CombatState state = CombatState.fromString(rs.getString("state"));
                if (state == null) {
                    logger.warn("CombatDAO: session for campaign {} has unknown state '{}', treating as ended",
                        campaignId, rs.getString("state"));
                    state = CombatState.ENDED;
                }
                session = new CombatSession(rs.getString("session_id"), campaignId, state,
                    rs.getLong("started_at"), rs.getLong("ended_at"));
            }
        }

        try (PreparedStatement ps = c.prepareStatement(
                "SELECT * FROM combatant WHERE campaign_id = ? ORDER BY seq")) {
            ps.setString(1, campaignId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    CombatantStatus status = CombatantStatus.fromString(rs.getString("status"));
                    session.restoreCombatant(new Combatant(
                        rs.getString("combatant_id"),
                        rs.getString("name"),
                        rs.getString("team"),
                        SourceKind.fromString(rs.getString("source_kind")),
                        rs.getString("source_key"),
                        rs.getDouble("hit_chance"),
                        status == null ? CombatantStatus.REMOVED : status));
                }
            }
        }

        try (PreparedStatement ps = c.prepareStatement(
                "SELECT * FROM attack_log WHERE campaign_id = ? ORDER BY seq")) {
            ps.setString(1, campaignId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    session.restoreAttack(new AttackResult(
                        rs.getString("attacker_id"),
                        rs.getString("attacker_name"),
                        rs.getString("target_id"),
                        rs.getString("target_name"),
                        rs.getDouble("hit_chance"),
                        rs.getDouble("roll"),
                        rs.getBoolean("hit"),
                        CombatantStatus.fromString(rs.getString("target_status")),
                        rs.getLong("ts")));
                }
            }
        }
        return Optional.of(session);
    }

    @Override
    public void saveSession(CombatSession session) {
        String campaignId = session.getCampaignId();
        try (Connection c = database.getConnection()) {
            c.setAutoCommit(false);
            try {
                try (PreparedStatement ps = c.prepareStatement(
                        "MERGE INTO combat_session (campaign_id, session_id, state, started_at, ended_at) KEY(campaign_id) VALUES (?,?,?,?,?)")) {
                    ps.setString(1, campaignId);
                    ps.setString(2, session.getSessionId());
                    ps.setString(3, session.getState().getDisplayName());
                    ps.setLong(4, session.getStartedAt());
                    ps.setLong(5, session.getEndedAt());
                    ps.executeUpdate();
                }
                for (String table : new String[] {"combatant", "attack_log"}) {
                    try (PreparedStatement ps = c.prepareStatement("DELETE FROM " + table + " WHERE campaign_id = ?")) {
                        ps.setString(1, campaignId);
                        ps.executeUpdate();
                    }
                }
                insertCombatants(c, campaignId, session.getCombatants());
                insertAttackLog(c, campaignId, session.getAttackLog());
                c.commit();
                logger.debug("CombatDAO: saved session {} for campaign {} ({} combatants, {} attacks)",
                    session.getSessionId(), campaignId, session.getCombatants().size(), session.getAttackLog().size());
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save combat for campaign " + campaignId, e);
        }
    }

    private void insertCombatants(Connection c, String campaignId, List<Combatant> combatants) throws SQLException {
        String sql = "INSERT INTO combatant (campaign_id, combatant_id, seq, name, team, source_kind, source_key, hit_chance, status) " +
            "VALUES (?,?,?,?,?,?,?,?,?)";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            int seq = 0;
            for (Combatant combatant : combatants) {
                ps.setString(1, campaignId);
                ps.setString(2, combatant.getId());
                ps.setInt(3, seq++);
                ps.setString(4, combatant.getName());
                ps.setString(5, combatant.getTeam());
                ps.setString(6, combatant.getSourceKind().getWireName());
                ps.setString(7, combatant.getSourceKey());
                ps.setDouble(8, combatant.getHitChance());
                ps.setString(9, combatant.getStatus().getWireName());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private void insertAttackLog(Connection c, String campaignId, List<AttackResult> log) throws SQLException {
        String sql = "INSERT INTO attack_log (campaign_id, seq, attacker_id, attacker_name, target_id, target_name, " +
            "hit_chance, roll, hit, target_status, ts) VALUES (?,?,?,?,?,?,?,?,?,?,?)";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            int seq = 0;
            for (AttackResult result : log) {
                ps.setString(1, campaignId);
                ps.setInt(2, seq++);
                ps.setString(3, result.getAttackerId());
                ps.setString(4, result.getAttackerName());
                ps.setString(5, result.getTargetId());
                ps.setString(6, result.getTargetName());
                ps.setDouble(7, result.getHitChance());
                ps.setDouble(8, result.getRoll());
                ps.setBoolean(9, result.isHit());
                ps.setString(10, result.getTargetStatus() == null ? null : result.getTargetStatus().getWireName());
                ps.setLong(11, result.getTimestamp());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }
}
