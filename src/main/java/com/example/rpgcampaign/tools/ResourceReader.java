package com.example.rpgcampaign.tools;

import com.example.rpgcampaign.combat.AttackResult;
import com.example.rpgcampaign.combat.CombatException;
import com.example.rpgcampaign.combat.CombatSession;
import com.example.rpgcampaign.combat.CombatSessionManager;
import com.example.rpgcampaign.combat.Combatant;
import com.example.rpgcampaign.model.BestiaryEntry;
import com.example.rpgcampaign.model.Campaign;
import com.example.rpgcampaign.model.NpcRecord;
import com.example.rpgcampaign.persistence.CampaignRepository;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only views of campaign data addressed by {@code campaign://} URIs and rendered as YAML.
 *
 * <ul>
 *   <li>{@code campaign://list}</li>
 *   <li>{@code campaign://{id}}</li>
 *   <li>{@code campaign://{id}/combat}</li>
 *   <li>{@code campaign://{id}/npcs}</li>
 *   <li>{@code campaign://{id}/bestiary}</li>
 * </ul>
 */
public class ResourceReader {

    public static final String SCHEME = "campaign://";

    private final CampaignRepository records;
    private final CombatSessionManager sessions;
    private final Yaml yaml;

    public ResourceReader(CampaignRepository records, CombatSessionManager sessions) {
        this.records = records;
        this.sessions = sessions;
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        this.yaml = new Yaml(options);
    }

    /**
     * URIs that can currently be read.
     */
    public List<String> listResources() {
        List<String> uris = new ArrayList<>();
        uris.add(SCHEME + "list");
        for (Campaign c : records.listCampaigns()) {
            String base = SCHEME + c.getId();
            uris.add(base);
            uris.add(base + "/npcs");
            uris.add(base + "/bestiary");
            if (sessions.findLatest(c.getId()).isPresent()) {
                uris.add(base + "/combat");
            }
        }
        return uris;
    }

    /**
     * Render a resource.
     * @throws CombatException INVALID_ARGUMENT for malformed URIs, CAMPAIGN_NOT_FOUND or
     *                         NO_ACTIVE_COMBAT for missing data
     */
    public String read(String uri) {
        if (uri == null || !uri.startsWith(SCHEME)) {
            throw CombatException.invalidArgument("Unknown resource '" + uri + "'. Resources start with " + SCHEME);
        }
        String path = uri.substring(SCHEME.length());
        if (path.equals("list")) {
            return yaml.dump(campaignList());
        }

        String[] parts = path.split("/");
        if (parts.length == 0 || parts.length > 2 || parts[0].isEmpty()) {
            throw CombatException.invalidArgument("Unknown resource '" + uri + "'.");
        }
        Campaign campaign = ToolSupport.requireCampaign(records, parts[0]);
        if (parts.length == 1) {
            return yaml.dump(campaignMap(campaign));
        }
        switch (parts[1]) {
            case "combat":
                return yaml.dump(combatMap(campaign.getId()));
            case "npcs":
                return yaml.dump(npcMap(campaign.getId()));
            case "bestiary":
                return yaml.dump(bestiaryMap(campaign.getId()));
            default:
                throw CombatException.invalidArgument("Unknown resource '" + uri + "'.");
        }
    }

    private Map<String, Object> campaignList() {
        List<Map<String, Object>> list = new ArrayList<>();
        for (Campaign c : records.listCampaigns()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("id", c.getId());
            m.put("name", c.getName());
            m.put("slug", c.getSlug());
            list.add(m);
        }
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("campaigns", list);
        return root;
    }

    private Map<String, Object> campaignMap(Campaign c) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", c.getId());
        m.put("name", c.getName());
        m.put("slug", c.getSlug());
        m.put("player_name", c.getPlayerName());
        m.put("player_slug", c.getPlayerSlug());
        m.put("created_at", c.getCreatedAt());
        return m;
    }

    private Map<String, Object> combatMap(String campaignId) {
        Optional<CombatSession> latest = sessions.findLatest(campaignId);
        if (latest.isEmpty()) {
            throw CombatException.noActiveCombat(campaignId);
        }
        CombatSession session = latest.get();

        Map<String, Object> m = new LinkedHashMap<>();
        m.put("session_id", session.getSessionId());
        m.put("state", session.getState().getDisplayName());
        m.put("started_at", session.getStartedAt());
        if (session.hasEnded()) {
            m.put("ended_at", session.getEndedAt());
        }

        List<Map<String, Object>> combatants = new ArrayList<>();
        for (Combatant c : session.getCombatants()) {
            Map<String, Object> cm = new LinkedHashMap<>();
            cm.put("id", c.getId());
            cm.put("name", c.getName());
            cm.put("team", c.getTeam());
            cm.put("source", c.getSourceKind().getWireName() + ":" + c.getSourceKey());
            cm.put("hit_chance", c.getHitChance());
            cm.put("status", c.getStatus().getWireName());
            combatants.add(cm);
        }
        m.put("combatants", combatants);

        List<Map<String, Object>> log = new ArrayList<>();
        for (AttackResult r : session.getAttackLog()) {
            Map<String, Object> lm = new LinkedHashMap<>();
            lm.put("attacker", r.getAttackerId());
            lm.put("target", r.getTargetId());
            lm.put("hit_chance", r.getHitChance());
            lm.put("roll", r.getRoll());
            lm.put("hit", r.isHit());
            log.add(lm);
        }
        m.put("attack_log", log);
        return m;
    }

    private Map<String, Object> npcMap(String campaignId) {
        List<Map<String, Object>> list = new ArrayList<>();
        for (NpcRecord npc : records.listNpcs(campaignId)) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("slug", npc.getSlug());
            m.put("name", npc.getName());
            m.put("keywords", new ArrayList<>(npc.getKeywords()));
            m.put("threat_level", npc.getThreatLevel() == null ? null : npc.getThreatLevel().getWireName());
            if (npc.getHitChance() != null) {
                m.put("hit_chance", npc.getHitChance());
            }
            m.put("player", npc.isPlayer());
            list.add(m);
        }
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("npcs", list);
        return root;
    }

    private Map<String, Object> bestiaryMap(String campaignId) {
        List<Map<String, Object>> list = new ArrayList<>();
        for (BestiaryEntry entry : records.getBestiary(campaignId)) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("name", entry.getName());
            m.put("threat_level", entry.getThreatLevel().getWireName());
            m.put("hp", entry.getHp());
            m.put("weapons", new LinkedHashMap<>(entry.getWeapons()));
            if (!entry.getDescription().isEmpty()) {
                m.put("description", entry.getDescription());
            }
            list.add(m);
        }
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("creatures", list);
        return root;
    }
}
