package com.example.rpgcampaign.persistence;

import com.example.rpgcampaign.model.BestiaryEntry;
import com.example.rpgcampaign.model.ThreatLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads creature templates from a YAML resource of the form:
 * <pre>
 * creatures:
 *   - name: Goblin
 *     threat_level: negligible
 *     hp: 2d6
 *     weapons: { scimitar: 1d6 }
 *     description: Small and spiteful.
 * </pre>
 */
public class BestiaryYamlLoader {

    private static final Logger logger = LoggerFactory.getLogger(BestiaryYamlLoader.class);

    /**
     * Parse the creatures in a classpath resource.
     * Entries without a name or with an unknown threat level are skipped.
     * @return the parsed entries, empty if the resource does not exist
     */
    @SuppressWarnings("unchecked")
    public List<BestiaryEntry> readResource(String resourcePath) {
        List<BestiaryEntry> entries = new ArrayList<>();
        try (InputStream in = BestiaryYamlLoader.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                logger.info("No bestiary resource found at {}", resourcePath);
                return entries;
            }

            Map<String, Object> root = new Yaml().load(in);
            if (root == null) return entries;

            Object creaturesObj = root.get("creatures");
            if (!(creaturesObj instanceof List)) {
                logger.warn("Bestiary resource {} has no 'creatures' list", resourcePath);
                return entries;
            }

            for (Object item : (List<Object>) creaturesObj) {
                if (!(item instanceof Map)) continue;
                BestiaryEntry entry = toEntry((Map<String, Object>) item, resourcePath);
                if (entry != null) {
                    entries.add(entry);
                }
            }
            return entries;
        } catch (IOException e) {
            throw new PersistenceException("Failed to read bestiary resource " + resourcePath, e);
        }
    }

    /**
     * Copy the creatures of a resource into a campaign's bestiary, leaving existing entries alone.
     * @return number of entries added
     */
    public int loadInto(CampaignRepository repository, String campaignId, String resourcePath) {
        int added = 0;
        for (BestiaryEntry entry : readResource(resourcePath)) {
            if (repository.getBestiaryEntry(campaignId, entry.getName()).isPresent()) {
                continue;
            }
            repository.saveBestiaryEntry(campaignId, entry);
            added++;
        }
        logger.info("Seeded {} bestiary entr{} from {} into campaign {}", added, added == 1 ? "y" : "ies",
            resourcePath, campaignId);
        return added;
    }

    private BestiaryEntry toEntry(Map<String, Object> data, String resourcePath) {
        String name = str(data.get("name"));
        if (name.isEmpty()) return null;

        String threat = str(data.get("threat_level"));
        ThreatLevel level = ThreatLevel.fromString(threat);
        if (level == null) {
            logger.warn("Skipping creature '{}' in {}: unknown threat level '{}'", name, resourcePath, threat);
            return null;
        }

        Map<String, String> weapons = new LinkedHashMap<>();
        Object weaponsObj = data.get("weapons");
        if (weaponsObj instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> e : map.entrySet()) {
                weapons.put(String.valueOf(e.getKey()), String.valueOf(e.getValue()));
            }
        }

        String hp = str(data.get("hp"));
        return new BestiaryEntry(name, level, hp.isEmpty() ? "10" : hp, weapons, str(data.get("description")));
    }

    private static String str(Object o) {
        return o == null ? "" : String.valueOf(o).trim();
    }
}
