package com.example.rpgcampaign.tools;

import com.example.rpgcampaign.combat.CombatException;
import com.example.rpgcampaign.model.Campaign;
import com.example.rpgcampaign.persistence.CampaignRepository;

import java.util.ArrayList;
import java.util.List;

final class ToolSupport {

    private ToolSupport() { }

    static Campaign requireCampaign(CampaignRepository records, String campaignId) {
        return records.getCampaign(campaignId)
            .orElseThrow(() -> CombatException.campaignNotFound(campaignId));
    }

    /**
     * Split a comma-separated argument, dropping blanks.
     */
    static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        if (value == null) return items;
        for (String part : value.split(",")) {
            if (!part.isBlank()) {
                items.add(part.trim());
            }
        }
        return items;
    }

    static String percent(double chance) {
        return Math.round(chance * 100) + "%";
    }
}
