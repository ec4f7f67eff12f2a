package com.example.rpgcampaign.tools;

import com.example.rpgcampaign.combat.CombatException;
import com.example.rpgcampaign.combat.CombatSessionManager;
import com.example.rpgcampaign.model.Inventory;
import com.example.rpgcampaign.model.InventoryItem;
import com.example.rpgcampaign.model.NpcRecord;
import com.example.rpgcampaign.persistence.CampaignRepository;
import com.example.rpgcampaign.tools.ToolDefinition.Category;
import com.example.rpgcampaign.util.DiceFormula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

/**
 * Handles INVENTORY tools: add_item, remove_item, update_item, get_inventory, add_money, remove_money.
 *
 * Every change loads the NPC's inventory, edits the copy and saves it back while holding the
 * campaign lock, so two edits to the same campaign never lose each other's changes.
 */
public class InventoryToolHandler implements ToolHandler {

    private static final Logger logger = LoggerFactory.getLogger(InventoryToolHandler.class);

    private static final Set<String> SUPPORTED_TOOLS = ToolRegistry.getToolsByCategory(Category.INVENTORY).stream()
            .map(ToolDefinition::getName)
            .collect(Collectors.toUnmodifiableSet());

    private final CampaignRepository records;
    private final CombatSessionManager sessions;

    public InventoryToolHandler(CampaignRepository records, CombatSessionManager sessions) {
        this.records = records;
        this.sessions = sessions;
    }

    @Override
    public boolean supports(String toolName) {
        return SUPPORTED_TOOLS.contains(toolName);
    }

    @Override
    public ToolResult handle(ToolRequest request) {
        switch (request.getName()) {
            case "add_item":
                return handleAddItem(request);
            case "remove_item":
                return handleRemoveItem(request);
            case "update_item":
                return handleUpdateItem(request);
            case "get_inventory":
                return handleGetInventory(request);
            case "add_money":
                return handleAddMoney(request);
            case "remove_money":
                return handleRemoveMoney(request);
            default:
                throw CombatException.invalidArgument("Unsupported inventory tool: " + request.getName());
        }
    }

    // ==================== ITEMS ====================

    private ToolResult handleAddItem(ToolRequest request) {
        String itemName = request.require("item_name");
        String description = request.require("description");
        String source = request.require("source");
        boolean weapon = Boolean.TRUE.equals(request.getBoolean("weapon"));
        String damage = request.get("damage");
        String container = request.get("container");
        if (weapon && damage == null) {
            throw CombatException.invalidArgument("Weapon items must have damage specified.");
        }
        requireFormula(damage);

        return editInventory(request, (npc, inventory) -> {
            if (inventory.hasItem(itemName)) {
                throw new CombatException(CombatException.Kind.ALREADY_EXISTS,
                    "Item '" + itemName + "' already exists. " + npc.getName() + " already has this.");
            }
            String holder = container != null ? requireContainer(inventory, container) : null;
            inventory.putItem(new InventoryItem(itemName, description, source, weapon, damage, holder));

            String weaponText = weapon ? " (weapon, " + damage + " damage)" : "";
            String containerText = holder != null ? " in " + holder : "";
            return "Added '" + itemName + "'" + weaponText + " to " + npc.getName() + "'s inventory"
                + containerText + ".\nSource: " + source;
        });
    }

    private ToolResult handleRemoveItem(ToolRequest request) {
        String itemName = request.require("item_name");
        String reason = request.getOrDefault("reason", "removed");

        return editInventory(request, (npc, inventory) -> {
            InventoryItem item = requireItem(npc, inventory, itemName);
            List<String> loosened = inventory.removeItem(item.getName());

            StringBuilder sb = new StringBuilder("Removed '").append(item.getName()).append("' from ")
                .append(npc.getName()).append("'s inventory. Reason: ").append(reason);
            if (!loosened.isEmpty()) {
                sb.append("\nNo longer stored in it: ").append(String.join(", ", loosened));
            }
            return sb.toString();
        });
    }

    private ToolResult handleUpdateItem(ToolRequest request) {
        String itemName = request.require("item_name");
        String description = request.get("description");
        Boolean weapon = request.getBoolean("weapon");
        String damage = request.get("damage");
        String container = request.get("container");
        requireFormula(damage);

        return editInventory(request, (npc, inventory) -> {
            InventoryItem item = requireItem(npc, inventory, itemName);
            List<String> updates = new ArrayList<>();

            if (description != null) {
                item = item.withDescription(description);
                updates.add("description");
            }
            if (weapon != null) {
                item = item.withWeapon(weapon);
                updates.add("weapon status");
            }
            if (damage != null) {
                item = item.withDamage(damage);
                updates.add("damage");
            }
            if (container != null) {
                String holder = requireContainer(inventory, container);
                if (inventory.wouldContainItself(item.getName(), holder)) {
                    throw CombatException.invalidArgument("'" + item.getName() + "' cannot be stored inside itself.");
                }
                item = item.withContainer(holder);
                updates.add("container");
            }

            if (updates.isEmpty()) {
                return "No updates provided for '" + item.getName() + "'";
            }
            if (item.isWeapon() && item.getDamage() == null) {
                throw CombatException.invalidArgument("Weapon items must have damage specified.");
            }
            inventory.putItem(item);
            return "Updated '" + item.getName() + "' for " + npc.getName() + ": " + String.join(", ", updates);
        });
    }

    private ToolResult handleGetInventory(ToolRequest request) {
        String campaignId = request.require("campaign_id");
        ToolSupport.requireCampaign(records, campaignId);
        NpcRecord npc = requireNpc(campaignId, request.require("npc_name"));

        Inventory inventory = records.getInventory(campaignId, npc.getSlug()).orElse(null);
        if (inventory == null) {
            return ToolResult.ok(npc.getName() + " carries nothing yet.");
        }

        StringBuilder sb = new StringBuilder();
        sb.append("=== ").append(npc.getName()).append("'s Inventory ===\n\n");
        sb.append("Money: ").append(inventory.getMoney()).append(" gold\n\n");
        List<InventoryItem> items = inventory.getItems();
        if (items.isEmpty()) {
            sb.append("No items.");
        } else {
            sb.append("Items (").append(items.size()).append("):\n");
            for (InventoryItem item : items) {
                sb.append("\n- ").append(item.getName()).append('\n');
                sb.append("  Description: ").append(item.getDescription()).append('\n');
                sb.append("  Source: ").append(item.getSource()).append('\n');
                if (item.isWeapon()) {
                    sb.append("  Weapon: yes (damage: ").append(item.getDamage()).append(")\n");
                }
                if (item.getContainer() != null) {
                    sb.append("  Container: ").append(item.getContainer()).append('\n');
                }
            }
        }
        return ToolResult.ok(sb.toString().trim());
    }

    // ==================== MONEY ====================

    private ToolResult handleAddMoney(ToolRequest request) {
        long amount = requireAmount(request);
        return editInventory(request, (npc, inventory) -> {
            inventory.setMoney(Math.addExact(inventory.getMoney(), amount));
            return "Added " + amount + " gold to " + npc.getName() + "'s inventory.\nNew balance: "
                + inventory.getMoney() + " gold";
        });
    }

    private ToolResult handleRemoveMoney(ToolRequest request) {
        long amount = requireAmount(request);
        return editInventory(request, (npc, inventory) -> {
            if (inventory.getMoney() < amount) {
                throw new CombatException(CombatException.Kind.INSUFFICIENT_FUNDS,
                    npc.getName() + " only has " + inventory.getMoney() + " gold but needs " + amount + " gold.");
            }
            inventory.setMoney(inventory.getMoney() - amount);
            return "Removed " + amount + " gold from " + npc.getName() + "'s inventory.\nNew balance: "
                + inventory.getMoney() + " gold";
        });
    }

    // ==================== HELPERS ====================

    /**
     * Load, edit and save one NPC's inventory under the campaign lock.
     * An NPC without an inventory starts from an empty one. Nothing is saved if the edit throws.
     */
    private ToolResult editInventory(ToolRequest request, BiFunction<NpcRecord, Inventory, String> edit) {
        String campaignId = request.require("campaign_id");
        String npcName = request.require("npc_name");
        ToolSupport.requireCampaign(records, campaignId);

        String text = sessions.withCampaignLock(campaignId, () -> {
            ToolSupport.requireCampaign(records, campaignId);
            NpcRecord npc = requireNpc(campaignId, npcName);
            Inventory inventory = records.getInventory(campaignId, npc.getSlug()).orElseGet(Inventory::new);
            String result = edit.apply(npc, inventory);
            records.saveInventory(campaignId, npc.getSlug(), inventory);
            logger.debug("{} on {} in campaign {}: {}", request.getName(), npc.getSlug(), campaignId, inventory);
            return result;
        });
        return ToolResult.ok(text);
    }

    private NpcRecord requireNpc(String campaignId, String npcName) {
        return records.findNpc(campaignId, npcName)
            .orElseThrow(() -> CombatException.notFound("NPC", npcName));
    }

    private static InventoryItem requireItem(NpcRecord npc, Inventory inventory, String itemName) {
        return inventory.getItem(itemName)
            .orElseThrow(() -> new CombatException(CombatException.Kind.NOT_FOUND,
                npc.getName() + " has no item '" + itemName + "'."));
    }

    /**
     * @return the container's name as stored
     */
    private static String requireContainer(Inventory inventory, String container) {
        return inventory.getItem(container)
            .map(InventoryItem::getName)
            .orElseThrow(() -> {
                String available = inventory.getItems().stream()
                    .map(InventoryItem::getName)
                    .collect(Collectors.joining(", "));
                return new CombatException(CombatException.Kind.NOT_FOUND, "Container '" + container + "' not found. "
                    + "Available: " + (available.isEmpty() ? "none" : available));
            });
    }

    private static void requireFormula(String damage) {
        if (damage != null && !DiceFormula.isValid(damage)) {
            throw CombatException.invalidArgument("Damage '" + damage + "' is not dice notation such as 1d8 or 2d6+3.");
        }
    }

    private static long requireAmount(ToolRequest request) {
        long amount = request.requireLong("amount");
        if (amount <= 0) {
            throw CombatException.invalidArgument("Amount must be a positive number of gold, got " + amount + ".");
        }
        return amount;
    }
}
