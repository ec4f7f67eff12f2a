package com.example.rpgcampaign.model;

/**
 * One item an NPC carries. Items may sit inside another item of the same inventory (a pouch, a backpack).
 */
public class InventoryItem {

    private final String name;
    private final String description;
    private final String source;
    private final boolean weapon;
    private final String damage;      // nullable: dice formula
    private final String container;   // nullable: name of the holding item

    public InventoryItem(String name, String description, String source, boolean weapon,
                         String damage, String container) {
        this.name = name;
        this.description = description == null ? "" : description;
        this.source = source == null ? "" : source;
        this.weapon = weapon;
        this.damage = damage;
        this.container = container;
    }

    /**
     * Items are looked up case-insensitively.
     */
    public static String keyFor(String name) {
        return name == null ? "" : name.trim().toLowerCase();
    }

    public String getKey() { return keyFor(name); }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public String getSource() { return source; }
    public boolean isWeapon() { return weapon; }
    public String getDamage() { return damage; }
    public String getContainer() { return container; }

    public boolean isInside(String containerName) {
        return container != null && keyFor(container).equals(keyFor(containerName));
    }

    public InventoryItem withDescription(String newDescription) {
        return new InventoryItem(name, newDescription, source, weapon, damage, container);
    }

    public InventoryItem withWeapon(boolean newWeapon) {
        return new InventoryItem(name, description, source, newWeapon, damage, container);
    }

    public InventoryItem withDamage(String newDamage) {
        return new InventoryItem(name, description, source, weapon, newDamage, container);
    }

    public InventoryItem withContainer(String newContainer) {
        return new InventoryItem(name, description, source, weapon, damage, newContainer);
    }

    @Override
    public String toString() {
        return "InventoryItem[" + name + (weapon ? ", weapon " + damage : "") + (container != null ? ", in " + container : "") + "]";
    }
}
