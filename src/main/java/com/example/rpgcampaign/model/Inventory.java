package com.example.rpgcampaign.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Money and items carried by one NPC. Items keep the order they were added in.
 * Not thread-safe; callers work on their own copy and save it back.
 */
public class Inventory {

    private long money;
    private final Map<String, InventoryItem> items = new LinkedHashMap<>();

    public Inventory() {
        this(0L, List.of());
    }

    public Inventory(long money, List<InventoryItem> items) {
        this.money = money;
        for (InventoryItem item : items) {
            this.items.put(item.getKey(), item);
        }
    }

    public long getMoney() { return money; }

    public void setMoney(long money) {
        if (money < 0) {
            throw new IllegalArgumentException("Money cannot be negative: " + money);
        }
        this.money = money;
    }

    public List<InventoryItem> getItems() {
        return new ArrayList<>(items.values());
    }

    public Optional<InventoryItem> getItem(String name) {
        return Optional.ofNullable(items.get(InventoryItem.keyFor(name)));
    }

    public boolean hasItem(String name) {
        return items.containsKey(InventoryItem.keyFor(name));
    }

    /**
     * Add an item, or replace the item of the same name in place.
     */
    public void putItem(InventoryItem item) {
        items.put(item.getKey(), item);
    }

    /**
     * Remove an item. Items that were stored inside it stay in the inventory, loose.
     * @return names of the items that lost their container
     */
    public List<String> removeItem(String name) {
        InventoryItem removed = items.remove(InventoryItem.keyFor(name));
        List<String> loosened = new ArrayList<>();
        if (removed == null) return loosened;
        for (InventoryItem item : getItems()) {
            if (item.isInside(removed.getName())) {
                items.put(item.getKey(), item.withContainer(null));
                loosened.add(item.getName());
            }
        }
        return loosened;
    }

    /**
     * True if putting {@code item} into {@code container} would place it inside itself,
     * directly or through a chain of containers.
     */
    public boolean wouldContainItself(String item, String container) {
        String itemKey = InventoryItem.keyFor(item);
        String current = InventoryItem.keyFor(container);
        int hops = 0;
        while (!current.isEmpty() && hops++ <= items.size()) {
            if (current.equals(itemKey)) return true;
            InventoryItem holder = items.get(current);
            if (holder == null || holder.getContainer() == null) return false;
            current = InventoryItem.keyFor(holder.getContainer());
        }
        return false;
    }

    public Inventory copy() {
        return new Inventory(money, getItems());
    }

    @Override
    public String toString() {
        return "Inventory[" + money + " gold, " + items.size() + " items]";
    }
}
