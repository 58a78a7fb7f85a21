package com.catalogiq.engine.service;

import com.catalogiq.catalog.model.Item;
import com.catalogiq.common.exception.EngineException;

import java.util.Comparator;
import java.util.List;

/**
 * Built-in master selection rules. Every rule breaks ties by the lowest item id.
 */
public enum MasterSelectionStrategy implements MasterSelector {

    /** Keep the premium-priced listing. */
    HIGHEST_PRICE(Comparator.comparing(Item::getPrice).reversed()),
    LOWEST_PRICE(Comparator.comparing(Item::getPrice)),
    LOWEST_ID((a, b) -> 0);

    private final Comparator<Item> order;

    MasterSelectionStrategy(Comparator<Item> primary) {
        this.order = primary.thenComparing(Item::getId);
    }

    @Override
    public Item selectMaster(List<Item> members) {
        return members.stream()
                .min(order)
                .orElseThrow(() -> EngineException.emptyInput("group members"));
    }

    public static MasterSelectionStrategy fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase().replace('-', '_');
            for (MasterSelectionStrategy strategy : values()) {
                if (strategy.name().equals(normalized)) {
                    return strategy;
                }
            }
        }
        throw EngineException.invalidParameter("masterSelection", name);
    }
}
