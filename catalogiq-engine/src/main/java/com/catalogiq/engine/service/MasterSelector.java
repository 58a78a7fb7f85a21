package com.catalogiq.engine.service;

import com.catalogiq.catalog.model.Item;

import java.util.List;

/**
 * Picks the canonical record of a duplicate group.
 */
@FunctionalInterface
public interface MasterSelector {

    /**
     * @param members group members, at least two, in ascending id order
     */
    Item selectMaster(List<Item> members);
}
