package com.catalogiq.catalog.repository;

import com.catalogiq.catalog.model.Item;
import com.catalogiq.catalog.model.ItemEmbeddings;
import com.catalogiq.common.enums.Aspect;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Read-only view of the catalog and its precomputed embeddings.
 * Implementations must return items in ascending id order from {@link #findAllItems()}.
 */
public interface EmbeddingStore {

    Optional<Item> findItem(String itemId);

    List<Item> findAllItems();

    ItemEmbeddings findEmbeddings(String itemId);

    default Optional<double[]> findEmbedding(String itemId, Aspect aspect) {
        return findEmbeddings(itemId).get(aspect);
    }

    /**
     * Dimension shared by every vector of the aspect, empty when no item has one yet.
     */
    OptionalInt dimension(Aspect aspect);

    int size();
}
