package com.catalogiq.catalog.repository;

import com.catalogiq.catalog.model.Item;
import com.catalogiq.catalog.model.ItemEmbeddings;
import com.catalogiq.common.enums.Aspect;
import com.catalogiq.common.exception.EngineException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Embedding store held in memory, filled by the catalog loader or by callers
 * that already hold embeddings from the external model service.
 */
@Slf4j
@Repository
public class InMemoryEmbeddingStore implements EmbeddingStore {

    private final ConcurrentSkipListMap<String, Item> items = new ConcurrentSkipListMap<>();
    private final Map<String, ItemEmbeddings> embeddings = new ConcurrentHashMap<>();
    private final Map<Aspect, Integer> dimensions = new EnumMap<>(Aspect.class);

    /**
     * Store an item with its vectors, replacing any previous version.
     * Rejects a vector whose dimension differs from the one already recorded for its aspect.
     */
    public synchronized void save(Item item, Map<Aspect, double[]> vectors) {
        Map<Aspect, Integer> pending = new EnumMap<>(Aspect.class);
        if (vectors != null) {
            for (Map.Entry<Aspect, double[]> entry : vectors.entrySet()) {
                if (entry.getValue() == null) {
                    continue;
                }
                int actual = entry.getValue().length;
                if (actual == 0) {
                    throw EngineException.emptyInput("embedding " + entry.getKey().toJson() + " of item " + item.getId());
                }
                Integer expected = dimensions.get(entry.getKey());
                if (expected != null && expected != actual) {
                    throw EngineException.dimensionMismatch(entry.getKey().toJson(), expected, actual);
                }
                pending.put(entry.getKey(), actual);
            }
        }
        pending.forEach(dimensions::putIfAbsent);
        items.put(item.getId(), item);
        embeddings.put(item.getId(), new ItemEmbeddings(item.getId(), vectors));
        log.debug("Stored item {} with aspects {}", item.getId(), pending.keySet());
    }

    public synchronized void remove(String itemId) {
        items.remove(itemId);
        embeddings.remove(itemId);
    }

    public synchronized void clear() {
        items.clear();
        embeddings.clear();
        dimensions.clear();
    }

    @Override
    public Optional<Item> findItem(String itemId) {
        if (itemId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(items.get(itemId));
    }

    @Override
    public List<Item> findAllItems() {
        return new ArrayList<>(items.values());
    }

    @Override
    public ItemEmbeddings findEmbeddings(String itemId) {
        ItemEmbeddings found = itemId == null ? null : embeddings.get(itemId);
        return found != null ? found : ItemEmbeddings.empty(itemId);
    }

    @Override
    public synchronized OptionalInt dimension(Aspect aspect) {
        Integer dimension = dimensions.get(aspect);
        return dimension == null ? OptionalInt.empty() : OptionalInt.of(dimension);
    }

    @Override
    public int size() {
        return items.size();
    }
}
