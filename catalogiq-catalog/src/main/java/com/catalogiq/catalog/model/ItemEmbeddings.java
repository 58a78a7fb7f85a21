package com.catalogiq.catalog.model;

import com.catalogiq.common.enums.Aspect;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Named embedding vectors of one item. A missing aspect makes the item
 * ineligible for computations on that aspect.
 */
public final class ItemEmbeddings {

    private final String itemId;
    private final Map<Aspect, double[]> vectors;

    public ItemEmbeddings(String itemId, Map<Aspect, double[]> vectors) {
        this.itemId = itemId;
        EnumMap<Aspect, double[]> copy = new EnumMap<>(Aspect.class);
        if (vectors != null) {
            vectors.forEach((aspect, vector) -> {
                if (vector != null) {
                    copy.put(aspect, vector.clone());
                }
            });
        }
        this.vectors = Collections.unmodifiableMap(copy);
    }

    public static ItemEmbeddings empty(String itemId) {
        return new ItemEmbeddings(itemId, Map.of());
    }

    public String getItemId() {
        return itemId;
    }

    /**
     * Copy of the aspect's vector; the stored one is never handed out.
     */
    public Optional<double[]> get(Aspect aspect) {
        return Optional.ofNullable(vectors.get(aspect)).map(double[]::clone);
    }

    public boolean has(Aspect aspect) {
        return vectors.containsKey(aspect);
    }

    public Set<Aspect> aspects() {
        return vectors.keySet();
    }
}
