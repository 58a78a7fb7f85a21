package com.catalogiq.catalog.model;

import lombok.*;

import java.math.BigDecimal;

/**
 * Catalog product. The id is stable and never reused; text and price fields may
 * change between runs and are read fresh on every computation.
 */
@Getter
@Builder
@AllArgsConstructor
@ToString
@EqualsAndHashCode(of = "id")
public class Item {

    @NonNull
    private final String id;

    @Setter
    private String sku;

    @Setter
    private String name;

    @Setter
    private String description;

    @Setter
    private String brand;

    @Setter
    private String category;

    @Setter
    @NonNull
    @Builder.Default
    private BigDecimal price = BigDecimal.ZERO;

    /**
     * Short human-readable label used in oracle prompts.
     */
    public String displayName() {
        if (brand == null || brand.isBlank()) {
            return name != null ? name : id;
        }
        return brand + " " + (name != null ? name : id);
    }
}
