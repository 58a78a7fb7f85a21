package com.catalogiq.catalog.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * One line of a catalog seed file: item attributes plus embeddings keyed by aspect name.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogItemJson {

    private String id;
    private String sku;
    private String name;
    private String description;
    private String brand;
    private String category;
    private BigDecimal price;
    private Map<String, List<Double>> embeddings;

    public boolean isValid() {
        return id != null && !id.isBlank()
                && (price == null || price.signum() >= 0);
    }
}
