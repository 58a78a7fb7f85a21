package com.catalogiq.engine.spi;

import com.catalogiq.common.enums.Aspect;

/**
 * External model service turning content into a vector of the aspect's fixed dimension.
 */
public interface EmbeddingProvider {

    double[] embedText(String text, Aspect aspect);

    default boolean isAvailable() {
        return true;
    }
}
