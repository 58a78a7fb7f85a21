package com.catalogiq.engine.service;

import com.catalogiq.catalog.model.Item;

import java.math.BigDecimal;
import java.util.List;

/**
 * Monetary estimate of the waste a duplicate group represents. Business policy, so callers
 * may plug their own.
 */
@FunctionalInterface
public interface RedundancyCostFunction {

    BigDecimal cost(Item master, List<Item> members);
}
