package com.catalogiq.engine.service;

import com.catalogiq.catalog.model.Item;
import com.catalogiq.common.exception.EngineException;

import java.math.BigDecimal;
import java.util.List;

public enum RedundancyCostStrategy implements RedundancyCostFunction {

    /** Inventory value of every member except the master. */
    NON_MASTER_VALUE {
        @Override
        public BigDecimal cost(Item master, List<Item> members) {
            return members.stream()
                    .filter(member -> !member.getId().equals(master.getId()))
                    .map(Item::getPrice)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
        }
    },

    /** Total group value minus the cheapest member. */
    SUM_MINUS_MIN {
        @Override
        public BigDecimal cost(Item master, List<Item> members) {
            BigDecimal total = members.stream().map(Item::getPrice).reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal min = members.stream().map(Item::getPrice).min(BigDecimal::compareTo).orElse(BigDecimal.ZERO);
            return total.subtract(min);
        }
    },

    /** Highest minus lowest member price. */
    PRICE_SPREAD {
        @Override
        public BigDecimal cost(Item master, List<Item> members) {
            BigDecimal max = members.stream().map(Item::getPrice).max(BigDecimal::compareTo).orElse(BigDecimal.ZERO);
            BigDecimal min = members.stream().map(Item::getPrice).min(BigDecimal::compareTo).orElse(BigDecimal.ZERO);
            return max.subtract(min);
        }
    };

    public static RedundancyCostStrategy fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase().replace('-', '_');
            for (RedundancyCostStrategy strategy : values()) {
                if (strategy.name().equals(normalized)) {
                    return strategy;
                }
            }
        }
        throw EngineException.invalidParameter("costFunction", name);
    }
}
