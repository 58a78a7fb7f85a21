package com.catalogiq.engine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Connected component of the duplicate match graph.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DuplicateGroup {

    /** 1-based, ordered by the smallest member id of each group */
    private int groupId;

    private String masterId;

    /** Master first, then descending price, then ascending id */
    private List<String> memberIds;

    private int size;

    /** Sum of member prices */
    private BigDecimal totalValue;

    private BigDecimal redundancyCost;

    /** Optional merge recommendation, best-effort */
    private String rationale;
}
