package com.catalogiq.engine.service;

import com.catalogiq.catalog.model.Item;
import com.catalogiq.catalog.repository.EmbeddingStore;
import com.catalogiq.common.exception.EngineException;
import com.catalogiq.engine.config.EngineConfig;
import com.catalogiq.engine.dto.DuplicateGroup;
import com.catalogiq.engine.dto.SimilarityEdge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Groups accepted duplicate edges into connected components.
 *
 * Components are found with a union-find over the vertices named by the edges, so chains
 * A-B, B-C land in one group even when A-C was never scored. Group ids follow the smallest
 * member id of each group, which makes numbering stable across identical runs.
 */
@Slf4j
@Service
public class ClusterBuilder {

    private final EmbeddingStore embeddingStore;
    private final MasterSelector masterSelector;
    private final RedundancyCostFunction costFunction;

    @Autowired
    public ClusterBuilder(EmbeddingStore embeddingStore, EngineConfig engineConfig) {
        this(embeddingStore,
                MasterSelectionStrategy.fromName(engineConfig.getDuplicates().getMasterSelection()),
                RedundancyCostStrategy.fromName(engineConfig.getDuplicates().getCostFunction()));
    }

    public ClusterBuilder(EmbeddingStore embeddingStore, MasterSelector masterSelector,
                          RedundancyCostFunction costFunction) {
        this.embeddingStore = embeddingStore;
        this.masterSelector = masterSelector;
        this.costFunction = costFunction;
    }

    /**
     * Build groups resolving items through the embedding store.
     *
     * @throws EngineException UNKNOWN_ITEM when an edge names an item the store does not hold
     */
    public List<DuplicateGroup> buildGroups(List<SimilarityEdge> edges) {
        return buildGroups(edges, embeddingStore::findItem);
    }

    /**
     * Build groups resolving items from the batch that produced the edges.
     */
    public List<DuplicateGroup> buildGroups(List<SimilarityEdge> edges, Map<String, Item> itemsById) {
        return buildGroups(edges, id -> Optional.ofNullable(itemsById.get(id)));
    }

    private List<DuplicateGroup> buildGroups(List<SimilarityEdge> edges, Function<String, Optional<Item>> lookup) {
        if (edges == null || edges.isEmpty()) {
            return List.of();
        }

        TreeSet<String> vertexIds = new TreeSet<>();
        for (SimilarityEdge edge : edges) {
            if (edge.getItemA() == null || edge.getItemB() == null) {
                throw EngineException.invalidParameter("edge", edge);
            }
            if (edge.getItemA().equals(edge.getItemB())) {
                continue;
            }
            vertexIds.add(edge.getItemA());
            vertexIds.add(edge.getItemB());
        }

        List<String> vertices = new ArrayList<>(vertexIds);
        Map<String, Integer> index = new HashMap<>(vertices.size() * 2);
        for (int i = 0; i < vertices.size(); i++) {
            index.put(vertices.get(i), i);
        }

        DisjointSet components = new DisjointSet(vertices.size());
        for (SimilarityEdge edge : edges) {
            if (!edge.getItemA().equals(edge.getItemB())) {
                components.union(index.get(edge.getItemA()), index.get(edge.getItemB()));
            }
        }

        // vertices are sorted, so each member list comes out in ascending id order and the
        // first member seen for a root is the group's minimum id
        Map<Integer, List<String>> membersByRoot = new HashMap<>();
        TreeMap<String, Integer> rootByMinId = new TreeMap<>();
        for (int i = 0; i < vertices.size(); i++) {
            int root = components.find(i);
            List<String> members = membersByRoot.computeIfAbsent(root, r -> new ArrayList<>());
            if (members.isEmpty()) {
                rootByMinId.put(vertices.get(i), root);
            }
            members.add(vertices.get(i));
        }

        List<DuplicateGroup> groups = new ArrayList<>(rootByMinId.size());
        int groupId = 1;
        for (Integer root : rootByMinId.values()) {
            List<String> memberIds = membersByRoot.get(root);
            if (memberIds.size() < 2) {
                continue;
            }
            List<Item> members = new ArrayList<>(memberIds.size());
            for (String id : memberIds) {
                members.add(lookup.apply(id).orElseThrow(() -> EngineException.unknownItem(id)));
            }
            groups.add(toGroup(groupId++, members));
        }

        log.info("Built {} duplicate groups from {} edges over {} items", groups.size(), edges.size(), vertices.size());
        return groups;
    }

    private DuplicateGroup toGroup(int groupId, List<Item> members) {
        Item master = masterSelector.selectMaster(members);

        List<String> ordered = new ArrayList<>(members.size());
        ordered.add(master.getId());
        members.stream()
                .filter(member -> !member.getId().equals(master.getId()))
                .sorted(Comparator.comparing(Item::getPrice).reversed().thenComparing(Item::getId))
                .forEach(member -> ordered.add(member.getId()));

        BigDecimal totalValue = members.stream().map(Item::getPrice).reduce(BigDecimal.ZERO, BigDecimal::add);

        return DuplicateGroup.builder()
                .groupId(groupId)
                .masterId(master.getId())
                .memberIds(List.copyOf(ordered))
                .size(members.size())
                .totalValue(totalValue)
                .redundancyCost(costFunction.cost(master, List.copyOf(members)))
                .build();
    }
}
