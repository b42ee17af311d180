package com.diplomacy.model;

import java.util.ArrayList;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static territory/part adjacency graph. Built once by the map loader and never
 * mutated afterwards; every collection it hands out is unmodifiable.
 */
public final class MapGraph {

    private final List<Territory> territories;
    private final List<Part> parts;
    private final List<List<Part>> neighbors;
    private final Map<String, Territory> territoriesById = new LinkedHashMap<>();
    private final Map<String, Part> partsById = new LinkedHashMap<>();

    /**
     * @param territories territories in index order
     * @param parts       parts in index order
     * @param adjacency   for every part index, the indexes of its neighbor parts
     */
    public MapGraph(List<Territory> territories, List<Part> parts, List<List<Integer>> adjacency) {
        if (adjacency.size() != parts.size()) {
            throw new IllegalArgumentException("Adjacency must list every part: "
                    + adjacency.size() + " != " + parts.size());
        }
        this.territories = List.copyOf(territories);
        this.parts = List.copyOf(parts);

        List<List<Part>> lists = new ArrayList<>(parts.size());
        for (List<Integer> indexes : adjacency) {
            lists.add(indexes.stream().map(this.parts::get).toList());
        }
        this.neighbors = Collections.unmodifiableList(lists);

        for (Territory territory : this.territories) {
            territoriesById.put(territory.id(), territory);
        }
        for (Part part : this.parts) {
            partsById.put(part.id(), part);
        }
    }

    public List<Territory> getTerritories() {
        return territories;
    }

    public List<Part> getParts() {
        return parts;
    }

    public Optional<Part> findPart(String partId) {
        return Optional.ofNullable(partsById.get(partId));
    }

    /**
     * @throws IllegalArgumentException if the part id is unknown
     */
    public Part part(String partId) {
        Part part = partsById.get(partId);
        if (part == null) {
            throw new IllegalArgumentException("Unknown part: " + partId);
        }
        return part;
    }

    public Optional<Territory> findTerritory(String territoryId) {
        return Optional.ofNullable(territoriesById.get(territoryId));
    }

    public Territory territory(int index) {
        return territories.get(index);
    }

    public Territory territoryOf(Part part) {
        return territories.get(part.territoryIndex());
    }

    public List<Part> partsOf(Territory territory) {
        return territory.partIndexes().stream().map(parts::get).toList();
    }

    public List<Part> neighbors(Part part) {
        return neighbors.get(part.index());
    }

    public boolean isCoast(Part part) {
        return part.isCoast();
    }

    public boolean isAdjacent(Part from, Part to) {
        return neighbors(from).contains(to);
    }

    /**
     * Whether {@code from} lists any part of {@code territory} as a neighbor.
     */
    public boolean touches(Part from, Territory territory) {
        return neighbors(from).stream().anyMatch(n -> n.territoryIndex() == territory.index());
    }

    /**
     * A sea territory has no land part. Only fleets at sea can convoy.
     */
    public boolean isSea(Territory territory) {
        return partsOf(territory).stream().allMatch(Part::isCoast);
    }

    /**
     * Territory-level hop distance from every territory to the nearest of {@code sources},
     * ignoring part kinds. Unreachable territories get {@link Integer#MAX_VALUE}.
     */
    public int[] distancesFrom(List<Territory> sources) {
        int[] distance = new int[territories.size()];
        Arrays.fill(distance, Integer.MAX_VALUE);
        Deque<Integer> queue = new ArrayDeque<>();
        for (Territory source : sources) {
            distance[source.index()] = 0;
            queue.add(source.index());
        }
        while (!queue.isEmpty()) {
            int current = queue.poll();
            for (Part part : partsOf(territories.get(current))) {
                for (Part neighbor : neighbors(part)) {
                    int next = neighbor.territoryIndex();
                    if (distance[next] == Integer.MAX_VALUE) {
                        distance[next] = distance[current] + 1;
                        queue.add(next);
                    }
                }
            }
        }
        return distance;
    }
}
