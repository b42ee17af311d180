package com.diplomacy.config;

import com.diplomacy.exception.GameConfigurationException;
import com.diplomacy.model.MapGraph;
import com.diplomacy.model.Part;
import com.diplomacy.model.PartKind;
import com.diplomacy.model.Territory;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Loads the map description at startup and turns it into an immutable {@link MapGraph}.
 * <p>
 * Each territory entry lists its parts ({@code _L} land, {@code _C}/{@code _NC}/{@code _SC} coast)
 * with their neighbors, plus {@code center}, {@code initPlayer} and {@code initPart}.
 * A neighbor is either an exact part id or a territory id; a territory id stands for
 * that territory's parts of the same kind as the listing part.
 * <p>
 * Any problem is fatal: the application must not start on a broken map.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MapLoader {

    private static final TypeReference<LinkedHashMap<String, LinkedHashMap<String, Object>>> MAP_TYPE =
            new TypeReference<>() {};

    private static final Set<String> RESERVED_KEYS = Set.of("center", "initPlayer", "initPart");

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    @Value("${diplomacy.map-location:file:map.json}")
    private String mapLocation;

    @Getter
    private MapDefinition definition;

    @Getter
    private MapGraph mapGraph;

    /** The map file exactly as read, for {@code --map} dumps. */
    @Getter
    private String rawJson;

    @PostConstruct
    public void loadMap() {
        Resource resource = resourceLoader.getResource(mapLocation);
        if (!resource.exists()) {
            throw new GameConfigurationException("Map file not found: " + mapLocation);
        }
        try (InputStream is = resource.getInputStream()) {
            rawJson = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new GameConfigurationException("Failed to read map file: " + mapLocation, e);
        }

        definition = parse(rawJson);
        mapGraph = buildGraph(definition);
        log.info("Loaded map from {} with {} territories and {} parts",
                mapLocation, mapGraph.getTerritories().size(), mapGraph.getParts().size());
    }

    /**
     * Parse a map description.
     *
     * @throws GameConfigurationException if the JSON is malformed or an entry is invalid
     */
    public MapDefinition parse(String json) {
        Map<String, LinkedHashMap<String, Object>> raw;
        try {
            raw = objectMapper.readValue(json, MAP_TYPE);
        } catch (JacksonException e) {
            throw new GameConfigurationException("Unparseable map description: " + e.getMessage(), e);
        }
        if (raw == null || raw.isEmpty()) {
            throw new GameConfigurationException("Map description has no territories");
        }

        List<TerritoryDefinition> territories = new ArrayList<>();
        raw.forEach((territoryId, entry) -> territories.add(parseTerritory(territoryId, entry)));
        return new MapDefinition(territories);
    }

    private TerritoryDefinition parseTerritory(String territoryId, Map<String, Object> entry) {
        if (entry == null) {
            throw new GameConfigurationException("Territory " + territoryId + " has no entry");
        }
        Map<String, List<String>> parts = new LinkedHashMap<>();
        for (Map.Entry<String, Object> field : entry.entrySet()) {
            if (RESERVED_KEYS.contains(field.getKey())) {
                continue;
            }
            if (!(field.getValue() instanceof List<?> neighbors)) {
                throw new GameConfigurationException("Part " + field.getKey() + " of " + territoryId
                        + " must list its neighbors as an array");
            }
            parts.put(field.getKey(), neighbors.stream().map(String::valueOf).toList());
        }
        if (parts.isEmpty()) {
            throw new GameConfigurationException("Territory " + territoryId + " has no parts");
        }

        return new TerritoryDefinition(
                territoryId,
                parts,
                parseFlag(territoryId, entry.get("center")),
                optionalName(entry.get("initPlayer")),
                optionalName(entry.get("initPart")));
    }

    private boolean parseFlag(String territoryId, Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        String text = String.valueOf(value).trim();
        if (text.equals("1")) {
            return true;
        }
        if (text.equals("0")) {
            return false;
        }
        throw new GameConfigurationException("Territory " + territoryId + " has invalid center flag: " + value);
    }

    private String optionalName(Object value) {
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() || text.equals("None") || text.equals("null") ? null : text;
    }

    /**
     * Resolve neighbor identifiers and index every territory and part.
     *
     * @throws GameConfigurationException on unknown identifiers or inconsistent start positions
     */
    public MapGraph buildGraph(MapDefinition definition) {
        List<Territory> territories = new ArrayList<>();
        List<Part> parts = new ArrayList<>();
        Map<String, Part> partsById = new HashMap<>();
        Map<String, List<Part>> partsByTerritory = new HashMap<>();

        for (TerritoryDefinition terrDef : definition.territories()) {
            int territoryIndex = territories.size();
            List<Integer> partIndexes = new ArrayList<>();
            for (String partId : terrDef.parts().keySet()) {
                Part part = new Part(parts.size(), partId, kindOf(partId), territoryIndex);
                if (partsById.putIfAbsent(partId, part) != null) {
                    throw new GameConfigurationException("Duplicate part id: " + partId);
                }
                parts.add(part);
                partIndexes.add(part.index());
                partsByTerritory.computeIfAbsent(terrDef.id(), id -> new ArrayList<>()).add(part);
            }
            validateStart(terrDef);
            territories.add(new Territory(territoryIndex, terrDef.id(), terrDef.center(),
                    partIndexes, terrDef.initPlayer(), terrDef.initPart()));
        }

        List<List<Integer>> adjacency = new ArrayList<>();
        for (TerritoryDefinition terrDef : definition.territories()) {
            for (Map.Entry<String, List<String>> partEntry : terrDef.parts().entrySet()) {
                Part part = partsById.get(partEntry.getKey());
                Set<Integer> resolved = new LinkedHashSet<>();
                for (String neighborId : partEntry.getValue()) {
                    for (Part neighbor : resolveNeighbor(part, neighborId, partsById, partsByTerritory)) {
                        resolved.add(neighbor.index());
                    }
                }
                adjacency.add(List.copyOf(resolved));
            }
        }
        return new MapGraph(territories, parts, adjacency);
    }

    private List<Part> resolveNeighbor(Part part, String neighborId,
                                       Map<String, Part> partsById, Map<String, List<Part>> partsByTerritory) {
        Part exact = partsById.get(neighborId);
        if (exact != null) {
            return List.of(exact);
        }
        List<Part> territoryParts = partsByTerritory.get(neighborId);
        if (territoryParts == null) {
            throw new GameConfigurationException("Part " + part.id() + " lists unknown neighbor " + neighborId);
        }
        List<Part> sameKind = territoryParts.stream().filter(p -> p.kind() == part.kind()).toList();
        if (sameKind.isEmpty()) {
            throw new GameConfigurationException("Part " + part.id() + " lists " + neighborId
                    + ", which has no " + part.kind().name().toLowerCase() + " part");
        }
        return sameKind;
    }

    private PartKind kindOf(String partId) {
        try {
            return PartKind.fromPartId(partId);
        } catch (IllegalArgumentException e) {
            throw new GameConfigurationException(e.getMessage(), e);
        }
    }

    private void validateStart(TerritoryDefinition terrDef) {
        if (terrDef.initPart() == null) {
            return;
        }
        if (terrDef.initPlayer() == null) {
            throw new GameConfigurationException("Territory " + terrDef.id() + " has initPart without initPlayer");
        }
        if (!terrDef.parts().containsKey(terrDef.initPart())) {
            throw new GameConfigurationException("initPart " + terrDef.initPart()
                    + " is not a part of " + terrDef.id());
        }
    }
}
