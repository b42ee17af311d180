package com.diplomacy.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of a game: unit placement, center ownership, players and phase.
 * <p>
 * Units and center owners are stored as player indexes in arrays keyed by part and
 * territory index. A snapshot is never changed in place; {@link #edit()} produces a
 * replacement, so no caller ever sees a half-applied phase.
 */
public final class GameState {

    private static final int NONE = -1;

    private final MapGraph map;
    private final List<PlayerState> players;
    private final int[] unitOwner;
    private final int[] centerOwner;
    private final int phaseCount;
    private final PhaseKind phaseKind;
    private final GameStatus status;
    private final String winner;
    private final List<Dislodgement> dislodged;

    private GameState(Editor editor) {
        this.map = editor.map;
        this.players = List.copyOf(editor.players);
        this.unitOwner = editor.unitOwner.clone();
        this.centerOwner = editor.centerOwner.clone();
        this.phaseCount = editor.phaseCount;
        this.phaseKind = editor.phaseKind;
        this.status = editor.status;
        this.winner = editor.winner;
        this.dislodged = List.copyOf(editor.dislodged);
    }

    /**
     * Starting position described by the map: players in order of first appearance,
     * their units on {@code initPart} and their centers as home centers.
     */
    public static GameState initial(MapGraph map) {
        Map<String, List<Integer>> homes = new LinkedHashMap<>();
        for (Territory territory : map.getTerritories()) {
            if (territory.initPlayer() != null) {
                List<Integer> centers = homes.computeIfAbsent(territory.initPlayer(), name -> new ArrayList<>());
                if (territory.supplyCenter()) {
                    centers.add(territory.index());
                }
            }
        }
        List<PlayerState> players = new ArrayList<>();
        homes.forEach((name, centers) -> players.add(new PlayerState(players.size(), name, centers)));

        Editor editor = new Editor(map, players);
        for (Territory territory : map.getTerritories()) {
            if (territory.initPlayer() == null) {
                continue;
            }
            if (territory.initPart() != null) {
                editor.placeUnit(map.part(territory.initPart()), territory.initPlayer());
            }
            if (territory.supplyCenter()) {
                editor.setCenterOwner(territory, territory.initPlayer());
            }
        }
        return editor.build();
    }

    public Editor edit() {
        return new Editor(this);
    }

    public MapGraph getMap() {
        return map;
    }

    public List<PlayerState> getPlayers() {
        return players;
    }

    public Optional<PlayerState> findPlayer(String name) {
        return players.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    public boolean hasPlayer(String name) {
        return findPlayer(name).isPresent();
    }

    public int getPhaseCount() {
        return phaseCount;
    }

    public PhaseKind getPhaseKind() {
        return phaseKind;
    }

    public GameStatus getStatus() {
        return status;
    }

    /** Winner's name once the game is {@link GameStatus#FINISHED}, otherwise null. */
    public String getWinner() {
        return winner;
    }

    /** Units waiting to retreat; empty outside retreat phases. */
    public List<Dislodgement> getDislodged() {
        return dislodged;
    }

    public String getPhaseLabel() {
        return "Phase " + phaseCount + " " + phaseKind.getLabel();
    }

    // ── units ───────────────────────────────────────────────────────────

    public Optional<String> unitOwner(Part part) {
        return nameOf(unitOwner[part.index()]);
    }

    public boolean hasUnit(Part part) {
        return unitOwner[part.index()] != NONE;
    }

    /**
     * The part of {@code territory} that holds a unit, if any.
     */
    public Optional<Part> occupiedPart(Territory territory) {
        return map.partsOf(territory).stream().filter(this::hasUnit).findFirst();
    }

    public boolean isOccupied(Territory territory) {
        return occupiedPart(territory).isPresent();
    }

    /** Every occupied part in part index order. */
    public List<Part> unitParts() {
        return map.getParts().stream().filter(this::hasUnit).toList();
    }

    public List<Part> units(String player) {
        int index = indexOf(player);
        return map.getParts().stream().filter(p -> unitOwner[p.index()] == index).toList();
    }

    public int unitCount(String player) {
        return units(player).size();
    }

    // ── centers ─────────────────────────────────────────────────────────

    public Optional<String> centerOwner(Territory territory) {
        return nameOf(centerOwner[territory.index()]);
    }

    public List<Territory> centers(String player) {
        int index = indexOf(player);
        return map.getTerritories().stream().filter(t -> centerOwner[t.index()] == index).toList();
    }

    public int centerCount(String player) {
        return centers(player).size();
    }

    /** A player with neither units nor centers is out of the game. */
    public boolean isEliminated(String player) {
        return unitCount(player) == 0 && centerCount(player) == 0;
    }

    public List<String> activePlayers() {
        return players.stream().map(PlayerState::name).filter(name -> !isEliminated(name)).toList();
    }

    private int indexOf(String player) {
        return findPlayer(player).map(PlayerState::index).orElse(NONE);
    }

    private Optional<String> nameOf(int index) {
        return index == NONE ? Optional.empty() : Optional.of(players.get(index).name());
    }

    @Override
    public String toString() {
        return getPhaseLabel() + " " + status + " units=" + unitParts().size();
    }

    /**
     * Builds the next snapshot. Only reachable through {@link GameState#edit()} or
     * {@link GameState#initial(MapGraph)}.
     */
    public static final class Editor {

        private final MapGraph map;
        private final List<PlayerState> players;
        private final int[] unitOwner;
        private final int[] centerOwner;
        private int phaseCount = 1;
        private PhaseKind phaseKind = PhaseKind.MOVE;
        private GameStatus status = GameStatus.IN_PROGRESS;
        private String winner;
        private List<Dislodgement> dislodged = List.of();

        private Editor(MapGraph map, List<PlayerState> players) {
            this.map = map;
            this.players = players;
            this.unitOwner = new int[map.getParts().size()];
            this.centerOwner = new int[map.getTerritories().size()];
            Arrays.fill(unitOwner, NONE);
            Arrays.fill(centerOwner, NONE);
        }

        private Editor(GameState state) {
            this.map = state.map;
            this.players = state.players;
            this.unitOwner = state.unitOwner.clone();
            this.centerOwner = state.centerOwner.clone();
            this.phaseCount = state.phaseCount;
            this.phaseKind = state.phaseKind;
            this.status = state.status;
            this.winner = state.winner;
            this.dislodged = state.dislodged;
        }

        /**
         * @throws IllegalStateException if the territory of {@code part} already holds a unit
         */
        public Editor placeUnit(Part part, String player) {
            Territory territory = map.territoryOf(part);
            for (Part other : map.partsOf(territory)) {
                if (unitOwner[other.index()] != NONE) {
                    throw new IllegalStateException("Territory " + territory.id() + " already holds a unit on " + other.id());
                }
            }
            unitOwner[part.index()] = playerIndex(player);
            return this;
        }

        public Editor removeUnit(Part part) {
            unitOwner[part.index()] = NONE;
            return this;
        }

        public Editor clearUnits() {
            Arrays.fill(unitOwner, NONE);
            return this;
        }

        public Editor setCenterOwner(Territory territory, String player) {
            centerOwner[territory.index()] = player == null ? NONE : playerIndex(player);
            return this;
        }

        public Editor phase(int count, PhaseKind kind) {
            this.phaseCount = count;
            this.phaseKind = kind;
            return this;
        }

        public Editor status(GameStatus status, String winner) {
            this.status = status;
            this.winner = winner;
            return this;
        }

        public Editor dislodged(List<Dislodgement> dislodged) {
            this.dislodged = dislodged;
            return this;
        }

        public GameState build() {
            return new GameState(this);
        }

        private int playerIndex(String player) {
            return players.stream()
                    .filter(p -> p.name().equals(player))
                    .mapToInt(PlayerState::index)
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown player: " + player));
        }
    }
}
