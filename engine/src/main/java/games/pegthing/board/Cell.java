package games.pegthing.board;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A single hole on the board: whether it holds a peg, and the jumps that land in or leave from it.
 * <p>
 * Connections map a landing destination to the position jumped to get there. They are fixed
 * when the board is built and shared by every cell derived through {@link #withPegged(boolean)}.
 */
public final class Cell {
    private final boolean pegged;
    private final SortedMap<Integer, Integer> connections;

    /**
     * Creates a cell owning a snapshot of {@code connections}.
     *
     * @param pegged      initial peg state
     * @param connections destination -> jumped position; must not be null
     */
    public Cell(boolean pegged, SortedMap<Integer, Integer> connections) {
        Objects.requireNonNull(connections, "connections");
        this.pegged = pegged;
        this.connections = Collections.unmodifiableSortedMap(new TreeMap<>(connections));
    }

    private Cell(Cell source, boolean pegged) {
        this.pegged = pegged;
        this.connections = source.connections;
    }

    public boolean isPegged() {
        return pegged;
    }

    /**
     * Returns the unmodifiable destination -> jumped map for this hole.
     */
    public SortedMap<Integer, Integer> getConnections() {
        return connections;
    }

    /**
     * Same hole with a different peg state.
     */
    public Cell withPegged(boolean pegged) {
        if (pegged == this.pegged) {
            return this;
        }
        return new Cell(this, pegged);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cell)) {
            return false;
        }
        Cell other = (Cell) o;
        return pegged == other.pegged && connections.equals(other.connections);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pegged, connections);
    }

    @Override
    public String toString() {
        return "Cell(pegged=" + pegged + ", connections=" + connections + ")";
    }
}
