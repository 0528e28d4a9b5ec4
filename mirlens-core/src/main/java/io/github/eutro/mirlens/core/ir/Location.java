package io.github.eutro.mirlens.core.ir;

import org.jetbrains.annotations.NotNull;

/**
 * A program point: a block, and a statement offset within it.
 * <p>
 * The offset equal to the number of statements in the block denotes its terminator.
 * Locations are ordered in program order, block first.
 */
public final class Location implements Comparable<Location> {
    /**
     * The block index.
     */
    public final int block;
    /**
     * The statement offset.
     */
    public final int statement;

    private Location(int block, int statement) {
        this.block = block;
        this.statement = statement;
    }

    /**
     * Create a location.
     *
     * @param block     The block index.
     * @param statement The statement offset.
     * @return The location.
     */
    public static Location of(int block, int statement) {
        if (block < 0 || statement < 0) {
            throw new MalformedIrException("negative location bb" + block + "[" + statement + "]");
        }
        return new Location(block, statement);
    }

    @Override
    public int compareTo(@NotNull Location o) {
        int c = Integer.compare(block, o.block);
        return c != 0 ? c : Integer.compare(statement, o.statement);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Location location = (Location) o;
        return block == location.block && statement == location.statement;
    }

    @Override
    public int hashCode() {
        return 31 * block + statement;
    }

    @Override
    public String toString() {
        return "bb" + block + "[" + statement + "]";
    }
}
