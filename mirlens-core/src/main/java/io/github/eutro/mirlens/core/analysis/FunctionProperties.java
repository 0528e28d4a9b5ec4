package io.github.eutro.mirlens.core.analysis;

import java.util.ArrayList;
import java.util.List;

/**
 * Notable properties of a function, for a one-glance summary.
 */
public final class FunctionProperties {
    public boolean hasPanicPath;
    public boolean hasCheckedOps;
    public boolean hasBorrows;
    public boolean hasDrops;
    public boolean hasRecursion;
    public boolean hasAssertions;
    public boolean hasSwitches;

    /**
     * Describe the properties that hold, in a fixed order.
     *
     * @return The descriptions.
     */
    public List<String> describe() {
        List<String> result = new ArrayList<>();
        if (hasPanicPath) result.add("Contains panic path");
        if (hasCheckedOps) result.add("Uses checked arithmetic");
        if (hasBorrows) result.add("Introduces borrows");
        if (hasDrops) result.add("Has explicit drops");
        if (hasRecursion) result.add("Recursive");
        if (hasAssertions) result.add("Contains assertions");
        if (hasSwitches) result.add("Has conditional branches");
        return result;
    }

    @Override
    public String toString() {
        return String.join(", ", describe());
    }
}
