package io.github.eutro.mirlens.core.cfg;

import io.github.eutro.mirlens.core.index.Indices;
import io.github.eutro.mirlens.core.ir.FunctionBody;
import io.github.eutro.mirlens.core.ir.MalformedIrException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A whole program: named functions sharing one set of {@link Indices}.
 */
public final class Program {
    public final String name;
    public final Indices indices;
    private final List<Function> functions = new ArrayList<>();

    public Program(String name, Indices indices) {
        this.name = name;
        this.indices = indices;
    }

    /**
     * Add a function to this program.
     *
     * @param name The function name.
     * @param body The function body.
     * @return The new function.
     */
    public Function addFunction(String name, FunctionBody body) {
        Function func = new Function(name, body, indices);
        functions.add(func);
        return func;
    }

    public List<Function> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    /**
     * Get a function by index.
     *
     * @param index The index.
     * @return The function.
     * @throws MalformedIrException If there is no such function.
     */
    public Function getFunction(int index) {
        if (index < 0 || index >= functions.size()) {
            throw new MalformedIrException("function " + index + " out of range, program has " + functions.size());
        }
        return functions.get(index);
    }
}
