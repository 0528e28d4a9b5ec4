package io.github.eutro.mirlens.core.passes.misc;

import io.github.eutro.mirlens.core.cfg.Function;
import io.github.eutro.mirlens.core.cfg.Program;
import io.github.eutro.mirlens.core.passes.IRPass;
import io.github.eutro.mirlens.core.passes.InPlaceIRPass;

/**
 * Lifts passes which operate on smaller parts of a program into ones that operate on bigger parts.
 */
public class ForPass {
    /**
     * Lift a function pass to operate on every function of a program.
     *
     * @param pass The function pass. It must be in-place.
     * @return The program pass.
     */
    public static Functions liftFunctions(IRPass<Function, Function> pass) {
        if (!pass.isInPlace()) throw new IllegalArgumentException("function passes must be in-place");
        return new Functions(pass);
    }

    /**
     * A function pass lifted to operate on a full program.
     */
    public static class Functions implements InPlaceIRPass<Program> {
        private final IRPass<Function, Function> pass;

        private Functions(IRPass<Function, Function> pass) {
            this.pass = pass;
        }

        @Override
        public void runInPlace(Program program) {
            for (Function func : program.getFunctions()) {
                try {
                    pass.run(func);
                } catch (RuntimeException e) {
                    e.addSuppressed(new RuntimeException("in function " + func.name));
                    throw e;
                }
            }
        }
    }
}
