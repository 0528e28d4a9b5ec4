package io.github.eutro.mirlens.core.passes.meta;

import io.github.eutro.mirlens.core.analysis.LifetimeIndex;
import io.github.eutro.mirlens.core.analysis.LocalLifetime;
import io.github.eutro.mirlens.core.analysis.SourceRange;
import io.github.eutro.mirlens.core.cfg.Function;
import io.github.eutro.mirlens.core.ext.CommonExts;
import io.github.eutro.mirlens.core.ext.MetadataState;
import io.github.eutro.mirlens.core.index.SpanIndex;
import io.github.eutro.mirlens.core.index.SpanInfo;
import io.github.eutro.mirlens.core.ir.FunctionBody;
import io.github.eutro.mirlens.core.ir.Location;
import io.github.eutro.mirlens.core.ir.Statement;
import io.github.eutro.mirlens.core.passes.InPlaceIRPass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes {@link CommonExts#LIFETIMES}.
 * <p>
 * Loops can emit several scope markers for one local, so the first
 * {@link Statement.StorageLive} and the last {@link Statement.StorageDead}
 * in program order are taken, giving the widest range.
 */
public class ComputeLifetimes implements InPlaceIRPass<Function> {
    private static final Logger logger = LogManager.getLogger(ComputeLifetimes.class);
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeLifetimes INSTANCE = new ComputeLifetimes();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);

        FunctionBody body = func.body;
        int n = body.locals.size();
        Location[] live = new Location[n];
        Location[] dead = new Location[n];
        for (int b = 0; b < body.blocks.size(); b++) {
            List<Statement> statements = body.blocks.get(b).statements;
            for (int s = 0; s < statements.size(); s++) {
                Statement stmt = statements.get(s);
                if (stmt instanceof Statement.StorageLive) {
                    int local = ((Statement.StorageLive) stmt).local;
                    if (isDeclared(func, local) && live[local] == null) {
                        live[local] = Location.of(b, s);
                    }
                } else if (stmt instanceof Statement.StorageDead) {
                    int local = ((Statement.StorageDead) stmt).local;
                    if (isDeclared(func, local)) {
                        dead[local] = Location.of(b, s);
                    }
                }
            }
        }

        List<LocalLifetime> lifetimes = new ArrayList<>(n);
        int resolved = 0;
        for (int local = 0; local < n; local++) {
            SourceRange range = sourceRange(body, func.indices.spans, live[local], dead[local]);
            if (range != null) resolved++;
            lifetimes.add(new LocalLifetime(local, live[local], dead[local], range));
        }
        logger.debug("{}: {} of {} locals have source ranges", func.name, resolved, n);
        func.attachExt(CommonExts.LIFETIMES, new LifetimeIndex(lifetimes));

        ms.validate(MetadataState.LIFETIMES);
    }

    private static boolean isDeclared(Function func, int local) {
        if (local < func.body.locals.size()) return true;
        logger.trace("{}: storage marker for undeclared local _{}", func.name, local);
        return false;
    }

    private static @Nullable SourceRange sourceRange(FunctionBody body,
                                                     SpanIndex spans,
                                                     @Nullable Location live,
                                                     @Nullable Location dead) {
        if (live == null || dead == null) return null;
        SpanInfo start = spans.getNullable(body.spanAt(live));
        SpanInfo end = spans.getNullable(body.spanAt(dead));
        if (start == null || end == null || !start.file.equals(end.file)) return null;
        return new SourceRange(start.lineStart, start.colStart, end.lineEnd, end.colEnd);
    }
}
