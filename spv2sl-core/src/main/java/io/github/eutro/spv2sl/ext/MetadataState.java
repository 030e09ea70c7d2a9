package io.github.eutro.spv2sl.ext;

import io.github.eutro.spv2sl.passes.IRPass;
import io.github.eutro.spv2sl.passes.cfg.ComputeLadders;
import io.github.eutro.spv2sl.passes.cfg.FindHoistedValues;
import io.github.eutro.spv2sl.passes.cfg.FindLoopVariables;
import io.github.eutro.spv2sl.passes.meta.ComputeDoms;
import io.github.eutro.spv2sl.passes.meta.ComputeLoops;
import io.github.eutro.spv2sl.passes.meta.ComputePreds;
import io.github.eutro.spv2sl.passes.meta.ComputeUses;
import io.github.eutro.spv2sl.ssa.Function;

import java.util.BitSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks which analyses of a {@link Function} are currently up to date.
 */
public class MetadataState {
    public static class MetaKind {
        private static final AtomicInteger COUNTER = new AtomicInteger();
        public final int id = COUNTER.getAndIncrement();
        public final String name;

        private MetaKind(String name) {
            this.name = name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A kind of metadata that can be recomputed by running passes.
     *
     * @param <T> The type of IR the passes run on.
     */
    public static class ComputableMetaKind<T> extends MetaKind {
        private final IRPass<T, T>[] passes;

        @SafeVarargs
        private ComputableMetaKind(String name, IRPass<T, T>... passes) {
            super(name);
            this.passes = passes;
        }

        void computeFor(T t) {
            for (IRPass<T, T> pass : passes) {
                if (!pass.isInPlace()) throw new IllegalArgumentException("pass " + pass + " is not in place");
                pass.run(t);
            }
        }
    }

    public static final ComputableMetaKind<Function>
            PREDS = new ComputableMetaKind<>("PREDS", ComputePreds.INSTANCE),
            DOMS = new ComputableMetaKind<>("DOMS", ComputeDoms.INSTANCE),
            USES = new ComputableMetaKind<>("USES", ComputeUses.INSTANCE),
            LOOPS = new ComputableMetaKind<>("LOOPS", ComputeLoops.INSTANCE),
            LADDERS = new ComputableMetaKind<>("LADDERS", ComputeLadders.INSTANCE),
            LOOP_VARIABLES = new ComputableMetaKind<>("LOOP_VARIABLES", FindLoopVariables.INSTANCE),
            HOISTED = new ComputableMetaKind<>("HOISTED", FindHoistedValues.INSTANCE);

    private final BitSet validSet = new BitSet();

    public boolean isValid(MetaKind kind) {
        return validSet.get(kind.id);
    }

    @SafeVarargs
    public final <T> void ensureValid(T t, ComputableMetaKind<T>... kinds) {
        for (ComputableMetaKind<T> kind : kinds) {
            if (!isValid(kind)) {
                kind.computeFor(t);
                validate(kind);
            }
        }
    }

    public void validate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, true);
        }
    }

    public void invalidate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, false);
        }
    }

    public void graphChanged() {
        invalidate(PREDS, DOMS, LOOPS, LADDERS);
        varsChanged();
    }

    public void varsChanged() {
        invalidate(USES, LOOP_VARIABLES, HOISTED);
    }
}
