package io.github.eutro.spv2sl.tracker;

import io.github.eutro.spv2sl.ssa.BasicBlock;
import io.github.eutro.spv2sl.ssa.Var;

import java.util.*;

/**
 * The decisions accumulated over the passes of a compilation: values that must be bound to temporaries, and
 * loop headers whose loops must be emitted in the generic shape.
 * <p>
 * Decisions are only ever added. A pass reads the decisions of the passes before it and records new ones in a
 * {@link Recorder}, which only take effect on the next pass.
 */
public final class Decisions {
    public static final Decisions NONE = new Decisions(Collections.emptySet(), Collections.emptySet());

    private final Set<Var> forcedTemporaries;
    private final Set<BasicBlock> nonOptimizableBlocks;

    private Decisions(Set<Var> forcedTemporaries, Set<BasicBlock> nonOptimizableBlocks) {
        this.forcedTemporaries = Collections.unmodifiableSet(forcedTemporaries);
        this.nonOptimizableBlocks = Collections.unmodifiableSet(nonOptimizableBlocks);
    }

    public boolean isForcedTemporary(Var value) {
        return forcedTemporaries.contains(value);
    }

    public boolean isNonOptimizable(BasicBlock block) {
        return nonOptimizableBlocks.contains(block);
    }

    public Set<Var> getForcedTemporaries() {
        return forcedTemporaries;
    }

    public Set<BasicBlock> getNonOptimizableBlocks() {
        return nonOptimizableBlocks;
    }

    public int size() {
        return forcedTemporaries.size() + nonOptimizableBlocks.size();
    }

    public Recorder recorder() {
        return new Recorder(this);
    }

    @Override
    public String toString() {
        return "Decisions{temporaries=" + forcedTemporaries + ", nonOptimizable=" + nonOptimizableBlocks.size() + "}";
    }

    /**
     * Collects the decisions made during one pass.
     */
    public static final class Recorder {
        private final Decisions base;
        private final Set<Var> forcedTemporaries = new LinkedHashSet<>();
        private final Set<BasicBlock> nonOptimizableBlocks = new LinkedHashSet<>();
        private final List<String> log = new ArrayList<>();

        private Recorder(Decisions base) {
            this.base = base;
        }

        /**
         * Record that a value must be bound to a temporary.
         *
         * @param value  The value.
         * @param reason Why, for the decision log.
         * @return Whether this is a new decision.
         */
        public boolean forceTemporary(Var value, String reason) {
            if (base.isForcedTemporary(value) || !forcedTemporaries.add(value)) return false;
            log.add("temporary " + value.identifier() + ": " + reason);
            return true;
        }

        /**
         * Record that a loop header cannot be emitted in an optimized shape.
         *
         * @param header The loop header.
         * @param reason Why, for the decision log.
         * @return Whether this is a new decision.
         */
        public boolean markNonOptimizable(BasicBlock header, String reason) {
            if (base.isNonOptimizable(header) || !nonOptimizableBlocks.add(header)) return false;
            log.add("complex loop " + header.toTargetString() + ": " + reason);
            return true;
        }

        public boolean isEmpty() {
            return log.isEmpty();
        }

        /**
         * Get the decisions of this pass, in the order they were made.
         *
         * @return The descriptions of the decisions.
         */
        public List<String> getLog() {
            return Collections.unmodifiableList(log);
        }

        /**
         * Combine the decisions of this pass with those it started from.
         *
         * @return The accumulated decisions.
         */
        public Decisions snapshot() {
            if (isEmpty()) return base;
            Set<Var> temporaries = new LinkedHashSet<>(base.forcedTemporaries);
            temporaries.addAll(forcedTemporaries);
            Set<BasicBlock> blocks = new LinkedHashSet<>(base.nonOptimizableBlocks);
            blocks.addAll(nonOptimizableBlocks);
            return new Decisions(temporaries, blocks);
        }
    }
}
