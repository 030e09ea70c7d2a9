package io.github.eutro.spv2sl.tracker;

import io.github.eutro.spv2sl.compile.CompilerOptions;
import io.github.eutro.spv2sl.compile.MalformedInputException;
import io.github.eutro.spv2sl.emit.ExpressionResolver;
import io.github.eutro.spv2sl.emit.StatementSink;
import io.github.eutro.spv2sl.ext.CommonExts;
import io.github.eutro.spv2sl.ops.CommonOps;
import io.github.eutro.spv2sl.ops.ShaderOps;
import io.github.eutro.spv2sl.ssa.*;
import io.github.eutro.spv2sl.util.IRUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Decides, within one pass, which values are forwarded into their uses and which are bound to temporaries,
 * and notices when a forwarding decision turns out to be wrong.
 * <p>
 * Wrong decisions are never fixed within the pass that made them. They are recorded, and a recompile is
 * requested so the next pass makes the right decision from the start.
 */
public class ExpressionTracker implements ExpressionResolver {
    private static final Logger LOGGER = LogManager.getLogger(ExpressionTracker.class);

    private final CompilerOptions options;
    private final Decisions decisions;
    private final Decisions.Recorder recorder;
    private final StatementSink sink;

    private final Map<Var, ValueState> states = new HashMap<>();
    private final Map<Variable, Set<Var>> dependents = new HashMap<>();

    public ExpressionTracker(CompilerOptions options, Decisions decisions, Decisions.Recorder recorder, StatementSink sink) {
        this.options = options;
        this.decisions = decisions;
        this.recorder = recorder;
        this.sink = sink;
    }

    public Decisions getDecisions() {
        return decisions;
    }

    /**
     * Whether a value may be rendered as its defining expression at its uses.
     *
     * @param value The value.
     * @param depth The forwarding depth the value would have, see {@link #forwardDepth(Collection)}.
     * @return Whether to forward it.
     */
    public boolean shouldForward(Var value, int depth) {
        if (value.getType().isPointer()) return true; // pointers cannot be stored in temporaries
        if (options.forceTemporary || decisions.isForcedTemporary(value)) return false;
        if (value.getNullable(CommonExts.HOISTED_BEFORE) != null) return false;
        Effect def = value.getNullable(CommonExts.ASSIGNED_AT);
        if (def != null) {
            Insn insn = def.insn();
            if (insn.op.key == ShaderOps.CALL) return false;
            if (insn.op == ShaderOps.LOAD) {
                Variable root = IRUtils.rootVariable(insn.arg(0));
                if (root != null && root.isVolatile) return false;
            }
        }
        return depth <= options.maxForwardDepth;
    }

    /**
     * Get the depth a forwarded expression with these arguments would have.
     *
     * @param args The arguments.
     * @return The depth.
     */
    public int forwardDepth(Collection<Var> args) {
        int depth = 0;
        for (Var arg : args) {
            ValueState state = states.get(arg);
            if (state != null) depth = Math.max(depth, state.depth);
        }
        return depth + 1;
    }

    /**
     * Record that a value is rendered as an expression.
     *
     * @param value          The value.
     * @param text           The expression.
     * @param args           The values the expression was built from.
     * @param extraDeps      Variables read by the expression itself.
     * @param needsTranspose Whether the expression is the transpose of the value.
     * @return The state of the value.
     */
    public ValueState forward(Var value, String text, Collection<Var> args, Set<Variable> extraDeps, boolean needsTranspose) {
        Set<Variable> deps = new LinkedHashSet<>(extraDeps);
        for (Var arg : args) {
            ValueState state = states.get(arg);
            if (state != null && state.kind != ValueState.Kind.TEMPORARY) deps.addAll(state.dependencies);
        }
        ValueState state = new ValueState(value, ValueState.Kind.FORWARDED, text, deps, needsTranspose,
                forwardDepth(args), isTrivial(value));
        put(state);
        LOGGER.trace("forwarded {} as {}", value, text);
        return state;
    }

    /**
     * Record that a value is held in a temporary named by its {@link Var#identifier()}.
     *
     * @param value          The value.
     * @param needsTranspose Whether the temporary holds the transpose of the value.
     * @return The state of the value.
     */
    public ValueState bindTemporary(Var value, boolean needsTranspose) {
        ValueState state = new ValueState(value, ValueState.Kind.TEMPORARY, value.identifier(),
                Collections.emptySet(), needsTranspose, 0, true);
        put(state);
        return state;
    }

    /**
     * Record that a phi result is held in its variable.
     *
     * @param value    The phi result.
     * @param variable The variable of the phi.
     * @return The state of the value.
     */
    public ValueState bindPhi(Var value, Variable variable) {
        Set<Variable> deps = new LinkedHashSet<>();
        deps.add(variable);
        ValueState state = new ValueState(value, ValueState.Kind.PHI, variable.name, deps, false, 0, true);
        put(state);
        return state;
    }

    private void put(ValueState state) {
        states.put(state.value, state);
        if (state.kind == ValueState.Kind.FORWARDED) {
            for (Variable dep : state.dependencies) {
                dependents.computeIfAbsent(dep, $ -> new LinkedHashSet<>()).add(state.value);
            }
        }
    }

    private static boolean isTrivial(Var value) {
        if (value.getType().isPointer()) return true;
        Effect def = value.getNullable(CommonExts.ASSIGNED_AT);
        if (def == null) return true;
        Insn insn = def.insn();
        if (insn.op.key == CommonOps.CONST || insn.op.key == CommonOps.ARG || insn.op.key == CommonOps.PHI) {
            return true;
        }
        if (insn.op == ShaderOps.LOAD) {
            // loading a whole variable just names it
            Effect ptrDef = insn.arg(0).getNullable(CommonExts.ASSIGNED_AT);
            return ptrDef != null && ptrDef.insn().op.key == ShaderOps.VARIABLE;
        }
        return false;
    }

    public @Nullable ValueState peek(Var value) {
        return states.get(value);
    }

    /**
     * Read a value at a use, counting the read.
     * <p>
     * Reading a forwarded value after one of its dependencies was written, or reading a non-trivial forwarded
     * value a second time, forces it to a temporary on the next pass.
     *
     * @param value The value.
     * @return The state of the value.
     * @throws MalformedInputException If the value has not been defined yet.
     */
    public ValueState read(Var value) {
        ValueState state = states.get(value);
        if (state == null) {
            throw new MalformedInputException("value used before its definition", value);
        }
        if (state.isForwarded()) {
            if (state.invalidated) {
                forceTemporary(value, "read after a write to " + names(state.dependencies));
            } else if (!state.trivial && ++state.readCount > 1) {
                forceTemporary(value, "read more than once");
            }
        }
        return state;
    }

    /**
     * Read a value at a use that needs the value itself, resolving any pending transpose.
     *
     * @param value The value.
     * @return The text.
     */
    public String readText(Var value) {
        ValueState state = read(value);
        return state.needsTranspose ? "transpose(" + state.text + ")" : state.text;
    }

    /**
     * Note a write to a variable. Forwarded expressions that read it become stale.
     *
     * @param variable The variable written.
     */
    public void invalidateOnWrite(Variable variable) {
        Set<Var> stale = dependents.remove(variable);
        if (stale == null) return;
        for (Var value : stale) {
            ValueState state = states.get(value);
            if (state != null && state.isForwarded()) state.invalidated = true;
        }
    }

    public void invalidateAll(Collection<Variable> variables) {
        for (Variable variable : variables) {
            invalidateOnWrite(variable);
        }
    }

    /**
     * Note a call, which may write to any variable outside the function.
     */
    public void invalidateGlobals() {
        List<Variable> globals = new ArrayList<>();
        for (Variable variable : dependents.keySet()) {
            if (!variable.isFunctionLocal()) globals.add(variable);
        }
        invalidateAll(globals);
    }

    /**
     * Force a value to a temporary on the next pass. Pointers cannot be temporaries, so the forwarded
     * indices they were built from are forced instead.
     *
     * @param value  The value.
     * @param reason Why.
     */
    public void forceTemporary(Var value, String reason) {
        if (value.getType().isPointer()) {
            Effect def = value.getNullable(CommonExts.ASSIGNED_AT);
            if (def == null) return;
            for (Var arg : def.insn().args()) {
                ValueState state = states.get(arg);
                if (state != null && state.isForwarded() && !state.dependencies.isEmpty()) {
                    forceTemporary(arg, reason + " (index of " + value.identifier() + ")");
                }
            }
            return;
        }
        if (recorder.forceTemporary(value, reason)) {
            LOGGER.debug("forcing {} to a temporary: {}", value, reason);
            sink.requestRecompile();
        }
    }

    /**
     * Mark a loop header as needing the generic loop shape on the next pass.
     *
     * @param header The loop header.
     * @param reason Why.
     */
    public void markNonOptimizable(BasicBlock header, String reason) {
        if (recorder.markNonOptimizable(header, reason)) {
            LOGGER.debug("loop {} is not optimizable: {}", header.toTargetString(), reason);
            sink.requestRecompile();
        }
    }

    @Override
    public String resolveExpressionText(Var value) {
        ValueState state = states.get(value);
        if (state == null) throw new IllegalStateException("value " + value + " has not been declared");
        return state.text;
    }

    private static String names(Set<Variable> variables) {
        StringJoiner sj = new StringJoiner(", ");
        for (Variable variable : variables) {
            sj.add(variable.name);
        }
        return sj.toString();
    }
}
