package io.github.eutro.spv2sl.passes.cfg;

import io.github.eutro.spv2sl.ext.CommonExts;
import io.github.eutro.spv2sl.ext.CommonExts.LoopInfo;
import io.github.eutro.spv2sl.ops.CommonOps;
import io.github.eutro.spv2sl.ops.ShaderOps;
import io.github.eutro.spv2sl.ssa.*;
import io.github.eutro.spv2sl.tracker.Decisions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Picks the shape a structured loop is rendered as, from the shape of its control-flow graph.
 * <p>
 * The classification is optimistic: a loop whose test or increment turns out to need statements when
 * emitted is marked non-optimizable, and is classified {@link LoopShape.Kind#COMPLEX} on the next pass.
 */
public class LoopClassifier {
    private static final Logger LOGGER = LogManager.getLogger(LoopClassifier.class);

    private final Decisions decisions;

    public LoopClassifier(Decisions decisions) {
        this.decisions = decisions;
    }

    public LoopShape classify(BasicBlock header) {
        LoopShape shape = doClassify(header);
        LOGGER.debug("loop {} is {}", header.toTargetString(), shape);
        return shape;
    }

    private LoopShape doClassify(BasicBlock header) {
        LoopInfo loop = header.getExtOrThrow(CommonExts.LOOP_INFO);
        BasicBlock merge = Objects.requireNonNull(header.getMergeBlock());
        BasicBlock cont = Objects.requireNonNull(header.getContinueBlock());
        if (decisions.isNonOptimizable(header) || cont == header) return LoopShape.COMPLEX;

        Insn ctrl = header.getControl().insn();
        List<BasicBlock> targets = header.getControl().targets;

        if (ctrl.op == CommonOps.BR_IF) {
            // the header is the test: for (; cond; ) or while (cond)
            LoopShape shape = testFirst(loop, header, header, merge, cont);
            if (shape != null) return shape;
        } else if (ctrl.op == CommonOps.BR) {
            BasicBlock next = targets.get(0);
            if (next != cont && next != merge && loop.contains(next)
                    && next.getPhis().isEmpty()
                    && next.getMergeKind() == BasicBlock.MergeKind.NONE
                    && next.getControl().insn().op == CommonOps.BR_IF) {
                LoopShape shape = testFirst(loop, header, next, merge, cont);
                if (shape != null) return shape;
            }
            LoopShape shape = doWhile(header, merge, cont);
            if (shape != null) return shape;
        }
        return LoopShape.COMPLEX;
    }

    private static LoopShape testFirst(LoopInfo loop, BasicBlock header, BasicBlock test,
                                       BasicBlock merge, BasicBlock cont) {
        List<BasicBlock> targets = test.getControl().targets;
        BasicBlock ifTrue = targets.get(0);
        BasicBlock ifFalse = targets.get(1);
        boolean exitOnTrue;
        BasicBlock body;
        if (ifFalse == merge && ifTrue != merge) {
            exitOnTrue = false;
            body = ifTrue;
        } else if (ifTrue == merge && ifFalse != merge) {
            exitOnTrue = true;
            body = ifFalse;
        } else {
            return null;
        }
        if (body == header) return null;
        if (!merge.getPhis().isEmpty() || !body.getPhis().isEmpty()) return null;
        if (!isSideEffectFree(loop, header) || test != header && !isSideEffectFree(loop, test)) return null;
        if (!isIncrement(loop, header, test, cont)) return null;
        boolean hasIncrement = hasNonPhiEffects(cont);
        LoopShape.Kind kind = hasIncrement || !header.getPhis().isEmpty()
                ? LoopShape.Kind.FOR_LOOP
                : LoopShape.Kind.WHILE_LOOP;
        return new LoopShape(kind, test, body, exitOnTrue);
    }

    private static LoopShape doWhile(BasicBlock header, BasicBlock merge, BasicBlock cont) {
        if (!header.getPhis().isEmpty() || !merge.getPhis().isEmpty()) return null;
        if (cont.getControl().insn().op != CommonOps.BR_IF) return null;
        if (cont.getMergeKind() != BasicBlock.MergeKind.NONE) return null;
        List<BasicBlock> targets = cont.getControl().targets;
        if (targets.get(0) == header && targets.get(1) == merge) {
            return new LoopShape(LoopShape.Kind.DO_WHILE, cont, header, false);
        }
        if (targets.get(0) == merge && targets.get(1) == header) {
            return new LoopShape(LoopShape.Kind.DO_WHILE, cont, header, true);
        }
        return null;
    }

    private static boolean hasNonPhiEffects(BasicBlock block) {
        return block.getEffects().size() > block.getPhis().size();
    }

    /**
     * Whether a block only computes values, so that it can become the loop condition.
     */
    private static boolean isSideEffectFree(LoopInfo loop, BasicBlock block) {
        for (Effect effect : block.getEffects()) {
            if (!CommonExts.isPure(effect.insn().op.key)) return false;
            Var result = effect.result();
            if (result != null && loop.hoisted.contains(result)) return false;
        }
        return true;
    }

    /**
     * Whether the continue block can become the increment clause.
     */
    private static boolean isIncrement(LoopInfo loop, BasicBlock header, BasicBlock test, BasicBlock cont) {
        if (cont == header || cont == test) return false;
        Control ctrl = cont.getControl();
        if (ctrl.insn().op != CommonOps.BR || ctrl.targets.get(0) != header) return false;
        if (cont.getMergeKind() != BasicBlock.MergeKind.NONE) return false;
        for (Effect effect : cont.getEffects()) {
            Insn insn = effect.insn();
            if (insn.op.key == CommonOps.PHI) continue;
            if (insn.op != ShaderOps.STORE && !CommonExts.isPure(insn.op.key)) return false;
            for (Var arg : insn.args()) {
                Effect def = arg.getNullable(CommonExts.ASSIGNED_AT);
                BasicBlock defBlock = def == null ? null : def.getNullable(CommonExts.OWNING_BLOCK);
                if (defBlock == null || defBlock == cont || defBlock == header || defBlock == test) continue;
                // values from the body may not have been computed on every path to the increment
                if (loop.contains(defBlock)) return false;
            }
        }
        return true;
    }
}
