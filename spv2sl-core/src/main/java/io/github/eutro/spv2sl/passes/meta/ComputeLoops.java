package io.github.eutro.spv2sl.passes.meta;

import io.github.eutro.spv2sl.compile.MalformedInputException;
import io.github.eutro.spv2sl.ext.CommonExts;
import io.github.eutro.spv2sl.ext.CommonExts.LoopInfo;
import io.github.eutro.spv2sl.ext.MetadataState;
import io.github.eutro.spv2sl.ops.CommonOps;
import io.github.eutro.spv2sl.ops.ShaderOps;
import io.github.eutro.spv2sl.passes.InPlaceIRPass;
import io.github.eutro.spv2sl.ssa.*;
import io.github.eutro.spv2sl.util.GraphWalker;
import io.github.eutro.spv2sl.util.IRUtils;

import java.util.*;

/**
 * Computes a {@link LoopInfo} for every loop header, and {@link CommonExts#LOOP_DOMINATOR} for every block
 * inside a loop.
 * <p>
 * The body of a loop is every block reachable from its header, without going through its merge block,
 * that the header dominates.
 */
public class ComputeLoops implements InPlaceIRPass<Function> {
    public static final ComputeLoops INSTANCE = new ComputeLoops();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.DOMS);

        List<LoopInfo> loops = new ArrayList<>();
        for (BasicBlock block : func.blocks) {
            block.removeExt(CommonExts.LOOP_INFO);
            block.removeExt(CommonExts.LOOP_DOMINATOR);
        }
        for (BasicBlock block : func.blocks) {
            if (!block.isLoopHeader()) continue;
            if (block != func.getEntry() && block.getNullable(CommonExts.IDOM) == null) continue; // unreachable
            LoopInfo info = computeLoop(block);
            block.attachExt(CommonExts.LOOP_INFO, info);
            loops.add(info);
        }

        // outer loops first, so inner loops overwrite the loop dominator of their blocks
        loops.sort(Comparator.comparingInt((LoopInfo l) -> l.body.size()).reversed());
        for (LoopInfo loop : loops) {
            for (BasicBlock block : loop.body) {
                block.attachExt(CommonExts.LOOP_DOMINATOR, loop.header);
            }
        }

        ms.validate(MetadataState.LOOPS);
    }

    private static LoopInfo computeLoop(BasicBlock header) {
        BasicBlock merge = Objects.requireNonNull(header.getMergeBlock());
        BasicBlock cont = header.getContinueBlock();
        if (cont == null) {
            throw new MalformedInputException("loop header has no continue block", header);
        }
        LoopInfo info = new LoopInfo(header);
        for (BasicBlock block : GraphWalker.blockWalker(header, Collections.singleton(merge)).preOrder()) {
            if (ComputeDoms.dominates(header, block)) {
                info.body.add(block);
            }
        }
        if (!info.body.contains(cont)) {
            throw new MalformedInputException("continue block " + cont.toTargetString()
                    + " is not reachable from its loop header", header);
        }
        boolean hasBackEdge = false;
        for (BasicBlock block : info.body) {
            if (block.getControl().targets.contains(header)) {
                hasBackEdge = true;
            }
            for (Effect effect : block.getEffects()) {
                Insn insn = effect.insn();
                if (insn.op == ShaderOps.STORE) {
                    Variable root = IRUtils.rootVariable(insn.arg(0));
                    if (root != null) info.storedVariables.add(root);
                } else if (insn.op.key == ShaderOps.CALL) {
                    // callees may write through pointer arguments
                    for (Var arg : insn.args()) {
                        if (!arg.getType().isPointer()) continue;
                        Variable root = IRUtils.rootVariable(arg);
                        if (root != null) info.storedVariables.add(root);
                    }
                } else if (insn.op.key == CommonOps.PHI) {
                    for (Var var : effect.getAssignsTo()) {
                        info.storedVariables.add(IRUtils.phiVariable(var));
                    }
                }
            }
        }
        if (!hasBackEdge) {
            throw new MalformedInputException("loop has no back edge to its header", header);
        }
        return info;
    }
}
