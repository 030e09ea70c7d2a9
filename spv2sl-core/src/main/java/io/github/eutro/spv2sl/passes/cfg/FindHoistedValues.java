package io.github.eutro.spv2sl.passes.cfg;

import io.github.eutro.spv2sl.ext.CommonExts;
import io.github.eutro.spv2sl.ext.CommonExts.LoopInfo;
import io.github.eutro.spv2sl.ext.MetadataState;
import io.github.eutro.spv2sl.ops.CommonOps;
import io.github.eutro.spv2sl.passes.InPlaceIRPass;
import io.github.eutro.spv2sl.ssa.*;
import io.github.eutro.spv2sl.util.IRUtils;

import java.util.*;

/**
 * Finds values defined inside a loop and read after it.
 * <p>
 * Such a value cannot be declared where it is defined, since the loop body is a scope of its own, so it is
 * declared ahead of the outermost loop it escapes and only assigned at its definition.
 */
public class FindHoistedValues implements InPlaceIRPass<Function> {
    public static final FindHoistedValues INSTANCE = new FindHoistedValues();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.LOOPS, MetadataState.USES);

        List<LoopInfo> loops = new ArrayList<>();
        for (BasicBlock block : func.blocks) {
            LoopInfo loop = block.getNullable(CommonExts.LOOP_INFO);
            if (loop != null) {
                loop.hoisted.clear();
                loops.add(loop);
            }
            for (Effect effect : block.getEffects()) {
                for (Var var : effect.getAssignsTo()) {
                    var.removeExt(CommonExts.HOISTED_BEFORE);
                }
            }
        }
        loops.sort(Comparator.comparingInt((LoopInfo l) -> l.body.size()).reversed());

        for (LoopInfo loop : loops) {
            for (BasicBlock block : loop.body) {
                for (Effect effect : block.getEffects()) {
                    if (effect.insn().op.key == CommonOps.PHI) continue;
                    Var result = effect.result();
                    if (result == null
                            || result.getType().isPointer()
                            || result.getNullable(CommonExts.HOISTED_BEFORE) != null) {
                        continue;
                    }
                    if (escapes(result, loop)) {
                        result.attachExt(CommonExts.HOISTED_BEFORE, loop.header);
                        loop.hoisted.add(result);
                    }
                }
            }
        }

        ms.validate(MetadataState.HOISTED);
    }

    private static boolean escapes(Var value, LoopInfo loop) {
        for (Insn use : IRUtils.usesOf(value)) {
            if (use.op.key == CommonOps.PHI) {
                // a phi reads its operand on the edge from the matching predecessor
                List<BasicBlock> preds = CommonOps.PHI.cast(use.op).arg;
                List<Var> args = use.args();
                for (int i = 0; i < args.size(); i++) {
                    if (args.get(i) == value && !loop.contains(preds.get(i))) return true;
                }
                continue;
            }
            BasicBlock block = IRUtils.owningBlock(use);
            if (block != null && !loop.contains(block)) return true;
        }
        return false;
    }
}
