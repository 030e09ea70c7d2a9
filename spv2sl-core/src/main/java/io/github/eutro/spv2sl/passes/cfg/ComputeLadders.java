package io.github.eutro.spv2sl.passes.cfg;

import io.github.eutro.spv2sl.ext.CommonExts;
import io.github.eutro.spv2sl.ext.CommonExts.LoopInfo;
import io.github.eutro.spv2sl.ext.MetadataState;
import io.github.eutro.spv2sl.ops.CommonOps;
import io.github.eutro.spv2sl.passes.InPlaceIRPass;
import io.github.eutro.spv2sl.ssa.BasicBlock;
import io.github.eutro.spv2sl.ssa.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Decides, before any emission, which switches need a ladder variable.
 * <p>
 * A {@code break} inside a switch only leaves the switch, so a case that exits the enclosing loop has to
 * set a flag that is tested right after the switch closes. Switches nested in such a switch need the
 * outer switch to carry a ladder as well, since the test after the inner switch is itself inside the outer one.
 */
public class ComputeLadders implements InPlaceIRPass<Function> {
    private static final Logger LOGGER = LogManager.getLogger(ComputeLadders.class);

    public static final ComputeLadders INSTANCE = new ComputeLadders();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.LOOPS);

        for (BasicBlock block : func.blocks) {
            block.removeExt(CommonExts.LADDER_BREAK);
        }
        for (BasicBlock block : func.blocks) {
            if (block.getControl().insn().op.key != CommonOps.SWITCH) continue;
            BasicBlock loopHeader = block.getNullable(CommonExts.LOOP_DOMINATOR);
            if (loopHeader == null || block.getMergeBlock() == null) continue;
            if (breaksOutOfLoop(block, loopHeader.getExtOrThrow(CommonExts.LOOP_INFO))) {
                LOGGER.debug("switch {} needs a ladder to break out of loop {}",
                        block.toTargetString(), loopHeader.toTargetString());
                block.attachExt(CommonExts.LADDER_BREAK, loopHeader);
            }
        }

        ms.validate(MetadataState.LADDERS);
    }

    private static boolean breaksOutOfLoop(BasicBlock switchHeader, LoopInfo loop) {
        BasicBlock loopMerge = Objects.requireNonNull(loop.header.getMergeBlock());
        Set<BasicBlock> stop = new HashSet<>(Arrays.asList(
                switchHeader.getMergeBlock(),
                loopMerge,
                loop.header,
                loop.header.getContinueBlock()));
        Set<BasicBlock> seen = new HashSet<>();
        Deque<BasicBlock> queue = new ArrayDeque<>(switchHeader.getControl().targets);
        while (!queue.isEmpty()) {
            BasicBlock block = queue.removeFirst();
            if (block == loopMerge) return true;
            if (stop.contains(block) || !seen.add(block)) continue;
            if (block.isLoopHeader()) {
                // breaks from a nested loop only leave that loop
                queue.addLast(Objects.requireNonNull(block.getMergeBlock()));
                continue;
            }
            queue.addAll(block.getControl().targets);
        }
        return false;
    }
}
