package io.github.eutro.spv2sl.passes.meta;

import io.github.eutro.spv2sl.ext.CommonExts;
import io.github.eutro.spv2sl.ext.MetadataState;
import io.github.eutro.spv2sl.passes.InPlaceIRPass;
import io.github.eutro.spv2sl.ssa.BasicBlock;
import io.github.eutro.spv2sl.ssa.Function;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes {@link CommonExts#PREDS} for each block.
 */
public class ComputePreds implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputePreds INSTANCE = new ComputePreds();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);

        for (BasicBlock block : func.blocks) {
            block.attachExt(CommonExts.PREDS, new ArrayList<>());
        }
        for (BasicBlock block : func.blocks) {
            for (BasicBlock target : block.getControl().targets) {
                List<BasicBlock> preds = target.getExtOrThrow(CommonExts.PREDS);
                if (!preds.contains(block)) preds.add(block);
            }
        }

        ms.validate(MetadataState.PREDS);
    }
}
