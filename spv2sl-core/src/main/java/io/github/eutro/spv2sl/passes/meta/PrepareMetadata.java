package io.github.eutro.spv2sl.passes.meta;

import io.github.eutro.spv2sl.ext.CommonExts;
import io.github.eutro.spv2sl.ext.MetadataState;
import io.github.eutro.spv2sl.passes.InPlaceIRPass;
import io.github.eutro.spv2sl.ssa.Function;

/**
 * Brings every analysis that emission reads up to date, so that emission passes never mutate the IR.
 */
public class PrepareMetadata implements InPlaceIRPass<Function> {
    public static final PrepareMetadata INSTANCE = new PrepareMetadata();

    @Override
    public void runInPlace(Function func) {
        if (func.blocks.isEmpty()) throw new IllegalArgumentException("function " + func.name + " has no blocks");
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func,
                MetadataState.PREDS,
                MetadataState.DOMS,
                MetadataState.USES,
                MetadataState.LOOPS,
                MetadataState.LADDERS,
                MetadataState.LOOP_VARIABLES,
                MetadataState.HOISTED);
    }
}
