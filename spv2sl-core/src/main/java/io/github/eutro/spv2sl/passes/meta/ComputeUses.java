package io.github.eutro.spv2sl.passes.meta;

import io.github.eutro.spv2sl.ext.CommonExts;
import io.github.eutro.spv2sl.ext.MetadataState;
import io.github.eutro.spv2sl.passes.InPlaceIRPass;
import io.github.eutro.spv2sl.ssa.*;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Computes {@link CommonExts#USED_AT} for every value of a function.
 */
public class ComputeUses implements InPlaceIRPass<Function> {
    public static final ComputeUses INSTANCE = new ComputeUses();

    @Override
    public void runInPlace(Function func) {
        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                for (Var arg : effect.insn().args()) {
                    arg.removeExt(CommonExts.USED_AT);
                }
                for (Var var : effect.getAssignsTo()) {
                    var.removeExt(CommonExts.USED_AT);
                }
            }
            for (Var arg : block.getControl().insn().args()) {
                arg.removeExt(CommonExts.USED_AT);
            }
        }
        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                for (Var arg : effect.insn().args()) {
                    getOrCreateUses(arg).add(effect.insn());
                }
                for (Var var : effect.getAssignsTo()) {
                    getOrCreateUses(var);
                }
            }
            Control ctrl = block.getControl();
            for (Var arg : ctrl.insn().args()) {
                getOrCreateUses(arg).add(ctrl.insn());
            }
        }

        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.validate(MetadataState.USES);
    }

    @NotNull
    private static Set<Insn> getOrCreateUses(Var arg) {
        return arg.getExt(CommonExts.USED_AT).orElseGet(() -> {
            Set<Insn> set = new LinkedHashSet<>();
            arg.attachExt(CommonExts.USED_AT, set);
            return set;
        });
    }
}
