package io.github.eutro.spv2sl.util;

import io.github.eutro.spv2sl.ext.CommonExts;
import io.github.eutro.spv2sl.ops.CommonOps;
import io.github.eutro.spv2sl.ops.ShaderOps;
import io.github.eutro.spv2sl.ssa.*;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Set;

public class IRUtils {
    /**
     * Find the variable a pointer value points into, following access chains.
     *
     * @param pointer The pointer value.
     * @return The variable, or null if the pointer does not come from one.
     */
    public static @Nullable Variable rootVariable(Var pointer) {
        Var cursor = pointer;
        while (true) {
            Effect def = cursor.getNullable(CommonExts.ASSIGNED_AT);
            if (def == null) return null;
            Insn insn = def.insn();
            Variable variable = ShaderOps.VARIABLE.argNullable(insn.op);
            if (variable != null) return variable;
            if (insn.op != ShaderOps.ACCESS_CHAIN) return null;
            cursor = insn.arg(0);
        }
    }

    /**
     * Get the variable backing a phi result, creating it on first use.
     *
     * @param phi The phi result.
     * @return The variable.
     */
    public static Variable phiVariable(Var phi) {
        Variable variable = phi.getNullable(CommonExts.PHI_VARIABLE);
        if (variable == null) {
            variable = Variable.forPhi(phi, phi.identifier(), phi.getType());
            phi.attachExt(CommonExts.PHI_VARIABLE, variable);
        }
        return variable;
    }

    /**
     * Get the value a phi takes when control arrives from {@code pred}.
     *
     * @param phi  The phi effect.
     * @param pred The predecessor.
     * @return The incoming value, or null if {@code pred} is not listed.
     */
    public static @Nullable Var phiIncoming(Effect phi, BasicBlock pred) {
        List<BasicBlock> preds = CommonOps.PHI.cast(phi.insn().op).arg;
        int idx = preds.indexOf(pred);
        return idx < 0 ? null : phi.insn().arg(idx);
    }

    public static Set<Insn> usesOf(Var var) {
        Set<Insn> uses = var.getNullable(CommonExts.USED_AT);
        return uses == null ? Collections.emptySet() : uses;
    }

    public static @Nullable BasicBlock owningBlock(Insn insn) {
        Effect fx = insn.getNullable(CommonExts.OWNING_EFFECT);
        if (fx != null) return fx.getNullable(CommonExts.OWNING_BLOCK);
        Control ctrl = insn.getNullable(CommonExts.OWNING_CONTROL);
        return ctrl == null ? null : ctrl.getNullable(CommonExts.OWNING_BLOCK);
    }
}
