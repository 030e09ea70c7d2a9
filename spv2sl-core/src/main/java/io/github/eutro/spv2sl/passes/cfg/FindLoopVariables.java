package io.github.eutro.spv2sl.passes.cfg;

import io.github.eutro.spv2sl.ext.CommonExts;
import io.github.eutro.spv2sl.ext.CommonExts.LoopInfo;
import io.github.eutro.spv2sl.ext.CommonExts.LoopVariable;
import io.github.eutro.spv2sl.ext.MetadataState;
import io.github.eutro.spv2sl.ops.CommonOps;
import io.github.eutro.spv2sl.ops.ShaderOps;
import io.github.eutro.spv2sl.passes.InPlaceIRPass;
import io.github.eutro.spv2sl.ssa.*;
import io.github.eutro.spv2sl.util.IRUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Finds local variables that can be declared in a loop's initializer clause.
 * <p>
 * A candidate is only accessed inside the loop, apart from a single whole-variable store in the block that
 * enters the loop header. Any effect taking a pointer into the variable, such as a call, is an access. Whether the candidate is actually used that way depends on the shape the loop
 * is emitted as.
 */
public class FindLoopVariables implements InPlaceIRPass<Function> {
    private static final Logger LOGGER = LogManager.getLogger(FindLoopVariables.class);

    public static final FindLoopVariables INSTANCE = new FindLoopVariables();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.PREDS, MetadataState.LOOPS);

        Map<Variable, List<Effect>> accesses = new LinkedHashMap<>();
        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                effect.removeExt(CommonExts.LOOP_VARIABLE_INIT);
                Insn insn = effect.insn();
                // forming a chain touches nothing, its users do
                if (insn.op == ShaderOps.ACCESS_CHAIN) continue;
                Set<Variable> roots = new LinkedHashSet<>();
                for (Var arg : insn.args()) {
                    if (!arg.getType().isPointer()) continue;
                    Variable root = IRUtils.rootVariable(arg);
                    if (root != null && root.isFunctionLocal() && root.phiOf == null) roots.add(root);
                }
                for (Variable root : roots) {
                    accesses.computeIfAbsent(root, $ -> new ArrayList<>()).add(effect);
                }
            }
        }

        Set<Variable> claimed = new HashSet<>();
        for (BasicBlock block : func.blocks) {
            LoopInfo loop = block.getNullable(CommonExts.LOOP_INFO);
            if (loop == null) continue;
            loop.loopVariables.clear();
            BasicBlock entering = enteringBlock(loop);
            if (entering == null) continue;
            for (Map.Entry<Variable, List<Effect>> entry : accesses.entrySet()) {
                Variable variable = entry.getKey();
                if (variable.initializer != null || claimed.contains(variable)) continue;
                Effect init = findInit(loop, entering, entry.getValue());
                if (init == null) continue;
                claimed.add(variable);
                init.attachExt(CommonExts.LOOP_VARIABLE_INIT, loop.header);
                loop.loopVariables.add(new LoopVariable(variable, init));
                LOGGER.debug("{} is a candidate loop variable of {}", variable, loop.header.toTargetString());
            }
        }

        ms.validate(MetadataState.LOOP_VARIABLES);
    }

    private static BasicBlock enteringBlock(LoopInfo loop) {
        BasicBlock entering = null;
        for (BasicBlock pred : loop.header.getExtOrThrow(CommonExts.PREDS)) {
            if (loop.contains(pred)) continue;
            if (entering != null) return null;
            entering = pred;
        }
        if (entering == null || entering.getControl().insn().op != CommonOps.BR) return null;
        return entering;
    }

    private static Effect findInit(LoopInfo loop, BasicBlock entering, List<Effect> accesses) {
        Effect init = null;
        for (Effect access : accesses) {
            BasicBlock block = access.getExtOrThrow(CommonExts.OWNING_BLOCK);
            if (loop.contains(block)) continue;
            if (init != null || block != entering) return null;
            Insn insn = access.insn();
            if (insn.op != ShaderOps.STORE) return null;
            Effect ptrDef = insn.arg(0).getNullable(CommonExts.ASSIGNED_AT);
            if (ptrDef == null || ptrDef.insn().op.key != ShaderOps.VARIABLE) return null;
            init = access;
        }
        return init;
    }
}
