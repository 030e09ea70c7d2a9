package io.github.eutro.spv2sl.ops;

import io.github.eutro.spv2sl.ext.CommonExts;
import io.github.eutro.spv2sl.ssa.BasicBlock;
import io.github.eutro.spv2sl.ssa.Insn;
import io.github.eutro.spv2sl.ssa.Var;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Operations for control flow, phis, constants and arguments.
 */
public class CommonOps {
    /**
     * Control: an unconditional jump.
     */
    public static final Op BR = new SimpleOpKey("br").create();
    /**
     * Control: jumps to the first target if its argument is true, otherwise to the second.
     */
    public static final Op BR_IF = new SimpleOpKey("br_if").create();
    /**
     * Control: multi-way jump on its argument. The first target is the default, the rest correspond
     * in order to the case literals.
     */
    public static final UnaryOpKey<List<Integer>> SWITCH = new UnaryOpKey<>("switch");
    /**
     * Control: returns from the function, with no value.
     */
    public static final Op RETURN = new SimpleOpKey("return").create();
    /**
     * Control: returns its argument from the function.
     */
    public static final Op RETURN_VALUE = new SimpleOpKey("return_value").create();
    /**
     * Control: abnormally terminates the invocation.
     */
    public static final Op KILL = new SimpleOpKey("kill").create();
    /**
     * Control: cannot be reached.
     */
    public static final Op UNREACHABLE = new SimpleOpKey("unreachable").create();

    /**
     * Effect: returns the argument corresponding to the predecessor control came from.
     * <p>
     * Must precede any other effect within its basic block.
     */
    public static final UnaryOpKey<List<BasicBlock>> PHI = new UnaryOpKey<>("phi", bbs ->
            bbs.stream().map(BasicBlock::toTargetString).collect(Collectors.joining(" ")));

    /**
     * Effect: returns the {@code n}th argument of the function.
     */
    public static final UnaryOpKey<Integer> ARG = new UnaryOpKey<>("arg");
    /**
     * Effect: returns the constant.
     */
    public static final UnaryOpKey<Object> CONST = new UnaryOpKey<>("const");

    static {
        for (OpKey key : new OpKey[]{
                PHI,
                ARG,
                CONST,
        }) {
            CommonExts.markPure(key);
        }
    }

    public static Insn constant(Object k) {
        return CONST.create(k).insn();
    }

    /**
     * Get the constant a value is assigned, if it is assigned by a {@link #CONST} instruction.
     *
     * @param var The value.
     * @return The constant, or null.
     */
    public static @Nullable Object constantValue(Var var) {
        return var.getExt(CommonExts.ASSIGNED_AT)
                .map(fx -> CONST.argNullable(fx.insn().op))
                .orElse(null);
    }

    public static boolean isConstant(Var var) {
        return constantValue(var) != null;
    }
}
