package io.github.eutro.spv2sl.ext;

import io.github.eutro.spv2sl.ssa.*;
import io.github.eutro.spv2sl.ssa.Module;
import io.github.eutro.spv2sl.types.ShaderType;

import java.util.*;

public class CommonExts {
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    public static final Ext<BasicBlock> IDOM = Ext.create(BasicBlock.class, "IDOM");
    public static final Ext<List<BasicBlock>> PREDS = Ext.create(List.class, "PREDS");

    /**
     * The innermost loop header whose body contains a block. Absent for blocks outside any loop.
     */
    public static final Ext<BasicBlock> LOOP_DOMINATOR = Ext.create(BasicBlock.class, "LOOP_DOMINATOR");
    public static final Ext<LoopInfo> LOOP_INFO = Ext.create(LoopInfo.class, "LOOP_INFO");

    /**
     * Present on a switch header if breaking out of its enclosing loop from a case needs a ladder variable.
     */
    public static final Ext<BasicBlock> LADDER_BREAK = Ext.create(BasicBlock.class, "LADDER_BREAK");

    public static final Ext<Boolean> IS_PURE = Ext.create(Boolean.class, "IS_PURE");

    public static final Ext<Effect> ASSIGNED_AT = Ext.create(Effect.class, "ASSIGNED_AT");
    public static final Ext<Set<Insn>> USED_AT = Ext.create(Set.class, "USED_AT");
    public static final Ext<ShaderType> VALUE_TYPE = Ext.create(ShaderType.class, "VALUE_TYPE");
    /**
     * The variable a phi result is stored in between the edge copies and its uses.
     */
    public static final Ext<Variable> PHI_VARIABLE = Ext.create(Variable.class, "PHI_VARIABLE");

    /**
     * Set on values that are defined inside a loop but read after it, so must be declared ahead of the loop.
     */
    public static final Ext<BasicBlock> HOISTED_BEFORE = Ext.create(BasicBlock.class, "HOISTED_BEFORE");

    /**
     * Set on the store that initializes a loop variable, pointing at the loop header.
     */
    public static final Ext<BasicBlock> LOOP_VARIABLE_INIT = Ext.create(BasicBlock.class, "LOOP_VARIABLE_INIT");

    public static final Ext<Module> OWNING_MODULE = Ext.create(Module.class, "OWNING_MODULE");
    public static final Ext<Function> OWNING_FUNCTION = Ext.create(Function.class, "OWNING_FUNCTION");
    public static final Ext<BasicBlock> OWNING_BLOCK = Ext.create(BasicBlock.class, "OWNING_BLOCK");
    public static final Ext<Control> OWNING_CONTROL = Ext.create(Control.class, "OWNING_CONTROL");
    public static final Ext<Effect> OWNING_EFFECT = Ext.create(Effect.class, "OWNING_EFFECT");

    public static <T extends ExtContainer> T markPure(T t) {
        t.attachExt(IS_PURE, true);
        return t;
    }

    public static boolean isPure(ExtContainer ec) {
        return ec.getNullable(IS_PURE) == Boolean.TRUE;
    }

    /**
     * Static facts about one structured loop, attached to its header.
     */
    public static class LoopInfo {
        public final BasicBlock header;
        /**
         * Blocks reachable from the header without leaving through the merge block, header included.
         */
        public final Set<BasicBlock> body = new LinkedHashSet<>();
        /**
         * Variables written anywhere in the body, including phi variables of body blocks.
         */
        public final Set<Variable> storedVariables = new HashSet<>();
        /**
         * Values defined in the body and read after the loop.
         */
        public final List<Var> hoisted = new ArrayList<>();
        /**
         * Variables whose declaration can move into the loop's initializer clause.
         */
        public final List<LoopVariable> loopVariables = new ArrayList<>();

        public LoopInfo(BasicBlock header) {
            this.header = header;
        }

        public boolean contains(BasicBlock block) {
            return body.contains(block);
        }
    }

    public static final class LoopVariable {
        public final Variable variable;
        public final Effect initStore;

        public LoopVariable(Variable variable, Effect initStore) {
            this.variable = variable;
            this.initStore = initStore;
        }

        @Override
        public String toString() {
            return variable.name;
        }
    }
}
