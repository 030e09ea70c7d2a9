package io.github.eutro.spv2sl.ssa;

import io.github.eutro.spv2sl.ext.*;
import io.github.eutro.spv2sl.types.ShaderType;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A shader function: a control-flow graph of {@link BasicBlock}s, its parameters and its local variables.
 */
public final class Function extends ExtHolder {
    public static boolean UNIQUE_VAR_NAMES = System.getenv("SPV2SL_UNIQUE_VAR_NAMES") != null;

    public final String name;
    public final ShaderType returnType;
    /**
     * Parameter values, in declaration order. Each is assigned by an {@code arg} effect in the entry block.
     */
    public final List<Var> params = new ArrayList<>();
    /**
     * Function-scope mutable variables.
     */
    public final List<Variable> locals = new ArrayList<>();

    public final List<BasicBlock> blocks = new TrackedList<BasicBlock>(new ArrayList<>()) {
        @Override
        protected void onAdded(BasicBlock elt) {
            elt.attachExt(CommonExts.OWNING_FUNCTION, Function.this);
            if (metaState != null) metaState.graphChanged();
        }

        @Override
        protected void onRemoved(BasicBlock elt) {
            elt.removeExt(CommonExts.OWNING_FUNCTION);
            if (metaState != null) metaState.graphChanged();
        }
    }; // [0] is entry

    private int nextBlockId = 0;
    private final Map<String, Integer> varNames = new HashMap<>();

    public Function(String name, ShaderType returnType) {
        this.name = name;
        this.returnType = returnType;
    }

    public Var newVar(String name, ShaderType type) {
        Var var;
        if (UNIQUE_VAR_NAMES || varNames.containsKey(name)) {
            int index = varNames.merge(name, 1, Integer::sum) - 1;
            var = new Var(name, index);
        } else {
            varNames.put(name, 1);
            var = new Var(name, 0);
        }
        var.attachExt(CommonExts.VALUE_TYPE, type);
        return var;
    }

    public BasicBlock newBb() {
        BasicBlock bb = new BasicBlock(nextBlockId++);
        blocks.add(bb);
        return bb;
    }

    public Variable newLocal(String name, ShaderType type) {
        Variable local = new Variable(name, type, Variable.StorageClass.FUNCTION);
        locals.add(local);
        return local;
    }

    public BasicBlock getEntry() {
        return blocks.get(0);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("fn ").append(name).append(params).append(" {\n");
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }

    // exts
    private MetadataState metaState = new MetadataState();

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = (MetadataState) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = null;
            return;
        }
        super.removeExt(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            return (T) metaState;
        }
        return super.getNullable(ext);
    }
}
