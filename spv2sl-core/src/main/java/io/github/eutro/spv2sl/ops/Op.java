package io.github.eutro.spv2sl.ops;

import io.github.eutro.spv2sl.ext.DelegatingExtHolder;
import io.github.eutro.spv2sl.ext.ExtContainer;
import io.github.eutro.spv2sl.ssa.Insn;
import io.github.eutro.spv2sl.ssa.Var;

import java.util.List;

/**
 * An operation, encapsulating an {@link OpKey operation key} and any intermediates.
 */
public class Op extends DelegatingExtHolder {
    public final OpKey key;

    public Op(OpKey key) {
        this.key = key;
    }

    @Override
    protected ExtContainer getDelegate() {
        return key;
    }

    @Override
    public String toString() {
        return key.toString();
    }

    public Insn insn(Var... vars) {
        return new Insn(this, vars);
    }

    public Insn insn(List<Var> vars) {
        return new Insn(this, vars);
    }
}
