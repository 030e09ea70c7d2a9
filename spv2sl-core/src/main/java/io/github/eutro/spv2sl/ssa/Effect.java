package io.github.eutro.spv2sl.ssa;

import io.github.eutro.spv2sl.ext.*;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An effect, encapsulating an {@link Insn instruction} and the values its results are assigned to.
 */
public final class Effect extends DelegatingExtHolder {
    private final List<Var> assignsTo;
    private Insn insn;

    Effect(List<Var> assignsTo, Insn insn) {
        this.assignsTo = new ArrayList<>(assignsTo);
        for (Var var : this.assignsTo) {
            var.attachExt(CommonExts.ASSIGNED_AT, this);
        }
        this.setInsn(insn);
    }

    @Override
    protected ExtContainer getDelegate() {
        return insn();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (!assignsTo.isEmpty()) {
            sb.append(assignsTo.stream()
                    .map(Objects::toString)
                    .collect(Collectors.joining(", ", "", " = ")));
        }
        sb.append(insn());
        return sb.toString();
    }

    public List<Var> getAssignsTo() {
        return Collections.unmodifiableList(assignsTo);
    }

    /**
     * Get the single value this effect assigns, if it assigns exactly one.
     *
     * @return The value, or null.
     */
    public @Nullable Var result() {
        return assignsTo.size() == 1 ? assignsTo.get(0) : null;
    }

    public Insn insn() {
        return insn;
    }

    public void setInsn(Insn insn) {
        insn.attachExt(CommonExts.OWNING_EFFECT, this);
        this.insn = insn;
    }

    // exts
    private BasicBlock owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = (BasicBlock) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
