package io.github.eutro.spv2sl.ssa;

import io.github.eutro.spv2sl.ext.*;
import io.github.eutro.spv2sl.ops.CommonOps;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A basic block: straight-line effects followed by exactly one {@link Control}.
 * <p>
 * Blocks also carry the structured-control annotations of the input: the kind of construct
 * they head, its merge block, and for loops the continue block.
 */
public final class BasicBlock extends ExtHolder {
    public enum MergeKind {
        NONE,
        SELECTION,
        LOOP,
    }

    private final int id;
    private final TrackedList<Effect> effects = new TrackedList<Effect>(new ArrayList<>()) {
        @Override
        protected void onAdded(Effect elt) {
            registerWithThis(elt);
        }

        @Override
        protected void onRemoved(Effect elt) {
            elt.removeExt(CommonExts.OWNING_BLOCK);
        }
    };
    private Control control;

    private MergeKind mergeKind = MergeKind.NONE;
    private @Nullable BasicBlock mergeBlock;
    private @Nullable BasicBlock continueBlock;

    BasicBlock(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    public String toTargetString() {
        return "@" + id;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString());
        if (mergeKind != MergeKind.NONE) {
            sb.append(' ').append(mergeKind.name().toLowerCase()).append("_merge ")
                    .append(mergeBlock == null ? "?" : mergeBlock.toTargetString());
            if (continueBlock != null) {
                sb.append(" continue ").append(continueBlock.toTargetString());
            }
        }
        sb.append("\n{\n");
        for (Effect effect : getEffects()) {
            sb.append(' ').append(effect).append('\n');
        }
        sb.append(' ').append(getControl());
        sb.append("\n}");
        return sb.toString();
    }

    private <T extends ExtContainer> T registerWithThis(T extable) {
        if (extable != null) {
            extable.attachExt(CommonExts.OWNING_BLOCK, this);
        }
        return extable;
    }

    public List<Effect> getEffects() {
        return effects;
    }

    public void addEffect(Effect effect) {
        effects.add(effect);
    }

    /**
     * Get the leading phi effects of this block.
     *
     * @return The phis, in order.
     */
    public List<Effect> getPhis() {
        List<Effect> phis = new ArrayList<>();
        for (Effect effect : effects) {
            if (effect.insn().op.key != CommonOps.PHI) break;
            phis.add(effect);
        }
        return phis;
    }

    public Control getControl() {
        return control;
    }

    public void setControl(Control control) {
        this.control = registerWithThis(control);
    }

    public MergeKind getMergeKind() {
        return mergeKind;
    }

    public @Nullable BasicBlock getMergeBlock() {
        return mergeBlock;
    }

    public @Nullable BasicBlock getContinueBlock() {
        return continueBlock;
    }

    /**
     * Mark this block as the header of a selection construct.
     *
     * @param merge The block the branches of the selection reconverge at.
     */
    public void setSelectionMerge(BasicBlock merge) {
        this.mergeKind = MergeKind.SELECTION;
        this.mergeBlock = merge;
        this.continueBlock = null;
    }

    /**
     * Mark this block as the header of a loop construct.
     *
     * @param merge         The block control reaches when the loop exits.
     * @param continueBlock The block that branches back to this header.
     */
    public void setLoopMerge(BasicBlock merge, BasicBlock continueBlock) {
        this.mergeKind = MergeKind.LOOP;
        this.mergeBlock = merge;
        this.continueBlock = continueBlock;
    }

    public boolean isLoopHeader() {
        return mergeKind == MergeKind.LOOP;
    }

    // exts
    private Function owner = null;
    private BasicBlock idom = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            return (T) owner;
        } else if (ext == CommonExts.IDOM) {
            return (T) idom;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = (Function) value;
            return;
        } else if (ext == CommonExts.IDOM) {
            idom = (BasicBlock) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = null;
            return;
        } else if (ext == CommonExts.IDOM) {
            idom = null;
            return;
        }
        super.removeExt(ext);
    }
}
