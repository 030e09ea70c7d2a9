package io.github.eutro.spv2sl.ssa;

import io.github.eutro.spv2sl.ext.CommonExts;
import io.github.eutro.spv2sl.ext.Ext;
import io.github.eutro.spv2sl.ext.ExtHolder;
import io.github.eutro.spv2sl.ops.CommonOps;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A block terminator, encapsulating a raw {@link Insn instruction} and the jump targets.
 */
public final class Control extends ExtHolder {
    private final Insn insn;
    /**
     * The jump targets of this instruction. The meaning of the order depends on the operation:
     * {@code br_if} lists the true target first, {@code switch} lists the default target first.
     */
    public final List<BasicBlock> targets;

    Control(Insn insn, List<BasicBlock> targets) {
        insn.attachExt(CommonExts.OWNING_CONTROL, this);
        this.insn = insn;
        this.targets = targets;
    }

    /**
     * Construct an unconditional jump to a block.
     *
     * @param target The jump target.
     * @return The jump instruction.
     */
    public static Control br(BasicBlock target) {
        return CommonOps.BR.insn().jumpsTo(target);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(insn());
        if (!targets.isEmpty()) {
            sb.append(" ->");
            for (BasicBlock target : targets) {
                sb.append(' ').append(target.toTargetString());
            }
        }
        return sb.toString();
    }

    public Insn insn() {
        return insn;
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
