package io.github.eutro.spv2sl.ssa;

import io.github.eutro.spv2sl.ext.CommonExts;
import io.github.eutro.spv2sl.ext.Ext;
import io.github.eutro.spv2sl.ext.ExtHolder;
import io.github.eutro.spv2sl.types.ShaderType;
import org.jetbrains.annotations.Nullable;

import java.util.Set;

/**
 * An SSA value. It is assigned by exactly one {@link Effect} and never changes.
 */
public final class Var extends ExtHolder {
    public String name;
    public int index;

    Var(String name, int index) {
        this.name = name;
        this.index = index;
    }

    /**
     * The identifier this value is declared under when it becomes a temporary.
     *
     * @return The identifier.
     */
    public String identifier() {
        return index == 0 ? name : name + "_" + index;
    }

    public ShaderType getType() {
        return getExtOrThrow(CommonExts.VALUE_TYPE);
    }

    @Override
    public String toString() {
        return '$' + name + (index == 0 ? "" : "." + index);
    }

    // exts
    private Effect assignedAt = null;
    private Set<Insn> usedAt = null;
    private ShaderType type = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.ASSIGNED_AT) {
            return (T) assignedAt;
        } else if (ext == CommonExts.USED_AT) {
            return (T) usedAt;
        } else if (ext == CommonExts.VALUE_TYPE) {
            return (T) type;
        }
        return super.getNullable(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.ASSIGNED_AT) {
            assignedAt = (Effect) value;
            return;
        } else if (ext == CommonExts.USED_AT) {
            usedAt = (Set<Insn>) value;
            return;
        } else if (ext == CommonExts.VALUE_TYPE) {
            type = (ShaderType) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.ASSIGNED_AT) {
            assignedAt = null;
            return;
        } else if (ext == CommonExts.USED_AT) {
            usedAt = null;
            return;
        } else if (ext == CommonExts.VALUE_TYPE) {
            type = null;
            return;
        }
        super.removeExt(ext);
    }
}
