package io.github.eutro.spv2sl.layout;

import io.github.eutro.spv2sl.types.ShaderType;

/**
 * Where an access chain ends up in memory.
 * <p>
 * The byte address is {@link #dynamicOffset} words plus {@link #offset} bytes. The dynamic part is a sum of
 * {@code index * k + } terms, each already scaled to words, so that a constant word index can be appended.
 */
public final class AccessChainDescriptor {
    public final ShaderType type;
    public final int offset;
    public final String dynamicOffset;
    public final int matrixStride;
    public final int arrayStride;
    /**
     * Whether the matrix being accessed, or that the accessed vector belongs to, is stored row by row.
     */
    public final boolean rowMajor;

    AccessChainDescriptor(ShaderType type,
                          int offset,
                          String dynamicOffset,
                          int matrixStride,
                          int arrayStride,
                          boolean rowMajor) {
        this.type = type;
        this.offset = offset;
        this.dynamicOffset = dynamicOffset;
        this.matrixStride = matrixStride;
        this.arrayStride = arrayStride;
        this.rowMajor = rowMajor;
    }

    public boolean isDynamic() {
        return !dynamicOffset.isEmpty();
    }

    public boolean reachedScalar() {
        return type.isScalar();
    }

    @Override
    public String toString() {
        return "AccessChainDescriptor{" +
                "type=" + type +
                ", offset=" + offset +
                ", dynamicOffset='" + dynamicOffset + '\'' +
                ", matrixStride=" + matrixStride +
                ", arrayStride=" + arrayStride +
                ", rowMajor=" + rowMajor +
                '}';
    }
}
