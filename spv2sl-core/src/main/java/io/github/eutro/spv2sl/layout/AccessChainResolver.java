package io.github.eutro.spv2sl.layout;

import io.github.eutro.spv2sl.compile.MalformedInputException;
import io.github.eutro.spv2sl.compile.UnsupportedConstructException;
import io.github.eutro.spv2sl.types.ShaderType;
import io.github.eutro.spv2sl.types.ShaderType.Member;
import io.github.eutro.spv2sl.util.SourceText;

import java.util.List;

/**
 * Walks access chains into buffer memory.
 * <p>
 * Declared offsets and strides are used where present. Missing ones are filled in from the packing standard.
 */
public class AccessChainResolver {
    private final PackingStandard std;
    private final int wordStride;

    /**
     * Create a resolver.
     *
     * @param std        The standard to fill missing layout decorations in with.
     * @param wordStride The size in bytes of the unit dynamic offsets are expressed in.
     */
    public AccessChainResolver(PackingStandard std, int wordStride) {
        if (wordStride <= 0) throw new IllegalArgumentException("word stride " + wordStride);
        this.std = std;
        this.wordStride = wordStride;
    }

    public PackingStandard getStandard() {
        return std;
    }

    public int getWordStride() {
        return wordStride;
    }

    public AccessChainDescriptor resolve(ShaderType base, List<ChainIndex> indices) {
        return resolve(base, indices, false);
    }

    /**
     * Resolve a chain of indices starting at a value of type {@code base}.
     *
     * @param base     The type the chain starts at.
     * @param indices  The indices, one per step.
     * @param rowMajor Whether {@code base}, if it is a matrix, is stored row by row.
     * @return Where the chain ends up.
     * @throws MalformedInputException        If the chain steps into a scalar, or indexes a struct dynamically.
     * @throws UnsupportedConstructException If a dynamic step is not a whole number of words.
     */
    public AccessChainDescriptor resolve(ShaderType base, List<ChainIndex> indices, boolean rowMajor) {
        ShaderType type = Layouts.withLayout(base, rowMajor, std);
        StringBuilder dynamic = new StringBuilder();
        int offset = 0;
        int matrixStride = type.innermostElement().isMatrix() ? Layouts.matrixStride(type, rowMajor, std) : 0;
        int arrayStride = type.isArray() ? type.arrayStride : 0;
        boolean needsConversion = rowMajor;

        for (ChainIndex index : indices) {
            if (type.isArray()) {
                offset += step(dynamic, index, arrayStride, "array", type);
                type = type.parent();
                if (type.isArray()) arrayStride = type.arrayStride;
            } else if (type.isStruct()) {
                if (!index.isConstant()) {
                    throw new MalformedInputException("struct member index " + index + " is not constant", type);
                }
                int memberIndex = index.constant();
                if (memberIndex < 0 || memberIndex >= type.members.size()) {
                    throw new MalformedInputException("member index " + memberIndex + " out of bounds", type);
                }
                Member member = type.member(memberIndex);
                offset += member.offset;
                type = member.type;
                if (type.innermostElement().isMatrix()) {
                    matrixStride = member.matrixStride;
                    needsConversion = member.rowMajor;
                } else {
                    needsConversion = false;
                }
                if (type.isArray()) arrayStride = type.arrayStride;
            } else if (type.isMatrix()) {
                int stride = needsConversion ? type.componentWidth() : matrixStride;
                offset += step(dynamic, index, stride, "matrix", type);
                type = type.parent();
            } else if (type.isVector()) {
                int stride = needsConversion ? matrixStride : type.componentWidth();
                offset += step(dynamic, index, stride, "vector", type);
                type = type.parent();
            } else {
                throw new MalformedInputException("cannot subdivide a scalar", type);
            }
        }
        return new AccessChainDescriptor(type, offset, dynamic.toString(), matrixStride, arrayStride, needsConversion);
    }

    private int step(StringBuilder dynamic, ChainIndex index, int stride, String what, ShaderType type) {
        if (index.isConstant()) return index.constant() * stride;
        if (stride % wordStride != 0) {
            throw new UnsupportedConstructException("stride " + stride + " for dynamic " + what
                    + " indexing is not a multiple of " + wordStride + " bytes", type);
        }
        dynamic.append(SourceText.enclose(index.expression()))
                .append(" * ")
                .append(stride / wordStride)
                .append(" + ");
        return 0;
    }
}
