package io.github.eutro.spv2sl.layout;

import io.github.eutro.spv2sl.compile.UnsupportedConstructException;
import io.github.eutro.spv2sl.types.ShaderType;
import io.github.eutro.spv2sl.types.ShaderType.Member;
import io.github.eutro.spv2sl.types.TypeNames;
import io.github.eutro.spv2sl.util.SourceText;

import java.util.List;

/**
 * Renders reads from a buffer that has been flattened into an array of four-component words.
 */
public final class FlattenedAccess {
    /**
     * The expression reading the value.
     */
    public final String text;
    /**
     * Whether {@link #text} builds the transpose of the value, because it was stored row by row.
     */
    public final boolean needsTranspose;

    private FlattenedAccess(String text, boolean needsTranspose) {
        this.text = text;
        this.needsTranspose = needsTranspose;
    }

    /**
     * Render a read through an access chain into a flattened buffer.
     *
     * @param buffer    The name of the word array.
     * @param blockType The type of the buffer before flattening.
     * @param indices   The chain.
     * @param resolver  The resolver, whose word stride is the size of one array element.
     * @return The read.
     */
    public static FlattenedAccess read(String buffer, ShaderType blockType, List<ChainIndex> indices,
                                       AccessChainResolver resolver) {
        AccessChainDescriptor chain = resolver.resolve(blockType, indices);
        Reader reader = new Reader(buffer, chain.dynamicOffset, resolver.getWordStride());
        ShaderType target = chain.type;
        if (target.isArray()) {
            throw new UnsupportedConstructException("access chains that result in an array cannot be flattened", target);
        } else if (target.isStruct()) {
            return new FlattenedAccess(reader.struct(target, chain.offset), false);
        } else if (target.isMatrix()) {
            return new FlattenedAccess(reader.matrix(target, chain.offset, chain.matrixStride, chain.rowMajor),
                    chain.rowMajor);
        } else {
            return new FlattenedAccess(reader.vector(target, chain.offset, chain.matrixStride, chain.rowMajor), false);
        }
    }

    private static final class Reader {
        private final String buffer;
        private final String dynamicOffset;
        private final int wordStride;

        Reader(String buffer, String dynamicOffset, int wordStride) {
            this.buffer = buffer;
            this.dynamicOffset = dynamicOffset;
            this.wordStride = wordStride;
        }

        String word(int index) {
            return buffer + "[" + dynamicOffset + index + "]";
        }

        String vector(ShaderType type, int offset, int matrixStride, boolean transposed) {
            int width = type.componentWidth();
            int perWord = wordStride / width;
            if (transposed) {
                // the components of a row of a row-major matrix are a matrix stride apart
                StringBuilder sb = new StringBuilder();
                if (type.vecSize > 1) sb.append(TypeNames.of(type)).append('(');
                for (int i = 0; i < type.vecSize; i++) {
                    if (i != 0) sb.append(", ");
                    int component = (offset + i * matrixStride) / width;
                    sb.append(word(component / perWord)).append(SourceText.swizzle(1, component % perWord));
                }
                if (type.vecSize > 1) sb.append(')');
                return sb.toString();
            }
            if (offset % width != 0) {
                throw new UnsupportedConstructException("offset " + offset + " is not aligned to its components", type);
            }
            int component = offset / width;
            if (component % perWord + type.vecSize > perWord) {
                throw new UnsupportedConstructException("vector at offset " + offset + " straddles a word", type);
            }
            return word(component / perWord) + SourceText.swizzle(type.vecSize, component % perWord);
        }

        String matrix(ShaderType type, int offset, int matrixStride, boolean rowMajor) {
            // build the matrix as it is stored, one stored vector per constructor argument
            ShaderType stored = rowMajor ? ShaderType.matrix(type.base, type.vecSize, type.columns) : type;
            ShaderType vector = stored.parent();
            StringBuilder sb = new StringBuilder(TypeNames.of(stored)).append('(');
            for (int i = 0; i < stored.columns; i++) {
                if (i != 0) sb.append(", ");
                sb.append(vector(vector, offset + i * matrixStride, matrixStride, false));
            }
            return sb.append(')').toString();
        }

        String struct(ShaderType type, int offset) {
            StringBuilder sb = new StringBuilder(TypeNames.of(type)).append('(');
            for (int i = 0; i < type.members.size(); i++) {
                if (i != 0) sb.append(", ");
                Member member = type.member(i);
                int memberOffset = offset + member.offset;
                ShaderType memberType = member.type;
                if (memberType.isArray()) {
                    throw new UnsupportedConstructException("array member " + member.name + " cannot be flattened", type);
                } else if (memberType.isStruct()) {
                    sb.append(struct(memberType, memberOffset));
                } else if (memberType.isMatrix()) {
                    String matrix = matrix(memberType, memberOffset, member.matrixStride, member.rowMajor);
                    // a struct constructor cannot carry a pending transpose, so resolve it here
                    sb.append(member.rowMajor ? "transpose(" + matrix + ")" : matrix);
                } else {
                    sb.append(vector(memberType, memberOffset, 0, false));
                }
            }
            return sb.append(')').toString();
        }
    }
}
