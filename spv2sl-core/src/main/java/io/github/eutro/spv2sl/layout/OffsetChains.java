package io.github.eutro.spv2sl.layout;

import io.github.eutro.spv2sl.types.ShaderType;
import io.github.eutro.spv2sl.types.ShaderType.Member;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns byte offsets back into access chains.
 */
public class OffsetChains {
    /**
     * Find the chain of constant indices that selects the scalar at a byte offset of a struct.
     * <p>
     * This is the inverse of {@link AccessChainResolver#resolve}: resolving the returned chain gives back
     * {@code offset}.
     *
     * @param struct The struct type.
     * @param offset The byte offset.
     * @param std    The standard to fill missing layout decorations in with.
     * @return The chain, or empty if the offset falls into padding or past the end.
     */
    public static Optional<List<Integer>> chainFromOffset(ShaderType struct, int offset, PackingStandard std) {
        if (!struct.isStruct()) throw new IllegalArgumentException("not a struct: " + struct);
        ShaderType type = Layouts.layOut(struct, std);
        List<Integer> chain = new ArrayList<>();
        int rel = offset;
        boolean rowMajor = false;
        int matrixStride = 0;
        if (rel < 0) return Optional.empty();

        while (true) {
            if (type.isStruct()) {
                int found = -1;
                for (int i = 0; i < type.members.size(); i++) {
                    Member member = type.member(i);
                    if (member.offset > rel) continue;
                    if (member.type.isRuntimeArray()
                            || rel < member.offset + Layouts.size(member.type, member.rowMajor, std)) {
                        found = i;
                    }
                }
                if (found < 0) return Optional.empty();
                Member member = type.member(found);
                chain.add(found);
                rel -= member.offset;
                type = member.type;
                rowMajor = member.rowMajor;
                matrixStride = member.matrixStride;
            } else if (type.isArray()) {
                int element = rel / type.arrayStride;
                if (!type.isRuntimeArray() && element >= type.arrayLength) return Optional.empty();
                chain.add(element);
                rel -= element * type.arrayStride;
                type = type.parent();
            } else if (type.isMatrix()) {
                int width = type.componentWidth();
                int vector = rel / matrixStride;
                int within = rel % matrixStride;
                if (within % width != 0) return Optional.empty();
                int column = rowMajor ? within / width : vector;
                int row = rowMajor ? vector : within / width;
                if (column >= type.columns || row >= type.vecSize) return Optional.empty();
                chain.add(column);
                chain.add(row);
                return Optional.of(chain);
            } else if (type.isVector()) {
                int width = type.componentWidth();
                if (rel % width != 0 || rel / width >= type.vecSize) return Optional.empty();
                chain.add(rel / width);
                return Optional.of(chain);
            } else {
                return rel == 0 ? Optional.of(chain) : Optional.empty();
            }
        }
    }
}
