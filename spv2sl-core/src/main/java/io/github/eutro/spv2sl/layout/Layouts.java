package io.github.eutro.spv2sl.layout;

import io.github.eutro.spv2sl.types.ShaderType;
import io.github.eutro.spv2sl.types.ShaderType.Member;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Memory layout arithmetic under a {@link PackingStandard}.
 * <p>
 * The {@code rowMajor} parameters describe how a matrix, or the matrices inside an array, are stored.
 * They are ignored for every other type.
 */
public final class Layouts {
    private static final Logger LOGGER = LogManager.getLogger(Layouts.class);

    private Layouts() {
    }

    public static int alignUp(int value, int alignment) {
        return (value + alignment - 1) / alignment * alignment;
    }

    /**
     * Get the base alignment of a type.
     *
     * @param type     The type.
     * @param rowMajor Whether matrices are stored row by row.
     * @param std      The packing standard.
     * @return The alignment in bytes.
     */
    public static int alignment(ShaderType type, boolean rowMajor, PackingStandard std) {
        if (type.isArray()) {
            int minimum = std.isVec4Padded() ? 16 : 1;
            return Math.max(minimum, alignment(type.innermostElement(), rowMajor, std));
        }
        if (type.isStruct()) {
            int alignment = 1;
            for (Member member : type.members) {
                alignment = Math.max(alignment, alignment(member.type, member.rowMajor, std));
            }
            if (std.isVec4Padded()) alignment = alignUp(alignment, 16);
            return alignment;
        }
        if (type.isScalar()) return type.componentWidth();
        int base = type.componentWidth();
        if (std.isScalar()) return base;
        if (type.isVector()) {
            if (std.isHlsl()) return base;
            return type.vecSize == 2 ? 2 * base : 4 * base;
        }
        if (type.isMatrix()) {
            int rows = storedVectorSize(type, rowMajor);
            if (std.isVec4Padded() || rows == 3) return 4 * base;
            return rows * base;
        }
        throw new IllegalArgumentException("type " + type + " cannot be laid out in memory");
    }

    /**
     * Get the number of bytes a type occupies, not counting trailing padding that following members may use.
     *
     * @param type     The type.
     * @param rowMajor Whether matrices are stored row by row.
     * @param std      The packing standard.
     * @return The size in bytes. Runtime arrays have size 0.
     */
    public static int size(ShaderType type, boolean rowMajor, PackingStandard std) {
        if (type.isArray()) {
            if (type.isRuntimeArray()) return 0;
            int size = type.arrayLength * arrayStride(type, rowMajor, std);
            // the last element of a non-struct array only takes the space of its components
            if (std.isHlsl() && !type.innermostElement().isStruct()) {
                size -= (4 - type.vecSize) * type.componentWidth();
            }
            return size;
        }
        if (type.isStruct()) {
            int padAlignment = 1;
            int size = 0;
            for (Member member : type.members) {
                int packedAlignment = alignment(member.type, member.rowMajor, std);
                int alignment = Math.max(packedAlignment, padAlignment);
                // the member after a struct is aligned to that struct's alignment
                padAlignment = member.type.isStruct() ? packedAlignment : 1;
                size = alignUp(size, alignment);
                size += size(member.type, member.rowMajor, std);
            }
            return size;
        }
        int base = type.componentWidth();
        if (type.isMatrix()) {
            int vectors = rowMajor ? type.vecSize : type.columns;
            int rows = storedVectorSize(type, rowMajor);
            int size;
            if (std.isVec4Padded() || (rows == 3 && !std.isScalar())) {
                size = vectors * 4 * base;
            } else {
                size = vectors * rows * base;
            }
            if (std.isHlsl()) size -= (4 - rows) * base;
            return size;
        }
        return type.vecSize * base;
    }

    /**
     * Get the stride between consecutive elements of an array.
     *
     * @param array    The array type.
     * @param rowMajor Whether matrices in the array are stored row by row.
     * @param std      The packing standard.
     * @return The stride in bytes.
     */
    public static int arrayStride(ShaderType array, boolean rowMajor, PackingStandard std) {
        if (!array.isArray()) throw new IllegalArgumentException("not an array: " + array);
        int size = size(array.parent(), rowMajor, std);
        return alignUp(size, alignment(array, rowMajor, std));
    }

    /**
     * Get the stride between the stored vectors of a matrix: columns if column-major, rows if row-major.
     *
     * @param matrix   The matrix type, or an array of matrices.
     * @param rowMajor Whether the matrix is stored row by row.
     * @param std      The packing standard.
     * @return The stride in bytes.
     */
    public static int matrixStride(ShaderType matrix, boolean rowMajor, PackingStandard std) {
        ShaderType type = matrix.innermostElement();
        if (!type.isMatrix()) throw new IllegalArgumentException("not a matrix: " + matrix);
        int base = type.componentWidth();
        int rows = storedVectorSize(type, rowMajor);
        if (std.isVec4Padded()) return 4 * base;
        if (std.isScalar()) return rows * base;
        return rows == 3 ? 4 * base : rows * base;
    }

    private static int storedVectorSize(ShaderType matrix, boolean rowMajor) {
        return rowMajor ? matrix.columns : matrix.vecSize;
    }

    public static boolean isStandardCompliant(ShaderType struct, PackingStandard std) {
        return !firstNonCompliantMember(struct, std).isPresent();
    }

    public static OptionalInt firstNonCompliantMember(ShaderType struct, PackingStandard std) {
        return firstNonCompliantMember(struct, std, 0, Integer.MAX_VALUE);
    }

    /**
     * Check the declared layout of a block against a packing standard.
     * <p>
     * Only members whose declared offset lies in {@code [start, end)} are checked. The last member of the block
     * may be an array of unknown size, in which case its size is not needed.
     *
     * @param struct The block type.
     * @param std    The packing standard.
     * @param start  The first offset to check.
     * @param end    The offset to stop checking at.
     * @return The index of the first member that does not follow the standard, if any.
     */
    public static OptionalInt firstNonCompliantMember(ShaderType struct, PackingStandard std, int start, int end) {
        if (!struct.isStruct()) throw new IllegalArgumentException("not a struct: " + struct);
        return check(struct, std, start, end, true);
    }

    private static OptionalInt check(ShaderType struct, PackingStandard std, int start, int end, boolean topLevel) {
        int offset = 0;
        int padAlignment = 1;
        List<Member> members = struct.members;
        for (int i = 0; i < members.size(); i++) {
            Member member = members.get(i);
            ShaderType type = member.type;
            int packedAlignment = alignment(type, member.rowMajor, std);
            boolean canBeUnsized = topLevel && i + 1 == members.size() && type.isArray();
            int packedSize = 0;
            if (!canBeUnsized || std.isHlsl()) {
                packedSize = size(type, member.rowMajor, std);
            }
            if (std.isHlsl() && packedSize > 0) {
                // a member that straddles a 16-byte register is aligned to the register
                if (offset / 16 != (offset + packedSize - 1) / 16) {
                    packedAlignment = Math.max(packedAlignment, 16);
                }
            }

            int alignment = Math.max(packedAlignment, padAlignment);
            offset = alignUp(offset, alignment);
            int actualOffset = member.hasOffset() ? member.offset : offset;
            if (actualOffset >= end) break;
            padAlignment = type.isStruct() ? packedAlignment : 1;

            if (actualOffset >= start) {
                if (!std.hasFlexibleOffsets()) {
                    if (actualOffset != offset) {
                        return fail(struct, i, std, "offset " + actualOffset + ", expected " + offset);
                    }
                } else if (actualOffset % alignment != 0) {
                    return fail(struct, i, std, "offset " + actualOffset + " not aligned to " + alignment);
                }

                if (type.isArray() && type.arrayStride != 0) {
                    int expected = arrayStride(type, member.rowMajor, std);
                    if (expected != type.arrayStride) {
                        return fail(struct, i, std, "array stride " + type.arrayStride + ", expected " + expected);
                    }
                }
                if (type.innermostElement().isMatrix() && member.matrixStride != 0) {
                    int expected = matrixStride(type, member.rowMajor, std);
                    if (expected != member.matrixStride) {
                        return fail(struct, i, std, "matrix stride " + member.matrixStride + ", expected " + expected);
                    }
                }
                ShaderType element = type.innermostElement();
                if (element.isStruct()) {
                    PackingStandard substructStd = std.substructStandard();
                    if (check(element, substructStd, 0, Integer.MAX_VALUE, false).isPresent()) {
                        return fail(struct, i, std, "member struct does not follow " + substructStd);
                    }
                }
            }

            offset = actualOffset + packedSize;
        }
        return OptionalInt.empty();
    }

    private static OptionalInt fail(ShaderType struct, int index, PackingStandard std, String reason) {
        LOGGER.trace("{}.{} does not follow {}: {}", struct.name, struct.member(index).name, std, reason);
        return OptionalInt.of(index);
    }

    /**
     * Find the first of the candidate standards that a block follows.
     *
     * @param struct     The block type.
     * @param candidates The standards to try, in order of preference.
     * @return The standard, if any matched.
     */
    public static Optional<PackingStandard> detectStandard(ShaderType struct, PackingStandard... candidates) {
        for (PackingStandard candidate : candidates) {
            if (isStandardCompliant(struct, candidate)) return Optional.of(candidate);
        }
        return Optional.empty();
    }

    /**
     * Fill in the layout decorations a struct is missing, as the standard would place them.
     * <p>
     * Declared offsets and strides are kept, and the members after them are placed relative to them.
     *
     * @param struct The struct type.
     * @param std    The packing standard.
     * @return The struct, with every offset, array stride and matrix stride present.
     */
    public static ShaderType layOut(ShaderType struct, PackingStandard std) {
        if (!struct.isStruct()) throw new IllegalArgumentException("not a struct: " + struct);
        List<Member> laidOut = new ArrayList<>();
        int offset = 0;
        int padAlignment = 1;
        for (Member member : struct.members) {
            ShaderType type = member.type;
            int packedAlignment = alignment(type, member.rowMajor, std);
            int packedSize = size(type, member.rowMajor, std);
            if (std.isHlsl() && packedSize > 0 && offset / 16 != (offset + packedSize - 1) / 16) {
                packedAlignment = Math.max(packedAlignment, 16);
            }
            offset = alignUp(offset, Math.max(packedAlignment, padAlignment));
            padAlignment = type.isStruct() ? packedAlignment : 1;

            Member result = member.withType(withLayout(type, member.rowMajor, std));
            if (!member.hasOffset()) result = result.at(offset);
            if (type.innermostElement().isMatrix() && member.matrixStride == 0) {
                result = result.withMatrixStride(matrixStride(type, member.rowMajor, std));
            }
            laidOut.add(result);
            offset = result.offset + packedSize;
        }
        return struct.withMembers(laidOut);
    }

    /**
     * Fill in the layout decorations of any type: array strides of arrays, and everything {@link #layOut}
     * fills in for structs.
     *
     * @param type     The type.
     * @param rowMajor Whether matrices in the type are stored row by row.
     * @param std      The packing standard.
     * @return The type with its layout filled in.
     */
    public static ShaderType withLayout(ShaderType type, boolean rowMajor, PackingStandard std) {
        if (type.isArray()) {
            ShaderType result = type.withElement(withLayout(type.parent(), rowMajor, std));
            if (result.arrayStride == 0) result = result.withArrayStride(arrayStride(type, rowMajor, std));
            return result;
        }
        if (type.isStruct()) return layOut(type, std.substructStandard());
        return type;
    }
}
