package io.github.eutro.spv2sl.types;

import io.github.eutro.spv2sl.ssa.Variable.StorageClass;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.stream.Collectors;

/**
 * An immutable shader type.
 * <p>
 * Vectors have {@code vecSize > 1} and one column. Matrices have {@code columns > 1} columns, each a vector of
 * {@code vecSize} components. Arrays and pointers wrap an element type. Structs carry their members together with
 * the explicit layout decorations of the input.
 */
public final class ShaderType {
    public enum Kind {
        VOID,
        SCALAR,
        VECTOR,
        MATRIX,
        ARRAY,
        STRUCT,
        POINTER,
    }

    public enum BaseType {
        VOID(0),
        BOOL(4),
        INT(4),
        UINT(4),
        INT64(8),
        UINT64(8),
        HALF(2),
        FLOAT(4),
        DOUBLE(8),
        STRUCT(0);

        /**
         * Size of one component in bytes.
         */
        public final int width;

        BaseType(int width) {
            this.width = width;
        }
    }

    /**
     * Array length of a runtime-sized array.
     */
    public static final int RUNTIME_LENGTH = -1;

    public static final ShaderType VOID = new ShaderType(Kind.VOID, BaseType.VOID, 1, 1, null,
            0, null, 0, null, Collections.emptyList(), null);
    public static final ShaderType BOOL = scalar(BaseType.BOOL);
    public static final ShaderType INT = scalar(BaseType.INT);
    public static final ShaderType UINT = scalar(BaseType.UINT);
    public static final ShaderType FLOAT = scalar(BaseType.FLOAT);
    public static final ShaderType DOUBLE = scalar(BaseType.DOUBLE);

    public final Kind kind;
    public final BaseType base;
    public final int vecSize;
    public final int columns;
    private final @Nullable ShaderType element;
    public final int arrayLength;
    /**
     * Name of the specialization constant that sizes this array, if any.
     */
    public final @Nullable String lengthConstant;
    /**
     * Declared array stride, or 0 if undecorated.
     */
    public final int arrayStride;
    public final @Nullable String name;
    public final List<Member> members;
    public final @Nullable StorageClass storageClass;

    private ShaderType(Kind kind,
                       BaseType base,
                       int vecSize,
                       int columns,
                       @Nullable ShaderType element,
                       int arrayLength,
                       @Nullable String lengthConstant,
                       int arrayStride,
                       @Nullable String name,
                       List<Member> members,
                       @Nullable StorageClass storageClass) {
        this.kind = kind;
        this.base = base;
        this.vecSize = vecSize;
        this.columns = columns;
        this.element = element;
        this.arrayLength = arrayLength;
        this.lengthConstant = lengthConstant;
        this.arrayStride = arrayStride;
        this.name = name;
        this.members = members;
        this.storageClass = storageClass;
    }

    public static ShaderType scalar(BaseType base) {
        return new ShaderType(Kind.SCALAR, base, 1, 1, null, 0, null, 0, null, Collections.emptyList(), null);
    }

    public static ShaderType vector(BaseType base, int size) {
        if (size < 2 || size > 4) throw new IllegalArgumentException("vector size " + size);
        return new ShaderType(Kind.VECTOR, base, size, 1, null, 0, null, 0, null, Collections.emptyList(), null);
    }

    /**
     * Create a matrix type.
     *
     * @param base    The component type.
     * @param columns The number of columns.
     * @param rows    The number of components in each column.
     * @return The type.
     */
    public static ShaderType matrix(BaseType base, int columns, int rows) {
        if (columns < 2 || columns > 4 || rows < 2 || rows > 4) {
            throw new IllegalArgumentException("matrix " + columns + "x" + rows);
        }
        return new ShaderType(Kind.MATRIX, base, rows, columns, null, 0, null, 0, null, Collections.emptyList(), null);
    }

    public static ShaderType array(ShaderType element, int length) {
        if (length <= 0) throw new IllegalArgumentException("array length " + length);
        return new ShaderType(Kind.ARRAY, element.base, element.vecSize, element.columns, element,
                length, null, 0, null, Collections.emptyList(), null);
    }

    public static ShaderType runtimeArray(ShaderType element) {
        return new ShaderType(Kind.ARRAY, element.base, element.vecSize, element.columns, element,
                RUNTIME_LENGTH, null, 0, null, Collections.emptyList(), null);
    }

    /**
     * Create an array sized by a specialization constant.
     *
     * @param element       The element type.
     * @param constant      The name of the constant.
     * @param defaultLength The default value of the constant.
     * @return The type.
     */
    public static ShaderType specArray(ShaderType element, String constant, int defaultLength) {
        return new ShaderType(Kind.ARRAY, element.base, element.vecSize, element.columns, element,
                defaultLength, constant, 0, null, Collections.emptyList(), null);
    }

    public static ShaderType struct(String name, Member... members) {
        return struct(name, Arrays.asList(members));
    }

    public static ShaderType struct(String name, List<Member> members) {
        return new ShaderType(Kind.STRUCT, BaseType.STRUCT, 1, 1, null, 0, null, 0, name,
                Collections.unmodifiableList(new ArrayList<>(members)), null);
    }

    public static ShaderType pointer(ShaderType pointee, StorageClass storageClass) {
        return new ShaderType(Kind.POINTER, pointee.base, pointee.vecSize, pointee.columns, pointee,
                0, null, 0, null, Collections.emptyList(), storageClass);
    }

    @Contract(pure = true)
    public ShaderType withArrayStride(int stride) {
        if (kind != Kind.ARRAY) throw new IllegalStateException("not an array: " + this);
        return new ShaderType(kind, base, vecSize, columns, element, arrayLength, lengthConstant,
                stride, name, members, storageClass);
    }

    @Contract(pure = true)
    public ShaderType withElement(ShaderType newElement) {
        if (kind != Kind.ARRAY) throw new IllegalStateException("not an array: " + this);
        return new ShaderType(kind, newElement.base, newElement.vecSize, newElement.columns, newElement,
                arrayLength, lengthConstant, arrayStride, name, members, storageClass);
    }

    @Contract(pure = true)
    public ShaderType withMembers(List<Member> newMembers) {
        if (kind != Kind.STRUCT) throw new IllegalStateException("not a struct: " + this);
        return struct(Objects.requireNonNull(name), newMembers);
    }

    public boolean isScalar() {
        return kind == Kind.SCALAR;
    }

    public boolean isVector() {
        return kind == Kind.VECTOR;
    }

    public boolean isMatrix() {
        return kind == Kind.MATRIX;
    }

    public boolean isArray() {
        return kind == Kind.ARRAY;
    }

    public boolean isStruct() {
        return kind == Kind.STRUCT;
    }

    public boolean isPointer() {
        return kind == Kind.POINTER;
    }

    public boolean isRuntimeArray() {
        return kind == Kind.ARRAY && arrayLength == RUNTIME_LENGTH;
    }

    /**
     * Size of a single component in bytes.
     *
     * @return The width.
     */
    public int componentWidth() {
        return base.width;
    }

    /**
     * Get the type one access-chain step below this one: the element of an array, the column of a matrix,
     * the component of a vector, or the pointee of a pointer.
     *
     * @return The parent type.
     */
    public ShaderType parent() {
        switch (kind) {
            case ARRAY:
            case POINTER:
                return Objects.requireNonNull(element);
            case MATRIX:
                return vector(base, vecSize);
            case VECTOR:
                return scalar(base);
            default:
                throw new IllegalStateException("type " + this + " has no parent type");
        }
    }

    public ShaderType pointee() {
        if (kind != Kind.POINTER) throw new IllegalStateException("not a pointer: " + this);
        return Objects.requireNonNull(element);
    }

    /**
     * Strip every array dimension off this type.
     *
     * @return The innermost element type.
     */
    public ShaderType innermostElement() {
        ShaderType t = this;
        while (t.isArray()) t = t.parent();
        return t;
    }

    public Member member(int index) {
        if (kind != Kind.STRUCT) throw new IllegalStateException("not a struct: " + this);
        return members.get(index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShaderType)) return false;
        ShaderType that = (ShaderType) o;
        return vecSize == that.vecSize
                && columns == that.columns
                && arrayLength == that.arrayLength
                && arrayStride == that.arrayStride
                && kind == that.kind
                && base == that.base
                && Objects.equals(element, that.element)
                && Objects.equals(lengthConstant, that.lengthConstant)
                && Objects.equals(name, that.name)
                && members.equals(that.members)
                && storageClass == that.storageClass;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, base, vecSize, columns, element, arrayLength, name, members);
    }

    @Override
    public String toString() {
        switch (kind) {
            case VOID:
                return "void";
            case SCALAR:
                return base.name().toLowerCase(Locale.ROOT);
            case VECTOR:
                return base.name().toLowerCase(Locale.ROOT) + vecSize;
            case MATRIX:
                return base.name().toLowerCase(Locale.ROOT) + columns + "x" + vecSize;
            case ARRAY:
                return element + "[" + (isRuntimeArray() ? "" : lengthConstant != null ? lengthConstant : arrayLength) + "]";
            case STRUCT:
                return "struct " + name + members.stream()
                        .map(Member::toString)
                        .collect(Collectors.joining("; ", " { ", " }"));
            case POINTER:
                return "ptr<" + storageClass + ", " + element + ">";
            default:
                throw new IllegalStateException();
        }
    }

    /**
     * A struct member, with its layout decorations.
     */
    public static final class Member {
        public final String name;
        public final ShaderType type;
        /**
         * Declared byte offset, or -1 if undecorated.
         */
        public final int offset;
        /**
         * Declared matrix stride, or 0 if undecorated or not a matrix.
         */
        public final int matrixStride;
        public final boolean rowMajor;

        private Member(String name, ShaderType type, int offset, int matrixStride, boolean rowMajor) {
            this.name = name;
            this.type = type;
            this.offset = offset;
            this.matrixStride = matrixStride;
            this.rowMajor = rowMajor;
        }

        public static Member of(String name, ShaderType type) {
            return new Member(name, type, -1, 0, false);
        }

        public Member at(int offset) {
            return new Member(name, type, offset, matrixStride, rowMajor);
        }

        public Member withMatrixStride(int stride) {
            return new Member(name, type, offset, stride, rowMajor);
        }

        public Member withType(ShaderType newType) {
            return new Member(name, newType, offset, matrixStride, rowMajor);
        }

        public Member rowMajor() {
            return new Member(name, type, offset, matrixStride, true);
        }

        public boolean hasOffset() {
            return offset >= 0;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Member)) return false;
            Member member = (Member) o;
            return offset == member.offset
                    && matrixStride == member.matrixStride
                    && rowMajor == member.rowMajor
                    && name.equals(member.name)
                    && type.equals(member.type);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, type, offset, matrixStride, rowMajor);
        }

        @Override
        public @NotNull String toString() {
            StringBuilder sb = new StringBuilder();
            if (offset >= 0) sb.append("[offset ").append(offset).append("] ");
            if (rowMajor) sb.append("[row_major] ");
            return sb.append(type).append(' ').append(name).toString();
        }
    }
}
