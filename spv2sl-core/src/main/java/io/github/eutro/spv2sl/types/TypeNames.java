package io.github.eutro.spv2sl.types;

/**
 * Spells shader types the way C-like shading languages do.
 */
public class TypeNames {
    public static String of(ShaderType type) {
        switch (type.kind) {
            case VOID:
                return "void";
            case SCALAR:
                return scalarName(type.base);
            case VECTOR:
                return vectorPrefix(type.base) + "vec" + type.vecSize;
            case MATRIX:
                String prefix = type.base == ShaderType.BaseType.DOUBLE ? "d" : "";
                if (type.columns == type.vecSize) return prefix + "mat" + type.columns;
                return prefix + "mat" + type.columns + "x" + type.vecSize;
            case ARRAY:
                return of(type.innermostElement()) + arraySuffix(type);
            case STRUCT:
                return type.name;
            default:
                throw new IllegalArgumentException("type " + type + " has no name");
        }
    }

    /**
     * Spell a declaration of {@code name}, with array dimensions after the name.
     *
     * @param type The declared type.
     * @param name The declared name.
     * @return The declaration, without initializer.
     */
    public static String declare(ShaderType type, String name) {
        if (type.isArray()) {
            return of(type.innermostElement()) + " " + name + arraySuffix(type);
        }
        return of(type) + " " + name;
    }

    private static String arraySuffix(ShaderType type) {
        StringBuilder sb = new StringBuilder();
        for (ShaderType t = type; t.isArray(); t = t.parent()) {
            sb.append('[');
            if (t.lengthConstant != null) {
                sb.append(t.lengthConstant);
            } else if (!t.isRuntimeArray()) {
                sb.append(t.arrayLength);
            }
            sb.append(']');
        }
        return sb.toString();
    }

    private static String scalarName(ShaderType.BaseType base) {
        switch (base) {
            case BOOL:
                return "bool";
            case INT:
                return "int";
            case UINT:
                return "uint";
            case INT64:
                return "int64_t";
            case UINT64:
                return "uint64_t";
            case HALF:
                return "float16_t";
            case FLOAT:
                return "float";
            case DOUBLE:
                return "double";
            default:
                throw new IllegalArgumentException("no scalar type " + base);
        }
    }

    private static String vectorPrefix(ShaderType.BaseType base) {
        switch (base) {
            case BOOL:
                return "b";
            case INT:
                return "i";
            case UINT:
                return "u";
            case INT64:
                return "i64";
            case UINT64:
                return "u64";
            case HALF:
                return "f16";
            case FLOAT:
                return "";
            case DOUBLE:
                return "d";
            default:
                throw new IllegalArgumentException("no vector type of " + base);
        }
    }
}
