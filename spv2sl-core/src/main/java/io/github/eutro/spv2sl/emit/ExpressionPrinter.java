package io.github.eutro.spv2sl.emit;

import io.github.eutro.spv2sl.types.ShaderType;
import io.github.eutro.spv2sl.types.TypeNames;
import io.github.eutro.spv2sl.util.SourceText;

import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * Builds expression text out of the text of operands.
 */
public class ExpressionPrinter {
    public static String binary(String lhs, String operator, String rhs) {
        return SourceText.enclose(lhs) + " " + operator + " " + SourceText.enclose(rhs);
    }

    public static String unary(String operator, String operand) {
        return operator + SourceText.enclose(operand);
    }

    public static String select(String condition, String ifTrue, String ifFalse) {
        return SourceText.enclose(condition) + " ? " + SourceText.enclose(ifTrue) + " : " + SourceText.enclose(ifFalse);
    }

    public static String call(String function, List<String> args) {
        StringJoiner sj = new StringJoiner(", ", function + "(", ")");
        for (String arg : args) {
            sj.add(arg);
        }
        return sj.toString();
    }

    public static String construct(ShaderType type, List<String> args) {
        return call(TypeNames.of(type), args);
    }

    /**
     * Render the text selecting part of a composite by literal indices.
     *
     * @param base    The composite expression.
     * @param type    The type of the composite.
     * @param indices The indices.
     * @return The text.
     */
    public static String extract(String base, ShaderType type, List<Integer> indices) {
        StringBuilder sb = new StringBuilder(SourceText.enclose(base));
        for (int index : indices) {
            if (type.isStruct()) {
                ShaderType.Member member = type.member(index);
                sb.append('.').append(member.name);
                type = member.type;
            } else if (type.isVector()) {
                sb.append(SourceText.swizzle(1, index));
                type = type.parent();
            } else {
                sb.append('[').append(index).append(']');
                type = type.parent();
            }
        }
        return sb.toString();
    }

    /**
     * Render a constant.
     *
     * @param value The constant: a boolean, a number, or a list of constants for a composite.
     * @param type  The type of the constant.
     * @return The literal text.
     */
    public static String literal(Object value, ShaderType type) {
        if (value instanceof List) {
            ShaderType element = type.isStruct() ? null : type.parent();
            List<?> elements = (List<?>) value;
            StringJoiner sj = new StringJoiner(", ", TypeNames.of(type) + "(", ")");
            for (int i = 0; i < elements.size(); i++) {
                sj.add(literal(elements.get(i), element == null ? type.member(i).type : element));
            }
            return sj.toString();
        }
        if (value instanceof Boolean) return value.toString();
        if (!(value instanceof Number)) throw new IllegalArgumentException("not a constant: " + value);
        Number number = (Number) value;
        switch (type.base) {
            case HALF:
            case FLOAT:
                return floatLiteral(number.floatValue(), "");
            case DOUBLE:
                return floatLiteral(number.doubleValue(), "lf");
            case UINT:
                return Long.toString(number.longValue() & 0xFFFFFFFFL) + "u";
            case UINT64:
                return Long.toUnsignedString(number.longValue()) + "ul";
            case INT64:
                return number.longValue() + "l";
            default:
                return Long.toString(number.longValue());
        }
    }

    private static String floatLiteral(double value, String suffix) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("no literal for " + value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.format(Locale.ROOT, "%.1f", value) + suffix;
        }
        return (suffix.isEmpty() ? Float.toString((float) value) : Double.toString(value)) + suffix;
    }
}
