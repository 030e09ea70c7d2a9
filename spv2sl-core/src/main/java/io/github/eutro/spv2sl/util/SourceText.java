package io.github.eutro.spv2sl.util;

/**
 * Helpers for splicing expression text together.
 */
public class SourceText {
    private static final String COMPONENTS = "xyzw";

    /**
     * Whether an expression has to be parenthesized before it can be used as an operand.
     *
     * @param expr The expression text.
     * @return Whether it contains an operator outside any brackets.
     */
    public static boolean needsEnclosing(String expr) {
        if (expr.isEmpty()) return false;
        int depth = 0;
        for (int i = 0; i < expr.length(); i++) {
            char c = expr.charAt(i);
            switch (c) {
                case '(':
                case '[':
                    depth++;
                    break;
                case ')':
                case ']':
                    depth--;
                    break;
                case ' ':
                case '+':
                case '*':
                case '/':
                case '%':
                case '<':
                case '>':
                case '=':
                case '&':
                case '|':
                case '^':
                case '?':
                case ':':
                case ',':
                    if (depth == 0) return true;
                    break;
                case '-':
                    // exponent sign, as in 1e-5
                    if (i >= 2 && (expr.charAt(i - 1) == 'e' || expr.charAt(i - 1) == 'E')
                            && Character.isDigit(expr.charAt(i - 2))) {
                        break;
                    }
                    if (depth == 0) return true;
                    break;
                case '!':
                case '~':
                    if (depth == 0) return true;
                    break;
                default:
                    break;
            }
        }
        return false;
    }

    public static String enclose(String expr) {
        return needsEnclosing(expr) ? "(" + expr + ")" : expr;
    }

    /**
     * Logically negate a boolean expression.
     *
     * @param expr The expression text.
     * @return The negated text.
     */
    public static String negate(String expr) {
        if (expr.startsWith("!") && !needsEnclosing(expr.substring(1))) {
            return expr.substring(1);
        }
        return "!" + enclose(expr);
    }

    /**
     * Get the swizzle selecting {@code count} consecutive components, starting at {@code first}.
     *
     * @param count The number of components.
     * @param first The first component.
     * @return The swizzle, including the leading dot, or an empty string for a whole four-component vector.
     */
    public static String swizzle(int count, int first) {
        if (first < 0 || count < 1 || first + count > COMPONENTS.length()) {
            throw new IllegalArgumentException("no swizzle of " + count + " components from " + first);
        }
        if (count == COMPONENTS.length()) return "";
        return "." + COMPONENTS.substring(first, first + count);
    }
}
