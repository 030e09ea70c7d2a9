package io.github.eutro.spv2sl.emit;

import io.github.eutro.spv2sl.ssa.Var;
import org.jetbrains.annotations.Nullable;

/**
 * A sink that renders statements as indented text, with braces on lines of their own.
 */
public class TextSink implements StatementSink {
    private static final String INDENT = "    ";

    private final StringBuilder sb = new StringBuilder();
    private int depth = 0;
    private boolean recompileRequested = false;
    private @Nullable ExpressionResolver resolver;

    private void line(String text) {
        if (!text.isEmpty()) {
            for (int i = 0; i < depth; i++) {
                sb.append(INDENT);
            }
            sb.append(text);
        }
        sb.append('\n');
    }

    @Override
    public void emitStatement(String... tokens) {
        line(String.join("", tokens));
    }

    @Override
    public void beginScope() {
        line("{");
        depth++;
    }

    @Override
    public void endScope() {
        endScope("");
    }

    @Override
    public void endScope(String suffix) {
        if (depth == 0) throw new IllegalStateException("no scope to end");
        depth--;
        line("}" + suffix);
    }

    @Override
    public void requestRecompile() {
        recompileRequested = true;
    }

    @Override
    public void bind(ExpressionResolver resolver) {
        this.resolver = resolver;
    }

    public boolean isRecompileRequested() {
        return recompileRequested;
    }

    public int getDepth() {
        return depth;
    }

    /**
     * Look up the text of a value through the bound resolver.
     *
     * @param value The value.
     * @return The text.
     */
    public String resolve(Var value) {
        if (resolver == null) throw new IllegalStateException("no resolver bound");
        return resolver.resolveExpressionText(value);
    }

    public String getText() {
        return sb.toString();
    }

    @Override
    public String toString() {
        return getText();
    }
}
