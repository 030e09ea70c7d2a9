package io.github.eutro.spv2sl.emit;

/**
 * Receives the reconstructed program as a stream of statements and scopes.
 * <p>
 * Calls always nest properly: every {@link #beginScope()} is closed by exactly one {@code endScope}.
 */
public interface StatementSink {
    /**
     * Emit a statement. The tokens are concatenated as they are.
     *
     * @param tokens The tokens of the statement.
     */
    void emitStatement(String... tokens);

    void beginScope();

    void endScope();

    /**
     * Close a scope, with text following the closing brace on the same line, as in {@code } while (c);}.
     *
     * @param suffix The text after the brace.
     */
    void endScope(String suffix);

    /**
     * Ask for the whole program to be emitted again, because a decision made on this pass was wrong.
     */
    void requestRecompile();

    /**
     * Give the sink a way to look up the text of values.
     *
     * @param resolver The resolver.
     */
    void bind(ExpressionResolver resolver);
}
