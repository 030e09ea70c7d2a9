package io.github.eutro.spv2sl.emit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A sink that records what it is given, to be inspected or replayed into another sink later.
 * <p>
 * Used where the text of a construct is only known after its contents, like the clauses of a {@code for} loop.
 */
public class BufferedSink implements StatementSink {
    private enum Kind {
        STATEMENT,
        BEGIN,
        END,
    }

    private static final class Event {
        final Kind kind;
        final String text;

        Event(Kind kind, String text) {
            this.kind = kind;
            this.text = text;
        }
    }

    private final StatementSink parent;
    private final List<Event> events = new ArrayList<>();

    /**
     * Create a buffer.
     *
     * @param parent The sink recompile requests and resolvers are passed on to.
     */
    public BufferedSink(StatementSink parent) {
        this.parent = parent;
    }

    @Override
    public void emitStatement(String... tokens) {
        events.add(new Event(Kind.STATEMENT, String.join("", tokens)));
    }

    @Override
    public void beginScope() {
        events.add(new Event(Kind.BEGIN, ""));
    }

    @Override
    public void endScope() {
        endScope("");
    }

    @Override
    public void endScope(String suffix) {
        events.add(new Event(Kind.END, suffix));
    }

    @Override
    public void requestRecompile() {
        parent.requestRecompile();
    }

    @Override
    public void bind(ExpressionResolver resolver) {
        parent.bind(resolver);
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    /**
     * Whether anything other than plain statements was recorded.
     *
     * @return The above.
     */
    public boolean hasScopes() {
        for (Event event : events) {
            if (event.kind != Kind.STATEMENT) return true;
        }
        return false;
    }

    /**
     * Get the recorded statements, ignoring scopes.
     *
     * @return The statements, in order.
     */
    public List<String> statements() {
        List<String> statements = new ArrayList<>();
        for (Event event : events) {
            if (event.kind == Kind.STATEMENT) statements.add(event.text);
        }
        return Collections.unmodifiableList(statements);
    }

    public void replayInto(StatementSink sink) {
        for (Event event : events) {
            switch (event.kind) {
                case STATEMENT:
                    sink.emitStatement(event.text);
                    break;
                case BEGIN:
                    sink.beginScope();
                    break;
                case END:
                    sink.endScope(event.text);
                    break;
            }
        }
    }
}
