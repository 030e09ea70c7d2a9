package io.github.eutro.spv2sl.ops;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.Function;

/**
 * A key for operations carrying one non-null payload, such as the operator of a {@code binary} or the
 * variable named by a {@code variable}.
 *
 * @param <T> The type of the payload.
 */
public class UnaryOpKey<T> extends OpKey {
    private final Function<T, String> printer;

    public UnaryOpKey(String mnemonic, Function<T, String> printer) {
        super(mnemonic);
        this.printer = printer;
    }

    public UnaryOpKey(String mnemonic) {
        this(mnemonic, Objects::toString);
    }

    public class UnaryOp extends Op {
        public final T arg;

        UnaryOp(T arg) {
            super(UnaryOpKey.this);
            this.arg = arg;
        }

        @Override
        public String toString() {
            return key + " " + printer.apply(arg);
        }
    }

    /**
     * Get the payload of an operation, if it has this key.
     *
     * @param op The operation.
     * @return The payload, or null if the operation has another key.
     */
    public @Nullable T argNullable(Op op) {
        if (op.key != this) return null;
        return cast(op).arg;
    }

    public UnaryOp cast(Op op) {
        if (op.key != this) throw new ClassCastException(op + " is not " + mnemonic);
        @SuppressWarnings("unchecked")
        UnaryOp ret = (UnaryOp) op;
        return ret;
    }

    public UnaryOp create(T arg) {
        return new UnaryOp(Objects.requireNonNull(arg, mnemonic + " needs a payload"));
    }
}
