package io.github.eutro.spv2sl.ops;

/**
 * A key for an operation without intermediates, which therefore only needs a single {@link Op}.
 */
public class SimpleOpKey extends OpKey {
    private final Op op = new Op(this);

    public SimpleOpKey(String mnemonic) {
        super(mnemonic);
    }

    public Op create() {
        return op;
    }
}
