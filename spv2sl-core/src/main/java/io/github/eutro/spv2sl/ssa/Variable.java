package io.github.eutro.spv2sl.ssa;

import io.github.eutro.spv2sl.ext.ExtHolder;
import io.github.eutro.spv2sl.types.ShaderType;
import org.jetbrains.annotations.Nullable;

/**
 * A mutable storage location, as opposed to an SSA {@link Var}.
 * <p>
 * Values read from a variable stay valid only until the variable is next written.
 */
public final class Variable extends ExtHolder {
    public enum StorageClass {
        FUNCTION,
        PRIVATE,
        WORKGROUP,
        INPUT,
        OUTPUT,
        UNIFORM,
        STORAGE_BUFFER,
        PUSH_CONSTANT,
    }

    public final String name;
    public final ShaderType type;
    public final StorageClass storageClass;
    /**
     * Constant initializer, or null.
     */
    public @Nullable Object initializer;
    /**
     * Whether reads may observe a different value each time, as with some built-in inputs.
     */
    public boolean isVolatile;
    /**
     * Set for the synthesized variable that holds a phi result.
     */
    public final @Nullable Var phiOf;

    public Variable(String name, ShaderType type, StorageClass storageClass) {
        this(name, type, storageClass, null);
    }

    private Variable(String name, ShaderType type, StorageClass storageClass, @Nullable Var phiOf) {
        this.name = name;
        this.type = type;
        this.storageClass = storageClass;
        this.phiOf = phiOf;
    }

    /**
     * Create the function-scope variable that backs the result of a phi.
     *
     * @param phi  The phi result.
     * @param name The name to declare it under.
     * @param type The type of the phi.
     * @return The variable.
     */
    public static Variable forPhi(Var phi, String name, ShaderType type) {
        return new Variable(name, type, StorageClass.FUNCTION, phi);
    }

    public Variable withInitializer(Object initializer) {
        this.initializer = initializer;
        return this;
    }

    public Variable markVolatile() {
        isVolatile = true;
        return this;
    }

    public boolean isFunctionLocal() {
        return storageClass == StorageClass.FUNCTION;
    }

    @Override
    public String toString() {
        return '%' + name;
    }
}
