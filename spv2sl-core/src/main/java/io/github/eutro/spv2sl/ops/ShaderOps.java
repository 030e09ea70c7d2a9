package io.github.eutro.spv2sl.ops;

import io.github.eutro.spv2sl.ext.CommonExts;
import io.github.eutro.spv2sl.ssa.Variable;
import io.github.eutro.spv2sl.types.ShaderType;

import java.util.List;

/**
 * Operations on shader values and memory.
 */
public class ShaderOps {
    /**
     * Effect: returns a pointer to the variable.
     */
    public static final UnaryOpKey<Variable> VARIABLE = new UnaryOpKey<>("variable", v -> v.name);
    /**
     * Effect: returns the value behind its pointer argument.
     */
    public static final Op LOAD = new SimpleOpKey("load").create();
    /**
     * Effect: writes its second argument through its first, returns nothing.
     */
    public static final Op STORE = new SimpleOpKey("store").create();
    /**
     * Effect: returns a pointer into the aggregate behind its first argument, indexed by the remaining arguments.
     */
    public static final Op ACCESS_CHAIN = new SimpleOpKey("access_chain").create();

    /**
     * Effect: applies the infix operator to its two arguments.
     */
    public static final UnaryOpKey<String> BINARY = new UnaryOpKey<>("binary");
    /**
     * Effect: applies the prefix operator to its argument.
     */
    public static final UnaryOpKey<String> UNARY = new UnaryOpKey<>("unary");
    /**
     * Effect: returns its second argument if the first is true, else its third.
     */
    public static final Op SELECT = new SimpleOpKey("select").create();
    /**
     * Effect: calls a built-in function with no side effects.
     */
    public static final UnaryOpKey<String> INTRINSIC = new UnaryOpKey<>("intrinsic");
    /**
     * Effect: calls a function of the module, which may have side effects.
     */
    public static final UnaryOpKey<String> CALL = new UnaryOpKey<>("call");
    /**
     * Effect: converts its argument to the type.
     */
    public static final UnaryOpKey<ShaderType> CONVERT = new UnaryOpKey<>("convert");
    /**
     * Effect: extracts a member, element or component from a composite value by literal indices.
     */
    public static final UnaryOpKey<List<Integer>> COMPOSITE_EXTRACT = new UnaryOpKey<>("composite_extract");
    /**
     * Effect: builds a composite of the result type from its arguments.
     */
    public static final Op COMPOSITE_CONSTRUCT = new SimpleOpKey("composite_construct").create();
    public static final Op TRANSPOSE = new SimpleOpKey("transpose").create();
    /**
     * Effect: matrix times matrix.
     */
    public static final Op MAT_MUL = new SimpleOpKey("mat_mul").create();
    /**
     * Effect: matrix times column vector.
     */
    public static final Op MAT_VEC_MUL = new SimpleOpKey("mat_vec_mul").create();

    static {
        for (OpKey key : new OpKey[]{
                VARIABLE,
                LOAD.key,
                ACCESS_CHAIN.key,
                BINARY,
                UNARY,
                SELECT.key,
                INTRINSIC,
                CONVERT,
                COMPOSITE_EXTRACT,
                COMPOSITE_CONSTRUCT.key,
                TRANSPOSE.key,
                MAT_MUL.key,
                MAT_VEC_MUL.key,
        }) {
            CommonExts.markPure(key);
        }
    }
}
