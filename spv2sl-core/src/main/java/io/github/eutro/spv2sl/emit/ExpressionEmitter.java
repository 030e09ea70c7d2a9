package io.github.eutro.spv2sl.emit;

import io.github.eutro.spv2sl.compile.CompilerOptions;
import io.github.eutro.spv2sl.compile.MalformedInputException;
import io.github.eutro.spv2sl.compile.UnsupportedConstructException;
import io.github.eutro.spv2sl.ext.CommonExts;
import io.github.eutro.spv2sl.layout.AccessChainResolver;
import io.github.eutro.spv2sl.layout.ChainIndex;
import io.github.eutro.spv2sl.layout.FlattenedAccess;
import io.github.eutro.spv2sl.ops.CommonOps;
import io.github.eutro.spv2sl.ops.OpKey;
import io.github.eutro.spv2sl.ops.ShaderOps;
import io.github.eutro.spv2sl.ssa.*;
import io.github.eutro.spv2sl.tracker.ExpressionTracker;
import io.github.eutro.spv2sl.tracker.ValueState;
import io.github.eutro.spv2sl.types.ShaderType;
import io.github.eutro.spv2sl.types.TypeNames;
import io.github.eutro.spv2sl.util.SourceText;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Emits the straight-line effects of blocks, forwarding values or binding them to temporaries as the
 * {@link ExpressionTracker} decides.
 */
public class ExpressionEmitter {
    private static final Logger LOGGER = LogManager.getLogger(ExpressionEmitter.class);
    private static final int WORD_STRIDE = 16;

    private final CompilerOptions options;
    private final ExpressionTracker tracker;
    private StatementSink sink;
    private int declarations = 0;

    private final Map<Var, Pointer> pointers = new HashMap<>();
    private final Map<Effect, Variable> suppressedStores = new HashMap<>();
    private final Map<Variable, Var> suppressedStoreValues = new HashMap<>();
    private final Set<Effect> declaringStores = new HashSet<>();

    public ExpressionEmitter(CompilerOptions options, ExpressionTracker tracker, StatementSink sink) {
        this.options = options;
        this.tracker = tracker;
        this.sink = sink;
    }

    public ExpressionTracker getTracker() {
        return tracker;
    }

    public StatementSink getSink() {
        return sink;
    }

    /**
     * Redirect emission to another sink.
     *
     * @param sink The new sink.
     * @return The previous sink.
     */
    public StatementSink setSink(StatementSink sink) {
        StatementSink old = this.sink;
        this.sink = sink;
        return old;
    }

    /**
     * Get the number of declarations emitted so far, so callers can tell whether a region declared anything.
     *
     * @return The count.
     */
    public int getDeclarationCount() {
        return declarations;
    }

    public void emitDeclaration(ShaderType type, String name, @Nullable String init) {
        declarations++;
        if (init == null) {
            sink.emitStatement(TypeNames.declare(type, name), ";");
        } else {
            sink.emitStatement(TypeNames.declare(type, name), " = ", init, ";");
        }
    }

    /**
     * Do not emit a store, but remember the stored value, for a variable declared elsewhere.
     *
     * @param store    The store effect.
     * @param variable The variable stored to.
     */
    public void suppressStore(Effect store, Variable variable) {
        suppressedStores.put(store, variable);
    }

    /**
     * Read the value of a suppressed store at the point the variable is finally declared.
     * <p>
     * The read goes through the tracker, so a value made stale by a write since the store is forced to a
     * temporary.
     *
     * @param variable The variable.
     * @return The text of the stored value, or null if no suppressed store to it has been seen.
     */
    public @Nullable String suppressedStoreValue(Variable variable) {
        Var value = suppressedStoreValues.get(variable);
        return value == null ? null : unpack(tracker.read(value));
    }

    /**
     * Emit a store as the declaration of the variable it stores to.
     *
     * @param store The store effect.
     */
    public void declareAtStore(Effect store) {
        declaringStores.add(store);
    }

    public void emitEffects(BasicBlock block) {
        for (Effect effect : block.getEffects()) {
            if (effect.insn().op.key == CommonOps.PHI) continue;
            try {
                emitEffect(effect);
            } catch (RuntimeException e) {
                e.addSuppressed(new RuntimeException("emitting " + effect + " in " + block.toTargetString()));
                throw e;
            }
        }
    }

    public void emitEffect(Effect effect) {
        Insn insn = effect.insn();
        OpKey key = insn.op.key;
        Var result = effect.result();
        if (key == CommonOps.CONST) {
            Object value = CommonOps.CONST.cast(insn.op).arg;
            tracker.forward(requireResult(effect), ExpressionPrinter.literal(value, requireResult(effect).getType()),
                    Collections.emptyList(), Collections.emptySet(), false);
        } else if (key == CommonOps.ARG) {
            Var param = requireResult(effect);
            tracker.forward(param, param.identifier(), Collections.emptyList(), Collections.emptySet(), false);
        } else if (key == ShaderOps.VARIABLE) {
            emitVariable(effect);
        } else if (insn.op == ShaderOps.ACCESS_CHAIN) {
            emitAccessChain(effect);
        } else if (insn.op == ShaderOps.LOAD) {
            emitLoad(effect);
        } else if (insn.op == ShaderOps.STORE) {
            emitStore(effect);
        } else if (key == ShaderOps.CALL) {
            emitCall(effect);
        } else if (key == ShaderOps.BINARY) {
            String operator = ShaderOps.BINARY.cast(insn.op).arg;
            define(requireResult(effect), ExpressionPrinter.binary(text(insn.arg(0)), operator, text(insn.arg(1))),
                    insn.args(), false);
        } else if (key == ShaderOps.UNARY) {
            String operator = ShaderOps.UNARY.cast(insn.op).arg;
            define(requireResult(effect), ExpressionPrinter.unary(operator, text(insn.arg(0))), insn.args(), false);
        } else if (insn.op == ShaderOps.SELECT) {
            define(requireResult(effect),
                    ExpressionPrinter.select(text(insn.arg(0)), text(insn.arg(1)), text(insn.arg(2))),
                    insn.args(), false);
        } else if (key == ShaderOps.INTRINSIC) {
            define(requireResult(effect),
                    ExpressionPrinter.call(ShaderOps.INTRINSIC.cast(insn.op).arg, texts(insn.args())),
                    insn.args(), false);
        } else if (key == ShaderOps.CONVERT) {
            ShaderType target = ShaderOps.CONVERT.cast(insn.op).arg;
            define(requireResult(effect), ExpressionPrinter.construct(target, texts(insn.args())), insn.args(), false);
        } else if (key == ShaderOps.COMPOSITE_EXTRACT) {
            List<Integer> indices = ShaderOps.COMPOSITE_EXTRACT.cast(insn.op).arg;
            Var base = insn.arg(0);
            define(requireResult(effect), ExpressionPrinter.extract(text(base), base.getType(), indices),
                    insn.args(), false);
        } else if (insn.op == ShaderOps.COMPOSITE_CONSTRUCT) {
            Var value = requireResult(effect);
            define(value, ExpressionPrinter.construct(value.getType(), texts(insn.args())), insn.args(), false);
        } else if (insn.op == ShaderOps.TRANSPOSE) {
            ValueState arg = tracker.read(insn.arg(0));
            if (arg.needsTranspose()) {
                define(requireResult(effect), arg.getText(), insn.args(), false);
            } else {
                define(requireResult(effect), "transpose(" + arg.getText() + ")", insn.args(), false);
            }
        } else if (insn.op == ShaderOps.MAT_MUL) {
            emitMatrixProduct(effect);
        } else if (insn.op == ShaderOps.MAT_VEC_MUL) {
            ValueState matrix = tracker.read(insn.arg(0));
            ValueState vector = tracker.read(insn.arg(1));
            String text;
            if (matrix.needsTranspose()) {
                // transpose(M) * v == v * M
                text = ExpressionPrinter.binary(unpack(vector), "*", matrix.getText());
            } else {
                text = ExpressionPrinter.binary(matrix.getText(), "*", unpack(vector));
            }
            define(requireResult(effect), text, insn.args(), false);
        } else {
            throw new UnsupportedConstructException("no rendering for " + insn.op, effect);
        }
        if (result != null && LOGGER.isTraceEnabled()) {
            LOGGER.trace("{} -> {}", effect, tracker.peek(result));
        }
    }

    private static Var requireResult(Effect effect) {
        Var result = effect.result();
        if (result == null) throw new MalformedInputException("effect has no single result", effect);
        return result;
    }

    private static String unpack(ValueState state) {
        return state.needsTranspose() ? "transpose(" + state.getText() + ")" : state.getText();
    }

    private String text(Var value) {
        return tracker.readText(value);
    }

    private List<String> texts(List<Var> values) {
        List<String> texts = new ArrayList<>();
        for (Var value : values) {
            texts.add(text(value));
        }
        return texts;
    }

    /**
     * Forward a value or declare a temporary for it.
     *
     * @param value          The value.
     * @param text           Its expression.
     * @param args           The values the expression reads.
     * @param needsTranspose Whether the expression is the transpose of the value.
     */
    private void define(Var value, String text, List<Var> args, boolean needsTranspose) {
        define(value, text, args, Collections.emptySet(), needsTranspose);
    }

    private void define(Var value, String text, List<Var> args, Set<Variable> deps, boolean needsTranspose) {
        if (tracker.shouldForward(value, tracker.forwardDepth(args))) {
            tracker.forward(value, text, args, deps, needsTranspose);
        } else {
            bindTemporary(value, text, needsTranspose);
        }
    }

    private void bindTemporary(Var value, String text, boolean needsTranspose) {
        ShaderType type = value.getType();
        if (needsTranspose) type = ShaderType.matrix(type.base, type.vecSize, type.columns);
        if (value.getNullable(CommonExts.HOISTED_BEFORE) != null) {
            // declared ahead of the loop it escapes
            sink.emitStatement(value.identifier(), " = ", text, ";");
        } else {
            emitDeclaration(type, value.identifier(), text);
        }
        tracker.bindTemporary(value, needsTranspose);
    }

    /**
     * Declare a value that is defined inside a loop but read after it, ahead of the loop.
     *
     * @param value The value.
     */
    public void declareHoisted(Var value) {
        emitDeclaration(value.getType(), value.identifier(), null);
    }

    private void emitMatrixProduct(Effect effect) {
        Insn insn = effect.insn();
        ValueState lhs = tracker.read(insn.arg(0));
        ValueState rhs = tracker.read(insn.arg(1));
        if (lhs.needsTranspose() && rhs.needsTranspose()) {
            // transpose(A) * transpose(B) == transpose(B * A)
            define(requireResult(effect), ExpressionPrinter.binary(rhs.getText(), "*", lhs.getText()),
                    insn.args(), true);
        } else {
            define(requireResult(effect), ExpressionPrinter.binary(unpack(lhs), "*", unpack(rhs)),
                    insn.args(), false);
        }
    }

    private void emitCall(Effect effect) {
        Insn insn = effect.insn();
        String function = ShaderOps.CALL.cast(insn.op).arg;
        List<String> args = new ArrayList<>();
        Set<Variable> written = new LinkedHashSet<>();
        for (Var arg : insn.args()) {
            if (arg.getType().isPointer()) {
                Pointer pointer = pointer(arg);
                tracker.read(arg);
                args.add(pointer.lvalue(arg));
                written.add(pointer.root);
            } else {
                args.add(text(arg));
            }
        }
        String call = ExpressionPrinter.call(function, args);
        Var result = effect.result();
        if (result == null) {
            sink.emitStatement(call, ";");
        } else {
            define(result, call, insn.args(), false);
        }
        tracker.invalidateAll(written);
        tracker.invalidateGlobals();
    }

    private boolean isFlattened(Variable variable) {
        return options.flattenUniformBuffers
                && variable.storageClass == Variable.StorageClass.UNIFORM
                && variable.type.isStruct();
    }

    private void emitVariable(Effect effect) {
        Var result = requireResult(effect);
        Variable variable = ShaderOps.VARIABLE.cast(effect.insn().op).arg;
        Pointer pointer = new Pointer(variable, variable.type);
        pointer.text = variable.name;
        if (isFlattened(variable)) pointer.flattened = new ArrayList<>();
        pointers.put(result, pointer);
        tracker.forward(result, variable.name, Collections.emptyList(), Collections.emptySet(), false);
    }

    private Pointer pointer(Var value) {
        Pointer pointer = pointers.get(value);
        if (pointer == null) throw new MalformedInputException("pointer of unknown origin", value);
        return pointer;
    }

    private void emitAccessChain(Effect effect) {
        Insn insn = effect.insn();
        Var result = requireResult(effect);
        Pointer base = pointer(insn.arg(0));
        tracker.read(insn.arg(0));
        Pointer pointer = base.copy();
        List<Var> indices = insn.args().subList(1, insn.args().size());
        for (Var index : indices) {
            String indexText = text(index);
            Object constant = CommonOps.constantValue(index);
            ShaderType type = pointer.type;
            if (pointer.flattened != null) {
                pointer.flattened.add(constant instanceof Number
                        ? ChainIndex.constant(((Number) constant).intValue())
                        : ChainIndex.dynamic(indexText));
            }
            if (type.isStruct()) {
                if (!(constant instanceof Number)) {
                    throw new MalformedInputException("struct member index is not constant", index);
                }
                ShaderType.Member member = type.member(((Number) constant).intValue());
                pointer.append("." + member.name);
                pointer.type = member.type;
                pointer.rowMajor = member.rowMajor && !options.nativeRowMajorMatrix
                        && member.type.innermostElement().isMatrix();
            } else if (type.isArray()) {
                pointer.append("[" + indexText + "]");
                pointer.type = type.parent();
            } else if (type.isMatrix()) {
                if (pointer.rowMajor) {
                    // a column of a transposed matrix is a row of what is stored
                    pointer.storedMatrix = pointer.text;
                    pointer.column = indexText;
                    pointer.text = null;
                    pointer.rowMajor = false;
                } else {
                    pointer.append("[" + indexText + "]");
                }
                pointer.type = type.parent();
            } else if (type.isVector()) {
                if (pointer.storedMatrix != null) {
                    pointer.text = pointer.storedMatrix + "[" + indexText + "][" + pointer.column + "]";
                    pointer.storedMatrix = null;
                    pointer.column = null;
                } else if (constant instanceof Number) {
                    pointer.append(SourceText.swizzle(1, ((Number) constant).intValue()));
                } else {
                    pointer.append("[" + indexText + "]");
                }
                pointer.type = type.parent();
            } else {
                throw new MalformedInputException("cannot subdivide a scalar", index);
            }
        }
        if (pointer.flattened != null) {
            // validate the chain now, so errors point at the access chain rather than the load
            new AccessChainResolver(options.uniformBufferStandard, WORD_STRIDE)
                    .resolve(pointer.root.type, pointer.flattened);
        }
        pointers.put(result, pointer);
        tracker.forward(result, pointer.text == null ? "" : pointer.text, indices,
                Collections.emptySet(), false);
    }

    private void emitLoad(Effect effect) {
        Var result = requireResult(effect);
        Var ptr = effect.insn().arg(0);
        Pointer pointer = pointer(ptr);
        tracker.read(ptr);
        Set<Variable> deps = Collections.singleton(pointer.root);
        List<Var> args = Collections.singletonList(ptr);
        if (pointer.flattened != null) {
            AccessChainResolver resolver = new AccessChainResolver(options.uniformBufferStandard, WORD_STRIDE);
            FlattenedAccess access = FlattenedAccess.read(pointer.root.name, pointer.root.type, pointer.flattened, resolver);
            define(result, access.text, args, deps, access.needsTranspose);
        } else if (pointer.storedMatrix != null) {
            ShaderType column = pointer.type;
            List<String> components = new ArrayList<>();
            for (int row = 0; row < column.vecSize; row++) {
                components.add(pointer.storedMatrix + "[" + row + "][" + pointer.column + "]");
            }
            define(result, ExpressionPrinter.construct(column, components), args, deps, false);
        } else if (pointer.rowMajor) {
            if (!pointer.type.isMatrix()) {
                throw new UnsupportedConstructException("cannot load an array of row-major matrices as a whole", effect);
            }
            define(result, pointer.text, args, deps, true);
        } else {
            define(result, pointer.text, args, deps, false);
        }
    }

    private void emitStore(Effect effect) {
        Insn insn = effect.insn();
        Var ptr = insn.arg(0);
        Pointer pointer = pointer(ptr);
        tracker.read(ptr);
        String target = pointer.lvalue(ptr);
        Variable suppressedFor = suppressedStores.get(effect);
        if (suppressedFor != null) {
            // read where the variable is declared
            suppressedStoreValues.put(suppressedFor, insn.arg(1));
            tracker.invalidateOnWrite(pointer.root);
            return;
        }

        ValueState value = tracker.read(insn.arg(1));
        String text;
        if (pointer.rowMajor) {
            text = value.needsTranspose() ? value.getText() : "transpose(" + value.getText() + ")";
        } else {
            text = unpack(value);
        }

        if (declaringStores.contains(effect)) {
            emitDeclaration(pointer.root.type, pointer.root.name, text);
        } else {
            sink.emitStatement(target, " = ", text, ";");
        }
        tracker.invalidateOnWrite(pointer.root);
    }

    /**
     * Where a pointer value points, and how to name it.
     */
    private static final class Pointer {
        final Variable root;
        ShaderType type;
        /**
         * The assignable expression naming the pointee, or null if it has none.
         */
        @Nullable String text;
        /**
         * Whether the pointee is a matrix, or an array of matrices, stored transposed.
         */
        boolean rowMajor;
        /**
         * Set when pointing at a column of a transposed matrix: the stored matrix and the column index.
         */
        @Nullable String storedMatrix;
        @Nullable String column;
        /**
         * The chain from the root, if the root is a flattened buffer.
         */
        @Nullable List<ChainIndex> flattened;

        Pointer(Variable root, ShaderType type) {
            this.root = root;
            this.type = type;
        }

        void append(String suffix) {
            if (text == null) throw new UnsupportedConstructException("cannot index into a column of a row-major matrix", root);
            text += suffix;
        }

        String lvalue(Var value) {
            if (flattened != null) {
                throw new UnsupportedConstructException("cannot write to a flattened buffer", value);
            }
            if (text == null) {
                throw new UnsupportedConstructException("cannot write to a column of a row-major matrix", value);
            }
            return text;
        }

        Pointer copy() {
            Pointer copy = new Pointer(root, type);
            copy.text = text;
            copy.rowMajor = rowMajor;
            copy.storedMatrix = storedMatrix;
            copy.column = column;
            copy.flattened = flattened == null ? null : new ArrayList<>(flattened);
            return copy;
        }
    }
}
