package io.github.eutro.spv2sl.emit;

import io.github.eutro.spv2sl.compile.CompilerOptions;
import io.github.eutro.spv2sl.ext.CommonExts;
import io.github.eutro.spv2sl.ext.CommonExts.LoopVariable;
import io.github.eutro.spv2sl.ops.ShaderOps;
import io.github.eutro.spv2sl.passes.cfg.LoopClassifier;
import io.github.eutro.spv2sl.ssa.*;
import io.github.eutro.spv2sl.tracker.Decisions;
import io.github.eutro.spv2sl.tracker.ExpressionTracker;
import io.github.eutro.spv2sl.types.TypeNames;
import io.github.eutro.spv2sl.util.IRUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Emits one function: its signature, declarations of its variables, and its reconstructed body.
 * <p>
 * Expects the metadata of the function to be valid.
 */
public class FunctionEmitter {
    private static final Logger LOGGER = LogManager.getLogger(FunctionEmitter.class);

    private final CompilerOptions options;
    private final Decisions decisions;
    private final Decisions.Recorder recorder;
    private final StatementSink sink;

    public FunctionEmitter(CompilerOptions options, Decisions decisions, Decisions.Recorder recorder, StatementSink sink) {
        this.options = options;
        this.decisions = decisions;
        this.recorder = recorder;
        this.sink = sink;
    }

    public void emit(Function func) {
        LOGGER.debug("emitting function {}", func.name);
        ExpressionTracker tracker = new ExpressionTracker(options, decisions, recorder, sink);
        sink.bind(tracker);
        ExpressionEmitter expressions = new ExpressionEmitter(options, tracker, sink);
        ControlFlowEmitter controlFlow = new ControlFlowEmitter(options, expressions, new LoopClassifier(decisions));

        StringJoiner params = new StringJoiner(", ");
        for (Var param : func.params) {
            params.add(TypeNames.declare(param.getType(), param.identifier()));
        }
        sink.emitStatement(TypeNames.of(func.returnType), " ", func.name, "(", params.toString(), ")");
        sink.beginScope();

        Set<Variable> declaredElsewhere = new HashSet<>();
        for (BasicBlock block : func.blocks) {
            if (!block.isLoopHeader()) continue;
            for (LoopVariable lv : controlFlow.initializedLoopVariables(block)) {
                expressions.suppressStore(lv.initStore, lv.variable);
                declaredElsewhere.add(lv.variable);
            }
        }
        for (Effect store : findDeclaringStores(func, declaredElsewhere)) {
            expressions.declareAtStore(store);
            declaredElsewhere.add(Objects.requireNonNull(IRUtils.rootVariable(store.insn().arg(0))));
        }

        for (Variable local : func.locals) {
            if (declaredElsewhere.contains(local)) continue;
            expressions.emitDeclaration(local.type, local.name,
                    local.initializer == null ? null : ExpressionPrinter.literal(local.initializer, local.type));
        }
        for (BasicBlock block : func.blocks) {
            for (Effect phi : block.getPhis()) {
                Var result = Objects.requireNonNull(phi.result());
                Variable variable = IRUtils.phiVariable(result);
                expressions.emitDeclaration(variable.type, variable.name, null);
                tracker.bindPhi(result, variable);
            }
        }

        try {
            controlFlow.emitBlock(func.getEntry());
        } catch (RuntimeException e) {
            e.addSuppressed(new RuntimeException("emitting function " + func.name));
            throw e;
        }
        sink.endScope();
    }

    /**
     * Find the stores that can declare the variable they store to: the first access to a variable without
     * an initializer, when it is a whole store in the entry block.
     */
    private static List<Effect> findDeclaringStores(Function func, Set<Variable> excluded) {
        BasicBlock entry = func.getEntry();
        if (entry.isLoopHeader()) return Collections.emptyList();
        Set<Variable> locals = new HashSet<>(func.locals);
        Set<Variable> seen = new HashSet<>();
        List<Effect> stores = new ArrayList<>();
        for (Effect effect : entry.getEffects()) {
            Insn insn = effect.insn();
            if (insn.op == ShaderOps.STORE || insn.op == ShaderOps.LOAD) {
                Variable root = IRUtils.rootVariable(insn.arg(0));
                if (root == null || !locals.contains(root) || !seen.add(root)) continue;
                if (insn.op == ShaderOps.STORE
                        && root.initializer == null
                        && !excluded.contains(root)
                        && isWholeVariable(insn.arg(0))) {
                    stores.add(effect);
                }
            } else if (insn.op.key == ShaderOps.CALL) {
                for (Var arg : insn.args()) {
                    if (!arg.getType().isPointer()) continue;
                    Variable root = IRUtils.rootVariable(arg);
                    if (root != null) seen.add(root);
                }
            }
        }
        return stores;
    }

    private static boolean isWholeVariable(Var pointer) {
        Effect def = pointer.getNullable(CommonExts.ASSIGNED_AT);
        return def != null && def.insn().op.key == ShaderOps.VARIABLE;
    }
}
