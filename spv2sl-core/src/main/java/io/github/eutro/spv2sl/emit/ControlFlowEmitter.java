package io.github.eutro.spv2sl.emit;

import io.github.eutro.spv2sl.compile.CompilerOptions;
import io.github.eutro.spv2sl.compile.MalformedInputException;
import io.github.eutro.spv2sl.compile.UnsupportedConstructException;
import io.github.eutro.spv2sl.ext.CommonExts;
import io.github.eutro.spv2sl.ext.CommonExts.LoopInfo;
import io.github.eutro.spv2sl.ext.CommonExts.LoopVariable;
import io.github.eutro.spv2sl.ops.CommonOps;
import io.github.eutro.spv2sl.passes.cfg.LoopClassifier;
import io.github.eutro.spv2sl.passes.cfg.LoopShape;
import io.github.eutro.spv2sl.ssa.*;
import io.github.eutro.spv2sl.tracker.ExpressionTracker;
import io.github.eutro.spv2sl.tracker.ValueState;
import io.github.eutro.spv2sl.types.ShaderType;
import io.github.eutro.spv2sl.types.TypeNames;
import io.github.eutro.spv2sl.util.IRUtils;
import io.github.eutro.spv2sl.util.SourceText;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Rebuilds structured source from the control-flow graph of a function.
 * <p>
 * Blocks are emitted as chains: a block's effects, then its terminator, then whatever the terminator
 * transfers to, until a transfer reaches the merge or continue block of an enclosing construct. Such a
 * transfer becomes a {@code break}, a {@code continue}, or nothing at all when control would get there anyway.
 */
public class ControlFlowEmitter {
    private static final Logger LOGGER = LogManager.getLogger(ControlFlowEmitter.class);

    private enum ConstructKind {
        LOOP,
        SWITCH,
        SELECTION,
    }

    private static final class Construct {
        final ConstructKind kind;
        final BasicBlock header;
        final BasicBlock merge;
        /**
         * For loops, the continue block.
         */
        @Nullable BasicBlock cont;
        @Nullable LoopShape shape;
        /**
         * The scope depth of the loop body, or of the case bodies of a switch.
         */
        int bodyDepth;
        /**
         * For loops, whether a {@code continue} was emitted anywhere but the tail of the body.
         */
        boolean continuedEarly;
        /**
         * For switches, the case targets in the order they are emitted, and the one being emitted.
         * Targets that are not case bodies of their own are null.
         */
        List<BasicBlock> caseOrder = Collections.emptyList();
        int currentCase = -1;
        @Nullable String ladderVariable;

        Construct(ConstructKind kind, BasicBlock header, BasicBlock merge) {
            this.kind = kind;
            this.header = header;
            this.merge = merge;
        }
    }

    private static final class CaseGroup {
        final BasicBlock target;
        final List<Integer> labels = new ArrayList<>();
        boolean isDefault;

        CaseGroup(BasicBlock target) {
            this.target = target;
        }
    }

    private final CompilerOptions options;
    private final ExpressionEmitter expressions;
    private final ExpressionTracker tracker;
    private final LoopClassifier classifier;
    private final Map<BasicBlock, LoopShape> shapes = new HashMap<>();
    private final Deque<Construct> constructs = new ArrayDeque<>();
    private int depth = 0;

    public ControlFlowEmitter(CompilerOptions options, ExpressionEmitter expressions, LoopClassifier classifier) {
        this.options = options;
        this.expressions = expressions;
        this.tracker = expressions.getTracker();
        this.classifier = classifier;
    }

    /**
     * Get the shape a loop is emitted as on this pass.
     *
     * @param header The loop header.
     * @return The shape.
     */
    public LoopShape shapeOf(BasicBlock header) {
        return shapes.computeIfAbsent(header, classifier::classify);
    }

    /**
     * Get the loop variables declared in the initializer clause of a loop, which all share one type.
     *
     * @param header The loop header.
     * @return The variables, or an empty list if the loop has no initializer clause.
     */
    public List<LoopVariable> initializedLoopVariables(BasicBlock header) {
        if (!shapeOf(header).testsFirst()) return Collections.emptyList();
        List<LoopVariable> candidates = header.getExtOrThrow(CommonExts.LOOP_INFO).loopVariables;
        if (candidates.isEmpty()) return Collections.emptyList();
        ShaderType type = candidates.get(0).variable.type;
        List<LoopVariable> chosen = new ArrayList<>();
        for (LoopVariable candidate : candidates) {
            // one declaration, one type
            if (candidate.variable.type.equals(type) && !type.isArray()) chosen.add(candidate);
        }
        return chosen;
    }

    private StatementSink sink() {
        return expressions.getSink();
    }

    private void beginScope() {
        sink().beginScope();
        depth++;
    }

    private void endScope() {
        endScope("");
    }

    private void endScope(String suffix) {
        depth--;
        sink().endScope(suffix);
    }

    /**
     * Emit a block, and the chain it starts.
     *
     * @param block The block.
     */
    public void emitBlock(BasicBlock block) {
        if (block.isLoopHeader()) {
            emitLoop(block);
        } else {
            emitBlockBody(block);
        }
    }

    private void emitBlockBody(BasicBlock block) {
        expressions.emitEffects(block);
        emitControl(block);
    }

    private void emitControl(BasicBlock block) {
        Control control = block.getControl();
        Insn insn = control.insn();
        if (insn.op == CommonOps.BR) {
            branch(block, control.targets.get(0));
        } else if (insn.op == CommonOps.BR_IF) {
            if (block.getMergeKind() == BasicBlock.MergeKind.SELECTION) {
                emitSelection(block);
            } else {
                emitConditionalJump(block);
            }
        } else if (insn.op.key == CommonOps.SWITCH) {
            if (block.getMergeKind() != BasicBlock.MergeKind.SELECTION) {
                throw new UnsupportedConstructException("switch without its own merge block", block);
            }
            emitSwitch(block);
        } else if (insn.op == CommonOps.RETURN) {
            if (!constructs.isEmpty() || depth != 0) sink().emitStatement("return;");
        } else if (insn.op == CommonOps.RETURN_VALUE) {
            sink().emitStatement("return ", tracker.readText(insn.arg(0)), ";");
        } else if (insn.op == CommonOps.KILL) {
            sink().emitStatement("discard;");
        } else if (insn.op == CommonOps.UNREACHABLE) {
            Construct innermost = constructs.peekFirst();
            if (innermost != null && innermost.kind == ConstructKind.SWITCH) sink().emitStatement("break;");
        } else {
            throw new UnsupportedConstructException("unknown terminator " + insn.op, block);
        }
    }

    /**
     * Copy the incoming values into the phi variables of {@code to}, then transfer to it.
     */
    private void branch(BasicBlock from, BasicBlock to) {
        flushPhis(from, to);
        transfer(to);
    }

    /**
     * Assign the phi variables of {@code to} the values they take on the edge from {@code from}.
     * <p>
     * All the assignments happen at once: a value that reads a phi variable assigned earlier in the same
     * edge is copied before any assignment.
     */
    void flushPhis(BasicBlock from, BasicBlock to) {
        List<Effect> phis = to.getPhis();
        if (phis.isEmpty()) return;
        List<Variable> variables = new ArrayList<>();
        List<String> sources = new ArrayList<>();
        for (Effect phi : phis) {
            Var incoming = IRUtils.phiIncoming(phi, from);
            if (incoming == null) {
                throw new MalformedInputException("phi has no value for the edge from " + from.toTargetString(), to);
            }
            Var result = Objects.requireNonNull(phi.result());
            Variable variable = IRUtils.phiVariable(result);
            ValueState state = tracker.read(incoming);
            String source = state.needsTranspose() ? "transpose(" + state.getText() + ")" : state.getText();
            if (dependsOnAny(state, variables)) {
                String copy = variable.name + "_copy";
                expressions.emitDeclaration(variable.type, copy, source);
                source = copy;
            }
            variables.add(variable);
            sources.add(source);
        }
        for (int i = 0; i < variables.size(); i++) {
            Variable variable = variables.get(i);
            if (variable.name.equals(sources.get(i))) continue;
            sink().emitStatement(variable.name, " = ", sources.get(i), ";");
            tracker.invalidateOnWrite(variable);
        }
    }

    private static boolean dependsOnAny(ValueState state, List<Variable> variables) {
        for (Variable variable : variables) {
            if (state.getDependencies().contains(variable)) return true;
        }
        return false;
    }

    /**
     * Whether transferring to {@code to} ends the current chain as a break, continue or fallthrough.
     */
    private boolean isJump(BasicBlock to) {
        for (Construct construct : constructs) {
            if (construct.kind == ConstructKind.LOOP) {
                if (to == construct.header || to == construct.cont || to == construct.merge) return true;
            } else if (construct.kind == ConstructKind.SWITCH) {
                if (to == construct.merge) return true;
            }
        }
        return false;
    }

    private boolean atTailOf(Construct construct) {
        return constructs.peekFirst() == construct && depth == construct.bodyDepth;
    }

    /**
     * Continue emission at {@code to}, which may end the chain.
     */
    private void transfer(BasicBlock to) {
        boolean crossedAny = false;
        boolean crossedLoop = false;
        Construct crossedSwitch = null;
        for (Construct construct : constructs) {
            switch (construct.kind) {
                case LOOP: {
                    LoopShape shape = Objects.requireNonNull(construct.shape);
                    boolean isBackEdge = to == construct.header
                            || to == construct.cont && !(shape.isComplex() && construct.cont != construct.header);
                    if (isBackEdge || to == construct.cont || to == construct.merge) {
                        if (crossedLoop) {
                            throw new UnsupportedConstructException("branch out of more than one loop", to);
                        }
                    }
                    if (isBackEdge) {
                        if (!atTailOf(construct)) {
                            construct.continuedEarly = true;
                            sink().emitStatement("continue;");
                        }
                        return;
                    }
                    if (to == construct.cont) {
                        // the continue block of a complex loop is inlined at each branch to it
                        emitBlockBody(to);
                        return;
                    }
                    if (to == construct.merge) {
                        if (crossedSwitch != null) {
                            if (crossedSwitch.ladderVariable == null) {
                                throw new UnsupportedConstructException("break out of a loop from a switch without a ladder",
                                        crossedSwitch.header);
                            }
                            sink().emitStatement(crossedSwitch.ladderVariable, " = true;");
                        }
                        sink().emitStatement("break;");
                        return;
                    }
                    crossedLoop = true;
                    break;
                }
                case SWITCH: {
                    if (to == construct.merge) {
                        if (crossedLoop || crossedSwitch != null) {
                            throw new UnsupportedConstructException("break out of more than one construct", to);
                        }
                        sink().emitStatement("break;");
                        return;
                    }
                    int next = construct.currentCase + 1;
                    if (!crossedLoop && crossedSwitch == null
                            && next < construct.caseOrder.size() && construct.caseOrder.get(next) == to
                            && atTailOf(construct)) {
                        if (!options.supportCaseFallthrough) {
                            // repeat the next case here instead
                            construct.currentCase = next;
                            emitBlock(to);
                            construct.currentCase = next - 1;
                        }
                        return;
                    }
                    if (construct.caseOrder.contains(to)) {
                        throw new UnsupportedConstructException("jump between cases of a switch", to);
                    }
                    if (crossedSwitch == null) crossedSwitch = construct;
                    break;
                }
                case SELECTION:
                    if (to == construct.merge) {
                        if (crossedAny) {
                            throw new UnsupportedConstructException("branch to the merge of an enclosing selection", to);
                        }
                        return;
                    }
                    break;
            }
            crossedAny = true;
        }
        emitBlock(to);
    }

    private void emitSelection(BasicBlock block) {
        Control control = block.getControl();
        BasicBlock merge = Objects.requireNonNull(block.getMergeBlock());
        BasicBlock ifTrue = control.targets.get(0);
        BasicBlock ifFalse = control.targets.get(1);
        String cond = tracker.readText(control.insn().arg(0));
        boolean trueReal = ifTrue != merge || !merge.getPhis().isEmpty();
        boolean falseReal = ifFalse != merge || !merge.getPhis().isEmpty();

        Construct construct = new Construct(ConstructKind.SELECTION, block, merge);
        constructs.push(construct);
        if (trueReal) {
            sink().emitStatement("if (", cond, ")");
            beginScope();
            branch(block, ifTrue);
            endScope();
            if (falseReal) {
                sink().emitStatement("else");
                beginScope();
                branch(block, ifFalse);
                endScope();
            }
        } else if (falseReal) {
            sink().emitStatement("if (", SourceText.negate(cond), ")");
            beginScope();
            branch(block, ifFalse);
            endScope();
        }
        constructs.pop();
        transfer(merge);
    }

    private void emitConditionalJump(BasicBlock block) {
        Control control = block.getControl();
        BasicBlock ifTrue = control.targets.get(0);
        BasicBlock ifFalse = control.targets.get(1);
        String cond = tracker.readText(control.insn().arg(0));
        BasicBlock jump;
        BasicBlock rest;
        if (isJump(ifTrue)) {
            sink().emitStatement("if (", cond, ")");
            jump = ifTrue;
            rest = ifFalse;
        } else if (isJump(ifFalse)) {
            sink().emitStatement("if (", SourceText.negate(cond), ")");
            jump = ifFalse;
            rest = ifTrue;
        } else {
            throw new UnsupportedConstructException("conditional branch without a merge", block);
        }
        beginScope();
        branch(block, jump);
        endScope();
        branch(block, rest);
    }

    private void emitSwitch(BasicBlock block) {
        Control control = block.getControl();
        Insn insn = control.insn();
        BasicBlock merge = Objects.requireNonNull(block.getMergeBlock());
        List<Integer> literals = CommonOps.SWITCH.cast(insn.op).arg;
        BasicBlock defaultTarget = control.targets.get(0);
        Var selector = insn.arg(0);
        String selectorText = tracker.readText(selector);

        Map<BasicBlock, CaseGroup> groups = new LinkedHashMap<>();
        for (int i = 0; i < literals.size(); i++) {
            BasicBlock target = control.targets.get(i + 1);
            if (target == merge && defaultTarget == merge) continue;
            groups.computeIfAbsent(target, CaseGroup::new).labels.add(literals.get(i));
        }
        if (defaultTarget != merge) {
            groups.computeIfAbsent(defaultTarget, CaseGroup::new).isDefault = true;
        }

        if (groups.isEmpty()) {
            branch(block, merge);
            return;
        }
        if (groups.size() == 1 && groups.values().iterator().next().labels.isEmpty()) {
            // only a default: the switch is just a scope
            LOGGER.debug("switch {} has no cases, emitting it as a selection", block.toTargetString());
            Construct construct = new Construct(ConstructKind.SELECTION, block, merge);
            constructs.push(construct);
            branch(block, defaultTarget);
            constructs.pop();
            transfer(merge);
            return;
        }

        List<CaseGroup> order = orderForFallthrough(block, merge, new ArrayList<>(groups.values()));

        Construct construct = new Construct(ConstructKind.SWITCH, block, merge);
        BasicBlock ladderLoop = block.getNullable(CommonExts.LADDER_BREAK);
        if (ladderLoop != null) {
            construct.ladderVariable = "_" + block.getId() + "_ladder_break";
            expressions.emitDeclaration(ShaderType.BOOL, construct.ladderVariable, "false");
        }
        List<BasicBlock> caseOrder = new ArrayList<>();
        for (CaseGroup group : order) {
            // cases that only break or continue cannot be fallen into
            caseOrder.add(group.target == merge || isJump(group.target) ? null : group.target);
        }
        construct.caseOrder = caseOrder;

        sink().emitStatement("switch (", selectorText, ")");
        beginScope();
        construct.bodyDepth = depth + 1;
        constructs.push(construct);
        for (int i = 0; i < order.size(); i++) {
            CaseGroup group = order.get(i);
            construct.currentCase = i;
            for (Integer label : group.labels) {
                sink().emitStatement("case ", ExpressionPrinter.literal(label, selector.getType()), ":");
            }
            if (group.isDefault) sink().emitStatement("default:");
            beginScope();
            flushPhis(block, group.target);
            if (isJump(group.target)) {
                transfer(group.target);
            } else {
                emitBlock(group.target);
            }
            endScope();
        }
        constructs.pop();
        endScope();

        if (ladderLoop != null) {
            sink().emitStatement("if (", construct.ladderVariable, ")");
            beginScope();
            transfer(Objects.requireNonNull(ladderLoop.getMergeBlock()));
            endScope();
        }
        transfer(merge);
    }

    /**
     * Order the cases of a switch so that every case that falls through into another comes right before it.
     */
    private List<CaseGroup> orderForFallthrough(BasicBlock header, BasicBlock merge, List<CaseGroup> groups) {
        Map<BasicBlock, CaseGroup> byTarget = new HashMap<>();
        for (CaseGroup group : groups) {
            byTarget.put(group.target, group);
        }
        Set<BasicBlock> stop = new HashSet<>();
        stop.add(merge);
        for (Construct construct : constructs) {
            stop.add(construct.merge);
            if (construct.cont != null) stop.add(construct.cont);
            stop.add(construct.header);
        }

        Map<CaseGroup, CaseGroup> fallsInto = new HashMap<>();
        Set<CaseGroup> fallenInto = new HashSet<>();
        for (CaseGroup group : groups) {
            CaseGroup successor = null;
            Set<BasicBlock> seen = new HashSet<>();
            Deque<BasicBlock> queue = new ArrayDeque<>();
            queue.add(group.target);
            while (!queue.isEmpty()) {
                BasicBlock block = queue.removeFirst();
                if (stop.contains(block) || !seen.add(block)) continue;
                CaseGroup other = byTarget.get(block);
                if (other != null && other != group) {
                    if (successor != null && successor != other) {
                        throw new UnsupportedConstructException("case falls through into more than one case", group.target);
                    }
                    successor = other;
                    continue;
                }
                if (block.isLoopHeader()) {
                    queue.add(Objects.requireNonNull(block.getMergeBlock()));
                } else {
                    queue.addAll(block.getControl().targets);
                }
            }
            if (successor != null) {
                if (!fallenInto.add(successor)) {
                    throw new UnsupportedConstructException("more than one case falls through into a case", successor.target);
                }
                if (!successor.target.getPhis().isEmpty()) {
                    throw new UnsupportedConstructException("fallthrough into a case with phis", successor.target);
                }
                fallsInto.put(group, successor);
            }
        }
        if (fallsInto.isEmpty()) return groups;

        List<CaseGroup> order = new ArrayList<>();
        for (CaseGroup group : groups) {
            if (fallenInto.contains(group)) continue;
            for (CaseGroup cursor = group; cursor != null; cursor = fallsInto.get(cursor)) {
                order.add(cursor);
            }
        }
        if (order.size() != groups.size()) {
            throw new UnsupportedConstructException("cases fall through into each other in a cycle", header);
        }
        return order;
    }

    private void emitLoop(BasicBlock header) {
        LoopInfo loop = header.getExtOrThrow(CommonExts.LOOP_INFO);
        LoopShape shape = shapeOf(header);
        BasicBlock merge = Objects.requireNonNull(header.getMergeBlock());
        BasicBlock cont = Objects.requireNonNull(header.getContinueBlock());

        for (Var value : loop.hoisted) {
            if (value.getNullable(CommonExts.HOISTED_BEFORE) == header) expressions.declareHoisted(value);
        }
        tracker.invalidateAll(loop.storedVariables);

        Construct construct = new Construct(ConstructKind.LOOP, header, merge);
        construct.cont = cont;
        construct.shape = shape;

        switch (shape.kind) {
            case FOR_LOOP:
            case WHILE_LOOP:
                emitTestFirstLoop(header, shape, construct);
                break;
            case DO_WHILE:
                emitDoWhileLoop(header, shape, construct);
                break;
            default:
                sink().emitStatement("for (;;)");
                beginScope();
                construct.bodyDepth = depth;
                constructs.push(construct);
                emitBlockBody(header);
                constructs.pop();
                endScope();
                break;
        }
        transfer(merge);
    }

    private void emitTestFirstLoop(BasicBlock header, LoopShape shape, Construct construct) {
        BasicBlock test = Objects.requireNonNull(shape.testBlock);
        BasicBlock cont = Objects.requireNonNull(construct.cont);
        StatementSink outer = sink();

        StringJoiner init = new StringJoiner(", ");
        List<LoopVariable> loopVariables = initializedLoopVariables(header);
        for (LoopVariable lv : loopVariables) {
            String value = expressions.suppressedStoreValue(lv.variable);
            if (value == null) {
                throw new IllegalStateException("loop variable " + lv.variable + " was not initialized before its loop");
            }
            init.add(init.length() == 0
                    ? TypeNames.declare(lv.variable.type, lv.variable.name) + " = " + value
                    : lv.variable.name + " = " + value);
        }

        BufferedSink testSink = new BufferedSink(outer);
        expressions.setSink(testSink);
        expressions.emitEffects(header);
        if (test != header) expressions.emitEffects(test);
        String cond = tracker.readText(test.getControl().insn().arg(0));
        if (shape.exitOnTrue) cond = SourceText.negate(cond);
        expressions.setSink(outer);
        if (!testSink.isEmpty()) {
            tracker.markNonOptimizable(header, "loop test needs statements");
            testSink.replayInto(outer);
        }

        BufferedSink bodySink = new BufferedSink(outer);
        expressions.setSink(bodySink);
        depth++;
        construct.bodyDepth = depth;
        constructs.push(construct);
        transfer(Objects.requireNonNull(shape.bodyTarget));
        constructs.pop();
        depth--;

        BufferedSink incrementSink = new BufferedSink(outer);
        expressions.setSink(incrementSink);
        int declarations = expressions.getDeclarationCount();
        expressions.emitEffects(cont);
        flushPhis(cont, header);
        expressions.setSink(outer);
        if (incrementSink.hasScopes() || expressions.getDeclarationCount() != declarations) {
            tracker.markNonOptimizable(header, "loop increment needs declarations");
        }
        StringJoiner increment = new StringJoiner(", ");
        for (String statement : incrementSink.statements()) {
            increment.add(statement.endsWith(";") ? statement.substring(0, statement.length() - 1) : statement);
        }

        if (init.length() == 0 && increment.length() == 0) {
            outer.emitStatement("while (", cond, ")");
        } else {
            outer.emitStatement("for (", init.toString(), "; ", cond, "; ", increment.toString(), ")");
        }
        outer.beginScope();
        bodySink.replayInto(outer);
        outer.endScope();
    }

    private void emitDoWhileLoop(BasicBlock header, LoopShape shape, Construct construct) {
        BasicBlock cont = Objects.requireNonNull(construct.cont);
        sink().emitStatement("do");
        beginScope();
        construct.bodyDepth = depth;
        constructs.push(construct);
        int declarations = expressions.getDeclarationCount();
        emitBlockBody(header);

        StatementSink outer = sink();
        BufferedSink contSink = new BufferedSink(outer);
        expressions.setSink(contSink);
        expressions.emitEffects(cont);
        expressions.setSink(outer);
        if (!contSink.isEmpty() && construct.continuedEarly) {
            tracker.markNonOptimizable(header, "continue would skip the end of the loop body");
        }
        contSink.replayInto(outer);
        String cond = tracker.readText(cont.getControl().insn().arg(0));
        if (expressions.getDeclarationCount() != declarations) {
            // the condition is outside the scope of the body
            tracker.markNonOptimizable(header, "loop body declares values");
        }
        if (shape.exitOnTrue) cond = SourceText.negate(cond);
        constructs.pop();
        endScope(" while (" + cond + ");");
    }
}
