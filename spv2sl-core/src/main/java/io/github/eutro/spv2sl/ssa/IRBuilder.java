package io.github.eutro.spv2sl.ssa;

import io.github.eutro.spv2sl.ops.CommonOps;
import io.github.eutro.spv2sl.ops.ShaderOps;
import io.github.eutro.spv2sl.types.ShaderType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An IR, or instruction, builder, which encapsulates a position in a function
 * where instructions are being inserted.
 */
public class IRBuilder {
    /**
     * The function being inserted into.
     */
    public final Function func;
    private BasicBlock bb;

    public IRBuilder(Function func, BasicBlock bb) {
        this.func = func;
        this.bb = bb;
    }

    public BasicBlock getBlock() {
        return bb;
    }

    /**
     * Set the block this builder should insert at the end of.
     *
     * @param bb The block.
     */
    public void setBlock(BasicBlock bb) {
        this.bb = bb;
    }

    public void insert(Effect effect) {
        bb.addEffect(effect);
    }

    /**
     * Assign the result of the instruction to a value, and insert the effect.
     *
     * @param insn The instruction.
     * @param v    The value.
     * @return The same value.
     */
    public Var insert(Insn insn, Var v) {
        insert(insn.assignTo(v));
        return v;
    }

    /**
     * Assign the result of the instruction to a new value, and insert the effect.
     *
     * @param insn The instruction.
     * @param name The name of the value.
     * @param type The type of the value.
     * @return The new value.
     */
    public Var insert(Insn insn, String name, ShaderType type) {
        return insert(insn, func.newVar(name, type));
    }

    public void insertCtrl(Control ctrl) {
        bb.setControl(ctrl);
    }

    public Var constant(Object value, ShaderType type) {
        return insert(CommonOps.constant(value), "c", type);
    }

    public Var arg(int index, String name, ShaderType type) {
        Var param = insert(CommonOps.ARG.create(index).insn(), name, type);
        func.params.add(param);
        return param;
    }

    public Var pointer(Variable variable) {
        return insert(ShaderOps.VARIABLE.create(variable).insn(), variable.name + "_ptr",
                ShaderType.pointer(variable.type, variable.storageClass));
    }

    public Var load(Var pointer, String name) {
        return insert(ShaderOps.LOAD.insn(pointer), name, pointer.getType().pointee());
    }

    public Var load(Variable variable, String name) {
        return load(pointer(variable), name);
    }

    public void store(Var pointer, Var value) {
        insert(ShaderOps.STORE.insn(pointer, value).assignTo());
    }

    public void store(Variable variable, Var value) {
        store(pointer(variable), value);
    }

    public Var accessChain(Var base, ShaderType resultType, Var... indices) {
        List<Var> args = new ArrayList<>();
        args.add(base);
        args.addAll(Arrays.asList(indices));
        return insert(ShaderOps.ACCESS_CHAIN.insn(args), "chain",
                ShaderType.pointer(resultType, base.getType().storageClass));
    }

    public Var binary(String operator, ShaderType type, Var lhs, Var rhs, String name) {
        return insert(ShaderOps.BINARY.create(operator).insn(lhs, rhs), name, type);
    }

    public Var unary(String operator, ShaderType type, Var operand, String name) {
        return insert(ShaderOps.UNARY.create(operator).insn(operand), name, type);
    }

    public Var call(String function, ShaderType type, String name, Var... args) {
        return insert(ShaderOps.CALL.create(function).insn(args), name, type);
    }

    public void callVoid(String function, Var... args) {
        insert(ShaderOps.CALL.create(function).insn(args).assignTo());
    }

    public Var intrinsic(String function, ShaderType type, String name, Var... args) {
        return insert(ShaderOps.INTRINSIC.create(function).insn(args), name, type);
    }

    /**
     * Insert a phi. The incoming values are given in the same order as the predecessors.
     *
     * @param name   The name of the result.
     * @param type   The type of the result.
     * @param preds  The predecessor blocks.
     * @param values The value incoming from each predecessor.
     * @return The phi result.
     */
    public Var phi(String name, ShaderType type, List<BasicBlock> preds, List<Var> values) {
        if (preds.size() != values.size()) {
            throw new IllegalArgumentException("phi has " + preds.size() + " predecessors but " + values.size() + " values");
        }
        return insert(CommonOps.PHI.create(new ArrayList<>(preds)).insn(values), name, type);
    }

    public void br(BasicBlock target) {
        insertCtrl(Control.br(target));
    }

    public void brIf(Var cond, BasicBlock ifTrue, BasicBlock ifFalse) {
        insertCtrl(CommonOps.BR_IF.insn(cond).jumpsTo(ifTrue, ifFalse));
    }

    /**
     * Terminate the block with a switch.
     *
     * @param selector    The value switched on.
     * @param defaultCase The default target.
     * @param literals    The case literals.
     * @param cases       The target of each literal.
     */
    public void switchOn(Var selector, BasicBlock defaultCase, List<Integer> literals, List<BasicBlock> cases) {
        if (literals.size() != cases.size()) {
            throw new IllegalArgumentException("switch has " + literals.size() + " literals but " + cases.size() + " targets");
        }
        List<BasicBlock> targets = new ArrayList<>();
        targets.add(defaultCase);
        targets.addAll(cases);
        insertCtrl(CommonOps.SWITCH.create(new ArrayList<>(literals)).insn(selector).jumpsTo(targets));
    }

    public void ret() {
        insertCtrl(CommonOps.RETURN.insn().jumpsTo());
    }

    public void ret(Var value) {
        insertCtrl(CommonOps.RETURN_VALUE.insn(value).jumpsTo());
    }

    public void kill() {
        insertCtrl(CommonOps.KILL.insn().jumpsTo());
    }

    public void unreachable() {
        insertCtrl(CommonOps.UNREACHABLE.insn().jumpsTo());
    }
}
