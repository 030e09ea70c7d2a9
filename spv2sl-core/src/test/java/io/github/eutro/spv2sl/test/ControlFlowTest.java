package io.github.eutro.spv2sl.test;

import io.github.eutro.spv2sl.compile.CompilerOptions;
import io.github.eutro.spv2sl.compile.PassResult;
import io.github.eutro.spv2sl.compile.UnsupportedConstructException;
import io.github.eutro.spv2sl.ops.CommonOps;
import io.github.eutro.spv2sl.ssa.*;
import io.github.eutro.spv2sl.ssa.Module;
import io.github.eutro.spv2sl.types.ShaderType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ControlFlowTest {
    static Module forLoop() {
        return forLoop(false);
    }

    static Module forLoop(boolean reportAfter) {
        Module module = new Module();
        Function func = module.addFunction(new Function("main", ShaderType.VOID));
        Variable i = func.newLocal("i", ShaderType.INT);
        BasicBlock b0 = func.newBb(), b1 = func.newBb(), b2 = func.newBb(), b3 = func.newBb(), b4 = func.newBb();
        IRBuilder ib = new IRBuilder(func, b0);
        ib.store(i, ib.constant(0, ShaderType.INT));
        ib.br(b1);

        ib.setBlock(b1);
        b1.setLoopMerge(b4, b3);
        Var li = ib.load(i, "li");
        Var cond = ib.binary("<", ShaderType.BOOL, li, ib.constant(10, ShaderType.INT), "cond");
        ib.brIf(cond, b2, b4);

        ib.setBlock(b2);
        ib.callVoid("use", ib.load(i, "lb"));
        ib.br(b3);

        ib.setBlock(b3);
        Var lc = ib.load(i, "lc");
        ib.store(i, ib.binary("+", ShaderType.INT, lc, ib.constant(1, ShaderType.INT), "inc"));
        ib.br(b1);

        ib.setBlock(b4);
        if (reportAfter) ib.callVoid("report", ib.pointer(i));
        ib.ret();
        return module;
    }

    @Test
    void testForLoop() {
        PassResult result = Utils.compile(forLoop());
        assertEquals(Arrays.asList(
                "void main()",
                "{",
                "for (int i = 0; i < 10; i = i + 1)",
                "{",
                "use(i);",
                "}",
                "}"
        ), Utils.lines(result.output));
        assertEquals(1, result.pass);
        assertEquals(1, Utils.count(result.output, "i = i + 1"));
    }

    static Module keepGoingModule(Variable[] keepGoing) {
        Module module = new Module();
        keepGoing[0] = module.addGlobal(new Variable("keepGoing", ShaderType.BOOL, Variable.StorageClass.UNIFORM));
        return module;
    }

    @Test
    void testDoWhile() {
        Variable[] keepGoing = new Variable[1];
        Module module = keepGoingModule(keepGoing);
        Function func = module.addFunction(new Function("main", ShaderType.VOID));
        BasicBlock b0 = func.newBb(), b1 = func.newBb(), b2 = func.newBb(), b3 = func.newBb();
        IRBuilder ib = new IRBuilder(func, b0);
        ib.br(b1);

        ib.setBlock(b1);
        b1.setLoopMerge(b3, b2);
        ib.callVoid("step");
        ib.br(b2);

        ib.setBlock(b2);
        ib.brIf(ib.load(keepGoing[0], "k"), b1, b3);

        ib.setBlock(b3);
        ib.ret();

        List<String> lines = Utils.lines(Utils.compile(module).output);
        int doLine = lines.indexOf("do");
        assertTrue(doLine >= 0, "no do loop in " + lines);
        assertTrue(lines.indexOf("step();") > doLine);
        assertTrue(lines.contains("} while (keepGoing);"));
    }

    static Module whileLoop() {
        Variable[] keepGoing = new Variable[1];
        Module module = keepGoingModule(keepGoing);
        Function func = module.addFunction(new Function("main", ShaderType.VOID));
        BasicBlock b0 = func.newBb(), b1 = func.newBb(), b2 = func.newBb(), b3 = func.newBb(), b4 = func.newBb();
        IRBuilder ib = new IRBuilder(func, b0);
        ib.br(b1);

        ib.setBlock(b1);
        b1.setLoopMerge(b3, b2);
        ib.brIf(ib.load(keepGoing[0], "k"), b4, b3);

        ib.setBlock(b4);
        ib.callVoid("step");
        ib.br(b2);

        ib.setBlock(b2);
        ib.br(b1);

        ib.setBlock(b3);
        ib.ret();
        return module;
    }

    @Test
    void testWhile() {
        String output = Utils.compile(whileLoop()).output;
        assertTrue(Utils.lines(output).contains("while (keepGoing)"), output);
        assertFalse(output.contains("for ("), output);
        assertTrue(output.contains("step();"));
    }

    static Module switchFallthrough() {
        Module module = new Module();
        Variable color = module.addGlobal(new Variable("color", ShaderType.FLOAT, Variable.StorageClass.OUTPUT));
        Function func = module.addFunction(new Function("main", ShaderType.VOID));
        BasicBlock b0 = func.newBb(), b1 = func.newBb(), b2 = func.newBb(), b3 = func.newBb();
        IRBuilder ib = new IRBuilder(func, b0);
        Var x = ib.arg(0, "x", ShaderType.INT);
        b0.setSelectionMerge(b3);
        ib.switchOn(x, b2, Collections.singletonList(1), Collections.singletonList(b1));

        ib.setBlock(b1);
        ib.store(color, ib.constant(1.0f, ShaderType.FLOAT));
        ib.br(b2);

        ib.setBlock(b2);
        ib.store(color, ib.constant(2.0f, ShaderType.FLOAT));
        ib.br(b3);

        ib.setBlock(b3);
        ib.ret();
        return module;
    }

    @Test
    void testSwitchFallthrough() {
        List<String> lines = Utils.lines(Utils.compile(switchFallthrough()).output);
        int sw = lines.indexOf("switch (x)");
        int case1 = lines.indexOf("case 1:");
        int one = lines.indexOf("color = 1.0;");
        int dflt = lines.indexOf("default:");
        int two = lines.indexOf("color = 2.0;");
        assertTrue(sw >= 0 && sw < case1 && case1 < one && one < dflt && dflt < two, lines.toString());
        assertFalse(lines.subList(one, dflt).contains("break;"), "case 1 must fall into default");
        assertTrue(lines.subList(two, lines.size()).contains("break;"));
    }

    @Test
    void testSwitchWithoutFallthrough() {
        CompilerOptions options = CompilerOptions.builder().supportCaseFallthrough(false).build();
        String output = Utils.compile(switchFallthrough(), options).output;
        assertEquals(2, Utils.count(output, "color = 2.0;"), output);
        assertEquals(1, Utils.count(output, "color = 1.0;"));
    }

    @Test
    void testLadderBreak() {
        Module module = new Module();
        Function func = module.addFunction(new Function("main", ShaderType.VOID));
        BasicBlock b0 = func.newBb(), b1 = func.newBb(), b2 = func.newBb(), b3 = func.newBb(),
                b4 = func.newBb(), b5 = func.newBb(), b6 = func.newBb();
        IRBuilder ib = new IRBuilder(func, b0);
        Var sel = ib.arg(0, "sel", ShaderType.INT);
        ib.br(b1);

        ib.setBlock(b1);
        b1.setLoopMerge(b6, b5);
        ib.br(b2);

        ib.setBlock(b2);
        b2.setSelectionMerge(b4);
        ib.switchOn(sel, b4, Collections.singletonList(0), Collections.singletonList(b3));

        ib.setBlock(b3);
        ib.callVoid("hit");
        ib.br(b6);

        ib.setBlock(b4);
        ib.br(b5);

        ib.setBlock(b5);
        ib.br(b1);

        ib.setBlock(b6);
        ib.ret();

        List<String> lines = Utils.lines(Utils.compile(module).output);
        assertTrue(lines.contains("for (;;)"), lines.toString());
        int declare = lines.indexOf("bool _2_ladder_break = false;");
        int hit = lines.indexOf("hit();");
        int set = lines.indexOf("_2_ladder_break = true;");
        int test = lines.indexOf("if (_2_ladder_break)");
        assertTrue(declare >= 0 && declare < hit && hit < set && set < test, lines.toString());
        assertEquals("break;", lines.get(set + 1));
    }

    @Test
    void testReturnOmission() {
        Module module = new Module();
        Function func = module.addFunction(new Function("main", ShaderType.VOID));
        BasicBlock b0 = func.newBb(), b1 = func.newBb(), b2 = func.newBb();
        IRBuilder ib = new IRBuilder(func, b0);
        Var c = ib.arg(0, "c", ShaderType.BOOL);
        b0.setSelectionMerge(b2);
        ib.brIf(c, b1, b2);

        ib.setBlock(b1);
        ib.ret();

        ib.setBlock(b2);
        ib.callVoid("after");
        ib.ret();

        String output = Utils.compile(module).output;
        assertEquals(1, Utils.count(output, "return;"), output);
        List<String> lines = Utils.lines(output);
        assertTrue(lines.indexOf("return;") < lines.indexOf("after();"));
        assertTrue(lines.contains("if (c)"));
    }

    @Test
    void testPhiSwap() {
        Module module = new Module();
        Function func = module.addFunction(new Function("swap", ShaderType.INT));
        BasicBlock b0 = func.newBb(), b1 = func.newBb(), b2 = func.newBb(), b3 = func.newBb(), b4 = func.newBb();
        IRBuilder ib = new IRBuilder(func, b0);
        Var c1 = ib.constant(1, ShaderType.INT);
        Var c2 = ib.constant(2, ShaderType.INT);
        Var c0 = ib.constant(0, ShaderType.INT);
        Var c4 = ib.constant(4, ShaderType.INT);
        ib.br(b1);

        Var a = func.newVar("a", ShaderType.INT);
        Var b = func.newVar("b", ShaderType.INT);
        Var i = func.newVar("i", ShaderType.INT);
        Var inext = func.newVar("inext", ShaderType.INT);
        List<BasicBlock> preds = Arrays.asList(b0, b3);
        ib.setBlock(b1);
        b1.setLoopMerge(b4, b3);
        ib.insert(CommonOps.PHI.create(preds).insn(c1, b), a);
        ib.insert(CommonOps.PHI.create(preds).insn(c2, a), b);
        ib.insert(CommonOps.PHI.create(preds).insn(c0, inext), i);
        ib.brIf(ib.binary("<", ShaderType.BOOL, i, c4, "cond"), b2, b4);

        ib.setBlock(b2);
        ib.br(b3);

        ib.setBlock(b3);
        Var one = ib.constant(1, ShaderType.INT);
        ib.insert(io.github.eutro.spv2sl.ops.ShaderOps.BINARY.create("+").insn(i, one), inext);
        ib.br(b1);

        ib.setBlock(b4);
        ib.ret(ib.binary("+", ShaderType.INT, a, b, "s"));

        PassResult result = Utils.compile(module);
        List<String> lines = Utils.lines(result.output);
        int copy = lines.indexOf("int b_copy = a;");
        assertTrue(copy >= 0, lines.toString());
        assertEquals("a = b;", lines.get(copy + 1));
        assertEquals("b = b_copy;", lines.get(copy + 2));
        assertTrue(lines.contains("return a + b;"));
        assertTrue(result.pass <= 3);
    }

    @Test
    void testSwitchWithoutMergeRejected() {
        Module module = new Module();
        Function func = module.addFunction(new Function("main", ShaderType.VOID));
        BasicBlock b0 = func.newBb(), b1 = func.newBb();
        IRBuilder ib = new IRBuilder(func, b0);
        Var x = ib.arg(0, "x", ShaderType.INT);
        ib.switchOn(x, b1, Collections.emptyList(), Collections.emptyList());
        ib.setBlock(b1);
        ib.ret();

        UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class,
                () -> Utils.compile(module));
        assertSame(b0, e.getSubject());
    }

    @Test
    void testPointerUseAfterLoopKeepsDeclarationOutside() {
        PassResult result = Utils.compile(forLoop(true));
        List<String> lines = Utils.lines(result.output);
        int decl = lines.indexOf("int i = 0;");
        int loop = lines.indexOf("for (; i < 10; i = i + 1)");
        assertTrue(decl >= 0, lines.toString());
        assertTrue(loop > decl, lines.toString());
        assertTrue(lines.indexOf("report(i);") > loop, lines.toString());
        assertFalse(result.output.contains("for (int i"), result.output);
    }

    @Test
    void testLoopInitializerReadAfterWrite() {
        Module module = new Module();
        Function func = module.addFunction(new Function("main", ShaderType.VOID));
        Variable a = func.newLocal("a", ShaderType.INT);
        Variable i = func.newLocal("i", ShaderType.INT);
        BasicBlock b0 = func.newBb(), b1 = func.newBb(), b2 = func.newBb(), b3 = func.newBb(), b4 = func.newBb();
        IRBuilder ib = new IRBuilder(func, b0);
        Var n = ib.arg(0, "n", ShaderType.INT);
        ib.store(a, n);
        ib.store(i, ib.load(a, "start"));
        ib.store(a, ib.constant(5, ShaderType.INT));
        ib.br(b1);

        ib.setBlock(b1);
        b1.setLoopMerge(b4, b3);
        Var cond = ib.binary("<", ShaderType.BOOL, ib.load(i, "li"), ib.load(a, "la"), "cond");
        ib.brIf(cond, b2, b4);

        ib.setBlock(b2);
        ib.callVoid("use", ib.load(i, "lb"));
        ib.br(b3);

        ib.setBlock(b3);
        Var lc = ib.load(i, "lc");
        ib.store(i, ib.binary("+", ShaderType.INT, lc, ib.constant(1, ShaderType.INT), "inc"));
        ib.br(b1);

        ib.setBlock(b4);
        ib.ret();

        PassResult result = Utils.compile(module);
        assertEquals(Arrays.asList(
                "void main(int n)",
                "{",
                "int a = n;",
                "int start = a;",
                "a = 5;",
                "for (int i = start; i < a; i = i + 1)",
                "{",
                "use(i);",
                "}",
                "}"
        ), Utils.lines(result.output));
        assertEquals(2, result.pass);
    }

    @Test
    void testSeparateTestBlock() {
        Module module = new Module();
        Function func = module.addFunction(new Function("main", ShaderType.VOID));
        Variable i = func.newLocal("i", ShaderType.INT);
        BasicBlock b0 = func.newBb(), b1 = func.newBb(), b2 = func.newBb(), b3 = func.newBb(),
                b4 = func.newBb(), b5 = func.newBb();
        IRBuilder ib = new IRBuilder(func, b0);
        ib.store(i, ib.constant(0, ShaderType.INT));
        ib.br(b1);

        ib.setBlock(b1);
        b1.setLoopMerge(b5, b4);
        ib.br(b2);

        ib.setBlock(b2);
        Var cond = ib.binary("<", ShaderType.BOOL, ib.load(i, "li"), ib.constant(10, ShaderType.INT), "cond");
        ib.brIf(cond, b3, b5);

        ib.setBlock(b3);
        ib.callVoid("use", ib.load(i, "lb"));
        ib.br(b4);

        ib.setBlock(b4);
        Var lc = ib.load(i, "lc");
        ib.store(i, ib.binary("+", ShaderType.INT, lc, ib.constant(1, ShaderType.INT), "inc"));
        ib.br(b1);

        ib.setBlock(b5);
        ib.ret();

        PassResult result = Utils.compile(module);
        assertEquals(Arrays.asList(
                "void main()",
                "{",
                "for (int i = 0; i < 10; i = i + 1)",
                "{",
                "use(i);",
                "}",
                "}"
        ), Utils.lines(result.output));
        assertEquals(1, result.pass);
    }

    @Test
    void testLoopTestWithStatementsFallsBack() {
        Module module = new Module();
        Function func = module.addFunction(new Function("main", ShaderType.VOID));
        BasicBlock b0 = func.newBb(), b1 = func.newBb(), b2 = func.newBb(), b3 = func.newBb(), b4 = func.newBb();
        IRBuilder ib = new IRBuilder(func, b0);
        Var a = ib.arg(0, "a", ShaderType.FLOAT);
        Var b = ib.arg(1, "b", ShaderType.FLOAT);
        ib.br(b1);

        ib.setBlock(b1);
        b1.setLoopMerge(b4, b3);
        Var sum = ib.binary("+", ShaderType.FLOAT, a, b, "s");
        Var square = ib.binary("*", ShaderType.FLOAT, sum, sum, "sq");
        Var cond = ib.binary("<", ShaderType.BOOL, square, ib.constant(10.0f, ShaderType.FLOAT), "cond");
        ib.brIf(cond, b2, b4);

        ib.setBlock(b2);
        ib.callVoid("step");
        ib.br(b3);

        ib.setBlock(b3);
        ib.br(b1);

        ib.setBlock(b4);
        ib.ret();

        PassResult result = Utils.compile(module);
        List<String> lines = Utils.lines(result.output);
        int loop = lines.indexOf("for (;;)");
        assertTrue(loop >= 0, lines.toString());
        assertTrue(lines.indexOf("float s = a + b;") > loop, lines.toString());
        assertTrue(lines.indexOf("step();") > loop, lines.toString());
        assertTrue(lines.contains("break;"), lines.toString());
        assertFalse(result.output.contains("while ("), result.output);
        assertEquals(3, result.pass);
    }

    @Test
    void testComplexContinueInlinedAtEachContinue() {
        Module module = new Module();
        Variable skip = module.addGlobal(new Variable("skip", ShaderType.BOOL, Variable.StorageClass.UNIFORM));
        Function func = module.addFunction(new Function("main", ShaderType.VOID));
        BasicBlock b0 = func.newBb(), b1 = func.newBb(), b2 = func.newBb(), b3 = func.newBb(),
                b4 = func.newBb(), b5 = func.newBb(), b6 = func.newBb();
        IRBuilder ib = new IRBuilder(func, b0);
        ib.br(b1);

        ib.setBlock(b1);
        b1.setLoopMerge(b6, b5);
        ib.brIf(ib.call("check", ShaderType.BOOL, "k"), b2, b6);

        ib.setBlock(b2);
        b2.setSelectionMerge(b4);
        ib.brIf(ib.load(skip, "sk"), b5, b3);

        ib.setBlock(b3);
        ib.callVoid("work");
        ib.br(b4);

        ib.setBlock(b4);
        ib.br(b5);

        ib.setBlock(b5);
        ib.callVoid("advance");
        ib.br(b1);

        ib.setBlock(b6);
        ib.ret();

        PassResult result = Utils.compile(module);
        List<String> lines = Utils.lines(result.output);
        assertTrue(lines.contains("for (;;)"), lines.toString());
        assertEquals(2, Utils.count(result.output, "advance();"));
        int early = lines.indexOf("advance();");
        assertEquals("continue;", lines.get(early + 1));
        assertEquals(1, Utils.count(result.output, "continue;"));
        assertTrue(lines.lastIndexOf("advance();") > lines.indexOf("work();"));
    }

    @Test
    void testUnreachableCaseBreaks() {
        Module module = new Module();
        Function func = module.addFunction(new Function("main", ShaderType.VOID));
        BasicBlock b0 = func.newBb(), b1 = func.newBb(), b2 = func.newBb(), b3 = func.newBb();
        IRBuilder ib = new IRBuilder(func, b0);
        Var x = ib.arg(0, "x", ShaderType.INT);
        b0.setSelectionMerge(b3);
        ib.switchOn(x, b2, Collections.singletonList(1), Collections.singletonList(b1));

        ib.setBlock(b1);
        ib.callVoid("first");
        ib.unreachable();

        ib.setBlock(b2);
        ib.callVoid("other");
        ib.br(b3);

        ib.setBlock(b3);
        ib.ret();

        List<String> lines = Utils.lines(Utils.compile(module).output);
        int first = lines.indexOf("first();");
        assertTrue(first > lines.indexOf("case 1:"), lines.toString());
        assertEquals("break;", lines.get(first + 1));
        assertTrue(lines.indexOf("default:") > first, lines.toString());
    }

    @Test
    void testDefaultOnlySwitchCollapses() {
        Module module = new Module();
        Function func = module.addFunction(new Function("main", ShaderType.VOID));
        BasicBlock b0 = func.newBb(), b1 = func.newBb(), b2 = func.newBb();
        IRBuilder ib = new IRBuilder(func, b0);
        Var x = ib.arg(0, "x", ShaderType.INT);
        b0.setSelectionMerge(b2);
        ib.switchOn(x, b1, Collections.emptyList(), Collections.emptyList());

        ib.setBlock(b1);
        ib.callVoid("only");
        ib.br(b2);

        ib.setBlock(b2);
        ib.ret();

        assertEquals(Arrays.asList(
                "void main(int x)",
                "{",
                "only();",
                "}"
        ), Utils.lines(Utils.compile(module).output));
    }
}
