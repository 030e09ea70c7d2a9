package io.github.eutro.spv2sl.test;

import io.github.eutro.spv2sl.compile.CompilerOptions;
import io.github.eutro.spv2sl.compile.ConvergenceFailureException;
import io.github.eutro.spv2sl.compile.PassResult;
import io.github.eutro.spv2sl.compile.ShaderCompiler;
import io.github.eutro.spv2sl.ops.ShaderOps;
import io.github.eutro.spv2sl.ssa.*;
import io.github.eutro.spv2sl.ssa.Module;
import io.github.eutro.spv2sl.types.ShaderType;
import io.github.eutro.spv2sl.types.ShaderType.Member;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionTrackerTest {
    static final ShaderType MAT4 = ShaderType.matrix(ShaderType.BaseType.FLOAT, 4, 4);

    static Module loadThenOverwrite() {
        Module module = new Module();
        Function func = module.addFunction(new Function("main", ShaderType.VOID));
        Variable x = func.newLocal("x", ShaderType.FLOAT);
        BasicBlock b0 = func.newBb();
        IRBuilder ib = new IRBuilder(func, b0);
        ib.store(x, ib.constant(1.0f, ShaderType.FLOAT));
        Var v = ib.load(x, "v");
        ib.store(x, ib.constant(2.0f, ShaderType.FLOAT));
        ib.callVoid("use", v);
        ib.ret();
        return module;
    }

    @Test
    void testForwardedLoadInvalidatedByStore() {
        PassResult result = Utils.compile(loadThenOverwrite());
        assertEquals(2, result.pass);
        List<String> lines = Utils.lines(result.output);
        int decl = lines.indexOf("float x = 1.0;");
        int temp = lines.indexOf("float v = x;");
        int write = lines.indexOf("x = 2.0;");
        int use = lines.indexOf("use(v);");
        assertTrue(decl >= 0 && decl < temp && temp < write && write < use, lines.toString());
        assertFalse(result.output.contains("use(x)"));
    }

    @Test
    void testDecisionLogOnFailure() {
        CompilerOptions options = CompilerOptions.builder().maxRecompileIterations(1).build();
        ConvergenceFailureException e = assertThrows(ConvergenceFailureException.class,
                () -> new ShaderCompiler(options).compile(loadThenOverwrite()));
        assertEquals(1, e.getHistory().size());
        assertTrue(e.getHistory().get(0).contains("temporary v: read after a write to x"),
                e.getHistory().toString());
    }

    static Module readTwice() {
        Module module = new Module();
        Function func = module.addFunction(new Function("main", ShaderType.VOID));
        BasicBlock b0 = func.newBb();
        IRBuilder ib = new IRBuilder(func, b0);
        Var a = ib.arg(0, "a", ShaderType.FLOAT);
        Var b = ib.arg(1, "b", ShaderType.FLOAT);
        Var s = ib.binary("*", ShaderType.FLOAT, a, b, "s");
        ib.callVoid("f", s, s);
        ib.ret();
        return module;
    }

    @Test
    void testReadTwiceBecomesTemporary() {
        PassResult result = Utils.compile(readTwice());
        assertEquals(2, result.pass);
        List<String> lines = Utils.lines(result.output);
        assertEquals("void main(float a, float b)", lines.get(0));
        assertTrue(lines.contains("float s = a * b;"), lines.toString());
        assertTrue(lines.contains("f(s, s);"));
    }

    @Test
    void testForceTemporaryOption() {
        CompilerOptions options = CompilerOptions.builder().forceTemporary(true).build();
        PassResult result = Utils.compile(readTwice(), options);
        assertEquals(1, result.pass);
        assertTrue(Utils.lines(result.output).contains("float s = a * b;"), result.output);
    }

    @Test
    void testSingleUseIsForwarded() {
        Module module = new Module();
        Function func = module.addFunction(new Function("main", ShaderType.VOID));
        IRBuilder ib = new IRBuilder(func, func.newBb());
        Var a = ib.arg(0, "a", ShaderType.FLOAT);
        Var b = ib.arg(1, "b", ShaderType.FLOAT);
        ib.callVoid("f", ib.binary("+", ShaderType.FLOAT, a, b, "s"));
        ib.ret();

        PassResult result = Utils.compile(module);
        assertEquals(1, result.pass);
        assertTrue(Utils.lines(result.output).contains("f(a + b);"), result.output);
    }

    @Test
    void testRowMajorProduct() {
        Module module = new Module();
        ShaderType block = ShaderType.struct("Matrices",
                Member.of("a", MAT4).at(0).withMatrixStride(16).rowMajor(),
                Member.of("b", MAT4).at(64).withMatrixStride(16).rowMajor());
        Variable ubo = module.addGlobal(new Variable("ubo", block, Variable.StorageClass.UNIFORM));
        Variable out = module.addGlobal(new Variable("result", MAT4, Variable.StorageClass.OUTPUT));
        Function func = module.addFunction(new Function("main", ShaderType.VOID));
        IRBuilder ib = new IRBuilder(func, func.newBb());
        Var base = ib.pointer(ubo);
        Var a = ib.load(ib.accessChain(base, MAT4, ib.constant(0, ShaderType.INT)), "a");
        Var b = ib.load(ib.accessChain(base, MAT4, ib.constant(1, ShaderType.INT)), "b");
        Var product = ib.insert(ShaderOps.MAT_MUL.insn(a, b), "product", MAT4);
        ib.store(out, product);
        ib.ret();

        String output = Utils.compile(module).output;
        assertTrue(Utils.lines(output).contains("result = transpose(ubo.b * ubo.a);"), output);
        assertEquals(1, Utils.count(output, "transpose("));
    }

    @Test
    void testFlattenedUniformRead() {
        Module module = new Module();
        ShaderType vec4 = ShaderType.vector(ShaderType.BaseType.FLOAT, 4);
        ShaderType vec3 = ShaderType.vector(ShaderType.BaseType.FLOAT, 3);
        ShaderType block = ShaderType.struct("Params",
                Member.of("color", vec4).at(0),
                Member.of("scale", ShaderType.FLOAT).at(16),
                Member.of("dir", vec3).at(32));
        Variable ubo = module.addGlobal(new Variable("ubo", block, Variable.StorageClass.UNIFORM));
        Variable direction = module.addGlobal(new Variable("direction", vec3, Variable.StorageClass.OUTPUT));
        Function func = module.addFunction(new Function("main", ShaderType.VOID));
        IRBuilder ib = new IRBuilder(func, func.newBb());
        Var dir = ib.load(ib.accessChain(ib.pointer(ubo), vec3, ib.constant(2, ShaderType.INT)), "dir");
        ib.store(direction, dir);
        ib.ret();

        CompilerOptions options = CompilerOptions.builder().flattenUniformBuffers(true).build();
        String flat = Utils.compile(module, options).output;
        assertTrue(Utils.lines(flat).contains("direction = ubo[2].xyz;"), flat);

        String plain = Utils.compile(module).output;
        assertTrue(Utils.lines(plain).contains("direction = ubo.dir;"), plain);
    }

    @Test
    void testVolatileLoadsAreNotForwarded() {
        Module module = new Module();
        Variable mask = module.addGlobal(new Variable("gl_SampleMaskIn", ShaderType.INT, Variable.StorageClass.INPUT)
                .markVolatile());
        Function func = module.addFunction(new Function("main", ShaderType.VOID));
        IRBuilder ib = new IRBuilder(func, func.newBb());
        ib.callVoid("use", ib.load(mask, "m"));
        ib.ret();

        PassResult result = Utils.compile(module);
        assertEquals(1, result.pass);
        List<String> lines = Utils.lines(result.output);
        assertTrue(lines.contains("int m = gl_SampleMaskIn;"), lines.toString());
        assertTrue(lines.contains("use(m);"));
    }

    @Test
    void testLocalInitializer() {
        Module module = new Module();
        Function func = module.addFunction(new Function("main", ShaderType.VOID));
        func.newLocal("acc", ShaderType.FLOAT).withInitializer(0.5f);
        IRBuilder ib = new IRBuilder(func, func.newBb());
        ib.callVoid("use", ib.load(func.locals.get(0), "a"));
        ib.ret();

        List<String> lines = Utils.lines(Utils.compile(module).output);
        assertTrue(lines.contains("float acc = 0.5;"), lines.toString());
        assertTrue(lines.contains("use(acc);"));
    }
}
