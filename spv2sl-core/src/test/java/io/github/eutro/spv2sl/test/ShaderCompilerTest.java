package io.github.eutro.spv2sl.test;

import io.github.eutro.spv2sl.compile.CompilerOptions;
import io.github.eutro.spv2sl.compile.MalformedInputException;
import io.github.eutro.spv2sl.compile.PassResult;
import io.github.eutro.spv2sl.compile.ShaderCompiler;
import io.github.eutro.spv2sl.ssa.*;
import io.github.eutro.spv2sl.ssa.Module;
import io.github.eutro.spv2sl.types.ShaderType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

public class ShaderCompilerTest {
    @Test
    void testConvergesWithinThreePasses() {
        List<Supplier<Module>> fixtures = new ArrayList<>();
        fixtures.add(ControlFlowTest::forLoop);
        fixtures.add(ControlFlowTest::whileLoop);
        fixtures.add(ControlFlowTest::switchFallthrough);
        fixtures.add(ExpressionTrackerTest::loadThenOverwrite);
        fixtures.add(ExpressionTrackerTest::readTwice);
        for (Supplier<Module> fixture : fixtures) {
            PassResult result = new ShaderCompiler().compileToResult(fixture.get());
            assertTrue(result.converged);
            assertTrue(result.pass <= 3, "took " + result.pass + " passes");
        }
    }

    @Test
    void testDeterministic() {
        String first = new ShaderCompiler().compile(ExpressionTrackerTest.readTwice());
        String second = new ShaderCompiler().compile(ExpressionTrackerTest.readTwice());
        assertEquals(first, second);
    }

    @Test
    void testMultipleFunctions() {
        Module module = new Module();
        Function helper = module.addFunction(new Function("helper", ShaderType.FLOAT));
        IRBuilder ib = new IRBuilder(helper, helper.newBb());
        ib.ret(ib.constant(0.5f, ShaderType.FLOAT));
        Function main = module.addFunction(new Function("main", ShaderType.VOID));
        ib = new IRBuilder(main, main.newBb());
        ib.callVoid("use", ib.call("helper", ShaderType.FLOAT, "h"));
        ib.ret();

        String output = new ShaderCompiler().compile(module);
        List<String> lines = Utils.lines(output);
        assertTrue(lines.indexOf("float helper()") < lines.indexOf("void main()"), output);
        assertTrue(lines.contains("return 0.5;"));
        assertTrue(lines.contains("float h = helper();"), output);
    }

    @Test
    void testEmptyFunctionRejected() {
        Module module = new Module();
        module.addFunction(new Function("main", ShaderType.VOID));
        assertThrows(IllegalArgumentException.class, () -> new ShaderCompiler().compile(module));
    }

    @Test
    void testUseBeforeDefinitionRejected() {
        Module module = new Module();
        Function func = module.addFunction(new Function("main", ShaderType.VOID));
        IRBuilder ib = new IRBuilder(func, func.newBb());
        ib.callVoid("use", func.newVar("ghost", ShaderType.FLOAT));
        ib.ret();
        assertThrows(MalformedInputException.class, () -> new ShaderCompiler().compile(module));
    }

    @Test
    void testOptionValidation() {
        assertThrows(IllegalArgumentException.class, () -> CompilerOptions.builder().maxRecompileIterations(0));
        assertThrows(IllegalArgumentException.class, () -> CompilerOptions.builder().maxForwardDepth(0));
    }

    @Test
    void testToBuilderKeepsOptions() {
        CompilerOptions base = CompilerOptions.builder()
                .maxRecompileIterations(5)
                .flattenUniformBuffers(true)
                .build();
        CompilerOptions derived = base.toBuilder().forceTemporary(true).build();
        assertEquals(5, derived.maxRecompileIterations);
        assertTrue(derived.flattenUniformBuffers);
        assertTrue(derived.forceTemporary);
        assertFalse(base.forceTemporary);
        assertSame(base, new ShaderCompiler(base).getOptions());
    }

    @Test
    void testFindFunction() {
        Module module = ControlFlowTest.forLoop();
        assertSame(module.functions.get(0), module.findFunction("main"));
        assertNull(module.findFunction("missing"));
    }
}
