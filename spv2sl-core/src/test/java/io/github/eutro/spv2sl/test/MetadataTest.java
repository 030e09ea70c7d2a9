package io.github.eutro.spv2sl.test;

import io.github.eutro.spv2sl.ext.CommonExts;
import io.github.eutro.spv2sl.ext.CommonExts.LoopInfo;
import io.github.eutro.spv2sl.ext.MetadataState;
import io.github.eutro.spv2sl.passes.meta.ComputeDoms;
import io.github.eutro.spv2sl.passes.meta.PrepareMetadata;
import io.github.eutro.spv2sl.ssa.*;
import io.github.eutro.spv2sl.ssa.Module;
import io.github.eutro.spv2sl.types.ShaderType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MetadataTest {
    static Module hoisting() {
        Module module = new Module();
        Variable keepGoing = module.addGlobal(new Variable("keepGoing", ShaderType.BOOL, Variable.StorageClass.UNIFORM));
        Function func = module.addFunction(new Function("main", ShaderType.VOID));
        BasicBlock b0 = func.newBb(), b1 = func.newBb(), b2 = func.newBb(), b3 = func.newBb();
        IRBuilder ib = new IRBuilder(func, b0);
        ib.br(b1);

        ib.setBlock(b1);
        b1.setLoopMerge(b3, b2);
        Var v = ib.call("f", ShaderType.FLOAT, "v");
        ib.br(b2);

        ib.setBlock(b2);
        ib.brIf(ib.load(keepGoing, "k"), b1, b3);

        ib.setBlock(b3);
        ib.callVoid("use", v);
        ib.ret();
        return module;
    }

    @Test
    void testDominators() {
        Module module = ControlFlowTest.forLoop();
        Function func = module.functions.get(0);
        PrepareMetadata.INSTANCE.runInPlace(func);
        List<BasicBlock> b = func.blocks;
        assertTrue(ComputeDoms.dominates(b.get(0), b.get(4)));
        assertTrue(ComputeDoms.dominates(b.get(1), b.get(3)));
        assertFalse(ComputeDoms.dominates(b.get(2), b.get(4)));
        assertSame(b.get(1), b.get(4).getNullable(CommonExts.IDOM));
        assertEquals(Arrays.asList(b.get(0), b.get(3)), b.get(1).getExtOrThrow(CommonExts.PREDS));
    }

    @Test
    void testLoops() {
        Module module = ControlFlowTest.forLoop();
        Function func = module.functions.get(0);
        PrepareMetadata.INSTANCE.runInPlace(func);
        List<BasicBlock> b = func.blocks;
        LoopInfo loop = b.get(1).getExtOrThrow(CommonExts.LOOP_INFO);
        assertTrue(loop.contains(b.get(1)));
        assertTrue(loop.contains(b.get(2)));
        assertTrue(loop.contains(b.get(3)));
        assertFalse(loop.contains(b.get(4)));
        assertSame(b.get(1), b.get(2).getNullable(CommonExts.LOOP_DOMINATOR));
        assertEquals(Collections.singleton(func.locals.get(0)), loop.storedVariables);
        assertEquals(1, loop.loopVariables.size());
        assertEquals("i", loop.loopVariables.get(0).variable.name);
    }

    @Test
    void testPointerArgumentsAreAccesses() {
        Function func = ControlFlowTest.forLoop(true).functions.get(0);
        PrepareMetadata.INSTANCE.runInPlace(func);
        LoopInfo loop = func.blocks.get(1).getExtOrThrow(CommonExts.LOOP_INFO);
        assertTrue(loop.loopVariables.isEmpty());

        Module module = ControlFlowTest.whileLoop();
        func = module.functions.get(0);
        Variable scratch = func.newLocal("scratch", ShaderType.FLOAT);
        BasicBlock body = func.blocks.get(4);
        IRBuilder ib = new IRBuilder(func, body);
        ib.callVoid("modify", ib.pointer(scratch));
        PrepareMetadata.INSTANCE.runInPlace(func);
        loop = func.blocks.get(1).getExtOrThrow(CommonExts.LOOP_INFO);
        assertTrue(loop.storedVariables.contains(scratch));
    }

    @Test
    void testHoisting() {
        Module module = hoisting();
        Function func = module.functions.get(0);
        PrepareMetadata.INSTANCE.runInPlace(func);
        BasicBlock header = func.blocks.get(1);
        Var v = header.getEffects().get(0).result();
        assertNotNull(v);
        assertSame(header, v.getNullable(CommonExts.HOISTED_BEFORE));
        assertEquals(Collections.singletonList(v), header.getExtOrThrow(CommonExts.LOOP_INFO).hoisted);
    }

    @Test
    void testHoistedValueDeclaredBeforeLoop() {
        List<String> lines = Utils.lines(Utils.compile(hoisting()).output);
        int decl = lines.indexOf("float v;");
        int loop = lines.indexOf("do");
        int assign = lines.indexOf("v = f();");
        int use = lines.indexOf("use(v);");
        assertTrue(decl >= 0 && decl < loop && loop < assign && assign < use, lines.toString());
    }

    @Test
    void testLadders() {
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
        ib.switchOn(sel, b4, Arrays.asList(0, 1), Arrays.asList(b3, b4));
        ib.setBlock(b3);
        ib.br(b6);
        ib.setBlock(b4);
        ib.br(b5);
        ib.setBlock(b5);
        ib.br(b1);
        ib.setBlock(b6);
        ib.ret();

        PrepareMetadata.INSTANCE.runInPlace(func);
        assertSame(b1, b2.getNullable(CommonExts.LADDER_BREAK));
        assertNull(b1.getNullable(CommonExts.LADDER_BREAK));
    }

    @Test
    void testNoLadderWithoutLoopExit() {
        Module module = ControlFlowTest.switchFallthrough();
        Function func = module.functions.get(0);
        PrepareMetadata.INSTANCE.runInPlace(func);
        for (BasicBlock block : func.blocks) {
            assertNull(block.getNullable(CommonExts.LADDER_BREAK));
        }
    }

    @Test
    void testAddingBlocksInvalidatesAnalyses() {
        Module module = ControlFlowTest.forLoop();
        Function func = module.functions.get(0);
        PrepareMetadata.INSTANCE.runInPlace(func);
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        assertTrue(ms.isValid(MetadataState.PREDS));
        assertTrue(ms.isValid(MetadataState.HOISTED));
        func.newBb();
        assertFalse(ms.isValid(MetadataState.PREDS));
        assertFalse(ms.isValid(MetadataState.HOISTED));
    }
}
