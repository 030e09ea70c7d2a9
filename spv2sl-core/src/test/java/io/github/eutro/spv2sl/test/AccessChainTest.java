package io.github.eutro.spv2sl.test;

import io.github.eutro.spv2sl.compile.MalformedInputException;
import io.github.eutro.spv2sl.compile.UnsupportedConstructException;
import io.github.eutro.spv2sl.layout.*;
import io.github.eutro.spv2sl.types.ShaderType;
import io.github.eutro.spv2sl.types.ShaderType.Member;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static io.github.eutro.spv2sl.layout.ChainIndex.constant;
import static io.github.eutro.spv2sl.layout.ChainIndex.dynamic;
import static org.junit.jupiter.api.Assertions.*;

public class AccessChainTest {
    static final ShaderType PARAMS = ShaderType.struct("Params",
            Member.of("color", LayoutsTest.VEC4),
            Member.of("scale", ShaderType.FLOAT),
            Member.of("dir", LayoutsTest.VEC3));

    @Test
    void testResolveOffsets() {
        AccessChainResolver resolver = new AccessChainResolver(PackingStandard.STD140, 4);
        AccessChainDescriptor m = resolver.resolve(LayoutsTest.mixed(), Collections.singletonList(constant(4)));
        assertEquals(48, m.offset);
        assertEquals(16, m.matrixStride);
        assertFalse(m.isDynamic());

        AccessChainDescriptor element = resolver.resolve(LayoutsTest.mixed(), Arrays.asList(constant(4), constant(1), constant(2)));
        assertEquals(72, element.offset);
        assertTrue(element.reachedScalar());
    }

    @Test
    void testResolveDynamic() {
        AccessChainResolver resolver = new AccessChainResolver(PackingStandard.STD140, 4);
        AccessChainDescriptor element = resolver.resolve(LayoutsTest.mixed(), Arrays.asList(constant(5), dynamic("i")));
        assertTrue(element.isDynamic());
        assertEquals(112, element.offset);
        assertEquals("i * 4 + ", element.dynamicOffset);
    }

    @Test
    void testResolveErrors() {
        AccessChainResolver std140 = new AccessChainResolver(PackingStandard.STD140, 4);
        MalformedInputException scalar = assertThrows(MalformedInputException.class,
                () -> std140.resolve(LayoutsTest.mixed(), Arrays.asList(constant(0), constant(0))));
        assertTrue(scalar.getMessage().contains("cannot subdivide a scalar"));

        assertThrows(MalformedInputException.class,
                () -> std140.resolve(LayoutsTest.mixed(), Collections.singletonList(dynamic("i"))));

        AccessChainResolver words = new AccessChainResolver(PackingStandard.STD430, 16);
        assertThrows(UnsupportedConstructException.class,
                () -> words.resolve(LayoutsTest.mixed(), Arrays.asList(constant(5), dynamic("i"))));
    }

    @Test
    void testChainFromOffset() {
        ShaderType s = LayoutsTest.mixed();
        assertEquals(Optional.of(Arrays.asList(1, 1)), OffsetChains.chainFromOffset(s, 20, PackingStandard.STD140));
        assertEquals(Optional.of(Arrays.asList(4, 1, 2)), OffsetChains.chainFromOffset(s, 72, PackingStandard.STD140));
        assertEquals(Optional.of(Arrays.asList(5, 2)), OffsetChains.chainFromOffset(s, 144, PackingStandard.STD140));
        // padding after d
        assertEquals(Optional.empty(), OffsetChains.chainFromOffset(s, 44, PackingStandard.STD140));
    }

    @Test
    void testChainFromOffsetInvertsResolve() {
        ShaderType s = LayoutsTest.mixed();
        AccessChainResolver resolver = new AccessChainResolver(PackingStandard.STD140, 4);
        for (int offset : new int[]{0, 16, 24, 28, 36, 52, 100, 128}) {
            List<Integer> chain = OffsetChains.chainFromOffset(s, offset, PackingStandard.STD140)
                    .orElseThrow(() -> new AssertionError("no chain for " + offset));
            ChainIndex[] indices = chain.stream().map(ChainIndex::constant).toArray(ChainIndex[]::new);
            assertEquals(offset, resolver.resolve(s, Arrays.asList(indices)).offset, "offset " + offset);
        }
    }

    @Test
    void testFlattenedReads() {
        AccessChainResolver resolver = new AccessChainResolver(PackingStandard.STD140, 16);
        assertEquals("ubo[2].xyz", FlattenedAccess.read("ubo", PARAMS, Collections.singletonList(constant(2)), resolver).text);
        assertEquals("ubo[1].x", FlattenedAccess.read("ubo", PARAMS, Collections.singletonList(constant(1)), resolver).text);
        assertEquals("ubo[0]", FlattenedAccess.read("ubo", PARAMS, Collections.singletonList(constant(0)), resolver).text);
    }

    @Test
    void testFlattenedDynamicRead() {
        ShaderType block = ShaderType.struct("Data",
                Member.of("data", ShaderType.array(LayoutsTest.VEC4, 4)));
        AccessChainResolver resolver = new AccessChainResolver(PackingStandard.STD140, 16);
        FlattenedAccess access = FlattenedAccess.read("ubo", block, Arrays.asList(constant(0), dynamic("i")), resolver);
        assertEquals("ubo[i * 1 + 0]", access.text);
        assertFalse(access.needsTranspose);

        assertThrows(UnsupportedConstructException.class,
                () -> FlattenedAccess.read("ubo", block, Collections.singletonList(constant(0)), resolver));
    }
}
