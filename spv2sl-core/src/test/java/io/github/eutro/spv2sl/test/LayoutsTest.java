package io.github.eutro.spv2sl.test;

import io.github.eutro.spv2sl.layout.Layouts;
import io.github.eutro.spv2sl.layout.PackingStandard;
import io.github.eutro.spv2sl.types.ShaderType;
import io.github.eutro.spv2sl.types.ShaderType.Member;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import static io.github.eutro.spv2sl.types.ShaderType.BaseType.FLOAT;
import static org.junit.jupiter.api.Assertions.*;

public class LayoutsTest {
    static final ShaderType VEC2 = ShaderType.vector(FLOAT, 2);
    static final ShaderType VEC3 = ShaderType.vector(FLOAT, 3);
    static final ShaderType VEC4 = ShaderType.vector(FLOAT, 4);
    static final ShaderType MAT4 = ShaderType.matrix(FLOAT, 4, 4);

    static ShaderType mixed() {
        return ShaderType.struct("S",
                Member.of("a", ShaderType.FLOAT),
                Member.of("b", VEC3),
                Member.of("c", ShaderType.FLOAT),
                Member.of("d", VEC2),
                Member.of("m", MAT4),
                Member.of("arr", ShaderType.array(ShaderType.FLOAT, 3)));
    }

    static List<Integer> offsets(ShaderType struct) {
        List<Integer> offsets = new ArrayList<>();
        for (Member member : struct.members) offsets.add(member.offset);
        return offsets;
    }

    @Test
    void testStd140() {
        ShaderType laidOut = Layouts.layOut(mixed(), PackingStandard.STD140);
        assertEquals(Arrays.asList(0, 16, 28, 32, 48, 112), offsets(laidOut));
        assertEquals(16, laidOut.member(5).type.arrayStride);
        assertEquals(16, laidOut.member(4).matrixStride);
    }

    @Test
    void testStd430() {
        ShaderType laidOut = Layouts.layOut(mixed(), PackingStandard.STD430);
        assertEquals(Arrays.asList(0, 16, 28, 32, 48, 112), offsets(laidOut));
        assertEquals(4, laidOut.member(5).type.arrayStride);
    }

    @Test
    void testScalar() {
        ShaderType laidOut = Layouts.layOut(mixed(), PackingStandard.SCALAR);
        assertEquals(Arrays.asList(0, 4, 16, 20, 28, 92), offsets(laidOut));
    }

    @Test
    void testCompliance() {
        ShaderType std140 = Layouts.layOut(mixed(), PackingStandard.STD140);
        ShaderType std430 = Layouts.layOut(mixed(), PackingStandard.STD430);
        assertTrue(Layouts.isStandardCompliant(std140, PackingStandard.STD140));
        assertTrue(Layouts.isStandardCompliant(std430, PackingStandard.STD430));
        assertEquals(OptionalInt.of(5), Layouts.firstNonCompliantMember(std140, PackingStandard.STD430));
        assertEquals(OptionalInt.of(5), Layouts.firstNonCompliantMember(std430, PackingStandard.STD140));
        assertEquals(Optional.of(PackingStandard.STD430),
                Layouts.detectStandard(std430, PackingStandard.STD140, PackingStandard.STD430));
    }

    @Test
    void testComplianceRange() {
        ShaderType std140 = Layouts.layOut(mixed(), PackingStandard.STD140);
        // only the array stride differs, and the array starts at 112
        assertFalse(Layouts.firstNonCompliantMember(std140, PackingStandard.STD430, 0, 112).isPresent());
    }

    @Test
    void testEnhancedLayoutOffsets() {
        ShaderType aligned = ShaderType.struct("E",
                Member.of("a", ShaderType.FLOAT).at(0),
                Member.of("v", VEC4).at(32));
        assertTrue(Layouts.isStandardCompliant(aligned, PackingStandard.STD140_ENHANCED_LAYOUT));
        assertEquals(OptionalInt.of(1), Layouts.firstNonCompliantMember(aligned, PackingStandard.STD140));

        ShaderType misaligned = ShaderType.struct("E",
                Member.of("a", ShaderType.FLOAT).at(0),
                Member.of("v", VEC4).at(20));
        assertEquals(OptionalInt.of(1),
                Layouts.firstNonCompliantMember(misaligned, PackingStandard.STD140_ENHANCED_LAYOUT));
    }

    @Test
    void testHlslRegisterStraddling() {
        ShaderType packed = Layouts.layOut(ShaderType.struct("H",
                Member.of("a", ShaderType.FLOAT),
                Member.of("b", VEC3)), PackingStandard.HLSL_CBUFFER);
        assertEquals(Arrays.asList(0, 4), offsets(packed));

        ShaderType straddling = Layouts.layOut(ShaderType.struct("H",
                Member.of("a", VEC2),
                Member.of("b", VEC3)), PackingStandard.HLSL_CBUFFER);
        assertEquals(Arrays.asList(0, 16), offsets(straddling));
    }

    @Test
    void testUnsizedTrailingArray() {
        ShaderType tight = ShaderType.struct("R",
                Member.of("count", ShaderType.FLOAT).at(0),
                Member.of("data", ShaderType.runtimeArray(ShaderType.FLOAT).withArrayStride(4)).at(4));
        assertTrue(Layouts.isStandardCompliant(tight, PackingStandard.STD430));
        assertEquals(OptionalInt.of(1), Layouts.firstNonCompliantMember(tight, PackingStandard.STD140));

        ShaderType padded = ShaderType.struct("R",
                Member.of("count", ShaderType.FLOAT).at(0),
                Member.of("data", ShaderType.runtimeArray(ShaderType.FLOAT).withArrayStride(16)).at(16));
        assertTrue(Layouts.isStandardCompliant(padded, PackingStandard.STD140));
    }

    @Test
    void testAlignUp() {
        assertEquals(0, Layouts.alignUp(0, 16));
        assertEquals(16, Layouts.alignUp(1, 16));
        assertEquals(32, Layouts.alignUp(32, 16));
    }
}
