package io.github.eutro.spv2sl.test;

import io.github.eutro.spv2sl.types.ShaderType;
import io.github.eutro.spv2sl.types.TypeNames;
import io.github.eutro.spv2sl.util.SourceText;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SourceTextTest {
    @Test
    void testEnclose() {
        assertEquals("x", SourceText.enclose("x"));
        assertEquals("f(a + b)", SourceText.enclose("f(a + b)"));
        assertEquals("(a + b)", SourceText.enclose("a + b"));
        assertEquals("(f(a) + g(b))", SourceText.enclose("f(a) + g(b)"));
    }

    @Test
    void testNegate() {
        assertEquals("!c", SourceText.negate("c"));
        assertEquals("c", SourceText.negate("!c"));
        assertEquals("!(i < 4)", SourceText.negate("i < 4"));
    }

    @Test
    void testSwizzle() {
        assertEquals(".xyz", SourceText.swizzle(3, 0));
        assertEquals(".y", SourceText.swizzle(1, 1));
        assertEquals("", SourceText.swizzle(4, 0));
        assertThrows(IllegalArgumentException.class, () -> SourceText.swizzle(2, 3));
    }

    @Test
    void testTypeNames() {
        assertEquals("float x", TypeNames.declare(ShaderType.FLOAT, "x"));
        assertEquals("vec3 v", TypeNames.declare(ShaderType.vector(ShaderType.BaseType.FLOAT, 3), "v"));
        assertEquals("float arr[3]", TypeNames.declare(ShaderType.array(ShaderType.FLOAT, 3), "arr"));
        assertEquals("mat4", TypeNames.of(ShaderType.matrix(ShaderType.BaseType.FLOAT, 4, 4)));
        assertEquals("mat2x3", TypeNames.of(ShaderType.matrix(ShaderType.BaseType.FLOAT, 2, 3)));
        assertEquals("float xs[N]", TypeNames.declare(ShaderType.specArray(ShaderType.FLOAT, "N", 4), "xs"));
        assertEquals("float data[]", TypeNames.declare(ShaderType.runtimeArray(ShaderType.FLOAT), "data"));
    }
}
