package io.github.eutro.spv2sl.layout;

/**
 * A set of rules for laying out the members of a buffer block.
 */
public enum PackingStandard {
    STD140(true, false, false, false),
    STD140_ENHANCED_LAYOUT(true, false, false, true),
    STD430(false, false, false, false),
    STD430_ENHANCED_LAYOUT(false, false, false, true),
    HLSL_CBUFFER(true, true, false, false),
    HLSL_CBUFFER_PACK_OFFSET(true, true, false, true),
    SCALAR(false, false, true, false),
    SCALAR_ENHANCED_LAYOUT(false, false, true, true),
    ;

    private final boolean vec4Padded;
    private final boolean hlsl;
    private final boolean scalar;
    private final boolean flexibleOffsets;

    PackingStandard(boolean vec4Padded, boolean hlsl, boolean scalar, boolean flexibleOffsets) {
        this.vec4Padded = vec4Padded;
        this.hlsl = hlsl;
        this.scalar = scalar;
        this.flexibleOffsets = flexibleOffsets;
    }

    /**
     * Whether arrays, structs and matrix columns are rounded up to 16 bytes.
     *
     * @return The above.
     */
    public boolean isVec4Padded() {
        return vec4Padded;
    }

    /**
     * Whether vectors are only component-aligned, but may not straddle a 16-byte register.
     *
     * @return The above.
     */
    public boolean isHlsl() {
        return hlsl;
    }

    public boolean isScalar() {
        return scalar;
    }

    /**
     * Whether explicit member offsets may be larger than the natural offset, as long as they stay aligned.
     *
     * @return The above.
     */
    public boolean hasFlexibleOffsets() {
        return flexibleOffsets;
    }

    /**
     * Get the standard that nested structs have to follow. Explicit offsets cannot be chosen for them.
     *
     * @return The standard for substructs.
     */
    public PackingStandard substructStandard() {
        switch (this) {
            case STD140_ENHANCED_LAYOUT:
                return STD140;
            case STD430_ENHANCED_LAYOUT:
                return STD430;
            case SCALAR_ENHANCED_LAYOUT:
                return SCALAR;
            case HLSL_CBUFFER_PACK_OFFSET:
                return HLSL_CBUFFER;
            default:
                return this;
        }
    }
}
