package io.github.eutro.spv2sl.compile;

import io.github.eutro.spv2sl.layout.PackingStandard;

/**
 * Immutable options for a {@link ShaderCompiler}.
 */
public final class CompilerOptions {
    /**
     * Log the output of every pass, not just the last one.
     */
    public static boolean TRACE_PASSES = System.getenv("SPV2SL_TRACE_PASSES") != null;

    public static final CompilerOptions DEFAULT = builder().build();

    public final boolean forceTemporary;
    public final int maxRecompileIterations;
    public final int maxForwardDepth;
    public final boolean supportCaseFallthrough;
    public final boolean nativeRowMajorMatrix;
    public final boolean flattenUniformBuffers;
    public final PackingStandard uniformBufferStandard;

    private CompilerOptions(Builder builder) {
        this.forceTemporary = builder.forceTemporary;
        this.maxRecompileIterations = builder.maxRecompileIterations;
        this.maxForwardDepth = builder.maxForwardDepth;
        this.supportCaseFallthrough = builder.supportCaseFallthrough;
        this.nativeRowMajorMatrix = builder.nativeRowMajorMatrix;
        this.flattenUniformBuffers = builder.flattenUniformBuffers;
        this.uniformBufferStandard = builder.uniformBufferStandard;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .forceTemporary(forceTemporary)
                .maxRecompileIterations(maxRecompileIterations)
                .maxForwardDepth(maxForwardDepth)
                .supportCaseFallthrough(supportCaseFallthrough)
                .nativeRowMajorMatrix(nativeRowMajorMatrix)
                .flattenUniformBuffers(flattenUniformBuffers)
                .uniformBufferStandard(uniformBufferStandard);
    }

    public static final class Builder {
        private boolean forceTemporary = false;
        private int maxRecompileIterations = 3;
        private int maxForwardDepth = 8;
        private boolean supportCaseFallthrough = true;
        private boolean nativeRowMajorMatrix = false;
        private boolean flattenUniformBuffers = false;
        private PackingStandard uniformBufferStandard = PackingStandard.STD140;

        private Builder() {
        }

        /**
         * Never forward expressions, binding every value to a temporary.
         *
         * @param forceTemporary Whether to force temporaries.
         * @return This builder.
         */
        public Builder forceTemporary(boolean forceTemporary) {
            this.forceTemporary = forceTemporary;
            return this;
        }

        /**
         * Set the number of passes after which compilation gives up if decisions are still changing.
         *
         * @param maxRecompileIterations The number of passes, at least 1.
         * @return This builder.
         */
        public Builder maxRecompileIterations(int maxRecompileIterations) {
            if (maxRecompileIterations < 1) {
                throw new IllegalArgumentException("maxRecompileIterations " + maxRecompileIterations);
            }
            this.maxRecompileIterations = maxRecompileIterations;
            return this;
        }

        /**
         * Set how deeply forwarded expressions may nest before the outermost is bound to a temporary.
         *
         * @param maxForwardDepth The depth, at least 1.
         * @return This builder.
         */
        public Builder maxForwardDepth(int maxForwardDepth) {
            if (maxForwardDepth < 1) throw new IllegalArgumentException("maxForwardDepth " + maxForwardDepth);
            this.maxForwardDepth = maxForwardDepth;
            return this;
        }

        /**
         * Whether the target lets one switch case fall through into the next. If not, the next case is
         * repeated at the end of the one falling into it.
         *
         * @param supportCaseFallthrough Whether fallthrough is allowed.
         * @return This builder.
         */
        public Builder supportCaseFallthrough(boolean supportCaseFallthrough) {
            this.supportCaseFallthrough = supportCaseFallthrough;
            return this;
        }

        /**
         * Whether the target can declare row-major matrices, so that no transposes are needed.
         *
         * @param nativeRowMajorMatrix Whether row-major matrices are native.
         * @return This builder.
         */
        public Builder nativeRowMajorMatrix(boolean nativeRowMajorMatrix) {
            this.nativeRowMajorMatrix = nativeRowMajorMatrix;
            return this;
        }

        /**
         * Read uniform buffers as arrays of four-component words rather than as structs.
         *
         * @param flattenUniformBuffers Whether to flatten.
         * @return This builder.
         */
        public Builder flattenUniformBuffers(boolean flattenUniformBuffers) {
            this.flattenUniformBuffers = flattenUniformBuffers;
            return this;
        }

        /**
         * Set the standard missing layout decorations of uniform buffers are filled in with.
         *
         * @param uniformBufferStandard The standard.
         * @return This builder.
         */
        public Builder uniformBufferStandard(PackingStandard uniformBufferStandard) {
            this.uniformBufferStandard = uniformBufferStandard;
            return this;
        }

        public CompilerOptions build() {
            return new CompilerOptions(this);
        }
    }
}
