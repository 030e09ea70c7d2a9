package io.github.eutro.spv2sl.compile;

import org.jetbrains.annotations.Nullable;

/**
 * The input violates an assumption the reconstruction relies on, such as a use that its definition
 * does not dominate, or a loop header without a continue block.
 */
public class MalformedInputException extends ShaderCompileException {
    public MalformedInputException(String message, @Nullable Object subject) {
        super(message, subject);
    }
}
