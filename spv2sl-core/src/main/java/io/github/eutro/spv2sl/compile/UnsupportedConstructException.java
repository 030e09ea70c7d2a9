package io.github.eutro.spv2sl.compile;

import org.jetbrains.annotations.Nullable;

/**
 * The input is legal but has no equivalent in the target language.
 */
public class UnsupportedConstructException extends ShaderCompileException {
    public UnsupportedConstructException(String message, @Nullable Object subject) {
        super(message, subject);
    }
}
