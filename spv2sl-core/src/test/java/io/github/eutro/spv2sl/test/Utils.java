package io.github.eutro.spv2sl.test;

import io.github.eutro.spv2sl.compile.CompilerOptions;
import io.github.eutro.spv2sl.compile.PassResult;
import io.github.eutro.spv2sl.compile.ShaderCompiler;
import io.github.eutro.spv2sl.ssa.Module;

import java.util.ArrayList;
import java.util.List;

public class Utils {
    public static PassResult compile(Module module) {
        return compile(module, CompilerOptions.DEFAULT);
    }

    public static PassResult compile(Module module, CompilerOptions options) {
        PassResult result = new ShaderCompiler(options).compileToResult(module);
        System.out.println(result.output);
        return result;
    }

    /**
     * Split output into lines with indentation removed, dropping empty ones.
     */
    public static List<String> lines(String output) {
        List<String> lines = new ArrayList<>();
        for (String line : output.split("\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) lines.add(trimmed);
        }
        return lines;
    }

    public static int count(String haystack, String needle) {
        int count = 0;
        for (int i = haystack.indexOf(needle); i >= 0; i = haystack.indexOf(needle, i + 1)) {
            count++;
        }
        return count;
    }
}
