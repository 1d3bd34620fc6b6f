package faxc.codegen;

import java.util.Set;

/**
 * Fixed names of the output dialect. Generated code depends on the runtime
 * header providing {@code <runtimeNamespace>::println}, {@code ::Array} and
 * {@code ::Ptr}.
 */
public record CodegenOptions(
        String programNamespace,
        String runtimeNamespace,
        String runtimeHeader,
        int indentWidth,
        Set<String> runtimeHelpers
) {
    public CodegenOptions {
        if (indentWidth < 0) throw new IllegalArgumentException("indentWidth must be >= 0");
        runtimeHelpers = Set.copyOf(runtimeHelpers);
    }

    public static CodegenOptions defaults() {
        return new CodegenOptions("fax_app", "fax_std", "fax_runtime.hpp", 4, Set.of("println"));
    }

    public String inProgram(String name) { return programNamespace + "::" + name; }

    public String inRuntime(String name) { return runtimeNamespace + "::" + name; }
}
