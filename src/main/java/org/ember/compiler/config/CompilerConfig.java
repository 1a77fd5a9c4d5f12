package org.ember.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed view of the {@code ember.compiler} configuration block.
 *
 * @param runtimeModule     The module holding the built-in operators and {@code error/1}.
 * @param module            The module the compiled forms belong to.
 * @param guardOperators    Built-in operators allowed in guards, as {@code name/arity}.
 * @param booleanOperators  Built-in operators that always return a boolean, as {@code name/arity}.
 * @param shortCircuitOperators Binary operators whose result is the result of their right operand.
 * @param typeTests         Type test functions of the runtime module, as {@code name/arity}.
 * @param specialForms      Local names that never resolve to a function.
 * @param imports           Functions imported unqualified, by module.
 * @param macros            Macros, by module. A macro never resolves to a function value.
 * @param debugDump         Whether lowered forms are written to {@code dumpDirectory}.
 * @param dumpDirectory     Where debug dumps go.
 */
public record CompilerConfig(
        String runtimeModule,
        String module,
        Set<String> guardOperators,
        Set<String> booleanOperators,
        Set<String> shortCircuitOperators,
        Set<String> typeTests,
        Set<String> specialForms,
        Map<String, Set<String>> imports,
        Map<String, Set<String>> macros,
        boolean debugDump,
        String dumpDirectory
) {

    private static final String ROOT = "ember.compiler";

    public CompilerConfig {
        guardOperators = Set.copyOf(guardOperators);
        booleanOperators = Set.copyOf(booleanOperators);
        shortCircuitOperators = Set.copyOf(shortCircuitOperators);
        typeTests = Set.copyOf(typeTests);
        specialForms = Set.copyOf(specialForms);
        imports = Map.copyOf(imports);
        macros = Map.copyOf(macros);
    }

    /**
     * @return The configuration declared in {@code reference.conf}, without any override.
     */
    public static CompilerConfig defaults() {
        return fromConfig(ConfigFactory.parseResources("reference.conf").resolve());
    }

    /**
     * @param root A resolved configuration containing the {@code ember.compiler} block.
     * @return The typed view.
     */
    public static CompilerConfig fromConfig(Config root) {
        Config c = root.getConfig(ROOT);
        return new CompilerConfig(
                c.getString("runtime-module"),
                c.getString("module"),
                arities(c, "guard-operators"),
                arities(c, "boolean-operators"),
                new HashSet<>(c.getStringList("boolean-operators.short-circuit")),
                arities(c, "type-tests"),
                new HashSet<>(c.getStringList("special-forms")),
                table(c.getObject("functions.imports")),
                table(c.getObject("functions.macros")),
                c.getBoolean("debug-dump"),
                c.getString("debug-dump-directory"));
    }

    public boolean isGuardOperator(String name, int arity) {
        return guardOperators.contains(name + "/" + arity);
    }

    public boolean isBooleanOperator(String name, int arity) {
        return booleanOperators.contains(name + "/" + arity);
    }

    public boolean isShortCircuit(String name) {
        return shortCircuitOperators.contains(name);
    }

    public boolean isTypeTest(String name, int arity) {
        return typeTests.contains(name + "/" + arity);
    }

    /**
     * @param module A module name.
     * @param name   A function name.
     * @param arity  The arity.
     * @return {@code true} when the configuration declares {@code name/arity} a macro of {@code module}.
     */
    public boolean isMacro(String module, String name, int arity) {
        return macros.getOrDefault(module, Set.of()).contains(name + "/" + arity);
    }

    private static Set<String> arities(Config c, String path) {
        Set<String> result = new HashSet<>();
        c.getStringList(path + ".unary").forEach(op -> result.add(op + "/1"));
        c.getStringList(path + ".binary").forEach(op -> result.add(op + "/2"));
        return result;
    }

    private static Map<String, Set<String>> table(ConfigObject object) {
        Map<String, Set<String>> result = new LinkedHashMap<>();
        for (Map.Entry<String, ConfigValue> entry : object.entrySet()) {
            Object unwrapped = entry.getValue().unwrapped();
            if (!(unwrapped instanceof List<?> functions)) {
                throw new IllegalArgumentException("Function table entry '" + entry.getKey() + "' must be a list");
            }
            Set<String> names = new HashSet<>();
            functions.forEach(f -> names.add(String.valueOf(f)));
            result.put(entry.getKey(), Set.copyOf(names));
        }
        return result;
    }
}
