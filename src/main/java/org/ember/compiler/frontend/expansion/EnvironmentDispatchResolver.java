package org.ember.compiler.frontend.expansion;

import org.ember.compiler.config.CompilerConfig;
import org.ember.compiler.frontend.ast.AtomLiteral;
import org.ember.compiler.frontend.ast.Meta;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves captured names against the function tables of the {@link Environment}'s configuration.
 * <p>
 * Unqualified names are looked up in this order: the {@code import} hint of the call, the imported
 * functions, the special forms, the configured macros. A name found nowhere is a local
 * function. Qualified names resolve unless the module declares them a macro.
 */
public class EnvironmentDispatchResolver implements DispatchResolver {

    @Override
    public Optional<CaptureResult> resolveImport(Meta meta, String name, int arity, Environment env) {
        CompilerConfig config = env.config();
        Optional<String> hint = meta.importModule();
        if (hint.isPresent()) {
            return resolveRequire(meta, hint.get(), name, arity, env);
        }
        String key = name + "/" + arity;
        for (Map.Entry<String, Set<String>> imported : config.imports().entrySet()) {
            if (imported.getValue().contains(key)) {
                return Optional.of(new CaptureResult.RemoteRef(AtomLiteral.of(imported.getKey()), name, arity));
            }
        }
        boolean macro = config.macros().values().stream().anyMatch(names -> names.contains(key));
        if (config.specialForms().contains(name) || macro) {
            return Optional.empty();
        }
        return Optional.of(new CaptureResult.LocalRef(name, arity));
    }

    @Override
    public Optional<CaptureResult> resolveRequire(Meta meta, String module, String name, int arity, Environment env) {
        if (env.config().isMacro(module, name, arity)) {
            return Optional.empty();
        }
        return Optional.of(new CaptureResult.RemoteRef(AtomLiteral.of(module), name, arity));
    }
}
