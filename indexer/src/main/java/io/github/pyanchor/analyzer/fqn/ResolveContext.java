package io.github.pyanchor.analyzer.fqn;

import io.github.pyanchor.analyzer.PythonVersion;
import io.github.pyanchor.analyzer.cooked.ScopeKind;
import java.util.Optional;

/**
 * Resolve-time state: the dot-prefix for names minted in the current scope, the language version and the chain of
 * visible frames.
 */
public record ResolveContext(String prefix, PythonVersion version, ScopeChain chain) {

    /** The context a module starts from: the module path as prefix and no frames yet. */
    public static ResolveContext forModule(String modulePath, PythonVersion version) {
        return new ResolveContext(modulePath + ".", version, ScopeChain.empty());
    }

    /** A child scope: new prefix, one new frame seeded with {@code prefix + name} for each name. */
    public ResolveContext enterScope(ScopeKind kind, String newPrefix, Iterable<String> bindings) {
        return new ResolveContext(newPrefix, version, chain.push(kind, newPrefix, bindings));
    }

    public Optional<String> lookup(String name) {
        return chain.lookup(name);
    }

    public ResolveContext bind(String name, String fqn) {
        return new ResolveContext(prefix, version, chain.bind(name, fqn));
    }

    /** The FQN a name not visible anywhere gets when first seen in this scope. */
    public String mint(String name) {
        return prefix + name;
    }
}
