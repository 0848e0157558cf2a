package io.github.pyanchor.analyzer.cook;

import io.github.pyanchor.analyzer.PythonVersion;
import io.github.pyanchor.analyzer.cooked.Classification;
import io.github.pyanchor.analyzer.cooked.ScopeKind;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.pcollections.OrderedPSet;

/**
 * Cook-time state: the classification applied to bare names, plus the accumulators of the scope being cooked.
 *
 * <p>A context is created by the cook call that opens a scope and handed down to the children of that scope.
 * {@link #withMode} returns a view sharing the same accumulators. Nothing outside the cooker sees a context.
 */
public final class CookContext {
    private static final Logger log = LogManager.getLogger(CookContext.class);

    private final Classification mode;
    private final Scope scope;
    private final PythonVersion version;

    private static final class Scope {
        final ScopeKind kind;
        final @Nullable Scope parent;
        final LinkedHashSet<String> bindings = new LinkedHashSet<>();
        final Set<String> globals = new HashSet<>();
        final Set<String> nonlocals = new HashSet<>();

        Scope(ScopeKind kind, @Nullable Scope parent) {
            this.kind = kind;
            this.parent = parent;
        }

        Scope module() {
            var s = this;
            while (s.parent != null) {
                s = s.parent;
            }
            return s;
        }
    }

    private CookContext(Classification mode, Scope scope, PythonVersion version) {
        this.mode = mode;
        this.scope = scope;
        this.version = version;
    }

    public static CookContext forModule(PythonVersion version) {
        return new CookContext(Classification.REFERENCE, new Scope(ScopeKind.MODULE, null), version);
    }

    /** Same scope, different classification for the names cooked next. */
    public CookContext withMode(Classification newMode) {
        return newMode == mode ? this : new CookContext(newMode, scope, version);
    }

    /** A fresh, empty scope nested in this one. Names are cooked as references until told otherwise. */
    public CookContext enterScope(ScopeKind kind) {
        if (kind == ScopeKind.MODULE) {
            throw new IllegalArgumentException("Module scopes cannot be nested");
        }
        return new CookContext(Classification.REFERENCE, new Scope(kind, scope), version);
    }

    public Classification mode() {
        return mode;
    }

    public PythonVersion version() {
        return version;
    }

    public ScopeKind scopeKind() {
        return scope.kind;
    }

    /**
     * Registers {@code name} as bound in the current scope. Returns false, leaving the local set alone, when the name
     * was declared {@code global} or {@code nonlocal} earlier in this scope; a global name is recorded in the module
     * scope instead.
     */
    public boolean bind(String name) {
        return bindIn(scope, name);
    }

    /** Like {@link #bind}, but an assignment expression inside a comprehension binds in the enclosing scope. */
    public boolean bindAssignmentExpression(String name) {
        var target = scope;
        while (target.kind == ScopeKind.COMPREHENSION && target.parent != null) {
            target = target.parent;
        }
        return bindIn(target, name);
    }

    private static boolean bindIn(Scope target, String name) {
        if (target.globals.contains(name)) {
            target.module().bindings.add(name);
            return false;
        }
        if (target.nonlocals.contains(name)) {
            return false;
        }
        target.bindings.add(name);
        return true;
    }

    /** Only affects occurrences cooked after the declaration. Module-level declarations are no-ops. */
    public void declareGlobal(String name) {
        if (scope.kind == ScopeKind.MODULE) {
            log.trace("Ignoring module-level global declaration of {}", name);
            return;
        }
        scope.globals.add(name);
        scope.module().bindings.add(name);
    }

    public void declareNonlocal(String name) {
        if (scope.kind == ScopeKind.MODULE) {
            log.debug("Ignoring module-level nonlocal declaration of {}", name);
            return;
        }
        scope.nonlocals.add(name);
    }

    public boolean isDeclaredGlobal(String name) {
        return scope.globals.contains(name);
    }

    public boolean isDeclaredNonlocal(String name) {
        return scope.nonlocals.contains(name);
    }

    /** The names bound directly in this scope, in first-occurrence order. */
    public OrderedPSet<String> freezeBindings() {
        return OrderedPSet.from(scope.bindings);
    }
}
