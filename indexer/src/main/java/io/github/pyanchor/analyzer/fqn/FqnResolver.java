package io.github.pyanchor.analyzer.fqn;

import io.github.pyanchor.analyzer.InvariantViolationException;
import io.github.pyanchor.analyzer.cooked.Classification;
import io.github.pyanchor.analyzer.cooked.CookedNode;
import io.github.pyanchor.analyzer.cooked.CookedNode.*;
import io.github.pyanchor.analyzer.cooked.ScopeKind;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Assigns fully qualified names to the name occurrences of a cooked tree.
 *
 * <p>Each scope gets its own resolver instance whose {@link ResolveContext} is threaded through the scope's children in
 * source order: a name seen for the first time is minted from the current prefix and recorded in the innermost frame,
 * so later occurrences in the same or nested scopes reuse it. Nested scopes start from a context with one more frame;
 * what they record never flows back out.
 *
 * <p>Only the head of an attribute chain is looked up. Members stay unresolved.
 */
public final class FqnResolver implements CookedNode.Visitor<CookedNode> {
    private static final Logger log = LogManager.getLogger(FqnResolver.class);

    static final String LOCAL = "<local>";

    private ResolveContext context;

    private FqnResolver(ResolveContext context) {
        this.context = context;
    }

    /** Returns a structurally identical tree with FQNs filled in. */
    public static CookedNode resolve(CookedNode node, ResolveContext context) {
        return new FqnResolver(context).resolve(node);
    }

    /** Convenience for whole files. */
    public static ModuleRoot resolveModule(ModuleRoot module, ResolveContext context) {
        return expect(ModuleRoot.class, resolve(module, context));
    }

    private CookedNode resolve(CookedNode node) {
        return node.accept(this);
    }

    private List<CookedNode> resolveAll(List<CookedNode> nodes) {
        var result = new ArrayList<CookedNode>(nodes.size());
        for (var node : nodes) {
            result.add(resolve(node));
        }
        return result;
    }

    private <T extends CookedNode> List<T> resolveEach(List<T> nodes, Class<T> type) {
        var result = new ArrayList<T>(nodes.size());
        for (var node : nodes) {
            result.add(expect(type, resolve(node)));
        }
        return result;
    }

    private static <T extends CookedNode> T expect(Class<T> type, CookedNode node) {
        if (!type.isInstance(node)) {
            throw new InvariantViolationException(
                    "Expected " + type.getSimpleName() + " after resolution but got " + node.getClass().getSimpleName());
        }
        return type.cast(node);
    }

    private NameOccurrence resolveName(NameOccurrence name) {
        if (name.classification() == Classification.RAW) {
            return name;
        }
        var text = name.name();
        var existing = context.lookup(text);
        if (existing.isPresent()) {
            return name.withFqn(existing.get());
        }
        var minted = context.mint(text);
        context = context.bind(text, minted);
        log.trace("Minted {} for {}", minted, name.span());
        return name.withFqn(minted);
    }

    private FqnResolver child(ScopeKind kind, String prefix, Iterable<String> bindings) {
        return new FqnResolver(context.enterScope(kind, prefix, bindings));
    }

    /** The scope segment for a definition; a missing name falls back to its position. */
    private static String segment(NameOccurrence name) {
        return name.name().isEmpty() ? "<def>[" + name.span().start() + "]" : name.name();
    }

    private Parameter resolveParameter(Parameter parameter, FqnResolver inner) {
        var annotation = resolve(parameter.annotation());
        var defaultValue = resolve(parameter.defaultValue());
        return new Parameter(inner.resolve(parameter.target()), parameter.kind(), annotation, defaultValue);
    }

    private List<Parameter> resolveParameters(List<Parameter> parameters, FqnResolver inner) {
        var result = new ArrayList<Parameter>(parameters.size());
        for (var parameter : parameters) {
            result.add(resolveParameter(parameter, inner));
        }
        return result;
    }

    // ===== Scopes =====

    @Override
    public CookedNode visitModuleRoot(ModuleRoot node) {
        var module = child(ScopeKind.MODULE, context.prefix(), node.bindings());
        return new ModuleRoot(node.path(), module.resolveAll(node.body()), node.bindings());
    }

    @Override
    public CookedNode visitClassDef(ClassDef node) {
        var name = resolveName(node.name());
        var typeParameters = resolve(node.typeParameters());
        var bases = resolveAll(node.bases());
        var body = child(ScopeKind.CLASS, context.prefix() + segment(node.name()) + ".", node.bindings());
        return new ClassDef(name, typeParameters, bases, body.resolveAll(node.body()), node.bindings());
    }

    @Override
    public CookedNode visitFunctionDef(FunctionDef node) {
        var name = resolveName(node.name());
        var typeParameters = resolve(node.typeParameters());
        var prefix = context.prefix() + segment(node.name()) + "." + LOCAL + ".";
        var body = child(ScopeKind.FUNCTION, prefix, node.bindings());
        var parameters = resolveParameters(node.parameters(), body);
        var returnType = resolve(node.returnType());
        return new FunctionDef(
                name,
                node.async(),
                typeParameters,
                parameters,
                returnType,
                body.resolveAll(node.body()),
                node.bindings());
    }

    @Override
    public CookedNode visitLambda(Lambda node) {
        var prefix = context.prefix() + "<lambda>[" + node.keyword().start() + "]." + LOCAL + ".";
        var body = child(ScopeKind.FUNCTION, prefix, node.bindings());
        var parameters = resolveParameters(node.parameters(), body);
        return new Lambda(node.keyword(), parameters, body.resolve(node.body()), node.bindings());
    }

    @Override
    public CookedNode visitComprehension(Comprehension node) {
        var clauses = node.clauses();
        if (clauses.isEmpty() || !(clauses.get(0) instanceof ComprehensionFor first)) {
            throw new InvariantViolationException("Comprehension at " + node.forKeyword() + " has no leading for clause");
        }
        // the outermost iterable belongs to the enclosing scope
        var iterables = resolveAll(first.iterables());
        var inner = context.version().comprehensionsIsolated()
                ? child(ScopeKind.COMPREHENSION,
                        context.prefix() + "<comp_for>[" + node.forKeyword().start() + "].",
                        node.bindings())
                : this;

        var resolvedClauses = new ArrayList<CookedNode>(clauses.size());
        resolvedClauses.add(new ComprehensionFor(inner.resolve(first.target()), iterables, first.async()));
        for (var clause : clauses.subList(1, clauses.size())) {
            resolvedClauses.add(inner.resolve(clause));
        }
        var element = inner.resolve(node.element());
        return new Comprehension(node.kind(), node.forKeyword(), element, resolvedClauses, node.bindings());
    }

    @Override
    public CookedNode visitComprehensionFor(ComprehensionFor node) {
        var iterables = resolveAll(node.iterables());
        return new ComprehensionFor(resolve(node.target()), iterables, node.async());
    }

    @Override
    public CookedNode visitComprehensionIf(ComprehensionIf node) {
        return new ComprehensionIf(resolve(node.condition()));
    }

    @Override
    public CookedNode visitParameter(Parameter node) {
        return resolveParameter(node, this);
    }

    // ===== Statements =====

    @Override
    public CookedNode visitExpressionStatement(ExpressionStatement node) {
        return new ExpressionStatement(resolveAll(node.expressions()));
    }

    @Override
    public CookedNode visitAssignment(Assignment node) {
        var targets = resolveAll(node.targets());
        return new Assignment(targets, resolve(node.value()));
    }

    @Override
    public CookedNode visitAnnotatedAssignment(AnnotatedAssignment node) {
        var target = resolve(node.target());
        var annotation = resolve(node.annotation());
        return new AnnotatedAssignment(target, annotation, resolve(node.value()));
    }

    @Override
    public CookedNode visitAugmentedAssignment(AugmentedAssignment node) {
        var target = resolve(node.target());
        return new AugmentedAssignment(target, node.operator(), resolve(node.value()));
    }

    @Override
    public CookedNode visitReturn(Return node) {
        return new Return(resolve(node.value()));
    }

    @Override
    public CookedNode visitDelete(Delete node) {
        return new Delete(resolveAll(node.targets()));
    }

    @Override
    public CookedNode visitRaise(Raise node) {
        var exception = resolve(node.exception());
        return new Raise(exception, resolve(node.cause()));
    }

    @Override
    public CookedNode visitPass(Pass node) {
        return node;
    }

    @Override
    public CookedNode visitBreak(Break node) {
        return node;
    }

    @Override
    public CookedNode visitContinue(Continue node) {
        return node;
    }

    @Override
    public CookedNode visitAssert(Assert node) {
        return new Assert(resolveAll(node.expressions()));
    }

    @Override
    public CookedNode visitGlobal(Global node) {
        var names = new ArrayList<NameOccurrence>(node.names().size());
        for (var name : node.names()) {
            names.add(declareGlobal(name));
        }
        return new Global(names);
    }

    /**
     * Points {@code name} at the module binding for the rest of this scope. A name the scope already binds itself
     * keeps its local identity.
     */
    private NameOccurrence declareGlobal(NameOccurrence name) {
        var text = name.name();
        var chain = context.chain();
        if (!chain.isEmpty()) {
            var local = chain.innermost().get(text);
            if (local != null) {
                log.debug("global {} at {} follows a local binding; keeping {}", text, name.span(), local);
                return name.withFqn(local);
            }
        }
        var fqn = chain.lookupModule(text).orElseGet(() -> context.mint(text));
        if (!chain.isEmpty()) {
            context = context.bind(text, fqn);
        }
        return name.withFqn(fqn);
    }

    @Override
    public CookedNode visitNonlocal(Nonlocal node) {
        var names = new ArrayList<NameOccurrence>(node.names().size());
        for (var name : node.names()) {
            var target = context.chain().lookupEnclosingFunction(name.name());
            if (target.isEmpty()) {
                log.warn("No enclosing function binds nonlocal {} at {}", name.name(), name.span());
                names.add(name.withFqn(null));
            } else {
                names.add(name.withFqn(target.get()));
            }
        }
        return new Nonlocal(names);
    }

    @Override
    public CookedNode visitPrint(Print node) {
        var destination = resolve(node.destination());
        return new Print(destination, resolveAll(node.arguments()));
    }

    @Override
    public CookedNode visitExec(Exec node) {
        var code = resolve(node.code());
        return new Exec(code, resolveAll(node.namespaces()));
    }

    @Override
    public CookedNode visitTypeAlias(TypeAlias node) {
        var name = resolve(node.name());
        return new TypeAlias(name, resolve(node.value()));
    }

    @Override
    public CookedNode visitIf(If node) {
        var condition = resolve(node.condition());
        var body = resolveAll(node.body());
        return new If(condition, body, resolveAll(node.alternatives()));
    }

    @Override
    public CookedNode visitElifClause(ElifClause node) {
        var condition = resolve(node.condition());
        return new ElifClause(condition, resolveAll(node.body()));
    }

    @Override
    public CookedNode visitElseClause(ElseClause node) {
        return new ElseClause(resolveAll(node.body()));
    }

    @Override
    public CookedNode visitFor(For node) {
        var target = resolve(node.target());
        var iterable = resolve(node.iterable());
        var body = resolveAll(node.body());
        return new For(target, iterable, body, resolve(node.orElse()), node.async());
    }

    @Override
    public CookedNode visitWhile(While node) {
        var condition = resolve(node.condition());
        var body = resolveAll(node.body());
        return new While(condition, body, resolve(node.orElse()));
    }

    @Override
    public CookedNode visitTry(Try node) {
        var body = resolveAll(node.body());
        var handlers = resolveEach(node.handlers(), ExceptHandler.class);
        var orElse = resolve(node.orElse());
        return new Try(body, handlers, orElse, resolve(node.finallyClause()));
    }

    @Override
    public CookedNode visitExceptHandler(ExceptHandler node) {
        var type = resolve(node.type());
        var target = resolve(node.target());
        return new ExceptHandler(type, target, resolveAll(node.body()), node.group());
    }

    @Override
    public CookedNode visitFinallyClause(FinallyClause node) {
        return new FinallyClause(resolveAll(node.body()));
    }

    @Override
    public CookedNode visitWith(With node) {
        var items = resolveEach(node.items(), WithItem.class);
        return new With(items, resolveAll(node.body()), node.async());
    }

    @Override
    public CookedNode visitWithItem(WithItem node) {
        var contextManager = resolve(node.context());
        return new WithItem(contextManager, resolve(node.target()));
    }

    @Override
    public CookedNode visitMatch(Match node) {
        var subjects = resolveAll(node.subjects());
        return new Match(subjects, resolveEach(node.cases(), CaseClause.class));
    }

    @Override
    public CookedNode visitCaseClause(CaseClause node) {
        var patterns = resolveAll(node.patterns());
        var guard = resolve(node.guard());
        return new CaseClause(patterns, guard, resolveAll(node.body()));
    }

    @Override
    public CookedNode visitCasePattern(CasePattern node) {
        return new CasePattern(node.kind(), resolveAll(node.parts()));
    }

    // ===== Imports and decorators =====

    @Override
    public CookedNode visitImport(Import node) {
        return new Import(resolveEach(node.modules(), ImportedModule.class));
    }

    @Override
    public CookedNode visitImportedModule(ImportedModule node) {
        var path = resolveEach(node.path(), NameOccurrence.class);
        return new ImportedModule(path, resolve(node.alias()));
    }

    @Override
    public CookedNode visitImportFrom(ImportFrom node) {
        var module = resolveEach(node.module(), NameOccurrence.class);
        return new ImportFrom(node.level(), module, resolveAll(node.names()));
    }

    @Override
    public CookedNode visitImportedName(ImportedName node) {
        var name = resolveName(node.name());
        return new ImportedName(name, resolve(node.alias()));
    }

    @Override
    public CookedNode visitWildcardImport(WildcardImport node) {
        return node;
    }

    @Override
    public CookedNode visitDecorated(Decorated node) {
        var decorators = resolveEach(node.decorators(), Decorator.class);
        return new Decorated(decorators, resolve(node.definition()));
    }

    @Override
    public CookedNode visitDecorator(Decorator node) {
        return new Decorator(resolve(node.expression()));
    }

    // ===== Expressions =====

    @Override
    public CookedNode visitNameOccurrence(NameOccurrence node) {
        return resolveName(node);
    }

    @Override
    public CookedNode visitAttribute(Attribute node) {
        return new Attribute(resolve(node.object()), node.member(), node.target());
    }

    @Override
    public CookedNode visitSubscript(Subscript node) {
        var value = resolve(node.value());
        return new Subscript(value, resolveAll(node.indices()));
    }

    @Override
    public CookedNode visitSlice(Slice node) {
        var lower = resolve(node.lower());
        var upper = resolve(node.upper());
        return new Slice(lower, upper, resolve(node.step()));
    }

    @Override
    public CookedNode visitCall(Call node) {
        var function = resolve(node.function());
        return new Call(function, resolveAll(node.arguments()));
    }

    @Override
    public CookedNode visitKeywordArgument(KeywordArgument node) {
        return new KeywordArgument(node.keyword(), resolve(node.value()));
    }

    @Override
    public CookedNode visitStarred(Starred node) {
        return new Starred(resolve(node.value()));
    }

    @Override
    public CookedNode visitDoubleStarred(DoubleStarred node) {
        return new DoubleStarred(resolve(node.value()));
    }

    @Override
    public CookedNode visitBinaryOperation(BinaryOperation node) {
        var left = resolve(node.left());
        return new BinaryOperation(left, node.operator(), resolve(node.right()));
    }

    @Override
    public CookedNode visitBooleanOperation(BooleanOperation node) {
        var left = resolve(node.left());
        return new BooleanOperation(left, node.operator(), resolve(node.right()));
    }

    @Override
    public CookedNode visitUnaryOperation(UnaryOperation node) {
        return new UnaryOperation(node.operator(), resolve(node.operand()));
    }

    @Override
    public CookedNode visitComparison(Comparison node) {
        return new Comparison(resolveAll(node.operands()), node.operators());
    }

    @Override
    public CookedNode visitConditionalExpression(ConditionalExpression node) {
        var body = resolve(node.body());
        var condition = resolve(node.condition());
        return new ConditionalExpression(body, condition, resolve(node.orElse()));
    }

    @Override
    public CookedNode visitNamedExpression(NamedExpression node) {
        var value = resolve(node.value());
        return new NamedExpression(resolveName(node.target()), value);
    }

    @Override
    public CookedNode visitAwait(Await node) {
        return new Await(resolve(node.value()));
    }

    @Override
    public CookedNode visitYield(Yield node) {
        return new Yield(resolve(node.value()), node.from());
    }

    @Override
    public CookedNode visitTupleDisplay(TupleDisplay node) {
        return new TupleDisplay(resolveAll(node.elements()));
    }

    @Override
    public CookedNode visitListDisplay(ListDisplay node) {
        return new ListDisplay(resolveAll(node.elements()));
    }

    @Override
    public CookedNode visitSetDisplay(SetDisplay node) {
        return new SetDisplay(resolveAll(node.elements()));
    }

    @Override
    public CookedNode visitDictDisplay(DictDisplay node) {
        return new DictDisplay(resolveAll(node.entries()));
    }

    @Override
    public CookedNode visitKeyValue(KeyValue node) {
        var key = resolve(node.key());
        return new KeyValue(key, resolve(node.value()));
    }

    @Override
    public CookedNode visitStringLiteral(StringLiteral node) {
        return new StringLiteral(node.span(), resolveAll(node.interpolations()));
    }

    @Override
    public CookedNode visitNumberLiteral(NumberLiteral node) {
        return node;
    }

    @Override
    public CookedNode visitConstant(Constant node) {
        return node;
    }

    @Override
    public CookedNode visitEllipsis(Ellipsis node) {
        return node;
    }

    @Override
    public CookedNode visitOmitted(Omitted node) {
        return node;
    }

    @Override
    public CookedNode visitGeneric(Generic node) {
        return new Generic(node.kind(), node.span(), resolveAll(node.children()));
    }
}
