package io.github.pyanchor.analyzer.cook;

import static io.github.pyanchor.analyzer.python.PythonNodeTypes.*;

import io.github.pyanchor.analyzer.ConcreteNode;
import io.github.pyanchor.analyzer.InvariantViolationException;
import io.github.pyanchor.analyzer.NestingTooDeepException;
import io.github.pyanchor.analyzer.PythonVersion;
import io.github.pyanchor.analyzer.Span;
import io.github.pyanchor.analyzer.cooked.Classification;
import io.github.pyanchor.analyzer.cooked.ComprehensionKind;
import io.github.pyanchor.analyzer.cooked.CookedNode;
import io.github.pyanchor.analyzer.cooked.CookedNode.*;
import io.github.pyanchor.analyzer.cooked.ParameterKind;
import io.github.pyanchor.analyzer.cooked.ScopeKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.pcollections.OrderedPSet;

/**
 * Turns a concrete tree-sitter-python tree into a {@link CookedNode} tree, classifying every identifier occurrence and
 * collecting the names bound directly in each scope.
 *
 * <p>Names are references unless the syntactic position binds them: assignment, loop, {@code with}, {@code except}
 * and comprehension targets, parameters, definition names, import aliases, assignment expressions and {@code case}
 * captures. One instance cooks one file and is not thread-safe.
 */
public final class Cooker {
    private static final Logger log = LogManager.getLogger(Cooker.class);

    /** Node kinds that may appear where a name is being bound. */
    private static final Set<String> TARGET_KINDS = Set.of(
            IDENTIFIER,
            KEYWORD_IDENTIFIER,
            TUPLE,
            LIST,
            PATTERN_LIST,
            TUPLE_PATTERN,
            LIST_PATTERN,
            EXPRESSION_LIST,
            LIST_SPLAT,
            LIST_SPLAT_PATTERN,
            PARENTHESIZED_EXPRESSION,
            ATTRIBUTE,
            SUBSCRIPT,
            AS_PATTERN_TARGET);

    private final String path;
    private final int maxNestingDepth;
    private int depth;

    public Cooker(String path, int maxNestingDepth) {
        this.path = path;
        this.maxNestingDepth = maxNestingDepth;
    }

    /** Cooks a whole file. */
    public ModuleRoot cookModule(ConcreteNode root, PythonVersion version) {
        var cooked = cook(root, CookContext.forModule(version));
        if (!(cooked instanceof ModuleRoot module)) {
            throw new InvariantViolationException("Root node of " + path + " is " + root.kind() + ", not a module");
        }
        return module;
    }

    /** Cooks {@code node} and its subtree under {@code context}. */
    public CookedNode cook(ConcreteNode node, CookContext context) {
        if (++depth > maxNestingDepth) {
            depth--;
            throw new NestingTooDeepException(maxNestingDepth, node.startByte());
        }
        try {
            return dispatch(node, context);
        } finally {
            depth--;
        }
    }

    private CookedNode dispatch(ConcreteNode node, CookContext ctx) {
        var kind = node.kind();
        if (ctx.mode() == Classification.BINDING && !TARGET_KINDS.contains(kind)) {
            log.warn("Cannot bind to {} at byte {} in {}; cooking it as a reference", kind, node.startByte(), path);
            ctx = ctx.withMode(Classification.REFERENCE);
        }

        return switch (kind) {
            case MODULE -> cookModuleRoot(node, ctx);

            // Statements
            case EXPRESSION_STATEMENT -> cookExpressionStatement(node, ctx);
            case ASSIGNMENT -> cookAssignment(node, ctx);
            case AUGMENTED_ASSIGNMENT -> new AugmentedAssignment(
                    cook(requireField(node, FIELD_LEFT), ctx.withMode(Classification.BINDING)),
                    requireField(node, FIELD_OPERATOR).span(),
                    cook(requireField(node, FIELD_RIGHT), reference(ctx)));
            case RETURN_STATEMENT -> new Return(cookOptional(firstNamed(node), reference(ctx)));
            case DELETE_STATEMENT -> new Delete(cookFlattened(firstNamed(node), reference(ctx)));
            case RAISE_STATEMENT -> cookRaise(node, ctx);
            case PASS_STATEMENT -> new Pass(node.span());
            case BREAK_STATEMENT -> new Break(node.span());
            case CONTINUE_STATEMENT -> new Continue(node.span());
            case ASSERT_STATEMENT -> new Assert(cookAll(node.namedChildren(), reference(ctx)));
            case GLOBAL_STATEMENT -> cookGlobal(node, ctx);
            case NONLOCAL_STATEMENT -> cookNonlocal(node, ctx);
            case PRINT_STATEMENT -> cookPrint(node, ctx);
            case EXEC_STATEMENT -> cookExec(node, ctx);
            case TYPE_ALIAS_STATEMENT -> cookTypeAlias(node, ctx);
            case IMPORT_STATEMENT -> cookImport(node, ctx);
            case IMPORT_FROM_STATEMENT -> cookImportFrom(node, ctx);
            case FUTURE_IMPORT_STATEMENT -> cookFutureImport(node, ctx);

            // Compound statements
            case IF_STATEMENT -> cookIf(node, ctx);
            case FOR_STATEMENT -> new For(
                    cook(requireField(node, FIELD_LEFT), ctx.withMode(Classification.BINDING)),
                    cook(requireField(node, FIELD_RIGHT), reference(ctx)),
                    cookBlock(node.childByFieldName(FIELD_BODY), ctx),
                    cookElse(node.childByFieldName(FIELD_ALTERNATIVE), ctx),
                    node.hasToken("async"));
            case WHILE_STATEMENT -> new While(
                    cook(requireField(node, FIELD_CONDITION), reference(ctx)),
                    cookBlock(node.childByFieldName(FIELD_BODY), ctx),
                    cookElse(node.childByFieldName(FIELD_ALTERNATIVE), ctx));
            case TRY_STATEMENT -> cookTry(node, ctx);
            case WITH_STATEMENT -> cookWith(node, ctx);
            case MATCH_STATEMENT -> cookMatch(node, ctx);
            case FUNCTION_DEFINITION -> cookFunction(node, ctx);
            case CLASS_DEFINITION -> cookClass(node, ctx);
            case DECORATED_DEFINITION -> cookDecorated(node, ctx);
            case BLOCK -> new Generic(BLOCK, node.span(), cookBlock(node, ctx));

            // Names and trailers
            case IDENTIFIER, KEYWORD_IDENTIFIER -> cookName(node, ctx);
            case AS_PATTERN_TARGET -> cookAsPatternTarget(node, ctx);
            case ATTRIBUTE -> cookAttribute(node, ctx);
            case SUBSCRIPT -> new Subscript(
                    cook(requireField(node, FIELD_VALUE), reference(ctx)),
                    cookAll(node.childrenByFieldName(FIELD_SUBSCRIPT), reference(ctx)));
            case SLICE -> cookSlice(node, ctx);
            case CALL -> cookCall(node, ctx);
            case KEYWORD_ARGUMENT -> cookKeywordArgument(node, ctx);
            case LIST_SPLAT, LIST_SPLAT_PATTERN, PARENTHESIZED_LIST_SPLAT -> new Starred(
                    cookOptional(firstNamed(node), ctx));
            case DICTIONARY_SPLAT, DICTIONARY_SPLAT_PATTERN -> new DoubleStarred(
                    cookOptional(firstNamed(node), reference(ctx)));

            // Operators
            case BINARY_OPERATOR -> new BinaryOperation(
                    cook(requireField(node, FIELD_LEFT), ctx),
                    requireField(node, FIELD_OPERATOR).span(),
                    cook(requireField(node, FIELD_RIGHT), ctx));
            case BOOLEAN_OPERATOR -> new BooleanOperation(
                    cook(requireField(node, FIELD_LEFT), ctx),
                    requireField(node, FIELD_OPERATOR).span(),
                    cook(requireField(node, FIELD_RIGHT), ctx));
            case NOT_OPERATOR -> new UnaryOperation(
                    node.children().get(0).span(), cook(requireField(node, FIELD_ARGUMENT), ctx));
            case UNARY_OPERATOR -> new UnaryOperation(
                    requireField(node, FIELD_OPERATOR).span(), cook(requireField(node, FIELD_ARGUMENT), ctx));
            case COMPARISON_OPERATOR -> cookComparison(node, ctx);
            case CONDITIONAL_EXPRESSION -> cookConditional(node, ctx);
            case NAMED_EXPRESSION -> cookNamedExpression(node, ctx);
            case AWAIT -> new Await(cookOptional(firstNamed(node), ctx));
            case YIELD -> new Yield(cookOptional(firstNamed(node), reference(ctx)), node.hasToken("from"));
            case LAMBDA -> cookLambda(node, ctx);
            case AS_PATTERN -> new Generic(AS_PATTERN, node.span(), List.of(
                    cook(node.namedChildren().get(0), reference(ctx)),
                    cookOptional(node.childByFieldName(FIELD_ALIAS), ctx.withMode(Classification.BINDING))));

            // Displays
            case PARENTHESIZED_EXPRESSION -> cookParenthesized(node, ctx);
            case TUPLE, EXPRESSION_LIST, PATTERN_LIST, TUPLE_PATTERN -> new TupleDisplay(
                    cookAll(node.namedChildren(), ctx));
            case LIST, LIST_PATTERN -> new ListDisplay(cookAll(node.namedChildren(), ctx));
            case SET -> new SetDisplay(cookAll(node.namedChildren(), ctx));
            case DICTIONARY -> new DictDisplay(cookAll(node.namedChildren(), ctx));
            case PAIR -> new KeyValue(
                    cook(requireField(node, FIELD_KEY), ctx), cook(requireField(node, FIELD_VALUE), ctx));
            case LIST_COMPREHENSION -> cookComprehension(node, ComprehensionKind.LIST, ctx);
            case SET_COMPREHENSION -> cookComprehension(node, ComprehensionKind.SET, ctx);
            case DICTIONARY_COMPREHENSION -> cookComprehension(node, ComprehensionKind.DICT, ctx);
            case GENERATOR_EXPRESSION -> cookComprehension(node, ComprehensionKind.GENERATOR, ctx);

            // Literals
            case STRING, CONCATENATED_STRING -> new StringLiteral(node.span(), cookInterpolations(node, ctx));
            case INTEGER, FLOAT -> new NumberLiteral(node.span());
            case TRUE, FALSE, NONE -> new Constant(node.span());
            case ELLIPSIS -> new Ellipsis(node.span());

            // Annotations
            case TYPE -> cookType(node, ctx);
            case MEMBER_TYPE -> cookMemberType(node, ctx);

            default -> cookGeneric(node, ctx);
        };
    }

    // ===== Scopes =====

    private CookedNode cookModuleRoot(ConcreteNode node, CookContext ctx) {
        if (ctx.scopeKind() != ScopeKind.MODULE) {
            throw new InvariantViolationException("Nested module node at byte " + node.startByte() + " in " + path);
        }
        var body = cookStatements(node.namedChildren(), ctx);
        return new ModuleRoot(path, body, ctx.freezeBindings());
    }

    private CookedNode cookClass(ConcreteNode node, CookContext ctx) {
        var name = cookDefinitionName(requireField(node, FIELD_NAME), ctx);
        var typeParameters = cookOptional(node.childByFieldName(FIELD_TYPE_PARAMETERS), reference(ctx));
        var superclasses = node.childByFieldName(FIELD_SUPERCLASSES);
        List<CookedNode> bases = superclasses == null ? List.of() : cookArguments(superclasses, reference(ctx));

        var classCtx = ctx.enterScope(ScopeKind.CLASS);
        var body = cookBlock(node.childByFieldName(FIELD_BODY), classCtx);
        log.trace("Cooked class {} with bindings {}", name.name(), classCtx.freezeBindings());
        return new ClassDef(name, typeParameters, bases, body, classCtx.freezeBindings());
    }

    private CookedNode cookFunction(ConcreteNode node, CookContext ctx) {
        var name = cookDefinitionName(requireField(node, FIELD_NAME), ctx);
        var typeParameters = cookOptional(node.childByFieldName(FIELD_TYPE_PARAMETERS), reference(ctx));
        var returnType = cookOptional(node.childByFieldName(FIELD_RETURN_TYPE), reference(ctx));

        var functionCtx = ctx.enterScope(ScopeKind.FUNCTION);
        var parameters = cookParameters(node.childByFieldName(FIELD_PARAMETERS), ctx, functionCtx);
        var body = cookBlock(node.childByFieldName(FIELD_BODY), functionCtx);
        return new FunctionDef(
                name,
                node.hasToken("async"),
                typeParameters,
                parameters,
                returnType,
                body,
                functionCtx.freezeBindings());
    }

    private CookedNode cookLambda(ConcreteNode node, CookContext ctx) {
        var keyword = node.children().get(0);
        var lambdaCtx = ctx.enterScope(ScopeKind.FUNCTION);
        var parameters = cookParameters(node.childByFieldName(FIELD_PARAMETERS), ctx, lambdaCtx);
        var body = cook(requireField(node, FIELD_BODY), lambdaCtx);
        return new Lambda(keyword.span(), parameters, body, lambdaCtx.freezeBindings());
    }

    private CookedNode cookDecorated(ConcreteNode node, CookContext ctx) {
        var decorators = new ArrayList<Decorator>();
        for (var child : node.namedChildren()) {
            if (DECORATOR.equals(child.kind())) {
                var expression = firstNamed(child);
                if (expression == null) {
                    log.debug("Empty decorator at byte {} in {}", child.startByte(), path);
                    continue;
                }
                decorators.add(new Decorator(cookDecoratorExpression(expression, ctx)));
            }
        }
        var definition = cook(requireField(node, FIELD_DEFINITION), reference(ctx));
        return new Decorated(decorators, definition);
    }

    /** A dotted decorator path is raw up to its final segment; a bare name is an ordinary reference. */
    private CookedNode cookDecoratorExpression(ConcreteNode expression, CookContext ctx) {
        if (ATTRIBUTE.equals(expression.kind()) && isDottedChain(expression)) {
            return cook(expression, ctx.withMode(Classification.RAW));
        }
        if (CALL.equals(expression.kind())) {
            var function = requireField(expression, FIELD_FUNCTION);
            if (ATTRIBUTE.equals(function.kind()) && isDottedChain(function)) {
                var arguments = requireField(expression, FIELD_ARGUMENTS);
                return new Call(cook(function, ctx.withMode(Classification.RAW)), cookCallArguments(arguments, ctx));
            }
        }
        return cook(expression, reference(ctx));
    }

    private static boolean isDottedChain(ConcreteNode node) {
        var current = node;
        while (ATTRIBUTE.equals(current.kind())) {
            var object = current.childByFieldName(FIELD_OBJECT);
            if (object == null) {
                return false;
            }
            current = object;
        }
        return IDENTIFIER.equals(current.kind());
    }

    private CookedNode cookComprehension(ConcreteNode node, ComprehensionKind kind, CookContext ctx) {
        var clauses = node.namedChildren().stream()
                .filter(c -> FOR_IN_CLAUSE.equals(c.kind()) || IF_CLAUSE.equals(c.kind()))
                .toList();
        if (clauses.isEmpty() || !FOR_IN_CLAUSE.equals(clauses.get(0).kind())) {
            throw new InvariantViolationException(
                    "Comprehension at byte " + node.startByte() + " in " + path + " does not start with a for clause");
        }
        var first = clauses.get(0);
        var forKeyword = first.children().stream()
                .filter(c -> "for".equals(c.kind()))
                .findFirst()
                .orElseThrow(() -> new InvariantViolationException(
                        "for clause without 'for' at byte " + first.startByte() + " in " + path));

        boolean isolated = ctx.version().comprehensionsIsolated();
        // the outermost iterable is evaluated in the enclosing scope
        var firstIterables = cookAll(first.childrenByFieldName(FIELD_RIGHT), reference(ctx));
        var compCtx = isolated ? ctx.enterScope(ScopeKind.COMPREHENSION) : reference(ctx);

        var cookedClauses = new ArrayList<CookedNode>();
        cookedClauses.add(new ComprehensionFor(
                cook(requireField(first, FIELD_LEFT), compCtx.withMode(Classification.BINDING)),
                firstIterables,
                first.hasToken("async")));
        for (var clause : clauses.subList(1, clauses.size())) {
            if (FOR_IN_CLAUSE.equals(clause.kind())) {
                cookedClauses.add(new ComprehensionFor(
                        cook(requireField(clause, FIELD_LEFT), compCtx.withMode(Classification.BINDING)),
                        cookAll(clause.childrenByFieldName(FIELD_RIGHT), compCtx),
                        clause.hasToken("async")));
            } else {
                cookedClauses.add(new ComprehensionIf(cookOptional(firstNamed(clause), compCtx)));
            }
        }
        var element = cook(requireField(node, FIELD_BODY), compCtx);
        OrderedPSet<String> bindings = isolated ? compCtx.freezeBindings() : OrderedPSet.empty();
        return new Comprehension(kind, forKeyword.span(), element, cookedClauses, bindings);
    }

    // ===== Parameters =====

    /**
     * Parameter names bind in {@code inner}; annotations and defaults are evaluated where the definition is, in
     * {@code outer}.
     */
    private List<Parameter> cookParameters(@Nullable ConcreteNode parameters, CookContext outer, CookContext inner) {
        if (parameters == null) {
            return List.of();
        }
        var bindInner = inner.withMode(Classification.BINDING);
        var refOuter = reference(outer);
        var result = new ArrayList<Parameter>();
        for (var param : parameters.namedChildren()) {
            switch (param.kind()) {
                case IDENTIFIER, TUPLE_PATTERN -> result.add(new Parameter(
                        cook(param, bindInner), ParameterKind.REGULAR, CookedNode.omitted(), CookedNode.omitted()));
                case LIST_SPLAT_PATTERN -> result.add(new Parameter(
                        cookOptional(firstNamed(param), bindInner),
                        ParameterKind.VAR_POSITIONAL,
                        CookedNode.omitted(),
                        CookedNode.omitted()));
                case DICTIONARY_SPLAT_PATTERN -> result.add(new Parameter(
                        cookOptional(firstNamed(param), bindInner),
                        ParameterKind.VAR_KEYWORD,
                        CookedNode.omitted(),
                        CookedNode.omitted()));
                case TYPED_PARAMETER -> result.add(cookTypedParameter(param, bindInner, refOuter));
                case DEFAULT_PARAMETER, TYPED_DEFAULT_PARAMETER -> result.add(new Parameter(
                        cook(requireField(param, FIELD_NAME), bindInner),
                        ParameterKind.REGULAR,
                        cookOptional(param.childByFieldName(FIELD_TYPE), refOuter),
                        cook(requireField(param, FIELD_VALUE), refOuter)));
                case KEYWORD_SEPARATOR, POSITIONAL_SEPARATOR -> {
                    // bare * and / carry no names
                }
                default -> log.debug(
                        "Skipping parameter of kind {} at byte {} in {}", param.kind(), param.startByte(), path);
            }
        }
        return result;
    }

    private Parameter cookTypedParameter(ConcreteNode param, CookContext bindInner, CookContext refOuter) {
        var annotation = cookOptional(param.childByFieldName(FIELD_TYPE), refOuter);
        ConcreteNode target = null;
        var children = param.children();
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i).isNamed() && !FIELD_TYPE.equals(param.fieldNameForChild(i))) {
                target = children.get(i);
                break;
            }
        }
        if (target == null) {
            throw new InvariantViolationException(
                    "Typed parameter without a name at byte " + param.startByte() + " in " + path);
        }
        return switch (target.kind()) {
            case LIST_SPLAT_PATTERN -> new Parameter(
                    cookOptional(firstNamed(target), bindInner),
                    ParameterKind.VAR_POSITIONAL,
                    annotation,
                    CookedNode.omitted());
            case DICTIONARY_SPLAT_PATTERN -> new Parameter(
                    cookOptional(firstNamed(target), bindInner),
                    ParameterKind.VAR_KEYWORD,
                    annotation,
                    CookedNode.omitted());
            default -> new Parameter(cook(target, bindInner), ParameterKind.REGULAR, annotation, CookedNode.omitted());
        };
    }

    // ===== Statements =====

    private CookedNode cookExpressionStatement(ConcreteNode node, CookContext ctx) {
        var children = node.namedChildren();
        if (children.size() == 1) {
            var only = children.get(0);
            if (ASSIGNMENT.equals(only.kind()) || AUGMENTED_ASSIGNMENT.equals(only.kind())) {
                return cook(only, ctx);
            }
        }
        return new ExpressionStatement(cookAll(children, reference(ctx)));
    }

    /** Flattens {@code a = b = value}; an annotation turns the statement into an annotated assignment. */
    private CookedNode cookAssignment(ConcreteNode node, CookContext ctx) {
        var bind = ctx.withMode(Classification.BINDING);
        var annotation = node.childByFieldName(FIELD_TYPE);
        if (annotation != null) {
            return new AnnotatedAssignment(
                    cook(requireField(node, FIELD_LEFT), bind),
                    cook(annotation, reference(ctx)),
                    cookOptional(node.childByFieldName(FIELD_RIGHT), reference(ctx)));
        }

        var targets = new ArrayList<CookedNode>();
        var current = node;
        while (true) {
            targets.add(cook(requireField(current, FIELD_LEFT), bind));
            var right = requireField(current, FIELD_RIGHT);
            if (ASSIGNMENT.equals(right.kind()) && right.childByFieldName(FIELD_TYPE) == null) {
                current = right;
                continue;
            }
            return new Assignment(targets, cook(right, reference(ctx)));
        }
    }

    private CookedNode cookRaise(ConcreteNode node, CookContext ctx) {
        CookedNode exception = CookedNode.omitted();
        var children = node.children();
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i).isNamed() && !FIELD_CAUSE.equals(node.fieldNameForChild(i))) {
                exception = cook(children.get(i), reference(ctx));
                break;
            }
        }
        return new Raise(exception, cookOptional(node.childByFieldName(FIELD_CAUSE), reference(ctx)));
    }

    private CookedNode cookGlobal(ConcreteNode node, CookContext ctx) {
        var names = new ArrayList<NameOccurrence>();
        for (var child : node.namedChildren()) {
            ctx.declareGlobal(child.text());
            names.add(NameOccurrence.reference(child.span()));
        }
        return new Global(names);
    }

    private CookedNode cookNonlocal(ConcreteNode node, CookContext ctx) {
        var names = new ArrayList<NameOccurrence>();
        for (var child : node.namedChildren()) {
            ctx.declareNonlocal(child.text());
            names.add(NameOccurrence.reference(child.span()));
        }
        return new Nonlocal(names);
    }

    private CookedNode cookPrint(ConcreteNode node, CookContext ctx) {
        warnIfNotLegacy(node, ctx);
        CookedNode destination = CookedNode.omitted();
        for (var child : node.namedChildren()) {
            if (CHEVRON.equals(child.kind())) {
                destination = cookOptional(firstNamed(child), reference(ctx));
            }
        }
        return new Print(destination, cookAll(node.childrenByFieldName(FIELD_ARGUMENT), reference(ctx)));
    }

    private CookedNode cookExec(ConcreteNode node, CookContext ctx) {
        warnIfNotLegacy(node, ctx);
        var code = requireField(node, FIELD_CODE);
        var namespaces = node.namedChildren().stream()
                .filter(c -> c.startByte() != code.startByte())
                .toList();
        return new Exec(cook(code, reference(ctx)), cookAll(namespaces, reference(ctx)));
    }

    private void warnIfNotLegacy(ConcreteNode node, CookContext ctx) {
        if (!ctx.version().allowsLegacyStatements()) {
            log.warn("Legacy {} at byte {} in {} while cooking as {}", node.kind(), node.startByte(), path, ctx.version());
        }
    }

    /** {@code type Name = value}; the grammar does not always label the two sides with fields. */
    private CookedNode cookTypeAlias(ConcreteNode node, CookContext ctx) {
        var left = node.childByFieldName(FIELD_LEFT);
        var right = node.childByFieldName(FIELD_RIGHT);
        if (left == null || right == null) {
            var parts = node.namedChildren();
            if (parts.size() < 2) {
                log.warn("Type alias with {} parts at byte {} in {}", parts.size(), node.startByte(), path);
                return cookGeneric(node, ctx);
            }
            left = parts.get(0);
            right = parts.get(1);
        }
        return new TypeAlias(cookTypeAliasName(left, ctx), cook(right, reference(ctx)));
    }

    private CookedNode cookTypeAliasName(ConcreteNode left, CookContext ctx) {
        var node = unwrapType(left);
        if (IDENTIFIER.equals(node.kind())) {
            return cookName(node, ctx.withMode(Classification.BINDING));
        }
        var children = node.namedChildren();
        if (!children.isEmpty() && IDENTIFIER.equals(children.get(0).kind())) {
            // generic alias: type Name[T] = ...
            var parts = new ArrayList<CookedNode>();
            parts.add(cookName(children.get(0), ctx.withMode(Classification.BINDING)));
            parts.addAll(cookAll(children.subList(1, children.size()), reference(ctx)));
            return new Generic(node.kind(), node.span(), parts);
        }
        return cook(node, reference(ctx));
    }

    private CookedNode cookIf(ConcreteNode node, CookContext ctx) {
        var alternatives = new ArrayList<CookedNode>();
        for (var alternative : node.childrenByFieldName(FIELD_ALTERNATIVE)) {
            if (ELIF_CLAUSE.equals(alternative.kind())) {
                alternatives.add(new ElifClause(
                        cook(requireField(alternative, FIELD_CONDITION), reference(ctx)),
                        cookBlock(alternative.childByFieldName(FIELD_CONSEQUENCE), ctx)));
            } else {
                alternatives.add(cookElse(alternative, ctx));
            }
        }
        return new If(
                cook(requireField(node, FIELD_CONDITION), reference(ctx)),
                cookBlock(node.childByFieldName(FIELD_CONSEQUENCE), ctx),
                alternatives);
    }

    private CookedNode cookElse(@Nullable ConcreteNode elseClause, CookContext ctx) {
        if (elseClause == null) {
            return CookedNode.omitted();
        }
        var body = elseClause.childByFieldName(FIELD_BODY);
        return new ElseClause(cookBlock(body != null ? body : findChild(elseClause, BLOCK), ctx));
    }

    private CookedNode cookTry(ConcreteNode node, CookContext ctx) {
        var handlers = new ArrayList<ExceptHandler>();
        CookedNode orElse = CookedNode.omitted();
        CookedNode finallyClause = CookedNode.omitted();
        for (var child : node.namedChildren()) {
            switch (child.kind()) {
                case EXCEPT_CLAUSE -> handlers.add(cookExceptClause(child, ctx, false));
                case EXCEPT_GROUP_CLAUSE -> handlers.add(cookExceptClause(child, ctx, true));
                case ELSE_CLAUSE -> orElse = cookElse(child, ctx);
                case FINALLY_CLAUSE -> finallyClause = new FinallyClause(cookBlock(findChild(child, BLOCK), ctx));
                default -> {
                    // the try body is picked up by field below
                }
            }
        }
        return new Try(cookBlock(node.childByFieldName(FIELD_BODY), ctx), handlers, orElse, finallyClause);
    }

    /**
     * Handles {@code except}, {@code except E}, {@code except E as e}, the legacy {@code except E, e}, and both the
     * field-labelled and {@code as_pattern} shapes the grammar has used for them.
     */
    private ExceptHandler cookExceptClause(ConcreteNode node, CookContext ctx, boolean group) {
        var body = cookBlock(findChild(node, BLOCK), ctx);
        var bind = ctx.withMode(Classification.BINDING);

        var value = node.childByFieldName(FIELD_VALUE);
        var alias = node.childByFieldName(FIELD_ALIAS);
        if (value != null || alias != null) {
            return new ExceptHandler(
                    cookOptional(value, reference(ctx)), cookOptional(alias, exceptAliasContext(node, ctx)), body, group);
        }

        var expressions = node.namedChildren().stream()
                .filter(c -> !BLOCK.equals(c.kind()))
                .toList();
        if (expressions.isEmpty()) {
            return new ExceptHandler(CookedNode.omitted(), CookedNode.omitted(), body, group);
        }
        var first = expressions.get(0);
        if (AS_PATTERN.equals(first.kind())) {
            var type = first.namedChildren().get(0);
            return new ExceptHandler(
                    cook(type, reference(ctx)), cookOptional(first.childByFieldName(FIELD_ALIAS), bind), body, group);
        }
        if (expressions.size() >= 2 && (node.hasToken("as") || node.hasToken(","))) {
            return new ExceptHandler(
                    cook(first, reference(ctx)), cook(expressions.get(1), exceptAliasContext(node, ctx)), body, group);
        }
        return new ExceptHandler(cook(first, reference(ctx)), CookedNode.omitted(), body, group);
    }

    /** {@code except E, e} only binds {@code e} in the legacy dialect. */
    private CookContext exceptAliasContext(ConcreteNode node, CookContext ctx) {
        if (!node.hasToken("as") && node.hasToken(",") && !ctx.version().allowsLegacyStatements()) {
            log.warn("Legacy 'except E, name' at byte {} in {} while cooking as {}", node.startByte(), path, ctx.version());
            return reference(ctx);
        }
        return ctx.withMode(Classification.BINDING);
    }

    private CookedNode cookWith(ConcreteNode node, CookContext ctx) {
        var items = new ArrayList<WithItem>();
        var clause = findChild(node, WITH_CLAUSE);
        if (clause != null) {
            for (var item : clause.namedChildren()) {
                if (!WITH_ITEM.equals(item.kind())) {
                    continue;
                }
                var value = requireField(item, FIELD_VALUE);
                if (AS_PATTERN.equals(value.kind())) {
                    items.add(new WithItem(
                            cook(value.namedChildren().get(0), reference(ctx)),
                            cookOptional(value.childByFieldName(FIELD_ALIAS), ctx.withMode(Classification.BINDING))));
                } else {
                    items.add(new WithItem(cook(value, reference(ctx)), CookedNode.omitted()));
                }
            }
        }
        return new With(items, cookBlock(node.childByFieldName(FIELD_BODY), ctx), node.hasToken("async"));
    }

    // ===== Imports =====

    private CookedNode cookImport(ConcreteNode node, CookContext ctx) {
        var modules = new ArrayList<ImportedModule>();
        for (var entry : node.childrenByFieldName(FIELD_NAME)) {
            if (ALIASED_IMPORT.equals(entry.kind())) {
                var path = rawSegments(requireField(entry, FIELD_NAME));
                var alias = cookName(requireField(entry, FIELD_ALIAS), ctx.withMode(Classification.BINDING));
                modules.add(new ImportedModule(path, alias));
            } else {
                // import a.b.c binds a
                var segments = entry.namedChildren();
                var path = new ArrayList<NameOccurrence>();
                for (int i = 0; i < segments.size(); i++) {
                    var segment = segments.get(i);
                    path.add(i == 0
                            ? cookName(segment, ctx.withMode(Classification.BINDING))
                            : NameOccurrence.raw(segment.span()));
                }
                modules.add(new ImportedModule(path, CookedNode.omitted()));
            }
        }
        return new Import(modules);
    }

    private CookedNode cookImportFrom(ConcreteNode node, CookContext ctx) {
        var moduleName = requireField(node, FIELD_MODULE_NAME);
        int level = 0;
        List<NameOccurrence> module = List.of();
        if (RELATIVE_IMPORT.equals(moduleName.kind())) {
            var prefix = findChild(moduleName, IMPORT_PREFIX);
            level = prefix == null ? 0 : prefix.endByte() - prefix.startByte();
            var dotted = findChild(moduleName, DOTTED_NAME);
            if (dotted != null) {
                module = rawSegments(dotted);
            }
        } else {
            module = rawSegments(moduleName);
        }

        var wildcard = findChild(node, WILDCARD_IMPORT);
        if (wildcard != null) {
            return new ImportFrom(level, module, List.of(new WildcardImport(wildcard.span())));
        }
        return new ImportFrom(level, module, cookImportedNames(node, ctx));
    }

    private CookedNode cookFutureImport(ConcreteNode node, CookContext ctx) {
        List<NameOccurrence> module = node.children().stream()
                .filter(c -> "__future__".equals(c.kind()))
                .map(c -> NameOccurrence.raw(c.span()))
                .toList();
        return new ImportFrom(0, module, cookImportedNames(node, ctx));
    }

    private List<CookedNode> cookImportedNames(ConcreteNode node, CookContext ctx) {
        var bind = ctx.withMode(Classification.BINDING);
        var names = new ArrayList<CookedNode>();
        for (var entry : node.childrenByFieldName(FIELD_NAME)) {
            if (ALIASED_IMPORT.equals(entry.kind())) {
                var imported = requireField(entry, FIELD_NAME);
                names.add(new ImportedName(
                        NameOccurrence.raw(imported.span()), cookName(requireField(entry, FIELD_ALIAS), bind)));
            } else {
                var target = DOTTED_NAME.equals(entry.kind()) && entry.namedChildren().size() == 1
                        ? entry.namedChildren().get(0)
                        : entry;
                names.add(new ImportedName(cookName(target, bind), CookedNode.omitted()));
            }
        }
        return names;
    }

    private List<NameOccurrence> rawSegments(ConcreteNode dotted) {
        if (!DOTTED_NAME.equals(dotted.kind())) {
            return List.of(NameOccurrence.raw(dotted.span()));
        }
        return dotted.namedChildren().stream()
                .map(segment -> NameOccurrence.raw(segment.span()))
                .toList();
    }

    // ===== match / case =====

    private CookedNode cookMatch(ConcreteNode node, CookContext ctx) {
        var subjects = cookAll(node.childrenByFieldName(FIELD_SUBJECT), reference(ctx));
        var cases = new ArrayList<CaseClause>();
        var body = node.childByFieldName(FIELD_BODY);
        if (body != null) {
            for (var clause : body.namedChildren()) {
                if (CASE_CLAUSE.equals(clause.kind())) {
                    cases.add(cookCaseClause(clause, ctx));
                }
            }
        }
        return new Match(subjects, cases);
    }

    private CaseClause cookCaseClause(ConcreteNode node, CookContext ctx) {
        var patterns = new ArrayList<CookedNode>();
        for (var child : node.namedChildren()) {
            if (CASE_PATTERN.equals(child.kind())) {
                patterns.add(cookCasePattern(child, ctx));
            }
        }
        var guard = node.childByFieldName(FIELD_GUARD);
        return new CaseClause(
                patterns,
                guard == null ? CookedNode.omitted() : cookOptional(firstNamed(guard), reference(ctx)),
                cookBlock(node.childByFieldName(FIELD_CONSEQUENCE), ctx));
    }

    /** Capture names bind; dotted value patterns, class names and literals are references. */
    private CookedNode cookCasePattern(ConcreteNode node, CookContext ctx) {
        var bind = ctx.withMode(Classification.BINDING);
        return switch (node.kind()) {
            case IDENTIFIER -> cookCapture(node, bind);
            case DOTTED_NAME -> node.namedChildren().size() == 1
                    ? cookCapture(node.namedChildren().get(0), bind)
                    : cookValuePattern(node, ctx);
            case CLASS_PATTERN -> {
                var parts = new ArrayList<CookedNode>();
                var children = node.namedChildren();
                for (int i = 0; i < children.size(); i++) {
                    var child = children.get(i);
                    parts.add(i == 0 && DOTTED_NAME.equals(child.kind())
                            ? cookValuePattern(child, ctx)
                            : cookCasePattern(child, ctx));
                }
                yield new CasePattern(node.kind(), parts);
            }
            case KEYWORD_PATTERN -> {
                var parts = new ArrayList<CookedNode>();
                var children = node.namedChildren();
                for (int i = 0; i < children.size(); i++) {
                    var child = children.get(i);
                    parts.add(i == 0 && IDENTIFIER.equals(child.kind())
                            ? NameOccurrence.raw(child.span())
                            : cookCasePattern(child, ctx));
                }
                yield new CasePattern(node.kind(), parts);
            }
            case SPLAT_PATTERN -> new Starred(
                    firstNamed(node) == null ? CookedNode.omitted() : cookCapture(firstNamed(node), bind));
            case AS_PATTERN -> {
                var children = node.namedChildren();
                var parts = new ArrayList<CookedNode>();
                for (int i = 0; i < children.size(); i++) {
                    var child = children.get(i);
                    boolean isAlias = i == children.size() - 1 && i > 0 && IDENTIFIER.equals(child.kind());
                    parts.add(isAlias ? cookCapture(child, bind) : cookCasePattern(child, ctx));
                }
                yield new CasePattern(node.kind(), parts);
            }
            case STRING, CONCATENATED_STRING, INTEGER, FLOAT, TRUE, FALSE, NONE, ELLIPSIS -> cook(node, reference(ctx));
            default -> new CasePattern(node.kind(), node.namedChildren().stream()
                    .map(child -> cookCasePattern(child, ctx))
                    .toList());
        };
    }

    private CookedNode cookCapture(@Nullable ConcreteNode name, CookContext bind) {
        if (name == null) {
            return CookedNode.omitted();
        }
        if ("_".equals(name.text())) {
            return NameOccurrence.raw(name.span());
        }
        return cookName(name, bind);
    }

    /** {@code a.b.c} in a pattern: the head is looked up, the members are not. */
    private CookedNode cookValuePattern(ConcreteNode dotted, CookContext ctx) {
        var segments = dotted.namedChildren();
        if (segments.isEmpty()) {
            return CookedNode.omitted();
        }
        CookedNode result = cookName(segments.get(0), reference(ctx));
        for (var member : segments.subList(1, segments.size())) {
            result = new Attribute(result, NameOccurrence.raw(member.span()), false);
        }
        return result;
    }

    // ===== Expressions =====

    private NameOccurrence cookName(ConcreteNode node, CookContext ctx) {
        var span = node.span();
        if (node.isMissing() || span.text().isEmpty()) {
            log.debug("Missing identifier at byte {} in {}", span.start(), path);
            return NameOccurrence.raw(span);
        }
        return switch (ctx.mode()) {
            case BINDING -> ctx.bind(span.text()) ? NameOccurrence.binding(span) : NameOccurrence.reference(span);
            case REFERENCE -> NameOccurrence.reference(span);
            case RAW -> NameOccurrence.raw(span);
        };
    }

    /** The name of a class or function binds in the enclosing scope. */
    private NameOccurrence cookDefinitionName(ConcreteNode name, CookContext ctx) {
        return cookName(name, ctx.withMode(Classification.BINDING));
    }

    private CookedNode cookAsPatternTarget(ConcreteNode node, CookContext ctx) {
        var inner = firstNamed(node);
        return inner == null ? cookName(node, ctx) : cook(inner, ctx);
    }

    /** Only the final member inherits the ambient classification, and members are never resolved. */
    private CookedNode cookAttribute(ConcreteNode node, CookContext ctx) {
        var objectCtx = ctx.mode() == Classification.RAW ? ctx : reference(ctx);
        var object = cook(requireField(node, FIELD_OBJECT), objectCtx);
        var member = requireField(node, FIELD_ATTRIBUTE);
        return new Attribute(object, NameOccurrence.raw(member.span()), ctx.mode() == Classification.BINDING);
    }

    private CookedNode cookSlice(ConcreteNode node, CookContext ctx) {
        var slots = new CookedNode[] {CookedNode.omitted(), CookedNode.omitted(), CookedNode.omitted()};
        int colons = 0;
        for (var child : node.children()) {
            if (!child.isNamed()) {
                if (":".equals(child.kind())) {
                    colons++;
                }
                continue;
            }
            if (colons < slots.length) {
                slots[colons] = cook(child, reference(ctx));
            }
        }
        return new Slice(slots[0], slots[1], slots[2]);
    }

    private CookedNode cookCall(ConcreteNode node, CookContext ctx) {
        var function = cook(requireField(node, FIELD_FUNCTION), reference(ctx));
        return new Call(function, cookCallArguments(requireField(node, FIELD_ARGUMENTS), ctx));
    }

    private List<CookedNode> cookCallArguments(ConcreteNode arguments, CookContext ctx) {
        if (GENERATOR_EXPRESSION.equals(arguments.kind())) {
            return List.of(cook(arguments, reference(ctx)));
        }
        return cookArguments(arguments, reference(ctx));
    }

    private List<CookedNode> cookArguments(ConcreteNode argumentList, CookContext ctx) {
        return cookAll(argumentList.namedChildren(), ctx);
    }

    private CookedNode cookKeywordArgument(ConcreteNode node, CookContext ctx) {
        var name = requireField(node, FIELD_NAME);
        var value = cook(requireField(node, FIELD_VALUE), reference(ctx));
        if (!IDENTIFIER.equals(name.kind()) && !KEYWORD_IDENTIFIER.equals(name.kind())) {
            log.warn("Keyword argument name is a {} at byte {} in {}; ignoring it", name.kind(), name.startByte(), path);
        }
        return new KeywordArgument(name.span(), value);
    }

    private CookedNode cookComparison(ConcreteNode node, CookContext ctx) {
        var operands = new ArrayList<CookedNode>();
        var operators = new ArrayList<Span>();
        var children = node.children();
        for (int i = 0; i < children.size(); i++) {
            var child = children.get(i);
            if (FIELD_OPERATORS.equals(node.fieldNameForChild(i))) {
                operators.add(child.span());
            } else if (child.isNamed()) {
                operands.add(cook(child, ctx));
            }
        }
        return new Comparison(operands, operators);
    }

    private CookedNode cookConditional(ConcreteNode node, CookContext ctx) {
        var parts = node.namedChildren();
        if (parts.size() != 3) {
            log.debug("Conditional expression with {} parts at byte {} in {}", parts.size(), node.startByte(), path);
            return cookGeneric(node, ctx);
        }
        return new ConditionalExpression(cook(parts.get(0), ctx), cook(parts.get(1), ctx), cook(parts.get(2), ctx));
    }

    private CookedNode cookNamedExpression(ConcreteNode node, CookContext ctx) {
        var name = requireField(node, FIELD_NAME);
        var span = name.span();
        NameOccurrence target;
        if (name.isMissing() || span.text().isEmpty()) {
            target = NameOccurrence.raw(span);
        } else {
            target = ctx.bindAssignmentExpression(span.text())
                    ? NameOccurrence.binding(span)
                    : NameOccurrence.reference(span);
        }
        return new NamedExpression(target, cook(requireField(node, FIELD_VALUE), reference(ctx)));
    }

    private CookedNode cookParenthesized(ConcreteNode node, CookContext ctx) {
        var inner = firstNamed(node);
        if (inner == null) {
            return new TupleDisplay(List.of());
        }
        return cook(inner, ctx);
    }

    private List<CookedNode> cookInterpolations(ConcreteNode node, CookContext ctx) {
        var result = new ArrayList<CookedNode>();
        for (var child : node.namedChildren()) {
            switch (child.kind()) {
                case STRING -> result.addAll(cookInterpolations(child, ctx));
                case INTERPOLATION, FORMAT_EXPRESSION -> {
                    var expression = child.childByFieldName(FIELD_EXPRESSION);
                    if (expression == null) {
                        expression = firstNamed(child);
                    }
                    if (expression != null && !FORMAT_SPECIFIER.equals(expression.kind())) {
                        result.add(cook(expression, reference(ctx)));
                    }
                    var specifier = findChild(child, FORMAT_SPECIFIER);
                    if (specifier != null) {
                        result.addAll(cookInterpolations(specifier, ctx));
                    }
                }
                default -> {
                    // string_start, string_content, escape sequences
                }
            }
        }
        return result;
    }

    private CookedNode cookType(ConcreteNode node, CookContext ctx) {
        var children = node.namedChildren();
        if (children.size() == 1) {
            return cook(children.get(0), reference(ctx));
        }
        return cookGeneric(node, ctx);
    }

    private CookedNode cookMemberType(ConcreteNode node, CookContext ctx) {
        var children = node.namedChildren();
        if (children.size() != 2) {
            return cookGeneric(node, ctx);
        }
        return new Attribute(cook(children.get(0), reference(ctx)), NameOccurrence.raw(children.get(1).span()), false);
    }

    private CookedNode cookGeneric(ConcreteNode node, CookContext ctx) {
        if (node.isError()) {
            log.debug("Error node at bytes {}-{} in {}", node.startByte(), node.endByte(), path);
        } else if (!TYPE_KINDS.contains(node.kind())) {
            log.trace("No dedicated handling for {} at byte {} in {}", node.kind(), node.startByte(), path);
        }
        return new Generic(node.kind(), node.span(), cookAll(node.namedChildren(), reference(ctx)));
    }

    private static final Set<String> TYPE_KINDS =
            Set.of(TYPE_PARAMETER, "generic_type", "union_type", "splat_type", "constrained_type");

    // ===== Helpers =====

    private List<CookedNode> cookBlock(@Nullable ConcreteNode block, CookContext ctx) {
        if (block == null) {
            return List.of();
        }
        if (!BLOCK.equals(block.kind())) {
            return List.of(cook(block, reference(ctx)));
        }
        return cookStatements(block.namedChildren(), ctx);
    }

    private List<CookedNode> cookStatements(List<? extends ConcreteNode> statements, CookContext ctx) {
        return cookAll(statements, reference(ctx));
    }

    private List<CookedNode> cookAll(List<? extends ConcreteNode> nodes, CookContext ctx) {
        var result = new ArrayList<CookedNode>(nodes.size());
        for (var node : nodes) {
            result.add(cook(node, ctx));
        }
        return result;
    }

    /** An expression list is spread into its elements; any other node yields a single element. */
    private List<CookedNode> cookFlattened(@Nullable ConcreteNode node, CookContext ctx) {
        if (node == null) {
            return List.of();
        }
        if (EXPRESSION_LIST.equals(node.kind())) {
            return cookAll(node.namedChildren(), ctx);
        }
        return List.of(cook(node, ctx));
    }

    private CookedNode cookOptional(@Nullable ConcreteNode node, CookContext ctx) {
        return node == null ? CookedNode.omitted() : cook(node, ctx);
    }

    private static CookContext reference(CookContext ctx) {
        return ctx.withMode(Classification.REFERENCE);
    }

    private ConcreteNode requireField(ConcreteNode node, String field) {
        var child = node.childByFieldName(field);
        if (child == null) {
            throw new InvariantViolationException(String.format(
                    "%s at byte %d in %s has no '%s' child", node.kind(), node.startByte(), path, field));
        }
        return child;
    }

    private static ConcreteNode unwrapType(ConcreteNode node) {
        if (TYPE.equals(node.kind())) {
            var children = node.namedChildren();
            if (children.size() == 1) {
                return children.get(0);
            }
        }
        return node;
    }

    private static @Nullable ConcreteNode firstNamed(ConcreteNode node) {
        for (var child : node.children()) {
            if (child.isNamed()) {
                return child;
            }
        }
        return null;
    }

    private static @Nullable ConcreteNode findChild(ConcreteNode node, String kind) {
        for (var child : node.children()) {
            if (kind.equals(child.kind())) {
                return child;
            }
        }
        return null;
    }
}
