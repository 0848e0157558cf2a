package io.github.pyanchor.analyzer.cooked;

import io.github.pyanchor.analyzer.Span;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.pcollections.OrderedPSet;

/**
 * The normalized syntax tree produced by the cooker.
 *
 * <p>Every variant is an immutable record. Scope-introducing variants ({@link ModuleRoot}, {@link ClassDef},
 * {@link FunctionDef}, {@link Lambda}, {@link Comprehension}) carry the insertion-ordered set of names bound
 * directly in that scope, fixed when the scope finishes cooking. Absent optional children are {@link Omitted}.
 *
 * <p>Operations over the tree implement {@link Visitor}, which lists every variant, so adding a variant breaks every
 * operation that does not handle it.
 */
public sealed interface CookedNode {

    <R> R accept(Visitor<R> visitor);

    static Omitted omitted() {
        return Omitted.INSTANCE;
    }

    static boolean isOmitted(CookedNode node) {
        return node instanceof Omitted;
    }

    // ===== Scopes =====

    /** Root of one source file. */
    record ModuleRoot(String path, List<CookedNode> body, OrderedPSet<String> bindings) implements CookedNode {
        public ModuleRoot {
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitModuleRoot(this);
        }
    }

    record ClassDef(
            NameOccurrence name,
            CookedNode typeParameters,
            List<CookedNode> bases,
            List<CookedNode> body,
            OrderedPSet<String> bindings)
            implements CookedNode {
        public ClassDef {
            bases = List.copyOf(bases);
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitClassDef(this);
        }
    }

    record FunctionDef(
            NameOccurrence name,
            boolean async,
            CookedNode typeParameters,
            List<Parameter> parameters,
            CookedNode returnType,
            List<CookedNode> body,
            OrderedPSet<String> bindings)
            implements CookedNode {
        public FunctionDef {
            parameters = List.copyOf(parameters);
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionDef(this);
        }
    }

    /** An anonymous function; {@code keyword} locates the {@code lambda} token. */
    record Lambda(Span keyword, List<Parameter> parameters, CookedNode body, OrderedPSet<String> bindings)
            implements CookedNode {
        public Lambda {
            parameters = List.copyOf(parameters);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLambda(this);
        }
    }

    /**
     * A list/set/dict comprehension or generator expression. {@code clauses} holds {@link ComprehensionFor} and
     * {@link ComprehensionIf} nodes in source order; the first is always a {@code for}. {@code bindings} is empty when
     * the names were registered in the enclosing scope instead.
     */
    record Comprehension(
            ComprehensionKind kind,
            Span forKeyword,
            CookedNode element,
            List<CookedNode> clauses,
            OrderedPSet<String> bindings)
            implements CookedNode {
        public Comprehension {
            clauses = List.copyOf(clauses);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitComprehension(this);
        }
    }

    record ComprehensionFor(CookedNode target, List<CookedNode> iterables, boolean async) implements CookedNode {
        public ComprehensionFor {
            iterables = List.copyOf(iterables);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitComprehensionFor(this);
        }
    }

    record ComprehensionIf(CookedNode condition) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitComprehensionIf(this);
        }
    }

    /**
     * One formal parameter. {@code target} is normally a name, or a tuple pattern for legacy sublist parameters;
     * annotation and default are evaluated in the enclosing scope.
     */
    record Parameter(CookedNode target, ParameterKind kind, CookedNode annotation, CookedNode defaultValue)
            implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitParameter(this);
        }
    }

    // ===== Simple statements =====

    record ExpressionStatement(List<CookedNode> expressions) implements CookedNode {
        public ExpressionStatement {
            expressions = List.copyOf(expressions);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExpressionStatement(this);
        }
    }

    /** {@code t1 = t2 = value}; targets in source order. */
    record Assignment(List<CookedNode> targets, CookedNode value) implements CookedNode {
        public Assignment {
            targets = List.copyOf(targets);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssignment(this);
        }
    }

    /** {@code target: annotation [= value]} */
    record AnnotatedAssignment(CookedNode target, CookedNode annotation, CookedNode value) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAnnotatedAssignment(this);
        }
    }

    record AugmentedAssignment(CookedNode target, Span operator, CookedNode value) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAugmentedAssignment(this);
        }
    }

    record Return(CookedNode value) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturn(this);
        }
    }

    record Delete(List<CookedNode> targets) implements CookedNode {
        public Delete {
            targets = List.copyOf(targets);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDelete(this);
        }
    }

    record Raise(CookedNode exception, CookedNode cause) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRaise(this);
        }
    }

    record Pass(Span span) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPass(this);
        }
    }

    record Break(Span span) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBreak(this);
        }
    }

    record Continue(Span span) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitContinue(this);
        }
    }

    record Assert(List<CookedNode> expressions) implements CookedNode {
        public Assert {
            expressions = List.copyOf(expressions);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssert(this);
        }
    }

    record Global(List<NameOccurrence> names) implements CookedNode {
        public Global {
            names = List.copyOf(names);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGlobal(this);
        }
    }

    record Nonlocal(List<NameOccurrence> names) implements CookedNode {
        public Nonlocal {
            names = List.copyOf(names);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNonlocal(this);
        }
    }

    /** Legacy {@code print [>> destination,] args}. */
    record Print(CookedNode destination, List<CookedNode> arguments) implements CookedNode {
        public Print {
            arguments = List.copyOf(arguments);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPrint(this);
        }
    }

    /** Legacy {@code exec code [in globals[, locals]]}. */
    record Exec(CookedNode code, List<CookedNode> namespaces) implements CookedNode {
        public Exec {
            namespaces = List.copyOf(namespaces);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExec(this);
        }
    }

    /** {@code type Name[T] = value} */
    record TypeAlias(CookedNode name, CookedNode value) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTypeAlias(this);
        }
    }

    // ===== Compound statements =====

    /** {@code alternatives} holds {@link ElifClause}s followed by at most one {@link ElseClause}. */
    record If(CookedNode condition, List<CookedNode> body, List<CookedNode> alternatives) implements CookedNode {
        public If {
            body = List.copyOf(body);
            alternatives = List.copyOf(alternatives);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    record ElifClause(CookedNode condition, List<CookedNode> body) implements CookedNode {
        public ElifClause {
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitElifClause(this);
        }
    }

    record ElseClause(List<CookedNode> body) implements CookedNode {
        public ElseClause {
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitElseClause(this);
        }
    }

    record For(CookedNode target, CookedNode iterable, List<CookedNode> body, CookedNode orElse, boolean async)
            implements CookedNode {
        public For {
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFor(this);
        }
    }

    record While(CookedNode condition, List<CookedNode> body, CookedNode orElse) implements CookedNode {
        public While {
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWhile(this);
        }
    }

    record Try(List<CookedNode> body, List<ExceptHandler> handlers, CookedNode orElse, CookedNode finallyClause)
            implements CookedNode {
        public Try {
            body = List.copyOf(body);
            handlers = List.copyOf(handlers);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTry(this);
        }
    }

    /** {@code except [type [as target]]:} or, with {@code group}, {@code except*}. */
    record ExceptHandler(CookedNode type, CookedNode target, List<CookedNode> body, boolean group)
            implements CookedNode {
        public ExceptHandler {
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExceptHandler(this);
        }
    }

    record FinallyClause(List<CookedNode> body) implements CookedNode {
        public FinallyClause {
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFinallyClause(this);
        }
    }

    record With(List<WithItem> items, List<CookedNode> body, boolean async) implements CookedNode {
        public With {
            items = List.copyOf(items);
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWith(this);
        }
    }

    record WithItem(CookedNode context, CookedNode target) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWithItem(this);
        }
    }

    record Match(List<CookedNode> subjects, List<CaseClause> cases) implements CookedNode {
        public Match {
            subjects = List.copyOf(subjects);
            cases = List.copyOf(cases);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMatch(this);
        }
    }

    record CaseClause(List<CookedNode> patterns, CookedNode guard, List<CookedNode> body) implements CookedNode {
        public CaseClause {
            patterns = List.copyOf(patterns);
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCaseClause(this);
        }
    }

    /** A structural {@code case} pattern; capture names inside it are bindings. */
    record CasePattern(String kind, List<CookedNode> parts) implements CookedNode {
        public CasePattern {
            parts = List.copyOf(parts);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCasePattern(this);
        }
    }

    // ===== Imports and decorators =====

    record Import(List<ImportedModule> modules) implements CookedNode {
        public Import {
            modules = List.copyOf(modules);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitImport(this);
        }
    }

    /**
     * {@code import a.b.c [as alias]}. Without an alias the head segment is the binding; with one, every path segment
     * is raw.
     */
    record ImportedModule(List<NameOccurrence> path, CookedNode alias) implements CookedNode {
        public ImportedModule {
            path = List.copyOf(path);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitImportedModule(this);
        }
    }

    /** {@code from ..module import names}; {@code level} counts the leading dots. */
    record ImportFrom(int level, List<NameOccurrence> module, List<CookedNode> names) implements CookedNode {
        public ImportFrom {
            module = List.copyOf(module);
            names = List.copyOf(names);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitImportFrom(this);
        }
    }

    record ImportedName(NameOccurrence name, CookedNode alias) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitImportedName(this);
        }
    }

    record WildcardImport(Span star) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWildcardImport(this);
        }
    }

    /** A class or function definition with its decorators, which evaluate in the enclosing scope. */
    record Decorated(List<Decorator> decorators, CookedNode definition) implements CookedNode {
        public Decorated {
            decorators = List.copyOf(decorators);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDecorated(this);
        }
    }

    record Decorator(CookedNode expression) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDecorator(this);
        }
    }

    // ===== Expressions =====

    /**
     * A single identifier occurrence. {@code fqn} is null until resolution, and may stay null for raw occurrences and
     * degenerate references.
     */
    record NameOccurrence(Span span, Classification classification, @Nullable String fqn) implements CookedNode {
        public static NameOccurrence binding(Span span) {
            return new NameOccurrence(span, Classification.BINDING, null);
        }

        public static NameOccurrence reference(Span span) {
            return new NameOccurrence(span, Classification.REFERENCE, null);
        }

        public static NameOccurrence raw(Span span) {
            return new NameOccurrence(span, Classification.RAW, null);
        }

        public String name() {
            return span.text();
        }

        public boolean hasFqn() {
            return fqn != null && !fqn.isEmpty();
        }

        public NameOccurrence withFqn(@Nullable String newFqn) {
            return new NameOccurrence(span, classification, newFqn);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNameOccurrence(this);
        }
    }

    /**
     * {@code object.member}. The member is a raw occurrence because member lookup is not resolved here; {@code target}
     * records whether the attribute was being assigned.
     */
    record Attribute(CookedNode object, NameOccurrence member, boolean target) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAttribute(this);
        }
    }

    record Subscript(CookedNode value, List<CookedNode> indices) implements CookedNode {
        public Subscript {
            indices = List.copyOf(indices);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSubscript(this);
        }
    }

    record Slice(CookedNode lower, CookedNode upper, CookedNode step) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSlice(this);
        }
    }

    record Call(CookedNode function, List<CookedNode> arguments) implements CookedNode {
        public Call {
            arguments = List.copyOf(arguments);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }

    /** {@code keyword=value} in a call; the keyword names a callee parameter and is not resolved. */
    record KeywordArgument(Span keyword, CookedNode value) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitKeywordArgument(this);
        }
    }

    /** {@code *value}, as an argument or as an unpacking target. */
    record Starred(CookedNode value) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStarred(this);
        }
    }

    record DoubleStarred(CookedNode value) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDoubleStarred(this);
        }
    }

    record BinaryOperation(CookedNode left, Span operator, CookedNode right) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinaryOperation(this);
        }
    }

    record BooleanOperation(CookedNode left, Span operator, CookedNode right) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBooleanOperation(this);
        }
    }

    /** Prefix {@code +}, {@code -}, {@code ~} or {@code not}. */
    record UnaryOperation(Span operator, CookedNode operand) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnaryOperation(this);
        }
    }

    record Comparison(List<CookedNode> operands, List<Span> operators) implements CookedNode {
        public Comparison {
            operands = List.copyOf(operands);
            operators = List.copyOf(operators);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitComparison(this);
        }
    }

    /** {@code body if condition else orElse} */
    record ConditionalExpression(CookedNode body, CookedNode condition, CookedNode orElse) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConditionalExpression(this);
        }
    }

    /** {@code target := value} */
    record NamedExpression(NameOccurrence target, CookedNode value) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNamedExpression(this);
        }
    }

    record Await(CookedNode value) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAwait(this);
        }
    }

    record Yield(CookedNode value, boolean from) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitYield(this);
        }
    }

    record TupleDisplay(List<CookedNode> elements) implements CookedNode {
        public TupleDisplay {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTupleDisplay(this);
        }
    }

    record ListDisplay(List<CookedNode> elements) implements CookedNode {
        public ListDisplay {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitListDisplay(this);
        }
    }

    record SetDisplay(List<CookedNode> elements) implements CookedNode {
        public SetDisplay {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSetDisplay(this);
        }
    }

    /** Entries are {@link KeyValue} or {@link DoubleStarred}. */
    record DictDisplay(List<CookedNode> entries) implements CookedNode {
        public DictDisplay {
            entries = List.copyOf(entries);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDictDisplay(this);
        }
    }

    record KeyValue(CookedNode key, CookedNode value) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitKeyValue(this);
        }
    }

    /** A string or implicitly concatenated strings, with the expressions of any f-string interpolations. */
    record StringLiteral(Span span, List<CookedNode> interpolations) implements CookedNode {
        public StringLiteral {
            interpolations = List.copyOf(interpolations);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStringLiteral(this);
        }
    }

    record NumberLiteral(Span span) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumberLiteral(this);
        }
    }

    /** {@code True}, {@code False} or {@code None}. */
    record Constant(Span span) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConstant(this);
        }
    }

    record Ellipsis(Span span) implements CookedNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEllipsis(this);
        }
    }

    /** An optional child that is absent. */
    record Omitted() implements CookedNode {
        private static final Omitted INSTANCE = new Omitted();

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitOmitted(this);
        }
    }

    /**
     * A construct the cooker has no dedicated variant for, including parser error-recovery nodes. Its children are
     * cooked as references so that names inside still resolve.
     */
    record Generic(String kind, Span span, List<CookedNode> children) implements CookedNode {
        public Generic {
            children = List.copyOf(children);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGeneric(this);
        }
    }

    /** One method per variant. */
    interface Visitor<R> {
        R visitModuleRoot(ModuleRoot node);

        R visitClassDef(ClassDef node);

        R visitFunctionDef(FunctionDef node);

        R visitLambda(Lambda node);

        R visitComprehension(Comprehension node);

        R visitComprehensionFor(ComprehensionFor node);

        R visitComprehensionIf(ComprehensionIf node);

        R visitParameter(Parameter node);

        R visitExpressionStatement(ExpressionStatement node);

        R visitAssignment(Assignment node);

        R visitAnnotatedAssignment(AnnotatedAssignment node);

        R visitAugmentedAssignment(AugmentedAssignment node);

        R visitReturn(Return node);

        R visitDelete(Delete node);

        R visitRaise(Raise node);

        R visitPass(Pass node);

        R visitBreak(Break node);

        R visitContinue(Continue node);

        R visitAssert(Assert node);

        R visitGlobal(Global node);

        R visitNonlocal(Nonlocal node);

        R visitPrint(Print node);

        R visitExec(Exec node);

        R visitTypeAlias(TypeAlias node);

        R visitIf(If node);

        R visitElifClause(ElifClause node);

        R visitElseClause(ElseClause node);

        R visitFor(For node);

        R visitWhile(While node);

        R visitTry(Try node);

        R visitExceptHandler(ExceptHandler node);

        R visitFinallyClause(FinallyClause node);

        R visitWith(With node);

        R visitWithItem(WithItem node);

        R visitMatch(Match node);

        R visitCaseClause(CaseClause node);

        R visitCasePattern(CasePattern node);

        R visitImport(Import node);

        R visitImportedModule(ImportedModule node);

        R visitImportFrom(ImportFrom node);

        R visitImportedName(ImportedName node);

        R visitWildcardImport(WildcardImport node);

        R visitDecorated(Decorated node);

        R visitDecorator(Decorator node);

        R visitNameOccurrence(NameOccurrence node);

        R visitAttribute(Attribute node);

        R visitSubscript(Subscript node);

        R visitSlice(Slice node);

        R visitCall(Call node);

        R visitKeywordArgument(KeywordArgument node);

        R visitStarred(Starred node);

        R visitDoubleStarred(DoubleStarred node);

        R visitBinaryOperation(BinaryOperation node);

        R visitBooleanOperation(BooleanOperation node);

        R visitUnaryOperation(UnaryOperation node);

        R visitComparison(Comparison node);

        R visitConditionalExpression(ConditionalExpression node);

        R visitNamedExpression(NamedExpression node);

        R visitAwait(Await node);

        R visitYield(Yield node);

        R visitTupleDisplay(TupleDisplay node);

        R visitListDisplay(ListDisplay node);

        R visitSetDisplay(SetDisplay node);

        R visitDictDisplay(DictDisplay node);

        R visitKeyValue(KeyValue node);

        R visitStringLiteral(StringLiteral node);

        R visitNumberLiteral(NumberLiteral node);

        R visitConstant(Constant node);

        R visitEllipsis(Ellipsis node);

        R visitOmitted(Omitted node);

        R visitGeneric(Generic node);
    }
}
