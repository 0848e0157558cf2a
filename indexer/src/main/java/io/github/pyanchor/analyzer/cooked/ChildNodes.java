package io.github.pyanchor.analyzer.cooked;

import io.github.pyanchor.analyzer.cooked.CookedNode.*;
import java.util.ArrayList;
import java.util.List;

/** Lists the direct children of a cooked node in source order. */
public final class ChildNodes implements CookedNode.Visitor<List<CookedNode>> {
    private static final ChildNodes INSTANCE = new ChildNodes();

    private ChildNodes() {}

    public static List<CookedNode> of(CookedNode node) {
        return node.accept(INSTANCE);
    }

    private static List<CookedNode> concat(Object... parts) {
        var result = new ArrayList<CookedNode>();
        for (var part : parts) {
            if (part instanceof CookedNode node) {
                result.add(node);
            } else if (part instanceof List<?> list) {
                for (var item : list) {
                    result.add((CookedNode) item);
                }
            } else {
                throw new IllegalArgumentException("Not a node or node list: " + part);
            }
        }
        return result;
    }

    @Override
    public List<CookedNode> visitModuleRoot(ModuleRoot node) {
        return node.body();
    }

    @Override
    public List<CookedNode> visitClassDef(ClassDef node) {
        return concat(node.name(), node.typeParameters(), node.bases(), node.body());
    }

    @Override
    public List<CookedNode> visitFunctionDef(FunctionDef node) {
        return concat(node.name(), node.typeParameters(), node.parameters(), node.returnType(), node.body());
    }

    @Override
    public List<CookedNode> visitLambda(Lambda node) {
        return concat(node.parameters(), node.body());
    }

    @Override
    public List<CookedNode> visitComprehension(Comprehension node) {
        return concat(node.element(), node.clauses());
    }

    @Override
    public List<CookedNode> visitComprehensionFor(ComprehensionFor node) {
        return concat(node.target(), node.iterables());
    }

    @Override
    public List<CookedNode> visitComprehensionIf(ComprehensionIf node) {
        return List.of(node.condition());
    }

    @Override
    public List<CookedNode> visitParameter(Parameter node) {
        return List.of(node.target(), node.annotation(), node.defaultValue());
    }

    @Override
    public List<CookedNode> visitExpressionStatement(ExpressionStatement node) {
        return node.expressions();
    }

    @Override
    public List<CookedNode> visitAssignment(Assignment node) {
        return concat(node.targets(), node.value());
    }

    @Override
    public List<CookedNode> visitAnnotatedAssignment(AnnotatedAssignment node) {
        return List.of(node.target(), node.annotation(), node.value());
    }

    @Override
    public List<CookedNode> visitAugmentedAssignment(AugmentedAssignment node) {
        return List.of(node.target(), node.value());
    }

    @Override
    public List<CookedNode> visitReturn(Return node) {
        return List.of(node.value());
    }

    @Override
    public List<CookedNode> visitDelete(Delete node) {
        return node.targets();
    }

    @Override
    public List<CookedNode> visitRaise(Raise node) {
        return List.of(node.exception(), node.cause());
    }

    @Override
    public List<CookedNode> visitPass(Pass node) {
        return List.of();
    }

    @Override
    public List<CookedNode> visitBreak(Break node) {
        return List.of();
    }

    @Override
    public List<CookedNode> visitContinue(Continue node) {
        return List.of();
    }

    @Override
    public List<CookedNode> visitAssert(Assert node) {
        return node.expressions();
    }

    @Override
    public List<CookedNode> visitGlobal(Global node) {
        return concat(node.names());
    }

    @Override
    public List<CookedNode> visitNonlocal(Nonlocal node) {
        return concat(node.names());
    }

    @Override
    public List<CookedNode> visitPrint(Print node) {
        return concat(node.destination(), node.arguments());
    }

    @Override
    public List<CookedNode> visitExec(Exec node) {
        return concat(node.code(), node.namespaces());
    }

    @Override
    public List<CookedNode> visitTypeAlias(TypeAlias node) {
        return List.of(node.name(), node.value());
    }

    @Override
    public List<CookedNode> visitIf(If node) {
        return concat(node.condition(), node.body(), node.alternatives());
    }

    @Override
    public List<CookedNode> visitElifClause(ElifClause node) {
        return concat(node.condition(), node.body());
    }

    @Override
    public List<CookedNode> visitElseClause(ElseClause node) {
        return node.body();
    }

    @Override
    public List<CookedNode> visitFor(For node) {
        return concat(node.target(), node.iterable(), node.body(), node.orElse());
    }

    @Override
    public List<CookedNode> visitWhile(While node) {
        return concat(node.condition(), node.body(), node.orElse());
    }

    @Override
    public List<CookedNode> visitTry(Try node) {
        return concat(node.body(), node.handlers(), node.orElse(), node.finallyClause());
    }

    @Override
    public List<CookedNode> visitExceptHandler(ExceptHandler node) {
        return concat(node.type(), node.target(), node.body());
    }

    @Override
    public List<CookedNode> visitFinallyClause(FinallyClause node) {
        return node.body();
    }

    @Override
    public List<CookedNode> visitWith(With node) {
        return concat(node.items(), node.body());
    }

    @Override
    public List<CookedNode> visitWithItem(WithItem node) {
        return List.of(node.context(), node.target());
    }

    @Override
    public List<CookedNode> visitMatch(Match node) {
        return concat(node.subjects(), node.cases());
    }

    @Override
    public List<CookedNode> visitCaseClause(CaseClause node) {
        return concat(node.patterns(), node.guard(), node.body());
    }

    @Override
    public List<CookedNode> visitCasePattern(CasePattern node) {
        return node.parts();
    }

    @Override
    public List<CookedNode> visitImport(Import node) {
        return concat(node.modules());
    }

    @Override
    public List<CookedNode> visitImportedModule(ImportedModule node) {
        return concat(node.path(), node.alias());
    }

    @Override
    public List<CookedNode> visitImportFrom(ImportFrom node) {
        return concat(node.module(), node.names());
    }

    @Override
    public List<CookedNode> visitImportedName(ImportedName node) {
        return List.of(node.name(), node.alias());
    }

    @Override
    public List<CookedNode> visitWildcardImport(WildcardImport node) {
        return List.of();
    }

    @Override
    public List<CookedNode> visitDecorated(Decorated node) {
        return concat(node.decorators(), node.definition());
    }

    @Override
    public List<CookedNode> visitDecorator(Decorator node) {
        return List.of(node.expression());
    }

    @Override
    public List<CookedNode> visitNameOccurrence(NameOccurrence node) {
        return List.of();
    }

    @Override
    public List<CookedNode> visitAttribute(Attribute node) {
        return List.of(node.object(), node.member());
    }

    @Override
    public List<CookedNode> visitSubscript(Subscript node) {
        return concat(node.value(), node.indices());
    }

    @Override
    public List<CookedNode> visitSlice(Slice node) {
        return List.of(node.lower(), node.upper(), node.step());
    }

    @Override
    public List<CookedNode> visitCall(Call node) {
        return concat(node.function(), node.arguments());
    }

    @Override
    public List<CookedNode> visitKeywordArgument(KeywordArgument node) {
        return List.of(node.value());
    }

    @Override
    public List<CookedNode> visitStarred(Starred node) {
        return List.of(node.value());
    }

    @Override
    public List<CookedNode> visitDoubleStarred(DoubleStarred node) {
        return List.of(node.value());
    }

    @Override
    public List<CookedNode> visitBinaryOperation(BinaryOperation node) {
        return List.of(node.left(), node.right());
    }

    @Override
    public List<CookedNode> visitBooleanOperation(BooleanOperation node) {
        return List.of(node.left(), node.right());
    }

    @Override
    public List<CookedNode> visitUnaryOperation(UnaryOperation node) {
        return List.of(node.operand());
    }

    @Override
    public List<CookedNode> visitComparison(Comparison node) {
        return node.operands();
    }

    @Override
    public List<CookedNode> visitConditionalExpression(ConditionalExpression node) {
        return List.of(node.body(), node.condition(), node.orElse());
    }

    @Override
    public List<CookedNode> visitNamedExpression(NamedExpression node) {
        return List.of(node.target(), node.value());
    }

    @Override
    public List<CookedNode> visitAwait(Await node) {
        return List.of(node.value());
    }

    @Override
    public List<CookedNode> visitYield(Yield node) {
        return List.of(node.value());
    }

    @Override
    public List<CookedNode> visitTupleDisplay(TupleDisplay node) {
        return node.elements();
    }

    @Override
    public List<CookedNode> visitListDisplay(ListDisplay node) {
        return node.elements();
    }

    @Override
    public List<CookedNode> visitSetDisplay(SetDisplay node) {
        return node.elements();
    }

    @Override
    public List<CookedNode> visitDictDisplay(DictDisplay node) {
        return node.entries();
    }

    @Override
    public List<CookedNode> visitKeyValue(KeyValue node) {
        return List.of(node.key(), node.value());
    }

    @Override
    public List<CookedNode> visitStringLiteral(StringLiteral node) {
        return node.interpolations();
    }

    @Override
    public List<CookedNode> visitNumberLiteral(NumberLiteral node) {
        return List.of();
    }

    @Override
    public List<CookedNode> visitConstant(Constant node) {
        return List.of();
    }

    @Override
    public List<CookedNode> visitEllipsis(Ellipsis node) {
        return List.of();
    }

    @Override
    public List<CookedNode> visitOmitted(Omitted node) {
        return List.of();
    }

    @Override
    public List<CookedNode> visitGeneric(Generic node) {
        return node.children();
    }
}
