package logiceval.frontend.syntax;

import logiceval.frontend.grammar.LogicBaseVisitor;
import logiceval.frontend.grammar.LogicParser;
import org.antlr.v4.runtime.ParserRuleContext;

import java.util.List;

/**
 * Converts expression parse trees to {@link Ast.Expr}. Both spellings of exclusive-or
 * arrive as the single XOR token and become {@link Ast.BinaryOperator#XOR}.
 */
class ExpressionBuilder extends LogicBaseVisitor<Ast.Expr> {

    @Override
    public Ast.Expr visitExpression(LogicParser.ExpressionContext ctx) {
        return visit(ctx.implication());
    }

    @Override
    public Ast.Expr visitImplication(LogicParser.ImplicationContext ctx) {
        Ast.Expr left = visit(ctx.disjunction());
        if (ctx.implication() == null) {
            return left;
        }
        return new Ast.BinaryOp(left, Ast.BinaryOperator.IMPLIES, visit(ctx.implication()));
    }

    @Override
    public Ast.Expr visitDisjunction(LogicParser.DisjunctionContext ctx) {
        return foldLeft(ctx.exclusiveOr(), Ast.BinaryOperator.OR);
    }

    @Override
    public Ast.Expr visitExclusiveOr(LogicParser.ExclusiveOrContext ctx) {
        return foldLeft(ctx.conjunction(), Ast.BinaryOperator.XOR);
    }

    @Override
    public Ast.Expr visitConjunction(LogicParser.ConjunctionContext ctx) {
        return foldLeft(ctx.negation(), Ast.BinaryOperator.AND);
    }

    @Override
    public Ast.Expr visitNegation(LogicParser.NegationContext ctx) {
        if (ctx.NOT() != null) {
            return new Ast.UnaryOp(visit(ctx.negation()));
        }
        return visit(ctx.primary());
    }

    @Override
    public Ast.Expr visitPrimary(LogicParser.PrimaryContext ctx) {
        if (ctx.ID() != null) {
            return new Ast.Var(ctx.ID().getText());
        }
        if (ctx.BOOL() != null) {
            return new Ast.Literal("1".equals(ctx.BOOL().getText()));
        }
        return visit(ctx.expression());
    }

    private Ast.Expr foldLeft(List<? extends ParserRuleContext> operands, Ast.BinaryOperator op) {
        Ast.Expr result = visit(operands.get(0));
        for (int i = 1; i < operands.size(); i++) {
            result = new Ast.BinaryOp(result, op, visit(operands.get(i)));
        }
        return result;
    }
}
