package logiceval.frontend.syntax;

import logiceval.frontend.grammar.LogicBaseVisitor;
import logiceval.frontend.grammar.LogicParser;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;

class StatementBuilder extends LogicBaseVisitor<Ast.Stmt> {
    private final ExpressionBuilder expressions = new ExpressionBuilder();

    Ast.Program buildProgram(LogicParser.ProgramContext ctx) {
        List<Ast.Stmt> statements = new ArrayList<>();
        for (var stmt : ctx.statement()) {
            statements.add(visit(stmt));
        }
        return new Ast.Program(statements);
    }

    @Override
    public Ast.Stmt visitStatement(LogicParser.StatementContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public Ast.Stmt visitExprStmt(LogicParser.ExprStmtContext ctx) {
        String name = ctx.name == null ? null : ctx.name.getText();
        return new Ast.ExprStmt(expressions.visit(ctx.expression()), name);
    }

    @Override
    public Ast.Stmt visitSetStmt(LogicParser.SetStmtContext ctx) {
        return new Ast.SetStmt(ctx.ID().getText(), "1".equals(ctx.BOOL().getText()));
    }

    @Override
    public Ast.Stmt visitTableStmt(LogicParser.TableStmtContext ctx) {
        return new Ast.TableStmt(ctx.ID() == null ? null : ctx.ID().getText());
    }

    @Override
    public Ast.Stmt visitEvalStmt(LogicParser.EvalStmtContext ctx) {
        return new Ast.EvalStmt();
    }

    @Override
    public Ast.Stmt visitRuleStmt(LogicParser.RuleStmtContext ctx) {
        return new Ast.RuleStmt(ctx.ID().getText(), expressions.visit(ctx.expression()));
    }

    @Override
    public Ast.Stmt visitInferStmt(LogicParser.InferStmtContext ctx) {
        List<String> names = new ArrayList<>();
        for (TerminalNode id : ctx.ID()) {
            names.add(id.getText());
        }
        return new Ast.InferStmt(names);
    }
}
