package logiceval.frontend.semantic;

import logiceval.exception.SemanticException;
import logiceval.frontend.syntax.Ast;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Single pass over a program that tracks set variables and defined rules.
 * <p>
 * A rule name may be defined once per checker. {@code infer} may only name rules defined
 * earlier in the same walk. Variables are never checked: a variable that was never set
 * evaluates to 0. The tree is not modified.
 */
public class SemanticChecker implements Ast.StmtVisitor<Void>, Ast.ExprVisitor<Void> {
    private final Set<String> declaredVariables = new LinkedHashSet<>();
    private final Set<String> definedRules = new LinkedHashSet<>();

    public void check(Ast.Program program) {
        for (Ast.Stmt stmt : program.getStatements()) {
            stmt.accept(this);
        }
    }

    public Set<String> getDeclaredVariables() {
        return Collections.unmodifiableSet(declaredVariables);
    }

    public Set<String> getDefinedRules() {
        return Collections.unmodifiableSet(definedRules);
    }

    @Override
    public Void visitExprStmt(Ast.ExprStmt stmt) {
        return stmt.getExpr().accept(this);
    }

    @Override
    public Void visitSetStmt(Ast.SetStmt stmt) {
        declaredVariables.add(stmt.getName());
        return null;
    }

    // the target is resolved when the table is built
    @Override
    public Void visitTableStmt(Ast.TableStmt stmt) {
        return null;
    }

    @Override
    public Void visitEvalStmt(Ast.EvalStmt stmt) {
        return null;
    }

    @Override
    public Void visitRuleStmt(Ast.RuleStmt stmt) {
        if (!definedRules.add(stmt.getName())) {
            throw new SemanticException("Rule '" + stmt.getName() + "' already defined.");
        }
        return stmt.getExpr().accept(this);
    }

    @Override
    public Void visitInferStmt(Ast.InferStmt stmt) {
        for (String name : stmt.getRuleNames()) {
            if (!definedRules.contains(name)) {
                throw new SemanticException("Inference on undefined rule '" + name + "'.");
            }
        }
        return null;
    }

    @Override
    public Void visitBinaryOp(Ast.BinaryOp expr) {
        expr.getLeft().accept(this);
        return expr.getRight().accept(this);
    }

    @Override
    public Void visitUnaryOp(Ast.UnaryOp expr) {
        return expr.getOperand().accept(this);
    }

    @Override
    public Void visitLiteral(Ast.Literal expr) {
        return null;
    }

    @Override
    public Void visitVar(Ast.Var expr) {
        return null;
    }
}
