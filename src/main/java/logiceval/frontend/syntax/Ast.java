package logiceval.frontend.syntax;

import java.util.List;

/**
 * Syntax tree of the logic language. Nodes are immutable and own their children.
 * Every consumer walks the tree through {@link StmtVisitor} and {@link ExprVisitor},
 * so adding a node kind breaks each visitor until it handles the new case.
 */
public final class Ast {

    private Ast() {
    }

    public interface StmtVisitor<R> {
        R visitExprStmt(ExprStmt stmt);

        R visitSetStmt(SetStmt stmt);

        R visitTableStmt(TableStmt stmt);

        R visitEvalStmt(EvalStmt stmt);

        R visitRuleStmt(RuleStmt stmt);

        R visitInferStmt(InferStmt stmt);
    }

    public interface ExprVisitor<R> {
        R visitBinaryOp(BinaryOp expr);

        R visitUnaryOp(UnaryOp expr);

        R visitLiteral(Literal expr);

        R visitVar(Var expr);
    }

    // Program -> {Stmt}
    public static final class Program {
        private final List<Stmt> statements;

        public Program(List<Stmt> statements) {
            this.statements = List.copyOf(statements);
        }

        public List<Stmt> getStatements() {
            return statements;
        }
    }

    public interface Stmt {
        <R> R accept(StmtVisitor<R> visitor);
    }

    public interface Expr {
        <R> R accept(ExprVisitor<R> visitor);
    }

    // ExprStmt -> 'expr' [Ident] Expr ';'
    public static final class ExprStmt implements Stmt {
        private final Expr expr;
        private final String name;

        public ExprStmt(Expr expr, String name) {
            assert expr != null;
            this.expr = expr;
            this.name = name;
        }

        public Expr getExpr() {
            return expr;
        }

        // null when the expression is anonymous
        public String getName() {
            return name;
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitExprStmt(this);
        }
    }

    // SetStmt -> 'set' Ident '=' Bool ';'
    public static final class SetStmt implements Stmt {
        private final String name;
        private final boolean value;

        public SetStmt(String name, boolean value) {
            assert name != null;
            this.name = name;
            this.value = value;
        }

        public String getName() {
            return name;
        }

        public boolean getValue() {
            return value;
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitSetStmt(this);
        }
    }

    // TableStmt -> 'table' [Ident] ';'
    public static final class TableStmt implements Stmt {
        private final String targetId;

        public TableStmt(String targetId) {
            this.targetId = targetId;
        }

        // null means the last evaluated expression
        public String getTargetId() {
            return targetId;
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitTableStmt(this);
        }
    }

    // EvalStmt -> 'eval' ';'
    public static final class EvalStmt implements Stmt {
        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitEvalStmt(this);
        }
    }

    // RuleStmt -> Ident ':' Expr ';'
    public static final class RuleStmt implements Stmt {
        private final String name;
        private final Expr expr;

        public RuleStmt(String name, Expr expr) {
            assert name != null;
            assert expr != null;
            this.name = name;
            this.expr = expr;
        }

        public String getName() {
            return name;
        }

        public Expr getExpr() {
            return expr;
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitRuleStmt(this);
        }
    }

    // InferStmt -> 'infer' Ident {',' Ident} ';'
    public static final class InferStmt implements Stmt {
        private final List<String> ruleNames;

        public InferStmt(List<String> ruleNames) {
            assert !ruleNames.isEmpty();
            this.ruleNames = List.copyOf(ruleNames);
        }

        public List<String> getRuleNames() {
            return ruleNames;
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitInferStmt(this);
        }
    }

    public enum BinaryOperator {
        AND,
        OR,
        XOR,
        IMPLIES
    }

    public static final class BinaryOp implements Expr {
        private final Expr left;
        private final BinaryOperator op;
        private final Expr right;

        public BinaryOp(Expr left, BinaryOperator op, Expr right) {
            assert left != null;
            assert op != null;
            assert right != null;
            this.left = left;
            this.op = op;
            this.right = right;
        }

        public Expr getLeft() {
            return left;
        }

        public BinaryOperator getOp() {
            return op;
        }

        public Expr getRight() {
            return right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryOp(this);
        }
    }

    // The only unary operator is NOT.
    public static final class UnaryOp implements Expr {
        private final Expr operand;

        public UnaryOp(Expr operand) {
            assert operand != null;
            this.operand = operand;
        }

        public Expr getOperand() {
            return operand;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryOp(this);
        }
    }

    public static final class Literal implements Expr {
        private final boolean value;

        public Literal(boolean value) {
            this.value = value;
        }

        public boolean getValue() {
            return value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    public static final class Var implements Expr {
        private final String name;

        public Var(String name) {
            assert name != null;
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVar(this);
        }
    }
}
