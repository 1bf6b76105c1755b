package logiceval.ir;

import logiceval.frontend.syntax.Ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers one statement at a time to three-address code. Temporaries are numbered from
 * {@code t1} again for every statement, so they are only unique within one block.
 */
public class IRGenerator implements Ast.StmtVisitor<Void>, Ast.ExprVisitor<Operand> {
    private List<Instruction> instructions = new ArrayList<>();
    private int tempCounter = 0;

    private Operand newTemp() {
        return Operand.temp(++tempCounter);
    }

    public List<Instruction> generate(Ast.Stmt stmt) {
        instructions = new ArrayList<>();
        tempCounter = 0;
        stmt.accept(this);
        return instructions;
    }

    @Override
    public Void visitExprStmt(Ast.ExprStmt stmt) {
        Operand result = stmt.getExpr().accept(this);
        if (stmt.getName() != null) {
            instructions.add(new Instruction.Copy(Operand.name(stmt.getName()), result));
        }
        if (instructions.isEmpty()) {
            instructions.add(new Instruction.Copy(Operand.NO_OP_RESULT, result));
        }
        return null;
    }

    @Override
    public Void visitSetStmt(Ast.SetStmt stmt) {
        instructions.add(new Instruction.Copy(Operand.name(stmt.getName()), Operand.literal(stmt.getValue())));
        return null;
    }

    @Override
    public Void visitTableStmt(Ast.TableStmt stmt) {
        String target = stmt.getTargetId() != null ? stmt.getTargetId() : Instruction.CURRENT_EXPRESSION;
        instructions.add(new Instruction.Command(Instruction.CommandKind.TABLE, List.of(target)));
        return null;
    }

    @Override
    public Void visitEvalStmt(Ast.EvalStmt stmt) {
        instructions.add(new Instruction.Command(Instruction.CommandKind.EVAL, List.of()));
        return null;
    }

    // same shape as a named expression
    @Override
    public Void visitRuleStmt(Ast.RuleStmt stmt) {
        Operand result = stmt.getExpr().accept(this);
        instructions.add(new Instruction.Copy(Operand.name(stmt.getName()), result));
        return null;
    }

    @Override
    public Void visitInferStmt(Ast.InferStmt stmt) {
        instructions.add(new Instruction.Command(Instruction.CommandKind.INFER, stmt.getRuleNames()));
        return null;
    }

    @Override
    public Operand visitBinaryOp(Ast.BinaryOp expr) {
        Operand left = expr.getLeft().accept(this);
        Operand right = expr.getRight().accept(this);
        Operand tmp = newTemp();
        instructions.add(new Instruction.Compute(tmp, opcodeOf(expr.getOp()), left, right));
        return tmp;
    }

    @Override
    public Operand visitUnaryOp(Ast.UnaryOp expr) {
        Operand val = expr.getOperand().accept(this);
        Operand tmp = newTemp();
        instructions.add(new Instruction.Compute(tmp, Opcode.NOT, val));
        return tmp;
    }

    @Override
    public Operand visitLiteral(Ast.Literal expr) {
        return Operand.literal(expr.getValue());
    }

    @Override
    public Operand visitVar(Ast.Var expr) {
        return Operand.name(expr.getName());
    }

    private static Opcode opcodeOf(Ast.BinaryOperator op) {
        switch (op) {
            case AND:
                return Opcode.AND;
            case OR:
                return Opcode.OR;
            case XOR:
                return Opcode.XOR;
            case IMPLIES:
                return Opcode.IMPLIES;
            default:
                throw new IllegalArgumentException("Unknown operator: " + op);
        }
    }
}
