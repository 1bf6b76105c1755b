package logiceval.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * Constant folding and identity simplification, one instruction at a time.
 * <p>
 * The result has the same length and order as the input; only right-hand sides change.
 * There is no look across lines, no dead code removal and a single pass, so a chain such as
 * {@code t1 = NOT 1; t2 = AND t1 A} keeps its second line. {@code IMPLIES} is never folded,
 * and neither {@code X xor 1} nor {@code X xor X} is rewritten.
 */
public class PeepholeOptimizer implements Instruction.Visitor<Instruction> {

    public List<Instruction> optimize(List<Instruction> block) {
        List<Instruction> optimized = new ArrayList<>(block.size());
        for (Instruction instr : block) {
            optimized.add(instr.accept(this));
        }
        return optimized;
    }

    @Override
    public Instruction visitCopy(Instruction.Copy instr) {
        return instr;
    }

    @Override
    public Instruction visitCommand(Instruction.Command instr) {
        return instr;
    }

    @Override
    public Instruction visitCompute(Instruction.Compute instr) {
        Operand res = instr.getTarget();
        Operand arg1 = instr.getArg(0);
        switch (instr.getOpcode()) {
            case NOT:
                if (arg1.isLiteral()) {
                    return copy(res, Operand.literal(arg1.literalValue() == 0));
                }
                return instr;
            case AND: {
                Operand arg2 = instr.getArg(1);
                if (arg1.isLiteral(0) || arg2.isLiteral(0)) {
                    return copy(res, Operand.ZERO);
                }
                if (arg1.isLiteral(1) && arg2.isLiteral(1)) {
                    return copy(res, Operand.ONE);
                }
                if (arg1.isLiteral(1)) {
                    return copy(res, arg2);
                }
                if (arg2.isLiteral(1)) {
                    return copy(res, arg1);
                }
                return instr;
            }
            case OR: {
                Operand arg2 = instr.getArg(1);
                if (arg1.isLiteral(1) || arg2.isLiteral(1)) {
                    return copy(res, Operand.ONE);
                }
                if (arg1.isLiteral(0) && arg2.isLiteral(0)) {
                    return copy(res, Operand.ZERO);
                }
                if (arg1.isLiteral(0)) {
                    return copy(res, arg2);
                }
                if (arg2.isLiteral(0)) {
                    return copy(res, arg1);
                }
                return instr;
            }
            case XOR: {
                Operand arg2 = instr.getArg(1);
                if (arg1.isLiteral() && arg2.isLiteral()) {
                    return copy(res, Operand.literal(arg1.literalValue() != arg2.literalValue()));
                }
                if (arg1.isLiteral(0)) {
                    return copy(res, arg2);
                }
                if (arg2.isLiteral(0)) {
                    return copy(res, arg1);
                }
                return instr;
            }
            default:
                return instr;
        }
    }

    private static Instruction copy(Operand target, Operand value) {
        return new Instruction.Copy(target, value);
    }
}
