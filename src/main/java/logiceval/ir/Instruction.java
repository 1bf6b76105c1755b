package logiceval.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * One line of three-address code. Three shapes exist:
 * <pre>
 *   t1 = AND A B        compute
 *   foo = t1            copy
 *   TABLE foo           command (TABLE, EVAL, INFER)
 * </pre>
 * {@link #toString()} gives the printed form and {@link #parse(String)} reads it back.
 */
public abstract class Instruction {

    /**
     * Argument of a {@code TABLE} command asking for the last evaluated expression.
     */
    public static final String CURRENT_EXPRESSION = "LAST_EXPR";

    public interface Visitor<R> {
        R visitCompute(Compute instr);

        R visitCopy(Copy instr);

        R visitCommand(Command instr);
    }

    public enum CommandKind {
        TABLE,
        EVAL,
        INFER
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Instruction writing a value to a target: either a compute or a copy.
     */
    public abstract static class Assignment extends Instruction {
        private final Operand target;

        Assignment(Operand target) {
            if (target.isLiteral()) {
                throw new IllegalArgumentException("Cannot assign to literal " + target);
            }
            this.target = target;
        }

        public Operand getTarget() {
            return target;
        }

        // right-hand side operands, in order
        public abstract List<Operand> getOperands();
    }

    public static final class Compute extends Assignment {
        private final Opcode opcode;
        private final List<Operand> args;

        public Compute(Operand target, Opcode opcode, Operand... args) {
            super(target);
            if (args.length != opcode.getArity()) {
                throw new IllegalArgumentException(opcode + " takes " + opcode.getArity() + " operand(s)");
            }
            this.opcode = opcode;
            this.args = List.of(args);
        }

        public Opcode getOpcode() {
            return opcode;
        }

        public Operand getArg(int i) {
            return args.get(i);
        }

        @Override
        public List<Operand> getOperands() {
            return args;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCompute(this);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(getTarget()).append(" = ").append(opcode);
            for (Operand arg : args) {
                sb.append(' ').append(arg);
            }
            return sb.toString();
        }
    }

    public static final class Copy extends Assignment {
        private final Operand value;

        public Copy(Operand target, Operand value) {
            super(target);
            this.value = value;
        }

        public Operand getValue() {
            return value;
        }

        @Override
        public List<Operand> getOperands() {
            return List.of(value);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCopy(this);
        }

        @Override
        public String toString() {
            return getTarget() + " = " + value;
        }
    }

    public static final class Command extends Instruction {
        private final CommandKind kind;
        private final List<String> args;

        public Command(CommandKind kind, List<String> args) {
            this.kind = kind;
            this.args = List.copyOf(args);
        }

        public CommandKind getKind() {
            return kind;
        }

        public List<String> getArgs() {
            return args;
        }

        public boolean is(CommandKind other) {
            return kind == other;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCommand(this);
        }

        @Override
        public String toString() {
            if (args.isEmpty()) {
                return kind.name();
            }
            return kind + " " + String.join(" ", args);
        }
    }

    public static Instruction parse(String line) {
        String[] parts = line.trim().split("\\s+");
        for (CommandKind kind : CommandKind.values()) {
            if (kind.name().equals(parts[0])) {
                List<String> args = new ArrayList<>(List.of(parts).subList(1, parts.length));
                return new Command(kind, args);
            }
        }
        if (parts.length < 3 || !"=".equals(parts[1])) {
            throw new IllegalArgumentException("Malformed instruction: " + line);
        }
        Operand target = Operand.parse(parts[0]);
        if (parts.length == 3) {
            return new Copy(target, Operand.parse(parts[2]));
        }
        if (!Opcode.isOpcode(parts[2])) {
            throw new IllegalArgumentException("Unknown opcode in: " + line);
        }
        Operand[] args = new Operand[parts.length - 3];
        for (int i = 3; i < parts.length; i++) {
            args[i - 3] = Operand.parse(parts[i]);
        }
        return new Compute(target, Opcode.valueOf(parts[2]), args);
    }

    public static List<Instruction> parseAll(String... lines) {
        List<Instruction> block = new ArrayList<>();
        for (String line : lines) {
            block.add(parse(line));
        }
        return block;
    }
}
