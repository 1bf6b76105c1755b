package logiceval.exec;

import logiceval.exception.InterpreterException;
import logiceval.ir.Instruction;
import logiceval.ir.Opcode;
import logiceval.ir.Operand;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/*
    Interpreter - executes the blocks produced by the IRGenerator, one statement per block.
    Supported instructions:
    - <dest> = AND|OR|XOR|IMPLIES <a> <b>
    - <dest> = NOT <a>
    - <dest> = <value>
    - TABLE <id>|LAST_EXPR
    - EVAL
    - INFER <rule> [<rule> ...]
    Storage model:
    - variables: every variable or rule ever assigned, kept for the whole session.
    - Temporaries live in a map local to one run of one block.
    - lastIr: the last block that did real logic work; EVAL and TABLE without a target use it.
    - savedCode: the block of every named expression or rule, by name, for TABLE <id>.
    - Operands that were never assigned read as 0.
*/
public class Interpreter {
    // 2^n rows must fit a long row counter.
    static final int MAX_TABLE_VARIABLES = 62;

    private final Map<String, Integer> variables = new LinkedHashMap<>();
    private final Map<String, List<Instruction>> savedCode = new HashMap<>();
    private List<Instruction> lastIr;
    private final PrintStream out;

    public Interpreter() {
        this(System.out);
    }

    public Interpreter(PrintStream out) {
        this.out = out;
    }

    public void execute(List<Instruction> block) {
        cacheIfMeaningful(block);

        for (Instruction instr : block) {
            if (isCommand(instr, Instruction.CommandKind.TABLE)) {
                handleTable(block, (Instruction.Command) instr);
                return;
            }
            if (isCommand(instr, Instruction.CommandKind.EVAL)) {
                handleEval();
                return;
            }
        }

        run(block, Collections.emptyMap());

        for (Instruction instr : block) {
            if (isCommand(instr, Instruction.CommandKind.INFER)) {
                handleInfer((Instruction.Command) instr);
                return;
            }
        }
    }

    /**
     * Runs the assignments of a block and returns the last value written, or 0 if none was.
     * <p>
     * Values start from a copy of the session variables with {@code overrides} laid on top.
     * Writes to temporaries stay local; writes to names go through to the session variables
     * even when overrides are given. Table generation calls this once per row, so after a
     * table the session holds whatever the last row assigned. That write-through makes the
     * interpreter unsafe to share between threads.
     */
    public int run(List<Instruction> block, Map<String, Integer> overrides) {
        Map<String, Integer> context = new HashMap<>(variables);
        context.putAll(overrides);
        Map<String, Integer> temps = new HashMap<>();
        int lastResult = 0;

        for (Instruction instr : block) {
            if (!(instr instanceof Instruction.Assignment)) {
                continue;
            }
            int val;
            if (instr instanceof Instruction.Compute) {
                Instruction.Compute compute = (Instruction.Compute) instr;
                Opcode op = compute.getOpcode();
                int arg1 = resolveValue(compute.getArg(0), context, temps);
                int arg2 = op.getArity() > 1 ? resolveValue(compute.getArg(1), context, temps) : 0;
                val = op.apply(arg1, arg2);
            } else {
                val = resolveValue(((Instruction.Copy) instr).getValue(), context, temps);
            }

            Operand target = ((Instruction.Assignment) instr).getTarget();
            if (target.isTemp()) {
                temps.put(target.getText(), val);
            } else {
                variables.put(target.getText(), val);
                context.put(target.getText(), val);
            }
            lastResult = val;
        }
        return lastResult;
    }

    /**
     * Builds the truth table of a block over its input variables, or returns null when the
     * block reads no variables. Blocks reading more than {@value #MAX_TABLE_VARIABLES}
     * variables are rejected.
     */
    public TruthTable truthTable(List<Instruction> code) {
        List<String> inputs = inputVariables(code);
        if (inputs.isEmpty()) {
            return null;
        }
        if (inputs.size() > MAX_TABLE_VARIABLES) {
            throw new InterpreterException("Too many variables for a truth table: " + inputs.size()
                    + " (at most " + MAX_TABLE_VARIABLES + ")");
        }
        TruthTable table = new TruthTable(inputs);
        int n = inputs.size();
        long rows = 1L << n;
        for (long row = 0; row < rows; row++) {
            int[] values = new int[n];
            Map<String, Integer> localVars = new HashMap<>();
            for (int i = 0; i < n; i++) {
                values[i] = (int) ((row >> (n - 1 - i)) & 1);
                localVars.put(inputs.get(i), values[i]);
            }
            table.addRow(values, run(code, localVars));
        }
        return table;
    }

    public Map<String, Integer> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    public List<Instruction> getLastIr() {
        return lastIr;
    }

    public List<Instruction> getSavedCode(String name) {
        return savedCode.get(name);
    }

    // A "set X = 1" block must not replace the last real expression.
    private void cacheIfMeaningful(List<Instruction> block) {
        boolean isExpr = false;
        List<String> outputVars = new ArrayList<>();

        for (Instruction instr : block) {
            if (instr instanceof Instruction.Compute) {
                isExpr = true;
            }
            if (!(instr instanceof Instruction.Assignment)) {
                continue;
            }
            Operand target = ((Instruction.Assignment) instr).getTarget();
            if (target.isTemp()) {
                isExpr = true;
            } else if (!isLiteralCopy(instr)) {
                outputVars.add(target.getText());
                isExpr = true;
            }
        }

        if (isExpr) {
            List<Instruction> cached = List.copyOf(block);
            lastIr = cached;
            for (String var : outputVars) {
                savedCode.put(var, cached);
            }
        }
    }

    private void handleEval() {
        if (lastIr != null) {
            out.println(run(lastIr, Collections.emptyMap()));
        } else {
            out.println("No expression to evaluate.");
        }
    }

    private void handleTable(List<Instruction> block, Instruction.Command command) {
        String targetId = command.getArgs().isEmpty() ? null : command.getArgs().get(0);
        if (Instruction.CURRENT_EXPRESSION.equals(targetId)) {
            targetId = null;
        }

        List<Instruction> targetCode = block;
        if (targetId != null) {
            targetCode = savedCode.get(targetId);
            if (targetCode == null) {
                throw new InterpreterException("Unknown rule or expression '" + targetId + "'");
            }
        } else if (!hasAssignment(block) && lastIr != null) {
            targetCode = lastIr;
        }

        TruthTable table = truthTable(targetCode);
        if (table == null) {
            out.println("No variables to generate table for.");
            return;
        }
        for (String line : table.render()) {
            out.println(line);
        }
    }

    // Reports current values only; nothing is derived.
    private void handleInfer(Instruction.Command command) {
        List<String> rules = command.getArgs();
        out.println("Inferring from rules: " + String.join(", ", rules));
        for (String rule : rules) {
            Integer val = variables.get(rule);
            out.println(rule + ": " + (val == null ? "Undefined" : val));
        }
    }

    /**
     * Purely syntactic: every alphabetic name read on a right-hand side, sorted. Operator
     * words and temporaries are skipped.
     */
    private static List<String> inputVariables(List<Instruction> code) {
        TreeSet<String> inputs = new TreeSet<>();
        for (Instruction instr : code) {
            if (!(instr instanceof Instruction.Assignment)) {
                continue;
            }
            for (Operand operand : ((Instruction.Assignment) instr).getOperands()) {
                String text = operand.getText();
                if (operand.isName() && isAlphabetic(text) && !Opcode.isOpcode(text)) {
                    inputs.add(text);
                }
            }
        }
        return new ArrayList<>(inputs);
    }

    private static int resolveValue(Operand operand, Map<String, Integer> context, Map<String, Integer> temps) {
        if (operand.isLiteral()) {
            return operand.literalValue();
        }
        String token = operand.getText();
        if (temps.containsKey(token)) {
            return temps.get(token);
        }
        return context.getOrDefault(token, 0);
    }

    private static boolean isAlphabetic(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isLetter(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isLiteralCopy(Instruction instr) {
        return instr instanceof Instruction.Copy && ((Instruction.Copy) instr).getValue().isLiteral();
    }

    private static boolean hasAssignment(List<Instruction> block) {
        for (Instruction instr : block) {
            if (instr instanceof Instruction.Assignment) {
                return true;
            }
        }
        return false;
    }

    private static boolean isCommand(Instruction instr, Instruction.CommandKind kind) {
        return instr instanceof Instruction.Command && ((Instruction.Command) instr).is(kind);
    }
}
