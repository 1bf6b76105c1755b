package logiceval.exec;

import logiceval.exception.ErrorKind;
import logiceval.exception.InterpreterException;
import logiceval.ir.Instruction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InterpreterTest {
    private ByteArrayOutputStream buffer;
    private Interpreter interpreter;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        interpreter = new Interpreter(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private void execute(String... lines) {
        interpreter.execute(Instruction.parseAll(lines));
    }

    private List<String> output() {
        String text = buffer.toString(StandardCharsets.UTF_8);
        return text.isEmpty() ? List.of() : List.of(text.split("\\R"));
    }

    @Test
    void operatorsFollowTheirTruthTables() {
        int[][] cases = {{0, 0}, {0, 1}, {1, 0}, {1, 1}};
        int[] and = {0, 0, 0, 1};
        int[] or = {0, 1, 1, 1};
        int[] implies = {1, 1, 0, 1};
        int[] xor = {0, 1, 1, 0};
        for (int i = 0; i < cases.length; i++) {
            Map<String, Integer> ab = Map.of("a", cases[i][0], "b", cases[i][1]);
            assertEquals(and[i], interpreter.run(Instruction.parseAll("t1 = AND a b"), ab));
            assertEquals(or[i], interpreter.run(Instruction.parseAll("t1 = OR a b"), ab));
            assertEquals(implies[i], interpreter.run(Instruction.parseAll("t1 = IMPLIES a b"), ab));
            assertEquals(xor[i], interpreter.run(Instruction.parseAll("t1 = XOR a b"), ab));
        }
        assertEquals(1, interpreter.run(Instruction.parseAll("t1 = NOT a"), Map.of("a", 0)));
        assertEquals(0, interpreter.run(Instruction.parseAll("t1 = NOT a"), Map.of("a", 1)));
    }

    @Test
    void unsetNamesReadAsZero() {
        assertEquals(0, interpreter.run(Instruction.parseAll("t1 = OR Q Z"), Map.of()));
        assertEquals(1, interpreter.run(Instruction.parseAll("t1 = NOT Q"), Map.of()));
    }

    @Test
    void blockWithoutAssignmentsYieldsZero() {
        assertEquals(0, interpreter.run(Instruction.parseAll("EVAL"), Map.of()));
    }

    @Test
    void namesWriteThroughAndTemporariesStayLocal() {
        execute("A = 1");
        execute("t1 = NOT A", "foo = t1");

        assertEquals(Map.of("A", 1, "foo", 0), interpreter.getVariables());
        assertFalse(interpreter.getVariables().containsKey("t1"));
    }

    @Test
    void literalAssignmentDoesNotReplaceLastExpression() {
        List<Instruction> expr = Instruction.parseAll("t1 = AND A B");
        interpreter.execute(expr);
        execute("C = 1");

        assertEquals(expr, interpreter.getLastIr());
        assertNull(interpreter.getSavedCode("C"));
    }

    @Test
    void namedResultsAreSavedForTables() {
        List<Instruction> rule = Instruction.parseAll("t1 = OR A B", "R = t1");
        interpreter.execute(rule);
        List<Instruction> alias = Instruction.parseAll("S = A");
        interpreter.execute(alias);

        assertEquals(rule, interpreter.getSavedCode("R"));
        assertEquals(alias, interpreter.getSavedCode("S"));
        assertEquals(alias, interpreter.getLastIr());
    }

    @Test
    void placeholderBlockIsCachedButNotSaved() {
        List<Instruction> bare = Instruction.parseAll("t_res = A");
        interpreter.execute(bare);

        assertEquals(bare, interpreter.getLastIr());
        assertNull(interpreter.getSavedCode("t_res"));
    }

    @Test
    void cachedBlocksAreCopies() {
        List<Instruction> rule = Instruction.parseAll("t1 = OR A B", "R = t1");
        interpreter.execute(rule);
        rule.set(0, Instruction.parse("t1 = AND A B"));

        assertEquals("t1 = OR A B", interpreter.getLastIr().get(0).toString());
        assertEquals("t1 = OR A B", interpreter.getSavedCode("R").get(0).toString());
        assertThrows(UnsupportedOperationException.class, () -> interpreter.getLastIr().clear());
    }

    @Test
    void savedCodeIsReplacedOnRebinding() {
        execute("t1 = AND A B", "foo = t1");
        List<Instruction> second = Instruction.parseAll("t1 = OR A B", "foo = t1");
        interpreter.execute(second);

        assertEquals(second, interpreter.getSavedCode("foo"));
    }

    @Test
    void evalRerunsLastExpression() {
        execute("A = 1");
        execute("B = 1");
        execute("t1 = AND A B");
        execute("B = 0");
        execute("EVAL");

        assertEquals(List.of("0"), output());
    }

    @Test
    void evalWithoutExpression() {
        execute("A = 1");
        execute("EVAL");

        assertEquals(List.of("No expression to evaluate."), output());
    }

    @Test
    void tableOfNamedRule() {
        execute("t1 = OR A B", "R = t1");
        execute("TABLE R");

        assertEquals(List.of(
                "A | B | Result",
                "--------------",
                "0 | 0 | 0",
                "0 | 1 | 1",
                "1 | 0 | 1",
                "1 | 1 | 1"), output());
    }

    @Test
    void tableWithoutTargetUsesLastExpression() {
        execute("t1 = IMPLIES P Q");
        execute("C = 1");
        execute("TABLE LAST_EXPR");

        assertEquals(List.of(
                "P | Q | Result",
                "--------------",
                "0 | 0 | 1",
                "0 | 1 | 1",
                "1 | 0 | 0",
                "1 | 1 | 1"), output());
    }

    @Test
    void tableColumnsAreSortedAndRowsCountInBinary() {
        TruthTable table = interpreter.truthTable(Instruction.parseAll("t1 = AND C A", "t2 = OR t1 B"));

        assertEquals(List.of("A", "B", "C"), table.getVariables());
        assertEquals(8, table.getRowCount());
        for (int row = 0; row < 8; row++) {
            int[] inputs = table.getInputs(row);
            assertArrayEquals(new int[]{(row >> 2) & 1, (row >> 1) & 1, row & 1}, inputs);
            int expected = (inputs[0] == 1 && inputs[2] == 1) || inputs[1] == 1 ? 1 : 0;
            assertEquals(expected, table.getResult(row));
        }
    }

    @Test
    void tableInputsAreAlphabeticNamesOnly() {
        TruthTable table = interpreter.truthTable(Instruction.parseAll("t1 = AND x1 B", "t2 = OR t1 Carry_in", "R = t2"));

        assertEquals(List.of("B"), table.getVariables());
    }

    @Test
    void tableWritesLastRowThroughToSessionState() {
        execute("A = 0");
        execute("B = 0");
        execute("t1 = AND A B", "R = t1");
        assertEquals(0, interpreter.getVariables().get("R"));

        execute("TABLE R");

        assertEquals(1, interpreter.getVariables().get("R"));
        assertEquals(0, interpreter.getVariables().get("A"));
        assertEquals(0, interpreter.getVariables().get("B"));
    }

    @Test
    void tableRejectsMoreVariablesThanRowsCanCount() {
        List<String> lines = new ArrayList<>();
        lines.add("t1 = AND " + inputName(0) + " " + inputName(1));
        for (int i = 2; i <= Interpreter.MAX_TABLE_VARIABLES; i++) {
            lines.add("t" + i + " = AND t" + (i - 1) + " " + inputName(i));
        }
        List<Instruction> code = Instruction.parseAll(lines.toArray(new String[0]));

        InterpreterException e = assertThrows(InterpreterException.class, () -> interpreter.truthTable(code));
        assertEquals("Too many variables for a truth table: 63 (at most 62)", e.getMessage());
        assertEquals(ErrorKind.RUNTIME, e.getKind());
    }

    // aa, ab, ... az, ba, ...
    private static String inputName(int i) {
        return "" + (char) ('a' + i / 26) + (char) ('a' + i % 26);
    }

    @Test
    void unknownTableTargetIsRuntimeError() {
        InterpreterException e = assertThrows(InterpreterException.class, () -> execute("TABLE nope"));

        assertEquals("Unknown rule or expression 'nope'", e.getMessage());
        assertEquals(ErrorKind.RUNTIME, e.getKind());
    }

    @Test
    void tableWithoutVariables() {
        execute("t1 = 1");
        execute("TABLE LAST_EXPR");

        assertEquals(List.of("No variables to generate table for."), output());
    }

    @Test
    void tableWithNothingEvaluated() {
        execute("TABLE LAST_EXPR");

        assertEquals(List.of("No variables to generate table for."), output());
    }

    @Test
    void inferReportsCurrentValues() {
        execute("R = 1");
        execute("INFER R S");

        assertEquals(List.of("Inferring from rules: R, S", "R: 1", "S: Undefined"), output());
    }

    @Test
    void commandBlocksAreNotCached() {
        execute("t1 = AND A B");
        List<Instruction> last = interpreter.getLastIr();
        execute("EVAL");
        execute("TABLE LAST_EXPR");
        execute("INFER A");

        assertSame(last, interpreter.getLastIr());
        assertTrue(output().contains("A | B | Result"));
    }
}
