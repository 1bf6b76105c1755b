package logiceval;

import logiceval.exception.InterpreterException;
import logiceval.exception.LexicalException;
import logiceval.exception.SemanticException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionTest {
    private ByteArrayOutputStream buffer;
    private Session session;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        session = new Session(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private List<String> output() {
        String text = buffer.toString(StandardCharsets.UTF_8);
        return text.isEmpty() ? List.of() : List.of(text.split("\\R"));
    }

    @Test
    void setThenEvaluate() {
        session.run("set A = 1; set B = 0; expr A & B;");

        assertEquals(Map.of("A", 1, "B", 0), session.getInterpreter().getVariables());
        assertEquals(List.of(), output());

        session.run("eval;");
        assertEquals(List.of("0"), output());
    }

    @Test
    void tableOfRuleOverFreeVariables() {
        session.run("R: A | B;\ntable R;");

        assertEquals(List.of(
                "A | B | Result",
                "--------------",
                "0 | 0 | 0",
                "0 | 1 | 1",
                "1 | 0 | 1",
                "1 | 1 | 1"), output());
    }

    @Test
    void namedExpressionTableIgnoresLaterExpressions() {
        session.run("expr foo A & B; expr C | D; table foo;");

        assertEquals("A | B | Result", output().get(0));
        assertEquals("1 | 1 | 1", output().get(5));
    }

    @Test
    void anonymousTableUsesLastExpression() {
        session.run("expr A xor B; set C = 1; table;");

        assertEquals(List.of(
                "A | B | Result",
                "--------------",
                "0 | 0 | 0",
                "0 | 1 | 1",
                "1 | 0 | 1",
                "1 | 1 | 0"), output());
    }

    @Test
    void bareVariableExpressionCanBeTabulated() {
        session.run("expr A; table;");

        assertEquals(List.of("A | Result", "----------", "0 | 0", "1 | 1"), output());
    }

    @Test
    void foldedExpressionEvaluates() {
        session.run("expr !1 | 0; eval;");

        assertEquals(List.of("0"), output());
    }

    @Test
    void freshSessionHasNothingToEvaluateOrTabulate() {
        session.run("eval; table;");

        assertEquals(List.of("No expression to evaluate.", "No variables to generate table for."), output());
    }

    @Test
    void inferReportsRuleValues() {
        session.run("set A = 1; set B = 1; R: A & B; S: A -> !B; infer R, S;");

        assertEquals(List.of("Inferring from rules: R, S", "R: 1", "S: 0"), output());
    }

    @Test
    void ruleRedefinitionFailsBeforeAnythingRuns() {
        assertThrows(SemanticException.class, () -> session.run("R: A; R: B;"));

        assertNull(session.getInterpreter().getLastIr());
        assertTrue(session.getInterpreter().getVariables().isEmpty());
    }

    @Test
    void inferOnUndefinedRuleNeverExecutes() {
        assertThrows(SemanticException.class, () -> session.run("set A = 1; infer Z;"));

        assertFalse(session.getInterpreter().getVariables().containsKey("A"));
        assertEquals(List.of(), output());
    }

    @Test
    void rulesAreCheckedPerChunk() {
        session.run("R: A;");

        assertThrows(SemanticException.class, () -> session.run("infer R;"));
        session.run("R: B;");
        assertEquals(session.getInterpreter().getSavedCode("R"), session.getInterpreter().getLastIr());
    }

    @Test
    void failedChunkKeepsEarlierState() {
        session.run("set A = 1; expr foo A & B;");

        assertThrows(LexicalException.class, () -> session.run("set B = 2;"));
        assertEquals(1, session.getInterpreter().getVariables().get("A"));
        assertEquals(0, session.getInterpreter().getVariables().get("foo"));
    }

    @Test
    void runtimeErrorStopsTheRestOfTheChunk() {
        assertThrows(InterpreterException.class, () -> session.run("set A = 1; table nope; set B = 1;"));

        assertEquals(1, session.getInterpreter().getVariables().get("A"));
        assertFalse(session.getInterpreter().getVariables().containsKey("B"));
    }

    @Test
    void compilationKeepsEveryStage() {
        Compilation compilation = session.compile("expr foo 1 & A; table foo;");

        assertEquals(2, compilation.getProgram().getStatements().size());
        assertEquals(List.of("t1 = AND 1 A", "foo = t1", "TABLE foo"),
                compilation.getGeneratedInstructions().stream().map(Object::toString).collect(Collectors.toList()));
        assertEquals(List.of("t1 = A", "foo = t1", "TABLE foo"),
                compilation.getInstructions().stream().map(Object::toString).collect(Collectors.toList()));
        assertEquals(2, compilation.getBlocks().size());
    }
}
