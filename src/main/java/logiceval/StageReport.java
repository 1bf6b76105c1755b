package logiceval;

import logiceval.frontend.lexer.Token;
import logiceval.frontend.lexer.TokenKind;
import logiceval.frontend.semantic.SemanticChecker;
import logiceval.frontend.syntax.Ast;
import logiceval.ir.Instruction;

import java.io.PrintStream;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Verbose-mode printout of what each compiler stage produced for a chunk.
 */
public class StageReport {
    private static final String RULE = "=".repeat(60);
    private static final int MAX_EXAMPLES = 3;

    private final PrintStream out;

    public StageReport(PrintStream out) {
        this.out = out;
    }

    public void print(Compilation compilation) {
        printTokens(compilation.getTokens());
        printStatements(compilation.getProgram());
        printSemantics(compilation.getChecker());
        printGenerated(compilation.getGeneratedInstructions());
        printOptimization(compilation.getGeneratedInstructions(), compilation.getInstructions());
        header("STAGE 6: CODE EXECUTION / OUTPUT");
    }

    private void header(String stage) {
        out.println();
        out.println(RULE);
        out.println("  " + stage);
        out.println(RULE);
    }

    private void printTokens(List<Token> tokens) {
        header("STAGE 1: LEXICAL ANALYSIS");
        int count = 0;
        for (Token token : tokens) {
            if (token.getKind() == TokenKind.EOF) {
                continue;
            }
            out.printf("  Token: %-12s Value: %-10s Pos: %d:%d%n",
                    token.getKind(), token.getText(), token.getLine(), token.getColumn());
            count++;
        }
        out.println();
        out.println("  Total Tokens Generated: " + count);
    }

    private void printStatements(Ast.Program program) {
        header("STAGE 2: SYNTAX ANALYSIS");
        List<Ast.Stmt> statements = program.getStatements();
        out.println("  Total Statements: " + statements.size());
        for (int i = 0; i < statements.size(); i++) {
            out.println("    Statement " + (i + 1) + ": " + statements.get(i).getClass().getSimpleName());
        }
    }

    private void printSemantics(SemanticChecker checker) {
        header("STAGE 3: SEMANTIC ANALYSIS");
        printNames("Variables Declared", checker.getDeclaredVariables());
        printNames("Rules Defined", checker.getDefinedRules());
    }

    private void printNames(String label, Set<String> names) {
        out.println("  " + label + ": " + names.size());
        if (!names.isEmpty()) {
            out.println("    " + String.join(", ", new TreeSet<>(names)));
        }
    }

    private void printGenerated(List<Instruction> code) {
        header("STAGE 4: INTERMEDIATE CODE GENERATION");
        if (code.isEmpty()) {
            out.println("  No intermediate code generated");
            return;
        }
        out.println("  Generated 3AC Instructions: " + code.size());
        for (int i = 0; i < code.size(); i++) {
            out.printf("    %2d. %s%n", i + 1, code.get(i));
        }
    }

    private void printOptimization(List<Instruction> before, List<Instruction> after) {
        header("STAGE 5: CODE OPTIMIZATION");
        int changes = 0;
        for (int i = 0; i < before.size(); i++) {
            if (!before.get(i).toString().equals(after.get(i).toString())) {
                changes++;
            }
        }
        out.println("  Original Instructions: " + before.size());
        out.println("  Optimized Instructions: " + after.size());
        out.println("  Optimizations Applied: " + changes);
        if (changes == 0) {
            return;
        }
        out.println("  Optimization Examples:");
        int shown = 0;
        for (int i = 0; i < before.size() && shown < MAX_EXAMPLES; i++) {
            String orig = before.get(i).toString();
            String opt = after.get(i).toString();
            if (!orig.equals(opt)) {
                out.println("    Before: " + orig);
                out.println("    After:  " + opt);
                shown++;
            }
        }
    }
}
