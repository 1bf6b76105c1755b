package logiceval;

import logiceval.frontend.lexer.Token;
import logiceval.frontend.semantic.SemanticChecker;
import logiceval.frontend.syntax.Ast;
import logiceval.ir.Instruction;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the compiler produced for one chunk of source: tokens, tree, checker state and
 * one instruction block per statement, before and after optimization.
 */
public final class Compilation {
    private final List<Token> tokens;
    private final Ast.Program program;
    private final SemanticChecker checker;
    private final List<List<Instruction>> generated;
    private final List<List<Instruction>> blocks;

    Compilation(List<Token> tokens, Ast.Program program, SemanticChecker checker,
                List<List<Instruction>> generated, List<List<Instruction>> blocks) {
        this.tokens = List.copyOf(tokens);
        this.program = program;
        this.checker = checker;
        this.generated = List.copyOf(generated);
        this.blocks = List.copyOf(blocks);
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public Ast.Program getProgram() {
        return program;
    }

    public SemanticChecker getChecker() {
        return checker;
    }

    // optimized, one per statement, in statement order
    public List<List<Instruction>> getBlocks() {
        return blocks;
    }

    public List<List<Instruction>> getGeneratedBlocks() {
        return generated;
    }

    public List<Instruction> getInstructions() {
        return concat(blocks);
    }

    public List<Instruction> getGeneratedInstructions() {
        return concat(generated);
    }

    private static List<Instruction> concat(List<List<Instruction>> blocks) {
        List<Instruction> all = new ArrayList<>();
        for (List<Instruction> block : blocks) {
            all.addAll(block);
        }
        return all;
    }
}
