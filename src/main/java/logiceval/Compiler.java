package logiceval;

import logiceval.frontend.lexer.Scanner;
import logiceval.frontend.lexer.Token;
import logiceval.frontend.semantic.SemanticChecker;
import logiceval.frontend.syntax.Ast;
import logiceval.frontend.syntax.Parser;
import logiceval.ir.IRGenerator;
import logiceval.ir.Instruction;
import logiceval.ir.PeepholeOptimizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Scan, parse, check, lower and optimize one chunk of source. The whole chunk is checked
 * before any code is generated, so a failing chunk yields no instructions at all.
 */
public class Compiler {
    private final PeepholeOptimizer optimizer = new PeepholeOptimizer();

    public Compilation compile(String source) {
        List<Token> tokens = new Scanner(source).scan();
        Ast.Program program = new Parser(tokens).parse();

        SemanticChecker checker = new SemanticChecker();
        checker.check(program);

        IRGenerator irGenerator = new IRGenerator();
        List<List<Instruction>> generated = new ArrayList<>();
        List<List<Instruction>> optimized = new ArrayList<>();
        for (Ast.Stmt stmt : program.getStatements()) {
            List<Instruction> code = irGenerator.generate(stmt);
            generated.add(code);
            optimized.add(optimizer.optimize(code));
        }
        return new Compilation(tokens, program, checker, generated, optimized);
    }
}
