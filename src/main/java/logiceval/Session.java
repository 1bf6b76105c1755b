package logiceval;

import logiceval.exec.Interpreter;
import logiceval.ir.Instruction;

import java.io.PrintStream;
import java.util.List;

/**
 * One interpreter kept alive across chunks. Statements already executed keep their effect
 * when a later statement in the same chunk fails.
 */
public class Session {
    private final Compiler compiler = new Compiler();
    private final Interpreter interpreter;

    public Session() {
        this(System.out);
    }

    public Session(PrintStream out) {
        this.interpreter = new Interpreter(out);
    }

    public Compilation run(String source) {
        Compilation compilation = compile(source);
        execute(compilation);
        return compilation;
    }

    public Compilation compile(String source) {
        return compiler.compile(source);
    }

    public void execute(Compilation compilation) {
        for (List<Instruction> block : compilation.getBlocks()) {
            interpreter.execute(block);
        }
    }

    public Interpreter getInterpreter() {
        return interpreter;
    }
}
