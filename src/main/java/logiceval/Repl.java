package logiceval;

import logiceval.exception.LogicEvalException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

/**
 * Interactive loop. Lines are buffered until one contains ';', then the buffer is compiled
 * and run as one chunk against a single long-lived session.
 */
public class Repl {
    private final BufferedReader reader;
    private final PrintStream out;
    private final PrintStream err;
    private final Session session;
    private boolean verbose = false;

    public Repl(BufferedReader reader, PrintStream out, PrintStream err) {
        this.reader = reader;
        this.out = out;
        this.err = err;
        this.session = new Session(out);
    }

    public void run() throws IOException {
        out.println("LogicEval Compiler v1.0 (REPL Mode)");
        out.println("Type 'help' for commands, 'exit' to quit.");

        StringBuilder buffer = new StringBuilder();
        while (true) {
            out.print(buffer.length() > 0 ? "... " : "> ");
            out.flush();
            String line = reader.readLine();
            if (line == null) {
                return;
            }
            String command = line.trim();
            if ("exit".equals(command)) {
                return;
            }
            if ("verbose".equals(command)) {
                verbose = !verbose;
                out.println("Verbose mode: " + (verbose ? "ON" : "OFF"));
                continue;
            }
            if ("help".equals(command) && buffer.length() == 0) {
                printHelp();
                continue;
            }

            buffer.append(line).append('\n');
            if (line.indexOf(';') >= 0) {
                process(buffer.toString());
                buffer.setLength(0);
            }
        }
    }

    public Session getSession() {
        return session;
    }

    private void process(String chunk) {
        try {
            Compilation compilation = session.compile(chunk);
            if (verbose) {
                new StageReport(out).print(compilation);
            }
            session.execute(compilation);
        } catch (LogicEvalException e) {
            err.println("Error: " + e.getMessage());
        }
    }

    private void printHelp() {
        out.println("  expr [name] <expression>;   evaluate, optionally naming the result");
        out.println("  set <var> = 0|1;            assign a variable");
        out.println("  <rule>: <expression>;       define a rule");
        out.println("  table [name];               truth table of a name or the last expression");
        out.println("  eval;                       re-evaluate the last expression");
        out.println("  infer <rule>, ...;          show current values of rules");
        out.println("  operators: !  &  ^ (xor)  |  ->   literals: 0 1");
        out.println("  verbose                     toggle compiler stage reports");
        out.println("  exit                        quit");
    }
}
