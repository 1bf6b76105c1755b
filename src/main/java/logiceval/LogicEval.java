package logiceval;

import logiceval.exception.LogicEvalException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class LogicEval {
    public static void main(String[] args) throws IOException {
        boolean verbose = false;
        String fileName = null;
        for (String arg : args) {
            if ("--verbose".equals(arg) || "-v".equals(arg)) {
                verbose = true;
            } else if (fileName == null) {
                fileName = arg;
            } else {
                System.err.println("Usage: java -jar logiceval.jar [<source.logic> [--verbose]]");
                System.exit(2);
            }
        }

        if (fileName == null) {
            BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            new Repl(reader, System.out, System.err).run();
            return;
        }

        int status = runFile(Path.of(fileName), verbose, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Compiles and runs a whole file as one chunk. Returns the process exit status.
     */
    static int runFile(Path file, boolean verbose, PrintStream out, PrintStream err) throws IOException {
        if (!Files.exists(file)) {
            err.println("File not found: " + file);
            return 1;
        }
        String source = Files.readString(file, StandardCharsets.UTF_8);
        if (source.isBlank()) {
            err.println("Empty source file");
            return 1;
        }

        Session session = new Session(out);
        try {
            Compilation compilation = session.compile(source);
            if (verbose) {
                new StageReport(out).print(compilation);
            }
            session.execute(compilation);
        } catch (LogicEvalException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
        return 0;
    }
}
