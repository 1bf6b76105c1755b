package logiceval.exception;

/**
 * Base of every failure the pipeline reports. A failure ends the processing of the
 * statement group it occurred in; interpreter state built by earlier statements is kept.
 */
public abstract class LogicEvalException extends RuntimeException {
    private final ErrorKind kind;

    protected LogicEvalException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
