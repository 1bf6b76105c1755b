package logiceval.exception;

public class SemanticException extends LogicEvalException {
    public SemanticException(String message) {
        super(ErrorKind.SEMANTIC, message);
    }
}
