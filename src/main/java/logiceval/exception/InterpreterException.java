package logiceval.exception;

public class InterpreterException extends LogicEvalException {
    public InterpreterException(String message) {
        super(ErrorKind.RUNTIME, message);
    }
}
