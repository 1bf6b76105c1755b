package logiceval.exception;

public enum ErrorKind {
    LEXICAL,
    PARSE,
    SEMANTIC,
    RUNTIME
}
