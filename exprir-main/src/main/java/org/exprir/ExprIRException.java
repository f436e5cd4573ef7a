package org.exprir;

public class ExprIRException extends RuntimeException {

    public ExprIRException(String message) {
        super(message);
    }

    public ExprIRException(String message, Throwable cause) {
        super(message, cause);
    }
}
