package org.exprir;

public class ExpressionParseException extends ExprIRException {

    private final String reason;
    private final String expression;
    private final int position;

    public ExpressionParseException(String reason, String expression, int position) {
        super("parse error: " + reason);
        this.reason = reason;
        this.expression = expression;
        this.position = position;
    }

    public ExpressionParseException(String reason, String expression, int position, Throwable cause) {
        super("parse error: " + reason, cause);
        this.reason = reason;
        this.expression = expression;
        this.position = position;
    }

    public String getReason() {
        return reason;
    }

    public String getExpression() {
        return expression;
    }

    public int getPosition() {
        return position;
    }
}
