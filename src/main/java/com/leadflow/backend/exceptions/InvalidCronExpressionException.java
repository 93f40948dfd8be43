package com.leadflow.backend.exceptions;

/**
 * Raised when a workflow is saved with a schedule that is not a valid 5-field cron expression.
 */
public class InvalidCronExpressionException extends RuntimeException {

    private final String expression;

    public InvalidCronExpressionException(String expression, String reason) {
        super("Invalid cron expression '" + expression + "': " + reason);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
