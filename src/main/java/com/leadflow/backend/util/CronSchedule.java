package com.leadflow.backend.util;

import com.leadflow.backend.exceptions.InvalidCronExpressionException;
import org.springframework.scheduling.support.CronExpression;

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * A standard 5-field cron schedule ({@code minute hour day-of-month month day-of-week}).
 * Evaluation is delegated to Spring's {@link CronExpression} with the seconds field pinned to 0.
 */
public final class CronSchedule {

    private final String expression;
    private final CronExpression cron;

    private CronSchedule(String expression, CronExpression cron) {
        this.expression = expression;
        this.cron = cron;
    }

    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidCronExpressionException(expression, "expression is empty");
        }
        String normalized = expression.trim().replaceAll("\\s+", " ");
        int fields = normalized.split(" ").length;
        if (fields != 5) {
            throw new InvalidCronExpressionException(expression,
                    "expected 5 fields (minute hour day month weekday) but found " + fields);
        }
        try {
            return new CronSchedule(normalized, CronExpression.parse("0 " + normalized));
        } catch (IllegalArgumentException e) {
            throw new InvalidCronExpressionException(expression, e.getMessage());
        }
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (InvalidCronExpressionException e) {
            return false;
        }
    }

    /**
     * True when the schedule fires in the minute containing {@code time}.
     */
    public boolean matches(ZonedDateTime time) {
        ZonedDateTime minute = time.truncatedTo(ChronoUnit.MINUTES);
        ZonedDateTime next = cron.next(minute.minusSeconds(1));
        return minute.equals(next);
    }

    /**
     * Next firing strictly after {@code time}, or null if the schedule never fires again.
     */
    public ZonedDateTime next(ZonedDateTime time) {
        return cron.next(time);
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronSchedule)) return false;
        return expression.equals(((CronSchedule) o).expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression);
    }

    @Override
    public String toString() {
        return expression;
    }
}
