package com.stepflow.core.schedule;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.stepflow.core.exception.InvalidCronExpressionException;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Parsing and evaluation of five-field UNIX cron expressions, in UTC.
 */
public final class CronExpressions {

    private static final CronParser PARSER =
        new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private CronExpressions() {
    }

    /**
     * Parse and validate an expression.
     *
     * @throws InvalidCronExpressionException if the expression is malformed
     */
    public static Cron parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidCronExpressionException(String.valueOf(expression),
                new IllegalArgumentException("expression is empty"));
        }
        try {
            Cron cron = PARSER.parse(expression.trim());
            cron.validate();
            return cron;
        } catch (IllegalArgumentException e) {
            throw new InvalidCronExpressionException(expression, e);
        }
    }

    public static void validate(String expression) {
        parse(expression);
    }

    /**
     * Next occurrence strictly after the given instant.
     */
    public static Optional<Instant> nextAfter(String expression, Instant after) {
        ExecutionTime executionTime = ExecutionTime.forCron(parse(expression));
        return executionTime.nextExecution(ZonedDateTime.ofInstant(after, ZoneOffset.UTC))
            .map(ZonedDateTime::toInstant);
    }
}
