package org.onionscout.util;

import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.core.statement.StatementCustomizer;
import org.jdbi.v3.sqlobject.customizer.SqlStatementCustomizer;
import org.jdbi.v3.sqlobject.customizer.SqlStatementCustomizerFactory;
import org.jdbi.v3.sqlobject.customizer.SqlStatementCustomizingAnnotation;

import java.lang.annotation.*;
import java.lang.reflect.Method;
import java.sql.PreparedStatement;

/**
 * Fails the statement if it didn't update the expected number of rows. Used for state transitions guarded by the
 * current state in the WHERE clause, so a lost transition surfaces as an error rather than silently doing nothing.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD})
@SqlStatementCustomizingAnnotation(value = MustUpdate.Handler.class)
public @interface MustUpdate {
    /**
     * Number of rows that should be updated. (-1 means any except 0)
     */
    int value() default -1;

    class Handler implements SqlStatementCustomizerFactory {
        @Override
        public SqlStatementCustomizer createForMethod(Annotation annotation, Class<?> sqlObjectType, Method method) {
            int expectedCount = ((MustUpdate) annotation).value();
            String name = method.getDeclaringClass().getSimpleName() + "." + method.getName() + "()";
            return stmt -> stmt.addCustomizer(new StatementCustomizer() {
                @Override
                public void afterExecution(PreparedStatement stmt, StatementContext ctx) throws java.sql.SQLException {
                    long updateCount = stmt.getUpdateCount();
                    if (expectedCount == -1) {
                        if (updateCount == 0) {
                            throw new Exception(name + " didn't update any rows");
                        }
                    } else if (expectedCount != updateCount) {
                        throw new Exception(name + " expected to update " + expectedCount + " rows but updated " + updateCount);
                    }
                }
            });
        }
    }

    class Exception extends RuntimeException {
        public Exception(String message) {
            super(message);
        }
    }
}
