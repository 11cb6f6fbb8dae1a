package io.xmin.replication.commons.sql;

import java.io.IOException;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientConnectionException;

public final class SqlErrors {

    public enum Category {
        /**
         * The connection is gone or unusable, reconnect and retry.
         */
        CONNECTIVITY,
        /**
         * The transaction was rolled back by the server (serialization failure, deadlock, aborted transaction).
         */
        TRANSACTION,
        /**
         * The statement itself is wrong for the data (constraint, data exception, undefined object).
         */
        DATA
    }

    private SqlErrors() {
    }

    public static Category classify(SQLException exception) {
        if (exception instanceof SQLRecoverableException || exception instanceof SQLTransientConnectionException) {
            return Category.CONNECTIVITY;
        }

        String state = exception.getSQLState();

        if (state == null || state.length() < 2) {
            return (SqlErrors.hasIOCause(exception)) ? Category.CONNECTIVITY : Category.DATA;
        }

        String stateClass = state.substring(0, 2);

        switch (stateClass) {
            case "08":
            case "53":
                return Category.CONNECTIVITY;
            case "57":
                // 57014 is a cancelled statement, the remaining 57P codes are server shutdowns
                return state.startsWith("57P") ? Category.CONNECTIVITY : Category.TRANSACTION;
            case "40":
            case "25":
                return Category.TRANSACTION;
            default:
                return Category.DATA;
        }
    }

    public static boolean isConnectivity(SQLException exception) {
        return SqlErrors.classify(exception) == Category.CONNECTIVITY;
    }

    private static boolean hasIOCause(Throwable throwable) {
        Throwable cause = throwable.getCause();

        while (cause != null) {
            if (cause instanceof IOException) {
                return true;
            }

            cause = cause.getCause();
        }

        return false;
    }
}
