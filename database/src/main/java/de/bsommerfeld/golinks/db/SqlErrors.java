package de.bsommerfeld.golinks.db;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.Locale;

/**
 * Dialect-neutral classification of {@link SQLException}s.
 *
 * <p>
 * PostgreSQL reports SQLStates ({@code 23505}, {@code 23503}), MySQL reports
 * vendor codes ({@code 1062}, {@code 1452}) under the shared state
 * {@code 23000}, and the SQLite driver only reports the result code name in
 * its message. All three are recognized here so store code never inspects
 * driver classes. The cause chain is walked because drivers and callers wrap
 * the original exception.
 */
final class SqlErrors {

    private static final int MYSQL_DUPLICATE_ENTRY = 1062;
    private static final int MYSQL_NO_REFERENCED_ROW = 1452;
    private static final int MYSQL_LOCK_WAIT_TIMEOUT = 1205;
    private static final int MYSQL_DEADLOCK = 1213;

    private SqlErrors() {
    }

    static boolean isUniqueViolation(SQLException e) {
        for (SQLException s = e; s != null; s = next(s)) {
            if ("23505".equals(s.getSQLState()))
                return true;
            if (isMySql(s) && s.getErrorCode() == MYSQL_DUPLICATE_ENTRY)
                return true;
            String msg = message(s);
            if (msg.contains("unique constraint failed") || msg.contains("sqlite_constraint_unique")
                    || msg.contains("sqlite_constraint_primarykey") || msg.contains("duplicate key")
                    || msg.contains("duplicate entry"))
                return true;
        }
        return false;
    }

    static boolean isForeignKeyViolation(SQLException e) {
        for (SQLException s = e; s != null; s = next(s)) {
            if ("23503".equals(s.getSQLState()))
                return true;
            if (isMySql(s) && s.getErrorCode() == MYSQL_NO_REFERENCED_ROW)
                return true;
            String msg = message(s);
            if (msg.contains("foreign key constraint failed") || msg.contains("sqlite_constraint_foreignkey"))
                return true;
        }
        return false;
    }

    static boolean isTransient(SQLException e) {
        for (SQLException s = e; s != null; s = next(s)) {
            if (s instanceof SQLTransientException || s instanceof SQLRecoverableException)
                return true;
            String state = s.getSQLState();
            if (state != null && (state.startsWith("08") || state.startsWith("40")))
                return true;
            if (s.getErrorCode() == MYSQL_LOCK_WAIT_TIMEOUT && "HY000".equals(state))
                return true;
            if (s.getErrorCode() == MYSQL_DEADLOCK && isMySql(s))
                return true;
            String msg = message(s);
            if (msg.contains("sqlite_busy") || msg.contains("sqlite_locked") || msg.contains("database is locked"))
                return true;
        }
        return false;
    }

    /**
     * Converts an exception no caller handled specifically into a
     * {@link StoreException} of kind {@code TRANSIENT} or {@code STORAGE}.
     */
    static StoreException translate(String operation, SQLException e) {
        if (isTransient(e)) {
            return new StoreException(StoreException.Kind.TRANSIENT,
                    operation + " failed transiently: " + e.getMessage(), e);
        }
        return new StoreException(StoreException.Kind.STORAGE, operation + " failed: " + e.getMessage(), e);
    }

    private static boolean isMySql(SQLException s) {
        return "23000".equals(s.getSQLState()) || "HY000".equals(s.getSQLState()) || "40001".equals(s.getSQLState());
    }

    private static String message(SQLException s) {
        return s.getMessage() == null ? "" : s.getMessage().toLowerCase(Locale.ROOT);
    }

    private static SQLException next(SQLException s) {
        if (s.getNextException() != null)
            return s.getNextException();
        return s.getCause() instanceof SQLException cause ? cause : null;
    }
}
