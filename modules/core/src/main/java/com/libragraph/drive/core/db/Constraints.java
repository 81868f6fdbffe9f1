package com.libragraph.drive.core.db;

import java.sql.SQLException;

public final class Constraints {

    private static final String UNIQUE_VIOLATION = "23505";

    private Constraints() {
    }

    /**
     * Whether {@code t} or any of its causes is a unique-constraint violation.
     */
    public static boolean isUniqueViolation(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof SQLException sql && UNIQUE_VIOLATION.equals(sql.getSQLState())) {
                return true;
            }
            if (c.getCause() == c) {
                break;
            }
        }
        return false;
    }

    /**
     * Escapes {@code %}, {@code _} and {@code \} for use in a {@code LIKE ... ESCAPE '\'} pattern.
     */
    public static String likePrefix(String prefix) {
        StringBuilder sb = new StringBuilder(prefix.length() + 4);
        for (char ch : prefix.toCharArray()) {
            if (ch == '%' || ch == '_' || ch == '\\') {
                sb.append('\\');
            }
            sb.append(ch);
        }
        return sb.append('%').toString();
    }
}
