package dk.cloudcreate.domainkit.eventstore.postgresql;

import java.util.Set;
import java.util.regex.Pattern;

import static dk.cloudcreate.domainkit.common.FailFast.requireNonNull;
import static dk.cloudcreate.domainkit.common.MessageFormatter.msg;

/**
 * Table and column names can't be bound as statement parameters and are concatenated into the SQL,
 * so they're validated before use
 */
public final class PostgresqlUtil {
    private static final Pattern     VALID_SQL_IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]{0,62}$");
    private static final Set<String> RESERVED_KEYWORDS    = Set.of("ALL", "AND", "ANY", "AS", "ASC", "BETWEEN", "BY", "CASE", "CAST", "CHECK",
                                                                   "COLUMN", "CONSTRAINT", "CREATE", "DEFAULT", "DELETE", "DESC", "DISTINCT",
                                                                   "DROP", "ELSE", "END", "EXISTS", "FALSE", "FOREIGN", "FROM", "GRANT",
                                                                   "GROUP", "HAVING", "IN", "INDEX", "INSERT", "INTO", "IS", "JOIN", "KEY",
                                                                   "LIKE", "LIMIT", "NOT", "NULL", "OFFSET", "ON", "OR", "ORDER", "PRIMARY",
                                                                   "REFERENCES", "SELECT", "SET", "TABLE", "THEN", "TO", "TRUE", "UNION",
                                                                   "UNIQUE", "UPDATE", "USER", "USING", "VALUES", "WHEN", "WHERE", "WITH");

    private PostgresqlUtil() {
    }

    /**
     * @param tableOrColumnName the table or column name
     * @return true if the name only contains letters, digits and underscores, doesn't start with a digit,
     * is at most 63 characters long and isn't a reserved keyword
     */
    public static boolean isValidSqlIdentifier(String tableOrColumnName) {
        requireNonNull(tableOrColumnName, "No tableOrColumnName provided");
        return VALID_SQL_IDENTIFIER.matcher(tableOrColumnName).matches() &&
                !RESERVED_KEYWORDS.contains(tableOrColumnName.toUpperCase());
    }

    /**
     * @param tableOrColumnName the table or column name
     * @return the <code>tableOrColumnName</code>
     * @throws IllegalArgumentException if the name isn't valid according to {@link #isValidSqlIdentifier(String)}
     */
    public static String checkIsValidTableOrColumnName(String tableOrColumnName) {
        if (!isValidSqlIdentifier(tableOrColumnName)) {
            throw new IllegalArgumentException(msg("'{}' isn't a valid table or column name", tableOrColumnName));
        }
        return tableOrColumnName;
    }
}
