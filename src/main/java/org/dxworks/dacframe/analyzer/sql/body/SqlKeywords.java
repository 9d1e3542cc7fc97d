package org.dxworks.dacframe.analyzer.sql.body;

import java.util.Locale;
import java.util.Set;

/**
 * Fixed T-SQL word tables: the reserved words the scanner classifies as keywords, and the
 * built-in functions, types and clause words that never denote a bare column.
 */
public final class SqlKeywords {

    private SqlKeywords() {
        // utility class
    }

    private static final Set<String> RESERVED = Set.of(
            "ADD", "ALL", "ALTER", "AND", "ANY", "AS", "ASC", "AUTHORIZATION", "BACKUP", "BEGIN",
            "BETWEEN", "BREAK", "BROWSE", "BULK", "BY", "CASCADE", "CASE", "CHECK", "CHECKPOINT", "CLOSE",
            "CLUSTERED", "COALESCE", "COLLATE", "COLUMN", "COMMIT", "COMPUTE", "CONSTRAINT", "CONTAINS",
            "CONTAINSTABLE", "CONTINUE", "CONVERT", "CREATE", "CROSS", "CURRENT", "CURRENT_DATE",
            "CURRENT_TIME", "CURRENT_TIMESTAMP", "CURRENT_USER", "CURSOR", "DATABASE", "DBCC", "DEALLOCATE",
            "DECLARE", "DEFAULT", "DELETE", "DENY", "DESC", "DISK", "DISTINCT", "DISTRIBUTED", "DOUBLE",
            "DROP", "DUMP", "ELSE", "END", "ERRLVL", "ESCAPE", "EXCEPT", "EXEC", "EXECUTE", "EXISTS", "EXIT",
            "EXTERNAL", "FETCH", "FILE", "FILLFACTOR", "FOR", "FOREIGN", "FREETEXT", "FREETEXTTABLE", "FROM",
            "FULL", "FUNCTION", "GOTO", "GRANT", "GROUP", "HAVING", "HOLDLOCK", "IDENTITY", "IDENTITY_INSERT",
            "IDENTITYCOL", "IF", "IN", "INDEX", "INNER", "INSERT", "INTERSECT", "INTO", "IS", "JOIN", "KEY",
            "KILL", "LEFT", "LIKE", "LINENO", "LOAD", "MERGE", "NATIONAL", "NOCHECK", "NONCLUSTERED", "NOT",
            "NULL", "NULLIF", "OF", "OFF", "OFFSETS", "ON", "OPEN", "OPENDATASOURCE", "OPENQUERY",
            "OPENROWSET", "OPENXML", "OPTION", "OR", "ORDER", "OUTER", "OVER", "PERCENT", "PIVOT", "PLAN",
            "PRECISION", "PRIMARY", "PRINT", "PROC", "PROCEDURE", "PUBLIC", "RAISERROR", "READ", "READTEXT",
            "RECONFIGURE", "REFERENCES", "REPLICATION", "RESTORE", "RESTRICT", "RETURN", "REVERT", "REVOKE",
            "RIGHT", "ROLLBACK", "ROWCOUNT", "ROWGUIDCOL", "RULE", "SAVE", "SCHEMA", "SECURITYAUDIT",
            "SELECT", "SEMANTICKEYPHRASETABLE", "SEMANTICSIMILARITYDETAILSTABLE", "SEMANTICSIMILARITYTABLE",
            "SESSION_USER", "SET", "SETUSER", "SHUTDOWN", "SOME", "STATISTICS", "SYSTEM_USER", "TABLE",
            "TABLESAMPLE", "TEXTSIZE", "THEN", "TO", "TOP", "TRAN", "TRANSACTION", "TRIGGER", "TRUNCATE",
            "TRY_CONVERT", "TSEQUAL", "UNION", "UNIQUE", "UNPIVOT", "UPDATE", "UPDATETEXT", "USE", "USER",
            "VALUES", "VARYING", "VIEW", "WAITFOR", "WHEN", "WHERE", "WHILE", "WITH", "WITHIN", "WRITETEXT",
            // not reserved by the engine, but clause words of MERGE, APPLY and OUTPUT
            "MATCHED", "USING", "APPLY", "OUTPUT"
    );

    private static final Set<String> FUNCTIONS = Set.of(
            // window and aggregate
            "ROW_NUMBER", "RANK", "DENSE_RANK", "NTILE", "LAG", "LEAD", "FIRST_VALUE", "LAST_VALUE",
            "CUME_DIST", "PERCENT_RANK", "PERCENTILE_CONT", "PERCENTILE_DISC", "COUNT", "COUNT_BIG", "SUM",
            "AVG", "MIN", "MAX", "STDEV", "STDEVP", "VAR", "VARP", "GROUPING", "GROUPING_ID", "STRING_AGG",
            "APPROX_COUNT_DISTINCT", "CHECKSUM_AGG",
            // logical and conversion
            "IIF", "CHOOSE", "ISNULL", "CAST", "TRY_CAST", "TRY_PARSE", "PARSE", "GREATEST", "LEAST",
            // json
            "JSON_VALUE", "JSON_QUERY", "JSON_MODIFY", "JSON_OBJECT", "JSON_ARRAY", "JSON_PATH_EXISTS",
            "ISJSON", "OPENJSON",
            // string
            "STUFF", "CONCAT", "CONCAT_WS", "LEN", "DATALENGTH", "CHARINDEX", "PATINDEX", "SUBSTRING",
            "REPLACE", "REPLICATE", "REVERSE", "LTRIM", "RTRIM", "TRIM", "UPPER", "LOWER", "FORMAT",
            "QUOTENAME", "SPACE", "STR", "TRANSLATE", "SOUNDEX", "DIFFERENCE", "ASCII", "UNICODE",
            "STRING_SPLIT", "STRING_ESCAPE", "FORMATMESSAGE", "COMPRESS", "DECOMPRESS",
            // date and time
            "GETDATE", "GETUTCDATE", "SYSDATETIME", "SYSUTCDATETIME", "SYSDATETIMEOFFSET", "DATEADD",
            "DATEDIFF", "DATEDIFF_BIG", "DATENAME", "DATEPART", "DATETRUNC", "DATE_BUCKET", "DATEFROMPARTS",
            "DATETIMEFROMPARTS", "DATETIME2FROMPARTS", "TIMEFROMPARTS", "EOMONTH", "ISDATE", "SWITCHOFFSET",
            "TODATETIMEOFFSET",
            // math
            "ABS", "CEILING", "FLOOR", "ROUND", "POWER", "SQRT", "SQUARE", "SIGN", "EXP", "LOG", "LOG10",
            "PI", "RAND", "ISNUMERIC",
            // system and metadata
            "NEWID", "NEWSEQUENTIALID", "CHECKSUM", "BINARY_CHECKSUM", "HASHBYTES", "SCOPE_IDENTITY",
            "IDENT_CURRENT", "OBJECT_ID", "OBJECT_NAME", "OBJECT_SCHEMA_NAME", "OBJECTPROPERTY",
            "COLUMNPROPERTY", "DB_NAME", "DB_ID", "SCHEMA_NAME", "SCHEMA_ID", "SUSER_SNAME", "SUSER_NAME",
            "USER_NAME", "HOST_NAME", "APP_NAME", "ERROR_MESSAGE", "ERROR_NUMBER", "ERROR_SEVERITY",
            "ERROR_STATE", "ERROR_LINE", "ERROR_PROCEDURE", "XACT_STATE", "SESSION_CONTEXT", "CONTEXT_INFO",
            "TRIGGER_NESTLEVEL", "COLUMNS_UPDATED"
    );

    private static final Set<String> DATA_TYPES = Set.of(
            "BIGINT", "INT", "INTEGER", "SMALLINT", "TINYINT", "BIT", "DECIMAL", "NUMERIC", "MONEY",
            "SMALLMONEY", "FLOAT", "REAL", "DATETIME", "DATETIME2", "SMALLDATETIME", "DATETIMEOFFSET",
            "CHAR", "VARCHAR", "NCHAR", "NVARCHAR", "NTEXT", "BINARY", "VARBINARY", "UNIQUEIDENTIFIER",
            "XML", "SQL_VARIANT", "SYSNAME", "ROWVERSION", "GEOGRAPHY", "GEOMETRY", "HIERARCHYID"
    );

    // Built-in types that are also common column names; they only count in type positions.
    private static final Set<String> COLUMN_LIKE_TYPES = Set.of(
            "DATE", "TIME", "TIMESTAMP", "TEXT", "IMAGE"
    );

    private static final Set<String> DATE_PARTS = Set.of(
            "YEAR", "QUARTER", "MONTH", "DAYOFYEAR", "DAY", "WEEK", "WEEKDAY", "HOUR", "MINUTE", "SECOND",
            "MILLISECOND", "MICROSECOND", "NANOSECOND", "ISO_WEEK", "TZOFFSET"
    );

    private static final Set<String> CLAUSE_WORDS = Set.of(
            "ROWS", "RANGE", "UNBOUNDED", "PRECEDING", "FOLLOWING", "ROW", "NEXT", "ONLY", "OFFSET", "FIRST",
            "PARTITION", "TIES", "TRY", "CATCH", "THROW", "RETURNS", "LOCAL", "GLOBAL", "FORWARD_ONLY",
            "FAST_FORWARD", "STATIC", "KEYSET", "DYNAMIC", "READ_ONLY", "SCROLL", "INSENSITIVE", "NOCOUNT",
            "XACT_ABORT", "RECOMPILE", "MAXDOP", "OPTIMIZE", "MAXRECURSION", "WINDOW", "XMLNAMESPACES",
            "ZONE", "NOWAIT"
    );

    private static final Set<String> TABLE_HINTS = Set.of(
            "NOLOCK", "READUNCOMMITTED", "READCOMMITTED", "READCOMMITTEDLOCK", "REPEATABLEREAD",
            "SERIALIZABLE", "SNAPSHOT", "UPDLOCK", "XLOCK", "ROWLOCK", "PAGLOCK", "TABLOCK", "TABLOCKX",
            "HOLDLOCK", "NOWAIT", "READPAST", "FORCESEEK", "FORCESCAN", "NOEXPAND", "INDEX",
            "KEEPIDENTITY", "KEEPDEFAULTS", "IGNORE_CONSTRAINTS", "IGNORE_TRIGGERS"
    );

    private static final Set<String> ALIAS_STOP_WORDS = Set.of(
            "OUTPUT", "OPTION", "PIVOT", "UNPIVOT", "TABLESAMPLE", "WINDOW", "FOR", "THROW", "TRY", "CATCH",
            "RETURN", "GO"
    );

    // Methods of xml, hierarchyid and spatial values, invoked as column.method(...)
    private static final Set<String> VALUE_METHODS = Set.of(
            "VALUE", "QUERY", "EXIST", "NODES", "MODIFY", "GETANCESTOR", "GETDESCENDANT", "GETLEVEL",
            "GETREPARENTEDVALUE", "ISDESCENDANTOF", "TOSTRING", "STASTEXT", "STDISTANCE", "STINTERSECTS",
            "STCONTAINS", "STBUFFER", "STX", "STY", "LAT", "LONG", "WRITE"
    );

    // Functions whose first argument is a date part or a type name, never a column.
    private static final Set<String> KEYWORD_FIRST_ARGUMENT = Set.of(
            "DATEADD", "DATEDIFF", "DATEDIFF_BIG", "DATEPART", "DATENAME", "DATETRUNC", "DATE_BUCKET",
            "CONVERT", "TRY_CONVERT"
    );

    private static String upper(String word) {
        return word == null ? "" : word.toUpperCase(Locale.ROOT);
    }

    public static boolean isReserved(String word) {
        return RESERVED.contains(upper(word));
    }

    /**
     * True for words that never become a bare column reference unless bracketed and confirmed
     * by the column registry.
     */
    public static boolean isNeverColumn(String word) {
        String w = upper(word);
        return RESERVED.contains(w)
                || FUNCTIONS.contains(w)
                || DATA_TYPES.contains(w)
                || DATE_PARTS.contains(w)
                || CLAUSE_WORDS.contains(w)
                || TABLE_HINTS.contains(w)
                || w.startsWith("$");
    }

    public static boolean isBuiltInType(String word) {
        String w = upper(word);
        return DATA_TYPES.contains(w) || COLUMN_LIKE_TYPES.contains(w);
    }

    public static boolean isTableHint(String word) {
        return TABLE_HINTS.contains(upper(word));
    }

    public static boolean isValueMethod(String word) {
        return VALUE_METHODS.contains(upper(word));
    }

    public static boolean takesKeywordFirstArgument(String word) {
        return KEYWORD_FIRST_ARGUMENT.contains(upper(word));
    }

    /**
     * Whether a token directly after a table or subquery can be its alias.
     */
    public static boolean canBeAlias(Token token) {
        if (token.isBracketed()) {
            return true;
        }
        if (token.getKind() != TokenKind.IDENTIFIER) {
            return false;
        }
        String w = upper(token.getText());
        return !ALIAS_STOP_WORDS.contains(w) && !TABLE_HINTS.contains(w) && !w.startsWith("#") && !w.startsWith("$");
    }
}
