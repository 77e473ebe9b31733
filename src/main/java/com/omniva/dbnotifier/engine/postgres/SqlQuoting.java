package com.omniva.dbnotifier.engine.postgres;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * PostgreSQL quoting for identifiers and literals spliced into generated DDL
 */
public final class SqlQuoting {

    private SqlQuoting() {
    }

    /**
     * Quote an identifier verbatim, so it is case-sensitive
     */
    public static String quoteIdent(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Quote a possibly schema-qualified name ({@code schema.table}) part by part
     */
    public static String quoteQualified(String name) {
        return Arrays.stream(name.split("\\.", -1))
                .map(SqlQuoting::quoteIdent)
                .collect(Collectors.joining("."));
    }

    /**
     * Quote a string literal the way PostgreSQL's quote_literal does
     */
    public static String quoteLiteral(String literal) {
        if (literal == null) {
            throw new IllegalArgumentException("Literal cannot be null; use quoteNullable");
        }
        String escaped = literal.replace("'", "''");
        if (escaped.contains("\\")) {
            return "E'" + escaped.replace("\\", "\\\\") + "'";
        }
        return "'" + escaped + "'";
    }

    /**
     * Like {@link #quoteLiteral(String)}, but renders null as {@code NULL}
     */
    public static String quoteNullable(String literal) {
        return literal == null ? "NULL" : quoteLiteral(literal);
    }
}
