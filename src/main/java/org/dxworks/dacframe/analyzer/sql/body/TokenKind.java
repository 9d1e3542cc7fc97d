package org.dxworks.dacframe.analyzer.sql.body;

public enum TokenKind {
    IDENTIFIER,
    BRACKETED_IDENTIFIER,  // [name] or "name"
    KEYWORD,
    PUNCTUATION,
    LITERAL,
    AT_VARIABLE,  // @name or @@name
    WHITESPACE,
    COMMENT
}
