package com.example.sqlgate.parse;

import com.example.sqlgate.model.ParsedStatement;

/**
 * Parser capability consumed by the gate. Implementations must reject anything that is not
 * exactly one statement.
 */
public interface SqlParser {

    ParsedStatement parse(String sql) throws SqlParseException;
}
