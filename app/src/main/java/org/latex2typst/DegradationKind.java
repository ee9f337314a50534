package org.latex2typst;

public enum DegradationKind {
    UNKNOWN_COMMAND,
    UNKNOWN_ENVIRONMENT,
    PARSE_ERROR,
    UNSUPPORTED_FEATURE,
    // a definition command whose arguments did not fit its grammar
    MACRO_DEFINITION,
    // \left ... \right with a delimiter missing
    DELIMITER_MISMATCH,
    // content under a row span, short rows, spans wider than the table
    TABLE_STRUCTURE,
    OTHER
}
