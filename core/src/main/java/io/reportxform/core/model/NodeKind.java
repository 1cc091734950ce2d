package io.reportxform.core.model;

/** The closed set of expression tree node kinds. */
public enum NodeKind {
    LITERAL,
    FIELD_REFERENCE,
    PARAMETER_REFERENCE,
    GLOBAL_REFERENCE,
    BINARY_OPERATION,
    UNARY_OPERATION,
    FUNCTION_CALL,
    CONDITIONAL,
    AGGREGATE
}
