/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rollup.api.exceptions;

/**
 * Exception thrown when a rollup configuration cannot be compiled.
 *
 * This is a RuntimeException to avoid forcing checked exception handling
 * throughout the codebase. Every instance carries an {@link ErrorCode} so callers
 * can tell configuration mistakes apart without parsing messages. A compilation
 * failure is never partial: no params are produced.
 */
public class CompilationException extends RuntimeException {

    /**
     * Reason a configuration was rejected.
     */
    public enum ErrorCode {
        /** An element the compiler does not recognise. */
        UNKNOWN_CONFIG_KEY,
        /** A pattern declares neither a function nor a retention. */
        MISSING_RULE_BODY,
        /** The default pattern declares a rule_type other than {@code all}. */
        INVALID_DEFAULT_RULE_TYPE,
        /** The aggregate function allocates arena memory per row. */
        UNSUPPORTED_FUNCTION,
        /** Age and precision of two retentions do not grow together. */
        INCONSISTENT_RETENTION_ORDERING,
        /** A tagged_map term uses an operator other than =, =~, != or !=~. */
        UNKNOWN_TERM_OPERATOR,
        /** The configuration root element is absent. */
        MISSING_CONFIG_SECTION,
        /** rule_type is not one of all, plain, tagged, tagged_map. */
        INVALID_RULE_TYPE,
        /** A regexp does not compile. */
        INVALID_REGEX,
        /** The aggregate function name is not known to the resolver. */
        UNKNOWN_AGGREGATE_FUNCTION,
        /** A value has the wrong shape (not a number, out of range, malformed). */
        INVALID_CONFIG_VALUE
    }

    private final ErrorCode errorCode;

    public CompilationException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CompilationException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
