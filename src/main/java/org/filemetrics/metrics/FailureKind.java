package org.filemetrics.metrics;

public enum FailureKind {
    FILE_NOT_FOUND,
    IO_ERROR,
    UNSUPPORTED_TYPE,
    DECODE_ERROR,
    UNEXPECTED_STRUCTURE,
    EMPTY_FILE,
    NO_DATA,
    NO_VALID_RECORDS,
    TIMEOUT,
    WORKER_FAULT,
    INTERRUPTED
}
