package com.system.allocator.schemas;

public enum AssignmentErrorType {
    INVALID_INPUT,
    ALGORITHM_ERROR
}
