package com.pipebroker.core;

/** What happens when no permitted source yields a value for a parameter. */
public enum NotFoundBehavior {
    THROW_EXCEPTION,
    USE_DEFAULT
}
