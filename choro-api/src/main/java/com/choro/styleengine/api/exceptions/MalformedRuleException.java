/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.api.exceptions;

/**
 * Thrown when a style document contains an invalid rule: an unknown operator, a non-numeric
 * threshold, a malformed colour code, and so on.
 *
 * <p>Loading is aborted on the first malformed rule. A broken style must not render silently.
 */
public class MalformedRuleException extends RuntimeException {

    public MalformedRuleException(String message) {
        super(message);
    }

    public MalformedRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
