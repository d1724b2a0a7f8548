package com.fastalert.exception.guard;

public class DownstreamBulkheadFullException extends RuntimeException {
    public DownstreamBulkheadFullException(String integration, Throwable cause) { super("downstream bulkhead full: " + integration, cause); }
}
