package com.fastalert.exception.guard;

public class DownstreamOpenCircuitException extends RuntimeException {
    public DownstreamOpenCircuitException(String integration, Throwable cause) { super("downstream circuit open: " + integration, cause); }
}
