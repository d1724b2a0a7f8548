package com.fastalert.exception.guard;

public class DownstreamRateLimitedException extends RuntimeException {
    public DownstreamRateLimitedException(String integration, Throwable cause) { super("downstream rate limited: " + integration, cause); }
}
