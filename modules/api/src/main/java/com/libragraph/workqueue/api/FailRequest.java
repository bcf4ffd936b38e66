package com.libragraph.workqueue.api;

/**
 * Terminal {@code failed} write from a remote worker. A blank error is recorded as
 * {@code Unknown error}; a missing category is derived from the message.
 */
public record FailRequest(String workerId, Integer claimGeneration, String error, String errorCategory) {}
