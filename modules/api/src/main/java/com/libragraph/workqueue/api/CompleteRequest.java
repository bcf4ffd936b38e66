package com.libragraph.workqueue.api;

import com.fasterxml.jackson.databind.JsonNode;

/** Terminal {@code completed} write from a remote worker. */
public record CompleteRequest(String workerId, Integer claimGeneration, JsonNode result) {}
