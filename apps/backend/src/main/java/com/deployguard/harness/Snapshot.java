package com.deployguard.harness;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/** One accepted version of a named value; {@code hash} is over its canonical JSON. */
public record Snapshot(String name, int version, String hash, Instant createdAt, JsonNode value) {}
