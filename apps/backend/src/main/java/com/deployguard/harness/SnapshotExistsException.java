package com.deployguard.harness;

public class SnapshotExistsException extends RuntimeException {
    public SnapshotExistsException(String name) {
        super("Snapshot '" + name + "' already exists; use update to accept a new value");
    }
}
