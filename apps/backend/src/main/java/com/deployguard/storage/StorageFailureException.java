package com.deployguard.storage;

/**
 * An append or read against the backing store failed. Always fatal for the run that hits it.
 */
public class StorageFailureException extends RuntimeException {

    private final String streamId;

    public StorageFailureException(String streamId, String message, Throwable cause) {
        super(message + " [stream=" + streamId + "]", cause);
        this.streamId = streamId;
    }

    public String getStreamId() {
        return streamId;
    }
}
