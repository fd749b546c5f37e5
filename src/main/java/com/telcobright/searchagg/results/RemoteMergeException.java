package com.telcobright.searchagg.results;

/**
 * A peer node's partial result could not be merged. State merged before the failing step
 * is kept.
 */
public class RemoteMergeException extends Exception {

    public RemoteMergeException(String message) {
        super(message);
    }

    public RemoteMergeException(String message, Throwable cause) {
        super(message, cause);
    }
}
