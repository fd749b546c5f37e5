package com.telcobright.searchagg.bucket;

/**
 * A bucket contribution does not fit the running buckets it was merged into.
 */
public class BucketMergeException extends Exception {

    public BucketMergeException(String message) {
        super(message);
    }

    public BucketMergeException(String message, Throwable cause) {
        super(message, cause);
    }
}
