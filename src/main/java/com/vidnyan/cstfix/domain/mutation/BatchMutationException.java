package com.vidnyan.cstfix.domain.mutation;

/**
 * A batch could not be committed. Nothing from the batch was applied.
 */
public class BatchMutationException extends RuntimeException {

    public BatchMutationException(String message) {
        super(message);
    }

    public BatchMutationException(String message, Throwable cause) {
        super(message, cause);
    }
}
