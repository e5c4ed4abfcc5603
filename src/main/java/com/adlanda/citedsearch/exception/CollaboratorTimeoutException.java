package com.adlanda.citedsearch.exception;

import java.time.Duration;

/**
 * A call to the embedding model, the vector index or the generation model
 * did not complete within its deadline.
 */
public class CollaboratorTimeoutException extends CitedSearchException {

    private final String collaborator;
    private final Duration timeout;

    public CollaboratorTimeoutException(String collaborator, Duration timeout) {
        super(collaborator + " call timed out after " + timeout.toMillis() + "ms");
        this.collaborator = collaborator;
        this.timeout = timeout;
    }

    public String getCollaborator() {
        return collaborator;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
