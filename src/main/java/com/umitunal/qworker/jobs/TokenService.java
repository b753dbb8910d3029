package com.umitunal.qworker.jobs;

/**
 * Issues verification tokens and delivers them to the user.
 *
 * <p>Implementations may fail transiently (mail relay down, database busy);
 * such failures are retried by the worker.
 */
@FunctionalInterface
public interface TokenService {

    /**
     * Create a token for a user and send it to the given identifier.
     *
     * @param userId the user the token belongs to
     * @param identifier where the token is sent, e.g. an email address
     * @param context request context such as the client IP, may be null
     * @return the issued token
     */
    String createToken(String userId, String identifier, String context);
}
