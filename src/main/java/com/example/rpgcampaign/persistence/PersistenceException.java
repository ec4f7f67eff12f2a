package com.example.rpgcampaign.persistence;

/**
 * A storage operation failed (database unreachable, schema problem, ...).
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
