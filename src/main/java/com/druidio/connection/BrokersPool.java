package com.druidio.connection;

/**
 * Source of broker addresses ({@code host:port}) for outgoing queries.
 */
public interface BrokersPool {

    /**
     * Returns the broker the next query should go to. Safe to call from any thread.
     */
    String broker();
}
