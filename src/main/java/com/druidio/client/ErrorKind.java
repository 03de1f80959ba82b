package com.druidio.client;

/**
 * Why a query failed. Callers should treat values they do not know about like {@link #UNKNOWN}.
 */
public enum ErrorKind {
    /** The request could not be sent or the response body could not be read. */
    TRANSPORT,
    /** The query could not be written as JSON. */
    SERIALIZATION,
    /** The broker answered with an error object. */
    SERVER,
    /** The broker's answer did not have the expected shape. */
    RESPONSE_PARSING,
    UNKNOWN
}
