package org.searchclient.serialization;

/**
 * Output style used when writing JSON.
 */
public enum SerializationFormatting {
    /** No extraneous whitespace. */
    NONE,
    /** Multi-line, human readable output. */
    INDENTED
}
