package org.minihttp.http;

/** What a repeated header name does to the value already stored. */
public enum DuplicateHeaderPolicy {
    /** Values are joined with {@code ", "} in arrival order. */
    JOIN,
    /** The later value replaces the earlier one. */
    LAST_WINS
}
