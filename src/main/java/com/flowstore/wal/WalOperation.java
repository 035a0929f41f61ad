package com.flowstore.wal;

/**
 * Mutating operations recorded in the write-ahead log.
 */
public enum WalOperation {
    SET,
    DELETE
}
