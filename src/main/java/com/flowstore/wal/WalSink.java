package com.flowstore.wal;

import java.util.List;

/**
 * Downstream consumer of WAL entries, such as a durable backend.
 * Entries are delivered in id order; a batch counts as consumed only if
 * {@link #accept} returns normally.
 */
@FunctionalInterface
public interface WalSink {

    void accept(List<WalEntry> batch) throws Exception;
}
