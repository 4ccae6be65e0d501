package com.proposalbus.bus;

import java.util.List;
import java.util.Optional;

/**
 * Append-only record of published events, kept for observers and replay-style checks.
 */
public interface EventJournal {

    JournalEntry append(BusEvent event);

    List<JournalEntry> query(Optional<String> type, int limit);

    List<JournalEntry> queryAfter(long sequenceExclusive, int limit);

    long getLatestSequence();
}
