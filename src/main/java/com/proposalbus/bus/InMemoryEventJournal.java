package com.proposalbus.bus;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded journal; once {@code capacity} is reached the oldest entries are evicted.
 */
public class InMemoryEventJournal implements EventJournal {

    private final Deque<JournalEntry> entries = new ArrayDeque<>();
    private final AtomicLong sequence = new AtomicLong(0);
    private final int capacity;

    public InMemoryEventJournal(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("journal capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized JournalEntry append(BusEvent event) {
        JournalEntry entry = new JournalEntry(sequence.incrementAndGet(), event);
        entries.addLast(entry);
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
        return entry;
    }

    @Override
    public synchronized List<JournalEntry> query(Optional<String> type, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        List<JournalEntry> result = new ArrayList<>();
        for (JournalEntry entry : entries) {
            if (type.map(t -> t.equals(entry.event().type())).orElse(true)) {
                result.add(entry);
                if (result.size() == limit) {
                    break;
                }
            }
        }
        return result;
    }

    @Override
    public synchronized List<JournalEntry> queryAfter(long sequenceExclusive, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        List<JournalEntry> result = new ArrayList<>();
        for (JournalEntry entry : entries) {
            if (entry.sequenceNumber() > sequenceExclusive) {
                result.add(entry);
                if (result.size() == limit) {
                    break;
                }
            }
        }
        return result;
    }

    @Override
    public long getLatestSequence() {
        return sequence.get();
    }
}
