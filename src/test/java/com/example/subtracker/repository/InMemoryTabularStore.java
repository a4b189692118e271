package com.example.subtracker.repository;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Grid held in memory, with the same read and write contract as a spreadsheet tab.
 */
public class InMemoryTabularStore implements TabularStore {

    private final String id;
    private final List<List<String>> grid = new ArrayList<>();
    private final AtomicInteger writes = new AtomicInteger();
    private final AtomicReference<Runnable> beforeNextRead = new AtomicReference<>();
    private volatile RuntimeException readFailure;

    public InMemoryTabularStore(String id) {
        this.id = id;
    }

    public static InMemoryTabularStore withHeader(String id, LedgerSchema schema) {
        InMemoryTabularStore store = new InMemoryTabularStore(id);
        store.writeRow(1, schema.columns());
        store.writes.set(0);
        return store;
    }

    @Override
    public String id() {
        return id;
    }

    /**
     * Every subsequent read throws {@code failure}, as an unreachable or deleted sheet would.
     */
    public void failReadsWith(RuntimeException failure) {
        this.readFailure = failure;
    }

    /**
     * Runs {@code action} once, at the start of the next read, on the reading thread.
     */
    public void beforeNextRead(Runnable action) {
        beforeNextRead.set(action);
    }

    @Override
    public List<List<String>> readAll() {
        Runnable action = beforeNextRead.getAndSet(null);
        if (action != null) {
            action.run();
        }
        if (readFailure != null) {
            throw readFailure;
        }
        return snapshot();
    }

    private synchronized List<List<String>> snapshot() {
        List<List<String>> copy = new ArrayList<>();
        for (List<String> row : grid) {
            copy.add(new ArrayList<>(row));
        }
        return copy;
    }

    @Override
    public synchronized void writeRow(int rowNumber, List<String> values) {
        while (grid.size() < rowNumber) {
            grid.add(new ArrayList<>());
        }
        grid.set(rowNumber - 1, new ArrayList<>(values));
        writes.incrementAndGet();
    }

    public synchronized List<String> row(int rowNumber) {
        return rowNumber <= grid.size() ? List.copyOf(grid.get(rowNumber - 1)) : List.of();
    }

    public synchronized int rowCount() {
        return grid.size();
    }

    public int writeCount() {
        return writes.get();
    }
}
