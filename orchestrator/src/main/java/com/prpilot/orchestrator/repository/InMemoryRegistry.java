package com.prpilot.orchestrator.repository;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Id-keyed, process-lifetime store. Records are inserted once and looked up
 * by id; there is no scan-and-mutate API, so writers never race each other
 * over a shared record.
 */
public abstract class InMemoryRegistry<T> {

    private final ConcurrentMap<String, T> records = new ConcurrentHashMap<>();
    private final IdGenerator ids;
    private final String      prefix;

    protected InMemoryRegistry(IdGenerator ids, String prefix) {
        this.ids    = ids;
        this.prefix = prefix;
    }

    /** Allocates a fresh id, builds the record with it and stores it. */
    public T create(Function<String, T> factory) {
        while (true) {
            String id = ids.next(prefix);
            if (records.containsKey(id)) {
                continue;
            }
            T record = factory.apply(id);
            if (records.putIfAbsent(id, record) == null) {
                try {
                    onCreated(id, record);
                } catch (RuntimeException e) {
                    records.remove(id);
                    throw e;
                }
                return record;
            }
        }
    }

    public Optional<T> findById(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(records.get(id));
    }

    public int size() {
        return records.size();
    }

    protected void onCreated(String id, T record) {}
}
