package org.dcbpoker.service.poker.registry;

import org.dcbpoker.model.poker.PokerTable;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/** Live tables, in memory only. */
@Service
public class TableRegistry {
    private final Map<Long, PokerTable> tables = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public PokerTable register(PokerTable t) {
        if (t.getId() == null) t.setId(sequence.incrementAndGet());
        tables.put(t.getId(), t);
        return t;
    }

    public PokerTable get(Long id) {
        PokerTable t = id == null ? null : tables.get(id);
        if (t == null) throw new IllegalArgumentException("Table inconnue: " + id);
        return t;
    }

    public Collection<PokerTable> all() { return tables.values(); }

    public void remove(Long id) { tables.remove(id); }
}
