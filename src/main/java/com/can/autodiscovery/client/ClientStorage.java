package com.can.autodiscovery.client;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * İstemci önbelleğinin tutamacı sakladığı yer. Her kayıt, istemcinin hangi
 * üyelik neslinden kurulduğunu da taşır.
 */
public interface ClientStorage
{
    Entry get();

    void set(Entry entry);

    /**
     * Kaydı kaldırır ve kaldırılan kaydı döndürür.
     */
    Entry clear();

    /**
     * Kayıt hâlâ {@code expected} ise kaldırır.
     */
    boolean remove(Entry expected);

    /**
     * Bu depoda tutulan bütün kayıtları kaldırıp döndürür; thread kapsamında
     * başka thread'lerin, sonlanmış olanlar da dahil, kayıtlarını içerir.
     */
    List<Entry> clearAll();

    boolean isShared();

    record Entry(MemcachedClient client, long generation)
    {
        public Entry
        {
            Objects.requireNonNull(client, "client");
        }
    }

    final class Shared implements ClientStorage
    {
        private final AtomicReference<Entry> entry = new AtomicReference<>();

        @Override
        public Entry get()
        {
            return entry.get();
        }

        @Override
        public void set(Entry value)
        {
            entry.set(value);
        }

        @Override
        public Entry clear()
        {
            return entry.getAndSet(null);
        }

        @Override
        public boolean remove(Entry expected)
        {
            return entry.compareAndSet(expected, null);
        }

        @Override
        public List<Entry> clearAll()
        {
            Entry previous = clear();
            return previous == null ? List.of() : List.of(previous);
        }

        @Override
        public boolean isShared()
        {
            return true;
        }
    }

    /**
     * Her thread kendi kaydını görür. Kayıtlar ayrıca ortak bir kümede izlenir ki
     * kapatma sırasında hangi thread'e ait olursa olsun hepsine ulaşılabilsin.
     */
    final class PerThread implements ClientStorage
    {
        private final ThreadLocal<Entry> entry = new ThreadLocal<>();
        private final Set<Entry> live = ConcurrentHashMap.newKeySet();

        @Override
        public Entry get()
        {
            return entry.get();
        }

        @Override
        public void set(Entry value)
        {
            Entry previous = entry.get();
            if (previous != null) {
                live.remove(previous);
            }
            entry.set(value);
            live.add(value);
        }

        @Override
        public Entry clear()
        {
            Entry previous = entry.get();
            entry.remove();
            if (previous != null) {
                live.remove(previous);
            }
            return previous;
        }

        @Override
        public boolean remove(Entry expected)
        {
            if (entry.get() != expected) {
                return false;
            }
            clear();
            return true;
        }

        @Override
        public List<Entry> clearAll()
        {
            entry.remove();
            List<Entry> drained = new ArrayList<>();
            for (Entry tracked : live) {
                if (live.remove(tracked)) {
                    drained.add(tracked);
                }
            }
            return drained;
        }

        @Override
        public boolean isShared()
        {
            return false;
        }
    }
}
