package com.can.autodiscovery.client;

import com.can.autodiscovery.membership.MembershipCache;
import com.can.autodiscovery.metric.Counter;
import com.can.autodiscovery.metric.MetricsRegistry;
import org.jboss.logging.Logger;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Güncel üyelikle kurulmuş {@link MemcachedClient} tutamacını saklar. Tutamaç
 * yoksa ya da saklanan tutamacın nesli üyelik önbelleğinin neslinden eskiyse
 * üyelik önbelleğinden alınan düğüm listesiyle yenisi kurulur; böylece bir
 * thread'in tetiklediği geçersiz kılma diğer thread'lerin eski tutamaçlarını da
 * devre dışı bırakır.
 *
 * <p>Bırakılan tutamaçlar hemen kapatılmaz, emekliye ayırma stratejisine
 * devredilir. Paylaşılan kapsamda kurulum örnek üzerinde serileştirilir.
 */
public final class ClientCache
{
    private static final Logger LOG = Logger.getLogger(ClientCache.class);

    private final MembershipCache membership;
    private final MemcachedClientFactory factory;
    private final ClientBehaviors behaviors;
    private final ClientStorage storage;
    private final Consumer<MemcachedClient> retirement;
    private final Counter constructions, retirements;

    public ClientCache(MembershipCache membership,
                       MemcachedClientFactory factory,
                       ClientBehaviors behaviors,
                       ClientStorage storage,
                       Consumer<MemcachedClient> retirement,
                       MetricsRegistry metrics)
    {
        this.membership = Objects.requireNonNull(membership, "membership");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.behaviors = Objects.requireNonNull(behaviors, "behaviors");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.retirement = Objects.requireNonNull(retirement, "retirement");
        if (metrics != null) {
            this.constructions = metrics.counter("client_constructions");
            this.retirements = metrics.counter("client_retirements");
        } else {
            this.constructions = this.retirements = null;
        }
    }

    public MemcachedClient getClient()
    {
        ClientStorage.Entry entry = storage.get();
        if (isCurrent(entry)) {
            return entry.client();
        }
        if (storage.isShared()) {
            synchronized (this) {
                entry = storage.get();
                if (isCurrent(entry)) {
                    return entry.client();
                }
                return rebuild(entry);
            }
        }
        return rebuild(entry);
    }

    public void invalidate()
    {
        ClientStorage.Entry entry = storage.clear();
        if (entry != null) {
            retire(entry.client());
        }
    }

    /**
     * Yalnızca {@code generation} neslinden önce kurulmuş tutamacı bırakır. Ortak
     * geçersiz kılma sırasında başka bir thread'in yeni üyelikle kurduğu tutamaç
     * böylece korunur.
     */
    public void invalidateBefore(long generation)
    {
        ClientStorage.Entry entry = storage.get();
        if (entry != null && entry.generation() < generation && storage.remove(entry)) {
            retire(entry.client());
        }
    }

    public boolean isPopulated()
    {
        return storage.get() != null;
    }

    /**
     * Depodaki bütün tutamaçları beklemeden kapatır. Thread kapsamında diğer
     * thread'lerin tutamaçları da kapatılır.
     */
    public void close()
    {
        for (ClientStorage.Entry entry : storage.clearAll()) {
            try {
                entry.client().close();
            } catch (RuntimeException e) {
                LOG.warnf(e, "Failed to close memcached client for nodes %s", entry.client().nodes());
            }
        }
    }

    private boolean isCurrent(ClientStorage.Entry entry)
    {
        return entry != null && entry.generation() == membership.generation();
    }

    private MemcachedClient rebuild(ClientStorage.Entry stale)
    {
        MembershipCache.Membership current = membership.current();
        MemcachedClient client = factory.create(current.nodes(), behaviors);
        storage.set(new ClientStorage.Entry(client, current.generation()));
        if (constructions != null) {
            constructions.inc();
        }
        LOG.debugf("Built memcached client for %d node(s) at membership generation %d",
                current.nodes().size(), current.generation());
        if (stale != null) {
            retire(stale.client());
        }
        return client;
    }

    private void retire(MemcachedClient client)
    {
        if (retirements != null) {
            retirements.inc();
        }
        try {
            retirement.accept(client);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to retire memcached client for nodes %s", client.nodes());
        }
    }
}
