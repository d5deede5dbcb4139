package com.wlru.config;

import com.wlru.codec.StringCodec;
import com.wlru.core.WeightedLruCache;
import com.wlru.core.WeigherType;
import com.wlru.metric.MetricsRegistry;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

/**
 * CDI tarafından yönetilen bu yapılandırma sınıfı, ağırlıklı LRU önbelleğini,
 * metrik kaydını ve metrik raporlaması için kullanılan worker executor'ı
 * tekil bean olarak üretir. {@link Vertx} örneği quarkus-vertx eklentisinden
 * gelir. Değerler {@link AppProperties} üzerinden okunur; uygulama kapanırken
 * üretilen kaynaklar serbest bırakılır.
 */
@ApplicationScoped
public class AppConfig {

    private static final Logger LOG = Logger.getLogger(AppConfig.class);

    private final AppProperties properties;

    @Inject
    public AppConfig(AppProperties properties) {
        this.properties = properties;
    }

    @Produces
    @Singleton
    public WorkerExecutor metricsWorkerExecutor(Vertx vertx)
    {
        return vertx.createSharedWorkerExecutor("wlru-metrics", Math.max(1, properties.metrics().workerThreads()));
    }

    void disposeWorkerExecutor(@Disposes WorkerExecutor workerExecutor)
    {
        workerExecutor.close();
    }

    @Produces
    @Singleton
    public MetricsRegistry metricsRegistry() {
        return new MetricsRegistry();
    }

    @Produces
    @Singleton
    public WeightedLruCache<String, String> weightedLruCache(MetricsRegistry metrics)
    {
        var cacheProps = properties.cache();
        WeigherType weigher = WeigherType.fromConfig(cacheProps.weigher());
        WeightedLruCache<String, String> cache = WeightedLruCache.<String, String>builder()
                .capacity(cacheProps.capacity())
                .initialSlots(cacheProps.initialSlots())
                .weigher(weigher.create(StringCodec.UTF8, StringCodec.UTF8))
                .metrics(metrics)
                .build();
        LOG.infof("Weighted LRU cache ready: capacity=%d weigher=%s", cache.capacity(), weigher);
        return cache;
    }

    void disposeWeightedLruCache(@Disposes WeightedLruCache<String, String> cache)
    {
        LOG.debugf("Releasing %d cache entries (weight %d)", cache.count(), cache.weight());
        cache.clear();
    }
}
