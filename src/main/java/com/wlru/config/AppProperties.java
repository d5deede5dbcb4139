package com.wlru.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * {@code application.properties} içindeki "app" önekli değerleri tip güvenli
 * biçimde sunan yapılandırma arayüzüdür. Önbellek kapasitesi, ağırlık
 * hesaplayıcısı ve metrik raporlama ayarları buradan okunur.
 */
@ConfigMapping(prefix = "app")
public interface AppProperties
{
    Cache cache();
    Metrics metrics();

    interface Cache {
        @WithDefault("1048576")
        long capacity();

        @WithDefault("UTF8_BYTES")
        String weigher();

        @WithDefault("16")
        int initialSlots();
    }

    interface Metrics {
        @WithDefault("5")
        long reportIntervalSeconds();

        @WithDefault("1")
        int workerThreads();
    }
}
