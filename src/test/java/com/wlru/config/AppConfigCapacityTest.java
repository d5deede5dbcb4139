package com.wlru.config;

import com.wlru.core.WeightedLruCache;
import com.wlru.core.model.PutResult;
import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.junit.QuarkusTestProfile;
import io.quarkus.test.junit.TestProfile;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

@QuarkusTest
@TestProfile(AppConfigCapacityTest.SmallEntryCountProfile.class)
class AppConfigCapacityTest {

    @Inject
    WeightedLruCache<String, String> cache;

    @AfterEach
    void cleanup() {
        cache.clear();
    }

    @Nested
    class ConfiguredCache {
        /**
         * Konfigürasyonda verilen kapasite ve ağırlık hesaplayıcısı AppConfig tarafından önbelleğe aktarılır.
         * ENTRY_COUNT ile her girdi bir birim tuttuğundan üçüncü girdi en eskiyi çıkarmalıdır.
         */
        @Test
        void appliesCapacityAndWeigherFromConfig() {
            assertEquals(2, cache.capacity());
            assertEquals(PutResult.STORED, cache.put("a", "some long value"));
            assertEquals(PutResult.STORED, cache.put("b", "x"));
            assertEquals(PutResult.STORED, cache.put("c", "y"));
            assertNull(cache.get("a"));
            assertEquals(List.of("b", "c"), cache.keysInRecencyOrder());
        }
    }

    public static class SmallEntryCountProfile implements QuarkusTestProfile {

        public SmallEntryCountProfile() {
        }

        @Override
        public Map<String, String> getConfigOverrides() {
            return Map.of(
                    "app.cache.capacity", "2",
                    "app.cache.weigher", "entry-count",
                    "app.metrics.report-interval-seconds", "0"
            );
        }
    }
}
