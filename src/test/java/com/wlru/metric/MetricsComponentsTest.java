package com.wlru.metric;

import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.*;

class MetricsComponentsTest
{
    @Nested
    class CounterBehavior
    {
        // Bu test sayaç artışının ve toplamanın değeri doğru güncellediğini doğrular.
        @Test
        void counter_handles_increment_and_add()
        {
            Counter counter = new Counter("cache_hits");
            counter.inc();
            counter.add(4);
            assertEquals(5, counter.get());
            assertEquals("cache_hits", counter.name());
        }
    }

    @Nested
    class TimerBehavior
    {
        // Bu test süre kayıtlarının istatistiklere yansıtıldığını gösterir.
        @Test
        void timer_aggregates_durations_into_statistics()
        {
            Timer timer = new Timer("cache_get", 128);
            timer.record(1_000);
            timer.record(2_000);
            timer.record(3_000);
            Timer.Sample sample = timer.snapshot();
            assertEquals("cache_get", sample.name());
            assertEquals(3, sample.count());
            assertEquals(6_000, sample.totalNs());
            assertEquals(1_000, sample.minNs());
            assertEquals(3_000, sample.maxNs());
            assertEquals(2_000.0, sample.avgNs());
            assertEquals(2_000, sample.p50Ns());
        }

        // Bu test hiç kayıt yokken yüzdeliklerin sıfır olduğunu doğrular.
        @Test
        void empty_timer_reports_zeroes()
        {
            Timer.Sample sample = new Timer("idle").snapshot();
            assertEquals(0, sample.count());
            assertEquals(0, sample.minNs());
            assertEquals(0, sample.maxNs());
            assertEquals(0, sample.p95Ns());
        }

        // Bu test halka tampon dolduğunda yüzdeliklerin yalnızca son kayıtlardan hesaplandığını gösterir.
        @Test
        void reservoir_keeps_latest_samples()
        {
            Timer timer = new Timer("cache_put", 128);
            for (int i = 0; i < 128; i++) timer.record(1);
            for (int i = 0; i < 128; i++) timer.record(500);
            Timer.Sample sample = timer.snapshot();
            assertEquals(256, sample.count());
            assertEquals(500, sample.p50Ns());
            assertEquals(1, sample.minNs());
        }
    }

    @Nested
    class RegistryBehavior
    {
        // Bu test aynı isim için aynı sayaç ve zamanlayıcının döndüğünü doğrular.
        @Test
        void registry_reuses_components_with_same_name()
        {
            MetricsRegistry registry = new MetricsRegistry();
            assertSame(registry.counter("cache_hits"), registry.counter("cache_hits"));
            assertSame(registry.timer("cache_get"), registry.timer("cache_get"));
            assertTrue(registry.counters().containsKey("cache_hits"));
            assertTrue(registry.timers().containsKey("cache_get"));
        }

        // Bu test anlık görüntülerin isim sırasına göre döndüğünü gösterir.
        @Test
        void snapshots_are_sorted_by_name()
        {
            MetricsRegistry registry = new MetricsRegistry();
            registry.counter("cache_misses").add(2);
            registry.counter("cache_evictions").inc();
            registry.timer("cache_put").record(10);
            registry.timer("cache_get").record(20);

            SortedMap<String, Long> counters = registry.counterValues();
            assertEquals(List.of("cache_evictions", "cache_misses"), List.copyOf(counters.keySet()));
            assertEquals(2L, counters.get("cache_misses"));

            List<Timer.Sample> samples = registry.timerSamples();
            assertEquals("cache_get", samples.get(0).name());
            assertEquals("cache_put", samples.get(1).name());
        }
    }

    @Nested
    class ReporterBehavior
    {
        // Bu test geçerli aralıkla başlatılan raporlayıcının çalıştığını ve kapatılınca durduğunu doğrular.
        @Test
        void reporter_runs_with_valid_interval()
        {
            MetricsRegistry registry = new MetricsRegistry();
            Vertx vertx = Vertx.vertx();
            WorkerExecutor worker = vertx.createSharedWorkerExecutor("metrics-test");
            try
            {
                MetricsReporter reporter = new MetricsReporter(registry, 1, vertx, worker);
                reporter.start(1);
                assertTrue(reporter.isRunning());
                reporter.start(1);
                assertTrue(reporter.isRunning());
                reporter.close();
                assertFalse(reporter.isRunning());
            }
            finally
            {
                worker.close();
                vertx.close().toCompletionStage().toCompletableFuture().join();
            }
        }

        // Bu test geçersiz aralıkta raporlayıcının başlamadığını gösterir.
        @Test
        void reporter_ignores_invalid_interval()
        {
            MetricsRegistry registry = new MetricsRegistry();
            Vertx vertx = Vertx.vertx();
            WorkerExecutor worker = vertx.createSharedWorkerExecutor("metrics-test");
            try
            {
                MetricsReporter reporter = new MetricsReporter(registry, 0, vertx, worker);
                reporter.start(0);
                assertFalse(reporter.isRunning());
            }
            finally
            {
                worker.close();
                vertx.close().toCompletionStage().toCompletableFuture().join();
            }
        }

        // Bu test döküm işleminin dolu bir kayıtla hatasız çalıştığını doğrular.
        @Test
        void dump_logs_registry_contents()
        {
            MetricsRegistry registry = new MetricsRegistry();
            registry.counter("cache_hits").inc();
            registry.timer("cache_get").record(1_500);
            MetricsReporter reporter = new MetricsReporter(registry, 0, null, null);
            assertDoesNotThrow(reporter::dump);
        }
    }
}
