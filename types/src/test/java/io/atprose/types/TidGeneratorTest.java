package io.atprose.types;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TidGenerator")
class TidGeneratorTest {

    private static final Clock FROZEN = Clock.fixed(Instant.ofEpochSecond(1_707_228_000L), ZoneOffset.UTC);

    @Test
    @DisplayName("stamps the clock time and clock id")
    void stampsClock() {
        TidGenerator generator = new TidGenerator(FROZEN, 511);

        assertThat(generator.next().toString()).isEqualTo("3kkqvzbva22jz");
        assertThat(generator.clockId()).isEqualTo(511);
    }

    @Test
    @DisplayName("advances past a stalled clock")
    void advancesPastStalledClock() {
        TidGenerator generator = new TidGenerator(FROZEN, 7);

        Tid first = generator.next();
        Tid second = generator.next();

        assertThat(second).isGreaterThan(first);
        assertThat(second.timestampMicros()).isEqualTo(first.timestampMicros() + 1);
        assertThat(second.clockId()).isEqualTo(7);
    }

    @Test
    @DisplayName("rejects clock ids outside 0..1023")
    void rejectsBadClockId() {
        assertThatThrownBy(() -> new TidGenerator(FROZEN, 1024)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TidGenerator(FROZEN, -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("never repeats under concurrent use")
    void uniqueUnderConcurrency() throws Exception {
        TidGenerator generator = new TidGenerator();
        Set<Tid> seen = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 1000; i++) {
                        seen.add(generator.next());
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(seen).hasSize(4000);
    }
}
