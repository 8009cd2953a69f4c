package net.kinvault.e2ee.state;

import net.kinvault.e2ee.MutableClock;
import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class ExpiringCacheTest {

    @Test
    public void testEvictsOldestWhenFull() {
        List<String> evicted = new ArrayList<>();
        ExpiringCache<String, Integer> cache = new ExpiringCache<>(2, Duration.ofHours(1), new MutableClock(),
            (key, value) -> evicted.add(key));

        cache.put("a", 1);
        cache.put("b", 2);
        cache.put("c", 3);

        assertEquals(2, cache.size());
        assertNull(cache.get("a"));
        assertEquals(Integer.valueOf(3), cache.get("c"));
        assertEquals(Arrays.asList("a"), evicted);
    }

    @Test
    public void testEntriesExpire() {
        MutableClock clock = new MutableClock();
        List<String> evicted = new ArrayList<>();
        ExpiringCache<String, Integer> cache = new ExpiringCache<>(10, Duration.ofMinutes(5), clock,
            (key, value) -> evicted.add(key));

        cache.put("old", 1);
        clock.advance(Duration.ofMinutes(3));
        cache.put("new", 2);
        clock.advance(Duration.ofMinutes(3));

        assertEquals(1, cache.purgeExpired());
        assertNull(cache.get("old"));
        assertEquals(Integer.valueOf(2), cache.get("new"));
        assertEquals(Arrays.asList("old"), evicted);
    }

    @Test
    public void testRemoveDoesNotNotify() {
        List<String> evicted = new ArrayList<>();
        ExpiringCache<String, Integer> cache = new ExpiringCache<>(10, Duration.ofMinutes(5), new MutableClock(),
            (key, value) -> evicted.add(key));

        cache.put("a", 1);

        assertEquals(Integer.valueOf(1), cache.remove("a"));
        assertEquals(0, cache.size());
        assertEquals(0, evicted.size());
    }

    @Test
    public void testRestoredTimestampsKeepAge() {
        MutableClock clock = new MutableClock();
        ExpiringCache<String, Integer> cache = new ExpiringCache<>(10, Duration.ofMinutes(5), clock);

        cache.putAt("restored", 1, clock.millis() - Duration.ofMinutes(6).toMillis());
        cache.put("fresh", 2);

        assertNull(cache.get("restored"));
        assertEquals(Integer.valueOf(2), cache.get("fresh"));
    }
}
