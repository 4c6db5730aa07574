package in.greenhouse.support;

import in.greenhouse.application.port.output.FastCache;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed cache. TTLs are recorded but never expire entries.
 */
public final class InMemoryFastCache implements FastCache {
    private final Map<String, String> values = new ConcurrentHashMap<>();
    private final Map<String, LinkedList<String>> lists = new ConcurrentHashMap<>();
    private final Map<String, Duration> ttls = new ConcurrentHashMap<>();
    private volatile boolean failing = false;

    /** Make every call throw, to exercise degraded paths. */
    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public Optional<Duration> ttlOf(String key) {
        return Optional.ofNullable(ttls.get(key));
    }

    public boolean contains(String key) {
        return values.containsKey(key) || lists.containsKey(key);
    }

    public void clear() {
        values.clear();
        lists.clear();
        ttls.clear();
    }

    private void check() {
        if (failing) {
            throw new IllegalStateException("cache unavailable");
        }
    }

    @Override
    public Optional<String> get(String key) {
        check();
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(String key, String value) {
        check();
        values.put(key, value);
        ttls.remove(key);
    }

    @Override
    public void setWithTtl(String key, String value, Duration ttl) {
        check();
        values.put(key, value);
        ttls.put(key, ttl);
    }

    @Override
    public void delete(String key) {
        check();
        values.remove(key);
        lists.remove(key);
        ttls.remove(key);
    }

    @Override
    public void expire(String key, Duration ttl) {
        check();
        ttls.put(key, ttl);
    }

    @Override
    public synchronized void listPush(String key, String value) {
        check();
        lists.computeIfAbsent(key, k -> new LinkedList<>()).addFirst(value);
    }

    @Override
    public synchronized void listTrim(String key, long start, long stop) {
        check();
        LinkedList<String> list = lists.get(key);
        if (list == null) {
            return;
        }
        List<String> kept = slice(list, start, stop);
        list.clear();
        list.addAll(kept);
    }

    @Override
    public synchronized List<String> listRange(String key, long start, long stop) {
        check();
        LinkedList<String> list = lists.get(key);
        return list == null ? List.of() : slice(list, start, stop);
    }

    private static List<String> slice(List<String> list, long start, long stop) {
        int size = list.size();
        int from = (int) (start < 0 ? Math.max(0, size + start) : Math.min(start, size));
        int to = (int) (stop < 0 ? size + stop : Math.min(stop, size - 1));
        if (to < from) {
            return new ArrayList<>();
        }
        return new ArrayList<>(list.subList(from, to + 1));
    }
}
