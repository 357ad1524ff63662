package cache;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import Engine.SimState;
import utils.Log;

/**
 * Memo table of {@link Cached} results, owned by one construction context.
 * Entries are bucketed by token hash and told apart by token inside a bucket.
 * Not thread safe: a context is only ever driven by one thread.
 */
public class IdentityCache<T> {

    private static final class Entry<T> {
        private final long token;
        private final T result;

        Entry(long token, T result) {
            this.token = token;
            this.result = result;
        }
    }

    private final String name;
    private final Map<Integer, List<Entry<T>>> buckets = new HashMap<>();

    private long hitCount = 0;
    private long missCount = 0;

    public IdentityCache(String name) {
        this.name = name;
    }

    /**
     * Runs {@code f} against {@code st} the first time its token is seen and
     * returns the stored result afterwards.
     */
    public T uncache(Cached<T> f, SimState st) {
        int h = f.bucket();
        List<Entry<T>> bucket = buckets.get(h);
        if (bucket != null) {
            for (Entry<T> e : bucket) {
                if (e.token == f.getToken()) {
                    hitCount++;
                    return e.result;
                }
            }
        }
        missCount++;
        // the computation may itself observe other cached values, so look the bucket up again afterwards
        T r = f.run(st);
        if (r == null) {
            throw new IllegalStateException(name + ": cached computation " + f + " produced no result");
        }
        buckets.computeIfAbsent(h, k -> new ArrayList<>()).add(new Entry<>(f.getToken(), r));
        return r;
    }

    public int size() {
        int n = 0;
        for (List<Entry<T>> b : buckets.values()) {
            n += b.size();
        }
        return n;
    }

    public long getHitCount() {
        return hitCount;
    }

    public long getMissCount() {
        return missCount;
    }

    public String getCacheStats() {
        long total = hitCount + missCount;
        double hitRate = total > 0 ? (double) hitCount / total * 100 : 0;
        return String.format("%s[size=%d, hits=%d, misses=%d, hitRate=%.2f%%]",
                name, size(), hitCount, missCount, hitRate);
    }

    public void logStats() {
        Log.debug(getCacheStats());
    }
}
