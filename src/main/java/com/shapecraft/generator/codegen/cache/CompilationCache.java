package com.shapecraft.generator.codegen.cache;

import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

import com.shapecraft.generator.codegen.model.CallSite;
import com.shapecraft.generator.codegen.model.CallSiteKey;
import com.shapecraft.generator.codegen.shape.AnalyzedCallSite;

/**
 * Memo table of analysed call sites, keyed by value. Owned by whoever drives
 * the generator and handed to each run; a changed call site, schema or
 * generator setting yields a different key, so stale entries are never served.
 *
 * Each compilation retains only the keys it used, so the table holds at most
 * one entry per live call site.
 */
public class CompilationCache {

    private final Map<CallSiteKey, AnalyzedCallSite> entries = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public AnalyzedCallSite computeIfAbsent(CallSiteKey key, CallSite site,
                                            Function<CallSite, AnalyzedCallSite> analysis) {
        AnalyzedCallSite cached = entries.get(key);
        if (cached != null) {
            hits.incrementAndGet();
            return cached;
        }
        misses.incrementAndGet();
        return entries.computeIfAbsent(key, k -> analysis.apply(site));
    }

    /**
     * Evicts every entry whose key is not in {@code live}.
     *
     * @return number of evicted entries
     */
    public int retainOnly(Collection<CallSiteKey> live) {
        int before = entries.size();
        entries.keySet().retainAll(live instanceof Set ? live : new HashSet<>(live));
        return before - entries.size();
    }

    public int size() {
        return entries.size();
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public void clear() {
        entries.clear();
    }
}
