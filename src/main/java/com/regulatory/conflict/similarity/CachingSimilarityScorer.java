package com.regulatory.conflict.similarity;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.regulatory.conflict.core.model.NormativeProvision;
import com.regulatory.conflict.core.model.PairKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Caffeine-backed cache in front of a {@link SimilarityScorer}, keyed by the unordered pair.
 *
 * <p>Only available scores are cached; an unavailable pair is asked again on the next
 * call. The delegate always receives the pair in normalized order, so {@code score(a, b)}
 * and {@code score(b, a)} return the same value.</p>
 */
public class CachingSimilarityScorer implements SimilarityScorer {
    private static final Logger log = LoggerFactory.getLogger(CachingSimilarityScorer.class);

    private final SimilarityScorer delegate;
    private final Cache<PairKey, SimilarityScore> cache;
    // Secondary index: provisionId -> cached pairs that include it
    private final ConcurrentMap<String, Set<PairKey>> provisionIndex = new ConcurrentHashMap<>();

    public CachingSimilarityScorer(SimilarityScorer delegate, long maximumSize, Duration ttl) {
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(ttl)
                .recordStats()
                .removalListener((PairKey key, SimilarityScore value, RemovalCause cause) -> {
                    if (key != null && cause.wasEvicted()) {
                        removeFromIndex(key);
                    }
                })
                .build();
        log.info("CachingSimilarityScorer initialized: maxSize={}, ttl={}", maximumSize, ttl);
    }

    @Override
    public Optional<SimilarityScore> score(NormativeProvision a, NormativeProvision b) {
        PairKey key = PairKey.of(a.getId(), b.getId());
        SimilarityScore cached = cache.getIfPresent(key);
        if (cached != null) {
            return Optional.of(cached);
        }
        NormativeProvision first = key.first().equals(a.getId()) ? a : b;
        NormativeProvision second = first == a ? b : a;
        Optional<SimilarityScore> scored = delegate.score(first, second);
        scored.ifPresent(s -> {
            cache.put(key, s);
            provisionIndex.computeIfAbsent(key.first(), k -> ConcurrentHashMap.newKeySet()).add(key);
            provisionIndex.computeIfAbsent(key.second(), k -> ConcurrentHashMap.newKeySet()).add(key);
        });
        return scored;
    }

    /**
     * Drops every cached score involving the provision, for use when its text changes.
     */
    public void invalidate(String provisionId) {
        Set<PairKey> keys = provisionIndex.remove(provisionId);
        if (keys != null) {
            keys.forEach(cache::invalidate);
            log.debug("Invalidated {} similarity entries for provision {}", keys.size(), provisionId);
        }
    }

    public void invalidateAll() {
        cache.invalidateAll();
        provisionIndex.clear();
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    private void removeFromIndex(PairKey key) {
        Set<PairKey> first = provisionIndex.get(key.first());
        if (first != null) {
            first.remove(key);
        }
        Set<PairKey> second = provisionIndex.get(key.second());
        if (second != null) {
            second.remove(key);
        }
    }
}
