package com.tunechat.match.embed;

import com.tunechat.match.cache.CacheKeyUtil;
import com.tunechat.match.cache.TtlCache;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Read-through cache in front of an embedding source. Keys are derived from the case-folded,
 * trimmed text plus the provider mode, model and dimension, so switching providers never serves
 * a stale vector.
 */
public class EmbeddingCacheService {
    static final String METRIC = "ms_embed_cache_total";

    private final EmbeddingProperties properties;
    private final TtlCache<List<Double>> vectors;
    private final MeterRegistry meterRegistry;

    public EmbeddingCacheService(EmbeddingProperties properties, MeterRegistry meterRegistry) {
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.vectors = new TtlCache<>(properties.getCache().getMaxEntries());
    }

    public List<Double> getOrLoad(String text, Function<String, List<Double>> loader) {
        String key = cacheKey(text);
        if (key == null) {
            return loader.apply(text);
        }
        Optional<List<Double>> cached = vectors.get(key);
        if (cached.isPresent()) {
            record("hit");
            return cached.get();
        }
        record("miss");
        List<Double> vector = loader.apply(text);
        if (vector != null && !vector.isEmpty()) {
            vectors.put(key, List.copyOf(vector), properties.getCache().getTtlMs());
        }
        return vector;
    }

    public int size() {
        return vectors.size();
    }

    String cacheKey(String text) {
        EmbeddingProperties.Cache cache = properties.getCache();
        if (cache == null || !cache.isEnabled() || text == null) {
            return null;
        }
        String folded = text.trim().toLowerCase(Locale.ROOT);
        if (folded.isEmpty()) {
            return null;
        }
        if (cache.getMaxTextLength() > 0 && folded.length() > cache.getMaxTextLength()) {
            return null;
        }
        return String.join(
            ":",
            "embed",
            String.valueOf(properties.getMode()),
            String.valueOf(properties.getModel()),
            Integer.toString(properties.getDimension()),
            CacheKeyUtil.sha256Hex(folded)
        );
    }

    private void record(String result) {
        meterRegistry.counter(METRIC, "result", result).increment();
    }
}
