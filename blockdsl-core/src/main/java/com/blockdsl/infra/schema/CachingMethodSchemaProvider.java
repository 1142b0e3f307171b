package com.blockdsl.infra.schema;

import com.blockdsl.api.MethodSchemaProvider;
import com.blockdsl.api.exceptions.SchemaLookupException;
import com.blockdsl.api.model.MethodInputField;
import com.blockdsl.infra.config.EditorConfig;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * {@link MethodSchemaProvider} decorator that caches method input schemas per
 * (product, method) in a Caffeine {@link AsyncCache}.
 *
 * <p>Concurrent requests for the same method share one in-flight lookup.
 * Failed lookups are not cached: Caffeine drops a future that completes
 * exceptionally, so the next request tries again.
 *
 * <p>Thread-safe; one instance may be shared by all editor sessions.
 *
 * <pre>{@code
 * MethodSchemaProvider provider = CachingMethodSchemaProvider.wrap(remoteProvider, EditorConfig.loadDefault());
 * }</pre>
 */
public class CachingMethodSchemaProvider implements MethodSchemaProvider {

    private static final Logger logger = Logger.getLogger(CachingMethodSchemaProvider.class.getName());

    private final MethodSchemaProvider delegate;
    private final AsyncCache<SchemaKey, List<MethodInputField>> cache;

    public CachingMethodSchemaProvider(MethodSchemaProvider delegate, EditorConfig config) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.cache = Caffeine.newBuilder()
            .maximumSize(config.getSchemaCacheMaxSize())
            .expireAfterWrite(config.getSchemaCacheTtlSeconds(), TimeUnit.SECONDS)
            .recordStats()
            .buildAsync();

        logger.info(String.format("CachingMethodSchemaProvider initialized: maxSize=%d, ttl=%ds",
            config.getSchemaCacheMaxSize(), config.getSchemaCacheTtlSeconds()));
    }

    /**
     * Wraps the provider when caching is enabled, otherwise returns it unchanged.
     */
    public static MethodSchemaProvider wrap(MethodSchemaProvider delegate, EditorConfig config) {
        return config.isSchemaCacheEnabled() ? new CachingMethodSchemaProvider(delegate, config) : delegate;
    }

    @Override
    public CompletableFuture<List<MethodInputField>> getMethodInputFields(String product, String method) {
        return cache.get(new SchemaKey(product, method), (key, executor) -> load(key));
    }

    private CompletableFuture<List<MethodInputField>> load(SchemaKey key) {
        logger.fine("Schema cache miss: " + key);
        CompletableFuture<List<MethodInputField>> future;
        try {
            future = delegate.getMethodInputFields(key.product(), key.method());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(
                new SchemaLookupException(key.product(), key.method(), "Schema lookup failed: " + e.getMessage(), e));
        }
        if (future == null) {
            return CompletableFuture.failedFuture(
                new SchemaLookupException(key.product(), key.method(), "Schema provider returned no result"));
        }
        return future.thenApply(List::copyOf);
    }

    /**
     * Drops the cached schema of one method, e.g. after it was redeployed.
     */
    public void invalidate(String product, String method) {
        cache.synchronous().invalidate(new SchemaKey(product, method));
    }

    public void invalidateAll() {
        cache.synchronous().invalidateAll();
    }

    public long estimatedSize() {
        return cache.synchronous().estimatedSize();
    }

    public CacheStats stats() {
        return cache.synchronous().stats();
    }

    record SchemaKey(String product, String method) {
    }
}
