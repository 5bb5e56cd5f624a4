/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.cache;

import com.sffkit.SffException;
import com.sffkit.config.ExtractorConfig;
import com.sffkit.image.ImageSurface;
import com.sffkit.utils.LoggerUtil;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Least-recently-used cache of decoded portraits and stage previews.
 *
 * <p>Bounded both by entry count and by total pixel bytes
 * ({@code width * height * 4} per image). All operations are synchronized on
 * the cache; loaders run outside the lock, so two threads may decode the same
 * key concurrently and the later result wins.
 */
public class ImageCache {

    /**
     * Produces an image on a cache miss.
     */
    @FunctionalInterface
    public interface Loader {
        ImageSurface load() throws SffException;
    }

    private final long maxEntries;
    private final long maxBytes;
    private final LinkedHashMap<String, ImageSurface> entries = new LinkedHashMap<>(16, 0.75f, true);
    private long currentBytes;
    private long hitCount;
    private long missCount;

    public ImageCache(ExtractorConfig config) {
        this(config.cacheMaxEntries(), config.cacheMaxBytes());
    }

    public ImageCache(long maxEntries, long maxBytes) {
        if (maxEntries < 1 || maxBytes < 1) {
            throw new IllegalArgumentException(
                    "Cache limits must be positive: entries=" + maxEntries + ", bytes=" + maxBytes);
        }
        this.maxEntries = maxEntries;
        this.maxBytes = maxBytes;
    }

    public static String portraitKey(String characterId) {
        return "portrait:" + characterId;
    }

    public static String stagePreviewKey(String stageId) {
        return "stage:" + stageId;
    }

    public static String sffKey(String filePath, int group, int image) {
        return "sff:" + filePath + ":" + group + ":" + image;
    }

    /**
     * @return the cached image, or null on a miss
     */
    public synchronized ImageSurface get(String key) {
        ImageSurface image = entries.get(key);
        if (image != null) {
            hitCount++;
        } else {
            missCount++;
        }
        return image;
    }

    /**
     * Store an image, evicting least recently used entries until both limits
     * hold. An image larger than the byte limit is not stored, and any older
     * entry under the same key is dropped.
     */
    public synchronized void put(String key, ImageSurface image) {
        long cost = image.byteSize();
        if (cost > maxBytes) {
            LoggerUtil.debug(() -> "[ImageCache] Not caching " + key + ": " + cost + " bytes exceeds limit " + maxBytes);
            remove(key);
            return;
        }
        ImageSurface previous = entries.put(key, image);
        if (previous != null) {
            currentBytes -= previous.byteSize();
        }
        currentBytes += cost;
        evict();
    }

    /**
     * Return the cached image, or run the loader and cache its result. Failed
     * loads are not cached and propagate to the caller.
     */
    public ImageSurface getOrLoad(String key, Loader loader) throws SffException {
        ImageSurface cached = get(key);
        if (cached != null) {
            return cached;
        }
        ImageSurface loaded = loader.load();
        put(key, loaded);
        return loaded;
    }

    public synchronized void remove(String key) {
        ImageSurface removed = entries.remove(key);
        if (removed != null) {
            currentBytes -= removed.byteSize();
        }
    }

    public void clearCharacter(String characterId) {
        remove(portraitKey(characterId));
    }

    public void clearStage(String stageId) {
        remove(stagePreviewKey(stageId));
    }

    /** Drop every entry and reset the statistics. */
    public synchronized void clear() {
        entries.clear();
        currentBytes = 0;
        hitCount = 0;
        missCount = 0;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long totalBytes() {
        return currentBytes;
    }

    public synchronized long hitCount() {
        return hitCount;
    }

    public synchronized long missCount() {
        return missCount;
    }

    public synchronized double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    private void evict() {
        Iterator<Map.Entry<String, ImageSurface>> it = entries.entrySet().iterator();
        while ((entries.size() > maxEntries || currentBytes > maxBytes) && it.hasNext()) {
            Map.Entry<String, ImageSurface> eldest = it.next();
            currentBytes -= eldest.getValue().byteSize();
            it.remove();
            LoggerUtil.debug(() -> "[ImageCache] Evicted " + eldest.getKey());
        }
    }

    @Override
    public synchronized String toString() {
        return String.format(Locale.ROOT, "ImageCache: %d hits, %d misses (%.1f%% hit rate)",
                hitCount, missCount, hitRate() * 100);
    }
}
