/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.unit.cache;

import com.sffkit.SffException;
import com.sffkit.cache.ImageCache;
import com.sffkit.config.ExtractorConfig;
import com.sffkit.image.ImageSurface;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ImageCache")
class ImageCacheTest {

    @Mock
    private ImageCache.Loader loader;

    private static ImageSurface image(int width, int height) {
        return ImageSurface.of(width, height, new byte[width * height * 4]);
    }

    @Test
    void keysAreNamespaced() {
        assertEquals("portrait:kfm", ImageCache.portraitKey("kfm"));
        assertEquals("stage:temple", ImageCache.stagePreviewKey("temple"));
        assertEquals("sff:/chars/kfm.sff:9000:1", ImageCache.sffKey("/chars/kfm.sff", 9000, 1));
    }

    @Test
    void shouldCountHitsAndMisses() {
        ImageCache cache = new ImageCache(10, 10_000);
        assertNull(cache.get("a"));
        cache.put("a", image(2, 2));
        assertNotNull(cache.get("a"));
        assertNotNull(cache.get("a"));

        assertEquals(2, cache.hitCount());
        assertEquals(1, cache.missCount());
        assertEquals(2.0 / 3.0, cache.hitRate(), 1e-9);
        assertTrue(cache.toString().contains("66.7% hit rate"));
    }

    @Test
    void shouldEvictLeastRecentlyUsedByCount() {
        ImageCache cache = new ImageCache(2, 10_000);
        cache.put("a", image(1, 1));
        cache.put("b", image(1, 1));
        cache.get("a");
        cache.put("c", image(1, 1));

        assertEquals(2, cache.size());
        assertNotNull(cache.get("a"));
        assertNull(cache.get("b"));
        assertNotNull(cache.get("c"));
    }

    @Test
    void shouldEvictByByteCost() {
        ImageCache cache = new ImageCache(100, 100);
        cache.put("a", image(4, 4));
        cache.put("b", image(4, 4));

        assertEquals(1, cache.size());
        assertEquals(64, cache.totalBytes());
        assertNull(cache.get("a"));
    }

    @Test
    void imageLargerThanLimitIsNotStored() {
        ImageCache cache = new ImageCache(100, 10);
        cache.put("a", image(2, 2));
        assertEquals(0, cache.size());
    }

    @Test
    void oversizedReplacementDropsOldEntry() {
        ImageCache cache = new ImageCache(100, 64);
        cache.put("a", image(2, 2));
        cache.put("a", image(8, 8));
        assertEquals(0, cache.size());
        assertEquals(0, cache.totalBytes());
        assertNull(cache.get("a"));
    }

    @Test
    void replacingEntryUpdatesCost() {
        ImageCache cache = new ImageCache(10, 1000);
        cache.put("a", image(2, 2));
        cache.put("a", image(3, 3));
        assertEquals(36, cache.totalBytes());
        assertEquals(1, cache.size());
    }

    @Test
    void getOrLoadLoadsOnce() throws SffException {
        ImageCache cache = new ImageCache(10, 10_000);
        when(loader.load()).thenReturn(image(3, 3));

        cache.getOrLoad("portrait:kfm", loader);
        ImageSurface second = cache.getOrLoad("portrait:kfm", loader);

        assertEquals(3, second.width());
        verify(loader, times(1)).load();
    }

    @Test
    void failedLoadIsNotCached() throws SffException {
        ImageCache cache = new ImageCache(10, 10_000);
        when(loader.load()).thenThrow(new SffException.SpriteNotFound(9000, 0));

        assertThrows(SffException.SpriteNotFound.class, () -> cache.getOrLoad("portrait:kfm", loader));
        assertThrows(SffException.SpriteNotFound.class, () -> cache.getOrLoad("portrait:kfm", loader));
        verify(loader, times(2)).load();
        assertEquals(0, cache.size());
    }

    @Test
    void removeAndClear() {
        ImageCache cache = new ImageCache(10, 10_000);
        cache.put(ImageCache.portraitKey("kfm"), image(1, 1));
        cache.put(ImageCache.stagePreviewKey("temple"), image(1, 1));
        cache.get("missing");

        cache.clearCharacter("kfm");
        assertEquals(1, cache.size());
        cache.clearStage("temple");
        assertEquals(0, cache.size());
        assertEquals(0, cache.totalBytes());

        cache.put("x", image(1, 1));
        cache.clear();
        assertEquals(0, cache.size());
        assertEquals(0, cache.missCount());
        assertEquals(0.0, cache.hitRate());
    }

    @Test
    void limitsComeFromConfig() {
        Properties props = new Properties();
        props.setProperty("cache.max.entries", "1");
        ImageCache cache = new ImageCache(ExtractorConfig.fromProperties(props));
        cache.put("a", image(1, 1));
        cache.put("b", image(1, 1));
        assertEquals(1, cache.size());
    }

    @Test
    void rejectsNonPositiveLimits() {
        assertThrows(IllegalArgumentException.class, () -> new ImageCache(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new ImageCache(10, 0));
    }
}
