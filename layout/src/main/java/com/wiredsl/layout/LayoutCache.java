package com.wiredsl.layout;

import com.wiredsl.compiler.ir.IrDocument;
import com.wiredsl.compiler.ir.Viewport;

import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Memoizes render trees per document and viewport.
 * Documents and render trees are immutable, so cached trees can be handed to any thread.
 * <p>
 * The cache holds at most {@code maxEntries} trees. Once full, the oldest entry is evicted first,
 * so a caller that recompiles on every edit keeps only its recent document versions.
 */
public class LayoutCache {

    private record Key(IrDocument document, Viewport viewport) {}

    public static final int DEFAULT_MAX_ENTRIES = 64;

    private final LayoutEngine engine;
    private final int maxEntries;
    private final Map<Key, RenderTree> trees = new ConcurrentHashMap<>();
    private final Queue<Key> insertionOrder = new ConcurrentLinkedQueue<>();

    public LayoutCache() {
        this(new LayoutEngine());
    }

    public LayoutCache(LayoutEngine engine) {
        this(engine, DEFAULT_MAX_ENTRIES);
    }

    public LayoutCache(LayoutEngine engine, int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be at least 1, got " + maxEntries);
        }
        this.engine = engine;
        this.maxEntries = maxEntries;
    }

    public RenderTree layout(IrDocument document, Viewport viewport) {
        RenderTree tree = trees.computeIfAbsent(new Key(document, viewport), key -> {
            insertionOrder.add(key);
            return engine.layout(key.document(), key.viewport());
        });
        evictOverflow();
        return tree;
    }

    private void evictOverflow() {
        while (trees.size() > maxEntries) {
            Key oldest = insertionOrder.poll();
            if (oldest == null) {
                return;
            }
            trees.remove(oldest);
        }
    }

    public int maxEntries() {
        return maxEntries;
    }

    public int size() {
        return trees.size();
    }

    public void clear() {
        trees.clear();
        insertionOrder.clear();
    }
}
