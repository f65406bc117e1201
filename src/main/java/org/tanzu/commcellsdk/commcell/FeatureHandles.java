package org.tanzu.commcellsdk.commcell;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Per-session cache of feature clients.
 *
 * Each feature is built once on first access and kept until {@link #clear()}. Building a
 * feature may access another one, so construction happens outside the map. After
 * {@link #close()} every access raises CVPySDK/104.
 */
final class FeatureHandles {

    private final Map<Class<?>, Object> handles = new ConcurrentHashMap<>();
    private volatile boolean closed;

    <T> T get(Class<T> type, Supplier<T> factory) {
        if (closed) {
            throw new SdkException("CVPySDK", "104");
        }
        Object handle = handles.get(type);
        if (handle == null) {
            handle = factory.get();
            Object existing = handles.putIfAbsent(type, handle);
            if (existing != null) {
                handle = existing;
            }
        }
        return type.cast(handle);
    }

    void clear() {
        handles.clear();
    }

    void close() {
        closed = true;
        handles.clear();
    }

    boolean isClosed() {
        return closed;
    }

    int size() {
        return handles.size();
    }
}
