package com.example.archiveindexer.notify;

import java.util.List;

/**
 * Outbound signals sent after a successful build. Implementations log failures instead
 * of throwing; a build never fails because a notification did.
 */
public interface BuildNotifier extends AutoCloseable {
    void requestSearchReindex();

    /**
     * Asks the CDN to drop its cached copies of {@code urls}.
     */
    void invalidateCachedUrls(List<String> urls);

    @Override
    default void close() {
        // no-op
    }

    static BuildNotifier noop() {
        return new BuildNotifier() {
            @Override
            public void requestSearchReindex() {
            }

            @Override
            public void invalidateCachedUrls(List<String> urls) {
            }
        };
    }
}
