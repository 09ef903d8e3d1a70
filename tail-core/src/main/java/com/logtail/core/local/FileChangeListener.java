package com.logtail.core.local;

/**
 * Callback invoked from a watch thread when the watched file may have changed.
 */
@FunctionalInterface
public interface FileChangeListener {
    void onChanged();
}
