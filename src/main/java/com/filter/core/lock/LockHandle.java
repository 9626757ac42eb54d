package com.filter.core.lock;

import java.nio.file.Path;

/**
 * An acquired exclusive lock; closing releases it.
 */
public interface LockHandle extends AutoCloseable {

    Path lockFile();

    @Override
    void close();
}
