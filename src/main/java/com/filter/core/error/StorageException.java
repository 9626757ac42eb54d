package com.filter.core.error;

import java.io.IOException;

/**
 * Filesystem I/O failed underneath the core.
 */
public class StorageException extends FilterException {

    public StorageException(String message, IOException cause) {
        super(ErrorCategory.STORAGE, message + ": " + cause.getMessage(), null, cause);
    }
}
