package com.pagesentry.analyze.storage;

import com.pagesentry.analyze.model.StageResult;

public interface ObjectStore {
    /**
     * Stores {@code bytes} and returns the public URL of the object.
     */
    StageResult<String> put(String bucket, String key, byte[] bytes, String contentType);
}
