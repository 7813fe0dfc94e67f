package com.semsort.queue;

/**
 * A job payload tied to one file, so queued work can follow the file when it is moved or deleted.
 */
public interface FileScopedPayload<P> {
    String filePath();

    P withFilePath(String newPath);
}
