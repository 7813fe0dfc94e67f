package com.semsort.pipeline;

import java.util.List;

import com.semsort.queue.FileScopedPayload;

public record FolderSuggestionJob(String filePath, String excerpt, List<String> folders, String model)
        implements FileScopedPayload<FolderSuggestionJob> {

    @Override
    public FolderSuggestionJob withFilePath(String newPath) {
        return new FolderSuggestionJob(newPath, excerpt, folders, model);
    }
}
