package com.semsort.pipeline;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.semsort.ingest.EmbeddingInput;
import com.semsort.ingest.TextGenerationService;
import com.semsort.queue.JobCommit;
import com.semsort.queue.JobHandler;
import com.semsort.queue.QueueJob;

/**
 * Handles jobs on the {@code organize} stage: asks the text generation model which candidate folder a file
 * belongs in and keeps the answer until it is taken. Only the most recent {@code maxSuggestions} answers are
 * kept.
 */
public class FolderSuggestionService implements JobHandler<FolderSuggestionJob> {
    private static final Logger log = LoggerFactory.getLogger(FolderSuggestionService.class);

    public static final String STAGE = "organize";
    public static final int DEFAULT_MAX_SUGGESTIONS = 1_000;

    private final TextGenerationService generation;
    private final EmbeddingInput input;
    private final String model;
    private final Map<String, String> suggestions;

    public FolderSuggestionService(TextGenerationService generation, EmbeddingInput input, String model) {
        this(generation, input, model, DEFAULT_MAX_SUGGESTIONS);
    }

    public FolderSuggestionService(TextGenerationService generation, EmbeddingInput input, String model, int maxSuggestions) {
        if (maxSuggestions <= 0) {
            throw new IllegalArgumentException("maxSuggestions must be > 0");
        }
        this.generation = generation;
        this.input = input;
        this.model = model;
        this.suggestions = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
                return size() > maxSuggestions;
            }
        };
    }

    public FolderSuggestionJob newJob(String filePath, String text, List<String> folders) {
        if (folders == null || folders.isEmpty()) {
            throw new IllegalArgumentException("At least one candidate folder is required");
        }
        String excerpt = input.cap(text == null ? "" : text).text();
        return new FolderSuggestionJob(filePath, excerpt, List.copyOf(folders), model);
    }

    @Override
    public void handle(QueueJob<FolderSuggestionJob> job) {
        handle(job, action -> {
            action.accept(job.payload());
            return true;
        });
    }

    @Override
    public void handle(QueueJob<FolderSuggestionJob> job, JobCommit<FolderSuggestionJob> commit) {
        FolderSuggestionJob payload = job.payload();
        String reply = generation.generate(prompt(payload), payload.model());
        String folder = resolveFolder(reply, payload.folders());
        if (folder.isEmpty()) {
            throw new IllegalStateException("Model returned an empty folder suggestion for " + payload.filePath());
        }
        commit.commit(current -> {
            synchronized (suggestions) {
                suggestions.put(current.filePath(), folder);
            }
            log.info("organize.suggested path={} folder={}", current.filePath(), folder);
        });
    }

    public Optional<String> suggestion(String filePath) {
        synchronized (suggestions) {
            return Optional.ofNullable(suggestions.get(filePath));
        }
    }

    public Map<String, String> suggestions() {
        synchronized (suggestions) {
            return Map.copyOf(suggestions);
        }
    }

    public Optional<String> take(String filePath) {
        synchronized (suggestions) {
            return Optional.ofNullable(suggestions.remove(filePath));
        }
    }

    static String prompt(FolderSuggestionJob job) {
        StringBuilder builder = new StringBuilder();
        builder.append("Choose the best folder for the file below. Reply with the folder name only.\n");
        builder.append("File: ").append(job.filePath()).append('\n');
        builder.append("Folders:\n");
        for (String folder : job.folders()) {
            builder.append("- ").append(folder).append('\n');
        }
        builder.append("Content:\n").append(job.excerpt());
        return builder.toString();
    }

    static String resolveFolder(String reply, List<String> folders) {
        if (reply == null) {
            return "";
        }
        String trimmed = reply.strip();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (String folder : folders) {
            if (folder.equalsIgnoreCase(trimmed)) {
                return folder;
            }
        }
        for (String folder : folders) {
            if (lower.contains(folder.toLowerCase(Locale.ROOT))) {
                return folder;
            }
        }
        int newline = trimmed.indexOf('\n');
        return (newline < 0 ? trimmed : trimmed.substring(0, newline)).strip();
    }
}
