package com.semsort;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.semsort.cache.CacheStats;
import com.semsort.cache.EmbeddingCache;
import com.semsort.files.BatchFileMover;
import com.semsort.files.BatchLockManager;
import com.semsort.files.BatchMoveResult;
import com.semsort.files.FileOperationTracker;
import com.semsort.files.MoveRequest;
import com.semsort.ingest.EmbeddingInput;
import com.semsort.ingest.EmbeddingService;
import com.semsort.ingest.ModelServices;
import com.semsort.ingest.TextChunker;
import com.semsort.ingest.TextGenerationService;
import com.semsort.persist.AtomicJsonFile;
import com.semsort.pipeline.EmbeddingJob;
import com.semsort.pipeline.EmbeddingJobHandler;
import com.semsort.pipeline.EmbeddingPipeline;
import com.semsort.pipeline.FolderSuggestionJob;
import com.semsort.pipeline.FolderSuggestionService;
import com.semsort.pipeline.IndexSubmission;
import com.semsort.pipeline.PipelineMetrics;
import com.semsort.queue.QueueStats;
import com.semsort.queue.StageQueue;
import com.semsort.queue.StageQueueManager;
import com.semsort.runtime.AppConfig;
import com.semsort.vector.IndexMetadataStore;
import com.semsort.vector.LocalJsonVectorIndex;
import com.semsort.vector.SearchResult;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "semsort",
        mixinStandardHelpOptions = true,
        version = "semsort 0.1.0",
        description = "Local semantic indexing and organization of document folders.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final Set<String> INDEXED_EXTENSIONS = Set.of(".txt", ".md", ".csv", ".json", ".log", ".html", ".xml");

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", converter = ModeConverter.class, defaultValue = "stats",
            description = "Execution mode: index, search, organize, suggest, stats, retry-dead-letters")
    Mode mode;

    @Option(names = "--source-dir", description = "Directory to index in index mode")
    Path sourceDir;

    @Option(names = "--query", description = "Query text used in search mode")
    String query;

    @Option(names = "--top-k", description = "Top results to return", defaultValue = "5")
    int topK;

    @Option(names = "--plan", description = "JSON file listing {source, destination} moves for organize mode")
    Path planPath;

    @Option(names = "--file", description = "File to classify in suggest mode")
    Path suggestFile;

    @Option(names = "--folders", split = ",", description = "Candidate folders for suggest mode")
    List<String> folders;

    @Option(names = "--idle-timeout-ms", description = "How long to wait for queued work before exiting", defaultValue = "600000")
    long idleTimeoutMs;

    enum Mode {
        INDEX("index"),
        SEARCH("search"),
        ORGANIZE("organize"),
        SUGGEST("suggest"),
        STATS("stats"),
        RETRY_DEAD_LETTERS("retry-dead-letters");

        private final String cliName;

        Mode(String cliName) {
            this.cliName = cliName;
        }

        static Mode parse(String value) {
            for (Mode mode : values()) {
                if (mode.cliName.equalsIgnoreCase(value)) {
                    return mode;
                }
            }
            throw new IllegalArgumentException("Unknown mode: " + value);
        }

        @Override
        public String toString() {
            return cliName;
        }
    }

    static final class ModeConverter implements CommandLine.ITypeConverter<Mode> {
        @Override
        public Mode convert(String value) {
            return Mode.parse(value);
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        Integer invalid = validateOptions();
        if (invalid != null) {
            return invalid;
        }

        AppConfig config = loadConfig(Path.of(configPath));
        log.info("Starting semsort in {} mode", mode);
        log.info("Using config file: {}", configPath);

        try (Services services = Services.create(config)) {
            services.start();
            return switch (mode) {
                case INDEX -> runIndex(services);
                case SEARCH -> runSearch(services);
                case ORGANIZE -> runOrganize(services);
                case SUGGEST -> runSuggest(services);
                case STATS -> runStats(services);
                case RETRY_DEAD_LETTERS -> runRetryDeadLetters(services);
            };
        }
    }

    private Integer validateOptions() {
        if (mode == Mode.INDEX && sourceDir == null) {
            log.error("--source-dir is required in index mode");
            return 2;
        }
        if (mode == Mode.SEARCH && (query == null || query.isBlank())) {
            log.error("--query is required in search mode");
            return 2;
        }
        if (mode == Mode.ORGANIZE && planPath == null) {
            log.error("--plan is required in organize mode");
            return 2;
        }
        if (mode == Mode.SUGGEST && (suggestFile == null || folders == null || folders.isEmpty())) {
            log.error("--file and --folders are required in suggest mode");
            return 2;
        }
        return null;
    }

    private int runIndex(Services services) throws IOException, InterruptedException {
        if (!Files.isDirectory(sourceDir)) {
            log.error("Source directory does not exist: {}", sourceDir);
            return 1;
        }
        List<Path> files;
        try (Stream<Path> walk = Files.walk(sourceDir)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(Main::isIndexable)
                    .sorted()
                    .toList();
        }

        int submitted = 0;
        int skipped = 0;
        for (Path file : files) {
            String filePath = file.toAbsolutePath().normalize().toString();
            if (!services.pipeline.shouldReprocess(filePath)) {
                skipped++;
                continue;
            }
            String text;
            try {
                text = Files.readString(file, StandardCharsets.UTF_8);
            } catch (CharacterCodingException e) {
                log.warn("index.skip path={} reason=not-utf8", filePath);
                skipped++;
                continue;
            }
            IndexSubmission submission = services.pipeline.indexText(filePath, text);
            services.pipeline.recordWatcherEvent(filePath, "index");
            if (submission.chunks() > 0) {
                submitted++;
            }
        }

        boolean idle = services.queues.awaitIdle(Duration.ofMillis(idleTimeoutMs));
        PipelineMetrics.MetricsSnapshot metrics = services.pipeline.metrics();
        log.info("Indexed directory: files={}, submitted={}, skipped={}, embeddingsStored={}, cacheHits={}, drained={}",
                files.size(), submitted, skipped, metrics.embeddingsStored(), metrics.cacheHits(), idle);
        return idle ? 0 : 1;
    }

    private int runSearch(Services services) {
        List<SearchResult> results = services.pipeline.search(query, topK);
        for (int i = 0; i < results.size(); i++) {
            SearchResult result = results.get(i);
            log.info("Result #{} score={} path={} chunk={} id={}",
                    i + 1,
                    String.format(Locale.ROOT, "%.4f", result.score()),
                    result.metadata().get("path"),
                    result.metadata().get("chunkIndex"),
                    result.id());
        }
        if (results.isEmpty()) {
            log.info("No results for query");
        }
        return 0;
    }

    private int runOrganize(Services services) throws Exception {
        List<PlanEntry> plan = services.jsonFile.mapper().readValue(planPath.toFile(), new TypeReference<List<PlanEntry>>() {
        });
        List<MoveRequest> moves = new ArrayList<>(plan.size());
        for (PlanEntry entry : plan) {
            moves.add(new MoveRequest(Path.of(entry.source()), Path.of(entry.destination())));
        }
        BatchMoveResult result = services.pipeline.organize(moves);
        if (!result.success()) {
            log.error("Batch {} failed: errors={} rolledBack={}", result.batchId(), result.errors(), result.rolledBack());
            return 1;
        }
        log.info("Batch {} moved {} files", result.batchId(), result.completed().size());
        return 0;
    }

    private int runSuggest(Services services) throws IOException, InterruptedException {
        String filePath = suggestFile.toAbsolutePath().normalize().toString();
        String text = Files.readString(suggestFile, StandardCharsets.UTF_8);
        services.pipeline.requestFolderSuggestion(filePath, text, folders);
        services.queues.awaitIdle(Duration.ofMillis(idleTimeoutMs));
        return services.folderSuggestions.take(filePath)
                .map(folder -> {
                    log.info("Suggested folder for {}: {}", filePath, folder);
                    return 0;
                })
                .orElseGet(() -> {
                    log.error("No folder suggestion produced for {}", filePath);
                    return 1;
                });
    }

    private int runStats(Services services) {
        for (Map.Entry<String, QueueStats> entry : services.queues.getStats().entrySet()) {
            QueueStats stats = entry.getValue();
            log.info("Queue {} size={} active={} failed={} completed={} retried={}",
                    entry.getKey(), stats.size(), stats.active(), stats.failed(), stats.completed(), stats.retried());
        }
        CacheStats cacheStats = services.cache.getStats();
        log.info("Cache size={} maxSize={} hits={} misses={} hitRate={}",
                cacheStats.size(), cacheStats.maxSize(), cacheStats.hits(), cacheStats.misses(),
                String.format(Locale.ROOT, "%.3f", cacheStats.hitRate()));
        log.info("Index {}", services.index.stats());
        return 0;
    }

    private int runRetryDeadLetters(Services services) throws InterruptedException {
        int retried = services.queues.retryDeadLetters();
        boolean idle = services.queues.awaitIdle(Duration.ofMillis(idleTimeoutMs));
        log.info("Re-enqueued {} dead-lettered jobs drained={}", retried, idle);
        return idle ? 0 : 1;
    }

    static boolean isIndexable(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && INDEXED_EXTENSIONS.contains(name.substring(dot));
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }

    record PlanEntry(String source, String destination) {
    }

    /**
     * Everything one CLI invocation wires together, closed in reverse order of creation.
     */
    static final class Services implements AutoCloseable {
        final AtomicJsonFile jsonFile;
        final AppConfig config;
        final LocalJsonVectorIndex index;
        final EmbeddingCache cache;
        final FileOperationTracker tracker;
        final StageQueueManager queues;
        final FolderSuggestionService folderSuggestions;
        final EmbeddingPipeline pipeline;

        private Services(AtomicJsonFile jsonFile, AppConfig config, LocalJsonVectorIndex index, EmbeddingCache cache,
                FileOperationTracker tracker, StageQueueManager queues, FolderSuggestionService folderSuggestions,
                EmbeddingPipeline pipeline) {
            this.jsonFile = jsonFile;
            this.config = config;
            this.index = index;
            this.cache = cache;
            this.tracker = tracker;
            this.queues = queues;
            this.folderSuggestions = folderSuggestions;
            this.pipeline = pipeline;
        }

        static Services create(AppConfig config) throws IOException {
            Clock clock = Clock.systemUTC();
            AtomicJsonFile jsonFile = new AtomicJsonFile();
            AppConfig.EmbeddingConfig embedding = config.getEmbedding();

            LocalJsonVectorIndex index = LocalJsonVectorIndex.load(Path.of(config.getIndex().getPath()), jsonFile);
            EmbeddingCache cache = new EmbeddingCache(config.getCache().getMaxSize(), config.getCache().getTtlMs(),
                    config.getCache().getCleanupIntervalMs(), clock);
            FileOperationTracker tracker = new FileOperationTracker(config.getTracker().getCooldownMs(),
                    Path.of(config.getTracker().getPersistencePath()), config.getTracker().isCaseInsensitive(), clock, jsonFile);

            OkHttpClient httpClient = ModelServices.httpClient(embedding);
            EmbeddingService embeddingService = ModelServices.embeddings(httpClient, embedding);
            TextGenerationService generation = ModelServices.generation(httpClient, embedding);
            EmbeddingInput input = new EmbeddingInput(embedding.getContextTokens(), embedding.getCharsPerToken(),
                    embedding.getHeadroomRatio(), embedding.getMinTokens());
            TextChunker chunker = new TextChunker(embedding.getChunkSize(), embedding.getChunkOverlap(), embedding.getMaxChunks());
            Integer dimensions = embedding.getDimensions() > 0 ? embedding.getDimensions() : null;

            PipelineMetrics metrics = new PipelineMetrics();
            EmbeddingJobHandler embeddingHandler = new EmbeddingJobHandler(embeddingService, cache, index, metrics, dimensions);
            StageQueue<EmbeddingJob> embeddingQueue = new StageQueue<>(
                    StageQueue.Settings.from(EmbeddingPipeline.EMBEDDING_STAGE, config.getQueue()),
                    EmbeddingJob.class, embeddingHandler, jsonFile, clock);
            FolderSuggestionService folderSuggestions = new FolderSuggestionService(generation, input, embedding.getGenerationModel());
            StageQueue<FolderSuggestionJob> organizeQueue = new StageQueue<>(
                    StageQueue.Settings.from(FolderSuggestionService.STAGE, config.getQueue()),
                    FolderSuggestionJob.class, folderSuggestions, jsonFile, clock);

            StageQueueManager queues = new StageQueueManager();
            queues.register(embeddingQueue);
            queues.register(organizeQueue);

            BatchLockManager lockManager = new BatchLockManager(config.getBatch().getPollIntervalMs(),
                    config.getBatch().getStaleLockMs(), clock);
            BatchFileMover mover = new BatchFileMover(lockManager, tracker, queues, index, config.getBatch().getLockTimeoutMs());

            EmbeddingPipeline pipeline = new EmbeddingPipeline(chunker, input, cache, embeddingService, index,
                    embeddingQueue, organizeQueue, folderSuggestions, tracker, mover, metrics,
                    embedding.getModel(), dimensions);
            pipeline.reconcileIndex(new IndexMetadataStore(Path.of(config.getIndex().getMetadataPath()), jsonFile, clock));
            return new Services(jsonFile, config, index, cache, tracker, queues, folderSuggestions, pipeline);
        }

        void start() {
            tracker.initialize();
            queues.initializeAll();
            queues.startAll();
        }

        @Override
        public void close() {
            queues.shutdown();
            try {
                index.save(Path.of(config.getIndex().getPath()), jsonFile);
            } catch (IOException e) {
                log.warn("index.save.failed path={} reason={}", config.getIndex().getPath(), e.getMessage());
            }
            tracker.shutdown();
            cache.shutdown();
        }
    }
}
