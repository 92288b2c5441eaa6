package com.ryuqq.bridge.adapter.inmemory.knowledge;

import com.ryuqq.bridge.core.model.AddResourceResult;
import com.ryuqq.bridge.core.model.DirectoryEntry;
import com.ryuqq.bridge.core.model.MemoryHit;
import com.ryuqq.bridge.core.model.ResourceHit;
import com.ryuqq.bridge.core.model.SearchResult;
import com.ryuqq.bridge.core.model.SessionInfo;
import com.ryuqq.bridge.core.spi.KnowledgeBase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reference {@link KnowledgeBase} that keeps memories, resources and sessions in memory.
 *
 * <p>This backend is deliberately <strong>not</strong> thread-safe and enforces confinement:
 * the thread that calls {@link #initialize()} becomes the owner, and any later call from
 * another thread fails with {@link IllegalStateException}. Seeding methods
 * ({@link #addMemory(String)}, {@link #putResource(String, String)}, {@link #openSession(String)})
 * may be called by any thread before initialization.</p>
 *
 * <p><strong>Layout:</strong></p>
 * <pre>
 * viking://resources/
 *   ├── notes.md          (added via addResource)
 *   └── docs/             (directory implied by nested uris)
 *        └── guide.md
 * </pre>
 *
 * <p><strong>Ranking:</strong> hits are ordered by the number of case-insensitive occurrences
 * of the query terms. {@code find} additionally matches abstracts and directory names.</p>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public class InMemoryKnowledgeBase implements KnowledgeBase {

    private static final Logger log = LoggerFactory.getLogger(InMemoryKnowledgeBase.class);

    public static final String RESOURCE_ROOT = "viking://resources/";

    private static final int ABSTRACT_MAX_LENGTH = 200;

    private final Path dataDir;
    private final List<String> memories = new ArrayList<>();
    private final Map<String, StoredResource> resources = new LinkedHashMap<>();
    private final List<String> sessions = new ArrayList<>();

    private volatile Thread owner;
    private volatile boolean closed;

    public InMemoryKnowledgeBase() {
        this(null);
    }

    /**
     * @param dataDir directory whose regular files are loaded as resources on
     *                {@link #initialize()}, or null for an empty store
     */
    public InMemoryKnowledgeBase(Path dataDir) {
        this.dataDir = dataDir;
    }

    @Override
    public void initialize() throws IOException {
        if (closed) {
            throw new IllegalStateException("Knowledge base is closed");
        }
        if (owner != null) {
            throw new IllegalStateException("Knowledge base already initialized by " + owner.getName());
        }
        if (dataDir != null) {
            loadDataDir(dataDir);
        }
        owner = Thread.currentThread();
        log.info("In-memory knowledge base initialized on {} ({} resources, {} memories)",
            owner.getName(), resources.size(), memories.size());
    }

    private void loadDataDir(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            throw new IOException("Data directory does not exist: " + dir);
        }
        List<Path> files;
        try (Stream<Path> walk = Files.walk(dir)) {
            files = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
        for (Path file : files) {
            String relative = dir.relativize(file).toString().replace('\\', '/');
            resources.put(RESOURCE_ROOT + relative, StoredResource.of(file.getFileName().toString(), readText(file)));
        }
    }

    // ========== seeding ==========

    public void addMemory(String content) {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        checkSeedAccess();
        memories.add(content);
    }

    /**
     * Stores a resource directly under the given uri.
     *
     * @param uri resource uri, must start with {@value #RESOURCE_ROOT}
     * @param content resource text
     */
    public void putResource(String uri, String content) {
        if (uri == null || !uri.startsWith(RESOURCE_ROOT) || uri.endsWith("/")) {
            throw new IllegalArgumentException("uri must be a file under " + RESOURCE_ROOT + " (current: " + uri + ")");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        checkSeedAccess();
        resources.put(uri, StoredResource.of(uri.substring(uri.lastIndexOf('/') + 1), content));
    }

    public SessionInfo openSession(String sessionId) {
        SessionInfo session = SessionInfo.of(sessionId);
        checkSeedAccess();
        sessions.add(session.sessionId());
        return session;
    }

    // ========== KnowledgeBase ==========

    @Override
    public SearchResult search(String query, int limit) {
        checkAccess();
        requirePositive(limit);
        List<String> terms = terms(query);
        ToScore<Map.Entry<String, StoredResource>> resourceScore = entry ->
            score(terms, entry.getValue().title) + score(terms, entry.getValue().content);
        List<String> memoryHits = rank(memories, memory -> score(terms, memory), limit);
        List<Map.Entry<String, StoredResource>> resourceHits = rank(new ArrayList<>(resources.entrySet()), resourceScore, limit);
        int total = count(memories, memory -> score(terms, memory)) + count(resources.entrySet(), resourceScore);
        return toResult(total, memoryHits, resourceHits);
    }

    @Override
    public SearchResult find(String query, int limit) {
        checkAccess();
        requirePositive(limit);
        List<String> terms = terms(query);
        ToScore<Map.Entry<String, StoredResource>> resourceScore = entry ->
            score(terms, entry.getValue().title)
                + score(terms, entry.getValue().content)
                + score(terms, entry.getValue().abstractText)
                + score(terms, directoryPart(entry.getKey()));
        List<String> memoryHits = rank(memories, memory -> score(terms, memory), limit);
        List<Map.Entry<String, StoredResource>> resourceHits = rank(new ArrayList<>(resources.entrySet()), resourceScore, limit);
        int total = count(memories, memory -> score(terms, memory)) + count(resources.entrySet(), resourceScore);
        return toResult(total, memoryHits, resourceHits);
    }

    /**
     * Reads a UTF-8 text file and stores it under {@value #RESOURCE_ROOT}{@code <file-name>}.
     *
     * <p>Indexing is synchronous, so {@code waitForIndexing} and {@code timeout} have no effect.</p>
     */
    @Override
    public AddResourceResult addResource(String path, boolean waitForIndexing, Duration timeout) throws IOException {
        checkAccess();
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        Path file = Paths.get(path);
        if (!Files.isRegularFile(file)) {
            return new AddResourceResult("error", List.of("not a regular file: " + path), null);
        }
        String content = readText(file);
        if (content.isBlank()) {
            return new AddResourceResult("error", List.of("resource is empty: " + path), null);
        }
        String name = file.getFileName().toString();
        String uri = RESOURCE_ROOT + name;
        resources.put(uri, StoredResource.of(name, content));
        log.debug("Resource stored at {} ({} chars)", uri, content.length());
        return AddResourceResult.success("success", uri);
    }

    @Override
    public List<DirectoryEntry> listDirectory(String uri) {
        checkAccess();
        if (uri == null) {
            throw new IllegalArgumentException("uri cannot be null");
        }
        String prefix = uri.endsWith("/") ? uri : uri + "/";
        Map<String, DirectoryEntry> children = new LinkedHashMap<>();
        for (Map.Entry<String, StoredResource> entry : resources.entrySet()) {
            String key = entry.getKey();
            if (!key.startsWith(prefix)) {
                continue;
            }
            String rest = key.substring(prefix.length());
            int slash = rest.indexOf('/');
            if (slash >= 0) {
                String dirName = rest.substring(0, slash);
                children.putIfAbsent(dirName, new DirectoryEntry(dirName, true, 0));
            } else {
                children.put(rest, new DirectoryEntry(rest, false, entry.getValue().size()));
            }
        }
        if (children.isEmpty() && !prefix.equals(RESOURCE_ROOT)) {
            throw new NoSuchElementException("No such directory: " + uri);
        }
        return new ArrayList<>(children.values());
    }

    @Override
    public String read(String uri) {
        checkAccess();
        return lookup(uri).content;
    }

    @Override
    public String abstractOf(String uri) {
        checkAccess();
        return lookup(uri).abstractText;
    }

    @Override
    public List<SessionInfo> listSessions() {
        checkAccess();
        return sessions.stream().map(SessionInfo::of).collect(Collectors.toList());
    }

    /**
     * Closes the store. Idempotent, callable from any thread.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        log.info("In-memory knowledge base closed");
    }

    public boolean isClosed() {
        return closed;
    }

    // ========== internals ==========

    private void checkAccess() {
        if (closed) {
            throw new IllegalStateException("Knowledge base is closed");
        }
        Thread current = owner;
        if (current == null) {
            throw new IllegalStateException("Knowledge base not initialized");
        }
        if (current != Thread.currentThread()) {
            throw new IllegalStateException("Knowledge base is confined to thread " + current.getName()
                + " but was called from " + Thread.currentThread().getName());
        }
    }

    private void checkSeedAccess() {
        if (owner != null) {
            checkAccess();
        }
    }

    private StoredResource lookup(String uri) {
        StoredResource resource = uri == null ? null : resources.get(uri);
        if (resource == null) {
            throw new NoSuchElementException("Resource not found: " + uri);
        }
        return resource;
    }

    private static String readText(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private static void requirePositive(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
    }

    private static List<String> terms(String query) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        List<String> terms = new ArrayList<>();
        for (String term : query.toLowerCase(Locale.ROOT).split("\\s+")) {
            if (!term.isEmpty()) {
                terms.add(term);
            }
        }
        return terms;
    }

    static int score(List<String> terms, String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        String haystack = text.toLowerCase(Locale.ROOT);
        int score = 0;
        for (String term : terms) {
            int from = 0;
            int index;
            while ((index = haystack.indexOf(term, from)) >= 0) {
                score++;
                from = index + term.length();
            }
        }
        return score;
    }

    private static String directoryPart(String uri) {
        String rest = uri.substring(RESOURCE_ROOT.length());
        int slash = rest.lastIndexOf('/');
        return slash < 0 ? "" : rest.substring(0, slash);
    }

    @FunctionalInterface
    private interface ToScore<T> {
        int score(T item);
    }

    private static <T> List<T> rank(List<T> items, ToScore<T> scorer, int limit) {
        List<Scored<T>> scored = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            int s = scorer.score(items.get(i));
            if (s > 0) {
                scored.add(new Scored<>(items.get(i), s, i));
            }
        }
        scored.sort(Comparator.<Scored<T>>comparingInt(Scored::score).reversed().thenComparingInt(Scored::position));
        return scored.stream().limit(limit).map(Scored::item).collect(Collectors.toList());
    }

    private static <T> int count(Iterable<T> items, ToScore<T> scorer) {
        int count = 0;
        for (T item : items) {
            if (scorer.score(item) > 0) {
                count++;
            }
        }
        return count;
    }

    private static SearchResult toResult(int total, List<String> memoryHits, List<Map.Entry<String, StoredResource>> resourceHits) {
        List<MemoryHit> memories = memoryHits.stream().map(MemoryHit::of).collect(Collectors.toList());
        List<ResourceHit> hits = resourceHits.stream()
            .map(entry -> new ResourceHit(entry.getKey(), entry.getValue().title,
                entry.getValue().abstractText, entry.getValue().content))
            .collect(Collectors.toList());
        return new SearchResult(total, memories, hits);
    }

    private record Scored<T>(T item, int score, int position) {
    }

    private static final class StoredResource {

        private final String title;
        private final String content;
        private final String abstractText;

        private StoredResource(String title, String content, String abstractText) {
            this.title = title;
            this.content = content;
            this.abstractText = abstractText;
        }

        static StoredResource of(String title, String content) {
            return new StoredResource(title, content, abstractFor(content));
        }

        long size() {
            return content.getBytes(StandardCharsets.UTF_8).length;
        }

        private static String abstractFor(String content) {
            for (String line : content.split("\\R")) {
                String trimmed = line.strip();
                if (!trimmed.isEmpty()) {
                    return trimmed.length() > ABSTRACT_MAX_LENGTH ? trimmed.substring(0, ABSTRACT_MAX_LENGTH) : trimmed;
                }
            }
            return "";
        }
    }
}
