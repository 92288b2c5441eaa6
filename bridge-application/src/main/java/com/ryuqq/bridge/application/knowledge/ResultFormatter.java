package com.ryuqq.bridge.application.knowledge;

import com.ryuqq.bridge.core.model.AddResourceResult;
import com.ryuqq.bridge.core.model.DirectoryEntry;
import com.ryuqq.bridge.core.model.MemoryHit;
import com.ryuqq.bridge.core.model.ResourceHit;
import com.ryuqq.bridge.core.model.SearchResult;
import com.ryuqq.bridge.core.model.SessionInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders backend results as display text.
 *
 * <p>Stateless apart from its limits; safe to share between threads.</p>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public final class ResultFormatter {

    private final KnowledgeServiceConfig config;

    public ResultFormatter(KnowledgeServiceConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    public String formatSearch(String query, SearchResult result) {
        List<String> entries = hitEntries(result);
        if (entries.isEmpty()) {
            return "Search '" + query + "' found no results (total=" + result.total() + ")";
        }
        return "Search '" + query + "' found " + result.total() + " results:\n\n" + String.join("\n\n", entries);
    }

    public String formatFind(String query, SearchResult result) {
        List<String> entries = hitEntries(result);
        if (result.total() == 0 || entries.isEmpty()) {
            return "Deep search '" + query + "' found no results";
        }
        return "Deep search '" + query + "' found " + result.total() + " results:\n\n" + String.join("\n\n", entries);
    }

    public String formatAddResource(AddResourceResult result) {
        if (result.hasErrors()) {
            return "Failed to add resource: " + String.join(", ", result.errors());
        }
        String rootUri = result.rootUri() == null ? "" : result.rootUri();
        return "Resource added: " + rootUri + " (status=" + result.status() + ")";
    }

    public String fileNotFound(String path) {
        return "File not found: " + path;
    }

    public String formatDirectory(String uri, List<DirectoryEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return "Directory " + uri + " is empty";
        }
        StringBuilder sb = new StringBuilder("Directory ").append(uri).append(':');
        for (DirectoryEntry entry : entries) {
            sb.append("\n  [").append(entry.directory() ? 'D' : 'F').append("] ")
                .append(entry.name()).append(" (").append(entry.size()).append("b)");
        }
        return sb.toString();
    }

    public String formatRead(String content) {
        return truncate(content == null ? "" : content, config.readMaxLength());
    }

    public String formatSessions(List<SessionInfo> sessions) {
        if (sessions == null || sessions.isEmpty()) {
            return "No sessions";
        }
        StringBuilder sb = new StringBuilder("Sessions:");
        sessions.stream()
            .limit(config.maxSessions())
            .forEach(session -> sb.append("\n  - ").append(session.sessionId()));
        return sb.toString();
    }

    /**
     * Builds prompt context. Entries with no text are skipped.
     *
     * @return context text, empty when nothing qualifies
     */
    public String formatContext(SearchResult result) {
        List<String> parts = new ArrayList<>();
        result.memories().stream()
            .limit(config.contextMaxEntries())
            .map(MemoryHit::content)
            .filter(content -> !content.isEmpty())
            .forEach(content -> parts.add("[memory] " + content));
        for (ResourceHit hit : result.resources().subList(0, Math.min(config.contextMaxEntries(), result.resources().size()))) {
            String content = hit.contentOrAbstract();
            if (!content.isEmpty()) {
                parts.add("[knowledge:" + hit.titleOrUri() + "] " + truncate(content, config.contextSnippetLength()));
            }
        }
        return String.join("\n\n", parts);
    }

    private List<String> hitEntries(SearchResult result) {
        List<String> entries = new ArrayList<>();
        for (MemoryHit memory : result.memories()) {
            entries.add("[memory] " + truncate(memory.content(), config.snippetLength()));
        }
        for (ResourceHit resource : result.resources()) {
            entries.add("[resource:" + resource.uri() + "] " + truncate(resource.contentOrAbstract(), config.snippetLength()));
        }
        return entries;
    }

    static String truncate(String text, int maxLength) {
        return text.length() > maxLength ? text.substring(0, maxLength) : text;
    }
}
