package com.openforge.netagent.context;

import com.openforge.netagent.planner.FilterExtractor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Short-lived memory of one conversation, letting a follow-up such as
 * "what are their interface statuses?" reuse the devices found by the
 * previous query.
 *
 * Entries older than the context timeout are dropped lazily whenever the
 * context is read or written; nothing runs in the background. An instance
 * belongs to a single conversation and is not thread-safe.
 */
@Slf4j
public class ContextManager {

    private static final Pattern BACK_REFERENCE = Pattern.compile(
            "\\b(their|them|they|those|these|its|it|same)\\b", Pattern.CASE_INSENSITIVE);

    private final Deque<ContextEntry> entries = new ArrayDeque<>();
    private final Duration            timeout;
    private final int                 maxHistory;
    private final Clock               clock;
    private final FilterExtractor     extractor;

    public ContextManager(Duration timeout, int maxHistory, Clock clock, FilterExtractor extractor) {
        this.timeout    = timeout;
        this.maxHistory = Math.max(1, maxHistory);
        this.clock      = clock;
        this.extractor  = extractor;
    }

    public void update(String queryText, List<String> resolvedTools, Map<String, List<String>> resolvedEntities) {
        prune();
        entries.addLast(new ContextEntry(queryText, resolvedTools, resolvedEntities, clock.instant()));
        while (entries.size() > maxHistory) {
            entries.removeFirst();
        }
    }

    /**
     * Filters carried over from the most recent live entry that resolved
     * entities, or an empty map when the query is not a follow-up.
     *
     * @param weakMatch whether the planner found no pattern or directive for the query
     */
    public Map<String, Object> resolveImplicit(String queryText, boolean weakMatch) {
        prune();
        if (!isFollowUp(queryText, weakMatch)) return Map.of();

        Iterator<ContextEntry> newestFirst = entries.descendingIterator();
        while (newestFirst.hasNext()) {
            ContextEntry entry = newestFirst.next();
            if (entry.hasEntities()) {
                Map<String, Object> filters = new LinkedHashMap<>();
                entry.entities().forEach((type, ids) -> {
                    if (!ids.isEmpty()) filters.put(type, ids);
                });
                log.debug("[Context] \"{}\" inherits {} from \"{}\"", queryText, filters, entry.query());
                return filters;
            }
        }
        return Map.of();
    }

    /** A back-reference pronoun, or a weak match that names no subject of its own. */
    public boolean isFollowUp(String queryText, boolean weakMatch) {
        if (queryText == null) return false;
        if (BACK_REFERENCE.matcher(queryText).find()) return true;
        return weakMatch && !extractor.mentionsSubject(queryText);
    }

    /** Live entries, oldest first. */
    public List<ContextEntry> entries() {
        prune();
        return List.copyOf(entries);
    }

    /** One line per live entry, for the reasoning prompt. */
    public String describe() {
        List<ContextEntry> live = entries();
        if (live.isEmpty()) return "";
        StringBuilder sb = new StringBuilder();
        for (ContextEntry entry : live) {
            sb.append("- \"").append(entry.query()).append("\" answered by ")
              .append(entry.tools()).append(" resolved ").append(entry.entities()).append('\n');
        }
        return sb.toString();
    }

    public void clear() {
        entries.clear();
    }

    private void prune() {
        Instant now = clock.instant();
        entries.removeIf(entry -> Duration.between(entry.timestamp(), now).compareTo(timeout) > 0);
    }
}
