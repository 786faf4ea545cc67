package com.openforge.netagent.api;

import com.openforge.netagent.agent.Conversation;
import com.openforge.netagent.agent.NetworkAgent;
import com.openforge.netagent.agent.QueryOutcome;
import com.openforge.netagent.api.dto.QueryRequest;
import com.openforge.netagent.api.dto.QueryResponse;
import com.openforge.netagent.api.dto.ToolView;
import com.openforge.netagent.config.AgentProperties;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * REST API over {@link NetworkAgent}.
 *
 * Endpoints:
 *   POST   /api/network/query                : answer a question, optionally within a conversation
 *   DELETE /api/network/conversations/{id}   : forget a conversation and its context
 *   GET    /api/network/tools                : registered tools
 *
 * A query naming an unknown conversation id starts a new conversation under
 * that id. A query without an id is answered in a one-off conversation that is
 * not kept, and its response carries no id. Named conversations idle for longer
 * than the context timeout are dropped on the next request. Failed outcomes are
 * returned with HTTP 422 and status FAILED.
 */
@Slf4j
@RestController
@RequestMapping("/api/network")
@RequiredArgsConstructor
public class QueryController {

    private final NetworkAgent    networkAgent;
    private final AgentProperties agentProperties;
    private final Clock           clock;

    private final Map<String, Tracked> conversations = new ConcurrentHashMap<>();

    private static final class Tracked {
        final Conversation conversation;
        volatile Instant   lastUsed;

        Tracked(Conversation conversation, Instant lastUsed) {
            this.conversation = conversation;
            this.lastUsed     = lastUsed;
        }
    }

    // ── Query ────────────────────────────────────────────────────────────────

    @PostMapping("/query")
    public ResponseEntity<QueryResponse> query(@Valid @RequestBody QueryRequest request) {
        Instant now = clock.instant();
        evictIdle(now);

        String id = request.conversationId() != null && !request.conversationId().isBlank()
                ? request.conversationId()
                : null;
        QueryOutcome outcome;
        if (id == null) {
            outcome = networkAgent.newConversation().run(request.query());
        } else {
            Tracked tracked = conversations.compute(id, (key, existing) -> {
                if (existing == null) return new Tracked(networkAgent.newConversation(key), now);
                existing.lastUsed = now;
                return existing;
            });
            outcome = tracked.conversation.run(request.query());
            tracked.lastUsed = clock.instant();
        }
        log.info("[Controller] Conversation {} → {}", id == null ? "(one-off)" : id, outcome.state());

        HttpStatus status = outcome.succeeded() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(QueryResponse.from(id, outcome));
    }

    // ── Conversations ────────────────────────────────────────────────────────

    @DeleteMapping("/conversations/{conversationId}")
    public ResponseEntity<Void> deleteConversation(@PathVariable String conversationId) {
        if (conversations.remove(conversationId) == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND,
                    "Conversation not found: " + conversationId);
        }
        log.info("[Controller] Dropped conversation {}", conversationId);
        return ResponseEntity.noContent().build();
    }

    int activeConversations() {
        return conversations.size();
    }

    private void evictIdle(Instant now) {
        Duration idleLimit = agentProperties.settings().contextTimeoutDuration();
        conversations.entrySet().removeIf(entry -> {
            boolean idle = !now.isBefore(entry.getValue().lastUsed.plus(idleLimit));
            if (idle) log.debug("[Controller] Evicted idle conversation {}", entry.getKey());
            return idle;
        });
    }

    // ── Tools ────────────────────────────────────────────────────────────────

    @GetMapping("/tools")
    public List<ToolView> tools() {
        return networkAgent.toolManager().tools().stream().map(ToolView::from).toList();
    }
}
