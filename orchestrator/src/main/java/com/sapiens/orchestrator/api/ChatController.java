package com.sapiens.orchestrator.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sapiens.orchestrator.api.dto.*;
import com.sapiens.orchestrator.model.Artifact;
import com.sapiens.orchestrator.model.ArtifactKind;
import com.sapiens.orchestrator.model.UserState;
import com.sapiens.orchestrator.service.JourneyQueryService;
import com.sapiens.orchestrator.service.OrchestrationException;
import com.sapiens.orchestrator.service.Orchestrator;
import com.sapiens.orchestrator.statemachine.StateMachine;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Locale;

/**
 * REST API for the journey.
 *
 * POST /api/chat                        send one message, get the rendered reply
 * POST /api/users                       explicit user creation (409 if it exists)
 * GET  /api/state/{userId}              state snapshot with valid next targets
 * GET  /api/project/{userId}            active project proposal
 * GET  /api/artifacts/{userId}?kind=    artifact history, all revisions
 * GET  /api/conversation/{userId}       conversation history, oldest first
 * GET  /api/transitions/{userId}        transition log, oldest first
 */
@RestController
@RequestMapping("/api")
public class ChatController {

    private final Orchestrator        orchestrator;
    private final JourneyQueryService queries;
    private final StateMachine        stateMachine;
    private final ObjectMapper        objectMapper;

    public ChatController(Orchestrator orchestrator, JourneyQueryService queries,
                          StateMachine stateMachine, ObjectMapper objectMapper) {
        this.orchestrator = orchestrator;
        this.queries      = queries;
        this.stateMachine = stateMachine;
        this.objectMapper = objectMapper;
    }

    /**
     * Send one message.
     *
     * Example:
     *   curl -X POST http://localhost:8080/api/chat \
     *     -H "Content-Type: application/json" \
     *     -d '{"user_id":"u1","message":"Product Manager"}'
     */
    @PostMapping("/chat")
    public ChatResponse chat(@RequestBody ChatRequest req) {
        return ChatResponse.from(orchestrator.chat(req.userId(), req.message()));
    }

    @PostMapping("/users")
    public ResponseEntity<StateResponse> createUser(@RequestBody CreateUserRequest req) {
        UserState created = orchestrator.createUser(req.userId());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(StateResponse.from(created, stateMachine.validTargets(created)));
    }

    @GetMapping("/state/{userId}")
    public StateResponse state(@PathVariable String userId) {
        return StateResponse.from(queries.snapshot(userId));
    }

    /** Returns 404 if the user is unknown or no project has been proposed yet. */
    @GetMapping("/project/{userId}")
    public ProjectResponse project(@PathVariable String userId) {
        return queries.activeProject(userId)
                .map(ProjectResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "No project for user " + userId));
    }

    @GetMapping("/artifacts/{userId}")
    public List<ArtifactResponse> artifacts(@PathVariable String userId,
                                            @RequestParam(required = false) String kind) {
        return queries.artifacts(userId, parseKind(kind)).stream()
                .map(a -> ArtifactResponse.from(a, payloadOf(a)))
                .toList();
    }

    @GetMapping("/conversation/{userId}")
    public List<ConversationEntryResponse> conversation(@PathVariable String userId,
                                                        @RequestParam(defaultValue = "50") int limit) {
        return queries.conversation(userId, limit).stream()
                .map(ConversationEntryResponse::from)
                .toList();
    }

    @GetMapping("/transitions/{userId}")
    public List<TransitionResponse> transitions(@PathVariable String userId) {
        return queries.transitions(userId).stream()
                .map(TransitionResponse::from)
                .toList();
    }

    // ------------------------------------------------------------------

    private static ArtifactKind parseKind(String kind) {
        if (kind == null || kind.isBlank()) {
            return null;
        }
        try {
            return ArtifactKind.valueOf(kind.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new OrchestrationException(OrchestrationException.Kind.VALIDATION_FAILURE,
                    "unknown artifact kind: " + kind);
        }
    }

    private JsonNode payloadOf(Artifact a) {
        try {
            return objectMapper.readTree(a.getPayloadJson());
        } catch (JsonProcessingException e) {
            // Stored rows are written by our own serializer; show the raw text if one is not JSON.
            return objectMapper.getNodeFactory().textNode(a.getPayloadJson());
        }
    }
}
