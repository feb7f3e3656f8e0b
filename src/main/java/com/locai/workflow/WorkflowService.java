package com.locai.workflow;

import com.locai.api.ActiveWorkflowResponse;
import com.locai.api.WorkflowRunRequest;
import com.locai.config.AgentPreset;
import com.locai.config.WorkflowProperties;
import com.locai.stream.NdjsonEventWriter;
import com.locai.stream.WorkflowEventCodec;
import com.locai.workflow.model.ConversationContext;
import com.locai.workflow.model.WorkflowConfig;
import com.locai.workflow.model.WorkflowState;
import com.locai.workflow.persistence.WorkflowPersistenceService;
import com.locai.workflow.runtime.RunContext;
import com.locai.workflow.tools.FilteringToolCallbackProvider;
import com.locai.workflow.tools.ToolDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.io.OutputStream;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for starting, resuming, cancelling and discarding workflow runs.
 * Admission happens in {@link #prepare} so that conflicts surface before the event stream opens.
 */
@Service
@Slf4j
public class WorkflowService {

    private final WorkflowOrchestrator orchestrator;
    private final WorkflowRunRegistry registry;
    private final WorkflowPersistenceService persistenceService;
    private final WorkflowProperties properties;
    private final ToolDispatcher toolDispatcher;
    private final WorkflowEventCodec codec;
    private final ExecutorService workerExecutor;
    private final Clock clock;

    public WorkflowService(WorkflowOrchestrator orchestrator,
                           WorkflowRunRegistry registry,
                           WorkflowPersistenceService persistenceService,
                           WorkflowProperties properties,
                           ToolDispatcher toolDispatcher,
                           WorkflowEventCodec codec,
                           @Qualifier("workerExecutor") ExecutorService workerExecutor,
                           Clock clock) {
        this.orchestrator = orchestrator;
        this.registry = registry;
        this.persistenceService = persistenceService;
        this.properties = properties;
        this.toolDispatcher = toolDispatcher;
        this.codec = codec;
        this.workerExecutor = workerExecutor;
        this.clock = clock;
    }

    /**
     * A run that has been admitted and registered but not started yet.
     */
    public record PreparedRun(WorkflowRun run, WorkflowRunRegistry.LiveRun liveRun) {
        public String workflowId() {
            return run.state().getId();
        }
    }

    /**
     * Validates the request, enforces one active run per conversation and registers the run.
     *
     * @throws ResponseStatusException 400 for an unknown preset, 404 for an unknown resume target,
     *                                 409 when the conversation already has an unfinished run
     */
    public PreparedRun prepare(WorkflowRunRequest request) {
        String conversationId = StringUtils.hasText(request.conversationId()) ? request.conversationId().trim() : null;
        AgentPreset preset = resolvePreset(request.presetId());

        registry.liveWorkflowFor(conversationId).ifPresent(live -> {
            throw conflict("Conversation already has a running workflow " + live);
        });
        Optional<WorkflowState> orphan = persistenceService.checkActiveWorkflow(conversationId);
        boolean resume = StringUtils.hasText(request.workflowId());

        WorkflowState state;
        if (resume) {
            state = orphan.filter(candidate -> request.workflowId().equals(candidate.getId()))
                    .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                            "No resumable workflow " + request.workflowId() + " for this conversation."));
            state.prepareResume();
        } else {
            if (orphan.isPresent()) {
                throw conflict("Conversation has an unfinished workflow " + orphan.get().getId()
                        + ". Resume or discard it first.");
            }
            state = WorkflowState.create(UUID.randomUUID().toString(), conversationId, request.message(),
                    buildConfig(request, preset), clock.instant());
        }

        WorkflowRunRegistry.LiveRun liveRun;
        try {
            liveRun = registry.register(state.getId(), conversationId);
        } catch (WorkflowConflictException ex) {
            throw conflict(ex.getMessage());
        }
        RunContext runContext = new RunContext(state.getId(), liveRun.token(), workerExecutor, clock,
                Duration.ofMillis(state.getConfig().timeoutMs()));
        ConversationContext context = new ConversationContext(
                preset != null ? preset.getSystemPrompt() : null, request.conversationHistory());
        WorkflowRun run = new WorkflowRun(state, context, resume ? null : request.initialPlan(), resume, runContext);
        return new PreparedRun(run, liveRun);
    }

    /**
     * Runs an admitted workflow to completion, writing its events to {@code out}.
     */
    public void execute(PreparedRun prepared, OutputStream out) {
        NdjsonEventWriter writer = new NdjsonEventWriter(out, codec, prepared.liveRun().token());
        try {
            orchestrator.run(prepared.run(), writer);
        } finally {
            registry.unregister(prepared.workflowId());
        }
    }

    public boolean cancel(String workflowId) {
        return registry.cancel(workflowId, "Cancelled by user");
    }

    public Optional<ActiveWorkflowResponse> checkActive(String conversationId) {
        Optional<String> live = registry.liveWorkflowFor(conversationId);
        Optional<WorkflowState> stored = persistenceService.checkActiveWorkflow(conversationId);
        if (live.isEmpty() && stored.isEmpty()) {
            return Optional.empty();
        }
        String workflowId = live.orElseGet(() -> stored.get().getId());
        return Optional.of(new ActiveWorkflowResponse(live.isEmpty(), live.isPresent(), workflowId,
                stored.orElse(null)));
    }

    /**
     * Ends an orphaned run of the conversation as cancelled.
     *
     * @throws ResponseStatusException 409 while the run is live, 404 when nothing is stored
     */
    public WorkflowState discard(String conversationId) {
        if (registry.liveWorkflowFor(conversationId).isPresent()) {
            throw conflict("The workflow of this conversation is still running. Cancel it instead.");
        }
        WorkflowState discarded = persistenceService.discardActive(conversationId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "No unfinished workflow for this conversation."));
        log.info("Discarded orphaned workflow {} of conversation {}", discarded.getId(), conversationId);
        return discarded;
    }

    public List<AgentPreset> presets() {
        return List.copyOf(properties.getPresets());
    }

    private @Nullable AgentPreset resolvePreset(@Nullable String presetId) {
        if (!StringUtils.hasText(presetId)) {
            return null;
        }
        return properties.findPreset(presetId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown preset: " + presetId));
    }

    WorkflowConfig buildConfig(WorkflowRunRequest request, @Nullable AgentPreset preset) {
        List<String> available = toolDispatcher.availableTools();
        List<String> requested;
        if (request.enabledTools() != null && !request.enabledTools().isEmpty()) {
            requested = request.enabledTools();
        } else if (preset != null && !preset.getEnabledTools().isEmpty()) {
            requested = preset.getEnabledTools();
        } else {
            requested = available;
        }

        WorkflowConfig config = properties.defaultConfig(request.model(), knownTools(requested, available));
        if (request.maxSteps() != null) {
            config = config.withMaxSteps(request.maxSteps());
        }
        if (request.timeoutMs() != null) {
            config = config.withTimeouts(request.timeoutMs(), Math.min(config.stepTimeoutMs(), request.timeoutMs()));
        }
        config = config.withFlags(
                request.enableReflection() != null ? request.enableReflection() : config.enableReflection(),
                request.enablePlanning() != null ? request.enablePlanning() : config.enablePlanning());
        if (StringUtils.hasText(request.host())) {
            config = config.withHost(request.host().trim());
        }
        return config;
    }

    private List<String> knownTools(List<String> requested, List<String> available) {
        List<String> known = new ArrayList<>();
        for (String name : requested) {
            Optional<String> match = FilteringToolCallbackProvider.resolve(name, available);
            if (match.isEmpty()) {
                log.debug("Ignoring unknown tool {}", name);
            } else if (!known.contains(match.get())) {
                known.add(match.get());
            }
        }
        return known;
    }

    private static ResponseStatusException conflict(String message) {
        return new ResponseStatusException(HttpStatus.CONFLICT, message);
    }
}
