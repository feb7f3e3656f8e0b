package com.locai.api;

import com.locai.config.AgentPreset;
import com.locai.workflow.WorkflowService;
import com.locai.workflow.model.WorkflowState;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.util.List;

@RestController
@RequestMapping("/api/chat/agent")
public class WorkflowController {

    static final String WORKFLOW_ID_HEADER = "X-Workflow-Id";

    private final WorkflowService workflowService;

    public WorkflowController(WorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    /**
     * Streams the run as newline-delimited JSON events. Admission errors are answered before the stream opens.
     */
    @PostMapping(value = "/workflow", produces = MediaType.APPLICATION_NDJSON_VALUE)
    public ResponseEntity<StreamingResponseBody> runWorkflow(@Valid @RequestBody WorkflowRunRequest request) {
        WorkflowService.PreparedRun prepared = workflowService.prepare(request);
        StreamingResponseBody body = out -> workflowService.execute(prepared, out);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_NDJSON)
                .header(WORKFLOW_ID_HEADER, prepared.workflowId())
                .body(body);
    }

    @DeleteMapping("/workflow/{workflowId}")
    public CancelRunResponse cancelWorkflow(@PathVariable String workflowId) {
        boolean cancelled = workflowService.cancel(workflowId);
        return cancelled ? CancelRunResponse.success() : CancelRunResponse.notFound();
    }

    @GetMapping("/workflow/active/{conversationId}")
    public ResponseEntity<ActiveWorkflowResponse> activeWorkflow(@PathVariable String conversationId) {
        return workflowService.checkActive(conversationId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @DeleteMapping("/workflow/active/{conversationId}")
    public WorkflowState discardWorkflow(@PathVariable String conversationId) {
        return workflowService.discard(conversationId);
    }

    @GetMapping("/presets")
    public List<AgentPreset> presets() {
        return workflowService.presets();
    }
}
