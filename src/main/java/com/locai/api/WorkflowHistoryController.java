package com.locai.api;

import com.locai.workflow.model.WorkflowState;
import com.locai.workflow.model.WorkflowSummary;
import com.locai.workflow.persistence.RunHistoryStore;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.function.Supplier;

@RestController
@RequestMapping("/api/workflows")
public class WorkflowHistoryController {

    private final RunHistoryStore runHistoryStore;

    public WorkflowHistoryController(RunHistoryStore runHistoryStore) {
        this.runHistoryStore = runHistoryStore;
    }

    @GetMapping
    public List<WorkflowSummary> list(@RequestParam(required = false) String conversationId) {
        return runHistoryStore.list(conversationId);
    }

    @GetMapping("/{id}")
    public WorkflowState get(@PathVariable String id) {
        return validated(() -> runHistoryStore.find(id))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Workflow not found."));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        boolean deleted = validated(() -> runHistoryStore.delete(id));
        if (!deleted) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Workflow not found.");
        }
        return ResponseEntity.noContent().build();
    }

    private static <T> T validated(Supplier<T> call) {
        try {
            return call.get();
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }
}
