package com.locai.api;

public record CancelRunResponse(
        String status,
        String message
) {
    public static CancelRunResponse success() {
        return new CancelRunResponse("success", "Workflow cancellation requested.");
    }

    public static CancelRunResponse notFound() {
        return new CancelRunResponse("not-found", "No running workflow with this id.");
    }
}
