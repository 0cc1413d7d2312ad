package com.redzone.overweight.infrastructure.web.dto;

public record RefreshResponse(
        String status,
        String message
) {
    public static RefreshResponse started() {
        return new RefreshResponse("ok", "Refresh started, check back in ~60 seconds.");
    }

    public static RefreshResponse failed(String message) {
        return new RefreshResponse("error", message);
    }
}
