package github.sarthakdev143.pixel_factory.dto;

import github.sarthakdev143.pixel_factory.model.StreamState;

public record StreamCommandResponse(
        String route,
        StreamState state,
        String message) {
}
