package io.github.drompincen.codeforge.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiErrorResponse(ApiError error) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ApiError(String message, String type, String code) {}
}
