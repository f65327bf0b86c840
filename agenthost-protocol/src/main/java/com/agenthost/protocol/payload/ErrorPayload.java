package com.agenthost.protocol.payload;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.Locale;

/**
 * In-band {@code error} event. The request stream sends {@code error} and
 * {@code error_code}; the socket sends {@code message} at the top level.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ErrorPayload {

    @JsonAlias({ "message", "detail" })
    private String error;

    @JsonProperty("error_code")
    @JsonAlias({ "code" })
    private String errorCode;

    public String messageOr(String fallback) {
        return error == null || error.isBlank() ? fallback : error;
    }

    public boolean isAuthFailure() {
        return "unauthorized".equals(errorCode) || "session_expired".equals(errorCode);
    }

    public boolean isRateLimited() {
        if ("rate_limited".equals(errorCode) || "429".equals(errorCode)) {
            return true;
        }
        return error != null && error.toLowerCase(Locale.ROOT).contains("rate limit");
    }
}
