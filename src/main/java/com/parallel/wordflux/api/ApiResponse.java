package com.parallel.wordflux.api;

import java.util.Map;

/**
 * HTTP-style response produced by {@link WordCountHandler}.
 */
public record ApiResponse(int statusCode, Map<String, String> headers, String body) {

    public ApiResponse {
        headers = Map.copyOf(headers);
    }
}
