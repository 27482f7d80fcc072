package com.acme.devtools.flowtap.flow;

import com.acme.devtools.flowtap.util.Headers;

import java.util.Map;

/**
 * Optional overrides applied to an original response on resume. A {@code null} field keeps
 * the original value. Header overrides are merged into the original headers.
 */
public record ModifiedResponse(Integer statusCode, Map<String, String> headers, String content) {

    public static final ModifiedResponse PASS_THROUGH = new ModifiedResponse(null, null, null);

    public ModifiedResponse {
        headers = headers == null ? null : Headers.copyOf(headers);
    }

    public static ModifiedResponse of(ResponseSnapshot response) {
        return new ModifiedResponse(response.statusCode(), response.headers(), response.body());
    }

    public boolean isPassThrough() {
        return statusCode == null && headers == null && content == null;
    }

    public ResponseSnapshot applyTo(ResponseSnapshot original) {
        if (isPassThrough()) {
            return original;
        }
        int status = statusCode != null ? statusCode : original.statusCode();
        String reason = statusCode != null && statusCode != original.statusCode() ? "" : original.reason();
        return new ResponseSnapshot(
            status,
            reason,
            Headers.merge(original.headers(), headers),
            content != null ? content : original.body()
        );
    }

    /** Layers {@code other} over this modification; non-null fields of {@code other} win. */
    public ModifiedResponse overriddenBy(ModifiedResponse other) {
        if (other == null || other.isPassThrough()) {
            return this;
        }
        Map<String, String> mergedHeaders;
        if (headers == null) {
            mergedHeaders = other.headers;
        } else {
            mergedHeaders = other.headers == null ? headers : Headers.merge(headers, other.headers);
        }
        return new ModifiedResponse(
            other.statusCode != null ? other.statusCode : statusCode,
            mergedHeaders,
            other.content != null ? other.content : content
        );
    }
}
