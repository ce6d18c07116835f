package com.xammer.remediation.domain;

import com.xammer.remediation.exception.MalformedPayloadException;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * A decoded security finding, valid for one remediation cycle.
 */
@Data
@Builder
public class Finding {

    private final String name;
    private final String parent;
    private final String resourceName;
    private final String organizationId;
    private final String category;
    private final FindingState state;
    private final String notificationConfigName;
    private final String securityMarksName;
    private final Instant createTime;
    private final Instant eventTime;

    /**
     * Scanner specific properties, kept untyped. Read them through {@link #sourceProperty}.
     */
    @Singular
    private final Map<String, Object> sourceProperties;

    public boolean isActive() {
        return state == FindingState.ACTIVE;
    }

    /**
     * Returns the source property {@code key} as {@code type}, or empty when it is absent.
     *
     * @throws MalformedPayloadException if the property is present with another shape
     */
    public <T> Optional<T> sourceProperty(String key, Class<T> type) {
        Object value = sourceProperties.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (!type.isInstance(value)) {
            throw new MalformedPayloadException(String.format(
                    "source property '%s' of finding %s is a %s, expected %s",
                    key, name, value.getClass().getSimpleName(), type.getSimpleName()));
        }
        return Optional.of(type.cast(value));
    }

    public <T> T requireSourceProperty(String key, Class<T> type) {
        return sourceProperty(key, type).orElseThrow(() -> new MalformedPayloadException(
                String.format("source property '%s' missing from finding %s", key, name)));
    }
}
