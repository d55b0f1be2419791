package io.github.samzhu.prism.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@code GET /v1/models} 回應（OpenAI 格式）
 */
public record ModelList(
    String object,
    List<Entry> data
) {
    public record Entry(
        String id,
        String object,
        long created,
        @JsonProperty("owned_by")
        String ownedBy
    ) {}

    public static ModelList of(List<Entry> data) {
        return new ModelList("list", data);
    }
}
