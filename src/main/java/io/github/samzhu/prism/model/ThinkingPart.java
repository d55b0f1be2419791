package io.github.samzhu.prism.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ThinkingPart(
    String thinking,
    String signature
) implements ContentPart {
}
