package io.github.samzhu.prism.model;

public record TextPart(String text) implements ContentPart {
}
