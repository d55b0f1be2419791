package io.github.samzhu.prism.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 對話角色
 *
 * <p>{@code SYSTEM} 與 {@code TOOL} 只出現在轉換過程中；正規化後的對話只剩
 * {@code USER} 與 {@code ASSISTANT}。
 */
public enum Role {
    SYSTEM("system"),
    USER("user"),
    ASSISTANT("assistant"),
    TOOL("tool");

    private final String wireName;

    Role(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
