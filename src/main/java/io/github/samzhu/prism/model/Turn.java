package io.github.samzhu.prism.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * 單一對話回合
 *
 * @param role 角色
 * @param content 依序排列的內容區塊
 */
public record Turn(
    Role role,
    List<ContentPart> content
) {
    public Turn {
        content = content == null ? List.of() : List.copyOf(content);
    }

    public static Turn text(Role role, String text) {
        return new Turn(role, List.of(new TextPart(text)));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return content.isEmpty();
    }
}
