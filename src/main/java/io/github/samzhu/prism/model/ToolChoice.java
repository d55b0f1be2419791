package io.github.samzhu.prism.model;

/**
 * 工具選擇策略：{@code auto}、{@code none}、{@code any}，或指定工具名稱的 {@code tool}
 */
public record ToolChoice(
    String type,
    String name
) {
    public static final ToolChoice AUTO = new ToolChoice("auto", null);
    public static final ToolChoice NONE = new ToolChoice("none", null);
    public static final ToolChoice ANY = new ToolChoice("any", null);

    public static ToolChoice tool(String name) {
        return new ToolChoice("tool", name);
    }
}
