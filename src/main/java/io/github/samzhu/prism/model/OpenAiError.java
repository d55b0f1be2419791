package io.github.samzhu.prism.model;

/**
 * OpenAI 格式的錯誤回應：{@code {"error":{"message":...,"type":...,"code":null}}}
 *
 * <p>串流中發生錯誤時也以此格式送出單一 frame。
 */
public record OpenAiError(Body error) {

    public record Body(
        String message,
        String type,
        String code
    ) {}

    public static OpenAiError of(String errorType, String message) {
        return new OpenAiError(new Body(message, errorType, null));
    }
}
