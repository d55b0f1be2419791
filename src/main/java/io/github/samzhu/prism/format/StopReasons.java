package io.github.samzhu.prism.format;

/**
 * 後端 stop_reason 與 OpenAI finish_reason 的對應
 *
 * <ul>
 *   <li>{@code max_tokens} → {@code length}</li>
 *   <li>{@code tool_use} → {@code tool_calls}</li>
 *   <li>其他（{@code end_turn}、{@code stop_sequence}、null）→ {@code stop}</li>
 * </ul>
 */
public final class StopReasons {

    private StopReasons() {
    }

    public static String toFinishReason(String stopReason) {
        if ("max_tokens".equals(stopReason)) {
            return "length";
        }
        if ("tool_use".equals(stopReason)) {
            return "tool_calls";
        }
        return "stop";
    }
}
