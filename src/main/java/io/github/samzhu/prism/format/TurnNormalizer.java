package io.github.samzhu.prism.format;

import java.util.ArrayList;
import java.util.List;

import io.github.samzhu.prism.model.ContentPart;
import io.github.samzhu.prism.model.Turn;

/**
 * 對話回合正規化
 *
 * <p>後端要求 user / assistant 交替出現，因此：
 * <ul>
 *   <li>移除沒有內容的回合</li>
 *   <li>合併相鄰的同角色回合，內容依原順序串接</li>
 * </ul>
 *
 * <p>呼叫前 system 已抽出、tool 角色已轉為 user。
 */
public final class TurnNormalizer {

    private TurnNormalizer() {
    }

    public static List<Turn> normalize(List<Turn> turns) {
        List<Turn> merged = new ArrayList<>();
        for (Turn turn : turns) {
            if (turn.isEmpty()) {
                continue;
            }
            int last = merged.size() - 1;
            if (last >= 0 && merged.get(last).role() == turn.role()) {
                List<ContentPart> content = new ArrayList<>(merged.get(last).content());
                content.addAll(turn.content());
                merged.set(last, new Turn(turn.role(), content));
            } else {
                merged.add(turn);
            }
        }
        return merged;
    }
}
