package io.github.samzhu.prism.apikey;

/**
 * 新發出的 API Key：紀錄與僅此一次可見的明文
 */
public record IssuedApiKey(
    ApiKeyRecord record,
    String plaintext
) {
    @Override
    public String toString() {
        return "IssuedApiKey[id=" + record.id() + ", name=" + record.name() + "]";
    }
}
