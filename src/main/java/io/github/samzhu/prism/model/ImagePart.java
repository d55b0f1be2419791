package io.github.samzhu.prism.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 圖片內容，來源為 base64 資料或 URL
 */
public record ImagePart(Source source) implements ContentPart {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Source(
        String type,
        @JsonProperty("media_type")
        String mediaType,
        String data,
        String url
    ) {
        public static Source base64(String mediaType, String data) {
            return new Source("base64", mediaType, data, null);
        }

        public static Source url(String url) {
            return new Source("url", null, null, url);
        }
    }
}
