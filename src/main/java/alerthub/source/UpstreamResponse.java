package alerthub.source;

import lombok.Value;

/**
 * 已完整读取的上游响应
 */
@Value
public class UpstreamResponse {
    int code;
    String contentType;
    String body;

    public boolean isSuccessful() {
        return code >= 200 && code < 300;
    }
}
