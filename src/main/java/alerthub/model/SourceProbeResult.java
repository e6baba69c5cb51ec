package alerthub.model;

import lombok.Value;

/**
 * 数据源连通性测试结果
 */
@Value
public class SourceProbeResult {
    boolean ok;
    String message;
    String sampleLine;

    public static SourceProbeResult connected(String sampleLine) {
        return sampleLine == null
                ? new SourceProbeResult(true, "Connected. No active alerts.", null)
                : new SourceProbeResult(true, "Sample alert fetched.", sampleLine);
    }

    public static SourceProbeResult failed(String message) {
        return new SourceProbeResult(false, message, null);
    }
}
