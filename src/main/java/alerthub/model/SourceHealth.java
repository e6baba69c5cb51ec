package alerthub.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 数据源健康记录，按(sourceType, sourceId)唯一
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SourceHealth {
    private AlertSource sourceType;
    private String sourceId;
    private Instant lastSuccessAt;
    private Instant lastErrorAt;
    private String lastErrorMessage;
    private int failCount;
    private Instant nextRetryAt;
}
