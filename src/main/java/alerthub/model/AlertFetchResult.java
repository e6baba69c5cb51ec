package alerthub.model;

import lombok.Value;

import java.util.List;

/**
 * 一次全量拉取的结果：尽力返回的告警列表加上每个失败数据源的错误
 */
@Value
public class AlertFetchResult {
    List<Alert> alerts;
    List<AlertFetchError> errors;
}
