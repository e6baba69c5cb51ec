package alerthub.aggregator;

import alerthub.model.Alert;
import alerthub.model.AlertGroup;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 告警分组去重。纯函数，每次拉取都会重新计算。
 * 有上游指纹时按指纹分组，否则按推断出的服务和环境分组。
 */
public class AlertGrouper {

    /**
     * 时间倒序，时间相同按id保证结果与输入顺序无关
     */
    static final Comparator<Alert> NEWEST_FIRST = Comparator
            .comparing(Alert::getTimestamp, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Alert::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    public List<AlertGroup> group(List<Alert> alerts) {
        Map<String, List<Alert>> groups = new LinkedHashMap<>();
        for (Alert alert : alerts) {
            groups.computeIfAbsent(groupKey(alert), key -> new ArrayList<>()).add(alert);
        }

        List<AlertGroup> result = new ArrayList<>(groups.size());
        groups.forEach((key, members) -> {
            members.sort(NEWEST_FIRST);
            List<String> ids = members.stream().map(Alert::getId).collect(Collectors.toList());
            result.add(new AlertGroup(members.get(0), key, members.size(), ids));
        });
        result.sort(Comparator.comparing(AlertGroup::getRepresentative, NEWEST_FIRST));
        return result;
    }

    public static String groupKey(Alert alert) {
        String source = alert.getSource() != null ? alert.getSource().name() : "";
        String sourceId = StringUtils.defaultString(alert.getSourceId());
        String fingerprint = StringUtils.trimToEmpty(alert.getFingerprint());
        String basis = !fingerprint.isEmpty()
                ? String.join(":", "fingerprint", source, sourceId, fingerprint)
                : String.join(":", "service", source, sourceId, inferService(alert),
                StringUtils.defaultString(alert.getEnvironment()));
        return DigestUtils.sha1Hex(basis);
    }

    /**
     * service、instance、name中第一个非空值，都为空时为"unknown"
     */
    static String inferService(Alert alert) {
        for (String candidate : new String[]{alert.getService(), alert.getInstance(), alert.getName()}) {
            if (StringUtils.isNotBlank(candidate)) {
                return candidate.trim();
            }
        }
        return "unknown";
    }
}
