package alerthub.log;

import alerthub.utils.AlertHubException;
import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryResponse;
import co.elastic.clients.elasticsearch.core.MgetResponse;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.mget.MultiGetResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.json.JsonData;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 基于Elasticsearch的告警历史存储
 */
@Slf4j
public class EsAlertLogStore implements AlertLogStore {
    private static final int MAX_RESULTS = 10000;
    private static final List<String> QUERY_FIELDS = List.of("name", "severity", "sourceLabel", "source", "instance");

    private final ElasticsearchClient esClient;
    private final String index;

    public EsAlertLogStore(ElasticsearchClient esClient, String index) {
        this.esClient = esClient;
        this.index = index;
        ensureIndexExists();
    }

    @Override
    public void record(Collection<AlertLogEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        try {
            Map<String, AlertLogEntry> existing = findExisting(entries);
            BulkRequest.Builder bulk = new BulkRequest.Builder();
            for (AlertLogEntry entry : entries) {
                AlertLogEntry merged = entry.mergeInto(existing.get(entry.getAlertId()));
                bulk.operations(op -> op.index(i -> i
                        .index(index)
                        .id(merged.getAlertId())
                        .document(merged)));
            }
            BulkResponse response = esClient.bulk(bulk.build());
            if (response.errors()) {
                List<String> failed = response.items().stream()
                        .filter(item -> item.error() != null)
                        .map(BulkResponseItem::id)
                        .collect(Collectors.toList());
                log.error("部分告警历史写入失败: {}", failed);
            }
        } catch (IOException | ElasticsearchException e) {
            throw new AlertHubException("写入告警历史失败", e);
        }
    }

    private Map<String, AlertLogEntry> findExisting(Collection<AlertLogEntry> entries) throws IOException {
        List<String> ids = entries.stream().map(AlertLogEntry::getAlertId).distinct().collect(Collectors.toList());
        MgetResponse<AlertLogEntry> response = esClient.mget(m -> m.index(index).ids(ids), AlertLogEntry.class);
        Map<String, AlertLogEntry> existing = new HashMap<>();
        for (MultiGetResponseItem<AlertLogEntry> item : response.docs()) {
            if (item.isResult() && item.result().found() && item.result().source() != null) {
                existing.put(item.result().id(), item.result().source());
            }
        }
        return existing;
    }

    @Override
    public int pruneBefore(Instant cutoff) {
        try {
            DeleteByQueryResponse response = esClient.deleteByQuery(d -> d
                    .index(index)
                    .query(q -> q.range(r -> r.field("lastSeenAt").lt(JsonData.of(cutoff.toString())))));
            return response.deleted() != null ? response.deleted().intValue() : 0;
        } catch (IOException | ElasticsearchException e) {
            throw new AlertHubException("清理告警历史失败", e);
        }
    }

    @Override
    public List<AlertLogEntry> listSince(Instant cutoff) {
        return pageSince(cutoff, null, MAX_RESULTS, 0);
    }

    @Override
    public long countSince(Instant cutoff, String query) {
        try {
            return esClient.count(c -> c.index(index).query(buildQuery(cutoff, query))).count();
        } catch (IOException | ElasticsearchException e) {
            throw new AlertHubException("统计告警历史失败", e);
        }
    }

    @Override
    public List<AlertLogEntry> pageSince(Instant cutoff, String query, int limit, int offset) {
        try {
            SearchResponse<AlertLogEntry> response = esClient.search(s -> s
                            .index(index)
                            .query(buildQuery(cutoff, query))
                            .sort(so -> so.field(f -> f.field("timestamp").order(SortOrder.Desc)))
                            .sort(so -> so.field(f -> f.field("alertId").order(SortOrder.Asc)))
                            .from(Math.max(0, offset))
                            .size(Math.max(0, Math.min(limit, MAX_RESULTS))),
                    AlertLogEntry.class);
            List<AlertLogEntry> result = new ArrayList<>();
            for (Hit<AlertLogEntry> hit : response.hits().hits()) {
                if (hit.source() != null) {
                    result.add(hit.source());
                }
            }
            return result;
        } catch (IOException | ElasticsearchException e) {
            throw new AlertHubException("查询告警历史失败", e);
        }
    }

    /**
     * 文本条件用不区分大小写的wildcard；timestamp是日期类型，不参与文本匹配
     */
    private Query buildQuery(Instant cutoff, String query) {
        String trimmed = StringUtils.trimToEmpty(query);
        return Query.of(q -> q.bool(b -> {
            b.filter(f -> f.range(r -> r.field("lastSeenAt").gte(JsonData.of(cutoff.toString()))));
            if (!trimmed.isEmpty()) {
                String pattern = "*" + escapeWildcard(trimmed) + "*";
                for (String field : QUERY_FIELDS) {
                    b.should(s -> s.wildcard(w -> w.field(field).value(pattern).caseInsensitive(true)));
                }
                b.minimumShouldMatch("1");
            }
            return b;
        }));
    }

    private static String escapeWildcard(String value) {
        return value.replace("\\", "\\\\").replace("*", "\\*").replace("?", "\\?");
    }

    private void ensureIndexExists() {
        try {
            boolean exists = esClient.indices().exists(req -> req.index(index)).value();
            if (!exists) {
                esClient.indices().create(req -> req
                        .index(index)
                        .mappings(m -> m
                                .properties("alertId", p -> p.keyword(k -> k))
                                .properties("source", p -> p.keyword(k -> k))
                                .properties("sourceLabel", p -> p.keyword(k -> k))
                                .properties("name", p -> p.keyword(k -> k))
                                .properties("severity", p -> p.keyword(k -> k))
                                .properties("message", p -> p.text(t -> t))
                                .properties("instance", p -> p.keyword(k -> k))
                                .properties("timestamp", p -> p.dateNanos(d -> d))
                                .properties("firstSeenAt", p -> p.dateNanos(d -> d))
                                .properties("lastSeenAt", p -> p.dateNanos(d -> d))
                        )
                );
                log.info("已创建告警历史索引: {}", index);
            }
        } catch (IOException | ElasticsearchException e) {
            throw new AlertHubException("创建告警历史索引失败: " + index, e);
        }
    }
}
