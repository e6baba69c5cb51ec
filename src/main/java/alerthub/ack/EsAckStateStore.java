package alerthub.ack;

import alerthub.model.AckState;
import alerthub.utils.AlertHubException;
import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.OpType;
import co.elastic.clients.elasticsearch.core.GetResponse;
import co.elastic.clients.elasticsearch.core.MgetResponse;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.get.GetResult;
import co.elastic.clients.elasticsearch.core.mget.MultiGetResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * 基于Elasticsearch的确认状态存储，单条写入使用 if_seq_no/if_primary_term 乐观并发控制
 */
@Slf4j
public class EsAckStateStore implements AckStateStore {
    private static final int MAX_CONFLICT_RETRIES = 5;
    private static final int MAX_UNRESOLVED = 10000;

    private final ElasticsearchClient esClient;
    private final String index;

    public EsAckStateStore(ElasticsearchClient esClient, String index) {
        this.esClient = esClient;
        this.index = index;
        ensureIndexExists();
    }

    @Override
    public Optional<AckState> find(String alertId) {
        try {
            GetResponse<AckState> response = esClient.get(g -> g.index(index).id(alertId), AckState.class);
            return response.found() ? Optional.ofNullable(response.source()) : Optional.empty();
        } catch (IOException | ElasticsearchException e) {
            throw new AlertHubException("读取告警状态失败: " + alertId, e);
        }
    }

    @Override
    public Map<String, AckState> findByIds(Collection<String> alertIds) {
        Map<String, AckState> result = new HashMap<>();
        if (alertIds.isEmpty()) {
            return result;
        }
        try {
            MgetResponse<AckState> response = esClient.mget(m -> m
                            .index(index)
                            .ids(new ArrayList<>(alertIds)),
                    AckState.class);
            for (MultiGetResponseItem<AckState> item : response.docs()) {
                if (!item.isResult()) {
                    continue;
                }
                GetResult<AckState> doc = item.result();
                if (doc.found() && doc.source() != null) {
                    result.put(doc.id(), doc.source());
                }
            }
            return result;
        } catch (IOException | ElasticsearchException e) {
            throw new AlertHubException("批量读取告警状态失败", e);
        }
    }

    @Override
    public List<AckState> findUnresolved() {
        try {
            SearchResponse<AckState> response = esClient.search(s -> s
                            .index(index)
                            .query(q -> q.bool(b -> b
                                    .mustNot(mn -> mn.term(t -> t.field("status").value("resolved")))))
                            .size(MAX_UNRESOLVED),
                    AckState.class);
            List<AckState> states = new ArrayList<>();
            for (Hit<AckState> hit : response.hits().hits()) {
                if (hit.source() != null) {
                    states.add(hit.source());
                }
            }
            return states;
        } catch (IOException | ElasticsearchException e) {
            throw new AlertHubException("查询未恢复告警状态失败", e);
        }
    }

    @Override
    public AckState compute(String alertId, Function<Optional<AckState>, AckState> mutation) {
        for (int attempt = 1; attempt <= MAX_CONFLICT_RETRIES; attempt++) {
            try {
                GetResponse<AckState> current = esClient.get(g -> g.index(index).id(alertId), AckState.class);
                boolean exists = current.found() && current.source() != null;
                AckState updated = mutation.apply(exists ? Optional.of(current.source()) : Optional.empty());
                if (exists) {
                    long seqNo = current.seqNo();
                    long primaryTerm = current.primaryTerm();
                    esClient.index(i -> i
                            .index(index)
                            .id(alertId)
                            .document(updated)
                            .ifSeqNo(seqNo)
                            .ifPrimaryTerm(primaryTerm));
                } else {
                    esClient.index(i -> i
                            .index(index)
                            .id(alertId)
                            .opType(OpType.Create)
                            .document(updated));
                }
                return updated;
            } catch (ElasticsearchException e) {
                if (e.status() != 409) {
                    throw new AlertHubException("写入告警状态失败: " + alertId, e);
                }
                log.debug("告警状态写入冲突, 重试第{}次: {}", attempt, alertId);
            } catch (IOException e) {
                throw new AlertHubException("写入告警状态失败: " + alertId, e);
            }
        }
        throw new AlertHubException("写入告警状态冲突次数过多: " + alertId);
    }

    private void ensureIndexExists() {
        try {
            boolean exists = esClient.indices().exists(req -> req.index(index)).value();
            if (!exists) {
                esClient.indices().create(req -> req
                        .index(index)
                        .mappings(m -> m
                                .properties("alertId", p -> p.keyword(k -> k))
                                .properties("status", p -> p.keyword(k -> k))
                                .properties("note", p -> p.text(t -> t))
                                .properties("updatedBy", p -> p.keyword(k -> k))
                                .properties("updatedAt", p -> p.dateNanos(d -> d))
                                .properties("acknowledgedAt", p -> p.dateNanos(d -> d))
                                .properties("resolvedAt", p -> p.dateNanos(d -> d))
                                .properties("createdAt", p -> p.dateNanos(d -> d))
                        )
                );
                log.info("已创建告警状态索引: {}", index);
            }
        } catch (IOException | ElasticsearchException e) {
            throw new AlertHubException("创建告警状态索引失败: " + index, e);
        }
    }
}
