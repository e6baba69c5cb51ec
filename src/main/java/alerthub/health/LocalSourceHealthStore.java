package alerthub.health;

import alerthub.model.AlertSource;
import alerthub.model.SourceHealth;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * 进程内健康记录存储，同一key的写入由ConcurrentHashMap.compute串行化
 */
public class LocalSourceHealthStore implements SourceHealthStore {
    private final Map<String, SourceHealth> rows = new ConcurrentHashMap<>();

    @Override
    public Optional<SourceHealth> find(AlertSource sourceType, String sourceId) {
        return Optional.ofNullable(rows.get(key(sourceType, sourceId))).map(row -> row.toBuilder().build());
    }

    @Override
    public List<SourceHealth> findAll() {
        List<SourceHealth> result = new ArrayList<>();
        rows.values().forEach(row -> result.add(row.toBuilder().build()));
        return result;
    }

    @Override
    public SourceHealth update(AlertSource sourceType, String sourceId, UnaryOperator<SourceHealth> mutation) {
        SourceHealth updated = rows.compute(key(sourceType, sourceId), (key, current) -> {
            SourceHealth base = current != null
                    ? current.toBuilder().build()
                    : SourceHealth.builder().sourceType(sourceType).sourceId(sourceId).build();
            return mutation.apply(base);
        });
        return updated.toBuilder().build();
    }

    private static String key(AlertSource sourceType, String sourceId) {
        return sourceType.name() + ":" + sourceId;
    }
}
