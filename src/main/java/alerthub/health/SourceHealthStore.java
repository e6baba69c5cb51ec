package alerthub.health;

import alerthub.model.AlertSource;
import alerthub.model.SourceHealth;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * 数据源健康记录存储，按(sourceType, sourceId)读写
 */
public interface SourceHealthStore {

    Optional<SourceHealth> find(AlertSource sourceType, String sourceId);

    List<SourceHealth> findAll();

    /**
     * 对单条记录做原子的读-改-写，不存在时传入初始记录
     */
    SourceHealth update(AlertSource sourceType, String sourceId, UnaryOperator<SourceHealth> mutation);
}
