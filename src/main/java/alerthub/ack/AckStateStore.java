package alerthub.ack;

import alerthub.model.AckState;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * 确认状态存储，按告警id读写，单条写入必须原子
 */
public interface AckStateStore {

    Optional<AckState> find(String alertId);

    Map<String, AckState> findByIds(Collection<String> alertIds);

    /**
     * 所有状态不是resolved的记录
     */
    List<AckState> findUnresolved();

    /**
     * 原子的读-改-写，mutation拿到当前记录（可能不存在）并返回新记录
     */
    AckState compute(String alertId, Function<Optional<AckState>, AckState> mutation);
}
