package alerthub.ack;

import alerthub.model.AckState;
import alerthub.model.AckStatus;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

public class LocalAckStateStore implements AckStateStore {
    private final Map<String, AckState> states = new ConcurrentHashMap<>();

    @Override
    public Optional<AckState> find(String alertId) {
        return Optional.ofNullable(states.get(alertId)).map(LocalAckStateStore::copy);
    }

    @Override
    public Map<String, AckState> findByIds(Collection<String> alertIds) {
        Map<String, AckState> result = new HashMap<>();
        for (String alertId : alertIds) {
            AckState state = states.get(alertId);
            if (state != null) {
                result.put(alertId, copy(state));
            }
        }
        return result;
    }

    @Override
    public List<AckState> findUnresolved() {
        return states.values().stream()
                .filter(state -> state.getStatus() != AckStatus.RESOLVED)
                .map(LocalAckStateStore::copy)
                .collect(Collectors.toList());
    }

    @Override
    public AckState compute(String alertId, Function<Optional<AckState>, AckState> mutation) {
        AckState updated = states.compute(alertId,
                (id, current) -> copy(mutation.apply(Optional.ofNullable(current).map(LocalAckStateStore::copy))));
        return copy(updated);
    }

    private static AckState copy(AckState state) {
        return state.toBuilder().build();
    }
}
