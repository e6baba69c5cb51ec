package alerthub.silence;

import alerthub.model.SilenceRule;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class LocalSilenceRuleStore implements SilenceRuleStore {
    private final Map<String, SilenceRule> rules = new ConcurrentHashMap<>();

    @Override
    public List<SilenceRule> list() {
        return rules.values().stream()
                .sorted(Comparator.comparing(SilenceRule::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .map(rule -> rule.toBuilder().build())
                .collect(Collectors.toList());
    }

    @Override
    public Optional<SilenceRule> find(String id) {
        return Optional.ofNullable(rules.get(id)).map(rule -> rule.toBuilder().build());
    }

    @Override
    public SilenceRule save(SilenceRule rule) {
        rules.put(rule.getId(), rule.toBuilder().build());
        return rule;
    }

    @Override
    public boolean delete(String id) {
        return rules.remove(id) != null;
    }
}
