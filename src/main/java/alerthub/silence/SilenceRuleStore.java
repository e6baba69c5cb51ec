package alerthub.silence;

import alerthub.model.SilenceRule;

import java.util.List;
import java.util.Optional;

/**
 * 静默规则存储
 */
public interface SilenceRuleStore {

    List<SilenceRule> list();

    Optional<SilenceRule> find(String id);

    SilenceRule save(SilenceRule rule);

    boolean delete(String id);
}
