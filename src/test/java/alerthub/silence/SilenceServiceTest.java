package alerthub.silence;

import alerthub.model.AlertSource;
import alerthub.model.SilenceRule;
import alerthub.utils.AlertHubException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SilenceService")
class SilenceServiceTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private SilenceService service;

    @BeforeEach
    void setUp() {
        service = new SilenceService(new LocalSilenceRuleStore(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static SilenceRule.SilenceRuleBuilder input() {
        return SilenceRule.builder()
                .name("  maintenance ")
                .startsAt(NOW.minus(Duration.ofHours(1)))
                .endsAt(NOW.plus(Duration.ofHours(1)));
    }

    @Test
    @DisplayName("新建规则时清理空白字段并设置默认值")
    void createNormalizesInput() {
        SilenceRule created = service.create(input()
                .sourceId("  ")
                .servicePattern(" api-* ")
                .environmentPattern("")
                .build(), "alice");

        assertThat(created.getId()).isNotBlank();
        assertThat(created.getName()).isEqualTo("maintenance");
        assertThat(created.getSourceId()).isNull();
        assertThat(created.getServicePattern()).isEqualTo("api-*");
        assertThat(created.getEnvironmentPattern()).isNull();
        assertThat(created.getSourceType()).isNull();
        assertThat(created.getSeverity()).isNull();
        assertThat(created.isEnabled()).isTrue();
        assertThat(created.getCreatedBy()).isEqualTo("alice");
        assertThat(created.getCreatedAt()).isEqualTo(NOW);
        assertThat(service.activeRules()).containsExactly(created);
    }

    @Test
    void validatesRequiredFields() {
        assertThatThrownBy(() -> service.create(input().name(" ").build(), "u"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Name is required");
        assertThatThrownBy(() -> service.create(input().startsAt(null).build(), "u"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Start and end time are required");
        assertThatThrownBy(() -> service.create(input().endsAt(NOW.minus(Duration.ofHours(1))).build(), "u"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("End time must be after start time");
    }

    @Test
    void updateKeepsCreationMetadata() {
        SilenceRule created = service.create(input().build(), "alice");

        SilenceRule updated = service.update(created.getId(), input()
                .name("db window")
                .sourceType(AlertSource.TRIGGER_SYSTEM)
                .enabled(false)
                .build());

        assertThat(updated.getId()).isEqualTo(created.getId());
        assertThat(updated.getCreatedBy()).isEqualTo("alice");
        assertThat(updated.getName()).isEqualTo("db window");
        assertThat(updated.getSourceType()).isEqualTo(AlertSource.TRIGGER_SYSTEM);
        assertThat(updated.isEnabled()).isFalse();
        assertThat(service.activeRules()).isEmpty();
    }

    @Test
    void updateOfUnknownRuleFails() {
        assertThatThrownBy(() -> service.update("missing", input().build()))
                .isInstanceOf(AlertHubException.class);
    }

    @Test
    @DisplayName("默认列表不含已过期规则")
    void listFiltersExpiredUnlessRequested() {
        SilenceRule current = service.create(input().build(), "u");
        SilenceRule expired = service.create(input()
                .startsAt(NOW.minus(Duration.ofDays(2)))
                .endsAt(NOW.minus(Duration.ofDays(1)))
                .build(), "u");

        assertThat(service.list(false)).containsExactly(current);
        assertThat(service.list(true)).containsExactlyInAnyOrder(current, expired);
    }

    @Test
    void deleteRemovesRule() {
        SilenceRule created = service.create(input().build(), "u");

        assertThat(service.delete(created.getId())).isTrue();
        assertThat(service.delete(created.getId())).isFalse();
        assertThat(service.list(true)).isEmpty();
    }
}
