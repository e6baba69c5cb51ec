package alerthub.aggregator;

import alerthub.health.SourceHealthTracker;
import alerthub.model.Alert;
import alerthub.model.AlertFetchError;
import alerthub.model.AlertFetchResult;
import alerthub.model.AlertSource;
import alerthub.settings.Settings;
import alerthub.settings.SourceConfig;
import alerthub.source.SourceAdapter;
import alerthub.source.SourceFetchException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 拉取编排器：所有数据源并发拉取，等待全部结束后合并结果。
 * 单个数据源的失败或退避只产生一条错误，不影响其它数据源。
 */
public class FetchOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(FetchOrchestrator.class);

    private final Map<AlertSource, SourceAdapter<?>> adapters;
    private final SourceHealthTracker healthTracker;
    private final ExecutorService fetchExecutor;
    private final Duration sourceTimeout;

    public FetchOrchestrator(Collection<? extends SourceAdapter<?>> adapters,
                             SourceHealthTracker healthTracker,
                             ExecutorService fetchExecutor,
                             Duration sourceTimeout) {
        this.adapters = new EnumMap<>(AlertSource.class);
        adapters.forEach(adapter -> this.adapters.put(adapter.getSourceType(), adapter));
        this.healthTracker = healthTracker;
        this.fetchExecutor = fetchExecutor;
        this.sourceTimeout = sourceTimeout;
    }

    /**
     * 拉取全部已配置数据源，错误列表按 类型->配置顺序 排列
     */
    public AlertFetchResult fetchAll(Settings settings) {
        long start = System.currentTimeMillis();
        List<SourceConfig> sources = settings.getConfiguredSources();
        List<CompletableFuture<SourceOutcome>> jobs = new ArrayList<>(sources.size());
        for (SourceConfig source : sources) {
            jobs.add(submit(source));
        }

        // 等待全部完成，不因单个失败提前返回
        CompletableFuture.allOf(jobs.toArray(new CompletableFuture[0])).join();

        List<Alert> alerts = new ArrayList<>();
        List<AlertFetchError> errors = new ArrayList<>();
        for (CompletableFuture<SourceOutcome> job : jobs) {
            SourceOutcome outcome = job.join();
            alerts.addAll(outcome.alerts);
            if (outcome.error != null) {
                errors.add(outcome.error);
            }
        }
        logger.info("告警拉取完成: 数据源{}个, 告警{}条, 错误{}条, 耗时{}ms",
                sources.size(), alerts.size(), errors.size(), System.currentTimeMillis() - start);
        return new AlertFetchResult(alerts, errors);
    }

    private CompletableFuture<SourceOutcome> submit(SourceConfig source) {
        Optional<Instant> backoffUntil = healthTracker.backoffUntil(source.getSourceType(), source.getId());
        if (backoffUntil.isPresent()) {
            // 退避期间不调用适配器，也不更新健康记录
            SourceFetchException skipped = SourceFetchException.backoff(backoffUntil.get());
            logger.warn("数据源处于退避期, 跳过: {}, {}", source.getDisplayLabel(), skipped.getMessage());
            return CompletableFuture.completedFuture(SourceOutcome.failed(source, skipped.getMessage()));
        }

        SourceAdapter<?> adapter = adapters.get(source.getSourceType());
        if (adapter == null) {
            return CompletableFuture.completedFuture(
                    SourceOutcome.failed(source, "No adapter registered for " + source.getSourceType().getDisplayName()));
        }

        CompletableFuture<List<Alert>> fetch;
        try {
            fetch = CompletableFuture.supplyAsync(() -> adapter.fetchConfig(source), fetchExecutor);
        } catch (RuntimeException e) {
            fetch = CompletableFuture.failedFuture(e);
        }
        CompletableFuture<List<Alert>> bounded = fetch.orTimeout(sourceTimeout.toMillis(), TimeUnit.MILLISECONDS);
        CompletableFuture<List<Alert>> original = fetch;
        return bounded.handle((alerts, error) -> {
            if (error == null) {
                recordHealth(source, () -> healthTracker.recordSuccess(source.getSourceType(), source.getId()));
                logger.debug("数据源拉取成功: {}, 告警{}条", source.getDisplayLabel(), alerts.size());
                return SourceOutcome.succeeded(alerts);
            }
            Throwable cause = unwrap(error);
            if (cause instanceof TimeoutException) {
                original.cancel(true);
            }
            String message = messageOf(cause);
            recordHealth(source, () -> healthTracker.recordFailure(source.getSourceType(), source.getId(), message));
            return SourceOutcome.failed(source, message);
        });
    }

    /**
     * 健康记录写入失败只记日志，不能影响本次拉取结果
     */
    private void recordHealth(SourceConfig source, Runnable write) {
        try {
            write.run();
        } catch (RuntimeException e) {
            logger.error("写入数据源健康记录失败: {}", source.getDisplayLabel(), e);
        }
    }

    private String messageOf(Throwable cause) {
        if (cause instanceof TimeoutException) {
            return "Request timed out after " + sourceTimeout.toSeconds() + "s";
        }
        return StringUtils.defaultIfBlank(cause.getMessage(), "Request failed");
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static final class SourceOutcome {
        final List<Alert> alerts;
        final AlertFetchError error;

        private SourceOutcome(List<Alert> alerts, AlertFetchError error) {
            this.alerts = alerts;
            this.error = error;
        }

        static SourceOutcome succeeded(List<Alert> alerts) {
            return new SourceOutcome(alerts == null ? List.of() : alerts, null);
        }

        static SourceOutcome failed(SourceConfig source, String message) {
            return new SourceOutcome(List.of(), new AlertFetchError(source.getDisplayLabel(), message));
        }
    }
}
