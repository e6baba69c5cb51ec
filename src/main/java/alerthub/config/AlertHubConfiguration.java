package alerthub.config;

import alerthub.ack.AckStateService;
import alerthub.ack.AckStateStore;
import alerthub.ack.LocalAckStateStore;
import alerthub.aggregator.AlertGrouper;
import alerthub.aggregator.AlertService;
import alerthub.aggregator.FetchOrchestrator;
import alerthub.aggregator.SilenceMatcher;
import alerthub.health.BackoffPolicy;
import alerthub.health.LocalSourceHealthStore;
import alerthub.health.SourceHealthReporter;
import alerthub.health.SourceHealthStore;
import alerthub.health.SourceHealthTracker;
import alerthub.log.AlertLogService;
import alerthub.log.AlertLogStore;
import alerthub.log.LocalAlertLogStore;
import alerthub.settings.SettingsProvider;
import alerthub.settings.YamlSettingsProvider;
import alerthub.silence.LocalSilenceRuleStore;
import alerthub.silence.SilenceRuleStore;
import alerthub.silence.SilenceService;
import alerthub.source.MetricsAlertingAdapter;
import alerthub.source.SourceAdapter;
import alerthub.source.TriggerSystemAdapter;
import alerthub.source.UpstreamHttpClient;
import alerthub.source.UptimeCheckAdapter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
@EnableConfigurationProperties(AlertHubProperties.class)
public class AlertHubConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public SettingsProvider settingsProvider(AlertHubProperties properties) {
        log.info("数据源设置文件: {}", properties.getSettingsPath());
        return new YamlSettingsProvider(Paths.get(properties.getSettingsPath()));
    }

    @Bean
    public UpstreamHttpClient upstreamHttpClient(AlertHubProperties properties) {
        AlertHubProperties.Http http = properties.getHttp();
        return new UpstreamHttpClient(http.getConnectTimeout(), http.getReadTimeout(), http.getCallTimeout());
    }

    @Bean
    public MetricsAlertingAdapter metricsAlertingAdapter(UpstreamHttpClient httpClient, Clock clock) {
        return new MetricsAlertingAdapter(httpClient, clock);
    }

    @Bean
    public TriggerSystemAdapter triggerSystemAdapter(UpstreamHttpClient httpClient, Clock clock) {
        return new TriggerSystemAdapter(httpClient, clock);
    }

    @Bean
    public UptimeCheckAdapter uptimeCheckAdapter(UpstreamHttpClient httpClient, Clock clock) {
        return new UptimeCheckAdapter(httpClient, clock);
    }

    /**
     * 数据源拉取线程池，队列满时由调用线程执行
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService fetchExecutor(AlertHubProperties properties) {
        AlertHubProperties.Fetch fetch = properties.getFetch();
        return new ThreadPoolExecutor(
                fetch.getCorePoolSize(),
                Math.max(fetch.getCorePoolSize(), fetch.getMaxPoolSize()),
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(fetch.getQueueCapacity()),
                new ThreadFactoryBuilder()
                        .setNameFormat("alerthub-fetch-%d")
                        .setDaemon(true)
                        .build(),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public SourceHealthStore sourceHealthStore() {
        return new LocalSourceHealthStore();
    }

    @Bean
    public SourceHealthTracker sourceHealthTracker(SourceHealthStore store, AlertHubProperties properties, Clock clock) {
        AlertHubProperties.Health health = properties.getHealth();
        return new SourceHealthTracker(store, new BackoffPolicy(health.getBackoffBase(), health.getBackoffCap()), clock);
    }

    @Bean
    public SourceHealthReporter sourceHealthReporter(SourceHealthTracker tracker, AlertHubProperties properties,
                                                     Clock clock) {
        return new SourceHealthReporter(tracker, properties.getHealth().getStaleFloor(), clock);
    }

    @Bean
    public FetchOrchestrator fetchOrchestrator(List<SourceAdapter<?>> adapters, SourceHealthTracker tracker,
                                               ExecutorService fetchExecutor, AlertHubProperties properties) {
        return new FetchOrchestrator(adapters, tracker, fetchExecutor, properties.getFetch().getSourceTimeout());
    }

    @Bean
    @ConditionalOnProperty(name = "alerthub.store.type", havingValue = "local", matchIfMissing = true)
    public AckStateStore localAckStateStore() {
        return new LocalAckStateStore();
    }

    @Bean
    @ConditionalOnProperty(name = "alerthub.store.type", havingValue = "local", matchIfMissing = true)
    public AlertLogStore localAlertLogStore() {
        return new LocalAlertLogStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public SilenceRuleStore silenceRuleStore() {
        return new LocalSilenceRuleStore();
    }

    @Bean
    public AckStateService ackStateService(AckStateStore store, Clock clock) {
        return new AckStateService(store, clock);
    }

    @Bean
    public SilenceService silenceService(SilenceRuleStore store, Clock clock) {
        return new SilenceService(store, clock);
    }

    @Bean
    public AlertLogService alertLogService(AlertLogStore store, AlertHubProperties properties, Clock clock) {
        return new AlertLogService(store, properties.getLog().getRetention(), clock);
    }

    @Bean
    public AlertService alertService(SettingsProvider settingsProvider,
                                     FetchOrchestrator orchestrator,
                                     List<SourceAdapter<?>> adapters,
                                     SilenceService silenceService,
                                     AckStateService ackStateService,
                                     AlertLogService alertLogService,
                                     SourceHealthTracker healthTracker,
                                     SourceHealthReporter healthReporter,
                                     AlertHubProperties properties,
                                     Clock clock) {
        return new AlertService(settingsProvider, orchestrator, adapters, new AlertGrouper(),
                new SilenceMatcher(clock), silenceService, ackStateService, alertLogService,
                healthTracker, healthReporter, properties.getAck().getAutoResolve());
    }
}
