package alerthub.config;

import alerthub.aggregator.AutoResolvePolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * application.yml 中 alerthub.* 配置
 */
@Data
@ConfigurationProperties(prefix = "alerthub")
public class AlertHubProperties {

    /** 数据源设置文件 */
    private String settingsPath = "config/settings.yml";

    private Http http = new Http();
    private Fetch fetch = new Fetch();
    private Health health = new Health();
    private Ack ack = new Ack();
    private Log log = new Log();
    private Store store = new Store();
    private Elasticsearch elasticsearch = new Elasticsearch();
    private Scheduler scheduler = new Scheduler();

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(15);
        private Duration callTimeout = Duration.ofSeconds(20);
    }

    @Data
    public static class Fetch {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 100;
        /** 单个数据源的拉取超时，超时后按失败处理 */
        private Duration sourceTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Health {
        private Duration backoffBase = Duration.ofSeconds(10);
        private Duration backoffCap = Duration.ofMinutes(10);
        private Duration staleFloor = Duration.ofMinutes(5);
    }

    @Data
    public static class Ack {
        private AutoResolvePolicy autoResolve = AutoResolvePolicy.SKIP_ON_ERRORS;
    }

    @Data
    public static class Log {
        private Duration retention = Duration.ofDays(30);
    }

    @Data
    public static class Store {
        /** local | elasticsearch */
        private String type = "local";
    }

    @Data
    public static class Elasticsearch {
        private String host = "localhost";
        private int port = 9200;
        private String scheme = "http";
        private boolean ssl = false;
        private String username;
        private String password;
        private int timeoutSeconds = 30;
        private int maxConnections = 10;
        private String ackIndex = "alerthub-ack-state";
        private String logIndex = "alerthub-alert-log";
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
    }
}
