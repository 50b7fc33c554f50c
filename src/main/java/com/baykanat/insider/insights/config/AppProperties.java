package com.baykanat.insider.insights.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.DayOfWeek;

/** app.* için tip güvenli configuration (engine paralelliği, funnel varsayılanları, experiment eşikleri). */
@Configuration
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private EngineProperties engine = new EngineProperties();
    private FunnelProperties funnel = new FunnelProperties();
    private BreakdownProperties breakdown = new BreakdownProperties();
    private TimeProperties time = new TimeProperties();
    private ActorsProperties actors = new ActorsProperties();
    private ExperimentProperties experiment = new ExperimentProperties();

    @Getter
    @Setter
    public static class EngineProperties {
        /** Worker pool boyutu; 0 ise available processors. */
        private int parallelism = 0;
        /** Sorgu başına cooperative deadline (saniye). */
        private long queryTimeoutSeconds = 60;
        /** Tek worker task'ına düşen actor sayısı. */
        private int actorPartitionSize = 500;
    }

    @Getter
    @Setter
    public static class FunnelProperties {
        private int defaultConversionWindowDays = 14;
        private String defaultDateFrom = "-7d";
        /** Mask tabanlı step eşleştirme nedeniyle üst sınır. */
        private int maxSteps = 20;
    }

    @Getter
    @Setter
    public static class BreakdownProperties {
        private String otherLabel = "Other";
        private String allUsersLabel = "all users";
    }

    @Getter
    @Setter
    public static class TimeProperties {
        private DayOfWeek weekStartDay = DayOfWeek.SUNDAY;
        private String defaultTimezone = "UTC";
    }

    @Getter
    @Setter
    public static class ActorsProperties {
        private int defaultPageSize = 100;
        private int maxPageSize = 1000;
    }

    @Getter
    @Setter
    public static class ExperimentProperties {
        /** Monte Carlo örnek sayısı. */
        private int simulationCount = 50_000;
        /** Set edilirse simülasyon deterministik olur. */
        private Long seed;
        private double minProbability = 0.9;
        private double expectedLossThreshold = 0.01;
        private long minExposure = 100;
        /** Kapalı form toplamın terim sayısı bunu aşarsa Monte Carlo'ya düşülür. */
        private long maxExactTerms = 2_000_000;
        private int maxTestVariants = 7;
    }
}
