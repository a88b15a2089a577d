package com.example.CostNavigator.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables for query resolution. Bounds here are the only place radius and limit
 * clamps are defined; everything downstream reads them from this bean.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "navigator")
public class NavigatorProperties {

    private final Search search = new Search();
    private final Inference inference = new Inference();
    private final Request request = new Request();
    private final Geocoding geocoding = new Geocoding();

    @Getter
    @Setter
    public static class Search {
        private double defaultRadiusKm = 40.0;
        private double minRadiusKm = 1.0;
        private double maxRadiusKm = 500.0;
        private int defaultLimit = 10;
        private int maxLimit = 50;
    }

    @Getter
    @Setter
    public static class Inference {
        /** Try the chat model before the pattern grammar. */
        private boolean enabled = true;
        private Duration timeout = Duration.ofSeconds(3);
        /** Preferred chat client key, e.g. "deepseek" or "openai". */
        private String model = "deepseek";
    }

    @Getter
    @Setter
    public static class Request {
        private Duration deadline = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Geocoding {
        private String dataset = "classpath:geo/us_postal_codes.tsv";
    }
}
