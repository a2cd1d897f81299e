package com.lottointel.activo.config;

import com.lottointel.activo.service.MismatchPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything the pipeline reads from {@code lotto-scraper.*}. Every value has a default,
 * so an absent key is never an error.
 */
@Component
@ConfigurationProperties(prefix = "lotto-scraper")
@Data
public class LottoScraperProperties {

    private Source source = new Source();
    private Validation validation = new Validation();
    private Output output = new Output();
    private Job job = new Job();

    /** Zone that defines "today" for the latest-N-days window. */
    private String zoneId = "America/Caracas";

    @Data
    public static class Source {
        public static final String DEFAULT_URL_TEMPLATE =
                "https://loteriadehoy.com/animalito/lottoactivo/historico/{start}/{end}/";
        public static final String DEFAULT_DAILY_URL_TEMPLATE =
                "https://loteriadehoy.com/animalito/lottoactivo/resultados/{date}/";

        /** Identifier stamped on every record */
        private String name = "lotto-activo";
        private String urlTemplate = DEFAULT_URL_TEMPLATE;
        /** Page listing one day's draws as result blocks */
        private String dailyUrlTemplate = DEFAULT_DAILY_URL_TEMPLATE;
        private int maxRetries = 3;
        private Duration retryDelay = Duration.ofSeconds(2);
        /** 1.0 keeps the delay fixed; anything above grows it exponentially */
        private double backoffMultiplier = 1.0;
        private Duration timeout = Duration.ofSeconds(30);
        private double maxDataSizeMb = 50.0;
        private int maxRangeDays = 365;
        private Map<String, String> headers = defaultHeaders();

        private static Map<String, String> defaultHeaders() {
            Map<String, String> headers = new LinkedHashMap<>();
            headers.put("User-Agent", "Mozilla/5.0 (Windows NT 10.0; Win64; x64) "
                    + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/135.0.0.0 Safari/537.36");
            headers.put("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8");
            headers.put("Accept-Language", "es-ES,es;q=0.9,en;q=0.8");
            headers.put("Cache-Control", "no-cache");
            return headers;
        }

        public long maxDataSizeBytes() {
            return (long) (maxDataSizeMb * 1024 * 1024);
        }
    }

    @Data
    public static class Validation {
        private MismatchPolicy mismatchPolicy = MismatchPolicy.MARK_INVALID;
    }

    @Data
    public static class Output {
        private String outputDir = "data/lotto-activo";
        private String filePrefix = "lotto_activo";
        /** Defaults to {outputDir}/runs/scrape_runs.jsonl when blank */
        private String auditFile;
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private boolean enabled = false;
            private String outputDir = "outputs/lotto-activo";
            private boolean includeHeader = true;
        }
    }

    @Data
    public static class Job {
        private JobMode mode = JobMode.LATEST;
        private int latestDays = 7;
        private int backfillChunkDays = 7;

        public enum JobMode {
            LATEST, RANGE, BACKFILL, DAY, LAST
        }
    }
}
