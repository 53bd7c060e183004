package pro.kaleert.rasp.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "rasp")
public class RaspConfig {

    private String rawDir = "schedules/raw";
    private String parsedDir = "schedules/parsed";
    private boolean prettyJson = true;

    private int workerThreadCount = Runtime.getRuntime().availableProcessors();
    private String workerThreadPrefix = "rasp-parser-";

    private Scheduler scheduler = new Scheduler();

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private long checkInterval = 600_000L;
    }
}
