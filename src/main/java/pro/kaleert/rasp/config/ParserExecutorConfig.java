package pro.kaleert.rasp.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class ParserExecutorConfig {

    private final RaspConfig properties;

    @Bean(name = "sheetParserExecutor", destroyMethod = "shutdown")
    public ExecutorService sheetParserExecutor() {
        int threads = Math.max(1, properties.getWorkerThreadCount());
        log.info("Sheet parser pool: {} threads", threads);
        return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory(properties.getWorkerThreadPrefix()));
    }
}
