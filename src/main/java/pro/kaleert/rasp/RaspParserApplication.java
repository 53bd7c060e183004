package pro.kaleert.rasp;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.scheduling.annotation.EnableScheduling;
import pro.kaleert.rasp.config.ConfigInitializer;

@EnableScheduling
@SpringBootApplication
public class RaspParserApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(RaspParserApplication.class)
                .initializers(new ConfigInitializer())
                .run(args);
    }
}
