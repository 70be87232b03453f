package dev.aparikh.hybridsearch;

import dev.aparikh.hybridsearch.cli.ExitCodes;
import dev.aparikh.hybridsearch.cli.HybridSearchCli;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.retry.annotation.EnableRetry;

import java.util.Map;

@SpringBootApplication
@EnableRetry
public class HybridSearchApplication {

    public static void main(String[] args) {
        if (!HybridSearchCli.isCliInvocation(args)) {
            SpringApplication.run(HybridSearchApplication.class, args);
            return;
        }

        SpringApplication application = new SpringApplication(HybridSearchApplication.class);
        application.setWebApplicationType(WebApplicationType.NONE);
        application.setAddCommandLineProperties(false);
        application.setDefaultProperties(Map.of(
                "hybrid.cli.enabled", "true",
                "spring.main.banner-mode", "off"));
        int exitCode;
        try {
            ConfigurableApplicationContext context = application.run(args);
            exitCode = SpringApplication.exit(context);
        } catch (RuntimeException e) {
            exitCode = ExitCodes.of(e);
        }
        System.exit(exitCode);
    }
}
