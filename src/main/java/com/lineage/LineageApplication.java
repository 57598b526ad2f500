package com.lineage;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

/**
 * Entry point of the {@code lineage} command.
 * <p>
 * {@code lineage serve} keeps the servlet container running for the health
 * API and the {@code /ws} and {@code /ws/agents/{agentId}} channels. Every
 * other command (migrate, restore, history, health) opens the timeline store,
 * runs once and exits with the command's exit code.
 */
@SpringBootApplication
public class LineageApplication {

    static final String SERVE_COMMAND = "serve";

    public static void main(String[] args) {
        boolean serveMode = Arrays.asList(args).contains(SERVE_COMMAND);

        ConfigurableApplicationContext ctx = new SpringApplicationBuilder(LineageApplication.class)
                .web(serveMode ? WebApplicationType.SERVLET : WebApplicationType.NONE)
                .properties("spring.main.banner-mode=off")
                .run(args);

        if (!serveMode) {
            int exitCode = SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class));
            System.exit(exitCode);
        }
    }
}
