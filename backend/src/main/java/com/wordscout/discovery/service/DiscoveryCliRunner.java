package com.wordscout.discovery.service;

import com.wordscout.config.DiscoveryProperties;
import com.wordscout.discovery.model.DiscoveryRunRequest;
import com.wordscout.discovery.model.DiscoveryRunSummary;
import com.wordscout.discovery.model.KeywordRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Component
public class DiscoveryCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryCliRunner.class);
    private static final int TOP_KEYWORDS_LOGGED = 20;

    private final DiscoveryProperties properties;
    private final DiscoveryRunService runService;
    private final ConfigurableApplicationContext applicationContext;

    public DiscoveryCliRunner(
        DiscoveryProperties properties,
        DiscoveryRunService runService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.runService = runService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        DiscoveryProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        List<String> seeds = readSeeds(cli);
        if (seeds.isEmpty() && !cli.isResume()) {
            log.warn("discovery.cli.run is set but no seeds were configured");
            return;
        }

        DiscoveryRunSummary summary = runService.runAndWait(DiscoveryRunRequest.ofSeeds(seeds), cli.isResume());
        if (summary == null) {
            log.error("Discovery run finished without a summary: {}", runService.status().lastError());
        } else {
            log.info(
                "Discovery run {}: keywords={} requests={} failed={} cacheHits={} notes={}",
                summary.status(),
                summary.keywordsFound(),
                summary.completedRequests(),
                summary.failedTasks(),
                summary.cacheHits(),
                summary.notes()
            );
            for (KeywordRecord keyword : runService.keywords(TOP_KEYWORDS_LOGGED)) {
                log.info("  {} ({}) depth={} seed={}", keyword.phrase(), keyword.count(), keyword.depth(), keyword.seed());
            }
        }

        if (cli.isExitAfterRun()) {
            int exitCode = summary != null && "COMPLETED".equals(summary.status()) ? 0 : 1;
            int code = SpringApplication.exit(applicationContext, () -> exitCode);
            System.exit(code);
        }
    }

    static List<String> readSeeds(DiscoveryProperties.Cli cli) {
        List<String> seeds = new ArrayList<>();
        if (cli.getSeeds() != null) {
            for (String part : cli.getSeeds().split("[,\\r\\n]+")) {
                if (!part.isBlank()) {
                    seeds.add(part.trim());
                }
            }
        }
        if (cli.getSeedsFile() != null && !cli.getSeedsFile().isBlank()) {
            try {
                for (String line : Files.readAllLines(Path.of(cli.getSeedsFile()), StandardCharsets.UTF_8)) {
                    if (!line.isBlank()) {
                        seeds.add(line.trim());
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read seeds file " + cli.getSeedsFile(), e);
            }
        }
        return seeds;
    }
}
