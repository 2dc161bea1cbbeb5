package com.dependforce;

import com.dependforce.config.Config;
import com.dependforce.config.JdbcHelper;
import com.dependforce.dependency.DependencyAnalyzer;
import com.dependforce.dependency.DependencyException;
import com.dependforce.dependency.DependencyOptions;
import com.dependforce.dependency.DependencyRecord;
import com.dependforce.dependency.DependencyResult;
import com.dependforce.dependency.Urn;
import com.dependforce.report.DependencyReportWriter;
import com.dependforce.sqlserver.SqlServerCatalogResolver;
import com.dependforce.sqlserver.SqlServerDiscoveryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.util.*;

public class DependencyRunner {
    private static final Logger logger = LoggerFactory.getLogger(DependencyRunner.class);

    public static void main(String[] args) {
        if (args.length < 2 || !args[0].equals("--config")) {
            System.err.println("Usage: java -jar dependforce.jar --config <config-file>");
            System.exit(1);
        }

        String configFile = args[1];

        try {
            logger.info("DependForce - object dependency analysis");
            logger.info("Config file: {}", configFile);

            Config config = new Config(configFile);
            List<Urn> roots = config.getRootObjects();
            DependencyOptions options = config.getDependencyOptions();
            logger.info("Options: {}", options);

            String url = JdbcHelper.buildJdbcUrl(config);
            logger.info("Connecting to {}/{}...", config.getServer(), config.getDatabase());

            List<DependencyResult> results;
            try (Connection connection = openConnection(url, config)) {
                logger.info("Connected successfully");

                DependencyAnalyzer analyzer = new DependencyAnalyzer(
                    new SqlServerDiscoveryService(connection, config.getQueryTimeout()),
                    new SqlServerCatalogResolver(connection, config.getQueryTimeout()));
                results = analyzer.analyzeAll(roots, options);
            }

            DependencyReportWriter writer = new DependencyReportWriter(config.getOutputFolder(), options);
            int failed = 0;
            for (DependencyResult result : results) {
                logger.info("{}", result);
                for (DependencyRecord record : result.getRecords()) {
                    logger.info("  [{}] {} {}", record.getTier(), record.getDependentKind(), record.getDependentName());
                }
                for (DependencyException nodeError : result.getNodeErrors()) {
                    logger.warn("  unresolved: {}", nodeError.getMessage());
                }
                if (!result.isSuccess()) {
                    failed++;
                }
                writer.write(result);
            }

            logger.info("Reports written to {}", config.getOutputFolder());
            if (failed == results.size()) {
                logger.error("Dependency analysis failed for every object");
                System.exit(1);
            }

        } catch (DependencyException e) {
            logger.error("Dependency analysis failed: {}", e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            logger.error("Dependency analysis failed", e);
            System.exit(1);
        }
    }

    private static Connection openConnection(String url, Config config) throws Exception {
        String username = config.getUsername();
        if (username.isEmpty()) {
            // integrated authentication
            return DriverManager.getConnection(url + ";integratedSecurity=true");
        }
        return DriverManager.getConnection(url, username, config.getPassword());
    }
}
