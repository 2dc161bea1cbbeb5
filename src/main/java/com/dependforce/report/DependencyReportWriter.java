package com.dependforce.report;

import com.dependforce.config.AppConfig;
import com.dependforce.dependency.DependencyException;
import com.dependforce.dependency.DependencyOptions;
import com.dependforce.dependency.DependencyRecord;
import com.dependforce.dependency.DependencyResult;
import com.dependforce.dependency.ObjectIdentity;
import com.dependforce.dependency.Urn;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.*;

/**
 * Writes the dependency analysis of each root object to the output folder:
 * a JSON report, a CSV listing and a SQL script with the creation scripts in
 * precedence order.
 */
public class DependencyReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(DependencyReportWriter.class);
    private static final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    static final String[] CSV_HEADERS = {
        "Tier", "Dependent", "Type", "Owner", "IsSchemaBound", "Parent", "ParentType", "Urn", "OriginalResource"
    };

    private final Path outputFolder;
    private final DependencyOptions options;

    // Base names handed out so far, so that repeated roots do not overwrite each other
    private final Map<String, Integer> usedBaseNames = new HashMap<>();

    public DependencyReportWriter(String outputFolder, DependencyOptions options) {
        this.outputFolder = Paths.get(outputFolder);
        this.options = options;
    }

    /**
     * Writes the report files for one result.
     *
     * @return paths of the files written
     */
    public List<Path> write(DependencyResult result) throws IOException {
        Files.createDirectories(outputFolder);

        String baseName = uniqueBaseName(baseName(result.getRoot()));
        List<Path> written = new ArrayList<>();

        Path jsonPath = outputFolder.resolve(baseName + AppConfig.REPORT_JSON_SUFFIX);
        Files.writeString(jsonPath, gson.toJson(toJson(result)), StandardCharsets.UTF_8);
        written.add(jsonPath);

        if (result.getStatus() == DependencyResult.Status.COMPLETED) {
            Path csvPath = outputFolder.resolve(baseName + AppConfig.REPORT_CSV_SUFFIX);
            writeCsv(csvPath, result.getRecords());
            written.add(csvPath);

            if (options.isIncludeScript()) {
                Path sqlPath = outputFolder.resolve(baseName + AppConfig.REPORT_SQL_SUFFIX);
                writeScript(sqlPath, result);
                written.add(sqlPath);
            }
        }

        logger.info("Wrote {} report file(s) for {}", written.size(), baseName);
        return written;
    }

    JsonObject toJson(DependencyResult result) {
        JsonObject report = new JsonObject();

        JsonObject metadata = new JsonObject();
        metadata.addProperty("generatedAt", Instant.now().toString());
        metadata.addProperty("root", result.getRoot() != null ? result.getRoot().getUrn() : null);
        metadata.addProperty("status", result.getStatus().name());
        report.add("metadata", metadata);

        JsonObject opts = new JsonObject();
        opts.addProperty("direction", options.getDirection().name());
        opts.addProperty("includeSelf", options.isIncludeSelf());
        opts.addProperty("includeScript", options.isIncludeScript());
        opts.addProperty("allowSystemObjects", options.isAllowSystemObjects());
        report.add("options", opts);

        if (result.getError() != null) {
            report.add("error", errorJson(result.getError()));
        }

        JsonArray dependencies = new JsonArray();
        for (DependencyRecord record : result.getRecords()) {
            JsonObject dep = new JsonObject();
            dep.addProperty("tier", record.getTier());
            dep.addProperty("dependent", record.getDependentName());
            dep.addProperty("type", record.getDependentKind());
            dep.addProperty("owner", record.getOwner());
            dep.addProperty("isSchemaBound", record.isSchemaBound());
            dep.addProperty("parent", record.getParentName());
            dep.addProperty("parentType", record.getParentKind());
            dep.addProperty("urn", record.getDependentIdentity().getUrn());
            dep.addProperty("parentUrn", urnOf(record.getParentIdentity()));
            dep.addProperty("originalResource", urnOf(record.getOriginRootIdentity()));
            if (record.hasScript()) {
                dep.addProperty("script", record.getScript());
            }
            dependencies.add(dep);
        }
        report.add("dependencies", dependencies);

        JsonArray unresolved = new JsonArray();
        for (DependencyException nodeError : result.getNodeErrors()) {
            unresolved.add(errorJson(nodeError));
        }
        report.add("unresolved", unresolved);

        return report;
    }

    private static JsonObject errorJson(DependencyException error) {
        JsonObject json = new JsonObject();
        json.addProperty("kind", error.getKind().name());
        json.addProperty("urn", urnOf(error.getIdentity()));
        json.addProperty("message", error.getMessage());
        return json;
    }

    private void writeCsv(Path path, List<DependencyRecord> records) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(CSV_HEADERS).build();
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (DependencyRecord record : records) {
                printer.printRecord(
                    record.getTier(),
                    record.getDependentName(),
                    record.getDependentKind(),
                    record.getOwner(),
                    record.isSchemaBound(),
                    record.getParentName(),
                    record.getParentKind(),
                    record.getDependentIdentity().getUrn(),
                    urnOf(record.getOriginRootIdentity()));
            }
        }
    }

    private void writeScript(Path path, DependencyResult result) throws IOException {
        String nl = AppConfig.SCRIPT_LINE_SEPARATOR;
        StringBuilder sb = new StringBuilder();
        sb.append("-- Dependencies of ").append(urnOf(result.getRoot())).append(nl);
        sb.append("-- Direction: ").append(options.getDirection().name().toLowerCase())
          .append(", objects: ").append(result.getRecords().size()).append(nl).append(nl);

        for (DependencyRecord record : result.getRecords()) {
            if (!record.hasScript()) {
                sb.append("-- No script available for ").append(record.getDependentIdentity().getUrn()).append(nl).append(nl);
                continue;
            }
            sb.append("-- ").append(record.getDependentKind()).append(' ').append(record.getDependentName())
              .append(" (tier ").append(record.getTier()).append(')').append(nl);
            sb.append(record.getScript()).append(nl).append(nl);
        }

        Files.writeString(path, sb.toString(), StandardCharsets.UTF_8);
    }

    private synchronized String uniqueBaseName(String name) {
        int seen = usedBaseNames.merge(name, 1, Integer::sum);
        return seen == 1 ? name : name + "_" + seen;
    }

    /**
     * File-system safe base name for a root object, e.g. {@code Table_dbo.Orders}.
     */
    static String baseName(ObjectIdentity root) {
        if (root == null || root.getUrn() == null) {
            return "unknown";
        }
        String name;
        try {
            Urn urn = Urn.from(root);
            name = urn.getType() + "_" + (urn.getSchema() != null ? urn.getSchema() + "." : "")
                + (urn.getName() != null ? urn.getName() : "object");
        } catch (IllegalArgumentException e) {
            name = root.getUrn();
        }
        return name.replaceAll("[^a-zA-Z0-9_.-]", "_");
    }

    private static String urnOf(ObjectIdentity identity) {
        return identity != null ? identity.getUrn() : null;
    }
}
