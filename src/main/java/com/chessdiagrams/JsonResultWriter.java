package com.chessdiagrams;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Writes extraction records as a pretty-printed JSON array with snake_case keys.
 * Absent values are written as null.
 */
public class JsonResultWriter {

    private static final Logger log = LoggerFactory.getLogger(JsonResultWriter.class);

    private final Gson gson;

    public JsonResultWriter() {
        this.gson = new GsonBuilder()
                .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
                .serializeNulls()
                .setPrettyPrinting()
                .disableHtmlEscaping()
                .create();
    }

    public String toJson(List<?> records) {
        return gson.toJson(records);
    }

    public void write(List<?> records, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            gson.toJson(records, writer);
        }
        log.info("Wrote {} records to {}", records.size(), file);
    }

    /** {@code <outputFolder>/<pdf name without extension>_<layout>.json} */
    public static Path outputFile(ExtractorConfig config) {
        String pdfName = Path.of(config.pdfPath).getFileName().toString();
        int dot = pdfName.lastIndexOf('.');
        String base = dot > 0 ? pdfName.substring(0, dot) : pdfName;
        String suffix = config.layout == Layout.GRID ? "_grid" : "_diagrams";
        return Path.of(config.outputFolder).resolve(base + suffix + ".json");
    }
}
