package com.raditha.staleflag.cli;

import com.raditha.staleflag.config.CleanupConfig;
import com.raditha.staleflag.model.SourceUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Finds the Java sources under a base path.
 */
public class SourceCollector {

    private static final Logger logger = LoggerFactory.getLogger(SourceCollector.class);

    private final CleanupConfig config;

    public SourceCollector(CleanupConfig config) {
        this.config = config;
    }

    /**
     * Every {@code .java} file under the base path that no exclude pattern matches,
     * named by its path relative to the base path.
     */
    public List<SourceUnit> collect(Path basePath) throws IOException {
        List<Path> files;
        try (Stream<Path> walk = Files.walk(basePath)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".java"))
                    .sorted(Comparator.naturalOrder())
                    .toList();
        }
        List<SourceUnit> units = new ArrayList<>();
        for (Path file : files) {
            String name = basePath.relativize(file).toString().replace('\\', '/');
            if (config.shouldExclude(name)) {
                logger.debug("Excluded {}", name);
                continue;
            }
            units.add(new SourceUnit(name, file, Files.readString(file, StandardCharsets.UTF_8)));
        }
        logger.info("Collected {} source files under {}", units.size(), basePath);
        return units;
    }
}
