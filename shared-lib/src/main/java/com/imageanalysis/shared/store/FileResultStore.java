package com.imageanalysis.shared.store;

import com.imageanalysis.shared.json.Json;
import com.imageanalysis.shared.model.ResultFilter;
import com.imageanalysis.shared.model.ResultSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Results as one JSON file per image id.
 */
public class FileResultStore implements ResultStore {

    private static final Logger logger = LoggerFactory.getLogger(FileResultStore.class);

    private final Path directory;

    public FileResultStore(Path directory) {
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StoreException("Cannot create result directory " + directory, e);
        }
        logger.info("Using local result store at {}", directory.toAbsolutePath());
    }

    @Override
    public void upsert(ResultSummary summary) {
        Path file = JsonFiles.fileFor(directory, summary.getId());
        try {
            JsonFiles.writeAtomically(file, Json.toJson(summary));
        } catch (IOException e) {
            throw new StoreException("Cannot write result " + summary.getId(), e);
        }
        logger.debug("Stored result {}", summary.getId());
    }

    @Override
    public Optional<ResultSummary> get(String id) {
        return read(JsonFiles.fileFor(directory, id));
    }

    @Override
    public List<ResultSummary> list(int limit, ResultFilter filter) {
        List<Path> files;
        try (Stream<Path> stream = Files.list(directory)) {
            files = stream.filter(JsonFiles::isRecordFile).collect(Collectors.toList());
        } catch (IOException e) {
            throw new StoreException("Cannot list " + directory, e);
        }

        List<ResultSummary> results = new ArrayList<>();
        for (Path file : files) {
            read(file).filter(filter::matches).ifPresent(results::add);
        }
        return results.stream()
                .sorted(NEWEST_FIRST)
                .limit(ResultStore.clampLimit(limit))
                .collect(Collectors.toList());
    }

    private Optional<ResultSummary> read(Path file) {
        try {
            return JsonFiles.read(file).map(json -> Json.fromJson(json, ResultSummary.class));
        } catch (IOException e) {
            throw new StoreException("Cannot read " + file, e);
        }
    }
}
