package com.williamcallahan.setforge.service.pipeline;

import com.williamcallahan.setforge.config.InputSettings;
import com.williamcallahan.setforge.domain.work.WorkItem;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads work items from text files under an input directory.
 *
 * <p>Files are filtered by extension and size and visited in path order. An item's identity is
 * its path relative to the input directory with {@code /} separators, so it stays stable across
 * runs. Payloads are read lazily as the stream is consumed. A file that cannot be read as UTF-8
 * text, or that disappears before it is read, is skipped with a warning.</p>
 */
public class FileWorkItemSource implements WorkItemSource {
    private static final Logger log = LoggerFactory.getLogger(FileWorkItemSource.class);

    private final Path inputDir;
    private final List<String> extensions;
    private final long minFileSizeBytes;
    private final long maxFileSizeBytes;

    public FileWorkItemSource(Path inputDir, InputSettings settings) {
        this.inputDir = Objects.requireNonNull(inputDir, "inputDir");
        Objects.requireNonNull(settings, "settings");
        this.extensions = settings.getExtensions().stream()
                .map(extension -> extension.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableList());
        this.minFileSizeBytes = settings.getMinFileSizeBytes();
        this.maxFileSizeBytes = settings.getMaxFileSizeBytes();
    }

    @Override
    public Stream<WorkItem> items() throws IOException {
        if (!Files.isDirectory(inputDir)) {
            throw new IOException("Input directory does not exist: " + inputDir);
        }
        Stream<Path> files = Files.walk(inputDir);
        return files.filter(Files::isRegularFile)
                .filter(this::hasAcceptedExtension)
                .filter(this::hasAcceptedSize)
                .sorted()
                .map(this::toWorkItem)
                .flatMap(Optional::stream)
                .onClose(files::close);
    }

    private boolean hasAcceptedExtension(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(name::endsWith);
    }

    private boolean hasAcceptedSize(Path file) {
        try {
            long size = Files.size(file);
            if (size < minFileSizeBytes || size > maxFileSizeBytes) {
                log.debug("[PIPELINE] Skipping {} ({} bytes outside {}-{})", file, size, minFileSizeBytes, maxFileSizeBytes);
                return false;
            }
            return true;
        } catch (IOException sizeFailure) {
            log.warn("[PIPELINE] Skipping {}: {}", file, sizeFailure.getMessage());
            return false;
        }
    }

    private Optional<WorkItem> toWorkItem(Path file) {
        String identity = inputDir.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
        try {
            return Optional.of(WorkItem.fromFile(identity, Files.readString(file, StandardCharsets.UTF_8), file));
        } catch (IOException readFailure) {
            log.warn("[PIPELINE] Skipping unreadable input {}: {}", identity, readFailure.toString());
            return Optional.empty();
        }
    }
}
