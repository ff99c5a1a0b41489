package com.largomodo.demstitch.service.archive;

import com.largomodo.demstitch.core.workspace.StitchWorkspace;
import com.largomodo.demstitch.util.DemXmlMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Enumeration;
import java.util.List;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Flattens input directories, tile files and (nested) zip archives into a list of tile files.
 * <p>
 * Directories are walked in place. Archives are extracted selectively into the run's
 * workspace: only entries that look like DEM XML by name and head, plus nested archives,
 * which are expanded in turn until none remain. Order is deterministic: inputs in the
 * order given, files within an input sorted by path.
 * <p>
 * Fail-soft: unreadable paths and broken archives are logged and skipped.
 */
public class TileSourceCollector {

    private static final Logger log = LoggerFactory.getLogger(TileSourceCollector.class);

    /**
     * Collect tile sources from all inputs.
     *
     * @param inputs    directories, {@code .zip} archives or single tile files
     * @param workspace scratch space for archive extraction
     * @return tile files in discovery order (possibly empty)
     */
    public List<Path> collect(List<Path> inputs, StitchWorkspace workspace) {
        List<Path> sources = new ArrayList<>();
        for (Path input : inputs) {
            try {
                if (Files.isDirectory(input)) {
                    collectDirectory(input, workspace, sources);
                } else if (Files.isRegularFile(input) && DemXmlMatcher.isZipName(input.getFileName().toString())) {
                    collectArchive(input, workspace, sources);
                } else if (DemXmlMatcher.isDemXml(input)) {
                    sources.add(input);
                } else {
                    log.warn("Unsupported path: {}", input);
                }
            } catch (IOException | UncheckedIOException e) {
                log.warn("Cannot read input {} - skipping: {}", input, e.getMessage());
            }
        }
        log.info("Collected DEM XML: {} files", sources.size());
        return sources;
    }

    private void collectDirectory(Path dir, StitchWorkspace workspace, List<Path> sources) throws IOException {
        List<Path> files;
        try (Stream<Path> stream = Files.walk(dir)) {
            files = stream.filter(path -> {
                        try {
                            return Files.isRegularFile(path);
                        } catch (UncheckedIOException e) {
                            // Attributes unreadable (broken symlink, permission denied)
                            log.warn("Cannot access {} - skipping", path);
                            return false;
                        }
                    })
                    .sorted()
                    .toList();
        }

        for (Path file : files) {
            String name = file.getFileName().toString();
            if (DemXmlMatcher.isZipName(name)) {
                collectArchive(file, workspace, sources);
            } else if (DemXmlMatcher.isDemXml(file)) {
                sources.add(file);
            }
        }
    }

    /**
     * Extract an archive and every archive nested in it, then gather the extracted tiles.
     */
    private void collectArchive(Path archive, StitchWorkspace workspace, List<Path> sources) {
        Deque<Path> pending = new ArrayDeque<>();
        pending.add(archive);
        List<Path> extracted = new ArrayList<>();

        while (!pending.isEmpty()) {
            Path zip = pending.poll();
            String baseName = zip.getFileName().toString().replaceFirst("(?i)\\.zip$", "");
            try {
                Path target = workspace.newDirectory(baseName);
                for (Path entry : extractSelected(zip, target)) {
                    if (DemXmlMatcher.isZipName(entry.getFileName().toString())) {
                        pending.add(entry);
                    } else {
                        extracted.add(entry);
                    }
                }
            } catch (IOException e) {
                log.warn("Cannot extract archive {} - skipping: {}", zip.getFileName(), e.getMessage());
            }
        }

        extracted.sort(null);
        sources.addAll(extracted);
    }

    /**
     * Extract DEM-looking XML entries and nested zips from {@code zip} into {@code targetDir}.
     *
     * @return extracted files in archive order
     * @throws IOException if the archive cannot be opened or an entry escapes the target
     */
    List<Path> extractSelected(Path zip, Path targetDir) throws IOException {
        List<Path> extracted = new ArrayList<>();
        Path root = targetDir.toAbsolutePath().normalize();

        try (ZipFile zipFile = new ZipFile(zip.toFile())) {
            Enumeration<? extends ZipEntry> entries = zipFile.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (entry.isDirectory()) {
                    continue;
                }
                String name = entry.getName();
                boolean nestedZip = DemXmlMatcher.isZipName(name);
                if (!nestedZip) {
                    if (!DemXmlMatcher.looksLikeDemName(name)) {
                        continue;
                    }
                    try (InputStream head = zipFile.getInputStream(entry)) {
                        if (!DemXmlMatcher.looksLikeDemHead(head)) {
                            continue;
                        }
                    }
                }

                Path destination = root.resolve(name).normalize();
                if (!destination.startsWith(root)) {
                    throw new IOException("Archive entry escapes extraction directory: " + name);
                }
                Files.createDirectories(destination.getParent());
                try (InputStream in = zipFile.getInputStream(entry)) {
                    Files.copy(in, destination, StandardCopyOption.REPLACE_EXISTING);
                }
                extracted.add(destination);
            }
        }
        log.debug("Extracted {} entries from {}", extracted.size(), zip.getFileName());
        return extracted;
    }
}
