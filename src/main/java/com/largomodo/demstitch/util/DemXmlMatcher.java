package com.largomodo.demstitch.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Cheap detection of GSI elevation (DEM) XML tiles.
 * <p>
 * Two stages: a name check that rules out metadata and index files, then a sniff of the
 * first {@link #SNIFF_BYTES} bytes for DEM body markers. Archives ship DEM tiles next to
 * metadata XML with the same extension, so the name alone is not enough.
 * <p>
 * Stateless utility. Safe for concurrent use.
 */
public class DemXmlMatcher {

    private static final Logger log = LoggerFactory.getLogger(DemXmlMatcher.class);

    /**
     * Bytes read from the head of a file or archive entry for content sniffing.
     */
    public static final int SNIFF_BYTES = 8 * 1024;

    private static final List<String> BODY_MARKERS = List.of(
            "<DEM", "ElevationModel", "tupleList", "doubleOrNilReasonTupleList"
    );

    private DemXmlMatcher() {
        // Static utility class - prevent instantiation
    }

    /**
     * Name-level check: {@code .xml} and not an obvious metadata/index file.
     *
     * @param name file or entry name (may include directories)
     */
    public static boolean looksLikeDemName(String name) {
        if (name == null) {
            return false;
        }
        String n = baseName(name).toLowerCase(Locale.ROOT);
        if (!n.endsWith(".xml")) {
            return false;
        }
        return !(n.startsWith("fmdid") || n.contains("metadata") || n.endsWith("_index.xml"));
    }

    /**
     * Content-level check on the decoded head of a file.
     */
    public static boolean looksLikeDemHead(String head) {
        if (head == null) {
            return false;
        }
        for (String marker : BODY_MARKERS) {
            if (head.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Reads up to {@link #SNIFF_BYTES} from {@code in} and checks them for DEM markers.
     * Malformed UTF-8 is replaced, not rejected.
     */
    public static boolean looksLikeDemHead(InputStream in) throws IOException {
        byte[] head = in.readNBytes(SNIFF_BYTES);
        return looksLikeDemHead(new String(head, StandardCharsets.UTF_8));
    }

    /**
     * Full check of a file on disk: regular file, DEM-like name, DEM-like head.
     * Unreadable files are reported as non-matching.
     *
     * @param path file to check (can be null)
     */
    public static boolean isDemXml(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return false;
        }
        if (!looksLikeDemName(path.getFileName().toString())) {
            return false;
        }
        try (InputStream in = Files.newInputStream(path)) {
            return looksLikeDemHead(in);
        } catch (IOException e) {
            log.debug("Cannot sniff {}: {}", path, e.getMessage());
            return false;
        }
    }

    /**
     * True when the name ends with {@code .zip} (case-insensitive).
     */
    public static boolean isZipName(String name) {
        return name != null && name.toLowerCase(Locale.ROOT).endsWith(".zip");
    }

    private static String baseName(String name) {
        String n = name.replace('\\', '/');
        int slash = n.lastIndexOf('/');
        return slash >= 0 ? n.substring(slash + 1) : n;
    }
}
