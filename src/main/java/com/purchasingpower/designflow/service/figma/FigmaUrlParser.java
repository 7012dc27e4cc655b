package com.purchasingpower.designflow.service.figma;

import com.purchasingpower.designflow.exception.MalformedIdentifierException;
import com.purchasingpower.designflow.model.figma.FigmaFileReference;
import org.springframework.stereotype.Component;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses Figma identifiers into a file key and node ids.
 *
 * Handles:
 * - ABC123xyz... (bare 22-char file key)
 * - https://www.figma.com/file/KEY/File-Name
 * - https://www.figma.com/design/KEY/File-Name?node-id=1-2
 * - https://www.figma.com/proto/KEY/...  and  /board/KEY/...
 * - node-id lists: ?node-id=1-2,3:4
 */
@Component
public class FigmaUrlParser {

    private static final Pattern FILE_KEY = Pattern.compile("^[a-zA-Z0-9]{22}$");
    private static final Pattern FIGMA_URL = Pattern.compile(
            "figma\\.com/(?:file|design|proto|board)/([a-zA-Z0-9]+)(?:/([^?#]+))?(?:\\?[^#]*node-id=([^&#]+))?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern FIGMA_URL_PREFIX = Pattern.compile("figma\\.com/(file|design|proto|board)/");
    private static final Pattern EMBEDDED_KEY = Pattern.compile("([a-zA-Z0-9]{22})");
    private static final Pattern DASHED_NODE_ID = Pattern.compile("^\\d+-\\d+$");
    private static final Pattern PAGE_NODE_ID = Pattern.compile("^0:\\d+$");

    public FigmaFileReference parse(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new MalformedIdentifierException(String.valueOf(identifier));
        }
        String trimmed = identifier.trim();

        if (FILE_KEY.matcher(trimmed).matches()) {
            return new FigmaFileReference(trimmed, List.of(), null);
        }

        Matcher url = FIGMA_URL.matcher(trimmed);
        if (url.find()) {
            String fileName = url.group(2) != null ? decode(url.group(2).replace('-', ' ')) : null;
            List<String> nodeIds = url.group(3) != null ? splitNodeIds(decode(url.group(3))) : List.of();
            return new FigmaFileReference(url.group(1), nodeIds, fileName);
        }

        Matcher embedded = EMBEDDED_KEY.matcher(trimmed);
        if (embedded.find()) {
            return new FigmaFileReference(embedded.group(1), List.of(), null);
        }

        throw new MalformedIdentifierException(identifier);
    }

    /**
     * Parses the identifier and merges extra comma-separated node ids after the URL's own,
     * dropping duplicates but keeping first-seen order.
     */
    public FigmaFileReference parse(String identifier, String extraNodeIds) {
        FigmaFileReference reference = parse(identifier);
        if (extraNodeIds == null || extraNodeIds.isBlank()) {
            return reference;
        }
        LinkedHashSet<String> merged = new LinkedHashSet<>(reference.getNodeIds());
        Arrays.stream(extraNodeIds.split(","))
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .forEach(merged::add);
        return new FigmaFileReference(reference.getFileKey(), new ArrayList<>(merged), reference.getFileName());
    }

    public static boolean isFigmaUrl(String input) {
        return input != null && FIGMA_URL_PREFIX.matcher(input).find();
    }

    /**
     * Node ids that select something narrower than a whole page. {@code 0:N} ids are pages.
     */
    public static List<String> specificNodeIds(List<String> nodeIds) {
        return nodeIds.stream().filter(id -> !PAGE_NODE_ID.matcher(id).matches()).toList();
    }

    /**
     * {@code 12:34} becomes {@code 12-34}, safe for file names.
     */
    public static String nodeIdToFilename(String nodeId) {
        return nodeId.replace(':', '-');
    }

    private static List<String> splitNodeIds(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .map(id -> DASHED_NODE_ID.matcher(id).matches() ? id.replace('-', ':') : id)
                .toList();
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }
}
