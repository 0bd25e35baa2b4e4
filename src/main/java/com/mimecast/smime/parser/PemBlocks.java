package com.mimecast.smime.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits arbitrary text into PEM armored blocks.
 */
public final class PemBlocks {

    private static final Pattern BLOCK = Pattern.compile("-----BEGIN[^-]+-----.+?-----END[^-]+-----", Pattern.DOTALL);

    private PemBlocks() {
        // static utility
    }

    /**
     * Extracts all non-overlapping PEM blocks in order of appearance.
     *
     * @param raw Input text, may be null.
     * @return List of blocks including their BEGIN and END lines.
     */
    public static List<String> extract(String raw) {
        List<String> blocks = new ArrayList<>();
        if (raw == null) {
            return blocks;
        }

        Matcher matcher = BLOCK.matcher(raw);
        while (matcher.find()) {
            blocks.add(matcher.group());
        }
        return blocks;
    }

    /**
     * Extracts the PEM blocks whose text contains the given marker.
     *
     * @param raw    Input text.
     * @param marker Marker such as <code>CERTIFICATE</code> or <code>PRIVATE KEY</code>.
     * @return List of matching blocks.
     */
    public static List<String> extract(String raw, String marker) {
        return extract(raw).stream()
                .filter(block -> block.contains(marker))
                .toList();
    }
}
