package com.omniva.dbnotifier.synthesis;

import com.omniva.dbnotifier.config.DbNotifierConfig;
import com.omniva.dbnotifier.messaging.model.ChangeType;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives the handler and trigger names of a generated artifact:
 * {@code <prefix>_<channel>_for_<table>_events_<d_i_u>[_<notifName>]}.
 * <p>
 * Equal (table, channel, notifName, event set) inputs always derive equal names, which is what
 * lets a replace be expressed as drop-by-computed-name followed by create.
 */
@RequiredArgsConstructor
public class ArtifactNamer {
    private static final Logger log = LoggerFactory.getLogger(ArtifactNamer.class);

    private final DbNotifierConfig config;

    public ArtifactNames derive(String tableName, String channelName, String notifName, Set<ChangeType> events) {
        String suffix = String.format("%s_for_%s_events_%s%s",
                channelName,
                tableName,
                eventInitials(events),
                notifName != null ? "_" + notifName : "");

        return new ArtifactNames(
                fitIdentifier(config.getHandlerPrefix() + "_" + suffix),
                fitIdentifier(config.getTriggerPrefix() + "_" + suffix));
    }

    /**
     * Sorted, deduplicated lower-case initials joined by underscores, e.g. {@code d_i_u}
     */
    static String eventInitials(Set<ChangeType> events) {
        return EnumSet.copyOf(events).stream()
                .map(event -> String.valueOf(event.initial()))
                .collect(Collectors.joining("_"));
    }

    /**
     * Truncate to the engine's identifier limit (in UTF-8 bytes) the way the engine itself would.
     * Long names with a common prefix may collide after truncation; the registry rejects such collisions.
     */
    private String fitIdentifier(String name) {
        int maxBytes = config.getMaxIdentifierLength();
        byte[] bytes = name.getBytes(StandardCharsets.UTF_8);
        if (bytes.length <= maxBytes) {
            return name;
        }

        StringBuilder truncated = new StringBuilder();
        int used = 0;
        for (int offset = 0; offset < name.length(); ) {
            int codePoint = name.codePointAt(offset);
            int width = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8).length;
            if (used + width > maxBytes) {
                break;
            }
            truncated.appendCodePoint(codePoint);
            used += width;
            offset += Character.charCount(codePoint);
        }

        log.warn("Derived name '{}' exceeds {} bytes and was truncated to '{}'", name, maxBytes, truncated);
        return truncated.toString();
    }
}
