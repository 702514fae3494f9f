package me.golemcore.otp.domain.model;

import java.util.List;

/**
 * Entries matched by a directory search.
 *
 * @param entries
 *            matched entries, at most the requested size limit
 * @param truncated
 *            {@code true} when more entries matched than were returned
 */
public record DirectorySearchResult(List<DirectoryEntry> entries, boolean truncated) {
}
