package com.waypoint.core.persistence;

import java.util.List;

/**
 * A snapshot directory under {@code backups/}.
 *
 * @param id    directory name, a UTC timestamp such as {@code 20260118T093012345Z}
 * @param files state files captured in the snapshot
 */
public record BackupInfo(String id, List<String> files) {
}
