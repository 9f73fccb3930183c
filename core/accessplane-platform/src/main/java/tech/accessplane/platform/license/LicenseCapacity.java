package tech.accessplane.platform.license;

import java.util.List;

/**
 * Seat usage of one tenant.
 *
 * @param totalAllowed       seats granted by the active licenses
 * @param currentActiveUsers effectively active principals of the tenant
 * @param remaining          {@code max(0, totalAllowed - currentActiveUsers)}
 * @param licenses           the active licenses that make up {@code totalAllowed}
 */
public record LicenseCapacity(long totalAllowed, long currentActiveUsers, long remaining, List<License> licenses) {

    public LicenseCapacity {
        licenses = licenses == null ? List.of() : List.copyOf(licenses);
    }

    public LicenseCapacity(long totalAllowed, long currentActiveUsers, long remaining) {
        this(totalAllowed, currentActiveUsers, remaining, List.of());
    }

    public static LicenseCapacity of(List<License> licenses, long currentActiveUsers) {
        long totalAllowed = licenses.stream().mapToLong(License::numberOfUsers).sum();
        return new LicenseCapacity(
            totalAllowed,
            currentActiveUsers,
            Math.max(0, totalAllowed - currentActiveUsers),
            licenses
        );
    }

    public boolean isExhausted() {
        return remaining < 1;
    }

    /**
     * Snapshot after one more principal was created, computed locally
     * rather than re-read from the store.
     */
    public LicenseCapacity afterCreation() {
        return new LicenseCapacity(totalAllowed, currentActiveUsers + 1, Math.max(0, remaining - 1), licenses);
    }
}
