package tech.accessplane.platform.license;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import tech.accessplane.platform.shared.IsoDates;

import java.time.LocalDate;

/**
 * A tenant license, stored as {@code ACCOUNT#<tenantId>} / {@code LICENSE#<id>}.
 *
 * @param numberOfUsers seats granted by this license
 * @param endDate       last day the license counts; a license without one grants nothing
 */
public record License(
    @JsonProperty("licenseId") String id,
    @JsonIgnore String tenantId,
    String enterpriseId,
    String productId,
    long numberOfUsers,
    LocalDate endDate
) {

    /**
     * Active licenses are the ones whose end date is today or later.
     */
    public boolean isActiveOn(LocalDate day) {
        return endDate != null && !day.isAfter(endDate);
    }

    static License fromAttributes(String id, String tenantId, String enterpriseId, String productId,
                                  long numberOfUsers, String endDate) {
        return new License(id, tenantId, enterpriseId, productId, numberOfUsers, IsoDates.parseDate(endDate));
    }
}
