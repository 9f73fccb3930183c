package tech.accessplane.platform.principal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

class PrincipalTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 6, 15);

    @Test
    @DisplayName("isEffectivelyActive should require active status and an end date not yet passed")
    void isEffectivelyActive_shouldCheckStatusAndEndDate() {
        Principal principal = PrincipalFixtures.principal("p1", "t1", "a@acme.com");
        assertThat(principal.isEffectivelyActive(TODAY)).isTrue();

        principal.endDate = "2025-06-15";
        assertThat(principal.isEffectivelyActive(TODAY)).isTrue();

        principal.endDate = "2025-06-14T23:59:59.000Z";
        assertThat(principal.isEffectivelyActive(TODAY)).isFalse();

        principal.endDate = null;
        principal.status = PrincipalStatus.INACTIVE;
        assertThat(principal.isEffectivelyActive(TODAY)).isFalse();
    }
}
