package tech.accessplane.platform.license;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.accessplane.platform.common.Result;
import tech.accessplane.platform.common.errors.UseCaseError;
import tech.accessplane.platform.principal.Principal;
import tech.accessplane.platform.store.InMemoryKeyValueStore;
import tech.accessplane.platform.store.Item;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;
import static tech.accessplane.platform.principal.PrincipalFixtures.*;

/**
 * Unit tests for LicenseCapacityGate over the in-memory store.
 */
class LicenseCapacityGateTest {

    private InMemoryKeyValueStore store;
    private LicenseCapacityGate gate;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        LicenseRepository licenseRepo = new LicenseRepository();
        licenseRepo.store = store;

        gate = new LicenseCapacityGate();
        gate.licenseRepo = licenseRepo;
        gate.principalRepo = repositoryOver(store);
        gate.clock = Clock.fixed(Instant.parse("2025-06-15T12:00:00Z"), ZoneOffset.UTC);
    }

    // ========================================
    // getCapacity TESTS
    // ========================================

    @Test
    @DisplayName("getCapacity should sum seats of licenses whose end date is today or later")
    void getCapacity_shouldSumLicensesNotYetEnded() {
        // Arrange
        license("t1", "l1", 3, "2025-01-01", "2025-12-31");
        license("t1", "ends-today", 2, "2025-01-01", "2025-06-15");
        license("t1", "starts-later", 4, "2025-07-01", "2026-06-30");
        license("t1", "expired", 10, "2024-01-01", "2025-06-14");
        license("t1", "no-end", 20, "2025-01-01", null);
        license("t2", "other", 50, null, "2030-01-01");

        // Act
        LicenseCapacity capacity = gate.getCapacity("t1");

        // Assert
        assertThat(capacity.totalAllowed()).isEqualTo(9);
        assertThat(capacity.currentActiveUsers()).isZero();
        assertThat(capacity.remaining()).isEqualTo(9);
        assertThat(capacity.licenses()).extracting(License::id)
            .containsExactlyInAnyOrder("l1", "ends-today", "starts-later");
    }

    @Test
    @DisplayName("getCapacity should list each active license with its enterprise, product, seats and end date")
    void getCapacity_shouldListLicenseBreakdown() {
        // Arrange
        store.put(Item.builder()
            .set("PK", "ACCOUNT#t1")
            .set("SK", "LICENSE#global")
            .set("id", "global")
            .set("enterpriseId", "ent-1")
            .set("productId", "prod-global")
            .set("numberOfUsers", 50)
            .set("endDate", "2025-12-31")
            .build());
        license("t1", "oracle", 20, null, "2026-03-31");

        // Act
        LicenseCapacity capacity = gate.getCapacity("t1");

        // Assert
        assertThat(capacity.totalAllowed()).isEqualTo(70);
        assertThat(capacity.licenses())
            .filteredOn(l -> l.id().equals("global"))
            .singleElement()
            .satisfies(l -> {
                assertThat(l.enterpriseId()).isEqualTo("ent-1");
                assertThat(l.productId()).isEqualTo("prod-global");
                assertThat(l.numberOfUsers()).isEqualTo(50);
                assertThat(l.endDate()).isEqualTo(LocalDate.of(2025, 12, 31));
            });
    }

    @Test
    @DisplayName("getCapacity should only count effectively active principals")
    void getCapacity_shouldCountEffectivelyActivePrincipals() {
        // Arrange
        license("t1", "l1", 5, null, "2025-12-31");
        save(store, principal("p1", "t1", "a@acme.com"));
        save(store, inactive(principal("p2", "t1", "b@acme.com")));
        Principal ended = principal("p3", "t1", "c@acme.com");
        ended.endDate = "2025-06-01";
        save(store, ended);
        save(store, principal("p4", "t2", "d@acme.com"));

        // Act
        LicenseCapacity capacity = gate.getCapacity("t1");

        // Assert
        assertThat(capacity.currentActiveUsers()).isEqualTo(1);
        assertThat(capacity.remaining()).isEqualTo(4);
    }

    @Test
    @DisplayName("getCapacity should never report negative remaining seats")
    void getCapacity_shouldClampRemaining() {
        // Arrange
        license("t1", "l1", 1, null, "2025-12-31");
        save(store, principal("p1", "t1", "a@acme.com"));
        save(store, principal("p2", "t1", "b@acme.com"));

        // Act & Assert
        assertThat(gate.getCapacity("t1").remaining()).isZero();
    }

    // ========================================
    // validateUserCreation TESTS
    // ========================================

    @Test
    @DisplayName("validateUserCreation should fail with CapacityExceeded when the tenant is full")
    void validateUserCreation_shouldFail_whenTenantIsFull() {
        // Arrange
        license("T1", "l1", 5, null, "2025-12-31");
        for (int i = 1; i <= 5; i++) {
            save(store, principal("p" + i, "T1", "user" + i + "@acme.com"));
        }
        int itemsBefore = store.size();

        // Act
        Result<LicenseCapacity> result = gate.validateUserCreation("T1");

        // Assert
        assertThat(result.isFailure()).isTrue();
        assertThat(result.error()).isInstanceOf(UseCaseError.CapacityExceeded.class);
        assertThat(result.error().code()).isEqualTo("LICENSE_CAPACITY_EXCEEDED");
        assertThat(result.error().details()).containsEntry("totalAllowed", 5L).containsEntry("currentActiveUsers", 5L);
        assertThat(store.size()).isEqualTo(itemsBefore);
    }

    @Test
    @DisplayName("validateUserCreation should fail with LICENSE_NOT_FOUND when the tenant has no license")
    void validateUserCreation_shouldFail_whenNoLicense() {
        Result<LicenseCapacity> result = gate.validateUserCreation("t-unlicensed");

        assertThat(result.error()).isInstanceOf(UseCaseError.CapacityExceeded.class);
        assertThat(result.error().code()).isEqualTo("LICENSE_NOT_FOUND");
        assertThat(result.error().details()).containsEntry("tenantId", "t-unlicensed");
    }

    @Test
    @DisplayName("validateUserCreation should fail with LICENSE_NOT_FOUND when every license has expired")
    void validateUserCreation_shouldFail_whenAllLicensesExpired() {
        license("t1", "old", 10, "2024-01-01", "2024-12-31");
        license("t1", "no-end", 10, "2025-01-01", null);

        assertThat(gate.validateUserCreation("t1").error().code()).isEqualTo("LICENSE_NOT_FOUND");
    }

    @Test
    @DisplayName("validateUserCreation should return the capacity when a seat is left")
    void validateUserCreation_shouldSucceed_whenSeatLeft() {
        // Arrange
        license("t1", "l1", 2, null, "2025-12-31");
        save(store, principal("p1", "t1", "a@acme.com"));

        // Act
        Result<LicenseCapacity> result = gate.validateUserCreation("t1");

        // Assert
        assertThat(result.isSuccess()).isTrue();
        LicenseCapacity capacity = result.value();
        assertThat(capacity.totalAllowed()).isEqualTo(2);
        assertThat(capacity.currentActiveUsers()).isEqualTo(1);
        assertThat(capacity.remaining()).isEqualTo(1);
        assertThat(capacity.licenses()).extracting(License::id).containsExactly("l1");
        assertThat(capacity.afterCreation().remaining()).isZero();
    }

    @Test
    @DisplayName("validateUserCreation should fail when fewer seats are left than requested")
    void validateUserCreation_shouldFail_whenRequestedCountExceedsRemaining() {
        // Arrange
        license("t1", "l1", 3, null, "2025-12-31");
        save(store, principal("p1", "t1", "a@acme.com"));

        // Act
        Result<LicenseCapacity> two = gate.validateUserCreation("t1", 2);
        Result<LicenseCapacity> three = gate.validateUserCreation("t1", 3);

        // Assert
        assertThat(two.isSuccess()).isTrue();
        assertThat(three.error().code()).isEqualTo("LICENSE_CAPACITY_EXCEEDED");
        assertThat(three.error().details()).containsEntry("requested", 3).containsEntry("remaining", 2L);
    }

    @Test
    @DisplayName("validateUserCreation should reject a requested count below one")
    void validateUserCreation_shouldReject_whenRequestedCountNotPositive() {
        assertThatThrownBy(() -> gate.validateUserCreation("t1", 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("validateUserCreation should let two checks pass for the last seat when no principal was written in between")
    void validateUserCreation_shouldPassTwice_forLastSeatBeforeAnyWrite() {
        // Arrange: one seat left
        license("t1", "l1", 3, null, "2025-12-31");
        save(store, principal("p1", "t1", "a@acme.com"));
        save(store, principal("p2", "t1", "b@acme.com"));

        // Act: both creations check before either writes its principal
        Result<LicenseCapacity> first = gate.validateUserCreation("t1");
        Result<LicenseCapacity> second = gate.validateUserCreation("t1");

        // Assert: the check reserves nothing, so both pass
        assertThat(first.isSuccess()).isTrue();
        assertThat(second.isSuccess()).isTrue();
        assertThat(second.value().remaining()).isEqualTo(1);
    }

    private void license(String tenantId, String licenseId, int seats, String startDate, String endDate) {
        store.put(Item.builder()
            .set("PK", "ACCOUNT#" + tenantId)
            .set("SK", "LICENSE#" + licenseId)
            .set("id", licenseId)
            .set("numberOfUsers", seats)
            .set("startDate", startDate)
            .set("endDate", endDate)
            .build());
    }
}
