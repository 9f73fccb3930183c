package tech.accessplane.platform.identity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;

import static org.assertj.core.api.Assertions.*;

class TemporaryPasswordsTest {

    @RepeatedTest(20)
    @DisplayName("generate should satisfy the user pool password policy")
    void generate_shouldSatisfyPolicy() {
        String password = TemporaryPasswords.generate();

        assertThat(password).hasSize(12);
        assertThat(password).matches(".*[A-Z].*");
        assertThat(password).matches(".*[a-z].*");
        assertThat(password).matches(".*[0-9].*");
        assertThat(password).matches(".*[!@#$%^&*].*");
    }
}
