package de.anton.pv.solver.iv_solver.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FitResult} and {@link DiagnosticReport} invariants.
 */
class FitResultTest {

    @Test
    void build_validWithoutParameters_throwsException() {
        FitResult.Builder builder = FitResult.builder().status(FitStatus.VALID);

        assertThatThrownBy(builder::build)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("requires parameters");
    }

    @Test
    void build_failedWithoutErrorKind_throwsException() {
        FitResult.Builder builder = FitResult.builder().status(FitStatus.FAILED);

        assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void error_setsStatusOfErrorKind() {
        FitResult invalid = FitResult.builder().error(FitErrorKind.VALIDATION, "too few points").build();
        FitResult failed = FitResult.builder().error(FitErrorKind.NUMERICAL, "overflow").build();

        assertThat(invalid.getStatus()).isEqualTo(FitStatus.INVALID);
        assertThat(failed.getStatus()).isEqualTo(FitStatus.FAILED);
        assertThat(invalid.hasCurve()).isFalse();
        assertThat(invalid.getModeledCurrents()).isEmpty();
    }

    @Test
    void toBuilder_copiesEveryField() {
        FitResult original = FitResult.builder()
                .status(FitStatus.VALID)
                .parameters(new OneDiodeParameters(0.03, 1e-10, 1.1, 0.5, 2000.0))
                .curve(new double[]{0.0, 0.1}, new double[]{0.03, 0.029}, new double[]{0.03, 0.029},
                        new double[]{0.0, 0.0})
                .fingerprint("abc")
                .resultHash("hash", true)
                .build();

        FitResult copy = original.toBuilder().build();

        assertThat(copy.getParameters()).isEqualTo(original.getParameters());
        assertThat(copy.getVoltages()).containsExactly(original.getVoltages());
        assertThat(copy.getResultHash()).isEqualTo("hash");
        assertThat(copy.isHashStable()).isTrue();
    }

    @Test
    void unavailableReport_hasMaximumRiskAndFails() {
        DiagnosticReport report = DiagnosticReport.unavailable("INVALID: too few points");

        assertThat(report.riskScore()).isEqualTo(100.0);
        assertThat(report.validationPassed()).isFalse();
        assertThat(report.recommendations()).singleElement().asString().contains("too few points");
    }

    @Test
    void diagnosticReport_withRiskOutsideRange_throwsException() {
        assertThatThrownBy(() -> new DiagnosticReport(null, null, java.util.List.of(), null, 120.0, false,
                java.util.List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
