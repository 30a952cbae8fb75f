package de.anton.pv.solver.iv_solver.model;

/**
 * Physical constants (exact SI 2019 values) and the thermal voltage.
 */
public final class PhysicalConstants {

    public static final double BOLTZMANN = 1.380649e-23;          // J/K
    public static final double ELEMENTARY_CHARGE = 1.602176634e-19; // C
    public static final double STC_TEMPERATURE_K = 298.15;
    public static final double STC_IRRADIANCE_MW_PER_CM2 = 100.0;  // AM1.5G, 1000 W/m2

    private PhysicalConstants() { throw new IllegalStateException("Utility class"); }

    /**
     * Thermal voltage kT/q.
     *
     * @param temperatureK Absolute temperature in kelvin.
     * @return Thermal voltage in volt.
     */
    public static double thermalVoltage(double temperatureK) {
        if (!(temperatureK > 0) || !Double.isFinite(temperatureK)) {
            throw new IllegalArgumentException("Temperature must be positive and finite: " + temperatureK);
        }
        return BOLTZMANN * temperatureK / ELEMENTARY_CHARGE;
    }
}
