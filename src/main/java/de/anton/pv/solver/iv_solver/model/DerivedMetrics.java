package de.anton.pv.solver.iv_solver.model;

/**
 * Figures of merit of an illuminated curve.
 *
 * @param shortCircuitCurrentDensity Jsc in mA/cm2
 * @param openCircuitVoltage         Voc in V
 * @param fillFactor                 FF as a fraction
 * @param efficiencyPercent          PCE in percent
 * @param maxPowerWatts              Pmax in W
 * @param mppVoltage                 Vmpp in V
 * @param mppCurrent                 Impp in A
 * @param shortCircuitCurrent        Isc in A
 * @param seriesResistanceOhmCm2     area-normalised Rs
 * @param shuntResistanceOhmCm2      area-normalised Rsh
 * @param incidentPowerDensity       Pin in mW/cm2
 */
public record DerivedMetrics(
        double shortCircuitCurrentDensity,
        double openCircuitVoltage,
        double fillFactor,
        double efficiencyPercent,
        double maxPowerWatts,
        double mppVoltage,
        double mppCurrent,
        double shortCircuitCurrent,
        double seriesResistanceOhmCm2,
        double shuntResistanceOhmCm2,
        double incidentPowerDensity
) {

    public boolean isFinite() {
        double[] all = {shortCircuitCurrentDensity, openCircuitVoltage, fillFactor, efficiencyPercent,
                maxPowerWatts, mppVoltage, mppCurrent, shortCircuitCurrent, seriesResistanceOhmCm2,
                shuntResistanceOhmCm2};
        for (double value : all) {
            if (!Double.isFinite(value)) return false;
        }
        return true;
    }
}
