package de.anton.pv.solver.iv_solver.model;

/**
 * Side-by-side parameters of an illuminated and a dark fit of the same device.
 * A large ideality difference points to voltage-dependent collection or a
 * light-induced change of the dominant recombination path.
 *
 * @param idealityLight          primary ideality of the illuminated fit
 * @param idealityDark           primary ideality of the dark fit
 * @param deltaIdeality          n_light - n_dark
 * @param saturationCurrentLight primary I0 of the illuminated fit, A
 * @param saturationCurrentDark  primary I0 of the dark fit, A
 * @param seriesResistanceLight  Rs of the illuminated fit, Ohm
 * @param seriesResistanceDark   Rs of the dark fit, Ohm
 * @param shuntResistanceLight   Rsh of the illuminated fit, Ohm
 * @param shuntResistanceDark    Rsh of the dark fit, Ohm
 */
public record LightDarkComparison(
        double idealityLight,
        double idealityDark,
        double deltaIdeality,
        double saturationCurrentLight,
        double saturationCurrentDark,
        double seriesResistanceLight,
        double seriesResistanceDark,
        double shuntResistanceLight,
        double shuntResistanceDark
) {
}
