package org.channelsim.runtime;

import org.channelsim.compiler.RateEquationCompiler;
import org.channelsim.runtime.model.ChannelModel;
import org.channelsim.test.ChannelModelFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class ChannelOdeTest {

    private static final double VOLUME_IN = 1e-12;
    private static final double VOLUME_OUT = 1e-6;

    private ChannelOde ode;

    @BeforeEach
    void setUp() throws Exception {
        ChannelModel model = ChannelModelFixtures.twoStateModel();
        GeneratorMatrixBuilder builder = new GeneratorMatrixBuilder(model,
                RateFunctionTable.compile(model.rateFunctions(), new RateEquationCompiler()));
        Stimulus stimulus = new Stimulus(ChannelModelFixtures.voltageStep(), VOLUME_IN, VOLUME_OUT);
        ode = new ChannelOde(builder, stimulus, model.conductances(), VOLUME_IN, VOLUME_OUT,
                PhysicalConstants.DEFAULT_TEMPERATURE_K);
    }

    @Test
    void getDimension_isStatesPlusTwoConcentrations() {
        assertThat(ode.getDimension()).isEqualTo(4);
        assertThat(ode.getStateCount()).isEqualTo(2);
    }

    @Test
    void computeDerivatives_matchesHandComputedRightHandSide() {
        double[] y = {0.5, 0.5, 140.0, 5.0};
        double[] yDot = new double[4];

        // 0.15 s = 150 ms lies inside the +40 mV epoch
        ode.computeDerivatives(0.15, y, yDot);

        double alpha = 0.1 * Math.exp(40.0 / 25.0);
        double beta = 0.2 * Math.exp(-40.0 / 50.0);
        double current = 1.2 * 0.5 * (40.0 - Nernst.potentialMv(140.0, 5.0));
        double flux = current * 1e-12 / PhysicalConstants.FARADAY * 1000.0;

        assertThat(yDot[0]).isCloseTo(-alpha * 0.5 + beta * 0.5, within(1e-12));
        assertThat(yDot[1]).isCloseTo(alpha * 0.5 - beta * 0.5, within(1e-12));
        assertThat(yDot[2]).isCloseTo(-flux / VOLUME_IN, within(1e-9));
        assertThat(yDot[3]).isCloseTo(flux / VOLUME_OUT, within(1e-15));
        assertThat(yDot[0] + yDot[1]).isCloseTo(0.0, within(1e-15));
    }

    @Test
    void computeDerivatives_outwardCurrentDepletesInside() {
        double[] yDot = new double[4];

        ode.computeDerivatives(0.2, new double[] {0.0, 1.0, 140.0, 5.0}, yDot);

        assertThat(yDot[2]).isNegative();
        assertThat(yDot[3]).isPositive();
    }

    @Test
    void computeDerivatives_usesHoldingVoltageOutsideEpoch() {
        double[] yDot = new double[4];

        ode.computeDerivatives(0.05, new double[] {1.0, 0.0, 140.0, 5.0}, yDot);

        assertThat(yDot[1]).isCloseTo(0.1 * Math.exp(-80.0 / 25.0), within(1e-15));
    }

    @Test
    void computeDerivatives_rejectsNonFiniteState() {
        double[] yDot = new double[4];

        assertThatThrownBy(() -> ode.computeDerivatives(0.0, new double[] {0.0, 1.0, Double.NaN, 5.0}, yDot))
                .isInstanceOfSatisfying(NonFiniteDerivativeException.class,
                        e -> assertThat(e.getTimeSeconds()).isZero());
    }

    @Test
    void constructor_rejectsConductanceCountMismatch() throws Exception {
        ChannelModel model = ChannelModelFixtures.twoStateModel();
        GeneratorMatrixBuilder builder = new GeneratorMatrixBuilder(model,
                RateFunctionTable.compile(model.rateFunctions(), new RateEquationCompiler()));
        Stimulus stimulus = new Stimulus(ChannelModelFixtures.holding(0.0), VOLUME_IN, VOLUME_OUT);

        assertThatThrownBy(() -> new ChannelOde(builder, stimulus, new double[] {1.0, 2.0, 3.0},
                VOLUME_IN, VOLUME_OUT, PhysicalConstants.DEFAULT_TEMPERATURE_K))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
