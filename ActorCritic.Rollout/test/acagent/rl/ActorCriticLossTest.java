package acagent.rl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ActorCriticLossTest {

    @Test
    void combinesPolicyValueAndEntropyTerms() {
        RolloutTargets targets = new RolloutTargets(
                new double[][]{{1.0, 2.0}, {-1.0, 0.0}},
                new double[][]{{-0.5, -1.0}, {-0.5, -2.0}},
                new double[][]{{0.6, 0.6}, {0.6, 0.6}});

        ActorCriticLoss.Breakdown loss = ActorCriticLoss.compute(targets, 0.01, 0.5);

        // sum(adv * logp) = -0.5 - 2.0 + 0.5 + 0 = -2.0
        assertEquals(0.5, loss.policyLoss, 1e-12);
        assertEquals(1.5, loss.valueLoss, 1e-12);
        assertEquals(0.6, loss.entropy, 1e-12);
        assertEquals(0.5, loss.advantageMean, 1e-12);
        assertEquals(Math.sqrt(1.25), loss.advantageStd, 1e-12);
        assertEquals(0.5 + 0.75 - 0.006, loss.total, 1e-12);
    }

    @Test
    void coefficientsComeFromConfig() {
        RolloutTargets targets = new RolloutTargets(new double[][]{{2.0}}, new double[][]{{0.0}},
                new double[][]{{1.0}});
        AgentConfig config = AgentConfig.defaults(1).withLossCoefficients(0.1, 1.0, 0.5);

        ActorCriticLoss.Breakdown loss = ActorCriticLoss.compute(targets, config);

        assertEquals(4.0 - 0.1, loss.total, 1e-12);
    }

    @Test
    void rejectsEmptyTargets() {
        assertThrows(IllegalArgumentException.class, () -> ActorCriticLoss.compute(
                new RolloutTargets(new double[0][], new double[0][], new double[0][]), 0.01, 0.5));
    }
}
