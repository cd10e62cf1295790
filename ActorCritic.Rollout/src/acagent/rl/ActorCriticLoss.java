package acagent.rl;

/**
 * Advantage actor-critic loss components over a rollout.
 *
 * <pre>
 * policy  = -mean(adv * logProb)
 * value   =  mean(adv^2)
 * entropy =  mean(entropy)
 * total   =  policy + valueLossCoef * value - entropyCoef * entropy
 * </pre>
 */
public final class ActorCriticLoss {

    private ActorCriticLoss() {
    }

    public static class Breakdown {

        public final double total;
        public final double policyLoss;
        public final double valueLoss;
        public final double entropy;
        public final double advantageMean;
        public final double advantageStd;

        Breakdown(double total, double policyLoss, double valueLoss, double entropy,
                double advantageMean, double advantageStd) {
            this.total = total;
            this.policyLoss = policyLoss;
            this.valueLoss = valueLoss;
            this.entropy = entropy;
            this.advantageMean = advantageMean;
            this.advantageStd = advantageStd;
        }

        @Override
        public String toString() {
            return String.format("loss=%.6f policy=%.6f value=%.6f entropy=%.6f adv_mean=%.6f adv_std=%.6f",
                    total, policyLoss, valueLoss, entropy, advantageMean, advantageStd);
        }
    }

    public static Breakdown compute(RolloutTargets targets, double entropyCoef, double valueLossCoef) {
        int horizon = targets.horizon();
        int n = targets.numWorkers();
        if (horizon == 0 || n == 0) {
            throw new IllegalArgumentException("empty rollout targets");
        }
        double policySum = 0.0;
        double valueSum = 0.0;
        double entropySum = 0.0;
        double advSum = 0.0;
        for (int t = 0; t < horizon; t++) {
            for (int i = 0; i < n; i++) {
                double adv = targets.advantages[t][i];
                policySum += adv * targets.logProbs[t][i];
                valueSum += adv * adv;
                entropySum += targets.entropies[t][i];
                advSum += adv;
            }
        }
        double count = (double) horizon * n;
        double policy = -policySum / count;
        double value = valueSum / count;
        double entropy = entropySum / count;
        double advMean = advSum / count;
        double advStd = Math.sqrt(Math.max(0.0, value - advMean * advMean));
        double total = policy + valueLossCoef * value - entropyCoef * entropy;
        return new Breakdown(total, policy, value, entropy, advMean, advStd);
    }

    public static Breakdown compute(RolloutTargets targets, AgentConfig config) {
        return compute(targets, config.getEntropyCoef(), config.getValueLossCoef());
    }
}
