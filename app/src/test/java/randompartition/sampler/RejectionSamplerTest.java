package randompartition.sampler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.SplittableRandom;
import org.junit.jupiter.api.Test;
import randompartition.core.IntegerPartition;
import randompartition.core.RestrictionPolicies;
import randompartition.core.RestrictionPolicy;

final class RejectionSamplerTest {

  @Test
  void producesExactWeightForEveryPolicy() {
    List<RestrictionPolicy> policies =
        List.of(
            RestrictionPolicies.unrestricted(),
            RestrictionPolicies.even(),
            RestrictionPolicies.odd(),
            RestrictionPolicies.triangular(),
            RestrictionPolicies.residue(2, 3),
            RestrictionPolicies.atMost(5),
            RestrictionPolicies.atLeast(3));
    SplittableRandom random = new SplittableRandom(42);

    for (RestrictionPolicy policy : policies) {
      RejectionSampler sampler = new RejectionSampler(policy);
      for (int i = 0; i < 50; i++) {
        SamplingResult result = sampler.sample(30, SamplerOptions.defaults(), random);
        assertTrue(result.exact(), "weight " + result.weight() + " for " + policy);
        assertTrue(result.attempts() >= 1);
        for (long part : result.partition().multiplicities().keySet()) {
          assertTrue(RestrictionPolicies.allows(policy, part), part + " not allowed by " + policy);
        }
      }
    }
  }

  @Test
  void zeroTargetAcceptsFirstDraw() {
    RejectionSampler sampler = new RejectionSampler(RestrictionPolicies.odd());
    SamplingResult result = sampler.sample(0, SamplerOptions.defaults(), new SplittableRandom(1));

    assertTrue(result.partition().isEmpty());
    assertEquals(1, result.attempts());
  }

  @Test
  void budgetStopsInfeasibleTarget() {
    // No partition of 3 into even parts exists.
    RejectionSampler sampler = new RejectionSampler(RestrictionPolicies.even());
    SamplerOptions options = SamplerOptions.defaults().attempts(50);

    SamplingBudgetExceededException ex =
        assertThrows(
            SamplingBudgetExceededException.class,
            () -> sampler.sample(3, options, new SplittableRandom(8)));
    assertEquals(3, ex.target());
    assertEquals(50, ex.attempts());
  }

  @Test
  void sameSeedSameSample() {
    RejectionSampler sampler = new RejectionSampler(RestrictionPolicies.unrestricted());
    IntegerPartition first = sampler.sample(40, new SplittableRandom(99));
    IntegerPartition second = sampler.sample(40, new SplittableRandom(99));
    assertEquals(first, second);
  }
}
