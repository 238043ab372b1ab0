package randompartition.sampler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.SplittableRandom;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import randompartition.core.IntegerPartition;
import randompartition.core.RestrictionPolicies;
import randompartition.core.RestrictionPolicy;
import randompartition.tilt.TiltSolver;
import randompartition.tilt.TiltSolvers;

final class RandomPartitionsTest {

  @Test
  void seededInstancesRepeat() {
    RestrictionPolicy policy = RestrictionPolicies.odd();
    RandomPartitions first = RandomPartitions.seeded(policy, 1234);
    RandomPartitions second = RandomPartitions.seeded(policy, 1234);

    for (int i = 0; i < 20; i++) {
      assertEquals(first.sample(75), second.sample(75));
    }
  }

  @Test
  void sampleIsExactAndUsesRecommendedMethod() {
    RandomPartitions partitions = RandomPartitions.seeded(RestrictionPolicies.triangular(), 5);
    SamplingResult result = partitions.run(120, SamplerOptions.defaults());

    assertTrue(result.exact());
    assertEquals(SamplingMethod.DETERMINISTIC_SECOND_HALF, SamplingMethod.recommended());
    assertInstanceOf(
        DeterministicSecondHalfSampler.class, partitions.sampler(SamplingMethod.recommended()));
  }

  @Test
  void facadeMatchesRecommendedSamplerOnSameStream() {
    RestrictionPolicy policy = RestrictionPolicies.even();
    IntegerPartition viaFacade = RandomPartitions.seeded(policy, 77).sample(50);
    IntegerPartition direct =
        new DeterministicSecondHalfSampler(policy).sample(50, new SplittableRandom(77));
    assertEquals(direct, viaFacade);
  }

  @Test
  void samplersBoundToFacadePolicy() {
    RestrictionPolicy policy = RestrictionPolicies.residue(1, 3);
    RandomPartitions partitions = RandomPartitions.of(policy, new SplittableRandom(3));

    assertSame(policy, partitions.policy());
    for (SamplingMethod method : SamplingMethod.values()) {
      assertSame(policy, partitions.sampler(method).policy(), method.name());
    }
    assertInstanceOf(ExpectedSizeSampler.class, partitions.sampler(SamplingMethod.EXPECTED_SIZE));
    assertInstanceOf(RejectionSampler.class, partitions.sampler(SamplingMethod.REJECTION));
  }

  @Test
  void sampleWithPinsAlgorithm() {
    RandomPartitions partitions = RandomPartitions.seeded(RestrictionPolicies.unrestricted(), 9);
    assertEquals(30, partitions.sampleWith(SamplingMethod.REJECTION, 30).weight());
    assertEquals(30, partitions.sampleWith(SamplingMethod.DETERMINISTIC_SECOND_HALF, 30).weight());

    SamplingResult approximate =
        partitions.runWith(SamplingMethod.EXPECTED_SIZE, 30, SamplerOptions.defaults());
    assertEquals(1, approximate.attempts());
  }

  @Test
  void injectedSolverIsShared() {
    AtomicInteger calls = new AtomicInteger();
    TiltSolver counting =
        (target, policy) -> {
          calls.incrementAndGet();
          return TiltSolvers.bisection().solve(target, policy);
        };
    RandomPartitions partitions =
        new RandomPartitions(
            RestrictionPolicies.unrestricted(), counting, new SplittableRandom(10));

    partitions.sample(20);
    partitions.sampleWith(SamplingMethod.REJECTION, 20);
    partitions.sampleWith(SamplingMethod.EXPECTED_SIZE, 20);
    assertEquals(3, calls.get(), "one tilt solve per call");
  }

  @Test
  void rejectsNullCollaborators() {
    assertThrows(
        NullPointerException.class,
        () -> new RandomPartitions(null, TiltSolvers.bisection(), new SplittableRandom()));
    assertThrows(
        NullPointerException.class,
        () -> RandomPartitions.unrestricted().sampler(null));
  }
}
