package randompartition.cli;

import java.util.Objects;
import randompartition.core.RestrictionPolicies;
import randompartition.core.RestrictionPolicy;
import randompartition.sampler.SamplerOptions;
import randompartition.sampler.SamplingMethod;

record CliOptions(
    long target,
    String policySpec,
    RestrictionPolicy policy,
    SamplingMethod method,
    Long seed,
    SamplerOptions samplerOptions,
    int count,
    OutputFormat format) {

  enum OutputFormat {
    TEXT,
    FERRERS,
    JSON
  }

  CliOptions {
    if (target < 0) {
      throw new IllegalArgumentException("--n must be non-negative");
    }
    Objects.requireNonNull(policy, "policy");
    policySpec = policySpec == null ? "unrestricted" : policySpec;
    method = method == null ? SamplingMethod.recommended() : method;
    samplerOptions = SamplerOptions.normalize(samplerOptions);
    if (count < 1) {
      throw new IllegalArgumentException("--count must be at least 1");
    }
    format = format == null ? OutputFormat.TEXT : format;
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private long target = 100;
    private String policySpec = "unrestricted";
    private RestrictionPolicy policy = RestrictionPolicies.unrestricted();
    private SamplingMethod method = SamplingMethod.recommended();
    private Long seed;
    private SamplerOptions samplerOptions = SamplerOptions.defaults();
    private int count = 1;
    private OutputFormat format = OutputFormat.TEXT;

    Builder target(long target) {
      this.target = target;
      return this;
    }

    Builder policy(String spec) {
      this.policySpec = spec;
      this.policy = CliParsers.parsePolicy(spec);
      return this;
    }

    Builder method(SamplingMethod method) {
      this.method = method;
      return this;
    }

    Builder seed(Long seed) {
      this.seed = seed;
      return this;
    }

    Builder tilt(double tilt) {
      this.samplerOptions = samplerOptions.tilt(tilt);
      return this;
    }

    Builder maxAttempts(long maxAttempts) {
      this.samplerOptions = samplerOptions.attempts(maxAttempts);
      return this;
    }

    Builder strictTilt(boolean strict) {
      this.samplerOptions = samplerOptions.strictTilt(strict);
      return this;
    }

    Builder count(int count) {
      this.count = count;
      return this;
    }

    Builder format(OutputFormat format) {
      this.format = format;
      return this;
    }

    CliOptions build() {
      return new CliOptions(
          target, policySpec, policy, method, seed, samplerOptions, count, format);
    }
  }
}
