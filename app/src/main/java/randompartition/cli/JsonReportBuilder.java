package randompartition.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import randompartition.sampler.SamplingResult;
import randompartition.tilt.TiltSolution;

final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

  String build(CliOptions options, List<SamplingResult> results) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(options));
    root.put("samples", samples(results));
    return gson.toJson(root);
  }

  private Map<String, Object> meta(CliOptions options) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("target", options.target());
    meta.put("policy", options.policySpec());
    meta.put("method", options.method().name().toLowerCase(Locale.ROOT));
    meta.put("exact", options.method().exact());
    if (options.seed() != null) {
      meta.put("seed", options.seed());
    }
    if (options.samplerOptions().hasTiltOverride()) {
      meta.put("tilt_override", options.samplerOptions().tiltOverride());
    }
    if (options.samplerOptions().bounded()) {
      meta.put("max_attempts", options.samplerOptions().maxAttempts());
    }
    return meta;
  }

  private List<Map<String, Object>> samples(List<SamplingResult> results) {
    List<Map<String, Object>> list = new ArrayList<>(results.size());
    for (SamplingResult result : results) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("weight", result.weight());
      map.put("parts", result.partition().parts());
      map.put("attempts", result.attempts());
      map.put("tilt", result.tilt());
      TiltSolution solution = result.tiltSolution();
      if (solution != null) {
        map.put("tilt_iterations", solution.iterations());
        map.put("tilt_residual", solution.residual());
        map.put("tilt_converged", solution.converged());
      }
      map.put("elapsed_ms", result.elapsedNanos() / 1_000_000.0);
      list.add(map);
    }
    return list;
  }
}
