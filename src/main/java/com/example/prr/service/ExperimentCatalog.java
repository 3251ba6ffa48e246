package com.example.prr.service;

import com.example.prr.model.AvailabilityTier;
import com.example.prr.model.BlastRadius;
import com.example.prr.model.ChaosExperiment;
import com.example.prr.model.ComponentKind;
import com.example.prr.model.Finding;
import com.example.prr.model.Hypothesis;
import com.example.prr.model.Provenance;
import com.example.prr.model.SteadyState;
import com.example.prr.model.SystemComponent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic templates for the resilience plan: one fault per component kind
 * (with its LitmusChaos ChaosEngine manifest), steady-state baselines, and the
 * fallback content used when the model cannot produce the speculative parts.
 */
@Component
public class ExperimentCatalog {

    private static final String LITMUS_API_VERSION = "litmuschaos.io/v1alpha1";
    private static final String LITMUS_SERVICE_ACCOUNT = "litmus-admin";

    private record Fault(String label, String litmusExperiment, String description, String expectedResult,
                         Map<String, String> env) {}

    private static final Map<ComponentKind, Fault> FAULTS = new EnumMap<>(ComponentKind.class);

    static {
        FAULTS.put(ComponentKind.API, new Fault("Latency Injection", "pod-network-latency",
                "Inject 1000ms network latency into %s responses for 60 seconds",
                "Callers of %s apply timeouts and retries; user-facing flows degrade gracefully",
                env("TOTAL_CHAOS_DURATION", "60", "NETWORK_LATENCY", "1000")));
        FAULTS.put(ComponentKind.DATABASE, new Fault("Termination", "pod-delete",
                "Terminate the %s pod for 30 seconds",
                "Dependents of %s serve cached data or fail fast, and reconnect automatically",
                env("TOTAL_CHAOS_DURATION", "30", "FORCE", "true")));
        FAULTS.put(ComponentKind.SERVICE, new Fault("CPU Stress", "pod-cpu-hog",
                "Stress CPU on %s to 80%% for 2 minutes",
                "%s keeps serving requests with bounded latency increase",
                env("TOTAL_CHAOS_DURATION", "120", "CPU_CORES", "1", "CPU_LOAD", "80")));
        FAULTS.put(ComponentKind.UI, new Fault("Network Partition", "pod-network-loss",
                "Drop all network traffic between %s and its backends for 60 seconds",
                "%s shows appropriate error messages and retry options",
                env("TOTAL_CHAOS_DURATION", "60", "NETWORK_INTERFACE", "eth0",
                        "NETWORK_PACKET_LOSS_PERCENTAGE", "100")));
        FAULTS.put(ComponentKind.EXTERNAL, new Fault("Outage Simulation", "pod-dns-error",
                "Make DNS resolution of %s fail for 60 seconds",
                "Consumers of %s fall back to degraded functionality without cascading errors",
                env("TOTAL_CHAOS_DURATION", "60", "TARGET_HOSTNAMES", "")));
    }

    private static final List<String> FALLBACK_KNOWN_UNKNOWNS = List.of(
            "Behavior under sustained high load over multiple hours",
            "Recovery characteristics after a complete region failure",
            "Performance degradation patterns of shared data stores under multi-service load");

    private static final List<String> FALLBACK_UNKNOWN_UNKNOWNS = List.of(
            "Unforeseen cascading failures across seemingly isolated components",
            "Novel failure modes from combinations of component failures",
            "User behavior changes in response to partial system degradation");

    private static final List<String> FALLBACK_RECOMMENDATIONS = List.of(
            "Implement canary deployments to detect failures early",
            "Add distributed tracing to identify cascading failure patterns",
            "Establish recurring game days to explore unknown failure modes");

    // ── Experiments ─────────────────────────────────────────────────────────────

    public String experimentName(SystemComponent component) {
        return component.name() + " " + fault(component).label();
    }

    /** Builds the experiment for one ranked component, targeting only that component. */
    public ChaosExperiment experimentFor(SystemComponent component) {
        Fault fault = fault(component);
        return new ChaosExperiment(
                experimentName(component),
                fault.description().formatted(component.name()),
                List.of(component.name()),
                fault.expectedResult().formatted(component.name()),
                chaosEngine(component, fault));
    }

    private Map<String, Object> chaosEngine(SystemComponent component, Fault fault) {
        String app = slug(component.name());

        Map<String, Object> appInfo = new LinkedHashMap<>();
        appInfo.put("appns", "default");
        appInfo.put("applabel", "app=" + app);
        appInfo.put("appkind", component.kind() == ComponentKind.DATABASE ? "statefulset" : "deployment");

        List<Map<String, String>> env = new ArrayList<>();
        fault.env().forEach((name, value) -> {
            Map<String, String> entry = new LinkedHashMap<>();
            entry.put("name", name);
            entry.put("value", "TARGET_HOSTNAMES".equals(name) ? app : value);
            env.add(entry);
        });
        Map<String, Object> experiment = new LinkedHashMap<>();
        experiment.put("name", fault.litmusExperiment());
        experiment.put("spec", Map.of("components", Map.of("env", env)));

        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("appinfo", appInfo);
        spec.put("chaosServiceAccount", LITMUS_SERVICE_ACCOUNT);
        spec.put("experiments", List.of(experiment));

        Map<String, Object> engine = new LinkedHashMap<>();
        engine.put("apiVersion", LITMUS_API_VERSION);
        engine.put("kind", "ChaosEngine");
        engine.put("metadata", Map.of("name", app + "-" + fault.litmusExperiment()));
        engine.put("spec", spec);
        return engine;
    }

    // ── Steady states ───────────────────────────────────────────────────────────

    /** Baseline for a component on a critical path. Availability thresholds use the tier target. */
    public SteadyState steadyStateFor(SystemComponent component, AvailabilityTier tier) {
        String name = component.name();
        return switch (kindOf(component)) {
            case DATABASE -> new SteadyState(name + " Query Performance",
                    "Queries against " + name + " complete within the expected time",
                    "p95 query time < 100ms", "100ms", name);
            case API -> new SteadyState(name + " Response Time",
                    name + " responds to requests within 300ms",
                    "p95 latency < 300ms", "300ms", name);
            case SERVICE -> new SteadyState(name + " Error Rate",
                    name + " returns valid responses",
                    "Error rate < 0.1%", "0.1%", name);
            case UI -> new SteadyState(name + " Success Rate",
                    "User requests served by " + name + " succeed",
                    "Success rate > " + tier.target(), tier.target(), name);
            case EXTERNAL -> new SteadyState(name + " Availability",
                    name + " is reachable from its consumers",
                    "Availability > " + tier.target(), tier.target(), name);
        };
    }

    // ── Fallback content ────────────────────────────────────────────────────────

    public List<Hypothesis> fallbackHypotheses(List<ChaosExperiment> experiments) {
        return experiments.stream()
                .map(e -> new Hypothesis(
                        "When " + e.name() + " runs against " + String.join(", ", e.targetComponents())
                                + ", the steady state of its dependents is maintained",
                        e.description() + " and compare the affected steady states with their baseline",
                        Provenance.FALLBACK))
                .toList();
    }

    public List<Finding> fallbackKnownUnknowns() {
        return FALLBACK_KNOWN_UNKNOWNS.stream().map(Finding::fallback).toList();
    }

    public List<Finding> fallbackUnknownUnknowns() {
        return FALLBACK_UNKNOWN_UNKNOWNS.stream().map(Finding::fallback).toList();
    }

    public List<String> fallbackRecommendations() {
        return FALLBACK_RECOMMENDATIONS;
    }

    /** Blast radius computed from graph reachability when the model did not supply one. */
    public BlastRadius derivedBlastRadius(ChaosExperiment experiment, List<String> direct, List<String> transitive) {
        String targets = String.join(", ", experiment.targetComponents());
        List<String> directImpact = direct.isEmpty()
                ? List.of(targets + " is unavailable or degraded")
                : direct.stream().map(d -> d + " loses reliable access to " + targets).toList();
        List<String> indirectImpact = transitive.stream()
                .map(t -> t + " is degraded through its dependency chain")
                .toList();
        int affected = direct.size() + transitive.size();
        String containment = affected == 0
                ? "Impact limited to " + targets
                : "Impact limited to " + targets + " and " + affected + " dependent component(s)";
        return new BlastRadius(experiment.name(), directImpact, indirectImpact, containment);
    }

    private static Fault fault(SystemComponent component) {
        return FAULTS.get(kindOf(component));
    }

    private static ComponentKind kindOf(SystemComponent component) {
        return component.kind() != null ? component.kind() : ComponentKind.SERVICE;
    }

    static String slug(String name) {
        String slug = name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "");
        return slug.isEmpty() ? "component" : slug;
    }

    private static Map<String, String> env(String... pairs) {
        Map<String, String> env = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            env.put(pairs[i], pairs[i + 1]);
        }
        return env;
    }
}
