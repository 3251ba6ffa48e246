package com.example.prr.support;

import com.example.prr.config.PrrProperties;
import com.example.prr.model.ArchitectureExtractionResponse;
import com.example.prr.model.ArchitectureGraph;
import com.example.prr.model.BusinessImpact;
import com.example.prr.model.ComponentKind;
import com.example.prr.model.Dependency;
import com.example.prr.model.ProjectMetadata;
import com.example.prr.model.SinglePointOfFailure;
import com.example.prr.model.SystemComponent;
import com.example.prr.service.GraphAnalyzer;
import com.example.prr.service.TierClassifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Shared inputs for unit tests: the e-commerce reference architecture and fast settings.
 */
public final class TestFixtures {

    public static final Instant NOW = Instant.parse("2025-03-14T09:30:00Z");
    public static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A, 1, 2, 3};

    private TestFixtures() {
    }

    public static Clock clock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    /** Defaults, with no retry backoff so tests never sleep. */
    public static PrrProperties properties() {
        return new PrrProperties(
                new PrrProperties.Inference("fixture", Duration.ofSeconds(5), Duration.ZERO, 2),
                null, null, null, null, null);
    }

    public static ProjectMetadata metadata(BusinessImpact impact) {
        return new ProjectMetadata("Shop Platform", "Online retail storefront with catalogue and checkout", impact);
    }

    public static List<SystemComponent> ecommerceComponents() {
        return List.of(
                component("Frontend Web App", ComponentKind.UI),
                component("API Gateway", ComponentKind.API),
                component("Authentication Service", ComponentKind.SERVICE),
                component("Product Service", ComponentKind.SERVICE),
                component("Inventory Service", ComponentKind.SERVICE),
                component("User Database", ComponentKind.DATABASE),
                component("Product Database", ComponentKind.DATABASE),
                component("CDN", ComponentKind.EXTERNAL));
    }

    public static List<Dependency> ecommerceDependencies() {
        return List.of(
                new Dependency("Frontend Web App", "API Gateway", "REST"),
                new Dependency("API Gateway", "Authentication Service", "REST"),
                new Dependency("API Gateway", "Product Service", "REST"),
                new Dependency("API Gateway", "Inventory Service", "REST"),
                new Dependency("Authentication Service", "User Database", "Database"),
                new Dependency("Product Service", "Product Database", "Database"),
                new Dependency("Inventory Service", "Product Database", "Database"),
                new Dependency("Frontend Web App", "CDN", "External"));
    }

    public static ArchitectureExtractionResponse ecommerceListing() {
        return new ArchitectureExtractionResponse(ecommerceComponents(), ecommerceDependencies(),
                List.of("Implement API Gateway redundancy across multiple availability zones"));
    }

    public static SystemComponent component(String name, ComponentKind kind) {
        return new SystemComponent(name, kind, name + " component", List.of());
    }

    /** The e-commerce graph as extraction derives it, for stages that start from a graph. */
    public static ArchitectureGraph ecommerceGraph(BusinessImpact impact) {
        GraphAnalyzer analyzer = new GraphAnalyzer();
        List<SinglePointOfFailure> spofs =
                analyzer.findSinglePointsOfFailure(ecommerceComponents(), ecommerceDependencies());
        List<List<String>> paths =
                analyzer.findCriticalPaths(ecommerceComponents(), ecommerceDependencies(), 50).paths();
        TierClassifier.TierDecision tier = new TierClassifier().classify(impact, spofs.size(), paths.size());
        return new ArchitectureGraph(ecommerceComponents(), ecommerceDependencies(), paths, spofs,
                List.of("Implement API Gateway redundancy across multiple availability zones"),
                tier.tier(), tier.justification(), false);
    }
}
