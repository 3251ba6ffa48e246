package com.example.prr.model;

/**
 * A ranked dependency risk.
 *
 * @param name        Risk title
 * @param description Why the component is risky
 * @param impact      Consequence of the component failing
 * @param component   Graph component the risk refers to ({@code null} if unlinked)
 */
public record DependencyRisk(
        String name,
        String description,
        String impact,
        String component
) {}
