package com.example.prr.model;

/**
 * A component whose loss disconnects part of the system.
 *
 * @param name   Component name
 * @param impact What becomes unreachable when the component fails
 */
public record SinglePointOfFailure(String name, String impact) {}
