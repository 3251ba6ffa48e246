package com.example.prr.model;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * A titled section of the PRR document.
 */
public record PrrSection(
        @JsonAlias("title") String heading,
        @JsonAlias("content") String body
) {}
