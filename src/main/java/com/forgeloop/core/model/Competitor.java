package com.forgeloop.core.model;

import java.io.Serializable;
import java.util.List;

public record Competitor(
    String name,
    String description,
    List<String> strengths,
    List<String> weaknesses
) implements Serializable {}
