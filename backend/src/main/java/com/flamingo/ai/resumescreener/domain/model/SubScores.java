package com.flamingo.ai.resumescreener.domain.model;

/**
 * Per-category credit feeding the weighted score, each in [0, 100]. An unconstrained category
 * always carries full credit.
 */
public record SubScores(double skills, double keywords, double experience, double education) {}
