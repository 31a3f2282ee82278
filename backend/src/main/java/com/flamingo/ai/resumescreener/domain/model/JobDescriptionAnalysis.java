package com.flamingo.ai.resumescreener.domain.model;

/**
 * Requirements derived from an uploaded job description.
 *
 * @param filename name of the uploaded JD document
 * @param requirements pre-filled criteria for the recruiter to review
 * @param rawTextPreview leading part of the decoded JD text
 */
public record JobDescriptionAnalysis(
    String filename, RequirementSet requirements, String rawTextPreview) {}
