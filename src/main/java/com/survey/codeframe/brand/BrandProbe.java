package com.survey.codeframe.brand;

import com.survey.codeframe.service.UsageContext;

import java.util.List;

/**
 * What every tier needs to know about the candidate being checked.
 */
public record BrandProbe(
        String candidate,
        List<String> variants,
        String categoryName,
        String language,
        String visionModel,
        SearchCredentials credentials,
        UsageContext usageContext
) {
}
