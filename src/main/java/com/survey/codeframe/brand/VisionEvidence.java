package com.survey.codeframe.brand;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Vision-model reading of product images found for the candidate.
 */
public record VisionEvidence(
        String model,
        @JsonProperty("image_urls") List<String> imageUrls,
        @JsonProperty("images_analyzed") int imagesAnalyzed,
        @JsonProperty("matching_images") int matchingImages,
        @JsonProperty("detected_brand") String detectedBrand,
        String notes
) implements TierEvidence {

    @Override
    public EvidenceTier tier() {
        return EvidenceTier.VISION;
    }

    public double matchRate() {
        return imagesAnalyzed == 0 ? 0.0 : (double) matchingImages / imagesAnalyzed;
    }

    @Override
    public double positive() {
        return matchRate();
    }

    @Override
    public double negative() {
        return 0.0;
    }

    @Override
    public String summary() {
        return String.format("%d/%d images show the brand in this category", matchingImages, imagesAnalyzed);
    }
}
