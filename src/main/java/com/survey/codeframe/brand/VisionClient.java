package com.survey.codeframe.brand;

import java.util.List;

public interface VisionClient {

    /**
     * Asks a vision model how many of the images show the candidate as a product of the category.
     */
    VisionEvidence analyze(List<String> imageUrls, BrandProbe probe);
}
