package com.survey.codeframe.brand;

import java.util.List;

public interface WebSearchClient {

    List<WebSearchHit> search(String query, int count, BrandProbe probe);

    /**
     * @return image URLs for the query
     */
    List<String> searchImages(String query, int count, BrandProbe probe);
}
