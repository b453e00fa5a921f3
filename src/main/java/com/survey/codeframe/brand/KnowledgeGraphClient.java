package com.survey.codeframe.brand;

import java.util.List;

public interface KnowledgeGraphClient {

    List<KnowledgeGraphEntity> lookup(String query, int limit, BrandProbe probe);
}
