package com.survey.codeframe.brand;

public interface TranslationClient {

    TranslationEvidence translate(String text, String sourceLanguage, String targetLanguage, BrandProbe probe);
}
