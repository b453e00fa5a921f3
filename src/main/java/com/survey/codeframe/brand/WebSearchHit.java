package com.survey.codeframe.brand;

public record WebSearchHit(String title, String snippet, String link) {
}
