package com.survey.codeframe.brand;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.survey.codeframe.config.GoogleProperties;
import com.survey.codeframe.entity.UsageFeature;
import com.survey.codeframe.exception.EvidenceTierException;
import com.survey.codeframe.service.UsageContext;
import com.survey.codeframe.service.UsageLedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.UUID;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GoogleSearchClientTest {

    private MockRestServiceServer server;
    private UsageLedgerService usageLedger;
    private GoogleSearchClient client;
    private BrandProbe probe;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        usageLedger = mock(UsageLedgerService.class);
        client = new GoogleSearchClient(restTemplate, new ObjectMapper(), usageLedger, new GoogleProperties());
        probe = new BrandProbe("Colgate", List.of(), "Toothpaste", "en", null,
                new SearchCredentials("test-key", "engine-1"), UsageContext.forGeneration(UUID.randomUUID(), 7L));
    }

    @Test
    void testSearchParsesItems() {
        server.expect(requestTo(startsWith("https://www.googleapis.com/customsearch/v1")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("cx", "engine-1"))
                .andExpect(queryParam("num", "10"))
                .andRespond(withSuccess("""
                        {"items": [
                          {"title": "Colgate Total", "snippet": "Whitening toothpaste", "link": "https://colgate.com"},
                          {"title": "Toothpaste guide", "snippet": "How to choose", "link": "https://example.com"}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        List<WebSearchHit> hits = client.search("Colgate Toothpaste", 25, probe);

        assertEquals(2, hits.size());
        assertEquals("Colgate Total", hits.get(0).title());
        assertEquals("https://example.com", hits.get(1).link());
        verify(usageLedger).record(eq(UsageFeature.BRAND_WEB_SEARCH), eq("google-custom-search"),
                anyInt(), anyInt(), any(), any());
        server.verify();
    }

    @Test
    void testImageSearchReturnsLinks() {
        server.expect(requestTo(startsWith("https://www.googleapis.com/customsearch/v1")))
                .andExpect(queryParam("searchType", "image"))
                .andExpect(queryParam("num", "5"))
                .andRespond(withSuccess("""
                        {"items": [{"link": "https://img.example.com/1.jpg"}, {"link": ""}]}
                        """, MediaType.APPLICATION_JSON));

        List<String> links = client.searchImages("Colgate Toothpaste", 5, probe);

        assertEquals(List.of("https://img.example.com/1.jpg"), links);
    }

    @Test
    void testNoResultsIsEmptyList() {
        server.expect(requestTo(startsWith("https://www.googleapis.com/customsearch/v1")))
                .andRespond(withSuccess("{\"searchInformation\": {\"totalResults\": \"0\"}}", MediaType.APPLICATION_JSON));

        assertTrue(client.search("Zyxbrite", 10, probe).isEmpty());
    }

    @Test
    void testServerErrorIsRetryableTierError() {
        server.expect(requestTo(startsWith("https://www.googleapis.com/customsearch/v1")))
                .andRespond(withServerError());

        EvidenceTierException e = assertThrows(EvidenceTierException.class,
                () -> client.search("Colgate", 10, probe));
        assertEquals(EvidenceTier.WEB_SEARCH, e.getTier());
        verify(usageLedger, never()).record(any(), any(), anyInt(), anyInt(), any(), any());
    }

    @Test
    void testRejectedKeyIsNotRetryable() {
        server.expect(requestTo(startsWith("https://www.googleapis.com/customsearch/v1")))
                .andRespond(withStatus(HttpStatus.FORBIDDEN));

        assertThrows(IllegalStateException.class, () -> client.search("Colgate", 10, probe));
    }

    @Test
    void testMissingCredentials() {
        BrandProbe noKeys = new BrandProbe("Colgate", List.of(), "Toothpaste", "en", null,
                new SearchCredentials(null, "engine-1"), null);

        assertThrows(IllegalStateException.class, () -> client.search("Colgate", 10, noKeys));
    }
}
