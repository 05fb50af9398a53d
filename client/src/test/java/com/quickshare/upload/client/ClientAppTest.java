package com.quickshare.upload.client;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClientAppTest {

    @Test
    void testParseArgs_KeyValuePairs() {
        Map<String, String> params = ClientApp.parseArgs(new String[]{
                "--filePath=/tmp/report.pdf", "--apiBaseUrl=http://host:8000/v1?x=1", "--verbose", "positional"});

        assertEquals("/tmp/report.pdf", params.get("filePath"));
        assertEquals("http://host:8000/v1?x=1", params.get("apiBaseUrl"));
        assertEquals(2, params.size());
    }

    @Test
    void testResolveBaseUrl_Precedence() {
        assertEquals("http://args/v1", ClientApp.resolveBaseUrl(Map.of("apiBaseUrl", "http://args/v1"), "http://env/v1"));
        assertEquals("http://env/v1", ClientApp.resolveBaseUrl(Map.of(), "http://env/v1"));
        assertEquals(ClientApp.DEFAULT_BASE_URL, ClientApp.resolveBaseUrl(Map.of("apiBaseUrl", " "), null));
    }
}
