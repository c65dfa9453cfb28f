package com.phillippitts.speaktolatex.presentation.controller;

import com.phillippitts.speaktolatex.domain.TranslationResult;
import com.phillippitts.speaktolatex.service.stt.SttEngine;
import com.phillippitts.speaktolatex.testutil.FakeSttEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class LatexControllerIntegrationTest {

    @TestConfiguration
    static class FakeEngineConfig {
        @Bean
        SttEngine fakeSttEngine() {
            return new FakeSttEngine("fake", "Integral of x squared dx.");
        }
    }

    @Autowired
    private TestRestTemplate rest;

    @Test
    void shouldTranslateTypedText() {
        ResponseEntity<TranslationResult> response = rest.postForEntity("/api/latex/translate",
                json("{\"text\": \"sum from i equals 1 to n of i squared\"}"), TranslationResult.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().success()).isTrue();
        assertThat(response.getBody().latex()).isEqualTo("\\sum_{i=1}^{n}i^2");
        assertThat(response.getBody().speechText()).isEqualTo("sum from i equals 1 to n of i squared");
    }

    @Test
    @SuppressWarnings("rawtypes")
    void shouldRejectBlankText() {
        ResponseEntity<Map> response = rest.postForEntity("/api/latex/translate",
                json("{\"text\": \"   \"}"), Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).containsEntry("details", "No text provided");
    }

    @Test
    @SuppressWarnings("rawtypes")
    void shouldRejectMalformedJson() {
        ResponseEntity<Map> response = rest.postForEntity("/api/latex/translate",
                json("{\"text\": "), Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).containsEntry("errorCode", "InvalidInputException");
    }

    @Test
    void shouldTranscribeUploadedAudio() {
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("audio", new ByteArrayResource(new byte[]{1, 2, 3, 4, 5}) {
            @Override
            public String getFilename() {
                return "clip.wav";
            }
        });

        ResponseEntity<TranslationResult> response = rest.postForEntity("/api/latex/transcribe",
                multipart(body), TranslationResult.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().success()).isTrue();
        assertThat(response.getBody().speechText()).isEqualTo("Integral of x squared dx");
        assertThat(response.getBody().latex()).isEqualTo("\\int x^2\\, dx");
    }

    @Test
    @SuppressWarnings("rawtypes")
    void shouldRejectUploadWithoutAudioPart() {
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("note", "no recording attached");

        ResponseEntity<Map> response = rest.postForEntity("/api/latex/transcribe", multipart(body), Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).containsEntry("errorCode", "InvalidAudioException");
    }

    @Test
    void shouldEchoRequestId() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("X-Request-ID", "trace-me");

        ResponseEntity<String> response = rest.postForEntity("/api/latex/translate",
                new HttpEntity<>("{\"text\": \"x plus y\"}", headers), String.class);

        assertThat(response.getHeaders().getFirst("X-Request-ID")).isEqualTo("trace-me");
    }

    @Test
    void shouldExposeHealth() {
        ResponseEntity<String> response = rest.getForEntity("/actuator/health", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).contains("\"status\":\"UP\"").contains("fake: ready");
    }

    private static HttpEntity<String> json(String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }

    private static HttpEntity<MultiValueMap<String, Object>> multipart(MultiValueMap<String, Object> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        return new HttpEntity<>(body, headers);
    }
}
