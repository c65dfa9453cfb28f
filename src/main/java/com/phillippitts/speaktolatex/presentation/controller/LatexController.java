package com.phillippitts.speaktolatex.presentation.controller;

import com.phillippitts.speaktolatex.domain.TranslationResult;
import com.phillippitts.speaktolatex.exception.InvalidAudioException;
import com.phillippitts.speaktolatex.service.translation.LatexTranslationService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * HTTP surface of the translator.
 *
 * <ul>
 *   <li>{@code POST /api/latex/translate} - JSON {@code {"text": "..."}}</li>
 *   <li>{@code POST /api/latex/transcribe} - multipart upload with an {@code audio} part</li>
 * </ul>
 *
 * Both return a {@link TranslationResult}. An unsuccessful translation is still 200; request
 * and infrastructure errors are mapped by {@code GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/latex")
class LatexController {

    private static final Logger LOG = LogManager.getLogger(LatexController.class);

    private final LatexTranslationService translationService;

    LatexController(LatexTranslationService translationService) {
        this.translationService = translationService;
    }

    @PostMapping(value = "/translate", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<TranslationResult> translate(@Valid @RequestBody TranslateRequest request) {
        return ResponseEntity.ok(translationService.translateText(request.text()));
    }

    @PostMapping(value = "/transcribe", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<TranslationResult> transcribe(
            @RequestParam(value = "audio", required = false) MultipartFile audio) throws IOException {
        if (audio == null || audio.isEmpty()) {
            throw new InvalidAudioException("no audio file provided");
        }
        LOG.debug("Audio upload received: name={}, bytes={}", audio.getOriginalFilename(), audio.getSize());
        return ResponseEntity.ok(translationService.transcribeAndTranslate(audio.getBytes()));
    }

    record TranslateRequest(@NotBlank String text) {
    }
}
