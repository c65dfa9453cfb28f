package com.phillippitts.speaktolatex.service.translation;

import com.phillippitts.speaktolatex.config.properties.VoiceProperties;
import com.phillippitts.speaktolatex.domain.TranslationResult;
import com.phillippitts.speaktolatex.exception.InvalidAudioException;
import com.phillippitts.speaktolatex.exception.InvalidInputException;
import com.phillippitts.speaktolatex.exception.TranscriptionException;
import com.phillippitts.speaktolatex.service.compiler.LatexCompiler;
import com.phillippitts.speaktolatex.service.metrics.TranslationMetrics;
import com.phillippitts.speaktolatex.service.stt.SttEngine;
import com.phillippitts.speaktolatex.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Turns typed text or recorded speech into LaTeX.
 *
 * <p>Text goes straight to the compiler after cleaning. Audio is validated, transcribed by
 * the configured {@link SttEngine}, cleaned and then compiled. A recognition failure or silent
 * clip is reported as an unsuccessful {@link TranslationResult}; a missing engine is an
 * infrastructure problem and surfaces as {@link TranscriptionException}.
 */
@Service
public class LatexTranslationService {

    private static final Logger LOG = LogManager.getLogger(LatexTranslationService.class);

    static final String TRANSLATION_ID_KEY = "translationId";
    static final String SUCCESS_MESSAGE = "Translation completed successfully";
    static final String NO_SPEECH_MESSAGE = "No speech was detected in the audio";
    static final String RECOGNITION_FAILED_MESSAGE = "Speech recognition failed";

    private final LatexCompiler compiler;
    private final SpeechTextCleaner cleaner;
    private final ObjectProvider<SttEngine> sttEngine;
    private final VoiceProperties props;
    private final TranslationMetrics metrics;

    public LatexTranslationService(LatexCompiler compiler,
                                   SpeechTextCleaner cleaner,
                                   ObjectProvider<SttEngine> sttEngine,
                                   VoiceProperties props,
                                   TranslationMetrics metrics) {
        this.compiler = compiler;
        this.cleaner = cleaner;
        this.sttEngine = sttEngine;
        this.props = props;
        this.metrics = metrics;
    }

    /**
     * Compiles typed text.
     *
     * @throws InvalidInputException if the text is null or blank
     */
    public TranslationResult translateText(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidInputException("No text provided");
        }
        return traced(TranslationMetrics.SOURCE_TEXT, () -> compileCleaned(cleaner.clean(text),
                TranslationMetrics.SOURCE_TEXT));
    }

    /**
     * Transcribes a recording and compiles what was said.
     *
     * @throws InvalidAudioException  if the recording is missing, empty or too large
     * @throws TranscriptionException if no speech engine is available
     */
    public TranslationResult transcribeAndTranslate(byte[] audio) {
        validateAudio(audio);
        SttEngine engine = sttEngine.getIfAvailable();
        if (engine == null) {
            metrics.incrementFailure(TranslationMetrics.SOURCE_AUDIO, "no_engine");
            throw new TranscriptionException("No speech-to-text engine is configured", "none");
        }
        return traced(TranslationMetrics.SOURCE_AUDIO, () -> transcribe(engine, audio));
    }

    private TranslationResult transcribe(SttEngine engine, byte[] audio) {
        String recognised;
        try {
            recognised = engine.transcribe(audio);
        } catch (TranscriptionException e) {
            LOG.warn("Speech recognition failed: engine={}, bytes={}", e.getEngineName(), audio.length, e);
            metrics.incrementFailure(TranslationMetrics.SOURCE_AUDIO, "transcription");
            return TranslationResult.failure("", RECOGNITION_FAILED_MESSAGE);
        }
        String speech = cleaner.clean(recognised);
        if (speech.isEmpty()) {
            LOG.info("No speech detected: engine={}, bytes={}", engine.getEngineName(), audio.length);
            metrics.incrementFailure(TranslationMetrics.SOURCE_AUDIO, "no_speech");
            return TranslationResult.failure("", NO_SPEECH_MESSAGE);
        }
        return compileCleaned(speech, TranslationMetrics.SOURCE_AUDIO);
    }

    private TranslationResult compileCleaned(String speech, String source) {
        String latex = compiler.compile(speech).strip();
        LOG.info("Translated {} input: chars={}, preview='{}'", source, speech.length(),
                LogSanitizer.preview(speech, props.getLogPreviewChars()));
        LOG.debug("LaTeX output: {}", latex);
        metrics.incrementSuccess(source);
        return TranslationResult.success(speech, latex, SUCCESS_MESSAGE);
    }

    private void validateAudio(byte[] audio) {
        if (audio == null || audio.length == 0) {
            throw new InvalidAudioException("audio file is empty");
        }
        if (audio.length > props.getMaxAudioBytes()) {
            throw new InvalidAudioException(audio.length,
                    "exceeds limit of " + props.getMaxAudioBytes() + " bytes");
        }
    }

    private TranslationResult traced(String source, Supplier<TranslationResult> work) {
        ThreadContext.put(TRANSLATION_ID_KEY, UUID.randomUUID().toString());
        long start = System.nanoTime();
        try {
            return work.get();
        } finally {
            metrics.recordLatency(source, System.nanoTime() - start);
            ThreadContext.remove(TRANSLATION_ID_KEY);
        }
    }
}
