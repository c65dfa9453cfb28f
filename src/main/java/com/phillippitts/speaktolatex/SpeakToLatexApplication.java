package com.phillippitts.speaktolatex;

import com.phillippitts.speaktolatex.config.properties.CompilerProperties;
import com.phillippitts.speaktolatex.config.properties.VoiceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        CompilerProperties.class,
        VoiceProperties.class
})
public class SpeakToLatexApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpeakToLatexApplication.class, args);
    }

}
