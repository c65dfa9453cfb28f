package com.phillippitts.speaktolatex;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class SpeakToLatexApplicationTests {

    @Test
    void contextLoads() {
    }

}
