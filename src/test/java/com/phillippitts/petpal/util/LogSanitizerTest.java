package com.phillippitts.petpal.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncatesLongTextWithEllipsis() {
        assertThat(LogSanitizer.truncate("pick up the ball", 7)).isEqualTo("pick up…");
    }

    @Test
    void keepsShortTextUnchanged() {
        assertThat(LogSanitizer.truncate("sit", 10)).isEqualTo("sit");
    }

    @Test
    void flattensLineBreaks() {
        assertThat(LogSanitizer.truncate("good\r\ndog\nfetch", 100)).isEqualTo("good dog fetch");
    }

    @Test
    void returnsEmptyForNullOrNonPositiveMax() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("text", 0)).isEmpty();
    }
}
