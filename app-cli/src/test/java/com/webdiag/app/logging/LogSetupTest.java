package com.webdiag.app.logging;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;

class LogSetupTest {

    @Test
    void levelOf_parsesNamesCaseInsensitively_andFallsBackToInfo() {
        assertThat(LogSetup.levelOf("fine")).isEqualTo(Level.FINE);
        assertThat(LogSetup.levelOf(" WARNING ")).isEqualTo(Level.WARNING);
        assertThat(LogSetup.levelOf("loud")).isEqualTo(Level.INFO);
        assertThat(LogSetup.levelOf(null)).isEqualTo(Level.INFO);
    }
}
