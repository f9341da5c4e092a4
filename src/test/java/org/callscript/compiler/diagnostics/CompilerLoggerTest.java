package org.callscript.compiler.diagnostics;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the level handling of {@link CompilerLogger}.
 */
public class CompilerLoggerTest {

    @AfterEach
    void restoreLevel() {
        CompilerLogger.setLevel(CompilerLogger.INFO);
    }

    @Test
    @Tag("unit")
    void levelIsClamped() {
        CompilerLogger.setLevel(42);
        assertThat(CompilerLogger.getLevel()).isEqualTo(CompilerLogger.TRACE);

        CompilerLogger.setLevel(-3);
        assertThat(CompilerLogger.getLevel()).isEqualTo(CompilerLogger.ERROR);
    }

    @Test
    @Tag("unit")
    void levelsAboveTheCurrentOneAreDisabled() {
        CompilerLogger.setLevel(CompilerLogger.WARN);

        assertThat(CompilerLogger.isEnabled(CompilerLogger.DEBUG)).isFalse();
        assertThat(CompilerLogger.isEnabled(CompilerLogger.TRACE)).isFalse();
    }
}
