package org.ember.compiler.diagnostics;

import org.ember.junit.extensions.logging.ExpectLog;
import org.ember.junit.extensions.logging.LogLevel;
import org.ember.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(LogWatchExtension.class)
class DiagnosticsEngineTest {

    @Test
    @Tag("unit")
    void startsEmpty() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        assertThat(engine.hasErrors()).isFalse();
        assertThat(engine.getDiagnostics()).isEmpty();
        assertThat(engine.summary()).isEmpty();
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "a.ex:2: unused")
    void collectsErrorsAndWarningsInOrder() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        engine.reportWarning("unused", "a.ex", 2);
        engine.reportError("undefined variable \"x\"", "a.ex", 5);

        assertThat(engine.hasErrors()).isTrue();
        assertThat(engine.getDiagnostics()).extracting(Diagnostic::type)
                .containsExactly(Diagnostic.Type.WARNING, Diagnostic.Type.ERROR);
        assertThat(engine.warnings()).singleElement().satisfies(w -> assertThat(w.lineNumber()).isEqualTo(2));
        assertThat(engine.summary()).isEqualTo("[WARNING] a.ex:2: unused\n[ERROR] a.ex:5: undefined variable \"x\"");
    }
}
