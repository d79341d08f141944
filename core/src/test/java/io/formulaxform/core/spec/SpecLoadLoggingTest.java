package io.formulaxform.core.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.formulaxform.core.engine.EngineRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

/** Verifies the INFO entries written while formula specs load. */
@DisplayName("SpecLoadLoggingTest")
class SpecLoadLoggingTest {

    private FormulaSpecParser parser;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger parserLogger;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        parser = new FormulaSpecParser(EngineRegistry.standard());

        parserLogger = (Logger) LoggerFactory.getLogger(FormulaSpecParser.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        parserLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        parserLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    @Test
    @DisplayName("Each loaded spec logs id, version, lang and source")
    void loadedSpecIsLogged() throws IOException {
        Path path = tempDir.resolve("area.yaml");
        Files.writeString(path, """
                id: area
                version: "1.2.0"
                lang: infix
                expression: width * depth
                """);

        parser.parse(path);

        assertThat(logAppender.list).hasSize(1);
        ILoggingEvent event = logAppender.list.get(0);
        assertThat(event.getLevel()).isEqualTo(Level.INFO);
        assertThat(event.getFormattedMessage())
                .isEqualTo("Loaded formula spec: id=area, version=1.2.0, lang=infix, source=" + path);
    }

    @Test
    @DisplayName("Directory load logs a summary after the per-spec entries")
    void directoryLoadLogsSummary() throws IOException {
        Files.writeString(tempDir.resolve("a.yaml"), "id: a\nexpression: 1\n");
        Files.writeString(tempDir.resolve("b.yml"), "id: b\nexpression: 2\n");

        parser.loadDirectory(tempDir);

        assertThat(logAppender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .hasSize(3)
                .last()
                .isEqualTo("Loaded 2 formula spec(s) from " + tempDir);
    }

    @Test
    @DisplayName("Failed load logs nothing")
    void failedLoadIsNotLogged() throws IOException {
        Path path = tempDir.resolve("bad.yaml");
        Files.writeString(path, "id: bad\nlang: infix\nexpression: 1 +\n");

        assertThatThrownBy(() -> parser.parse(path)).hasMessageContaining("parity");

        assertThat(logAppender.list).isEmpty();
    }
}
