package ircube.convert.utilities;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConversionLogSessionTest {

    private static final Logger logger = LoggerFactory.getLogger(ConversionLogSessionTest.class);

    @TempDir
    Path tmp;

    @Test
    @DisplayName("Messages logged during a session land in conversion.log, later ones do not")
    void testSessionWritesLogFile() throws IOException {
        Path logFile;
        try (ConversionLogSession session = ConversionLogSession.start(tmp)) {
            assertTrue(session.isActive());
            logFile = session.getLogFile();
            logger.info("inside session marker");
        }
        logger.info("outside session marker");

        assertEquals(tmp.resolve(ConversionLogSession.LOG_FILE_NAME), logFile);
        String content = Files.readString(logFile);
        assertTrue(content.contains("inside session marker"));
        assertFalse(content.contains("outside session marker"));
    }

    @Test
    void testInvalidDirectoryGivesInactiveSession() {
        try (ConversionLogSession session = ConversionLogSession.start(tmp.resolve("missing"))) {
            assertFalse(session.isActive());
            assertNull(session.getLogFile());
        }
        assertFalse(ConversionLogSession.start(null).isActive());
    }
}
