package com.example.pdfrenamer.service.settings;

import com.example.pdfrenamer.model.DigitFilter;
import com.example.pdfrenamer.model.ExtractionRect;
import com.example.pdfrenamer.model.Settings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Reads and writes the INI settings file with the sections {@code Paths},
 * {@code OCR} and {@code Filter}. Saving a rectangle re-reads the file and
 * rewrites only the lines of the {@code OCR} keys. Every other line, comments
 * included, survives verbatim.
 */
public class SettingsStore {

    private static final Logger log = LoggerFactory.getLogger(SettingsStore.class);

    private static final String PATHS = "Paths";
    private static final String OCR = "OCR";
    private static final String FILTER = "Filter";

    private static final String DEFAULT_INPUT_DIR = "pdf_input";
    private static final String DEFAULT_OUTPUT_DIR = "pdf_output";
    private static final String DEFAULT_LOG_DIR = "log_output";

    private final Path file;

    public SettingsStore(Path file) {
        this.file = file.toAbsolutePath().normalize();
    }

    public Path location() {
        return file;
    }

    public Settings load() {
        IniDocument ini = read();
        Path base = file.getParent();
        Path inputDir = base.resolve(ini.get(PATHS, "input_dir").orElse(DEFAULT_INPUT_DIR)).normalize();
        Path outputDir = base.resolve(ini.get(PATHS, "output_dir").orElse(DEFAULT_OUTPUT_DIR)).normalize();
        Path logDir = base.resolve(ini.get(PATHS, "log_dir").orElse(DEFAULT_LOG_DIR)).normalize();

        ExtractionRect defaults = ExtractionRect.DEFAULT;
        int x = readInt(ini, OCR, "x", (int) defaults.x0());
        int y = readInt(ini, OCR, "y", (int) defaults.y0());
        int width = readInt(ini, OCR, "width", (int) defaults.width());
        int height = readInt(ini, OCR, "height", (int) defaults.height());
        ExtractionRect rect;
        if (width <= 0 || height <= 0) {
            log.warn("Ignoring OCR rectangle with non-positive size {}x{} in {}", width, height, file);
            rect = defaults;
        } else {
            rect = ExtractionRect.fromOrigin(x, y, width, height);
        }

        int digits = readInt(ini, FILTER, "digits", 0);
        DigitFilter digitFilter;
        if (digits < 0) {
            log.warn("Ignoring negative digit filter {} in {}", digits, file);
            digitFilter = DigitFilter.DISABLED;
        } else {
            digitFilter = new DigitFilter(digits);
        }

        Settings settings = new Settings(inputDir, outputDir, logDir, rect, digitFilter);
        log.info("Loaded settings from {}: input={}, output={}, log={}, rect={}, digits={}",
                file, inputDir, outputDir, logDir, rect, digitFilter.digits());
        return settings;
    }

    /**
     * Persists the smallest integer rectangle enclosing {@code rect} as
     * {@code x, y, width, height} under the {@code OCR} section, at least one
     * unit wide and high. Every other line is written back as it was read.
     *
     * @throws SettingsPersistenceException if the file cannot be read or written
     */
    public void saveRect(ExtractionRect rect) {
        int x = (int) Math.floor(rect.x0());
        int y = (int) Math.floor(rect.y0());
        int width = Math.max(1, (int) Math.ceil(rect.x1()) - x);
        int height = Math.max(1, (int) Math.ceil(rect.y1()) - y);
        IniDocument ini = read();
        ini.set(OCR, "x", Integer.toString(x));
        ini.set(OCR, "y", Integer.toString(y));
        ini.set(OCR, "width", Integer.toString(width));
        ini.set(OCR, "height", Integer.toString(height));
        write(ini);
        log.info("Saved extraction rectangle {} to {}", rect, file);
    }

    public void ensureDirectories(Settings settings) {
        for (Path dir : List.of(settings.inputDir(), settings.outputDir(), settings.logDir())) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new IllegalStateException("Unable to create directory " + dir, e);
            }
        }
    }

    private IniDocument read() {
        if (!Files.exists(file)) {
            log.debug("Settings file {} does not exist, using defaults", file);
            return IniDocument.empty();
        }
        try {
            return IniDocument.parse(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new SettingsPersistenceException("Failed to read settings file " + file, e);
        }
    }

    private void write(IniDocument ini) {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.writeString(temp, ini.render(), StandardCharsets.UTF_8);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new SettingsPersistenceException("Failed to write settings file " + file, e);
        }
    }

    private int readInt(IniDocument ini, String section, String key, int fallback) {
        String value = ini.get(section, key).orElse(null);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Setting {}.{} in {} is not an integer, using {}", section, key, file, fallback);
            return fallback;
        }
    }
}
