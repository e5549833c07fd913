package com.instagrab.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ConfigValidator - Validates configuration on startup.
 */
public class ConfigValidator {
    private static final Logger logger = LoggerFactory.getLogger(ConfigValidator.class);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z]+)}");
    private static final List<String> KNOWN_PLACEHOLDERS = List.of(
            "username", "shortcode", "postId", "num", "extension", "timestamp", "date", "type");

    public enum Severity { ERROR, WARNING }

    public record ValidationError(String message, Severity severity) {
        @Override
        public String toString() {
            return "[" + severity + "] " + message;
        }
    }

    public List<ValidationError> validate(Configuration config) {
        List<ValidationError> errors = new ArrayList<>();

        validateTemplate(config, errors);
        validateDelays(config, errors);
        validateLimits(config, errors);
        validateDirectories(config, errors);
        validateDiskSpace(config, errors);

        return errors;
    }

    private void validateTemplate(Configuration config, List<ValidationError> errors) {
        String template = config.filenameTemplate;
        if (template == null || template.isBlank()) {
            errors.add(new ValidationError("Filename template is empty - the default will be used", Severity.WARNING));
            return;
        }

        Matcher m = PLACEHOLDER.matcher(template);
        while (m.find()) {
            if (!KNOWN_PLACEHOLDERS.contains(m.group(1))) {
                errors.add(new ValidationError("Unknown placeholder in filename template: " + m.group(), Severity.ERROR));
            }
        }
        if (!template.contains("{extension}")) {
            errors.add(new ValidationError("Filename template has no {extension} - files will lack an extension", Severity.WARNING));
        }
        if (!template.contains("{shortcode}") && !template.contains("{postId}") && !template.contains("{timestamp}")) {
            errors.add(new ValidationError("Filename template has no per-post placeholder - downloads may overwrite each other", Severity.WARNING));
        }
    }

    private void validateDelays(Configuration config, List<ValidationError> errors) {
        checkWindow("profile", config.profileDelayMinMs, config.profileDelayMaxMs, errors);
        checkWindow("saved", config.savedDelayMinMs, config.savedDelayMaxMs, errors);

        if (config.downloadDelayMs < 0) {
            errors.add(new ValidationError("downloadDelayMs must not be negative", Severity.ERROR));
        }
        if (config.profileDelayMinMs < 1000) {
            errors.add(new ValidationError("Profile delay below 1s - the account may get rate limited", Severity.WARNING));
        }
    }

    private static void checkWindow(String name, long min, long max, List<ValidationError> errors) {
        if (min < 0 || max < min) {
            errors.add(new ValidationError(
                    String.format("Invalid %s delay window [%d, %d]", name, min, max), Severity.ERROR));
        }
    }

    private void validateLimits(Configuration config, List<ValidationError> errors) {
        if (config.historyLimit < 1) {
            errors.add(new ValidationError("historyLimit must be at least 1", Severity.ERROR));
        }
        if (config.downloadThreads < 1) {
            errors.add(new ValidationError("downloadThreads must be at least 1", Severity.ERROR));
        }
    }

    private void validateDirectories(Configuration config, List<ValidationError> errors) {
        if (config.downloadPath == null || config.downloadPath.isEmpty()) {
            errors.add(new ValidationError("No download directory configured", Severity.ERROR));
            return;
        }

        File dlPath = new File(config.downloadPath);
        if (!dlPath.exists()) {
            if (!dlPath.mkdirs()) {
                errors.add(new ValidationError("Cannot create download directory: " + config.downloadPath, Severity.ERROR));
            } else {
                logger.info("✅ Created download directory: {}", config.downloadPath);
            }
        } else if (!dlPath.isDirectory()) {
            errors.add(new ValidationError("Download path is not a directory: " + config.downloadPath, Severity.ERROR));
        }

        if (config.cookiesFile != null && !config.cookiesFile.isEmpty() && !new File(config.cookiesFile).exists()) {
            errors.add(new ValidationError("Cookies file not found: " + config.cookiesFile
                    + " - only the HTML fallback will work", Severity.WARNING));
        }
    }

    private void validateDiskSpace(Configuration config, List<ValidationError> errors) {
        File root = new File(config.downloadPath != null && !config.downloadPath.isEmpty() ? config.downloadPath : ".");
        if (!root.exists()) root = new File(".");
        long freeMB = root.getUsableSpace() / 1024 / 1024;

        if (freeMB < 100) {
            errors.add(new ValidationError(
                    String.format("CRITICAL: Only %d MB free - downloads may fail!", freeMB), Severity.ERROR));
        } else if (freeMB < 1024) {
            errors.add(new ValidationError(
                    String.format("Low disk space: only %d MB free", freeMB), Severity.WARNING));
        }
    }

    /**
     * Validate and report to the log.
     *
     * @throws IllegalStateException if any ERROR was found
     */
    public void validateAndReport(Configuration config) {
        List<ValidationError> errors = validate(config);

        int errorCount = 0;
        int warningCount = 0;

        for (ValidationError error : errors) {
            if (error.severity() == Severity.ERROR) {
                logger.error("❌ Config Error: {}", error.message());
                errorCount++;
            } else {
                logger.warn("⚠️ Config Warning: {}", error.message());
                warningCount++;
            }
        }

        if (errorCount > 0 || warningCount > 0) {
            logger.warn("📋 Configuration validation: {} errors, {} warnings", errorCount, warningCount);
        } else {
            logger.info("✅ Configuration validation passed");
        }

        if (errorCount > 0) {
            throw new IllegalStateException(
                    String.format("Configuration validation failed with %d error(s). Fix config and restart.", errorCount));
        }
    }
}
