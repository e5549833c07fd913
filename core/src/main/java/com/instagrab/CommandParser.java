package com.instagrab;

import java.nio.file.Path;

/**
 * Parses command line arguments into a {@link Request}.
 */
public class CommandParser {

    public static final String USAGE = """
            Usage: instagrab <url> [options]
              --dir DIR        download directory (default from config.json)
              --max N          stop after N items
              --no-video       skip videos
              --no-image       skip images
              --template T     filename template, e.g. {username}_{shortcode}_{num}.{extension}
              --cookies FILE   Netscape cookies.txt with an instagram.com session
              --html FILE      extract from a saved page instead of calling the API
              --config FILE    configuration file (default config.json)
              --list           print the found items without downloading
            Examples:
              instagrab https://www.instagram.com/p/CxYz123abc/
              instagrab https://www.instagram.com/someuser/ --max 50 --no-video
            """;

    /**
     * Null fields mean "use the configured value".
     */
    public record Request(
            String url,
            Path directory,
            int maxItems,
            Boolean includeVideos,
            Boolean includeImages,
            String template,
            Path cookiesFile,
            Path htmlFile,
            Path configFile,
            boolean listOnly
    ) {
    }

    /**
     * @throws IllegalArgumentException if the syntax is invalid
     */
    public static Request parse(String[] args) {
        if (args.length == 0) {
            throw new IllegalArgumentException("Missing URL\n" + USAGE);
        }

        String url = null;
        Path directory = null;
        int maxItems = 0;
        Boolean videos = null;
        Boolean images = null;
        String template = null;
        Path cookies = null;
        Path html = null;
        Path config = Path.of("config.json");
        boolean list = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--dir" -> directory = Path.of(value(args, ++i, arg));
                case "--max" -> maxItems = parseMax(value(args, ++i, arg));
                case "--no-video" -> videos = false;
                case "--no-image" -> images = false;
                case "--template" -> template = value(args, ++i, arg);
                case "--cookies" -> cookies = Path.of(value(args, ++i, arg));
                case "--html" -> html = Path.of(value(args, ++i, arg));
                case "--config" -> config = Path.of(value(args, ++i, arg));
                case "--list" -> list = true;
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg + "\n" + USAGE);
                    }
                    if (url != null) {
                        throw new IllegalArgumentException("Only one URL is supported, got " + url + " and " + arg);
                    }
                    url = arg;
                }
            }
        }

        if (url == null) {
            throw new IllegalArgumentException("Missing URL\n" + USAGE);
        }
        if (Boolean.FALSE.equals(videos) && Boolean.FALSE.equals(images)) {
            throw new IllegalArgumentException("--no-video and --no-image together leave nothing to download");
        }
        return new Request(url, directory, maxItems, videos, images, template, cookies, html, config, list);
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException("Option " + option + " needs a value");
        }
        return args[index];
    }

    private static int parseMax(String raw) {
        try {
            int max = Integer.parseInt(raw);
            if (max <= 0) throw new IllegalArgumentException("--max must be positive");
            return max;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid --max value: " + raw);
        }
    }
}
