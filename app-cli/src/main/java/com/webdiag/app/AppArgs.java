package com.webdiag.app;

import java.nio.file.Path;
import java.util.Objects;

/** 명령행 인자: <url> [--config file] [--out dir] [--no-json] [--sequential] */
public final class AppArgs {

    public static final String USAGE =
            "Usage: App <url> [--config diagnosis.yml] [--out dir] [--no-json] [--sequential]";

    private final String url;
    private final Path configFile;   // null이면 작업 디렉터리의 diagnosis.yml(없으면 기본값)
    private final Path outDir;       // null이면 설정값
    private final boolean noJson;
    private final boolean sequential;

    private AppArgs(String url, Path configFile, Path outDir, boolean noJson, boolean sequential) {
        this.url = url;
        this.configFile = configFile;
        this.outDir = outDir;
        this.noJson = noJson;
        this.sequential = sequential;
    }

    /** @throws IllegalArgumentException 인자가 잘못되면 (메시지에 이유) */
    public static AppArgs parse(String... args) {
        Objects.requireNonNull(args, "args");
        String url = null;
        Path config = null;
        Path out = null;
        boolean noJson = false;
        boolean sequential = false;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--config":
                    config = Path.of(value(args, ++i, a));
                    break;
                case "--out":
                    out = Path.of(value(args, ++i, a));
                    break;
                case "--no-json":
                    noJson = true;
                    break;
                case "--sequential":
                    sequential = true;
                    break;
                default:
                    if (a.startsWith("--")) throw new IllegalArgumentException("Unknown option: " + a);
                    if (url != null) throw new IllegalArgumentException("Only one URL is allowed: " + a);
                    url = a;
            }
        }
        if (url == null || url.isBlank()) throw new IllegalArgumentException("URL is required");
        return new AppArgs(url, config, out, noJson, sequential);
    }

    private static String value(String[] args, int i, String opt) {
        if (i >= args.length || args[i].startsWith("--")) {
            throw new IllegalArgumentException(opt + " needs a value");
        }
        return args[i];
    }

    public String url() { return url; }
    public Path configFile() { return configFile; }
    public Path outDir() { return outDir; }
    public boolean noJson() { return noJson; }
    public boolean sequential() { return sequential; }
}
