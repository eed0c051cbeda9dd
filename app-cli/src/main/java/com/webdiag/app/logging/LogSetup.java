package com.webdiag.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정 (slf4j-jdk14가 여기로 흘려보낸다) + 사이즈 롤링(기본 2MB x 5).
 * System props:
 *  -Dwd.log.level=FINE|INFO|WARNING|SEVERE (기본 WARNING: 콘솔 리포트를 가리지 않게)
 *  -Dwd.log.sizeMb=2
 *  -Dwd.log.files=5
 *  -Dwd.log.console=true|false (기본 true)
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false;
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    /** outRoot/logs/webdiag-%g.log */
    public static synchronized void configure(Path outRoot) {
        init(outRoot.resolve("logs"));
    }

    public static synchronized void init(Path logDir) {
        if (initialized) return;
        initialized = true;

        Level level = levelOf(System.getProperty("wd.log.level", "WARNING"));
        int sizeMb = parseInt(System.getProperty("wd.log.sizeMb"), 2);
        int fileCnt = parseInt(System.getProperty("wd.log.files"), 5);
        boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("wd.log.console", "true"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");
        root.setLevel(level);

        if (toConsole) {
            ConsoleHandler console = new ConsoleHandler();
            console.setLevel(level);
            console.setFormatter(LINE_FORMATTER);
            root.addHandler(console);
        }

        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve("webdiag-%g.log").toString();
            FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
            // 파일에는 최소 INFO까지 남긴다
            file.setLevel(level.intValue() < Level.INFO.intValue() ? level : Level.INFO);
            file.setFormatter(LINE_FORMATTER);
            root.addHandler(file);
            if (root.getLevel().intValue() > Level.INFO.intValue()) root.setLevel(Level.INFO);
        } catch (IOException e) {
            // 파일 로그 없이 콘솔만으로 진행
            Logger.getLogger(LogSetup.class.getName()).log(Level.WARNING, "File log setup failed: " + e.getMessage(), e);
        }

        Logger.getLogger(LogSetup.class.getName()).log(Level.FINE,
                () -> "Log initialized. dir=" + logDir.toAbsolutePath() + ", level=" + level.getName());
    }

    /** 문자열을 Level로(실패 시 INFO) */
    public static Level levelOf(String name) {
        try {
            return Level.parse(String.valueOf(name).trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Level.INFO;
        }
    }

    private static int parseInt(String s, int def) {
        try {
            return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    private static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), formatMessage(r));

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }
    }
}
