package com.linkchex.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

/**
 * CLI 로그 설정. SLF4J(slf4j-jdk14)와 StructuredLog 모두 JUL 루트 로거로 모인다.
 * stdout은 리포트 전용이라 로그는 stderr로만 나간다.
 * <pre>
 *  -Dlinkchex.log.level=DEBUG|INFO|WARN|ERROR   기본 WARNING, --verbose면 FINE
 *  -Dlinkchex.log.dir=logs                      지정 시 linkchex-N.log 롤링 파일 추가
 *  -Dlinkchex.log.sizeMb=2  -Dlinkchex.log.files=5
 * </pre>
 */
public final class LogSetup {
    private static final DateTimeFormatter TS =
            DateTimeFormatter.ofPattern("HH:mm:ss.SSS", Locale.ROOT).withZone(ZoneId.systemDefault());

    private static boolean done;

    private LogSetup() {}

    public static synchronized void init(boolean verbose) {
        if (done) return;
        done = true;

        Level level = resolveLevel(verbose);
        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");
        root.setLevel(level);

        Formatter fmt = new CompactFormatter();
        root.addHandler(stderrHandler(level, fmt));

        Handler file = fileHandler(level, fmt);
        if (file != null) root.addHandler(file);
    }

    private static Handler stderrHandler(Level level, Formatter fmt) {
        // ConsoleHandler와 같지만 레코드마다 flush해서 진행 표시줄과 섞이지 않게
        StreamHandler h = new StreamHandler(System.err, fmt) {
            @Override public synchronized void publish(LogRecord r) {
                super.publish(r);
                flush();
            }
        };
        h.setLevel(level);
        return h;
    }

    private static Handler fileHandler(Level level, Formatter fmt) {
        String dir = System.getProperty("linkchex.log.dir");
        if (dir == null || dir.isBlank()) return null;
        try {
            Path logDir = Files.createDirectories(Path.of(dir.trim()));
            int limit = intProp("linkchex.log.sizeMb", 2) * 1024 * 1024;
            FileHandler fh = new FileHandler(logDir.resolve("linkchex-%g.log").toString(),
                    limit, intProp("linkchex.log.files", 5), true);
            fh.setLevel(level);
            fh.setFormatter(fmt);
            return fh;
        } catch (IOException e) {
            System.err.println("linkchex: log file disabled (" + e.getMessage() + ")");
            return null;
        }
    }

    static Level resolveLevel(boolean verbose) {
        String prop = System.getProperty("linkchex.log.level");
        if (prop == null || prop.isBlank()) return verbose ? Level.FINE : Level.WARNING;
        return levelOf(prop);
    }

    /** SLF4J식 이름(DEBUG, WARN 등)도 받는다. 모르는 값이면 INFO. */
    static Level levelOf(String s) {
        String v = s.trim().toUpperCase(Locale.ROOT);
        return switch (v) {
            case "TRACE" -> Level.FINEST;
            case "DEBUG" -> Level.FINE;
            case "WARN" -> Level.WARNING;
            case "ERROR" -> Level.SEVERE;
            default -> {
                try {
                    yield Level.parse(v);
                } catch (IllegalArgumentException e) {
                    yield Level.INFO;
                }
            }
        };
    }

    private static int intProp(String key, int def) {
        String v = System.getProperty(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Math.max(1, Integer.parseInt(v.trim()));
        } catch (NumberFormatException e) {
            return def;
        }
    }

    /** "12:00:01.234 WARN  [worker] ProbeClient: msg" */
    private static final class CompactFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            StringBuilder sb = new StringBuilder(128)
                    .append(TS.format(Instant.ofEpochMilli(r.getMillis()))).append(' ')
                    .append(String.format(Locale.ROOT, "%-5s", shortLevel(r.getLevel()))).append(" [")
                    .append(Thread.currentThread().getName()).append("] ")
                    .append(simpleName(r.getLoggerName())).append(": ")
                    .append(formatMessage(r)).append(System.lineSeparator());
            if (r.getThrown() != null) {
                StringWriter sw = new StringWriter();
                r.getThrown().printStackTrace(new PrintWriter(sw));
                sb.append(sw);
            }
            return sb.toString();
        }

        private static String shortLevel(Level l) {
            if (l.intValue() >= Level.SEVERE.intValue()) return "ERROR";
            if (l.intValue() >= Level.WARNING.intValue()) return "WARN";
            if (l.intValue() >= Level.INFO.intValue()) return "INFO";
            return "DEBUG";
        }

        private static String simpleName(String logger) {
            if (logger == null) return "-";
            int dot = logger.lastIndexOf('.');
            return dot < 0 ? logger : logger.substring(dot + 1);
        }
    }
}
