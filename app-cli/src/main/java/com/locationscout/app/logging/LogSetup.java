package com.locationscout.app.logging;

import com.locationscout.core.util.StructuredLog;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;
import java.util.logging.*;

/**
 * CLI 실행용 JUL 구성. SLF4J(slf4j-jdk14) 로그와 StructuredLog 이벤트를 나눠 받는다.
 * <ul>
 *   <li>scout-%g.log : 일반 로그 한 줄 포맷(파일 레벨)</li>
 *   <li>events-%g.jsonl : StructuredLog 이벤트 JSON 원문</li>
 *   <li>콘솔(stderr) : 콘솔 레벨 이상만. 기본 WARNING 이라 진행률 출력과 섞이지 않는다</li>
 * </ul>
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false;
    private static Logger eventsRoot; // 강참조 유지(JUL 은 로거를 약참조로 보관)

    /**
     * System props (모두 선택):
     * -Dls.log.level=FINE|INFO|... (파일, 기본 INFO)
     * -Dls.log.console=WARNING|INFO|OFF (콘솔, 기본 WARNING)
     * -Dls.log.sizeMb=2, -Dls.log.files=5 (파일 롤링)
     */
    record Settings(Level fileLevel, Level consoleLevel, int sizeMb, int files) {
        static Settings from(Properties p) {
            return new Settings(
                    levelOf(p.getProperty("ls.log.level"), Level.INFO),
                    levelOf(p.getProperty("ls.log.console"), Level.WARNING),
                    Math.max(1, parseInt(p.getProperty("ls.log.sizeMb"), 2)),
                    Math.max(1, parseInt(p.getProperty("ls.log.files"), 5)));
        }

        int limitBytes() { return sizeMb * 1024 * 1024; }
    }

    public static synchronized void init(Path logDir) {
        if (initialized) return;
        initialized = true;

        Settings s = Settings.from(System.getProperties());
        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");
        root.setLevel(lowest(s.fileLevel(), s.consoleLevel()));

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(s.consoleLevel());
        console.setFormatter(new LineFormatter());
        root.addHandler(console);

        try {
            Files.createDirectories(logDir);

            FileHandler file = new FileHandler(logDir.resolve("scout-%g.log").toString(), s.limitBytes(), s.files(), true);
            file.setLevel(s.fileLevel());
            file.setFormatter(new LineFormatter());
            root.addHandler(file);

            FileHandler events = new FileHandler(logDir.resolve("events-%g.jsonl").toString(), s.limitBytes(), s.files(), true);
            events.setLevel(Level.ALL);
            events.setFormatter(new EventFormatter());
            eventsRoot = Logger.getLogger(eventsLoggerName());
            eventsRoot.setLevel(s.fileLevel());
            eventsRoot.setUseParentHandlers(false);
            eventsRoot.addHandler(events);

            Logger.getLogger(LogSetup.class.getName()).log(Level.INFO,
                    () -> "Log initialized. dir=" + logDir.toAbsolutePath() + ", file=" + s.fileLevel() + ", console=" + s.consoleLevel());
        } catch (IOException e) {
            // 파일 핸들러 실패: 콘솔만으로 계속
            root.log(Level.WARNING, "Log files unavailable in " + logDir + ": " + e.getMessage(), e);
        }
    }

    /** "events." → "events" (JUL 부모 로거 이름) */
    static String eventsLoggerName() {
        String p = StructuredLog.LOGGER_PREFIX;
        return p.endsWith(".") ? p.substring(0, p.length() - 1) : p;
    }

    /** 문자열을 Level로(비었거나 모르는 이름이면 def) */
    static Level levelOf(String s, Level def) {
        if (s == null || s.isBlank()) return def;
        try {
            return Level.parse(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return def;
        }
    }

    static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException e) { return def; }
    }

    private static Level lowest(Level a, Level b) {
        return a.intValue() <= b.intValue() ? a : b;
    }

    /** 시각 [레벨] (스레드) 로거 - 메시지, 예외가 있으면 스택 */
    static final class LineFormatter extends Formatter {
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

    /** 이벤트는 이미 JSON 한 줄이므로 그대로 */
    static final class EventFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            return r.getMessage() + System.lineSeparator();
        }
    }
}
