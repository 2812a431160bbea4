package com.docgraph.core.util;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Filter;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * CLI 프로세스의 java.util.logging 설정. SLF4J 호출은 slf4j-jdk14 바인딩으로 여기 핸들러를 탄다.
 * <ul>
 *   <li>logs/docgraph-%g.log : 사람이 읽는 한 줄 로그(사이즈 롤링)</li>
 *   <li>logs/crawl-events-%g.jsonl : {@link StructuredLog} 이벤트만 JSON 한 줄씩</li>
 *   <li>콘솔(stderr) : 사람이 읽는 로그. stdout은 명령 결과 JSON 전용</li>
 * </ul>
 * System props: -Ddg.log.level=DEBUG|INFO|WARN|ERROR (JUL 이름도 허용),
 * -Ddg.log.sizeMb=2, -Ddg.log.files=5, -Ddg.log.console=true|false
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false;

    /** 페이지마다 떠드는 JDK HTTP 내부 로거는 경고 이상만 */
    static final Map<String, Level> QUIET = Map.of(
            "jdk.internal.httpclient", Level.WARNING,
            "sun.net.www.protocol.http", Level.WARNING);

    /** StructuredLog가 만든 레코드(JSON 객체 한 줄)인지 */
    static final Filter EVENTS_ONLY = r -> isEvent(r.getMessage());
    static final Filter HUMAN_ONLY = r -> !isEvent(r.getMessage());

    public static synchronized void configure(Path outRoot) {
        init(outRoot.resolve("logs"));
    }

    public static synchronized void init(Path logDir) {
        if (initialized) return;
        initialized = true;

        Level level = levelOf(System.getProperty("dg.log.level", "INFO"));
        int sizeMb  = parseInt(System.getProperty("dg.log.sizeMb"), 2);
        int fileCnt = parseInt(System.getProperty("dg.log.files"), 5);
        boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("dg.log.console", "true"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        QUIET.forEach((name, lvl) -> Logger.getLogger(name).setLevel(lvl));

        if (toConsole) {
            ConsoleHandler console = new ConsoleHandler();
            console.setLevel(level);
            console.setFormatter(new LineFormatter());
            console.setFilter(HUMAN_ONLY);
            root.addHandler(console);
        }

        try {
            Files.createDirectories(logDir);
            int limit = sizeMb * 1024 * 1024;

            FileHandler text = new FileHandler(logDir.resolve("docgraph-%g.log").toString(), limit, fileCnt, true);
            text.setLevel(level);
            text.setFormatter(new LineFormatter());
            text.setFilter(HUMAN_ONLY);
            root.addHandler(text);

            FileHandler events = new FileHandler(logDir.resolve("crawl-events-%g.jsonl").toString(), limit, fileCnt, true);
            events.setLevel(level);
            events.setFormatter(new EventFormatter());
            events.setFilter(EVENTS_ONLY);
            root.addHandler(events);

            Logger.getLogger(LogSetup.class.getName()).log(Level.INFO,
                    () -> "Log initialized. dir=" + logDir.toAbsolutePath() + ", level=" + level.getName());
        } catch (IOException e) {
            // 파일 핸들러 없이 콘솔만으로 계속
            Logger.getLogger(LogSetup.class.getName()).log(Level.WARNING, "File logging disabled: " + e.getMessage(), e);
        }
    }

    /** 문자열을 Level로(실패 시 INFO). SLF4J 이름(TRACE/DEBUG/WARN/ERROR)도 받는다. */
    public static Level levelOf(String s) {
        String v = String.valueOf(s).trim().toUpperCase(Locale.ROOT);
        switch (v) {
            case "TRACE": return Level.FINEST;
            case "DEBUG": return Level.FINE;
            case "WARN":  return Level.WARNING;
            case "ERROR": return Level.SEVERE;
            default:
                try { return Level.parse(v); }
                catch (IllegalArgumentException e) { return Level.INFO; }
        }
    }

    static boolean isEvent(String msg) {
        return msg != null && msg.startsWith("{\"ts\":");
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException ignored) { return def; }
    }

    /** 시각 [레벨] (스레드) 짧은 로거명 - 메시지, 예외가 있으면 스택 */
    static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String name = r.getLoggerName() == null ? "" : r.getLoggerName();
            String shortName = name.substring(name.lastIndexOf('.') + 1);
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL %2$-7s (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(), shortName, formatMessage(r));

            Throwable t = r.getThrown();
            if (t == null) return base;
            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw;
        }
    }

    /** 이미 JSON인 메시지를 그대로 한 줄로 */
    static final class EventFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            return r.getMessage() + System.lineSeparator();
        }
    }
}
