package alpha.waypoint.testutil;

import org.assertj.core.groups.Tuple;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.logging.Formatter;
import java.util.logging.LogRecord;

import static java.lang.System.Logger.Level;
import static java.time.temporal.ChronoUnit.MILLIS;
import static java.util.Objects.requireNonNull;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Utils for JUL's {@link LogRecord} and related types.<p>
 * 
 * The router logs using {@code System.Logger}, which, absent of a different
 * logging backend, delegates to {@code java.util.logging}. This is what makes
 * the records observable by tests.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class LogRecords {
    private LogRecords() {
        // Empty
    }
    
    /**
     * Create an AssertJ Tuple consisting of a log- level and message.
     * 
     * @param level of log record
     * @param msg of log record
     * @return a tuple
     * 
     * @throws NullPointerException
     *             if {@code level} is {@code null}
     */
    public static Tuple rec(Level level, String msg) {
        return tuple(toJUL(level), msg);
    }
    
    /**
     * Formats the given record.<p>
     * 
     * {@code LogRecord} does not implement {@code toString} and would return
     * something like "java.util.logging.LogRecord@4e196770".
     * 
     * @param rec log record to format
     * @return a well formatted string
     */
    public static String toString(LogRecord rec) {
        String s = new ElegantFormatter().format(rec);
        // Remove trailing newline
        return s.substring(0, s.length() - 1);
    }
    
    /**
     * Convert {@code System.Logger.Level} to {@code java.util.logging.Level}.<p>
     * 
     * This is the same mapping as the one applied by the JDK's default
     * {@code System.LoggerFinder}.
     * 
     * @param level to convert
     * @return the converted value
     * @throws NullPointerException if {@code level} is {@code null}
     */
    static java.util.logging.Level toJUL(Level level) {
        switch (requireNonNull(level)) {
            case ALL:     return java.util.logging.Level.ALL;
            case TRACE:   return java.util.logging.Level.FINER;
            case DEBUG:   return java.util.logging.Level.FINE;
            case INFO:    return java.util.logging.Level.INFO;
            case WARNING: return java.util.logging.Level.WARNING;
            case ERROR:   return java.util.logging.Level.SEVERE;
            case OFF:     return java.util.logging.Level.OFF;
            default:
                throw new IllegalArgumentException(
                        "No JUL match for this level: " + level);
        }
    }
    
    static final class ElegantFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String joined = String.join(" | ",
                    r.getInstant().truncatedTo(MILLIS).toString().replace("T", " | "),
                    rightPad(r.getLevel().getLocalizedName(), "WARNING".length()),
                    r.getLoggerName(),
                    formatMessage(r));
            
            return r.getThrown() == null ? joined + '\n' :
                    joined + getStacktrace(r.getThrown());
        }
        
        private static String getStacktrace(Throwable t) {
            StringWriter sw = new StringWriter();
            PrintWriter pw = new PrintWriter(sw);
            pw.println();
            t.printStackTrace(pw);
            pw.close();
            return sw.toString();
        }
        
        private static String rightPad(String s, int minLength) {
            return s.length() >= minLength ? s : s + " ".repeat(minLength - s.length());
        }
    }
}
