package alpha.waypoint.testutil;

import alpha.waypoint.Router;

import java.io.OutputStream;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Logger;

import static alpha.waypoint.testutil.LogRecords.toJUL;
import static java.lang.System.Logger.Level;

/**
 * Logging utilities.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Logging {
    private Logging() {
        // Empty
    }
    
    /**
     * Set logging level for the package of a given component.<p>
     * 
     * This method is assumed to be used by test cases interested to increase
     * the logging output. A console handler of the target level is installed
     * on the component's logger, which formats all records using
     * {@link LogRecords#toString(java.util.logging.LogRecord)} and writes them
     * on {@code System.out}.
     * 
     * @param component to extract package from
     * @param level to set
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static void setLevel(Class<?> component, Level level) {
        final java.util.logging.Level impl = toJUL(level);
        Logger l = Logger.getLogger(component.getPackageName());
        l.setLevel(impl);
        if (CONSOLE_ADDED.compareAndSet(false, true)) {
            Handler h = new SystemOutInsteadOfSystemErr();
            h.setFormatter(new LogRecords.ElegantFormatter());
            h.setLevel(java.util.logging.Level.ALL);
            l.addHandler(h);
            l.setUseParentHandlers(false);
        }
    }
    
    private static final AtomicBoolean CONSOLE_ADDED = new AtomicBoolean();
    
    /**
     * Log everything.<p>
     * 
     * This method is equivalent to:
     * 
     * <pre>
     *     Logging.{@link #setLevel(Class, Level)
     *       setLevel}(Router.class, Level.ALL);
     * </pre>
     * 
     * Note that the router implementation lives in a sub-package of the
     * {@code Router} interface, and so its logger is a child of the logger
     * configured by this method.
     */
    public static void everything() {
        setLevel(Router.class, Level.ALL);
    }
    
    /**
     * Add handler to the logger of the package that the component belongs to.
     * 
     * @param component to extract package from
     * @param handler to add
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     */
    public static void addHandler(Class<?> component, Handler handler) {
        Logger.getLogger(component.getPackageName()).addHandler(handler);
    }
    
    /**
     * Remove handler from the logger of the package that the component belongs to.<p>
     * 
     * This method returns silently if the given handler is not found or
     * {@code null}.
     * 
     * @param component to extract package from
     * @param handler to remove (may be {@code null})
     * 
     * @throws NullPointerException if {@code component} is {@code null}
     */
    public static void removeHandler(Class<?> component, Handler handler) {
        Logger.getLogger(component.getPackageName()).removeHandler(handler);
    }
    
    private static final class SystemOutInsteadOfSystemErr extends ConsoleHandler {
        private boolean initialized;
        
        @Override
        protected synchronized void setOutputStream(OutputStream out) throws SecurityException {
            if (initialized) {
                super.setOutputStream(out);
            } else {
                super.setOutputStream(System.out);
                initialized = true;
            }
        }
    }
}
