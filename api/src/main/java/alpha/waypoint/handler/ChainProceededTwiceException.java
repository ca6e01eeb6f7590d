package alpha.waypoint.handler;

import alpha.waypoint.Chain;

import java.io.Serial;

/**
 * Thrown by {@link Chain#proceed()} if a middleware calls it more than
 * once.<p>
 * 
 * This is a bug in the middleware. The router does not recover the exception
 * into a response; the whole invocation chain completes exceptionally with
 * it.
 */
public class ChainProceededTwiceException extends IllegalStateException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs this object.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public ChainProceededTwiceException(String message) {
        super(message);
    }
}
