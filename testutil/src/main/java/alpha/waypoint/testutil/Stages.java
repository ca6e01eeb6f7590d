package alpha.waypoint.testutil;

import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * Utils for {@code CompletionStage}.
 */
public final class Stages {
    private Stages() {
        // Empty
    }
    
    /**
     * Awaits the result of the given stage, for at most 3 seconds.
     * 
     * @param stage to await
     * @param <T> type of result
     * 
     * @return the result
     * 
     * @throws InterruptedException
     *             if the current thread is interrupted while waiting
     * @throws ExecutionException
     *             if the stage completed exceptionally
     * @throws TimeoutException
     *             if the stage did not complete in time
     */
    public static <T> T await(CompletionStage<T> stage)
            throws InterruptedException, ExecutionException, TimeoutException {
        return stage.toCompletableFuture().get(3, SECONDS);
    }
    
    /**
     * Awaits the failure of the given stage, for at most 3 seconds.
     * 
     * @param stage to await
     * 
     * @return the cause of the failure, unwrapped from the
     *         {@code ExecutionException}
     * 
     * @throws InterruptedException
     *             if the current thread is interrupted while waiting
     * @throws TimeoutException
     *             if the stage did not complete in time
     * @throws AssertionError
     *             if the stage completed normally
     */
    public static Throwable awaitFailure(CompletionStage<?> stage)
            throws InterruptedException, TimeoutException {
        try {
            var v = stage.toCompletableFuture().get(3, SECONDS);
            throw new AssertionError("Expected failure, got: " + v);
        } catch (ExecutionException e) {
            return e.getCause();
        }
    }
}
