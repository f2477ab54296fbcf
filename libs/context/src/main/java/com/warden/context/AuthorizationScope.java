package com.warden.context;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Ambient holder binding an {@link AuthorizationContext} to the dynamic extent of one logical
 * operation, with an SLF4J MDC bridge.
 * <p>
 * A binding is established with {@link #run(AuthorizationContext, Runnable)} or
 * {@link #call(AuthorizationContext, Supplier)} and the previous binding (or none) is
 * restored when the block exits, normally or exceptionally. While a context is bound the MDC
 * keys {@code userId}, {@code tenantId} and {@code requestId} are populated so every log
 * statement of the operation carries them.
 * <p>
 * Bindings are thread-confined. Asynchronous work inherits the binding only when it is
 * submitted through {@link #wrap(Runnable)}, {@link #wrap(Supplier)},
 * {@link #propagating(Executor)} or {@link #supplyAsync(Supplier, Executor)}, which capture
 * the submitter's context and rebind it on the worker thread for the duration of the task.
 * Two operations running concurrently on different threads therefore never observe each
 * other's context.
 */
public final class AuthorizationScope {

    /** MDC key for the user ID. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for the tenant ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for the request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    private static final ThreadLocal<AuthorizationContext> CONTEXT = new ThreadLocal<>();

    private AuthorizationScope() {
        // utility class
    }

    /**
     * Returns the context bound to the current thread, if any.
     */
    public static Optional<AuthorizationContext> current() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Returns the bound context.
     *
     * @throws ContextMissingException if no context is bound
     */
    public static AuthorizationContext require() {
        AuthorizationContext context = CONTEXT.get();
        if (context == null) {
            throw new ContextMissingException();
        }
        return context;
    }

    /** Whether a context is bound to the current thread. */
    public static boolean isBound() {
        return CONTEXT.get() != null;
    }

    /**
     * Runs {@code block} with {@code context} bound, then restores the previous binding.
     *
     * @param context the context for the duration of the block (must not be null)
     * @param block   the work to execute
     */
    public static void run(AuthorizationContext context, Runnable block) {
        call(context, () -> {
            block.run();
            return null;
        });
    }

    /**
     * Calls {@code block} with {@code context} bound, then restores the previous binding.
     *
     * @param context the context for the duration of the block (must not be null)
     * @param block   the work to execute
     * @return the block's result
     */
    public static <T> T call(AuthorizationContext context, Supplier<T> block) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        AuthorizationContext previous = CONTEXT.get();
        bind(context);
        try {
            return block.get();
        } finally {
            restore(previous);
        }
    }

    /**
     * Starts asynchronous work with {@code context} bound.
     * <p>
     * The binding covers the synchronous part of {@code asyncBlock}; stages the block
     * schedules through {@link #propagating(Executor)} or {@link #supplyAsync(Supplier, Executor)}
     * carry the context onward. The returned future is the block's own future.
     *
     * @param context    the context of the operation
     * @param asyncBlock starts the work and returns its completion
     */
    public static <T> CompletableFuture<T> runAsync(
            AuthorizationContext context, Supplier<CompletableFuture<T>> asyncBlock) {
        try {
            return call(context, asyncBlock);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Returns a runnable that runs {@code task} under the context bound right now.
     * If no context is bound, the task runs unbound.
     */
    public static Runnable wrap(Runnable task) {
        AuthorizationContext captured = CONTEXT.get();
        if (captured == null) {
            return task;
        }
        return () -> run(captured, task);
    }

    /**
     * Returns a supplier that evaluates {@code task} under the context bound right now.
     * If no context is bound, the task runs unbound.
     */
    public static <T> Supplier<T> wrap(Supplier<T> task) {
        AuthorizationContext captured = CONTEXT.get();
        if (captured == null) {
            return task;
        }
        return () -> call(captured, task);
    }

    /**
     * Returns an executor that captures the submitter's context on every
     * {@code execute} call and binds it on the worker thread.
     */
    public static Executor propagating(Executor delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate must not be null");
        }
        return task -> delegate.execute(wrap(task));
    }

    /**
     * Like {@link CompletableFuture#supplyAsync(Supplier, Executor)}, with the current
     * context carried to the worker thread.
     */
    public static <T> CompletableFuture<T> supplyAsync(Supplier<T> task, Executor executor) {
        return CompletableFuture.supplyAsync(wrap(task), executor);
    }

    private static void bind(AuthorizationContext context) {
        CONTEXT.set(context);
        populateMdc(context);
    }

    private static void restore(AuthorizationContext previous) {
        if (previous != null) {
            bind(previous);
        } else {
            CONTEXT.remove();
            clearMdc();
        }
    }

    private static void populateMdc(AuthorizationContext ctx) {
        setMdc(MDC_USER_ID, ctx.userId());
        setMdc(MDC_TENANT_ID, ctx.tenantId());
        setMdc(MDC_REQUEST_ID, ctx.requestId());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(MDC_USER_ID);
        MDC.remove(MDC_TENANT_ID);
        MDC.remove(MDC_REQUEST_ID);
    }
}
