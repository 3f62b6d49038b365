// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.util.condition;

import java.util.Iterator;
import java.util.NoSuchElementException;
import espresso.util.SneakyThrow;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A condition context keeps track of currently registered handlers and restart points.
 * <p>
 * Each thread has its own local condition context, independent of other threads' contexts. Instances are not accessible
 * directly, static methods operating on the current thread's context are provided instead.
 * <p>
 * Worker threads started on behalf of a thread may share its restarts and its thread-safe handlers, see
 * {@link #saveInheritableState()}. An unwind to a restart owned by another thread has to be carried back to that thread
 * by whoever waits for the worker.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Signals the given condition as non-fatal.
     * <p>
     * Signaling a condition entails invoking currently registered handlers in order from the newest one to the oldest.
     * Handlers registered by another thread are skipped, unless they are {@link HandlerProcedure.ThreadSafe}. If any
     * handler performs a non-local control flow transfer, later handlers are not invoked.
     * <p>
     * If all handlers decline handling the condition, that is they all return normally, this method returns normally
     * as well.
     * <p>
     * Since handlers are allowed to unwind to a restart point, this method may throw {@link Unwind}.
     *
     * @param condition The condition to signal, passed to every handler wrapped in a {@link SignaledCondition}.
     */
    public static void signal(final Condition condition) {
        localContext().signal(new SignaledCondition(condition, false));
    }

    /**
     * Signals the given condition as an error.
     * <p>
     * This method behaves like {@link ConditionContext#signal(Condition)}, with one difference: if all handlers decline
     * handling the condition, a fatal error of type {@link UnhandledErrorError} is thrown.
     * <p>
     * A condition signaled with this method is called <dfn>fatal</dfn>. Handlers that only collect warnings are
     * expected to decline fatal conditions.
     * <p>
     * Since this method never returns normally, it's declared to return {@link UnhandledErrorError} that can be
     * "thrown" at call sites to help the compiler's control flow analysis.
     *
     * @param condition The condition to signal.
     * @return Never returns.
     */
    public static UnhandledErrorError error(final Condition condition) {
        localContext().signal(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Executes the given function with a restart point around it.
     * <p>
     * The restart is active, and visible to {@link #restarts()} and {@link #findRestart(String)}, only while
     * {@code callback} runs. An unwind targeting any other restart passes through unchanged.
     *
     * @param restartName The user-readable name of this restart point.
     * @param callback    The function to execute with a restart around it. The restart object is passed as an argument.
     * @return If the act of executing {@code callback} did not transfer control flow to this restart point, the value
     * returned by {@code callback}. Otherwise, if executing {@code callback} unwound to this restart point,
     * {@code null} instead.
     */
    public static <T> @Nullable T withRestart(
        final String restartName,
        final RestartCallback<? extends T> callback
    ) {
        final var restart = new Restart(restartName);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            restart.unlink();
        }
    }

    /**
     * Returns an iterable containing all active restart points, ordered from the newest one to the oldest.
     * <p>
     * In a worker thread, this includes the restarts inherited from the thread that submitted the work.
     */
    public static Iterable<Restart> restarts() {
        return localContext().new RestartIterable();
    }

    /**
     * Finds the newest active restart point with the given name.
     * <p>
     * Handlers use this to locate the restart established by a caller further up, such as the abort restart of a
     * build, without holding a reference to it.
     *
     * @param restartName The name the restart was established with.
     * @return The restart, or {@code null} if no active restart has that name.
     */
    public static @Nullable Restart findRestart(final String restartName) {
        for (final var restart : restarts()) {
            if (restart.name().equals(restartName)) {
                return restart;
            }
        }
        return null;
    }

    /**
     * Saves the inheritable state, that is, restarts and thread-safe handlers, to allow them to be used by a child
     * thread.
     * <p>
     * The saved state refers to the handlers and restarts as they are now. The caller must keep them established until
     * every thread that inherited the state has finished.
     *
     * @see #inheritState(InheritedState)
     */
    public static InheritedState saveInheritableState() {
        final var context = localContext();
        // The regular handler chain can be used unchanged, because signal() checks if the handler is usable in the
        // calling thread.
        return new InheritedState(context.firstHandler, context.firstRestart);
    }

    /**
     * Inherits the given condition context state in a child thread.
     * <p>
     * The child thread's condition context has to be empty, with no handlers or restarts at all.
     *
     * @param inheritedState The state saved by the parent thread.
     * @return The state before inheritance, to be restored by {@link #restoreState(PreviousState)}.
     * @see #saveInheritableState()
     */
    public static PreviousState inheritState(final InheritedState inheritedState) {
        final var context = localContext();
        assert context.firstHandler == null : "Attempted to inherit state into a thread that already has handlers";
        assert context.firstRestart == null : "Attempted to inherit state into a thread that already has restarts";
        context.firstHandler = inheritedState.firstHandler;
        context.firstRestart = inheritedState.firstRestart;
        return PreviousState.instance;
    }

    /**
     * Restores the original state of the current thread's condition context.
     * <p>
     * Pooled threads are reused for unrelated work, so this has to be called even if the inherited work failed.
     */
    public static void restoreState(@SuppressWarnings("unused") final PreviousState previousState) {
        final var context = localContext();
        context.firstHandler = null;
        context.firstRestart = null;
    }

    static ConditionContext localContext() {
        return localContext.get();
    }

    private void signal(final SignaledCondition condition) {
        for (var handler = findFirstHandler(); handler != null; handler = handler.next) {
            if (!handler.usableIn(this)) {
                continue;
            }
            final var currentSave = currentHandler;
            currentHandler = handler;
            try {
                handler.handle(condition);
            } catch (final Unwind unwind) {
                throw SneakyThrow.doThrow(unwind);
            } finally {
                currentHandler = currentSave;
            }
        }
    }

    private @Nullable Handler findFirstHandler() {
        // A condition signaled from within a handler only reaches the handlers installed before that one.
        return (currentHandler == null) ? firstHandler : currentHandler.next;
    }

    @Nullable Handler firstHandler = null;
    @Nullable Restart firstRestart = null;
    private @Nullable Handler currentHandler = null;

    @SuppressWarnings("nullness:type.argument") // Never null, CF doesn't understand withInitial.
    private static final ThreadLocal<ConditionContext> localContext = ThreadLocal.withInitial(ConditionContext::new);

    /**
     * Opaque saved state of a condition context, to be inherited by a worker thread.
     */
    public static final class InheritedState {
        private InheritedState(final @Nullable Handler firstHandler, final @Nullable Restart firstRestart) {
            this.firstHandler = firstHandler;
            this.firstRestart = firstRestart;
        }

        private final @Nullable Handler firstHandler;
        private final @Nullable Restart firstRestart;
    }

    /**
     * Opaque token representing the state of a worker thread's context before inheritance.
     */
    public static final class PreviousState {
        private PreviousState() {
        }

        private static final PreviousState instance = new PreviousState();
    }

    private final class RestartIterable implements Iterable<Restart> {
        @Override
        public Iterator<Restart> iterator() {
            return new RestartIterator(firstRestart);
        }
    }

    private static final class RestartIterator implements Iterator<Restart> {
        private RestartIterator(final @Nullable Restart firstRestart) {
            current = firstRestart;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public Restart next() {
            final var result = current;
            if (result == null) {
                throw new NoSuchElementException("No more restarts left");
            }
            current = result.next;
            return result;
        }

        private @Nullable Restart current;
    }
}
