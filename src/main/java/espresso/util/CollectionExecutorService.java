// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Consumer;
import java.util.function.Function;
import espresso.util.condition.ConditionContext;
import espresso.util.condition.Unwind;
import org.jetbrains.annotations.NotNull;

/**
 * A wrapper around {@link ExecutorService} providing convenient methods for concurrent operations on collections.
 */
public final class CollectionExecutorService {
    /**
     * Initializes a new collection executor service that will submit tasks to the given executor service.
     */
    public CollectionExecutorService(final @NotNull ExecutorService executorService) {
        this.executorService = executorService;
    }

    /**
     * Returns a fresh list of the results of applying the given function to the elements of the given collection,
     * in the order of the collection's iterator.
     * <p>
     * Elements are processed concurrently. The tasks inherit the {@link ConditionContext} state of the calling thread,
     * and unwinds escaping a task continue in the calling thread. Once a task fails, the tasks not yet awaited are
     * cancelled.
     * <p>
     * This method waits for the submitted tasks before returning.
     */
    public <T, R> @NotNull List<R> map(
        final @NotNull Collection<? extends T> collection,
        final @NotNull Function<? super T, ? extends R> function
    ) {
        final var results = new ArrayList<R>(collection.size());
        new AwaitImpl<R>(submitTasks(collection, function).iterator(), results::add).awaitAll();
        return results;
    }

    /**
     * Applies the given consumer to the elements of the given collection concurrently, with the same guarantees as
     * {@link #map(Collection, Function)}.
     */
    public <T> void forEach(
        final @NotNull Collection<? extends T> collection,
        final @NotNull Consumer<? super T> consumer
    ) {
        final var futures = submitTasks(collection, value -> {
            consumer.accept(value);
            return null;
        });
        new AwaitImpl<>(futures.iterator(), value -> {
        }).awaitAll();
    }

    private <T, R> @NotNull List<@NotNull Future<R>> submitTasks(
        final @NotNull Collection<? extends T> collection,
        final @NotNull Function<? super T, ? extends R> function
    ) {
        final var inheritedState = ConditionContext.saveInheritableState();
        final var futures = new ArrayList<@NotNull Future<R>>(collection.size());
        // Iterate explicitly so that the futures are in the collection's iterator order.
        for (final var element : collection) {
            futures.add(executorService.submit(() -> {
                final var previousState = ConditionContext.inheritState(inheritedState);
                try (final var t = new Trace(() -> "Executing a task in thread " + Thread.currentThread().getName())) {
                    t.use();
                    return function.apply(element);
                } finally {
                    ConditionContext.restoreState(previousState);
                }
            }));
        }
        return futures;
    }

    private final @NotNull ExecutorService executorService;

    private static final class AwaitImpl<T> {
        private AwaitImpl(
            final @NotNull Iterator<? extends @NotNull Future<? extends T>> iterator,
            final @NotNull Consumer<? super T> consumer
        ) {
            this.iterator = iterator;
            this.consumer = consumer;
        }

        private void awaitAll() {
            try {
                while (iterator.hasNext()) {
                    awaitOne(iterator.next());
                }
                if (foundInterrupt) {
                    throw new AssertionError("A task was interrupted, but no other task threw anything concrete");
                }
            } finally {
                cancelIfNeeded();
            }
        }

        private void cancelIfNeeded() {
            if (needsCancellation) {
                while (iterator.hasNext()) {
                    iterator.next().cancel(true);
                }
            }
        }

        private void awaitOne(final @NotNull Future<? extends T> future) {
            try {
                consumer.accept(future.get());
            } catch (final InterruptedException e) {
                throw SneakyThrow.doThrow(e);
            } catch (final ExecutionException e) {
                recover(e);
            }
        }

        private void recover(final @NotNull ExecutionException executionException) {
            needsCancellation = true;
            final var cause = executionException.getCause();
            if (cause instanceof Unwind) {
                // Cross-thread unwind to a restart, continue unwinding in this thread.
                throw SneakyThrow.doThrow(cause);
            } else if (cause instanceof InterruptedException) {
                // Keep looking, another future will likely hold something more concrete.
                foundInterrupt = true;
            } else if (cause instanceof final Error error) {
                throw error;
            } else if (cause instanceof final RuntimeException runtimeException) {
                throw runtimeException;
            } else {
                throw new AssertionError("An exception escaped from a worker through a future", cause);
            }
        }

        private final @NotNull Iterator<? extends @NotNull Future<? extends T>> iterator;
        private final @NotNull Consumer<? super T> consumer;
        private boolean foundInterrupt = false;
        private boolean needsCancellation = false;
    }
}
