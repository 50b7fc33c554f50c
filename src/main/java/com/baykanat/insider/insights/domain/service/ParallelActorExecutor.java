package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.config.AppProperties;
import com.baykanat.insider.insights.domain.exception.QueryCancelledException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiConsumer;
import java.util.function.BinaryOperator;
import java.util.function.Supplier;

/**
 * Actor listesini partition'lara bölüp sınırlı pool'da işler. Her task kendi kısmi accumulator'ını üretir,
 * tüm task'lar bitince birleştirilir. Tek actor'deki hata loglanıp atlanır; iptal/deadline tüm sorguyu düşürür.
 */
@Slf4j
@Component
public class ParallelActorExecutor {

    private final ExecutorService executor;
    private final AppProperties appProperties;

    public ParallelActorExecutor(@Qualifier("insightExecutor") ExecutorService executor, AppProperties appProperties) {
        this.executor = executor;
        this.appProperties = appProperties;
    }

    public <T, A> A execute(List<T> actors, QueryContext context, Supplier<A> accumulatorFactory,
                            BiConsumer<A, T> consumer, BinaryOperator<A> merger) {
        int partitionSize = Math.max(1, appProperties.getEngine().getActorPartitionSize());
        List<CompletableFuture<A>> futures = new ArrayList<>();
        for (int start = 0; start < actors.size(); start += partitionSize) {
            List<T> partition = actors.subList(start, Math.min(actors.size(), start + partitionSize));
            futures.add(CompletableFuture.supplyAsync(
                    () -> processPartition(partition, context, accumulatorFactory, consumer), executor));
        }
        List<A> partials = awaitAll(futures, context);

        A merged = accumulatorFactory.get();
        for (A partial : partials) {
            merged = merger.apply(merged, partial);
        }
        return merged;
    }

    /** Bağımsız task'ları (ör. entity başına trend) paralel çalıştırır; sonuçlar girdi sırasıyla döner. */
    public <R> List<R> invokeAll(List<Supplier<R>> tasks, QueryContext context) {
        List<CompletableFuture<R>> futures = new ArrayList<>();
        for (Supplier<R> task : tasks) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                context.checkCancelled();
                return task.get();
            }, executor));
        }
        return awaitAll(futures, context);
    }

    private <T, A> A processPartition(List<T> partition, QueryContext context,
                                      Supplier<A> accumulatorFactory, BiConsumer<A, T> consumer) {
        A accumulator = accumulatorFactory.get();
        for (T actor : partition) {
            context.checkCancelled();
            try {
                consumer.accept(accumulator, actor);
            } catch (QueryCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                context.recordSkippedActor();
                log.warn("Skipping actor after evaluation error: {}", e.getMessage());
            }
        }
        return accumulator;
    }

    private <R> List<R> awaitAll(List<CompletableFuture<R>> futures, QueryContext context) {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        try {
            long remaining = Math.max(0L, context.remainingNanos());
            all.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            cancelAll(futures, context);
            throw new QueryCancelledException("Query exceeded its deadline", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(futures, context);
            throw new QueryCancelledException("Query was interrupted", e);
        } catch (ExecutionException e) {
            cancelAll(futures, context);
            throw propagate(e.getCause());
        }

        List<R> results = new ArrayList<>(futures.size());
        for (CompletableFuture<R> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    private static <R> void cancelAll(List<CompletableFuture<R>> futures, QueryContext context) {
        context.cancel();
        futures.forEach(future -> future.cancel(true));
    }

    private static RuntimeException propagate(Throwable cause) {
        Throwable unwrapped = cause instanceof CompletionException && cause.getCause() != null ? cause.getCause() : cause;
        if (unwrapped instanceof RuntimeException runtime) {
            return runtime;
        }
        if (unwrapped instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("Insight worker failed", unwrapped);
    }
}
