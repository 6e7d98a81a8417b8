package com.fieldreport.impound.config;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor for SMS dispatch.
 *
 * Notifications run after the release has committed and must never hold the request thread
 * past its await timeout, so they get their own bounded pool. The MDC of the submitting thread
 * is carried into each task so SMS log lines keep the request's trace id.
 */
@Configuration
@Slf4j
public class ExecutorConfig {

    @Value("${app.executor.notification-threads:4}")
    private int notificationThreads;

    @Bean(name = "notificationExecutor", destroyMethod = "shutdown")
    public ExecutorService notificationExecutor() {
        log.info("Creating notification executor with {} threads and MDC propagation", notificationThreads);
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "notify-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new MdcPropagatingExecutorService(Executors.newFixedThreadPool(notificationThreads, threadFactory));
    }

    static final class MdcPropagatingExecutorService implements ExecutorService {

        private final ExecutorService delegate;

        MdcPropagatingExecutorService(ExecutorService delegate) {
            this.delegate = delegate;
        }

        private static <T> Callable<T> wrap(Callable<T> callable) {
            final Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    return callable.call();
                } finally {
                    MDC.clear();
                }
            };
        }

        private static Runnable wrap(Runnable runnable) {
            final Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        }

        private static <T> List<Callable<T>> wrapAll(Collection<? extends Callable<T>> tasks) {
            return tasks.stream().<Callable<T>>map(task -> wrap(task)).toList();
        }

        @Override
        public void execute(Runnable command) {
            delegate.execute(wrap(command));
        }

        @Override
        public <T> Future<T> submit(Callable<T> task) {
            return delegate.submit(wrap(task));
        }

        @Override
        public Future<?> submit(Runnable task) {
            return delegate.submit(wrap(task));
        }

        @Override
        public <T> Future<T> submit(Runnable task, T result) {
            return delegate.submit(wrap(task), result);
        }

        @Override
        public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks) throws InterruptedException {
            return delegate.invokeAll(wrapAll(tasks));
        }

        @Override
        public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks, long timeout, TimeUnit unit)
                throws InterruptedException {
            return delegate.invokeAll(wrapAll(tasks), timeout, unit);
        }

        @Override
        public <T> T invokeAny(Collection<? extends Callable<T>> tasks) throws InterruptedException, ExecutionException {
            return delegate.invokeAny(wrapAll(tasks));
        }

        @Override
        public <T> T invokeAny(Collection<? extends Callable<T>> tasks, long timeout, TimeUnit unit)
                throws InterruptedException, ExecutionException, TimeoutException {
            return delegate.invokeAny(wrapAll(tasks), timeout, unit);
        }

        @Override
        public void shutdown() { delegate.shutdown(); }
        @Override
        public List<Runnable> shutdownNow() { return delegate.shutdownNow(); }
        @Override
        public boolean isShutdown() { return delegate.isShutdown(); }
        @Override
        public boolean isTerminated() { return delegate.isTerminated(); }
        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.awaitTermination(timeout, unit);
        }
    }
}
