package com.fastalert.core.notify;

import com.fastalert.model.Alert;
import com.fastalert.model.ctx.NotifyContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 并发派发
 * 一个告警分组并发发往多个接收器, 每个接收器一个结果, 重试由调用方决定
 */
public class NotificationDispatcher {

    private final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final ExecutorService exec;

    public NotificationDispatcher(ExecutorService exec) {
        this.exec = exec;
    }

    /**
     * 异步派发, 返回的 future 在所有接收器完成后结束
     * 取消返回的 future 会中断进行中的调用
     */
    public CompletableFuture<Map<String, NotifyResult>> dispatchAsync(NotifyContext ctx, List<Alert> alerts,
                                                                       List<Integration> integrations) {
        List<CompletableFuture<NotifyResult>> futures = new ArrayList<>(integrations.size());
        for (Integration integration : integrations) {
            futures.add(submit(ctx, alerts, integration));
        }
        CompletableFuture<Map<String, NotifyResult>> all = CompletableFuture
                .allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> {
                    Map<String, NotifyResult> results = new LinkedHashMap<>();
                    for (int i = 0; i < integrations.size(); i++) {
                        results.put(integrations.get(i).name(), futures.get(i).join());
                    }
                    return results;
                });
        all.whenComplete((r, e) -> {
            if (e instanceof CancellationException) {
                futures.forEach(f -> f.cancel(true));
            }
        });
        return all;
    }

    /**
     * 同步派发, 超时后中断所有未完成的调用
     */
    public Map<String, NotifyResult> dispatch(NotifyContext ctx, List<Alert> alerts, List<Integration> integrations,
                                              long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
        CompletableFuture<Map<String, NotifyResult>> all = dispatchAsync(ctx, alerts, integrations);
        try {
            return all.get(timeout, unit);
        } catch (TimeoutException | InterruptedException e) {
            all.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            throw new IllegalStateException("dispatch failed", e.getCause());
        }
    }

    private CompletableFuture<NotifyResult> submit(NotifyContext ctx, List<Alert> alerts, Integration integration) {
        InterruptibleTask task = new InterruptibleTask(() -> integration.notify(ctx, alerts));
        try {
            exec.execute(task);
        } catch (RejectedExecutionException e) {
            log.error("[Notify] receiver={} rejected by dispatcher pool", integration.name(), e);
            task.complete(NotifyResult.failure(true, e));
        }
        return task;
    }

    /**
     * cancel(true) 时中断执行线程
     */
    private static final class InterruptibleTask extends CompletableFuture<NotifyResult> implements Runnable {

        private final Supplier<NotifyResult> body;

        private volatile Thread runner;

        // 线程池饱和时 CallerRunsPolicy 会在提交线程上直接执行
        private final Thread submitter = Thread.currentThread();

        InterruptibleTask(Supplier<NotifyResult> body) {
            this.body = body;
        }

        @Override
        public void run() {
            if (isDone()) {
                return;
            }
            runner = Thread.currentThread();
            try {
                complete(body.get());
            } catch (RuntimeException e) {
                complete(NotifyResult.failure(false, e));
            } finally {
                runner = null;
                // 只清除池线程上的中断标记, 提交线程的中断状态归调用方所有
                if (Thread.currentThread() != submitter) {
                    Thread.interrupted();
                }
            }
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            boolean cancelled = super.cancel(mayInterruptIfRunning);
            Thread t = runner;
            if (cancelled && mayInterruptIfRunning && t != null) {
                t.interrupt();
            }
            return cancelled;
        }
    }
}
