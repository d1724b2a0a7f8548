package com.fastalert.core.notify;

import com.fastalert.core.spi.image.AlertImage;
import com.fastalert.core.spi.image.ImageProvider;
import com.fastalert.model.Alert;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 截图增强
 * 每次查询有独立的短超时, 任何失败只记日志, 不影响通知本身
 */
@Slf4j
public final class Images {

    public static final Duration LOOKUP_TIMEOUT = Duration.ofMillis(500);

    private static final ExecutorService LOOKUP_POOL = Executors.newCachedThreadPool(new NamedThreadFactory("alert-image"));

    private final ImageProvider provider;

    private final Duration timeout;

    private Images(ImageProvider provider, Duration timeout) {
        this.provider = provider;
        this.timeout = timeout;
    }

    public static Images of(ImageProvider provider) {
        return new Images(provider, LOOKUP_TIMEOUT);
    }

    public static Images of(ImageProvider provider, Duration timeout) {
        return new Images(provider, timeout);
    }

    @FunctionalInterface
    public interface ImageConsumer {
        /**
         * @return false 停止遍历
         */
        boolean accept(int index, Alert alert, AlertImage image);
    }

    /**
     * 依次查询带截图 token 的告警
     */
    public void forEachStoredImage(List<Alert> alerts, ImageConsumer consumer) {
        for (int i = 0; i < alerts.size(); i++) {
            Alert alert = alerts.get(i);
            if (alert.imageToken().isEmpty()) {
                continue;
            }
            Optional<AlertImage> image = lookup(alert);
            if (image.isPresent() && !consumer.accept(i, alert, image.get())) {
                return;
            }
        }
    }

    /**
     * 第一张带 URL 的截图
     */
    public Optional<String> firstImageUrl(List<Alert> alerts) {
        String[] found = new String[1];
        forEachStoredImage(alerts, (i, alert, image) -> {
            if (image.hasUrl()) {
                found[0] = image.getUrl();
                return false;
            }
            return true;
        });
        return Optional.ofNullable(found[0]);
    }

    Optional<AlertImage> lookup(Alert alert) {
        CompletableFuture<Optional<AlertImage>> future = CompletableFuture.supplyAsync(() -> {
            try {
                return provider.imageFor(alert);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, LOOKUP_POOL);
        try {
            Optional<AlertImage> image = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return image == null ? Optional.empty() : image;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Image] lookup timed out after {}ms, alert={}", timeout.toMillis(), alert.name());
        } catch (ExecutionException e) {
            log.warn("[Image] lookup failed, alert={}", alert.name(), e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("[Image] lookup interrupted, alert={}", alert.name());
        }
        return Optional.empty();
    }
}
