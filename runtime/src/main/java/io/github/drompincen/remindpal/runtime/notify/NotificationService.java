package io.github.drompincen.remindpal.runtime.notify;

import io.github.drompincen.remindpal.protocol.api.ChoiceOption;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Wraps the {@link Notifier} with a per-call timeout. A choice prompt that
 * cannot be delivered is retried once as plain text listing the option ids, so
 * the recipient can still answer by typing one.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    static final String FALLBACK_FOOTER =
            "(Could not display buttons, please reply with text if needed or try command again)";

    private final Notifier notifier;
    private final long timeoutMs;
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "notifier");
        t.setDaemon(true);
        return t;
    });

    public NotificationService(Notifier notifier,
                               @Value("${remindpal.notifier.timeout-ms:15000}") long timeoutMs) {
        this.notifier = notifier;
        this.timeoutMs = timeoutMs;
    }

    public boolean sendText(String owner, String text) {
        return deliver("text", owner, () -> notifier.sendText(owner, text));
    }

    public boolean sendChoice(String owner, String text, List<ChoiceOption> options) {
        if (deliver("choice", owner, () -> notifier.sendChoice(owner, text, options))) {
            return true;
        }
        log.warn("Falling back to plain text for {}", owner);
        return sendText(owner, fallbackText(text, options));
    }

    static String fallbackText(String text, List<ChoiceOption> options) {
        StringBuilder sb = new StringBuilder(text);
        for (ChoiceOption option : options) {
            sb.append("\n- ").append(option.label()).append(" (Option ID: ").append(option.id()).append(')');
        }
        return sb.append('\n').append(FALLBACK_FOOTER).toString();
    }

    private boolean deliver(String kind, String owner, BooleanSupplier call) {
        CompletableFuture<Boolean> future = CompletableFuture.supplyAsync(call::getAsBoolean, executor);
        try {
            boolean sent = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (!sent) {
                log.warn("Notifier rejected {} message to {}", kind, owner);
            }
            return sent;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Timed out after {}ms sending {} message to {}", timeoutMs, kind, owner);
            return false;
        } catch (ExecutionException e) {
            log.error("Error sending {} message to {}", kind, owner, e.getCause());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while sending {} message to {}", kind, owner);
            return false;
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
