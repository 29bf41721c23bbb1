package io.github.drompincen.remindpal.runtime.assistant;

import io.github.drompincen.remindpal.persistence.store.ReminderStore;
import io.github.drompincen.remindpal.persistence.document.UserProfileDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounds the configured {@link AiFallback} with a timeout. Any failure, a
 * timeout or a blank answer falls back to the canned replies.
 */
@Service
public class AssistantService {

    private static final Logger log = LoggerFactory.getLogger(AssistantService.class);

    private final AiFallback answerer;
    private final CannedAiFallback canned = new CannedAiFallback();
    private final ReminderStore store;
    private final long timeoutMs;

    public AssistantService(AiFallback answerer, ReminderStore store,
                            @Value("${remindpal.assistant.timeout-ms:10000}") long timeoutMs) {
        this.answerer = answerer;
        this.store = store;
        this.timeoutMs = timeoutMs;
    }

    public String ask(String owner, String text) {
        int total = store.findProfile(owner).map(UserProfileDocument::getTotalReminders).orElse(0);
        AssistantContext context = new AssistantContext(owner, store.countActive(owner), total);

        CompletableFuture<String> future = CompletableFuture.supplyAsync(() -> answerer.answer(text, context));
        try {
            String answer = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (answer != null && !answer.isBlank()) {
                return answer.trim();
            }
            log.warn("Assistant returned an empty answer for {}", owner);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Assistant timed out after {}ms for {}", timeoutMs, owner);
        } catch (ExecutionException e) {
            log.error("Assistant failed for {}", owner, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted waiting for assistant answer for {}", owner);
        }
        return canned.answer(text, context);
    }
}
