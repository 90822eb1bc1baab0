package de.bsommerfeld.selfupdate.core.event;

import com.google.common.eventbus.DeadEvent;
import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.Subscribe;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide event bus for update notifications, transfer progress and
 * broadcasts. Delivery is synchronous on the posting thread.
 *
 * <p>
 * A subscriber that throws does not affect other subscribers or the poster;
 * the failure is logged. Events nobody listens to are logged at DEBUG.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);

    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus(ApplicationEventBus::logSubscriberFailure);
        eventBus.register(new DeadEventLogger());
    }

    public void post(Object event) {
        if (event instanceof HighFrequencyEvent) {
            LOG.trace("Posting event: {}", event);
        } else {
            LOG.debug("Posting event: {}", event);
        }
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getSimpleName());
        eventBus.register(listener);
    }

    /**
     * @throws IllegalArgumentException if the listener was never registered
     */
    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getSimpleName());
        eventBus.unregister(listener);
    }

    private static void logSubscriberFailure(Throwable exception, SubscriberExceptionContext context) {
        LOG.error("Subscriber {}.{} failed on {}",
                context.getSubscriber().getClass().getSimpleName(),
                context.getSubscriberMethod().getName(),
                context.getEvent(), exception);
    }

    private static final class DeadEventLogger {

        @Subscribe
        public void onDeadEvent(DeadEvent deadEvent) {
            LOG.debug("No subscriber for {}", deadEvent.getEvent());
        }
    }
}
