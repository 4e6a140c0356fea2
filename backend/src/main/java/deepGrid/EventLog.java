package deepGrid;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only history of emitted protocol events with listener fan-out.
 */
public final class EventLog {
    private static final Logger LOG = LoggerFactory.getLogger(EventLog.class);

    private final List<LoggedEvent> history = new CopyOnWriteArrayList<>();
    private final List<Consumer<LoggedEvent>> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong(1L);

    public void onEvent(Consumer<LoggedEvent> listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    <T extends ProtocolEvent> T append(T event) {
        Objects.requireNonNull(event, "event");
        LoggedEvent logged = new LoggedEvent(sequence.getAndIncrement(), event);
        history.add(logged);
        for (Consumer<LoggedEvent> listener : listeners) {
            try {
                listener.accept(logged);
            } catch (Exception ex) {
                LOG.warn("Event listener failed for {} #{}", logged.type(), logged.sequence(), ex);
            }
        }
        return event;
    }

    public List<LoggedEvent> history() {
        return List.copyOf(history);
    }

    public List<LoggedEvent> since(long afterSequence) {
        List<LoggedEvent> newer = new ArrayList<>();
        for (LoggedEvent event : history) {
            if (event.sequence() > afterSequence) {
                newer.add(event);
            }
        }
        return newer;
    }

    public int size() {
        return history.size();
    }
}
