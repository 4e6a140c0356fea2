package deepGrid;

import com.google.gson.Gson;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import org.eclipse.jetty.websocket.api.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pushes every protocol event to connected WebSocket clients.
 */
public final class EventFeedService {
    private static final Logger LOG = LoggerFactory.getLogger(EventFeedService.class);

    private final Set<Session> sessions = new CopyOnWriteArraySet<>();
    private final Gson gson = new Gson();

    public void register(Session session) {
        sessions.add(session);
    }

    public void unregister(Session session) {
        sessions.remove(session);
    }

    public int sessionCount() {
        return sessions.size();
    }

    /**
     * Replays the event history to a client that just connected.
     */
    public void sendHistory(Session session, List<LoggedEvent> history) {
        Objects.requireNonNull(session, "session");
        Map<String, Object> payload = Map.of(
                "type", "HISTORY",
                "events", history.stream().map(EventFeedService::toPayload).toList());
        try {
            session.getRemote().sendString(gson.toJson(payload));
        } catch (Exception ex) {
            LOG.warn("Failed to send event history", ex);
        }
    }

    public void broadcast(LoggedEvent event) {
        if (sessions.isEmpty()) {
            return;
        }
        String json = toJson(event);
        for (Session session : sessions) {
            try {
                session.getRemote().sendString(json);
            } catch (Exception ex) {
                LOG.warn("Failed to broadcast {} #{}", event.type(), event.sequence(), ex);
            }
        }
    }

    String toJson(LoggedEvent event) {
        return gson.toJson(toPayload(event));
    }

    static Map<String, Object> toPayload(LoggedEvent event) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("type", event.type());
        payload.put("sequence", event.sequence());
        payload.put("data", event.event());
        return payload;
    }
}
