package io.crisislink.session;

import io.crisislink.model.ConnectionId;
import io.crisislink.model.SessionId;
import io.crisislink.model.VolunteerProfile;
import io.crisislink.model.VolunteerRequest;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Registered volunteers with their load, and the queue of sessions still waiting for
 * one. Emergency sessions are queued ahead of every non-emergency session.
 */
public final class VolunteerMatcher {
    private final int capacityPerVolunteer;
    private final Map<ConnectionId, Slot> volunteers = new LinkedHashMap<>();
    private final List<Waiting> queue = new ArrayList<>();

    public VolunteerMatcher(int capacityPerVolunteer) {
        this.capacityPerVolunteer = Math.max(1, capacityPerVolunteer);
    }

    public synchronized void register(ConnectionId volunteer, VolunteerProfile profile) {
        Slot existing = volunteers.get(volunteer);
        volunteers.put(volunteer, new Slot(volunteer, profile, existing == null ? 0 : existing.load));
    }

    public synchronized void unregister(ConnectionId volunteer) {
        volunteers.remove(volunteer);
    }

    public synchronized boolean isRegistered(ConnectionId volunteer) {
        return volunteers.containsKey(volunteer);
    }

    public synchronized Optional<ConnectionId> claim(VolunteerRequest request) {
        Optional<Slot> best = volunteers.values().stream()
                .filter(slot -> slot.load < capacityPerVolunteer)
                .filter(slot -> fits(slot.profile, request))
                .min(Comparator.comparingInt(slot -> slot.load));
        best.ifPresent(slot -> slot.load++);
        return best.map(slot -> slot.id);
    }

    public synchronized void claimSpecific(ConnectionId volunteer) {
        Slot slot = volunteers.get(volunteer);
        if (slot != null) {
            slot.load++;
        }
    }

    public synchronized void release(ConnectionId volunteer) {
        Slot slot = volunteers.get(volunteer);
        if (slot != null && slot.load > 0) {
            slot.load--;
        }
    }

    public synchronized int enqueue(SessionId sessionId, VolunteerRequest request, boolean emergency) {
        queue.removeIf(w -> w.sessionId.equals(sessionId));
        Waiting waiting = new Waiting(sessionId, request, emergency);
        if (emergency) {
            int index = 0;
            while (index < queue.size() && queue.get(index).emergency) {
                index++;
            }
            queue.add(index, waiting);
            return index + 1;
        }
        queue.add(waiting);
        return queue.size();
    }

    public synchronized boolean dequeue(SessionId sessionId) {
        return queue.removeIf(w -> w.sessionId.equals(sessionId));
    }

    /** Pairs waiting sessions with free volunteers in queue order. */
    public synchronized List<Assignment> assignWaiting() {
        List<Assignment> out = new ArrayList<>();
        var it = queue.iterator();
        while (it.hasNext()) {
            Waiting waiting = it.next();
            Optional<ConnectionId> volunteer = claim(waiting.request);
            if (volunteer.isPresent()) {
                out.add(new Assignment(waiting.sessionId, volunteer.get()));
                it.remove();
            }
        }
        return out;
    }

    public synchronized Map<SessionId, Integer> positions() {
        Map<SessionId, Integer> out = new LinkedHashMap<>();
        for (int i = 0; i < queue.size(); i++) {
            out.put(queue.get(i).sessionId, i + 1);
        }
        return out;
    }

    public synchronized int waitingCount() {
        return queue.size();
    }

    public synchronized int availableVolunteers() {
        return (int) volunteers.values().stream().filter(slot -> slot.load < capacityPerVolunteer).count();
    }

    private static boolean fits(VolunteerProfile profile, VolunteerRequest request) {
        if (request == null) {
            return true;
        }
        if (request.language() != null && !request.language().isBlank()) {
            String wanted = request.language().trim().toLowerCase(Locale.ROOT);
            boolean speaks = profile.languages().stream().anyMatch(l -> l.equalsIgnoreCase(wanted));
            if (!speaks) {
                return false;
            }
        }
        if (request.specialization() != null && !request.specialization().isBlank()) {
            String wanted = request.specialization().trim();
            return profile.specializations().stream().anyMatch(s -> s.equalsIgnoreCase(wanted));
        }
        return true;
    }

    public record Assignment(SessionId sessionId, ConnectionId volunteer) {
    }

    private static final class Slot {
        private final ConnectionId id;
        private final VolunteerProfile profile;
        private int load;

        private Slot(ConnectionId id, VolunteerProfile profile, int load) {
            this.id = id;
            this.profile = profile;
            this.load = load;
        }
    }

    private record Waiting(SessionId sessionId, VolunteerRequest request, boolean emergency) {
    }
}
