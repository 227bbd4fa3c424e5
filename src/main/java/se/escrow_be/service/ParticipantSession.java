package se.escrow_be.service;

import org.springframework.web.socket.WebSocketSession;
import se.escrow_be.pojo.enums.Party;

/**
 * A connection bound to one user inside one room. Lives only as long as the socket, and
 * compares by identity: two connections of the same user are two participants.
 */
public final class ParticipantSession {

    private final WebSocketSession session;
    private final String roomPhrase;
    private final String userId;
    private final Party party;
    private final String username;
    private final SessionOutbox outbox = new SessionOutbox();

    public ParticipantSession(WebSocketSession session, String roomPhrase, String userId, Party party, String username) {
        this.session = session;
        this.roomPhrase = roomPhrase;
        this.userId = userId;
        this.party = party;
        this.username = username;
    }

    public WebSocketSession session() {
        return session;
    }

    public String roomPhrase() {
        return roomPhrase;
    }

    public String userId() {
        return userId;
    }

    public Party party() {
        return party;
    }

    public String username() {
        return username;
    }

    public String sessionId() {
        return session.getId();
    }

    SessionOutbox outbox() {
        return outbox;
    }

    @Override
    public String toString() {
        return "ParticipantSession[" + userId + " as " + party + " in '" + roomPhrase + "']";
    }
}
