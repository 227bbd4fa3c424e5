package se.escrow_be.configuration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import se.escrow_be.exception.ErrorKind;
import se.escrow_be.exception.EscrowStateException;
import se.escrow_be.exception.InvalidTransitionException;
import se.escrow_be.exception.ResourceNotFoundException;
import se.escrow_be.exception.UnauthorizedPartyException;
import se.escrow_be.pojo.enums.IntentType;
import se.escrow_be.pojo.enums.Party;
import se.escrow_be.service.ParticipantSession;
import se.escrow_be.service.RoomBroadcaster;
import se.escrow_be.service.RoomIntentDispatcher;
import se.escrow_be.service.RoomSessionRegistry;

import java.net.URI;
import java.nio.ByteBuffer;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RoomWebSocketHandlerTest {

    private static final String PHRASE = "amber river quiet stone";

    @Mock
    private RoomIntentDispatcher dispatcher;

    @Mock
    private RoomBroadcaster broadcaster;

    private RoomSessionRegistry registry;
    private RoomWebSocketHandler handler;
    private WebSocketSession session;
    private Map<String, Object> attributes;

    @BeforeEach
    void setUp() {
        registry = new RoomSessionRegistry();
        handler = new RoomWebSocketHandler(dispatcher, registry, broadcaster, new JacksonConfig().objectMapper(),
                10_000, 512 * 1024);
        attributes = new HashMap<>();
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("session-1");
        when(session.isOpen()).thenReturn(true);
        when(session.getAttributes()).thenReturn(attributes);
    }

    @Test
    @DisplayName("Paths decode the room phrase and user id")
    void parsePath() {
        assertThat(RoomWebSocketHandler.parsePath(URI.create("/api/ws/amber%20river%20quiet%20stone/user-1")))
                .hasValueSatisfying(parts -> assertThat(parts).containsExactly(PHRASE, "user-1"));
    }

    @Test
    @DisplayName("Paths with missing or extra segments are malformed")
    void parsePathMalformed() {
        assertThat(RoomWebSocketHandler.parsePath(URI.create("/api/ws/room"))).isEmpty();
        assertThat(RoomWebSocketHandler.parsePath(URI.create("/api/ws/room/user/extra"))).isEmpty();
        assertThat(RoomWebSocketHandler.parsePath(URI.create("/ws/x/room/user"))).isEmpty();
        assertThat(RoomWebSocketHandler.parsePath(URI.create("/api/ws/%20/user"))).isEmpty();
        assertThat(RoomWebSocketHandler.parsePath(null)).isEmpty();
    }

    @Test
    @DisplayName("An accepted join binds the participant to the socket and announces it")
    void acceptedJoin() throws Exception {
        when(session.getUri()).thenReturn(URI.create("/api/ws/amber%20river%20quiet%20stone/buyer-1"));
        ParticipantSession participant = new ParticipantSession(session, PHRASE, "buyer-1", Party.BUYER, "bo");
        when(dispatcher.join(eq(PHRASE), eq("buyer-1"), any())).thenReturn(participant);

        handler.afterConnectionEstablished(session);

        assertThat(attributes).containsEntry(RoomWebSocketHandler.PARTICIPANT_ATTRIBUTE, participant);
        verify(broadcaster).broadcastNotice(PHRASE, "BUYER bo joined the room");
        verify(session, never()).close(any(CloseStatus.class));
    }

    @Test
    @DisplayName("A refused join closes with a policy violation")
    void refusedJoin() throws Exception {
        when(session.getUri()).thenReturn(URI.create("/api/ws/room/stranger"));
        when(dispatcher.join(eq("room"), eq("stranger"), any())).thenThrow(new UnauthorizedPartyException("Room 'room' already has a buyer"));

        handler.afterConnectionEstablished(session);

        assertThat(closeStatus().getCode()).isEqualTo(CloseStatus.POLICY_VIOLATION.getCode());
        assertThat(registry.sessionCount("room")).isZero();
    }

    @Test
    @DisplayName("Joining an unknown room closes with a policy violation")
    void unknownRoomJoin() throws Exception {
        when(session.getUri()).thenReturn(URI.create("/api/ws/nope/user-1"));
        when(dispatcher.join(eq("nope"), eq("user-1"), any())).thenThrow(new ResourceNotFoundException("Room not found: nope"));

        handler.afterConnectionEstablished(session);

        assertThat(closeStatus().getCode()).isEqualTo(CloseStatus.POLICY_VIOLATION.getCode());
    }

    @Test
    @DisplayName("A malformed path closes with a protocol error before any join")
    void malformedPathJoin() throws Exception {
        when(session.getUri()).thenReturn(URI.create("/api/ws/only-room"));

        handler.afterConnectionEstablished(session);

        assertThat(closeStatus().getCode()).isEqualTo(CloseStatus.PROTOCOL_ERROR.getCode());
        verify(dispatcher, never()).join(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("Malformed JSON closes the connection with a protocol error")
    void malformedJson() throws Exception {
        joined();

        handler.handleMessage(session, new TextMessage("{not json"));

        assertThat(closeStatus().getCode()).isEqualTo(CloseStatus.PROTOCOL_ERROR.getCode());
    }

    @Test
    @DisplayName("An envelope without a string type closes with a protocol error")
    void missingType() throws Exception {
        joined();

        handler.handleMessage(session, new TextMessage("{\"type\": 3}"));

        assertThat(closeStatus().getCode()).isEqualTo(CloseStatus.PROTOCOL_ERROR.getCode());
    }

    @Test
    @DisplayName("Binary frames close with a protocol error")
    void binaryFrame() throws Exception {
        joined();

        handler.handleMessage(session, new BinaryMessage(ByteBuffer.wrap(new byte[]{1})));

        assertThat(closeStatus().getCode()).isEqualTo(CloseStatus.PROTOCOL_ERROR.getCode());
    }

    @Test
    @DisplayName("Unknown types get a warning and keep the connection open")
    void unknownType() throws Exception {
        joined();

        handler.handleMessage(session, new TextMessage("{\"type\": \"dance\"}"));

        verify(broadcaster).sendWarning(session, "Unknown message type: dance");
        verify(session, never()).close(any(CloseStatus.class));
    }

    @Test
    @DisplayName("Ping is answered with pong without touching the room")
    void ping() throws Exception {
        joined();

        handler.handleMessage(session, new TextMessage("{\"type\": \"ping\"}"));

        verify(broadcaster).sendPong(session);
        verify(dispatcher, never()).dispatch(any(), any(), any());
    }

    @Test
    @DisplayName("A rejected intent is answered to the sender with its error kind")
    void rejectedIntent() throws Exception {
        ParticipantSession participant = joined();
        doThrow(new InvalidTransitionException("confirm_seller_ready is not allowed while the room is AWAITING_DESCRIPTION"))
                .when(dispatcher).dispatch(eq(participant), eq(IntentType.CONFIRM_SELLER_READY), any());

        handler.handleMessage(session, new TextMessage("{\"type\": \"confirm_seller_ready\"}"));

        verify(broadcaster).sendError(session,
                "confirm_seller_ready is not allowed while the room is AWAITING_DESCRIPTION", ErrorKind.INVALID_TRANSITION);
    }

    @Test
    @DisplayName("Internal faults are reported without their details")
    void internalFault() throws Exception {
        ParticipantSession participant = joined();
        doThrow(new EscrowStateException("contract mismatch"))
                .when(dispatcher).dispatch(eq(participant), eq(IntentType.BUYER_LOCK_FUNDS), any());

        handler.handleMessage(session, new TextMessage("{\"type\": \"buyer_lock_funds\"}"));

        verify(broadcaster).sendError(session, "Internal error", ErrorKind.INTERNAL);
    }

    @Test
    @DisplayName("Disconnecting unregisters the session and announces the departure")
    void disconnect() throws Exception {
        joined();

        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        assertThat(registry.sessionCount(PHRASE)).isZero();
        verify(broadcaster).broadcastNotice(PHRASE, "SELLER sam left the room");
    }

    private ParticipantSession joined() {
        ParticipantSession participant = new ParticipantSession(session, PHRASE, "seller-1", Party.SELLER, "sam");
        attributes.put(RoomWebSocketHandler.PARTICIPANT_ATTRIBUTE, participant);
        registry.register(participant);
        return participant;
    }

    private CloseStatus closeStatus() throws Exception {
        ArgumentCaptor<CloseStatus> captor = ArgumentCaptor.forClass(CloseStatus.class);
        verify(session).close(captor.capture());
        return captor.getValue();
    }
}
