package se.escrow_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.escrow_be.configuration.properties.InactivityProperties;
import se.escrow_be.dto.request.RoomCreateRequest;
import se.escrow_be.dto.response.ChatMessageResponse;
import se.escrow_be.dto.response.RoomResponse;
import se.escrow_be.dto.response.RoomSummaryResponse;
import se.escrow_be.dto.response.SignatureAuditResponse;
import se.escrow_be.exception.*;
import se.escrow_be.mapper.RoomMapper;
import se.escrow_be.pojo.EscrowContract;
import se.escrow_be.pojo.Room;
import se.escrow_be.pojo.RoomMessage;
import se.escrow_be.pojo.UserAccount;
import se.escrow_be.pojo.enums.*;
import se.escrow_be.repository.RoomRepository;
import se.escrow_be.util.RoomPhraseGenerator;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The room lifecycle. Every mutating method expects the caller to hold the room's lock and
 * commits its whole effect (status, funds, signatures) in one transaction.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class RoomService {

    private static final int MAX_PHRASE_ATTEMPTS = 20;
    private static final int MAX_DESCRIPTION_LENGTH = 5_000;
    private static final int MAX_CHAT_LENGTH = 2_000;

    private final RoomRepository roomRepository;
    private final UserService userService;
    private final ContractAuthorizationService contractAuthorizationService;
    private final RoomTransitions roomTransitions;
    private final InactivityProperties inactivityProperties;
    private final RoomPhraseGenerator roomPhraseGenerator;
    private final RoomMapper roomMapper;

    @Transactional
    public RoomResponse createRoom(RoomCreateRequest request) {
        UserAccount seller = userService.getUser(request.getSellerId());
        if (seller.getRole() != UserRole.SELLER) {
            throw new UnauthorizedPartyException("Only a registered seller can open a room");
        }

        Room room = Room.builder()
                .roomPhrase(uniquePhrase())
                .sellerId(seller.getUserId())
                .amount(request.getAmount())
                .status(RoomStatus.WAITING_FOR_BUYER)
                .createdAt(roomTransitions.now())
                .build();
        roomTransitions.touch(room);
        roomTransitions.verifyInvariants(room);
        room = roomRepository.save(room);

        log.info("Seller {} created room '{}' for {}", seller.getUserId(), room.getRoomPhrase(), room.getAmount());
        return roomMapper.convertToResponse(room);
    }

    public List<RoomSummaryResponse> listRooms(RoomStatus status) {
        RoomStatus filter = status != null ? status : RoomStatus.WAITING_FOR_BUYER;
        return roomMapper.convertToSummaries(roomRepository.findByStatusOrderByCreatedAtDesc(filter));
    }

    public RoomResponse getRoom(String roomPhrase) {
        return roomMapper.convertToResponse(findRoom(roomPhrase));
    }

    public Map<Party, SignatureAuditResponse> auditContract(String roomPhrase) {
        Room room = findRoom(roomPhrase);
        if (room.getContract() == null) {
            throw new ResourceNotFoundException("Room '" + roomPhrase + "' has no contract yet");
        }
        return contractAuthorizationService.audit(room.getContract());
    }

    /**
     * Admits the seller, the already assigned buyer, or a first joiner into an empty buyer slot.
     */
    @Transactional
    public JoinResult join(String roomPhrase, String userId) {
        Room room = findRoom(roomPhrase);
        UserAccount user = userService.getUser(userId);

        if (userId.equals(room.getSellerId())) {
            return new JoinResult(Party.SELLER, user.getUsername(), roomMapper.convertToResponse(room), false);
        }
        if (userId.equals(room.getBuyerId())) {
            return new JoinResult(Party.BUYER, user.getUsername(), roomMapper.convertToResponse(room), false);
        }
        if (room.getBuyerId() != null || room.getStatus() != RoomStatus.WAITING_FOR_BUYER) {
            throw new UnauthorizedPartyException("Room '" + roomPhrase + "' already has a buyer");
        }
        if (user.getRole() != UserRole.BUYER) {
            throw new UnauthorizedPartyException("Only a registered buyer can take the buyer slot");
        }

        room.setBuyerId(userId);
        room.setBuyerJoinedAt(roomTransitions.now());
        roomTransitions.advance(room, RoomStatus.AWAITING_DESCRIPTION);
        room = persist(room);

        log.info("User {} joined room '{}' as buyer", userId, roomPhrase);
        return new JoinResult(Party.BUYER, user.getUsername(), roomMapper.convertToResponse(room), true);
    }

    @Transactional
    public RoomResponse proposeDescription(String roomPhrase, String userId, String description) {
        Room room = findRoom(roomPhrase);
        Party party = partyOf(room, userId);
        requireStatus(room, IntentType.PROPOSE_DESCRIPTION, RoomStatus.AWAITING_DESCRIPTION);
        requireParty(party, Party.BUYER, IntentType.PROPOSE_DESCRIPTION);

        applyProposal(room, party, description);
        log.info("Buyer proposed a description in room '{}'", roomPhrase);
        return roomMapper.convertToResponse(persist(room));
    }

    @Transactional
    public RoomResponse editDescription(String roomPhrase, String userId, String description) {
        Room room = findRoom(roomPhrase);
        Party party = partyOf(room, userId);
        requireNegotiationTurn(room, party, IntentType.EDIT_DESCRIPTION);

        applyProposal(room, party, description);
        log.info("{} countered the description in room '{}' (round {})", party, roomPhrase, room.getNegotiation().getRounds());
        return roomMapper.convertToResponse(persist(room));
    }

    @Transactional
    public RoomResponse approveDescription(String roomPhrase, String userId) {
        Room room = findRoom(roomPhrase);
        Party party = partyOf(room, userId);
        requireNegotiationTurn(room, party, IntentType.APPROVE_DESCRIPTION);

        room.getNegotiation().close();
        roomTransitions.advance(room, RoomStatus.AWAITING_SELLER_READY);
        log.info("{} approved the description in room '{}'", party, roomPhrase);
        return roomMapper.convertToResponse(persist(room));
    }

    @Transactional
    public RoomResponse confirmSellerReady(String roomPhrase, String userId) {
        Room room = findRoom(roomPhrase);
        Party party = partyOf(room, userId);
        requireStatus(room, IntentType.CONFIRM_SELLER_READY, RoomStatus.AWAITING_SELLER_READY);
        requireParty(party, Party.SELLER, IntentType.CONFIRM_SELLER_READY);

        roomTransitions.advance(room, RoomStatus.AWAITING_PAYMENT);
        log.info("Seller confirmed readiness in room '{}'", roomPhrase);
        return roomMapper.convertToResponse(persist(room));
    }

    @Transactional
    public RoomResponse lockFunds(String roomPhrase, String userId) {
        Room room = findRoom(roomPhrase);
        Party party = partyOf(room, userId);
        requireStatus(room, IntentType.BUYER_LOCK_FUNDS, RoomStatus.AWAITING_PAYMENT);
        requireParty(party, Party.BUYER, IntentType.BUYER_LOCK_FUNDS);

        contractAuthorizationService.openContract(room);
        room.setFundsLockedAt(roomTransitions.now());
        roomTransitions.advance(room, RoomStatus.MONEY_SECURED);
        log.info("Buyer locked {} in room '{}'", room.getAmount(), roomPhrase);
        return roomMapper.convertToResponse(persist(room));
    }

    /**
     * Seller marks delivery. The accompanying signature is the seller's release vote.
     */
    @Transactional(noRollbackFor = SignatureInvalidException.class)
    public RoomResponse markDelivered(String roomPhrase, String userId, String signedMessage) {
        Room room = findRoom(roomPhrase);
        Party party = partyOf(room, userId);
        requireStatus(room, IntentType.PRODUCT_DELIVERED, RoomStatus.MONEY_SECURED);
        requireParty(party, Party.SELLER, IntentType.PRODUCT_DELIVERED);

        Optional<Decision> binding = contractAuthorizationService.submitSignature(
                requireContract(room), Party.SELLER, Decision.RELEASE_TO_SELLER, signedMessage);
        if (binding.isPresent()) {
            throw new EscrowStateException("Contract of room '" + roomPhrase + "' settled before delivery");
        }

        room.setDeliveredAt(roomTransitions.now());
        roomTransitions.advance(room, RoomStatus.PRODUCT_DELIVERED);
        log.info("Seller marked delivery in room '{}'", roomPhrase);
        return roomMapper.convertToResponse(persist(room));
    }

    /**
     * Buyer confirms receipt with a release vote; together with the seller's delivery vote it
     * reaches the threshold.
     */
    @Transactional(noRollbackFor = SignatureInvalidException.class)
    public RoomResponse confirmReceipt(String roomPhrase, String userId, String signedMessage) {
        Room room = findRoom(roomPhrase);
        Party party = partyOf(room, userId);
        requireStatus(room, IntentType.TRANSACTION_SUCCESSFULL, RoomStatus.PRODUCT_DELIVERED);
        requireParty(party, Party.BUYER, IntentType.TRANSACTION_SUCCESSFULL);

        Optional<Decision> binding = contractAuthorizationService.submitSignature(
                requireContract(room), Party.BUYER, Decision.RELEASE_TO_SELLER, signedMessage);
        // Delivery is only accepted with a verified seller release vote
        Decision decision = binding.orElseThrow(() -> new EscrowStateException(
                "Room '" + roomPhrase + "' reached PRODUCT_DELIVERED without a verified seller release vote"));
        roomTransitions.complete(room);
        log.info("Room '{}' completed: {}", roomPhrase, decision);
        return roomMapper.convertToResponse(persist(room));
    }

    /**
     * Either party may cast or change a vote while a dispute is open. This is how a human party
     * matches the oracle's decision.
     */
    @Transactional(noRollbackFor = SignatureInvalidException.class)
    public RoomResponse submitSignature(String roomPhrase, String userId, Decision decision, String signedMessage) {
        Room room = findRoom(roomPhrase);
        Party party = partyOf(room, userId);
        requireStatus(room, IntentType.SUBMIT_SIGNATURE, RoomStatus.DISPUTE);
        if (decision == null) {
            throw new BusinessLogicException("A decision is required");
        }

        Optional<Decision> binding = contractAuthorizationService.submitSignature(
                requireContract(room), party, decision, signedMessage);
        if (binding.isPresent()) {
            roomTransitions.complete(room);
            log.info("Dispute in room '{}' settled by signatures: {}", roomPhrase, binding.get());
        } else {
            roomTransitions.touch(room);
            log.info("{} signed {} in disputed room '{}'", party, decision, roomPhrase);
        }
        return roomMapper.convertToResponse(persist(room));
    }

    /**
     * Appends a chat line. Chat does not advance the room and does not restart the inactivity window.
     */
    @Transactional
    public ChatMessageResponse appendChat(String roomPhrase, String userId, String message) {
        Room room = findRoom(roomPhrase);
        partyOf(room, userId);
        if (message == null || message.isBlank()) {
            throw new BusinessLogicException("Chat message must not be empty");
        }
        if (message.length() > MAX_CHAT_LENGTH) {
            throw new BusinessLogicException("Chat message exceeds " + MAX_CHAT_LENGTH + " characters");
        }
        UserAccount sender = userService.getUser(userId);

        RoomMessage chat = RoomMessage.builder()
                .type(MessageType.CHAT)
                .senderId(userId)
                .senderUsername(sender.getUsername())
                .content(message)
                .sentAt(roomTransitions.now())
                .build();
        room.appendMessage(chat);
        roomRepository.save(room);
        return roomMapper.convertMessage(chat);
    }

    /**
     * Applies the default resolution if the room's inactivity deadline has passed. The deadline
     * is re-read under the caller's lock, so a transition committed just before this call wins.
     *
     * @return the new snapshot, or empty when nothing was due
     */
    @Transactional
    public Optional<RoomResponse> resolveInactive(String roomPhrase, LocalDateTime now) {
        Room room = roomRepository.findById(roomPhrase).orElse(null);
        if (room == null || room.getStatus().isTerminal()
                || room.getInactivityDeadline() == null || room.getInactivityDeadline().isAfter(now)) {
            return Optional.empty();
        }

        RoomStatus expiredIn = room.getStatus();
        if (room.getContract() == null) {
            roomTransitions.cancel(room);
            roomTransitions.appendSystemMessage(room, "Room cancelled after inactivity in " + expiredIn);
            log.info("Room '{}' cancelled after inactivity in {}", roomPhrase, expiredIn);
        } else {
            Decision decision = inactivityProperties.decisionFor(expiredIn);
            contractAuthorizationService.resolveByDefault(room.getContract(), decision, ResolutionSource.INACTIVITY_TIMEOUT);
            roomTransitions.complete(room);
            roomTransitions.appendSystemMessage(room, "Inactivity timeout in " + expiredIn + ": " + decision);
            log.info("Room '{}' resolved by inactivity timeout in {}: {}", roomPhrase, expiredIn, decision);
        }
        return Optional.of(roomMapper.convertToResponse(persist(room)));
    }

    private Room findRoom(String roomPhrase) {
        return roomRepository.findById(roomPhrase)
                .orElseThrow(() -> new ResourceNotFoundException("Room not found: " + roomPhrase));
    }

    private Room persist(Room room) {
        roomTransitions.verifyInvariants(room);
        return roomRepository.save(room);
    }

    static Party partyOf(Room room, String userId) {
        if (userId != null && userId.equals(room.getSellerId())) {
            return Party.SELLER;
        }
        if (userId != null && userId.equals(room.getBuyerId())) {
            return Party.BUYER;
        }
        throw new UnauthorizedPartyException("User " + userId + " is not a participant of room '" + room.getRoomPhrase() + "'");
    }

    static void requireStatus(Room room, IntentType intent, RoomStatus expected) {
        if (room.getStatus() != expected) {
            throw new InvalidTransitionException(String.format(
                    "%s is not allowed while the room is %s", intent.getWireName(), room.getStatus()));
        }
    }

    static void requireParty(Party actual, Party expected, IntentType intent) {
        if (actual != expected) {
            throw new UnauthorizedPartyException(String.format(
                    "Only the %s may send %s", expected.name().toLowerCase(), intent.getWireName()));
        }
    }

    static EscrowContract requireContract(Room room) {
        if (room.getContract() == null) {
            throw new EscrowStateException("Room '" + room.getRoomPhrase() + "' in " + room.getStatus() + " has no contract");
        }
        return room.getContract();
    }

    private void requireNegotiationTurn(Room room, Party party, IntentType intent) {
        if (!room.getStatus().isNegotiation()) {
            throw new InvalidTransitionException(String.format(
                    "%s is not allowed while the room is %s", intent.getWireName(), room.getStatus()));
        }
        if (!room.getNegotiation().isTurnOf(party)) {
            throw new UnauthorizedPartyException("It is not the " + party.name().toLowerCase() + "'s turn to respond");
        }
    }

    private void applyProposal(Room room, Party author, String description) {
        if (description == null || description.isBlank()) {
            throw new BusinessLogicException("Description must not be empty");
        }
        if (description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new BusinessLogicException("Description exceeds " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        room.setDescription(description.trim());
        room.getNegotiation().recordProposal(author);
        roomTransitions.advance(room, room.getNegotiation().awaitingStatus());
    }

    private String uniquePhrase() {
        for (int attempt = 0; attempt < MAX_PHRASE_ATTEMPTS; attempt++) {
            String phrase = roomPhraseGenerator.nextPhrase();
            if (!roomRepository.existsById(phrase)) {
                return phrase;
            }
        }
        throw new EscrowStateException("Unable to generate a unique room phrase");
    }
}
