package se.escrow_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import se.escrow_be.pojo.enums.MessageType;

import java.time.LocalDateTime;

@Entity
@Table(name = "room_messages")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RoomMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long messageId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "room_phrase", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Room room;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private MessageType type = MessageType.CHAT;

    @Column(length = 36)
    private String senderId;

    @Column(length = 50)
    private String senderUsername;

    @Column(nullable = false, columnDefinition = "text")
    private String content;

    @Column(nullable = false)
    private LocalDateTime sentAt;
}
